package com.tyron.treedit.api.text;

import com.tyron.treedit.api.syntax.TextRange;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Collects replacements and produces a {@link TextEdit}.
 * <p>
 * Replacements may be added in any order; {@link #finish()} sorts them and rejects overlaps.
 */
public final class TextEditBuilder {

    private final List<AtomTextEdit> atoms = new ArrayList<>();

    public TextEditBuilder replace(@NotNull TextRange range, @NotNull String replaceWith) {
        atoms.add(AtomTextEdit.replace(range, replaceWith));
        return this;
    }

    public TextEditBuilder delete(@NotNull TextRange range) {
        atoms.add(AtomTextEdit.delete(range));
        return this;
    }

    public TextEditBuilder insert(int offset, @NotNull String text) {
        atoms.add(AtomTextEdit.insert(offset, text));
        return this;
    }

    public TextEditBuilder add(@NotNull AtomTextEdit atom) {
        atoms.add(Objects.requireNonNull(atom, "atom"));
        return this;
    }

    public boolean isEmpty() {
        return atoms.isEmpty();
    }

    /**
     * @throws IllegalStateException if two collected replacements overlap
     */
    @NotNull
    public TextEdit finish() {
        if (atoms.isEmpty()) {
            return TextEdit.empty();
        }
        List<AtomTextEdit> sorted = new ArrayList<>(atoms);
        sorted.sort(Comparator.comparing(AtomTextEdit::delete));
        for (int i = 1; i < sorted.size(); i++) {
            TextRange prev = sorted.get(i - 1).delete();
            TextRange next = sorted.get(i).delete();
            if (prev.endOffset() > next.startOffset()) {
                throw new IllegalStateException("overlapping edits " + prev + " and " + next);
            }
        }
        return new TextEdit(sorted);
    }
}
