package com.tyron.treedit.api.text;

import com.tyron.treedit.api.editor.Document;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An ordered set of non-overlapping {@link AtomTextEdit}s against one text snapshot.
 * <p>
 * Atoms are sorted by start offset and pairwise disjoint; all ranges refer to the text before any of them
 * is applied. Instances are created through {@link TextEditBuilder}.
 */
public final class TextEdit {

    private static final TextEdit EMPTY = new TextEdit(List.of());

    private final List<AtomTextEdit> atoms;

    TextEdit(List<AtomTextEdit> atoms) {
        this.atoms = Collections.unmodifiableList(new ArrayList<>(atoms));
    }

    public static TextEdit empty() {
        return EMPTY;
    }

    @NotNull
    public List<AtomTextEdit> getAtoms() {
        return atoms;
    }

    public boolean isEmpty() {
        return atoms.isEmpty();
    }

    /**
     * Applies the edit to the given text.
     *
     * @throws IndexOutOfBoundsException if an atom reaches past the end of {@code text}
     */
    @NotNull
    public String apply(@NotNull String text) {
        Objects.requireNonNull(text, "text");

        int resultLength = text.length();
        for (AtomTextEdit atom : atoms) {
            resultLength += atom.getLengthDelta();
        }

        StringBuilder out = new StringBuilder(Math.max(0, resultLength));
        int pos = 0;
        for (AtomTextEdit atom : atoms) {
            int start = atom.delete().startOffset();
            int end = atom.delete().endOffset();
            if (end > text.length()) {
                throw new IndexOutOfBoundsException("edit " + atom.delete() + " is out of bounds for length=" + text.length());
            }
            out.append(text, pos, start);
            out.append(atom.insert());
            pos = end;
        }
        out.append(text, pos, text.length());
        return out.toString();
    }

    /**
     * Applies the edit to a live document. Atoms are replayed back to front so that the offsets of the
     * remaining atoms stay valid.
     */
    public void applyTo(@NotNull Document document) {
        Objects.requireNonNull(document, "document");
        for (int i = atoms.size() - 1; i >= 0; i--) {
            AtomTextEdit atom = atoms.get(i);
            document.replace(atom.delete().startOffset(), atom.delete().endOffset(), atom.insert());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TextEdit other)) return false;
        return atoms.equals(other.atoms);
    }

    @Override
    public int hashCode() {
        return atoms.hashCode();
    }

    @Override
    public String toString() {
        return "TextEdit" + atoms;
    }
}
