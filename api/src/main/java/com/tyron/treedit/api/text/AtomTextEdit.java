package com.tyron.treedit.api.text;

import com.tyron.treedit.api.syntax.TextRange;

import java.util.Objects;

/**
 * A single replacement: delete {@link #delete()} and put {@link #insert()} in its place.
 */
public record AtomTextEdit(TextRange delete, String insert) {

    public AtomTextEdit {
        Objects.requireNonNull(delete, "delete");
        Objects.requireNonNull(insert, "insert");
    }

    public static AtomTextEdit replace(TextRange range, String text) {
        return new AtomTextEdit(range, text);
    }

    public static AtomTextEdit delete(TextRange range) {
        return new AtomTextEdit(range, "");
    }

    public static AtomTextEdit insert(int offset, String text) {
        return new AtomTextEdit(TextRange.empty(offset), text);
    }

    /**
     * @return change of the text length caused by this edit
     */
    public int getLengthDelta() {
        return insert.length() - delete.getLength();
    }
}
