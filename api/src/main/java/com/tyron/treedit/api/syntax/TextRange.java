package com.tyron.treedit.api.syntax;

/**
 * A half-open range {@code [startOffset, endOffset)} of text offsets.
 */
public record TextRange(int startOffset, int endOffset) implements Comparable<TextRange> {

    public TextRange {
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException("invalid range [" + startOffset + ", " + endOffset + ")");
        }
    }

    public static TextRange of(int startOffset, int endOffset) {
        return new TextRange(startOffset, endOffset);
    }

    public static TextRange offsetLength(int offset, int length) {
        return new TextRange(offset, offset + length);
    }

    public static TextRange empty(int offset) {
        return new TextRange(offset, offset);
    }

    public int getLength() {
        return endOffset - startOffset;
    }

    public boolean isEmpty() {
        return startOffset == endOffset;
    }

    public boolean contains(TextRange other) {
        return startOffset <= other.startOffset && other.endOffset <= endOffset;
    }

    /**
     * Two ranges intersect if they share at least one offset, or if one of them is empty and sits strictly
     * inside the other one.
     */
    public boolean intersects(TextRange other) {
        if (isEmpty() || other.isEmpty()) {
            return startOffset < other.endOffset && other.startOffset < endOffset;
        }
        return Math.max(startOffset, other.startOffset) < Math.min(endOffset, other.endOffset);
    }

    public TextRange shiftRight(int delta) {
        return new TextRange(startOffset + delta, endOffset + delta);
    }

    @Override
    public int compareTo(TextRange o) {
        int c = Integer.compare(startOffset, o.startOffset);
        return c != 0 ? c : Integer.compare(endOffset, o.endOffset);
    }

    @Override
    public String toString() {
        return "[" + startOffset + ", " + endOffset + ")";
    }
}
