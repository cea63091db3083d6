package com.tyron.treedit.api.editor;

import com.tyron.treedit.api.syntax.TextRange;

/**
 * Represents a single text change in a {@link Document}.
 * <p>
 * {@link #getOldRange()} is expressed in offsets of the text before the change.
 */
public final class DocumentEvent {

    private final Document document;
    private final TextRange oldRange;
    private final String newText;

    public DocumentEvent(Document document, TextRange oldRange, String newText) {
        this.document = document;
        this.oldRange = oldRange;
        this.newText = newText;
    }

    public Document getDocument() {
        return document;
    }

    public TextRange getOldRange() {
        return oldRange;
    }

    public String getNewText() {
        return newText;
    }

    /**
     * @return range covered by {@link #getNewText()} after the change
     */
    public TextRange getNewRange() {
        return TextRange.offsetLength(oldRange.startOffset(), newText.length());
    }
}
