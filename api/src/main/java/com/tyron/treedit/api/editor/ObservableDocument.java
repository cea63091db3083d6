package com.tyron.treedit.api.editor;

/**
 * {@link Document} that publishes change events, one per applied replacement.
 */
public interface ObservableDocument extends Document {

    void addDocumentListener(DocumentListener listener);

    void removeDocumentListener(DocumentListener listener);

    /**
     * Monotonically increasing stamp; increments on every change.
     */
    long getModificationStamp();
}
