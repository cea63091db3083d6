package com.tyron.treedit.core.syntax;

/**
 * Base class for rejected structural edits. The tree being edited is left untouched.
 */
public class TreeEditException extends RuntimeException {

    public TreeEditException(String message) {
        super(message);
    }
}
