package com.tyron.treedit.core.syntax;

/**
 * Thrown when an edit produced a node that no longer belongs to the expected syntax category.
 * This is a bug in the calling code, not a recoverable condition.
 */
public class InvalidStructureException extends IllegalStateException {

    public InvalidStructureException(String message) {
        super(message);
    }
}
