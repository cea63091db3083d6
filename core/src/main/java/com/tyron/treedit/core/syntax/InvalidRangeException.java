package com.tyron.treedit.core.syntax;

/**
 * Thrown when the boundaries of a replaced range are not children of the edited node or are out of order.
 */
public class InvalidRangeException extends TreeEditException {

    public InvalidRangeException(String message) {
        super(message);
    }
}
