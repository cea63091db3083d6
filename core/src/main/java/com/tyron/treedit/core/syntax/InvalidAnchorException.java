package com.tyron.treedit.core.syntax;

/**
 * Thrown when an insertion anchor is not a direct child of the node being edited, for example because it was
 * taken from an older version of the tree.
 */
public class InvalidAnchorException extends TreeEditException {

    public InvalidAnchorException(SyntaxElement anchor, SyntaxNode parent) {
        super("anchor " + anchor + " is not a child of " + parent);
    }
}
