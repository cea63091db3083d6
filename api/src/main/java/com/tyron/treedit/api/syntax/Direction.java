package com.tyron.treedit.api.syntax;

/**
 * Direction of sibling traversal.
 */
public enum Direction {
    NEXT,
    PREV
}
