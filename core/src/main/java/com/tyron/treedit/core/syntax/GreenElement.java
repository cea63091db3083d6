package com.tyron.treedit.core.syntax;

import com.tyron.treedit.api.syntax.SyntaxKind;

/**
 * Immutable, position independent tree element.
 * <p>
 * Green elements carry no parent pointer or offset, so a single instance can be shared by any number of
 * trees. Two green elements are "the same" only if they are the same Java object.
 */
public sealed interface GreenElement permits GreenNode, GreenToken {

    SyntaxKind getKind();

    int getTextLength();

    void appendText(StringBuilder out);

    default String getText() {
        StringBuilder sb = new StringBuilder(getTextLength());
        appendText(sb);
        return sb.toString();
    }
}
