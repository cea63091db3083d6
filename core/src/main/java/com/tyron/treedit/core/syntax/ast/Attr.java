package com.tyron.treedit.core.syntax.ast;

import com.tyron.treedit.api.syntax.SyntaxKind;
import com.tyron.treedit.core.syntax.SyntaxNode;

/**
 * An outer attribute such as {@code #[derive(Debug)]}.
 */
public final class Attr extends AstNode {

    private Attr(SyntaxNode syntax) {
        super(syntax);
    }

    public static Attr cast(SyntaxNode syntax) {
        if (syntax.getKind() != SyntaxKind.ATTR || !Grammar.hasChild(syntax, SyntaxKind.POUND)) {
            return null;
        }
        return new Attr(syntax);
    }
}
