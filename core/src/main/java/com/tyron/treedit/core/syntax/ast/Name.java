package com.tyron.treedit.core.syntax.ast;

import com.tyron.treedit.api.syntax.SyntaxKind;
import com.tyron.treedit.core.syntax.SyntaxNode;

public final class Name extends AstNode {

    private Name(SyntaxNode syntax) {
        super(syntax);
    }

    public static Name cast(SyntaxNode syntax) {
        if (syntax.getKind() != SyntaxKind.NAME || !Grammar.hasChild(syntax, SyntaxKind.IDENT)) {
            return null;
        }
        return new Name(syntax);
    }

    public String getIdentifier() {
        return token(SyntaxKind.IDENT).getText();
    }
}
