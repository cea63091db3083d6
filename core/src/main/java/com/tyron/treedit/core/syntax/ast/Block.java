package com.tyron.treedit.core.syntax.ast;

import com.tyron.treedit.api.syntax.SyntaxKind;
import com.tyron.treedit.core.syntax.SyntaxNode;
import com.tyron.treedit.core.syntax.SyntaxToken;

public final class Block extends AstNode {

    private Block(SyntaxNode syntax) {
        super(syntax);
    }

    public static Block cast(SyntaxNode syntax) {
        if (syntax.getKind() != SyntaxKind.BLOCK || !Grammar.isDelimited(syntax, SyntaxKind.L_CURLY, SyntaxKind.R_CURLY)
                || !Grammar.hasChild(syntax, SyntaxKind.L_CURLY)) {
            return null;
        }
        return new Block(syntax);
    }

    public SyntaxToken lCurly() {
        return token(SyntaxKind.L_CURLY);
    }
}
