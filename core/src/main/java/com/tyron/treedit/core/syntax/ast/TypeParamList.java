package com.tyron.treedit.core.syntax.ast;

import com.tyron.treedit.api.syntax.SyntaxKind;
import com.tyron.treedit.core.syntax.SyntaxNode;

import java.util.List;

public final class TypeParamList extends AstNode {

    private TypeParamList(SyntaxNode syntax) {
        super(syntax);
    }

    public static TypeParamList cast(SyntaxNode syntax) {
        if (syntax.getKind() != SyntaxKind.TYPE_PARAM_LIST
                || !Grammar.isDelimited(syntax, SyntaxKind.L_ANGLE, SyntaxKind.R_ANGLE)) {
            return null;
        }
        return new TypeParamList(syntax);
    }

    public List<TypeParam> typeParams() {
        return children(TypeParam::cast);
    }
}
