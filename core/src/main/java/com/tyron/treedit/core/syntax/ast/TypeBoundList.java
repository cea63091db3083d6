package com.tyron.treedit.core.syntax.ast;

import com.tyron.treedit.api.syntax.SyntaxKind;
import com.tyron.treedit.core.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

public final class TypeBoundList extends AstNode {

    private TypeBoundList(SyntaxNode syntax) {
        super(syntax);
    }

    public static TypeBoundList cast(SyntaxNode syntax) {
        return syntax.getKind() == SyntaxKind.TYPE_BOUND_LIST ? new TypeBoundList(syntax) : null;
    }

    public List<SyntaxNode> bounds() {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxNode child : syntax().children()) {
            if (child.getKind() == SyntaxKind.TYPE_BOUND) {
                result.add(child);
            }
        }
        return result;
    }
}
