package com.tyron.treedit.core.syntax.ast;

import com.tyron.treedit.api.syntax.SyntaxKind;
import com.tyron.treedit.core.syntax.SyntaxNode;
import org.jetbrains.annotations.Nullable;

public final class ImplBlock extends AstNode {

    private ImplBlock(SyntaxNode syntax) {
        super(syntax);
    }

    public static ImplBlock cast(SyntaxNode syntax) {
        if (syntax.getKind() != SyntaxKind.IMPL_BLOCK || !Grammar.hasChild(syntax, SyntaxKind.IMPL_KW)) {
            return null;
        }
        return new ImplBlock(syntax);
    }

    @Nullable
    public TypeParamList typeParamList() {
        return child(TypeParamList::cast);
    }

    @Nullable
    public ItemList itemList() {
        return child(ItemList::cast);
    }
}
