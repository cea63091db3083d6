package com.tyron.treedit.core.syntax.ast;

import com.tyron.treedit.api.syntax.SyntaxKind;
import com.tyron.treedit.core.syntax.SyntaxNode;
import com.tyron.treedit.core.syntax.SyntaxToken;
import org.jetbrains.annotations.Nullable;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * The braced body of an impl block.
 */
public final class ItemList extends AstNode {

    private static final Set<SyntaxKind> ALLOWED = EnumSet.of(
            SyntaxKind.L_CURLY, SyntaxKind.R_CURLY, SyntaxKind.FN_DEF, SyntaxKind.CONST_DEF,
            SyntaxKind.TYPE_ALIAS_DEF, SyntaxKind.WHITESPACE, SyntaxKind.COMMENT, SyntaxKind.ERROR);

    private ItemList(SyntaxNode syntax) {
        super(syntax);
    }

    public static ItemList cast(SyntaxNode syntax) {
        if (syntax.getKind() != SyntaxKind.ITEM_LIST
                || !Grammar.childKindsWithin(syntax, ALLOWED)
                || !Grammar.isDelimited(syntax, SyntaxKind.L_CURLY, SyntaxKind.R_CURLY)) {
            return null;
        }
        return new ItemList(syntax);
    }

    @Nullable
    public SyntaxToken lCurly() {
        return token(SyntaxKind.L_CURLY);
    }

    @Nullable
    public SyntaxToken rCurly() {
        return token(SyntaxKind.R_CURLY);
    }

    public List<ImplItem> implItems() {
        return children(ImplItem::cast);
    }
}
