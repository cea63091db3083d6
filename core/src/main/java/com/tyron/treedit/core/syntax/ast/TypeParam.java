package com.tyron.treedit.core.syntax.ast;

import com.tyron.treedit.api.syntax.SyntaxKind;
import com.tyron.treedit.core.syntax.GreenElement;
import com.tyron.treedit.core.syntax.SyntaxNode;
import com.tyron.treedit.core.syntax.SyntaxToken;
import org.jetbrains.annotations.Nullable;

/**
 * A generic parameter with optional bounds: {@code T: Clone + Debug}.
 */
public final class TypeParam extends AstNode {

    private TypeParam(SyntaxNode syntax) {
        super(syntax);
    }

    public static TypeParam cast(SyntaxNode syntax) {
        if (syntax.getKind() != SyntaxKind.TYPE_PARAM
                || !Grammar.hasChild(syntax, SyntaxKind.NAME)
                || Grammar.count(syntax, SyntaxKind.COLON) > 1
                || !boundsFollowColon(syntax)) {
            return null;
        }
        return new TypeParam(syntax);
    }

    private static boolean boundsFollowColon(SyntaxNode syntax) {
        boolean seenColon = false;
        for (GreenElement child : syntax.getGreen().getChildren()) {
            if (child.getKind() == SyntaxKind.COLON) {
                seenColon = true;
            } else if (child.getKind() == SyntaxKind.TYPE_BOUND_LIST && !seenColon) {
                return false;
            }
        }
        return true;
    }

    public Name name() {
        return child(Name::cast);
    }

    @Nullable
    public SyntaxToken colonToken() {
        return token(SyntaxKind.COLON);
    }

    @Nullable
    public TypeBoundList typeBoundList() {
        return child(TypeBoundList::cast);
    }
}
