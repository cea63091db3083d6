package com.tyron.treedit.core.syntax.ast;

import com.tyron.treedit.api.syntax.InsertPosition;
import com.tyron.treedit.api.syntax.SyntaxKind;
import com.tyron.treedit.core.syntax.SyntaxElement;
import com.tyron.treedit.core.syntax.SyntaxNode;
import com.tyron.treedit.core.syntax.SyntaxToken;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

public final class FnDef extends AstNode {

    private FnDef(SyntaxNode syntax) {
        super(syntax);
    }

    public static FnDef cast(SyntaxNode syntax) {
        if (syntax.getKind() != SyntaxKind.FN_DEF
                || !Grammar.hasChild(syntax, SyntaxKind.FN_KW)
                || !Grammar.hasChild(syntax, SyntaxKind.NAME)
                || Grammar.count(syntax, SyntaxKind.BLOCK) > 1
                || Grammar.hasChild(syntax, SyntaxKind.BLOCK) && Grammar.hasChild(syntax, SyntaxKind.SEMICOLON)) {
            return null;
        }
        return new FnDef(syntax);
    }

    public Name name() {
        return child(Name::cast);
    }

    @Nullable
    public TypeParamList typeParamList() {
        return child(TypeParamList::cast);
    }

    @Nullable
    public SyntaxNode paramList() {
        return syntax().findChildNode(SyntaxKind.PARAM_LIST);
    }

    @Nullable
    public Block body() {
        return child(Block::cast);
    }

    @Nullable
    public SyntaxToken semicolonToken() {
        return token(SyntaxKind.SEMICOLON);
    }

    /**
     * Returns a copy of this function with the given body. An existing body is replaced, a trailing
     * {@code ;} becomes {@code " " + body}, and a function with neither gets {@code " " + body} appended.
     */
    @NotNull
    public FnDef withBody(@NotNull Block body) {
        Block oldBody = body();
        if (oldBody != null) {
            SyntaxNode old = oldBody.syntax();
            return AstNodes.replaceChildren(this, old, old, List.of(body.syntax()));
        }
        SyntaxToken semicolon = semicolonToken();
        if (semicolon != null) {
            return AstNodes.replaceChildren(this, semicolon, semicolon,
                    List.of(SyntaxFactory.singleSpace(), body.syntax()));
        }
        List<SyntaxElement> toInsert = List.of(SyntaxFactory.singleSpace(), body.syntax());
        return AstNodes.insertChildren(this, InsertPosition.last(), toInsert);
    }
}
