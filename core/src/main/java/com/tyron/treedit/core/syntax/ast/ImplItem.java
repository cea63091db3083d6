package com.tyron.treedit.core.syntax.ast;

import com.tyron.treedit.api.syntax.SyntaxKind;
import com.tyron.treedit.core.syntax.SyntaxNode;
import org.jetbrains.annotations.Nullable;

/**
 * An item that may appear inside an impl block: a function, a constant or a type alias.
 */
public final class ImplItem extends AstNode {

    public enum Kind {
        FN(SyntaxKind.FN_DEF, SyntaxKind.FN_KW),
        CONST(SyntaxKind.CONST_DEF, SyntaxKind.CONST_KW),
        TYPE_ALIAS(SyntaxKind.TYPE_ALIAS_DEF, SyntaxKind.TYPE_KW);

        private final SyntaxKind nodeKind;
        private final SyntaxKind keyword;

        Kind(SyntaxKind nodeKind, SyntaxKind keyword) {
            this.nodeKind = nodeKind;
            this.keyword = keyword;
        }

        static Kind of(SyntaxKind nodeKind) {
            for (Kind kind : values()) {
                if (kind.nodeKind == nodeKind) {
                    return kind;
                }
            }
            return null;
        }
    }

    private final Kind kind;

    private ImplItem(SyntaxNode syntax, Kind kind) {
        super(syntax);
        this.kind = kind;
    }

    public static ImplItem cast(SyntaxNode syntax) {
        Kind kind = Kind.of(syntax.getKind());
        if (kind == null
                || !Grammar.hasChild(syntax, kind.keyword)
                || !Grammar.hasChild(syntax, SyntaxKind.NAME)) {
            return null;
        }
        return new ImplItem(syntax, kind);
    }

    public Kind getItemKind() {
        return kind;
    }

    public Name name() {
        return child(Name::cast);
    }

    @Nullable
    public FnDef asFnDef() {
        return FnDef.cast(syntax());
    }
}
