package com.tyron.treedit.core.syntax.ast;

import com.tyron.treedit.api.syntax.SyntaxKind;
import com.tyron.treedit.core.syntax.SyntaxNode;
import org.jetbrains.annotations.Nullable;

public final class StructDef extends AstNode {

    private StructDef(SyntaxNode syntax) {
        super(syntax);
    }

    public static StructDef cast(SyntaxNode syntax) {
        if (syntax.getKind() != SyntaxKind.STRUCT_DEF
                || !Grammar.hasChild(syntax, SyntaxKind.STRUCT_KW)
                || !Grammar.hasChild(syntax, SyntaxKind.NAME)) {
            return null;
        }
        return new StructDef(syntax);
    }

    public Name name() {
        return child(Name::cast);
    }

    @Nullable
    public TypeParamList typeParamList() {
        return child(TypeParamList::cast);
    }

    @Nullable
    public RecordFieldList recordFieldList() {
        return child(RecordFieldList::cast);
    }
}
