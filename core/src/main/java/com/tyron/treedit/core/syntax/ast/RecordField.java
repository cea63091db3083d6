package com.tyron.treedit.core.syntax.ast;

import com.tyron.treedit.api.syntax.SyntaxKind;
import com.tyron.treedit.core.syntax.SyntaxNode;
import com.tyron.treedit.core.syntax.SyntaxToken;
import org.jetbrains.annotations.Nullable;

/**
 * {@code name: Type}, optionally preceded by attributes and a visibility.
 */
public final class RecordField extends AstNode {

    private RecordField(SyntaxNode syntax) {
        super(syntax);
    }

    public static RecordField cast(SyntaxNode syntax) {
        if (syntax.getKind() != SyntaxKind.RECORD_FIELD || !Grammar.hasChild(syntax, SyntaxKind.NAME)) {
            return null;
        }
        return new RecordField(syntax);
    }

    public Name name() {
        return child(Name::cast);
    }

    @Nullable
    public SyntaxToken colonToken() {
        return token(SyntaxKind.COLON);
    }

    @Nullable
    public SyntaxNode type() {
        return syntax().findChildNode(SyntaxKind.PATH_TYPE);
    }
}
