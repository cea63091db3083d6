package com.tyron.treedit.core.syntax.ast;

import com.tyron.treedit.api.syntax.SyntaxKind;
import com.tyron.treedit.core.syntax.SyntaxNode;
import com.tyron.treedit.core.syntax.SyntaxToken;
import org.jetbrains.annotations.Nullable;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * The braced field list of a record struct: {@code { a: i32, b: String }}.
 */
public final class RecordFieldList extends AstNode {

    private static final Set<SyntaxKind> ALLOWED = EnumSet.of(
            SyntaxKind.L_CURLY, SyntaxKind.R_CURLY, SyntaxKind.RECORD_FIELD, SyntaxKind.COMMA,
            SyntaxKind.WHITESPACE, SyntaxKind.COMMENT, SyntaxKind.ERROR);

    private RecordFieldList(SyntaxNode syntax) {
        super(syntax);
    }

    public static RecordFieldList cast(SyntaxNode syntax) {
        if (syntax.getKind() != SyntaxKind.RECORD_FIELD_LIST
                || !Grammar.childKindsWithin(syntax, ALLOWED)
                || !Grammar.isDelimited(syntax, SyntaxKind.L_CURLY, SyntaxKind.R_CURLY)) {
            return null;
        }
        return new RecordFieldList(syntax);
    }

    @Nullable
    public SyntaxToken lCurly() {
        return token(SyntaxKind.L_CURLY);
    }

    @Nullable
    public SyntaxToken rCurly() {
        return token(SyntaxKind.R_CURLY);
    }

    public List<RecordField> fields() {
        return children(RecordField::cast);
    }
}
