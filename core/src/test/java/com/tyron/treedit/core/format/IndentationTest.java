package com.tyron.treedit.core.format;

import com.tyron.treedit.api.syntax.SyntaxKind;
import com.tyron.treedit.core.syntax.SyntaxNode;
import com.tyron.treedit.core.syntax.SyntaxTreeBuilder;
import com.tyron.treedit.core.syntax.Trees;
import com.tyron.treedit.core.syntax.ast.SyntaxFactory;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class IndentationTest {

    /**
     * <pre>
     * // c
     *   struct S {
     *       a: i32,
     *   }
     * </pre>
     */
    private static SyntaxNode indentedStruct() {
        return new SyntaxTreeBuilder()
                .startNode(SyntaxKind.SOURCE_FILE)
                .token(SyntaxKind.COMMENT, "// c")
                .token(SyntaxKind.WHITESPACE, "\n\n  ")
                .startNode(SyntaxKind.STRUCT_DEF)
                .token(SyntaxKind.STRUCT_KW)
                .token(SyntaxKind.WHITESPACE, " ")
                .startNode(SyntaxKind.NAME).token(SyntaxKind.IDENT, "S").finishNode()
                .token(SyntaxKind.WHITESPACE, " ")
                .startNode(SyntaxKind.RECORD_FIELD_LIST)
                .token(SyntaxKind.L_CURLY)
                .token(SyntaxKind.WHITESPACE, "\n      ")
                .element(SyntaxFactory.recordField("a", "i32").syntax().getGreen())
                .token(SyntaxKind.COMMA)
                .token(SyntaxKind.WHITESPACE, "\n  ")
                .token(SyntaxKind.R_CURLY)
                .finishNode()
                .finishNode()
                .finishNode()
                .finishRoot();
    }

    @Test
    public void indentOfTheLineANodeStartsOn() {
        SyntaxNode root = indentedStruct();
        SyntaxNode list = Trees.fieldList(root);

        Assertions.assertEquals("  ", Indentation.leadingIndent(Trees.structDef(root)));
        Assertions.assertEquals("  ", Indentation.leadingIndent(list));
        Assertions.assertEquals("      ", Indentation.leadingIndent(list.children().get(0)));
    }

    @Test
    public void firstLineHasNoIndent() {
        SyntaxNode root = Trees.struct("a");

        Assertions.assertNull(Indentation.leadingIndent(Trees.fieldList(root)));
        Assertions.assertEquals("", Indentation.leadingIndentOrEmpty(Trees.fieldList(root)));
    }

    @Test
    public void detachedNodeHasNoIndent() {
        Assertions.assertNull(Indentation.leadingIndent(SyntaxFactory.recordField("a", "i32").syntax()));
    }

    @Test
    public void multiline() {
        SyntaxNode root = indentedStruct();

        Assertions.assertTrue(Indentation.isMultiline(Trees.fieldList(root)));
        Assertions.assertFalse(Indentation.isMultiline(Trees.fieldList(Trees.struct("a", "b"))));
    }
}
