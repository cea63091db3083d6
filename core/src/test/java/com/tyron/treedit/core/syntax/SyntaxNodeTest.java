package com.tyron.treedit.core.syntax;

import com.tyron.treedit.api.syntax.Direction;
import com.tyron.treedit.api.syntax.SyntaxKind;
import com.tyron.treedit.api.syntax.TextRange;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class SyntaxNodeTest {

    @Test
    public void rendersTextAndComputesRanges() {
        SyntaxNode root = Trees.struct("a", "b");
        Assertions.assertEquals("struct S { a: i32, b: i32 }", root.getText());

        SyntaxNode list = Trees.fieldList(root);
        Assertions.assertEquals(TextRange.of(9, 27), list.getTextRange());

        List<SyntaxNode> fields = list.children();
        Assertions.assertEquals(2, fields.size());
        Assertions.assertEquals(TextRange.of(11, 17), fields.get(0).getTextRange());
        Assertions.assertEquals(TextRange.of(19, 25), fields.get(1).getTextRange());
        Assertions.assertEquals("b: i32", fields.get(1).getText());
    }

    @Test
    public void navigatesSiblingsAndTokensAcrossNodes() {
        SyntaxNode list = Trees.fieldList(Trees.struct("a", "b"));
        SyntaxElement first = list.firstChildOrToken();
        Assertions.assertNotNull(first);
        Assertions.assertEquals(SyntaxKind.L_CURLY, first.getKind());
        Assertions.assertNull(first.prevSiblingOrToken());

        List<SyntaxElement> siblings = first.siblingsWithTokens(Direction.NEXT);
        Assertions.assertEquals(list.getChildCount(), siblings.size());
        Assertions.assertEquals(SyntaxKind.R_CURLY, siblings.get(siblings.size() - 1).getKind());

        SyntaxToken lCurly = (SyntaxToken) first;
        SyntaxToken before = lCurly.prevToken();
        Assertions.assertNotNull(before);
        Assertions.assertEquals(SyntaxKind.WHITESPACE, before.getKind());
        Assertions.assertEquals("S", before.prevToken().getText());

        SyntaxToken afterWs = lCurly.nextToken().nextToken();
        Assertions.assertEquals("a", afterWs.getText());
        Assertions.assertEquals(SyntaxKind.NAME, afterWs.getParent().getKind());

        Assertions.assertNull(list.getRoot().firstToken().prevToken());
        Assertions.assertNull(list.getRoot().lastToken().nextToken());
    }

    @Test
    public void cursorsAreEqualOnlyWithinOneTree() {
        SyntaxNode root = Trees.struct("a");
        SyntaxNode list1 = Trees.fieldList(root);
        SyntaxNode list2 = Trees.fieldList(root);

        Assertions.assertNotSame(list1, list2);
        Assertions.assertEquals(list1, list2);
        Assertions.assertEquals(list1.hashCode(), list2.hashCode());

        SyntaxNode otherRoot = SyntaxNode.newRoot(root.getGreen());
        Assertions.assertNotEquals(root, otherRoot);
        Assertions.assertNotEquals(list1, Trees.fieldList(otherRoot));
        Assertions.assertEquals(list1.getText(), Trees.fieldList(otherRoot).getText());
    }

    @Test
    public void replaceWithRebuildsOnlyTheAncestorChain() {
        SyntaxNode root = Trees.struct("a");
        SyntaxNode structDef = Trees.structDef(root);
        SyntaxNode list = Trees.fieldList(root);
        GreenNode emptyList = new GreenNode(SyntaxKind.RECORD_FIELD_LIST, List.of(
                new GreenToken(SyntaxKind.L_CURLY, "{"), new GreenToken(SyntaxKind.R_CURLY, "}")));

        SyntaxNode replaced = list.replaceWith(emptyList);

        Assertions.assertSame(emptyList, replaced.getGreen());
        Assertions.assertEquals(list.getTextRange().startOffset(), replaced.getTextRange().startOffset());
        Assertions.assertEquals("struct S {}", replaced.getRoot().getText());
        Assertions.assertEquals("struct S { a: i32 }", root.getText());

        SyntaxNode newStruct = replaced.getParent();
        Assertions.assertNotSame(structDef.getGreen(), newStruct.getGreen());
        for (int i = 0; i < structDef.getChildCount() - 1; i++) {
            Assertions.assertSame(structDef.getGreen().getChildren().get(i), newStruct.getGreen().getChildren().get(i));
        }
    }

    @Test
    public void debugDumpListsEveryElement() {
        String dump = Trees.struct("a").debugDump();
        Assertions.assertTrue(dump.startsWith("SOURCE_FILE@[0, 19)"));
        Assertions.assertTrue(dump.contains("    RECORD_FIELD_LIST@[9, 19)"));
        Assertions.assertTrue(dump.contains("IDENT@[11, 12) \"a\""));
    }
}
