package com.tyron.treedit.core.syntax;

import com.tyron.treedit.api.syntax.InsertPosition;
import com.tyron.treedit.api.syntax.SyntaxKind;
import com.tyron.treedit.core.syntax.ast.SyntaxFactory;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class SyntaxAlgoTest {

    @Test
    public void insertAfterAnchorSharesUntouchedChildren() {
        SyntaxNode root = Trees.struct("a");
        SyntaxNode list = Trees.fieldList(root);
        SyntaxNode fieldA = list.children().get(0);

        SyntaxNode edited = SyntaxAlgo.insertChildren(list, InsertPosition.after(fieldA), List.of(
                SyntaxFactory.comma(), SyntaxFactory.singleSpace(), SyntaxFactory.recordField("b", "u8").syntax()));

        Assertions.assertEquals("{ a: i32, b: u8 }", edited.getText());
        Assertions.assertEquals("struct S { a: i32, b: u8 }", edited.getRoot().getText());
        Assertions.assertEquals("struct S { a: i32 }", root.getText());

        List<GreenElement> before = list.getGreen().getChildren();
        List<GreenElement> after = edited.getGreen().getChildren();
        Assertions.assertSame(before.get(0), after.get(0));
        Assertions.assertSame(before.get(1), after.get(1));
        Assertions.assertSame(before.get(2), after.get(2));
        Assertions.assertSame(before.get(3), after.get(6));
        Assertions.assertSame(before.get(4), after.get(7));

        SyntaxNode oldStruct = Trees.structDef(root);
        SyntaxNode newStruct = edited.getParent();
        Assertions.assertSame(oldStruct.getGreen().getChildren().get(2), newStruct.getGreen().getChildren().get(2));
    }

    @Test
    public void insertFirstLastAndBefore() {
        SyntaxNode list = Trees.fieldList(Trees.struct("a"));

        SyntaxNode first = SyntaxAlgo.insertChildren(list, InsertPosition.first(), List.of(SyntaxFactory.singleSpace()));
        Assertions.assertEquals(" { a: i32 }", first.getText());

        SyntaxNode last = SyntaxAlgo.insertChildren(list, InsertPosition.last(), List.of(SyntaxFactory.singleNewline()));
        Assertions.assertEquals("{ a: i32 }\n", last.getText());

        SyntaxElement rCurly = list.lastChildOrToken();
        SyntaxNode before = SyntaxAlgo.insertChildren(list, InsertPosition.before(rCurly), List.of(SyntaxFactory.comma()));
        Assertions.assertEquals("{ a: i32 ,}", before.getText());
    }

    @Test
    public void anchorFromOlderVersionIsRejected() {
        SyntaxNode list = Trees.fieldList(Trees.struct("a"));
        SyntaxElement staleAnchor = list.firstChildOrToken();

        SyntaxNode edited = SyntaxAlgo.insertChildren(list, InsertPosition.last(), List.of(SyntaxFactory.singleSpace()));

        Assertions.assertThrows(InvalidAnchorException.class, () ->
                SyntaxAlgo.insertChildren(edited, InsertPosition.after(staleAnchor), List.of(SyntaxFactory.comma())));
    }

    @Test
    public void anchorMustBeDirectChild() {
        SyntaxNode list = Trees.fieldList(Trees.struct("a"));
        SyntaxToken nested = list.children().get(0).firstToken();

        Assertions.assertThrows(InvalidAnchorException.class, () ->
                SyntaxAlgo.insertChildren(list, InsertPosition.before(nested), List.of(SyntaxFactory.comma())));
    }

    @Test
    public void replaceChildrenDeletesInclusiveRange() {
        SyntaxNode list = Trees.fieldList(Trees.struct("a", "b"));
        List<SyntaxElement> children = list.childrenWithTokens();

        // ", b: i32"
        SyntaxNode edited = SyntaxAlgo.replaceChildren(list, children.get(3), children.get(5), List.of());

        Assertions.assertEquals("{ a: i32 }", edited.getText());
        Assertions.assertSame(list.getGreen().getChildren().get(6), edited.getGreen().getChildren().get(3));
    }

    @Test
    public void replaceChildrenSplicesReplacement() {
        SyntaxNode list = Trees.fieldList(Trees.struct("a"));
        SyntaxNode field = list.children().get(0);

        SyntaxNode edited = SyntaxAlgo.replaceChildren(list, field, field, List.of(SyntaxFactory.recordField("x", "bool").syntax()));

        Assertions.assertEquals("{ x: bool }", edited.getText());
    }

    @Test
    public void replaceChildrenRejectsReversedOrForeignRanges() {
        SyntaxNode list = Trees.fieldList(Trees.struct("a", "b"));
        List<SyntaxElement> children = list.childrenWithTokens();

        Assertions.assertThrows(InvalidRangeException.class, () ->
                SyntaxAlgo.replaceChildren(list, children.get(5), children.get(2), List.of()));

        SyntaxToken nested = list.children().get(0).firstToken();
        Assertions.assertThrows(InvalidRangeException.class, () ->
                SyntaxAlgo.replaceChildren(list, children.get(0), nested, List.of()));

        SyntaxNode other = Trees.fieldList(Trees.struct("a", "b"));
        Assertions.assertThrows(InvalidRangeException.class, () ->
                SyntaxAlgo.replaceChildren(list, other.firstChildOrToken(), other.lastChildOrToken(), List.of()));
    }

    @Test
    public void replaceDescendantsMatchesByTreeIdentity() {
        SyntaxNode root = Trees.struct("a", "b");
        SyntaxNode list = Trees.fieldList(root);
        SyntaxNode fieldB = list.children().get(1);
        SyntaxToken typeOfB = fieldB.lastToken();

        Map<SyntaxElement, SyntaxElement> map = new HashMap<>();
        map.put(typeOfB, SyntaxFactory.token(SyntaxKind.IDENT, "String"));
        SyntaxNode edited = SyntaxAlgo.replaceDescendants(list, map);

        Assertions.assertEquals("{ a: i32, b: String }", edited.getText());
        // the textually identical type of `a` is a different element and stays
        Assertions.assertSame(list.getGreen().getChildren().get(2), edited.getGreen().getChildren().get(2));
    }

    @Test
    public void replaceDescendantsIgnoresKeysFromOtherTrees() {
        SyntaxNode list = Trees.fieldList(Trees.struct("a"));
        SyntaxNode sameText = Trees.fieldList(Trees.struct("a"));

        Map<SyntaxElement, SyntaxElement> map = new HashMap<>();
        map.put(sameText.children().get(0), SyntaxFactory.recordField("z", "i32").syntax());

        Assertions.assertSame(list, SyntaxAlgo.replaceDescendants(list, map));
    }

    @Test
    public void outerReplacementWinsOverNested() {
        SyntaxNode list = Trees.fieldList(Trees.struct("a"));
        SyntaxNode field = list.children().get(0);

        Map<SyntaxElement, SyntaxElement> map = new HashMap<>();
        map.put(field, SyntaxFactory.recordField("outer", "i32").syntax());
        map.put(field.firstToken(), SyntaxFactory.token(SyntaxKind.IDENT, "inner"));

        Assertions.assertEquals("{ outer: i32 }", SyntaxAlgo.replaceDescendants(list, map).getText());
    }

    @Test
    public void replacingRootWithTokenIsInvalid() {
        SyntaxNode list = Trees.fieldList(Trees.struct("a"));

        Map<SyntaxElement, SyntaxElement> map = Map.of(list, SyntaxFactory.comma());

        Assertions.assertThrows(InvalidStructureException.class, () -> SyntaxAlgo.replaceDescendants(list, map));
    }
}
