package com.tyron.treedit.core.syntax;

import com.tyron.treedit.api.syntax.InsertPosition;
import com.tyron.treedit.api.syntax.SyntaxKind;
import com.tyron.treedit.api.syntax.TextRange;
import com.tyron.treedit.api.text.AtomTextEdit;
import com.tyron.treedit.api.text.TextEdit;
import com.tyron.treedit.core.syntax.ast.SyntaxFactory;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class TreeDiffTest {

    @Test
    public void sameTreeProducesNoReplacements() {
        SyntaxNode list = Trees.fieldList(Trees.struct("a", "b"));

        Assertions.assertTrue(TreeDiff.diff(list, list).isEmpty());
        Assertions.assertTrue(TreeDiff.textEdit(list, list).isEmpty());
    }

    @Test
    public void changedTokenIsReplacedAlone() {
        SyntaxNode root = Trees.struct("a", "b");
        SyntaxNode list = Trees.fieldList(root);
        SyntaxToken name = list.children().get(1).firstToken();

        SyntaxNode edited = SyntaxAlgo.replaceDescendants(list, Map.of(name, SyntaxFactory.token(SyntaxKind.IDENT, "bb")));
        TextEdit edit = TreeDiff.textEdit(list, edited);

        Assertions.assertEquals(List.of(AtomTextEdit.replace(TextRange.of(19, 20), "bb")), edit.getAtoms());
        Assertions.assertEquals(edited.getRoot().getText(), edit.apply(root.getText()));
    }

    @Test
    public void differentChildCountReplacesWholeNode() {
        SyntaxNode root = Trees.struct("a");
        SyntaxNode list = Trees.fieldList(root);

        SyntaxNode edited = SyntaxAlgo.insertChildren(list, InsertPosition.after(list.children().get(0)),
                List.of(SyntaxFactory.comma()));
        List<TreeDiff.Replacement> replacements = TreeDiff.diff(list, edited);

        Assertions.assertEquals(1, replacements.size());
        Assertions.assertEquals(list.getTextRange(), replacements.get(0).from().getTextRange());
        Assertions.assertEquals("{ a: i32, }", replacements.get(0).to().getText());
        Assertions.assertEquals("struct S { a: i32, }", TreeDiff.textEdit(list, edited).apply(root.getText()));
    }

    @Test
    public void childKindMismatchReplacesTheParent() {
        SyntaxNode root = Trees.struct("a", "b");
        SyntaxNode list = Trees.fieldList(root);
        SyntaxElement comma = list.childrenWithTokens().get(3);

        SyntaxNode edited = SyntaxAlgo.replaceChildren(list, comma, comma, List.of(SyntaxFactory.token(SyntaxKind.SEMICOLON)));
        List<TreeDiff.Replacement> replacements = TreeDiff.diff(list, edited);

        Assertions.assertEquals(1, replacements.size());
        Assertions.assertEquals(TextRange.of(9, 27), replacements.get(0).from().getTextRange());
        Assertions.assertEquals("{ a: i32; b: i32 }", replacements.get(0).to().getText());
    }

    @Test
    public void severalChangesComeOutSortedAndDisjoint() {
        SyntaxNode root = Trees.struct("a", "b", "c");
        SyntaxNode list = Trees.fieldList(root);
        List<SyntaxNode> fields = list.children();

        Map<SyntaxElement, SyntaxElement> map = new HashMap<>();
        map.put(fields.get(2).lastToken(), SyntaxFactory.token(SyntaxKind.IDENT, "u64"));
        map.put(fields.get(0).firstToken(), SyntaxFactory.token(SyntaxKind.IDENT, "first"));
        map.put(fields.get(1), SyntaxFactory.recordField("middle", "bool").syntax());
        SyntaxNode edited = SyntaxAlgo.replaceDescendants(list, map);

        TextEdit edit = TreeDiff.textEdit(list, edited);
        List<AtomTextEdit> atoms = edit.getAtoms();
        Assertions.assertEquals(4, atoms.size());
        for (int i = 1; i < atoms.size(); i++) {
            Assertions.assertTrue(atoms.get(i - 1).delete().endOffset() <= atoms.get(i).delete().startOffset());
        }
        Assertions.assertEquals("struct S { first: i32, middle: bool, c: u64 }", edit.apply(root.getText()));
    }

    @Test
    public void rebuiltButEqualSubtreeYieldsNothing() {
        SyntaxNode root = Trees.struct("a", "b");
        SyntaxNode list = Trees.fieldList(root);
        SyntaxNode fieldA = list.children().get(0);

        SyntaxNode edited = SyntaxAlgo.replaceChildren(list, fieldA, fieldA,
                List.of(SyntaxFactory.recordField("a", "i32").syntax()));

        // textually equal but freshly built: the diff walks into it and finds nothing to change
        Assertions.assertTrue(TreeDiff.diff(list, edited).isEmpty());
        Assertions.assertSame(list.getGreen().getChildren().get(5), edited.getGreen().getChildren().get(5));
    }
}
