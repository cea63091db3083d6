package com.tyron.treedit.core.syntax.ast;

import com.tyron.treedit.api.syntax.InsertPosition;
import com.tyron.treedit.api.syntax.SyntaxKind;
import com.tyron.treedit.core.syntax.InvalidStructureException;
import com.tyron.treedit.core.syntax.SyntaxNode;
import com.tyron.treedit.core.syntax.Trees;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class AstNodesTest {

    @Test
    public void castChecksKindAndShape() {
        SyntaxNode root = Trees.struct("a", "b");
        SyntaxNode list = Trees.fieldList(root);

        RecordFieldList fields = AstNodes.cast(RecordFieldList.class, list);
        Assertions.assertNotNull(fields);
        Assertions.assertEquals(2, fields.fields().size());
        Assertions.assertEquals("b", fields.fields().get(1).name().getIdentifier());
        Assertions.assertNull(AstNodes.cast(ItemList.class, list));
        Assertions.assertNull(AstNodes.cast(RecordField.class, list));
    }

    @Test
    public void castOrThrowReportsTheCategory() {
        SyntaxNode list = Trees.fieldList(Trees.struct("a"));

        InvalidStructureException e = Assertions.assertThrows(InvalidStructureException.class,
                () -> AstNodes.castOrThrow(Block.class, list));
        Assertions.assertTrue(e.getMessage().contains("Block"), e.getMessage());
    }

    @Test
    public void typedInsertKeepsTheCategory() {
        RecordFieldList list = AstNodes.castOrThrow(RecordFieldList.class, Trees.fieldList(Trees.struct("a")));
        RecordField a = list.fields().get(0);

        RecordFieldList edited = AstNodes.insertChildren(list, InsertPosition.after(a.syntax()),
                List.of(SyntaxFactory.comma(), SyntaxFactory.singleSpace(), SyntaxFactory.recordField("b", "u8").syntax()));

        Assertions.assertEquals("{ a: i32, b: u8 }", edited.getText());
        Assertions.assertEquals(List.of("a", "b"),
                edited.fields().stream().map(f -> f.name().getIdentifier()).toList());
    }

    @Test
    public void typedInsertRejectsABrokenGrammar() {
        RecordFieldList list = AstNodes.castOrThrow(RecordFieldList.class, Trees.fieldList(Trees.struct("a")));

        Assertions.assertThrows(InvalidStructureException.class,
                () -> AstNodes.insertChildren(list, InsertPosition.first(), List.of(SyntaxFactory.token(SyntaxKind.L_CURLY))));
        Assertions.assertThrows(InvalidStructureException.class,
                () -> AstNodes.insertChildren(list, InsertPosition.last(), List.of(SyntaxFactory.colon())));
        // a field after the closing brace
        Assertions.assertThrows(InvalidStructureException.class,
                () -> AstNodes.insertChildren(list, InsertPosition.last(), List.of(SyntaxFactory.recordField("b", "u8").syntax())));
    }

    @Test
    public void typeParamNeedsBoundsAfterItsColon() {
        TypeParam param = SyntaxFactory.typeParam("T", "Clone", "Debug");
        Assertions.assertEquals("T: Clone + Debug", param.getText());
        Assertions.assertEquals(2, param.typeBoundList().bounds().size());

        Assertions.assertThrows(InvalidStructureException.class,
                () -> AstNodes.replaceChildren(param, param.colonToken(), param.colonToken(), List.of(SyntaxFactory.singleSpace())));
    }

    @Test
    public void descendantsAreInDocumentOrder() {
        SyntaxNode root = Trees.struct("a", "b", "c");

        List<RecordField> fields = AstNodes.descendants(root, RecordField.class);

        Assertions.assertEquals(List.of("a: i32", "b: i32", "c: i32"), fields.stream().map(AstNode::getText).toList());
        Assertions.assertEquals("a: i32", AstNodes.firstDescendant(root, RecordField.class).getText());
        Assertions.assertNull(AstNodes.firstDescendant(root, FnDef.class));
    }
}
