package com.tyron.treedit.assists;

import com.tyron.treedit.core.syntax.ast.SourceFile;
import com.tyron.treedit.core.syntax.ast.SyntaxFactory;
import com.tyron.treedit.core.syntax.ast.TypeParam;
import com.tyron.treedit.testFramework.BaseSyntaxTest;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TypeParamEditorTest extends BaseSyntaxTest {

    @Test
    public void removesColonAndBounds() {
        TypeParam param = SyntaxFactory.typeParam("T", "Clone", "Debug");

        TypeParam edited = new TypeParamEditor(param).removeBounds().ast();

        Assertions.assertEquals("T", edited.getText());
        Assertions.assertNull(edited.colonToken());
        Assertions.assertNull(edited.typeBoundList());
    }

    @Test
    public void patchesTheFunctionSignature() {
        SourceFile file = parse("fn f<T: Clone + Debug>() {}");

        TypeParamEditor editor = new TypeParamEditor(find(file, TypeParam.class)).removeBounds();

        assertPatch(file.getText(), editor.finish(), "fn f<T>() {}");
    }

    @Test
    public void onlyTheEditedParameterChanges() {
        SourceFile file = parse("fn f<A: Clone, B: Copy>() {}");

        TypeParamEditor editor = new TypeParamEditor(nth(file, TypeParam.class, 1)).removeBounds();

        assertPatch(file.getText(), editor.finish(), "fn f<A: Clone, B>() {}");
    }

    @Test
    public void parameterWithoutBoundsIsLeftAlone() {
        SourceFile file = parse("struct S<T> { t: T }");

        TypeParamEditor editor = new TypeParamEditor(find(file, TypeParam.class)).removeBounds();

        Assertions.assertTrue(editor.finish().isEmpty());
    }
}
