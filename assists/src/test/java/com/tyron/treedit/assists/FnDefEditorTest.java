package com.tyron.treedit.assists;

import com.tyron.treedit.core.syntax.ast.FnDef;
import com.tyron.treedit.core.syntax.ast.SourceFile;
import com.tyron.treedit.core.syntax.ast.SyntaxFactory;
import com.tyron.treedit.testFramework.BaseSyntaxTest;
import org.junit.jupiter.api.Test;

public class FnDefEditorTest extends BaseSyntaxTest {

    private void assertBody(String before, String expected) {
        SourceFile file = parse(before);

        FnDefEditor editor = new FnDefEditor(find(file, FnDef.class)).setBody(SyntaxFactory.emptyBlock());

        assertPatch(before, editor.finish(), expected);
    }

    @Test
    public void declarationGetsABody() {
        assertBody("fn f();", "fn f() {}");
    }

    @Test
    public void existingBodyIsReplaced() {
        assertBody("fn f() -> i32 { 1 }", "fn f() -> i32 {}");
    }

    @Test
    public void traitStyleItemInsideImpl() {
        assertBody("impl T {\n    fn f(x: i32);\n}", "impl T {\n    fn f(x: i32) {}\n}");
    }
}
