package com.tyron.treedit.core.syntax.ast;

import com.tyron.treedit.api.syntax.SyntaxKind;
import com.tyron.treedit.core.syntax.SyntaxNode;

import java.util.List;

public final class SourceFile extends AstNode {

    private SourceFile(SyntaxNode syntax) {
        super(syntax);
    }

    public static SourceFile cast(SyntaxNode syntax) {
        return syntax.getKind() == SyntaxKind.SOURCE_FILE ? new SourceFile(syntax) : null;
    }

    public List<StructDef> structs() {
        return children(StructDef::cast);
    }

    public List<ImplBlock> impls() {
        return children(ImplBlock::cast);
    }

    public List<FnDef> functions() {
        return children(FnDef::cast);
    }
}
