package com.tyron.treedit.assists;

import com.tyron.treedit.core.syntax.SyntaxElement;
import com.tyron.treedit.core.syntax.SyntaxToken;
import com.tyron.treedit.core.syntax.ast.AstNodes;
import com.tyron.treedit.core.syntax.ast.TypeBoundList;
import com.tyron.treedit.core.syntax.ast.TypeParam;
import org.jetbrains.annotations.NotNull;

import java.util.List;

public class TypeParamEditor extends AstEditor<TypeParam> {

    public TypeParamEditor(@NotNull TypeParam typeParam) {
        super(typeParam);
    }

    /**
     * Drops the {@code :} and the bound list after it in a single splice; {@code T: Clone + Debug} becomes
     * {@code T}. A parameter without a colon is left alone.
     */
    public TypeParamEditor removeBounds() {
        edit(param -> {
            SyntaxToken colon = param.colonToken();
            if (colon == null) {
                return param;
            }
            TypeBoundList bounds = param.typeBoundList();
            SyntaxElement end = bounds != null ? bounds.syntax() : colon;
            return AstNodes.replaceChildren(param, colon, end, List.of());
        });
        return this;
    }
}
