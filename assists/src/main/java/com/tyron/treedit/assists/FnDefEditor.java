package com.tyron.treedit.assists;

import com.tyron.treedit.core.syntax.ast.Block;
import com.tyron.treedit.core.syntax.ast.FnDef;
import org.jetbrains.annotations.NotNull;

public class FnDefEditor extends AstEditor<FnDef> {

    public FnDefEditor(@NotNull FnDef fn) {
        super(fn);
    }

    /**
     * @see FnDef#withBody(Block)
     */
    public FnDefEditor setBody(@NotNull Block body) {
        edit(fn -> fn.withBody(body));
        return this;
    }
}
