package com.tyron.treedit.assists;

import com.tyron.treedit.api.syntax.SyntaxKind;
import com.tyron.treedit.core.syntax.SyntaxElement;
import com.tyron.treedit.core.syntax.ast.AstNodes;
import com.tyron.treedit.core.syntax.ast.ImplItem;
import org.jetbrains.annotations.NotNull;

import java.util.List;

public class ImplItemEditor extends AstEditor<ImplItem> {

    public ImplItemEditor(@NotNull ImplItem item) {
        super(item);
    }

    public ImplItemEditor(@NotNull ImplItem item, @NotNull FormattingOptions options) {
        super(item, options);
    }

    /**
     * Removes every attribute and comment of the item, each together with the whitespace that follows it, so
     * that no blank line is left behind.
     */
    public void stripAttrsAndDocs() {
        edit(item -> {
            ImplItem current = item;
            SyntaxElement start;
            while ((start = firstAttrOrComment(current)) != null) {
                SyntaxElement next = start.nextSiblingOrToken();
                SyntaxElement end = next != null && next.getKind() == SyntaxKind.WHITESPACE ? next : start;
                current = AstNodes.replaceChildren(current, start, end, List.of());
            }
            return current;
        });
    }

    private static SyntaxElement firstAttrOrComment(ImplItem item) {
        for (SyntaxElement child : item.syntax().childrenWithTokens()) {
            if (child.getKind() == SyntaxKind.ATTR || child.getKind() == SyntaxKind.COMMENT) {
                return child;
            }
        }
        return null;
    }
}
