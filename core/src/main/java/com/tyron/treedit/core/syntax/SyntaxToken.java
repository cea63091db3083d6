package com.tyron.treedit.core.syntax;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public final class SyntaxToken extends SyntaxElement {

    private final GreenToken green;

    SyntaxToken(SyntaxNode parent, int indexInParent, int offset, GreenToken green) {
        super(parent, indexInParent, offset);
        this.green = green;
    }

    @NotNull
    @Override
    public GreenToken getGreen() {
        return green;
    }

    @NotNull
    @Override
    public String getText() {
        return green.getText();
    }

    /**
     * @return the token preceding this one in the whole tree, crossing node boundaries
     */
    @Nullable
    public SyntaxToken prevToken() {
        SyntaxElement cur = this;
        while (cur != null) {
            SyntaxElement sibling = cur.prevSiblingOrToken();
            while (sibling != null) {
                SyntaxToken token = sibling instanceof SyntaxNode node ? node.lastToken() : (SyntaxToken) sibling;
                if (token != null) {
                    return token;
                }
                sibling = sibling.prevSiblingOrToken();
            }
            cur = cur.getParent();
        }
        return null;
    }

    /**
     * @return the token following this one in the whole tree, crossing node boundaries
     */
    @Nullable
    public SyntaxToken nextToken() {
        SyntaxElement cur = this;
        while (cur != null) {
            SyntaxElement sibling = cur.nextSiblingOrToken();
            while (sibling != null) {
                SyntaxToken token = sibling instanceof SyntaxNode node ? node.firstToken() : (SyntaxToken) sibling;
                if (token != null) {
                    return token;
                }
                sibling = sibling.nextSiblingOrToken();
            }
            cur = cur.getParent();
        }
        return null;
    }
}
