package com.tyron.treedit.core.syntax;

import com.tyron.treedit.api.syntax.Direction;
import com.tyron.treedit.api.syntax.SyntaxKind;
import com.tyron.treedit.api.syntax.TextRange;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A positioned view of a {@link GreenElement} inside one tree snapshot.
 * <p>
 * Cursors are cheap and created on demand while navigating. Two cursors are equal when they denote the same
 * green element at the same slot of the same tree: the parents are equal, the index in the parent is the same
 * and the green element is the same object. Roots are only equal to themselves, so cursors from different
 * tree snapshots never compare equal even when their text is identical.
 */
public abstract sealed class SyntaxElement permits SyntaxNode, SyntaxToken {

    private final SyntaxNode parent;
    private final int indexInParent;
    private final int offset;

    SyntaxElement(SyntaxNode parent, int indexInParent, int offset) {
        this.parent = parent;
        this.indexInParent = indexInParent;
        this.offset = offset;
    }

    @NotNull
    public abstract GreenElement getGreen();

    public SyntaxKind getKind() {
        return getGreen().getKind();
    }

    @Nullable
    public SyntaxNode getParent() {
        return parent;
    }

    /**
     * @return the index among the parent's children (tokens included), or {@code -1} for a root
     */
    public int getIndexInParent() {
        return indexInParent;
    }

    @NotNull
    public TextRange getTextRange() {
        return TextRange.offsetLength(offset, getGreen().getTextLength());
    }

    @NotNull
    public String getText() {
        return getGreen().getText();
    }

    @NotNull
    public SyntaxNode getRoot() {
        SyntaxElement cur = this;
        while (cur.parent != null) {
            cur = cur.parent;
        }
        return (SyntaxNode) cur;
    }

    public boolean isNode() {
        return this instanceof SyntaxNode;
    }

    public boolean isToken() {
        return this instanceof SyntaxToken;
    }

    @Nullable
    public SyntaxNode asNode() {
        return this instanceof SyntaxNode node ? node : null;
    }

    @Nullable
    public SyntaxToken asToken() {
        return this instanceof SyntaxToken token ? token : null;
    }

    @Nullable
    public SyntaxElement nextSiblingOrToken() {
        if (parent == null) return null;
        int next = indexInParent + 1;
        return next < parent.getGreen().getChildren().size() ? parent.childAt(next) : null;
    }

    @Nullable
    public SyntaxElement prevSiblingOrToken() {
        if (parent == null || indexInParent == 0) return null;
        return parent.childAt(indexInParent - 1);
    }

    /**
     * @return this element followed by its siblings in the given direction
     */
    @NotNull
    public List<SyntaxElement> siblingsWithTokens(Direction direction) {
        List<SyntaxElement> result = new ArrayList<>();
        SyntaxElement cur = this;
        while (cur != null) {
            result.add(cur);
            cur = direction == Direction.NEXT ? cur.nextSiblingOrToken() : cur.prevSiblingOrToken();
        }
        return result;
    }

    @NotNull
    public List<SyntaxNode> ancestors() {
        List<SyntaxNode> result = new ArrayList<>();
        SyntaxNode cur = parent;
        while (cur != null) {
            result.add(cur);
            cur = cur.getParent();
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SyntaxElement other)) return false;
        if (getGreen() != other.getGreen() || offset != other.offset || indexInParent != other.indexInParent) {
            return false;
        }
        // roots are identity-compared, everything below by slot
        return parent != null && parent.equals(other.parent);
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(getGreen()) * 31 + offset;
    }

    @Override
    public String toString() {
        return getKind() + "@" + getTextRange();
    }
}
