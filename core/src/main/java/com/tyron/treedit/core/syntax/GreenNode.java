package com.tyron.treedit.core.syntax;

import com.tyron.treedit.api.syntax.SyntaxKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class GreenNode implements GreenElement {

    private final SyntaxKind kind;
    private final List<GreenElement> children;
    private final int textLength;

    public GreenNode(SyntaxKind kind, List<? extends GreenElement> children) {
        this.kind = Objects.requireNonNull(kind, "kind");
        if (!kind.isNode()) {
            throw new IllegalArgumentException("not a node kind: " + kind);
        }
        List<GreenElement> copy = new ArrayList<>(children.size());
        int length = 0;
        for (GreenElement child : children) {
            copy.add(Objects.requireNonNull(child, "child"));
            length += child.getTextLength();
        }
        this.children = Collections.unmodifiableList(copy);
        this.textLength = length;
    }

    @Override
    public SyntaxKind getKind() {
        return kind;
    }

    public List<GreenElement> getChildren() {
        return children;
    }

    @Override
    public int getTextLength() {
        return textLength;
    }

    @Override
    public void appendText(StringBuilder out) {
        for (GreenElement child : children) {
            child.appendText(out);
        }
    }

    /**
     * @return a node of the same kind with the given children; the children themselves are shared, not copied
     */
    public GreenNode withChildren(List<? extends GreenElement> newChildren) {
        return new GreenNode(kind, newChildren);
    }

    public GreenNode replaceChild(int index, GreenElement replacement) {
        List<GreenElement> newChildren = new ArrayList<>(children);
        newChildren.set(index, replacement);
        return new GreenNode(kind, newChildren);
    }

    @Override
    public String toString() {
        return kind + "@" + textLength;
    }
}
