package com.tyron.treedit.core.syntax;

import com.tyron.treedit.api.syntax.SyntaxKind;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

public final class SyntaxNode extends SyntaxElement {

    private final GreenNode green;

    private SyntaxNode(SyntaxNode parent, int indexInParent, int offset, GreenNode green) {
        super(parent, indexInParent, offset);
        this.green = green;
    }

    /**
     * Creates the root of a new tree snapshot. Every call creates a distinct tree, even for the same green node.
     */
    public static SyntaxNode newRoot(GreenNode green) {
        return new SyntaxNode(null, -1, 0, green);
    }

    @NotNull
    @Override
    public GreenNode getGreen() {
        return green;
    }

    public int getChildCount() {
        return green.getChildren().size();
    }

    @NotNull
    public SyntaxElement childAt(int index) {
        List<GreenElement> children = green.getChildren();
        int offset = getTextRange().startOffset();
        for (int i = 0; i < index; i++) {
            offset += children.get(i).getTextLength();
        }
        return wrap(index, offset, children.get(index));
    }

    @NotNull
    public List<SyntaxElement> childrenWithTokens() {
        List<GreenElement> children = green.getChildren();
        List<SyntaxElement> result = new ArrayList<>(children.size());
        int offset = getTextRange().startOffset();
        for (int i = 0; i < children.size(); i++) {
            GreenElement child = children.get(i);
            result.add(wrap(i, offset, child));
            offset += child.getTextLength();
        }
        return result;
    }

    @NotNull
    public List<SyntaxNode> children() {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxElement child : childrenWithTokens()) {
            if (child instanceof SyntaxNode node) {
                result.add(node);
            }
        }
        return result;
    }

    @Nullable
    public SyntaxElement firstChildOrToken() {
        return getChildCount() == 0 ? null : childAt(0);
    }

    @Nullable
    public SyntaxElement lastChildOrToken() {
        return getChildCount() == 0 ? null : childAt(getChildCount() - 1);
    }

    @Nullable
    public SyntaxElement findChildOrToken(SyntaxKind kind) {
        for (SyntaxElement child : childrenWithTokens()) {
            if (child.getKind() == kind) {
                return child;
            }
        }
        return null;
    }

    @Nullable
    public SyntaxToken findChildToken(SyntaxKind kind) {
        SyntaxElement element = findChildOrToken(kind);
        return element instanceof SyntaxToken token ? token : null;
    }

    @Nullable
    public SyntaxNode findChildNode(SyntaxKind kind) {
        SyntaxElement element = findChildOrToken(kind);
        return element instanceof SyntaxNode node ? node : null;
    }

    @Nullable
    public SyntaxToken firstToken() {
        for (SyntaxElement child : childrenWithTokens()) {
            SyntaxToken token = child instanceof SyntaxNode node ? node.firstToken() : (SyntaxToken) child;
            if (token != null) {
                return token;
            }
        }
        return null;
    }

    @Nullable
    public SyntaxToken lastToken() {
        List<SyntaxElement> children = childrenWithTokens();
        for (int i = children.size() - 1; i >= 0; i--) {
            SyntaxElement child = children.get(i);
            SyntaxToken token = child instanceof SyntaxNode node ? node.lastToken() : (SyntaxToken) child;
            if (token != null) {
                return token;
            }
        }
        return null;
    }

    /**
     * @return this node and all of its descendants in preorder
     */
    @NotNull
    public List<SyntaxElement> descendantsWithTokens() {
        List<SyntaxElement> result = new ArrayList<>();
        collect(this, result);
        return result;
    }

    private static void collect(SyntaxElement element, List<SyntaxElement> out) {
        out.add(element);
        if (element instanceof SyntaxNode node) {
            for (SyntaxElement child : node.childrenWithTokens()) {
                collect(child, out);
            }
        }
    }

    /**
     * Puts {@code replacement} in the place of this node and rebuilds the ancestor chain up to a new root.
     * Green siblings of every rebuilt ancestor are reused as they are.
     *
     * @return the node occupying this node's slot in the new tree
     */
    @NotNull
    public SyntaxNode replaceWith(@NotNull GreenNode replacement) {
        SyntaxNode parent = getParent();
        if (parent == null) {
            return newRoot(replacement);
        }
        SyntaxNode newParent = parent.replaceWith(parent.green.replaceChild(getIndexInParent(), replacement));
        return (SyntaxNode) newParent.childAt(getIndexInParent());
    }

    private SyntaxElement wrap(int index, int offset, GreenElement child) {
        if (child instanceof GreenNode node) {
            return new SyntaxNode(this, index, offset, node);
        }
        return new SyntaxToken(this, index, offset, (GreenToken) child);
    }

    /**
     * Renders the subtree as an indented outline, one element per line.
     */
    @NotNull
    public String debugDump() {
        StringBuilder sb = new StringBuilder();
        dump(this, 0, sb);
        return sb.toString();
    }

    private static void dump(SyntaxElement element, int depth, StringBuilder out) {
        out.append("  ".repeat(depth)).append(element);
        if (element instanceof SyntaxToken token) {
            out.append(' ').append('"').append(token.getText().replace("\n", "\\n")).append('"');
        }
        out.append('\n');
        if (element instanceof SyntaxNode node) {
            for (SyntaxElement child : node.childrenWithTokens()) {
                dump(child, depth + 1, out);
            }
        }
    }
}
