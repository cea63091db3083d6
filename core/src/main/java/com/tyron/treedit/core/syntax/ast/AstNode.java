package com.tyron.treedit.core.syntax.ast;

import com.tyron.treedit.api.syntax.SyntaxKind;
import com.tyron.treedit.core.syntax.SyntaxElement;
import com.tyron.treedit.core.syntax.SyntaxNode;
import com.tyron.treedit.core.syntax.SyntaxToken;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Typed view over a {@link SyntaxNode} of a known grammar category.
 * <p>
 * Instances are only created through the {@code cast} factory of each subclass, which checks the node kind and
 * the minimal shape the category needs.
 */
public abstract class AstNode {

    private final SyntaxNode syntax;

    protected AstNode(SyntaxNode syntax) {
        this.syntax = Objects.requireNonNull(syntax, "syntax");
    }

    @NotNull
    public SyntaxNode syntax() {
        return syntax;
    }

    @NotNull
    public String getText() {
        return syntax.getText();
    }

    @Nullable
    protected SyntaxToken token(SyntaxKind kind) {
        return syntax.findChildToken(kind);
    }

    @Nullable
    protected <N extends AstNode> N child(Function<SyntaxNode, N> caster) {
        for (SyntaxNode child : syntax.children()) {
            N cast = caster.apply(child);
            if (cast != null) {
                return cast;
            }
        }
        return null;
    }

    @NotNull
    protected <N extends AstNode> List<N> children(Function<SyntaxNode, N> caster) {
        List<N> result = new ArrayList<>();
        for (SyntaxNode child : syntax.children()) {
            N cast = caster.apply(child);
            if (cast != null) {
                result.add(cast);
            }
        }
        return result;
    }

    @NotNull
    public List<Attr> attrs() {
        return children(Attr::cast);
    }

    /**
     * @return comment tokens that are direct children of this node, doc comments included
     */
    @NotNull
    public List<SyntaxToken> comments() {
        List<SyntaxToken> result = new ArrayList<>();
        for (SyntaxElement child : syntax.childrenWithTokens()) {
            if (child.getKind() == SyntaxKind.COMMENT) {
                result.add((SyntaxToken) child);
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return syntax.equals(((AstNode) o).syntax);
    }

    @Override
    public int hashCode() {
        return syntax.hashCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + syntax + ")";
    }
}
