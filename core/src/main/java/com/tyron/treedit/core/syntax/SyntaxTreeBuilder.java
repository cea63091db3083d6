package com.tyron.treedit.core.syntax;

import com.tyron.treedit.api.syntax.SyntaxKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Builds green trees from a flat sequence of start/token/finish events.
 */
public final class SyntaxTreeBuilder {

    private final Deque<SyntaxKind> kinds = new ArrayDeque<>();
    private final Deque<List<GreenElement>> children = new ArrayDeque<>();
    private GreenNode result;

    public SyntaxTreeBuilder startNode(SyntaxKind kind) {
        if (result != null) {
            throw new IllegalStateException("tree already finished");
        }
        kinds.push(kind);
        children.push(new ArrayList<>());
        return this;
    }

    public SyntaxTreeBuilder token(SyntaxKind kind, String text) {
        return element(new GreenToken(kind, text));
    }

    /**
     * Adds a token whose text is fixed by its kind, such as punctuation or a keyword.
     */
    public SyntaxTreeBuilder token(SyntaxKind kind) {
        String text = kind.getFixedText();
        if (text == null) {
            throw new IllegalArgumentException(kind + " has no fixed text");
        }
        return token(kind, text);
    }

    /**
     * Adds an already built element, shared by reference.
     */
    public SyntaxTreeBuilder element(GreenElement element) {
        if (children.isEmpty()) {
            throw new IllegalStateException("no open node");
        }
        children.peek().add(element);
        return this;
    }

    public SyntaxTreeBuilder finishNode() {
        if (kinds.isEmpty()) {
            throw new IllegalStateException("no open node");
        }
        GreenNode node = new GreenNode(kinds.pop(), children.pop());
        if (children.isEmpty()) {
            result = node;
        } else {
            children.peek().add(node);
        }
        return this;
    }

    public GreenNode finish() {
        if (result == null || !kinds.isEmpty()) {
            throw new IllegalStateException("unbalanced tree: " + kinds.size() + " node(s) still open");
        }
        return result;
    }

    public SyntaxNode finishRoot() {
        return SyntaxNode.newRoot(finish());
    }
}
