package com.tyron.treedit.core.syntax;

import com.tyron.treedit.api.syntax.SyntaxKind;

import java.util.Objects;

public final class GreenToken implements GreenElement {

    private final SyntaxKind kind;
    private final String text;

    public GreenToken(SyntaxKind kind, String text) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = Objects.requireNonNull(text, "text");
        if (kind.isNode()) {
            throw new IllegalArgumentException("not a token kind: " + kind);
        }
    }

    @Override
    public SyntaxKind getKind() {
        return kind;
    }

    @Override
    public int getTextLength() {
        return text.length();
    }

    @Override
    public void appendText(StringBuilder out) {
        out.append(text);
    }

    @Override
    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return kind + "@" + '"' + text + '"';
    }
}
