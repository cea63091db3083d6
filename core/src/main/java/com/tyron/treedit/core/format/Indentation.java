package com.tyron.treedit.core.format;

import com.tyron.treedit.api.syntax.SyntaxKind;
import com.tyron.treedit.core.syntax.SyntaxNode;
import com.tyron.treedit.core.syntax.SyntaxToken;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Indentation lookups over the text surrounding a node.
 */
public final class Indentation {

    private Indentation() {
    }

    /**
     * Returns the indentation of the line on which {@code node} starts, found by walking back through the
     * preceding tokens to the closest whitespace that contains a line break.
     *
     * @return the text after the last line break of that whitespace, or {@code null} if the node starts on
     * the first line or is empty
     */
    @Nullable
    public static String leadingIndent(@NotNull SyntaxNode node) {
        SyntaxToken first = node.firstToken();
        if (first == null) {
            return null;
        }
        for (SyntaxToken token = first.prevToken(); token != null; token = token.prevToken()) {
            String text = token.getText();
            if (token.getKind() == SyntaxKind.WHITESPACE) {
                int pos = text.lastIndexOf('\n');
                if (pos >= 0) {
                    return text.substring(pos + 1);
                }
            }
            if (text.indexOf('\n') >= 0) {
                break;
            }
        }
        return null;
    }

    @NotNull
    public static String leadingIndentOrEmpty(@NotNull SyntaxNode node) {
        String indent = leadingIndent(node);
        return indent != null ? indent : "";
    }

    public static boolean isMultiline(@NotNull SyntaxNode node) {
        return node.getText().indexOf('\n') >= 0;
    }
}
