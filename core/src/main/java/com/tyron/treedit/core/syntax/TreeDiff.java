package com.tyron.treedit.core.syntax;

import com.tyron.treedit.api.text.TextEdit;
import com.tyron.treedit.api.text.TextEditBuilder;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Computes the text replacements that turn one version of a subtree into another.
 * <p>
 * Both trees are walked in lock step. Shared green elements are skipped without looking at them, tokens are
 * compared by text and nodes whose children line up kind by kind are compared child by child. Anything else
 * is replaced as a whole. The replacements come out in document order and never overlap.
 */
public final class TreeDiff {

    /**
     * One replacement: the text of {@code from} (in the old tree) becomes the text of {@code to}.
     */
    public record Replacement(SyntaxElement from, SyntaxElement to) {
    }

    private TreeDiff() {
    }

    @NotNull
    public static List<Replacement> diff(@NotNull SyntaxElement from, @NotNull SyntaxElement to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        List<Replacement> out = new ArrayList<>();
        go(from, to, out);
        return out;
    }

    /**
     * Writes the difference between {@code from} and {@code to} into {@code builder}, using offsets of the
     * tree {@code from} belongs to.
     */
    public static void diff(@NotNull SyntaxElement from, @NotNull SyntaxElement to, @NotNull TextEditBuilder builder) {
        for (Replacement replacement : diff(from, to)) {
            builder.replace(replacement.from().getTextRange(), replacement.to().getText());
        }
    }

    @NotNull
    public static TextEdit textEdit(@NotNull SyntaxElement from, @NotNull SyntaxElement to) {
        TextEditBuilder builder = new TextEditBuilder();
        diff(from, to, builder);
        return builder.finish();
    }

    private static void go(SyntaxElement from, SyntaxElement to, List<Replacement> out) {
        if (from.getGreen() == to.getGreen()) {
            return;
        }
        if (from instanceof SyntaxToken fromToken && to instanceof SyntaxToken toToken) {
            if (!fromToken.getText().equals(toToken.getText())) {
                out.add(new Replacement(from, to));
            }
            return;
        }
        if (from instanceof SyntaxNode fromNode && to instanceof SyntaxNode toNode
                && fromNode.getKind() == toNode.getKind()
                && sameChildKinds(fromNode.getGreen(), toNode.getGreen())) {
            List<SyntaxElement> fromChildren = fromNode.childrenWithTokens();
            List<SyntaxElement> toChildren = toNode.childrenWithTokens();
            for (int i = 0; i < fromChildren.size(); i++) {
                go(fromChildren.get(i), toChildren.get(i), out);
            }
            return;
        }
        out.add(new Replacement(from, to));
    }

    private static boolean sameChildKinds(GreenNode from, GreenNode to) {
        List<GreenElement> a = from.getChildren();
        List<GreenElement> b = to.getChildren();
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (a.get(i).getKind() != b.get(i).getKind()) {
                return false;
            }
        }
        return true;
    }
}
