package com.tyron.treedit.core.syntax.ast;

import com.tyron.treedit.api.syntax.SyntaxKind;
import com.tyron.treedit.core.syntax.SyntaxNode;
import com.tyron.treedit.core.syntax.SyntaxToken;
import com.tyron.treedit.core.syntax.SyntaxTreeBuilder;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Creates fresh, detached syntax for insertion into other trees.
 * <p>
 * Tokens are returned as children of a throwaway {@link SyntaxKind#SOURCE_FILE} root; nodes are roots of their
 * own tree.
 */
public final class SyntaxFactory {

    private SyntaxFactory() {
    }

    /**
     * @throws IllegalArgumentException if {@code text} contains anything but whitespace
     */
    @NotNull
    public static SyntaxToken whitespace(@NotNull String text) {
        Objects.requireNonNull(text, "text");
        if (text.isEmpty() || !text.isBlank()) {
            throw new IllegalArgumentException("not whitespace: '" + text + "'");
        }
        return token(SyntaxKind.WHITESPACE, text);
    }

    @NotNull
    public static SyntaxToken singleSpace() {
        return whitespace(" ");
    }

    @NotNull
    public static SyntaxToken singleNewline() {
        return whitespace("\n");
    }

    @NotNull
    public static SyntaxToken comma() {
        return token(SyntaxKind.COMMA);
    }

    @NotNull
    public static SyntaxToken colon() {
        return token(SyntaxKind.COLON);
    }

    @NotNull
    public static SyntaxToken token(@NotNull SyntaxKind kind) {
        return token(kind, kind.getFixedText());
    }

    @NotNull
    public static SyntaxToken token(@NotNull SyntaxKind kind, @NotNull String text) {
        SyntaxNode root = new SyntaxTreeBuilder()
                .startNode(SyntaxKind.SOURCE_FILE)
                .token(kind, text)
                .finishNode()
                .finishRoot();
        return (SyntaxToken) root.childAt(0);
    }

    /**
     * {@code name: type}
     */
    @NotNull
    public static RecordField recordField(@NotNull String name, @NotNull String type) {
        SyntaxTreeBuilder builder = new SyntaxTreeBuilder().startNode(SyntaxKind.RECORD_FIELD);
        name(builder, name);
        builder.token(SyntaxKind.COLON).token(SyntaxKind.WHITESPACE, " ");
        pathType(builder, type);
        return AstNodes.castOrThrow(RecordField.class, builder.finishNode().finishRoot());
    }

    /**
     * {@code {}}
     */
    @NotNull
    public static Block emptyBlock() {
        SyntaxNode root = new SyntaxTreeBuilder()
                .startNode(SyntaxKind.BLOCK)
                .token(SyntaxKind.L_CURLY)
                .token(SyntaxKind.R_CURLY)
                .finishNode()
                .finishRoot();
        return AstNodes.castOrThrow(Block.class, root);
    }

    /**
     * {@code fn name() {}}
     */
    @NotNull
    public static FnDef fnDef(@NotNull String name) {
        SyntaxTreeBuilder builder = new SyntaxTreeBuilder()
                .startNode(SyntaxKind.FN_DEF)
                .token(SyntaxKind.FN_KW)
                .token(SyntaxKind.WHITESPACE, " ");
        name(builder, name);
        builder.startNode(SyntaxKind.PARAM_LIST)
                .token(SyntaxKind.L_PAREN)
                .token(SyntaxKind.R_PAREN)
                .finishNode()
                .token(SyntaxKind.WHITESPACE, " ")
                .element(emptyBlock().syntax().getGreen())
                .finishNode();
        return AstNodes.castOrThrow(FnDef.class, builder.finishRoot());
    }

    @NotNull
    public static ImplItem implItem(@NotNull FnDef fn) {
        return AstNodes.castOrThrow(ImplItem.class, fn.syntax());
    }

    /**
     * {@code #[path]}
     */
    @NotNull
    public static Attr attr(@NotNull String path) {
        SyntaxTreeBuilder builder = new SyntaxTreeBuilder()
                .startNode(SyntaxKind.ATTR)
                .token(SyntaxKind.POUND)
                .token(SyntaxKind.L_BRACK);
        pathType(builder, path);
        builder.token(SyntaxKind.R_BRACK).finishNode();
        return AstNodes.castOrThrow(Attr.class, builder.finishRoot());
    }

    /**
     * {@code name: Bound1 + Bound2}, or just {@code name} without bounds.
     */
    @NotNull
    public static TypeParam typeParam(@NotNull String name, String... bounds) {
        SyntaxTreeBuilder builder = new SyntaxTreeBuilder().startNode(SyntaxKind.TYPE_PARAM);
        name(builder, name);
        if (bounds.length > 0) {
            builder.token(SyntaxKind.COLON)
                    .token(SyntaxKind.WHITESPACE, " ")
                    .startNode(SyntaxKind.TYPE_BOUND_LIST);
            for (int i = 0; i < bounds.length; i++) {
                if (i > 0) {
                    builder.token(SyntaxKind.WHITESPACE, " ")
                            .token(SyntaxKind.PLUS)
                            .token(SyntaxKind.WHITESPACE, " ");
                }
                builder.startNode(SyntaxKind.TYPE_BOUND);
                pathType(builder, bounds[i]);
                builder.finishNode();
            }
            builder.finishNode();
        }
        builder.finishNode();
        return AstNodes.castOrThrow(TypeParam.class, builder.finishRoot());
    }

    private static void name(SyntaxTreeBuilder builder, String name) {
        builder.startNode(SyntaxKind.NAME).token(SyntaxKind.IDENT, name).finishNode();
    }

    private static void pathType(SyntaxTreeBuilder builder, String type) {
        builder.startNode(SyntaxKind.PATH_TYPE)
                .startNode(SyntaxKind.NAME_REF)
                .token(SyntaxKind.IDENT, type)
                .finishNode()
                .finishNode();
    }
}
