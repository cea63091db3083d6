package com.tyron.treedit.assists;

import com.tyron.treedit.api.text.TextEdit;
import com.tyron.treedit.api.text.TextEditBuilder;
import com.tyron.treedit.core.syntax.InvalidStructureException;
import com.tyron.treedit.core.syntax.SyntaxElement;
import com.tyron.treedit.core.syntax.TreeDiff;
import com.tyron.treedit.core.syntax.ast.AstNode;
import com.tyron.treedit.core.syntax.ast.AstNodes;
import org.jetbrains.annotations.NotNull;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Editing session over one typed node.
 * <p>
 * The node passed to the constructor is kept as the original and never touched again; every successful edit
 * replaces the current version wholesale. {@link #finish()} turns the difference between the two into a
 * {@link TextEdit} against the original text, {@link #discard()} drops the edits. Either call closes the
 * session.
 * <p>
 * Not thread-safe; a session belongs to a single caller.
 *
 * @param <N> category of the edited node
 */
public class AstEditor<N extends AstNode> {

    private static final Logger LOG = Logger.getLogger(AstEditor.class.getName());

    private final N originalAst;
    private final FormattingOptions options;
    private N ast;
    private boolean closed;

    public AstEditor(@NotNull N node) {
        this(node, FormattingOptions.getInstance());
    }

    public AstEditor(@NotNull N node, @NotNull FormattingOptions options) {
        this.originalAst = Objects.requireNonNull(node, "node");
        this.options = Objects.requireNonNull(options, "options");
        this.ast = node;
    }

    /**
     * @return the current version of the edited node
     */
    @NotNull
    public N ast() {
        return ast;
    }

    @NotNull
    public N getOriginalAst() {
        return originalAst;
    }

    @NotNull
    public FormattingOptions getOptions() {
        return options;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Replaces the current node with {@code edit.apply(current)}. If {@code edit} throws, the current node stays
     * as it was.
     *
     * @throws IllegalStateException if the session is closed
     * @throws InvalidStructureException if the edit returned a node of another category
     */
    public AstEditor<N> edit(@NotNull UnaryOperator<N> edit) {
        checkOpen();
        N next = Objects.requireNonNull(edit.apply(ast), "edit result");
        if (next.getClass() != ast.getClass()) {
            throw new InvalidStructureException("edit turned " + ast.getClass().getSimpleName()
                    + " into " + next.getClass().getSimpleName());
        }
        if (LOG.isLoggable(Level.FINER)) {
            LOG.finer("astEditor action=edit category=" + ast.getClass().getSimpleName()
                    + " oldLength=" + ast.getText().length() + " newLength=" + next.getText().length());
        }
        ast = next;
        return this;
    }

    /**
     * Replaces descendants of the current node, matched by tree identity. Keys must come from the current
     * version of the tree; keys from other trees are ignored.
     */
    public <T extends AstNode> AstEditor<N> replaceDescendants(@NotNull Map<T, ? extends T> replacements) {
        Map<SyntaxElement, SyntaxElement> map = new HashMap<>();
        for (Map.Entry<T, ? extends T> e : replacements.entrySet()) {
            map.put(e.getKey().syntax(), e.getValue().syntax());
        }
        return edit(current -> AstNodes.replaceDescendants(current, map));
    }

    /**
     * Writes the accumulated changes into {@code builder} and closes the session.
     */
    public void finish(@NotNull TextEditBuilder builder) {
        Objects.requireNonNull(builder, "builder");
        checkOpen();
        closed = true;

        List<TreeDiff.Replacement> replacements = TreeDiff.diff(originalAst.syntax(), ast.syntax());
        for (TreeDiff.Replacement replacement : replacements) {
            builder.replace(replacement.from().getTextRange(), replacement.to().getText());
        }

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("astEditor action=finish category=" + ast.getClass().getSimpleName()
                    + " replacements=" + replacements.size());
        }
    }

    @NotNull
    public TextEdit finish() {
        TextEditBuilder builder = new TextEditBuilder();
        finish(builder);
        return builder.finish();
    }

    /**
     * Closes the session without producing any change.
     */
    public void discard() {
        checkOpen();
        closed = true;
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("astEditor action=discard category=" + ast.getClass().getSimpleName());
        }
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("editing session for " + originalAst + " is already closed");
        }
    }
}
