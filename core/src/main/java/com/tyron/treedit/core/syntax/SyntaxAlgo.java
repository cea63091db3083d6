package com.tyron.treedit.core.syntax;

import com.tyron.treedit.api.syntax.InsertPosition;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structural edits over immutable syntax trees.
 * <p>
 * Every operation returns the edited node inside a freshly rooted tree; the input tree is never modified.
 * Only the ancestor chain of the edited node is rebuilt, every other green subtree is shared by reference.
 * Elements to insert may come from any tree, only their green element is used.
 */
public final class SyntaxAlgo {

    private SyntaxAlgo() {
    }

    /**
     * Inserts {@code toInsert} among the direct children of {@code parent}.
     *
     * @throws InvalidAnchorException if the position's anchor is not a child of {@code parent}
     */
    @NotNull
    public static SyntaxNode insertChildren(@NotNull SyntaxNode parent,
                                            @NotNull InsertPosition<SyntaxElement> position,
                                            @NotNull List<? extends SyntaxElement> toInsert) {
        Objects.requireNonNull(parent, "parent");
        Objects.requireNonNull(position, "position");

        List<GreenElement> oldChildren = parent.getGreen().getChildren();
        int index;
        if (position instanceof InsertPosition.First) {
            index = 0;
        } else if (position instanceof InsertPosition.Last) {
            index = oldChildren.size();
        } else if (position instanceof InsertPosition.Before<SyntaxElement> before) {
            index = childIndex(parent, before.anchor());
        } else {
            index = childIndex(parent, ((InsertPosition.After<SyntaxElement>) position).anchor()) + 1;
        }

        List<GreenElement> newChildren = new ArrayList<>(oldChildren.size() + toInsert.size());
        newChildren.addAll(oldChildren.subList(0, index));
        for (SyntaxElement element : toInsert) {
            newChildren.add(element.getGreen());
        }
        newChildren.addAll(oldChildren.subList(index, oldChildren.size()));
        return parent.replaceWith(parent.getGreen().withChildren(newChildren));
    }

    /**
     * Replaces the inclusive run of children {@code [first, last]} of {@code parent} with {@code toInsert}.
     *
     * @throws InvalidRangeException if a boundary is not a child of {@code parent} or {@code first} follows {@code last}
     */
    @NotNull
    public static SyntaxNode replaceChildren(@NotNull SyntaxNode parent,
                                             @NotNull SyntaxElement first,
                                             @NotNull SyntaxElement last,
                                             @NotNull List<? extends SyntaxElement> toInsert) {
        Objects.requireNonNull(parent, "parent");
        if (!isChildOf(first, parent) || !isChildOf(last, parent)) {
            throw new InvalidRangeException("range " + first + "..=" + last + " is not made of children of " + parent);
        }
        int start = first.getIndexInParent();
        int end = last.getIndexInParent();
        if (start > end) {
            throw new InvalidRangeException("range start " + first + " follows its end " + last);
        }

        List<GreenElement> oldChildren = parent.getGreen().getChildren();
        List<GreenElement> newChildren = new ArrayList<>(oldChildren.size() - (end - start + 1) + toInsert.size());
        newChildren.addAll(oldChildren.subList(0, start));
        for (SyntaxElement element : toInsert) {
            newChildren.add(element.getGreen());
        }
        newChildren.addAll(oldChildren.subList(end + 1, oldChildren.size()));
        return parent.replaceWith(parent.getGreen().withChildren(newChildren));
    }

    /**
     * Replaces every descendant of {@code root} (and {@code root} itself) that is a key of {@code replacements}.
     * Keys are matched by tree identity, so only elements obtained from the same tree snapshot can match.
     * When both an element and one of its descendants are keys, the outer replacement wins.
     *
     * @throws InvalidStructureException if {@code root} would be replaced by a token
     */
    @NotNull
    public static SyntaxNode replaceDescendants(@NotNull SyntaxNode root,
                                                @NotNull Map<? extends SyntaxElement, ? extends SyntaxElement> replacements) {
        Objects.requireNonNull(root, "root");
        if (replacements.isEmpty()) {
            return root;
        }
        GreenElement newGreen = rewrite(root, replacements);
        if (newGreen == root.getGreen()) {
            return root;
        }
        if (!(newGreen instanceof GreenNode node)) {
            throw new InvalidStructureException("cannot replace node " + root + " with token " + newGreen);
        }
        return root.replaceWith(node);
    }

    private static GreenElement rewrite(SyntaxElement element, Map<? extends SyntaxElement, ? extends SyntaxElement> replacements) {
        SyntaxElement replacement = replacements.get(element);
        if (replacement != null) {
            return replacement.getGreen();
        }
        if (!(element instanceof SyntaxNode node)) {
            return element.getGreen();
        }

        List<GreenElement> oldChildren = node.getGreen().getChildren();
        List<GreenElement> newChildren = new ArrayList<>(oldChildren.size());
        boolean changed = false;
        for (SyntaxElement child : node.childrenWithTokens()) {
            GreenElement newChild = rewrite(child, replacements);
            changed |= newChild != child.getGreen();
            newChildren.add(newChild);
        }
        return changed ? node.getGreen().withChildren(newChildren) : node.getGreen();
    }

    private static int childIndex(SyntaxNode parent, SyntaxElement anchor) {
        if (!isChildOf(anchor, parent)) {
            throw new InvalidAnchorException(anchor, parent);
        }
        return anchor.getIndexInParent();
    }

    private static boolean isChildOf(SyntaxElement element, SyntaxNode parent) {
        return element != null && parent.equals(element.getParent());
    }
}
