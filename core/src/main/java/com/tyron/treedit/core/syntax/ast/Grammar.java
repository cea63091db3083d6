package com.tyron.treedit.core.syntax.ast;

import com.tyron.treedit.api.syntax.SyntaxKind;
import com.tyron.treedit.core.syntax.GreenElement;
import com.tyron.treedit.core.syntax.SyntaxNode;

import java.util.List;
import java.util.Set;

/**
 * Shape checks shared by the typed node categories.
 */
final class Grammar {

    private Grammar() {
    }

    static boolean childKindsWithin(SyntaxNode node, Set<SyntaxKind> allowed) {
        for (GreenElement child : node.getGreen().getChildren()) {
            if (!allowed.contains(child.getKind())) {
                return false;
            }
        }
        return true;
    }

    static boolean hasChild(SyntaxNode node, SyntaxKind kind) {
        return count(node, kind) > 0;
    }

    static int count(SyntaxNode node, SyntaxKind kind) {
        int n = 0;
        for (GreenElement child : node.getGreen().getChildren()) {
            if (child.getKind() == kind) {
                n++;
            }
        }
        return n;
    }

    /**
     * Checks a braced list: at most one opening and one closing delimiter, and every child that is not trivia
     * sits between them.
     */
    static boolean isDelimited(SyntaxNode node, SyntaxKind open, SyntaxKind close) {
        List<GreenElement> children = node.getGreen().getChildren();
        int openIndex = -1;
        int closeIndex = -1;
        for (int i = 0; i < children.size(); i++) {
            SyntaxKind kind = children.get(i).getKind();
            if (kind == open) {
                if (openIndex >= 0) return false;
                openIndex = i;
            } else if (kind == close) {
                if (closeIndex >= 0) return false;
                closeIndex = i;
            }
        }
        if (openIndex >= 0 && closeIndex >= 0 && closeIndex < openIndex) {
            return false;
        }
        for (int i = 0; i < children.size(); i++) {
            SyntaxKind kind = children.get(i).getKind();
            if (kind == open || kind == close || kind.isTrivia()) continue;
            if (openIndex >= 0 && i < openIndex) return false;
            if (closeIndex >= 0 && i > closeIndex) return false;
        }
        return true;
    }
}
