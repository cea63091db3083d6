package com.tyron.treedit.assists;

import com.tyron.treedit.api.syntax.InsertPosition;
import com.tyron.treedit.api.syntax.SyntaxKind;
import com.tyron.treedit.core.format.Indentation;
import com.tyron.treedit.core.syntax.SyntaxElement;
import com.tyron.treedit.core.syntax.SyntaxToken;
import com.tyron.treedit.core.syntax.ast.AstNodes;
import com.tyron.treedit.core.syntax.ast.ImplItem;
import com.tyron.treedit.core.syntax.ast.ItemList;
import com.tyron.treedit.core.syntax.ast.SyntaxFactory;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Appends items to the body of an impl block, one item per line.
 */
public class ItemListEditor extends AstEditor<ItemList> {

    public ItemListEditor(@NotNull ItemList itemList) {
        super(itemList);
    }

    public ItemListEditor(@NotNull ItemList itemList, @NotNull FormattingOptions options) {
        super(itemList, options);
    }

    /**
     * Appends all {@code items} in order. A body written on one line first gets a line break after its opening brace.
     */
    public void appendItems(@NotNull List<ImplItem> items) {
        edit(list -> {
            ItemList current = list;
            if (!Indentation.isMultiline(current.syntax())) {
                current = makeMultiline(current);
            }
            for (ImplItem item : items) {
                current = appendItem(current, item);
            }
            return current;
        });
    }

    public void appendItem(@NotNull ImplItem item) {
        edit(list -> appendItem(list, item));
    }

    private ItemList appendItem(ItemList list, ImplItem item) {
        List<ImplItem> items = list.implItems();
        String indent;
        SyntaxElement anchor;
        if (!items.isEmpty()) {
            ImplItem last = items.get(items.size() - 1);
            indent = Indentation.leadingIndentOrEmpty(last.syntax());
            anchor = last.syntax();
        } else {
            anchor = list.lCurly();
            if (anchor == null) {
                return list;
            }
            indent = getOptions().getIndentUnit() + Indentation.leadingIndentOrEmpty(list.syntax());
        }
        List<SyntaxElement> toInsert = List.of(SyntaxFactory.whitespace("\n" + indent), item.syntax());
        return AstNodes.insertChildren(list, InsertPosition.after(anchor), toInsert);
    }

    /**
     * Puts a line break right after the opening brace, turning whitespace already there into the break.
     */
    private static ItemList makeMultiline(ItemList list) {
        SyntaxToken lCurly = list.lCurly();
        if (lCurly == null) {
            return list;
        }
        SyntaxElement sibling = lCurly.nextSiblingOrToken();
        if (sibling == null) {
            return list;
        }

        SyntaxToken ws = SyntaxFactory.whitespace("\n" + Indentation.leadingIndentOrEmpty(list.syntax()));
        if (sibling.getKind() == SyntaxKind.WHITESPACE) {
            if (sibling.getText().indexOf('\n') >= 0) {
                return list;
            }
            return AstNodes.replaceChildren(list, sibling, sibling, List.of(ws));
        }
        return AstNodes.insertChildren(list, InsertPosition.after(lCurly), List.of(ws));
    }
}
