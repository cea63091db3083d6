package com.tyron.treedit.assists;

import com.tyron.treedit.api.syntax.InsertPosition;
import com.tyron.treedit.api.syntax.SyntaxKind;
import com.tyron.treedit.core.format.Indentation;
import com.tyron.treedit.core.syntax.InvalidAnchorException;
import com.tyron.treedit.core.syntax.SyntaxElement;
import com.tyron.treedit.core.syntax.ast.AstNodes;
import com.tyron.treedit.core.syntax.ast.RecordField;
import com.tyron.treedit.core.syntax.ast.RecordFieldList;
import com.tyron.treedit.core.syntax.ast.SyntaxFactory;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Adds fields to a record field list, following the layout the list already has.
 * <p>
 * In a list that spans several lines every new field goes on its own line, one level deeper than the list,
 * and is followed by a comma. In a single line list fields are separated by {@code ", "} and the last field
 * gets no trailing comma.
 */
public class RecordFieldListEditor extends AstEditor<RecordFieldList> {

    private static final Logger LOG = Logger.getLogger(RecordFieldListEditor.class.getName());

    public RecordFieldListEditor(@NotNull RecordFieldList fieldList) {
        super(fieldList);
    }

    public RecordFieldListEditor(@NotNull RecordFieldList fieldList, @NotNull FormattingOptions options) {
        super(fieldList, options);
    }

    public void appendField(@NotNull RecordField field) {
        insertField(InsertPosition.last(), field);
    }

    /**
     * @throws InvalidAnchorException if a before/after anchor is not a field of the current list
     */
    public void insertField(@NotNull InsertPosition<RecordField> position, @NotNull RecordField field) {
        edit(list -> insertField(list, position, field));
    }

    private RecordFieldList insertField(RecordFieldList list, InsertPosition<RecordField> position, RecordField field) {
        Anchor anchor = resolve(list, position);
        if (anchor == null) {
            LOG.fine("recordFieldList action=insertField result=skip reason=noLCurly");
            return list;
        }

        List<SyntaxElement> toInsert = new ArrayList<>(5);
        if (anchor.needsComma) {
            toInsert.add(SyntaxFactory.comma());
        }

        if (Indentation.isMultiline(list.syntax())) {
            String indent = Indentation.leadingIndentOrEmpty(list.syntax()) + getOptions().getIndentUnit();
            toInsert.add(SyntaxFactory.whitespace("\n" + indent));
            toInsert.add(field.syntax());
            toInsert.add(SyntaxFactory.comma());
        } else {
            toInsert.add(SyntaxFactory.singleSpace());
            toInsert.add(field.syntax());
            SyntaxElement next = anchor.element.nextSiblingOrToken();
            if (fieldFollows(anchor.element)) {
                toInsert.add(SyntaxFactory.comma());
            } else if (next == null || next.getKind() != SyntaxKind.WHITESPACE) {
                toInsert.add(SyntaxFactory.singleSpace());
            }
        }

        return AstNodes.insertChildren(list, InsertPosition.after(anchor.element), toInsert);
    }

    private Anchor resolve(RecordFieldList list, InsertPosition<RecordField> position) {
        if (position instanceof InsertPosition.First) {
            return afterLCurly(list);
        }
        List<RecordField> fields = list.fields();
        if (position instanceof InsertPosition.Last) {
            return fields.isEmpty() ? afterLCurly(list) : afterField(fields.get(fields.size() - 1));
        }
        if (position instanceof InsertPosition.Before<RecordField> before) {
            int index = indexOf(list, fields, before.anchor());
            return index == 0 ? afterLCurly(list) : afterField(fields.get(index - 1));
        }
        RecordField after = ((InsertPosition.After<RecordField>) position).anchor();
        indexOf(list, fields, after);
        return afterField(after);
    }

    private static int indexOf(RecordFieldList list, List<RecordField> fields, RecordField field) {
        int index = fields.indexOf(field);
        if (index < 0) {
            throw new InvalidAnchorException(field.syntax(), list.syntax());
        }
        return index;
    }

    private static Anchor afterLCurly(RecordFieldList list) {
        SyntaxElement lCurly = list.lCurly();
        return lCurly == null ? null : new Anchor(lCurly, false);
    }

    /**
     * Anchors after the comma that terminates {@code field}, or after the field itself when it has none; in
     * the latter case the field gets a fresh comma before anything else is inserted.
     */
    private static Anchor afterField(RecordField field) {
        for (SyntaxElement sibling = field.syntax().nextSiblingOrToken(); sibling != null; sibling = sibling.nextSiblingOrToken()) {
            if (sibling.getKind() == SyntaxKind.COMMA) {
                return new Anchor(sibling, false);
            }
            if (sibling.getKind() == SyntaxKind.RECORD_FIELD) {
                break;
            }
        }
        return new Anchor(field.syntax(), true);
    }

    private static boolean fieldFollows(SyntaxElement anchor) {
        for (SyntaxElement sibling = anchor.nextSiblingOrToken(); sibling != null; sibling = sibling.nextSiblingOrToken()) {
            if (sibling.getKind() == SyntaxKind.RECORD_FIELD) {
                return true;
            }
        }
        return false;
    }

    private record Anchor(SyntaxElement element, boolean needsComma) {
    }
}
