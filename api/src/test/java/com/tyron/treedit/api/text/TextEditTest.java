package com.tyron.treedit.api.text;

import com.tyron.treedit.api.syntax.TextRange;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class TextEditTest {

    @Test
    public void builderSortsAtomsByStartOffset() {
        TextEdit edit = new TextEditBuilder()
                .replace(TextRange.of(10, 12), "b")
                .insert(3, "a")
                .delete(TextRange.of(5, 6))
                .finish();

        List<AtomTextEdit> atoms = edit.getAtoms();
        Assertions.assertEquals(3, atoms.size());
        Assertions.assertEquals(3, atoms.get(0).delete().startOffset());
        Assertions.assertEquals(5, atoms.get(1).delete().startOffset());
        Assertions.assertEquals(10, atoms.get(2).delete().startOffset());
    }

    @Test
    public void overlappingReplacementsAreRejected() {
        TextEditBuilder builder = new TextEditBuilder()
                .replace(TextRange.of(0, 5), "x")
                .replace(TextRange.of(4, 8), "y");

        Assertions.assertThrows(IllegalStateException.class, builder::finish);
    }

    @Test
    public void adjacentReplacementsAreAllowed() {
        TextEdit edit = new TextEditBuilder()
                .replace(TextRange.of(0, 3), "one")
                .replace(TextRange.of(3, 6), "two")
                .finish();

        Assertions.assertEquals("onetwo!", edit.apply("abcdef!"));
    }

    @Test
    public void applyUsesOffsetsOfTheOriginalText() {
        String text = "struct S { a: i32 }";
        TextEdit edit = new TextEditBuilder()
                .insert(17, ", b: i32")
                .replace(TextRange.of(7, 8), "Point")
                .finish();

        Assertions.assertEquals("struct Point { a: i32, b: i32 }", edit.apply(text));
    }

    @Test
    public void emptyEditLeavesTextAlone() {
        TextEdit edit = new TextEditBuilder().finish();

        Assertions.assertTrue(edit.isEmpty());
        Assertions.assertSame(TextEdit.empty(), edit);
        Assertions.assertEquals("fn f() {}", edit.apply("fn f() {}"));
    }

    @Test
    public void applyRejectsRangesPastTheEnd() {
        TextEdit edit = new TextEditBuilder().replace(TextRange.of(2, 10), "x").finish();

        Assertions.assertThrows(IndexOutOfBoundsException.class, () -> edit.apply("abc"));
    }

    @Test
    public void invalidRangesCannotBeCreated() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> TextRange.of(5, 2));
        Assertions.assertThrows(IllegalArgumentException.class, () -> TextRange.of(-1, 2));
    }
}
