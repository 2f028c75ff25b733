package com.initialone.jyardify.patch;

import com.initialone.jyardify.model.EditDirective;
import com.initialone.jyardify.util.SourceText;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PatchApplierTest {

    private static final List<String> SOURCE = List.of(
            "class Foo",
            "  X = 1",
            "",
            "  def a",
            "    1",
            "  end",
            "",
            "  def b",
            "    2",
            "  end",
            "end");

    private final PatchApplier applier = new PatchApplier();

    private static EditDirective d(Integer line, String anchor, String comment) {
        return new EditDirective(line, anchor, 0, comment);
    }

    @Test
    void appliesRegardlessOfSubmissionOrder() {
        EditDirective a = d(4, "def a", "# Returns one");
        EditDirective b = d(8, "def b", "# Returns two\n# @return [Integer]");

        PatchResult forward = applier.apply(SOURCE, List.of(a, b));
        PatchResult backward = applier.apply(SOURCE, List.of(b, a));

        assertEquals(forward.lines(), backward.lines());
        assertEquals(List.of(
                "class Foo",
                "  X = 1",
                "",
                "  # Returns one",
                "  def a",
                "    1",
                "  end",
                "",
                "  # Returns two",
                "  # @return [Integer]",
                "  def b",
                "    2",
                "  end",
                "end"), forward.lines());
        assertEquals(2, forward.applied());
    }

    @Test
    void duplicateAnchorsInsertOnce() {
        PatchResult r = applier.apply(SOURCE, List.of(
                d(4, "def a", "# First"),
                d(4, "DEF A", "# Second")));

        assertEquals(1, r.applied());
        assertEquals(1, r.duplicates());
        assertEquals(SOURCE.size() + 1, r.lines().size());
        assertTrue(r.lines().contains("  # First"));
        assertFalse(r.lines().contains("  # Second"));
    }

    @Test
    void sameInputsGiveSameOutput() {
        List<EditDirective> ds = List.of(
                d(1, "class Foo", "# A foo"),
                d(2, "X", "# The x"),
                d(9, "def b", "# B"));

        assertEquals(applier.apply(SOURCE, ds).lines(), applier.apply(SOURCE, ds).lines());
    }

    @Test
    void lineCountGrowsByAppliedCommentLines() {
        List<EditDirective> ds = List.of(
                d(1, "class Foo", "# A foo\n#\n# @example\n#   Foo.new"),
                d(4, "def a", "# One"),
                d(8, "def missing", "# Never placed"),
                d(0, "def b", "# Invalid"));

        PatchResult r = applier.apply(SOURCE, ds);

        int expected = SOURCE.size();
        for (ResolvedInsertion ins : r.insertions()) {
            expected += SourceText.lineCount(ins.directive().comment);
        }
        assertEquals(expected, r.lines().size());
        assertEquals(SOURCE.size() + 5, r.lines().size());
        assertEquals(2, r.applied());
        assertEquals(1, r.unresolved());
        assertEquals(1, r.invalid());
    }

    @Test
    void malformedDirectivesAreDropped() {
        PatchResult r = applier.apply(SOURCE, List.of(
                d(null, "def a", "# no line"),
                d(4, "  ", "# blank anchor"),
                d(4, "def a", "   "),
                d(99, "def a", "# past the end"),
                d(-3, "def a", "# negative")));

        assertEquals(5, r.invalid());
        assertEquals(0, r.applied());
        assertEquals(SOURCE, r.lines());
    }

    @Test
    void collisionGoesToHigherDeclaredLine() {
        // both anchors resolve to "  def a"; line 5 is processed first and claims it
        PatchResult r = applier.apply(SOURCE, List.of(
                d(4, "def a", "# From line four"),
                d(5, "def a(x)", "# From line five")));

        assertEquals(1, r.applied());
        assertEquals(1, r.unresolved());
        assertEquals("  # From line five", r.lines().get(3));
        assertEquals("  def a", r.lines().get(4));
    }

    @Test
    void indentationCopiedFromMatchedLine() {
        List<String> src = List.of("module M", "\tdef t", "\tend", "end");

        PatchResult r = applier.apply(src, List.of(new EditDirective(2, "def t", 8, "# T\n\n# More")));

        assertEquals(List.of("module M", "\t# T", "", "\t# More", "\tdef t", "\tend", "end"), r.lines());
        assertEquals("\t", r.insertions().get(0).indent());
    }

    @Test
    void driftedDirectiveStillLands() {
        List<String> src = new ArrayList<>(SOURCE);

        PatchResult r = applier.apply(src, List.of(d(6, "def b", "# B")));

        assertEquals(MatchKind.NEAR, r.insertions().get(0).kind());
        assertEquals("  # B", r.lines().get(7));
        assertEquals("  def b", r.lines().get(8));
    }

    @Test
    void emptyDirectiveListLeavesSourceUntouched() {
        PatchResult r = applier.apply(SOURCE, List.of());

        assertEquals(SOURCE, r.lines());
        assertEquals(0, r.applied());
    }

    @Test
    void contentKeepsCrlfAndTrailingNewline() {
        String content = "class Foo\r\n  def a\r\n  end\r\nend\r\n";

        String out = applier.apply(content, List.of(d(2, "def a", "# A")));

        assertEquals("class Foo\r\n  # A\r\n  def a\r\n  end\r\nend\r\n", out);
    }
}
