// file: core/src/test/java/io/strata/core/merge/ThreeWayTextMergerTest.java
package io.strata.core.merge;

import io.strata.core.conflict.ConflictMarkers;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ThreeWayTextMergerTest {

    private final TextMerger merger = new ThreeWayTextMerger();

    @Test
    void non_overlapping_edits_merge_cleanly() {
        var result = merger.merge("a\nb\nc\nd\n", "a\nB\nc\nd\n", "a\nb\nc\nD\n");

        assertFalse(result.conflicted());
        assertEquals("a\nB\nc\nD\n", result.text());
    }

    @Test
    void overlapping_edits_produce_labelled_conflict() {
        var result = merger.merge("x\ny\nz", "x\nY1\nz", "x\nY2\nz", "global", "project/api");

        assertTrue(result.conflicted());
        assertEquals(1, result.regions().size());
        var region = result.regions().get(0);
        assertEquals("y", region.base());
        assertEquals("Y1", region.ours());
        assertEquals("Y2", region.theirs());
        assertEquals(2, region.startLine());
        assertEquals("x\n<<<<<<< global\nY1\n=======\nY2\n>>>>>>> project/api\nz", result.text());
        assertTrue(ConflictMarkers.hasMarkers(result.text()));
    }

    @Test
    void identical_edits_on_both_sides_are_not_a_conflict() {
        var result = merger.merge("a\nb\nc", "a\nB\nc\nd", "a\nB\nc");

        assertFalse(result.conflicted());
        assertEquals("a\nB\nc\nd", result.text());
    }

    @Test
    void insertions_at_different_positions_both_survive() {
        var result = merger.merge("a\nb", "0\na\nb", "a\nb\n9");

        assertFalse(result.conflicted());
        assertEquals("0\na\nb\n9", result.text());
    }

    @Test
    void different_insertions_at_same_position_conflict() {
        var result = merger.merge("a\nb", "a\nX\nb", "a\nY\nb");

        assertTrue(result.conflicted());
        assertEquals("", result.regions().get(0).base());
        assertEquals("a\n<<<<<<< ours\nX\n=======\nY\n>>>>>>> theirs\nb", result.text());
    }

    @Test
    void unchanged_side_takes_the_other() {
        assertEquals("new", merger.merge("old", "old", "new").text());
        assertEquals("new", merger.merge("old", "new", "old").text());
        assertEquals("same", merger.merge("old", "same", "same").text());
    }

    @Test
    void empty_base_with_theirs_only_content_takes_theirs() {
        var result = merger.merge("", "", "line1\nline2\n");

        assertFalse(result.conflicted());
        assertEquals("line1\nline2\n", result.text());
    }

    @Test
    void two_conflicts_are_reported_in_line_order() {
        var base = "a\nb\nc\nd\ne";
        var result = merger.merge(base, "A1\nb\nc\nd\nE1", "A2\nb\nc\nd\nE2");

        assertEquals(2, result.regions().size());
        assertTrue(result.regions().get(0).startLine() < result.regions().get(1).startLine());
        assertEquals(2, ConflictMarkers.parse(result.text()).size());
    }
}
