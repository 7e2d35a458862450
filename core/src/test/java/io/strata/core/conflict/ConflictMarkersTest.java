// file: core/src/test/java/io/strata/core/conflict/ConflictMarkersTest.java
package io.strata.core.conflict;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConflictMarkersTest {

    @Test
    void render_writes_the_exact_marker_layout() {
        assertEquals(
                "<<<<<<< global\nold\n=======\nnew\n>>>>>>> tool/claude",
                ConflictMarkers.render("old", "new", "global", "tool/claude"));
    }

    @Test
    void parse_recovers_regions_and_line_numbers() {
        var text = "keep\n<<<<<<< low\na\nb\n=======\nc\n>>>>>>> high\ntail";

        var regions = ConflictMarkers.parse(text);

        assertEquals(1, regions.size());
        var r = regions.get(0);
        assertEquals("low", r.oursLabel());
        assertEquals(List.of("a", "b"), r.ours());
        assertEquals("high", r.theirsLabel());
        assertEquals(List.of("c"), r.theirs());
        assertEquals(2, r.startLine());
        assertEquals(7, r.endLine());
    }

    @Test
    void plain_text_has_no_markers() {
        assertFalse(ConflictMarkers.hasMarkers("a\n=======\nb"));
        assertTrue(ConflictMarkers.parse("nothing here").isEmpty());
    }

    @Test
    void dangling_start_marker_counts_as_unresolved() {
        var text = "<<<<<<< low\na\n";

        assertTrue(ConflictMarkers.hasMarkers(text));
        assertThrows(IllegalArgumentException.class, () -> ConflictMarkers.parse(text));
    }

    @Test
    void nested_start_marker_breaks_the_enclosing_block() {
        var text = "<<<<<<< a\nx\n<<<<<<< b\ny\n=======\nz\n>>>>>>> c";

        assertThrows(IllegalArgumentException.class, () -> ConflictMarkers.parse(text));
    }

    @Test
    void artifact_requires_regions_and_names_its_sidecar() {
        assertThrows(IllegalArgumentException.class,
                () -> new ConflictArtifact("a.txt", List.of(), "", List.of()));

        var region = new ConflictRegion("b", "o", "t", "global", "local", 1);
        var artifact = new ConflictArtifact("dir/a.txt", List.of(region), "text",
                List.of(new ConflictArtifact.PendingLayer("workspace", "w")));

        assertEquals(1, artifact.conflictCount());
        assertEquals("dir/a.txt.strata-conflict", ConflictArtifact.artifactPath(artifact.path()));
    }
}
