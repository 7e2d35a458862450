// file: core/src/main/java/io/strata/core/merge/TextMergeResult.java
package io.strata.core.merge;

import io.strata.core.conflict.ConflictRegion;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a three-way text merge.
 * <p>
 * A clean merge has no regions. A conflicted merge still carries every line that
 * merged cleanly, with marker blocks standing in for the conflicting regions.
 */
public record TextMergeResult(String text, List<ConflictRegion> regions) {

    public TextMergeResult {
        Objects.requireNonNull(text, "text");
        regions = List.copyOf(regions);
    }

    public static TextMergeResult clean(String text) {
        return new TextMergeResult(text, List.of());
    }

    public boolean conflicted() { return !regions.isEmpty(); }
}
