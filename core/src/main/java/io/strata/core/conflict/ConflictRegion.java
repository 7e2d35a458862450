// file: core/src/main/java/io/strata/core/conflict/ConflictRegion.java
package io.strata.core.conflict;

import java.util.Objects;

/**
 * One irreconcilable region of a three-way text merge.
 * <p>
 * Fields:
 *  - base:        the common ancestor's text for the region
 *  - ours:        the already-merged (lower-precedence) side's text
 *  - theirs:      the incoming (higher-precedence) side's text
 *  - oursLabel:   label of the layer that produced "ours"
 *  - theirsLabel: label of the layer that produced "theirs"
 *  - startLine:   1-based line of the opening marker in the rendered text
 */
public record ConflictRegion(
        String base,
        String ours,
        String theirs,
        String oursLabel,
        String theirsLabel,
        int startLine
) {
    public ConflictRegion {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(ours, "ours");
        Objects.requireNonNull(theirs, "theirs");
        Objects.requireNonNull(oursLabel, "oursLabel");
        Objects.requireNonNull(theirsLabel, "theirsLabel");
        if (startLine < 1) throw new IllegalArgumentException("startLine must be >= 1");
    }
}
