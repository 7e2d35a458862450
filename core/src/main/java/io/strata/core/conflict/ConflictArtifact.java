// file: core/src/main/java/io/strata/core/conflict/ConflictArtifact.java
package io.strata.core.conflict;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything a person needs to resolve one conflicted file.
 * <p>
 * Fields:
 *  - path:    file path relative to the layer root
 *  - regions: conflicting regions in line order (never empty)
 *  - text:    the merged text with marker blocks in place of each region
 *  - pending: higher layers that were not folded in after the conflict, lowest first;
 *             their content is kept so nothing is silently dropped
 * <p>
 * After editing, the cleaned file is fed back as new input content for a write;
 * it is not parsed back into an artifact.
 */
public record ConflictArtifact(
        String path,
        List<ConflictRegion> regions,
        String text,
        List<PendingLayer> pending
) {
    /** Suffix of the sidecar file an artifact is written to next to its target. */
    public static final String FILE_SUFFIX = ".strata-conflict";

    public ConflictArtifact {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(text, "text");
        regions = List.copyOf(regions);
        pending = List.copyOf(pending);
        if (regions.isEmpty()) throw new IllegalArgumentException("a conflict artifact needs at least one region");
    }

    /** A layer whose content for this path was not merged because an earlier step conflicted. */
    public record PendingLayer(String label, String content) {
        public PendingLayer {
            Objects.requireNonNull(label, "label");
            Objects.requireNonNull(content, "content");
        }
    }

    /** Where the artifact for {@code path} is written, e.g. {@code config/app.txt.strata-conflict}. */
    public static String artifactPath(String path) {
        return path + FILE_SUFFIX;
    }

    /**
     * Where the raw content of a layer that was not folded is written, e.g.
     * {@code app.txt.strata-conflict.project-base.api} for label {@code project-base/api}.
     */
    public static String pendingPath(String path, String label) {
        return artifactPath(path) + "." + label.replace('/', '.');
    }

    /**
     * The conflicted path an artifact or pending-layer file belongs to, or empty if
     * {@code file} is neither.
     */
    public static Optional<String> targetOf(String file) {
        int at = file.lastIndexOf(FILE_SUFFIX);
        if (at <= 0) return Optional.empty();
        int end = at + FILE_SUFFIX.length();
        if (end != file.length() && file.charAt(end) != '.') return Optional.empty();
        return Optional.of(file.substring(0, at));
    }

    public int conflictCount() { return regions.size(); }
}
