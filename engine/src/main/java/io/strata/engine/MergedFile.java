// file: engine/src/main/java/io/strata/engine/MergedFile.java
package io.strata.engine;

import io.strata.core.Layer;
import io.strata.core.conflict.ConflictArtifact;
import io.strata.engine.format.FileFormat;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of folding one path across every layer that defines it.
 * <p>
 * Fields:
 *  - contributing: layers that define the path, lowest precedence first
 *  - content:      the merged value or text; for a conflicted text file, the text with markers
 *  - bytes:        what a workspace file should contain. A single contributor's bytes are
 *                  kept verbatim; merged structured content is re-serialized.
 *  - artifact:     present iff the fold hit a conflict
 */
public final class MergedFile {
    private final String path;
    private final FileFormat format;
    private final MergedContent content;
    private final byte[] bytes;
    private final List<Layer> contributing;
    private final ConflictArtifact artifact;

    public MergedFile(String path, FileFormat format, MergedContent content, byte[] bytes,
                      List<Layer> contributing, ConflictArtifact artifact) {
        this.path = Objects.requireNonNull(path, "path");
        this.format = Objects.requireNonNull(format, "format");
        this.content = Objects.requireNonNull(content, "content");
        this.bytes = Objects.requireNonNull(bytes, "bytes").clone();
        this.contributing = List.copyOf(contributing);
        this.artifact = artifact;
        if (this.contributing.isEmpty()) throw new IllegalArgumentException("no contributing layer for " + path);
    }

    public String path() { return path; }

    public FileFormat format() { return format; }

    public MergedContent content() { return content; }

    public byte[] bytes() { return bytes.clone(); }

    public List<Layer> contributing() { return contributing; }

    public boolean conflict() { return artifact != null; }

    public Optional<ConflictArtifact> artifact() { return Optional.ofNullable(artifact); }

    @Override
    public String toString() {
        return "MergedFile{" + path + ", " + format + ", contributing=" + contributing
                + (conflict() ? ", conflict" : "") + "}";
    }
}
