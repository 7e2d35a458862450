// file: engine/src/main/java/io/strata/engine/StagedEntry.java
package io.strata.engine;

import io.strata.core.Layer;
import io.strata.storage.Trees;

import java.util.Arrays;
import java.util.Objects;

/**
 * One staged change: new content for {@code path} in {@code target}, or its removal
 * when {@code content} is null.
 */
public record StagedEntry(String path, Layer target, byte[] content) {

    public StagedEntry {
        Objects.requireNonNull(target, "target");
        Trees.splitPath(path);
        content = content == null ? null : content.clone();
    }

    public static StagedEntry write(Layer target, String path, byte[] content) {
        return new StagedEntry(path, target, Objects.requireNonNull(content, "content"));
    }

    public static StagedEntry remove(Layer target, String path) {
        return new StagedEntry(path, target, null);
    }

    public boolean isRemoval() { return content == null; }

    @Override
    public byte[] content() { return content == null ? null : content.clone(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StagedEntry other)) return false;
        return path.equals(other.path) && target.equals(other.target) && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(path, target) + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "StagedEntry{" + target.label() + ":" + path
                + (content == null ? ", remove" : ", " + content.length + " bytes") + "}";
    }
}
