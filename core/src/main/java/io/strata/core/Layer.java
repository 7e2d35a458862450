// file: core/src/main/java/io/strata/core/Layer.java
package io.strata.core;

import java.util.Objects;

/**
 * A layer: a kind plus the identifiers it is parametrized by.
 * <p>
 * Layers are immutable identifiers, not containers. A layer names a reference in
 * the object store; whatever that reference points at is the layer's content.
 * <p>
 * Invariants:
 *  - tool is non-null iff the kind requires a tool, likewise for tag and project.
 */
public record Layer(LayerKind kind, String tool, String tag, String project) {

    /** Prefix shared by every layer reference. */
    public static final String REF_PREFIX = "refs/strata/layers/";

    public Layer {
        Objects.requireNonNull(kind, "kind");
        requireMatching(kind.requiresTool(), tool, "tool", kind);
        requireMatching(kind.requiresTag(), tag, "tag", kind);
        requireMatching(kind.requiresProject(), project, "project", kind);
    }

    public static Layer global() { return new Layer(LayerKind.GLOBAL, null, null, null); }

    public static Layer machineLocal() { return new Layer(LayerKind.MACHINE_LOCAL, null, null, null); }

    public static Layer workspace() { return new Layer(LayerKind.WORKSPACE_ACTIVE, null, null, null); }

    /**
     * Instantiate {@code kind} with the identifiers it needs from {@code context}.
     *
     * @throws IllegalArgumentException if the context lacks an identifier the kind requires
     */
    public static Layer of(LayerKind kind, ActiveContext context) {
        return new Layer(
                kind,
                kind.requiresTool() ? context.tool().orElse(null) : null,
                kind.requiresTag() ? context.tag().orElse(null) : null,
                kind.requiresProject() ? context.project().orElse(null) : null);
    }

    public int precedence() { return kind.precedence(); }

    /** Full reference name backing this layer, e.g. {@code refs/strata/layers/tool-project/claude/api}. */
    public String refName() { return REF_PREFIX + label(); }

    /**
     * Short human label used in conflict markers: the reference name without its prefix,
     * i.e. the kind's display name followed by its identifiers.
     * <p>
     * Every kind has a fixed number of path segments, so no layer reference is ever a
     * directory prefix of another.
     */
    public String label() {
        var sb = new StringBuilder(kind.toString());
        if (tool != null) sb.append('/').append(tool);
        if (tag != null) sb.append('/').append(tag);
        if (project != null) sb.append('/').append(project);
        return sb.toString();
    }

    /**
     * Parse a reference name produced by {@link #refName()}.
     *
     * @throws IllegalArgumentException if {@code refName} does not name a layer
     */
    public static Layer fromRefName(String refName) {
        if (!refName.startsWith(REF_PREFIX)) {
            throw new IllegalArgumentException("Not a layer reference: " + refName);
        }
        String[] parts = refName.substring(REF_PREFIX.length()).split("/", -1);
        LayerKind kind = LayerKind.fromDisplayName(parts[0]);
        int expected = 1 + (kind.requiresTool() ? 1 : 0) + (kind.requiresTag() ? 1 : 0) + (kind.requiresProject() ? 1 : 0);
        if (parts.length != expected) {
            throw new IllegalArgumentException("Malformed layer reference: " + refName);
        }
        int i = 1;
        String tool = kind.requiresTool() ? parts[i++] : null;
        String tag = kind.requiresTag() ? parts[i++] : null;
        String project = kind.requiresProject() ? parts[i] : null;
        return new Layer(kind, tool, tag, project);
    }

    private static void requireMatching(boolean required, String value, String field, LayerKind kind) {
        if (required && (value == null || value.isBlank())) {
            throw new IllegalArgumentException(kind + " requires a " + field);
        }
        if (!required && value != null) {
            throw new IllegalArgumentException(kind + " does not take a " + field);
        }
    }

    @Override
    public String toString() { return label(); }
}
