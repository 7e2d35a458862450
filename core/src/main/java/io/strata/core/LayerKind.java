// file: core/src/main/java/io/strata/core/LayerKind.java
package io.strata.core;

/**
 * The fixed catalog of layer kinds, declared in ascending precedence order.
 * <p>
 * Each kind declares which identifiers of the {@link ActiveContext} it is
 * parametrized by. A kind is applicable to a context only when every identifier
 * it requires is present there.
 * <p>
 * Precedence:
 *  - 1 (GLOBAL) is the lowest, 9 (WORKSPACE_ACTIVE) the highest.
 *  - WORKSPACE_ACTIVE is derived: it holds the merge output and is never a merge input.
 */
public enum LayerKind {
    GLOBAL(1, "global", false, false, false),
    TOOL_BASE(2, "tool-base", true, false, false),
    TOOL_TAG(3, "tool-tag", true, true, false),
    TOOL_TAG_PROJECT(4, "tool-tag-project", true, true, true),
    TOOL_PROJECT(5, "tool-project", true, false, true),
    TAG_BASE(6, "tag-base", false, true, false),
    PROJECT_BASE(7, "project-base", false, false, true),
    MACHINE_LOCAL(8, "machine-local", false, false, false),
    WORKSPACE_ACTIVE(9, "workspace-active", false, false, false);

    private final int precedence;
    private final String displayName;
    private final boolean requiresTool;
    private final boolean requiresTag;
    private final boolean requiresProject;

    LayerKind(int precedence, String displayName, boolean requiresTool, boolean requiresTag, boolean requiresProject) {
        this.precedence = precedence;
        this.displayName = displayName;
        this.requiresTool = requiresTool;
        this.requiresTag = requiresTag;
        this.requiresProject = requiresProject;
    }

    /** Precedence rank, 1 (lowest) to 9 (highest). */
    public int precedence() { return precedence; }

    public boolean requiresTool() { return requiresTool; }

    public boolean requiresTag() { return requiresTag; }

    public boolean requiresProject() { return requiresProject; }

    /** True for the derived workspace kind, which only ever receives merge output. */
    public boolean isDerived() { return this == WORKSPACE_ACTIVE; }

    /**
     * Whether every identifier this kind requires is set in {@code context}.
     * MACHINE_LOCAL additionally needs the context to opt in to the machine overlay.
     */
    public boolean isApplicable(ActiveContext context) {
        if (isDerived()) return false;
        if (requiresTool && context.tool().isEmpty()) return false;
        if (requiresTag && context.tag().isEmpty()) return false;
        if (requiresProject && context.project().isEmpty()) return false;
        if (this == MACHINE_LOCAL) return context.machineLocal();
        return true;
    }

    /** Parse a display name such as {@code "tool-tag"} back to its kind. */
    public static LayerKind fromDisplayName(String name) {
        for (LayerKind k : values()) {
            if (k.displayName.equals(name)) return k;
        }
        throw new IllegalArgumentException("Unknown layer kind: " + name);
    }

    @Override
    public String toString() { return displayName; }
}
