// file: core/src/main/java/io/strata/core/ActiveContext.java
package io.strata.core;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Runtime selection of the optional identifiers that qualify layers:
 * a tool identifier, a contextual tag and a project identifier.
 * <p>
 * Supplied per operation and never persisted here.
 * <p>
 * Identifiers end up inside reference names, so they are restricted to
 * letters, digits, '_' and '-', with single dots allowed between them.
 */
public final class ActiveContext {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9_-]+(\\.[A-Za-z0-9_-]+)*");

    private static final ActiveContext EMPTY = new ActiveContext(null, null, null, false);

    private final String tool;
    private final String tag;
    private final String project;
    private final boolean machineLocal;

    private ActiveContext(String tool, String tag, String project, boolean machineLocal) {
        this.tool = checkIdentifier("tool", tool);
        this.tag = checkIdentifier("tag", tag);
        this.project = checkIdentifier("project", project);
        this.machineLocal = machineLocal;
    }

    /** Context with no identifiers set. */
    public static ActiveContext empty() { return EMPTY; }

    /** Context with the given identifiers; any of them may be null. */
    public static ActiveContext of(String tool, String tag, String project) {
        return new ActiveContext(tool, tag, project, false);
    }

    public ActiveContext withTool(String tool) { return new ActiveContext(tool, tag, project, machineLocal); }

    public ActiveContext withTag(String tag) { return new ActiveContext(tool, tag, project, machineLocal); }

    public ActiveContext withProject(String project) { return new ActiveContext(tool, tag, project, machineLocal); }

    /** Opt in to (or out of) the machine-local overlay layer. */
    public ActiveContext withMachineLocal(boolean enabled) { return new ActiveContext(tool, tag, project, enabled); }

    public Optional<String> tool() { return Optional.ofNullable(tool); }

    public Optional<String> tag() { return Optional.ofNullable(tag); }

    public Optional<String> project() { return Optional.ofNullable(project); }

    public boolean machineLocal() { return machineLocal; }

    private static String checkIdentifier(String field, String value) {
        if (value == null) return null;
        if (!IDENTIFIER.matcher(value).matches() || value.endsWith(".lock")) {
            throw new IllegalArgumentException(
                    "%s identifier must match %s, got '%s'".formatted(field, IDENTIFIER.pattern(), value));
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ActiveContext other)) return false;
        return machineLocal == other.machineLocal
                && Objects.equals(tool, other.tool)
                && Objects.equals(tag, other.tag)
                && Objects.equals(project, other.project);
    }

    @Override
    public int hashCode() { return Objects.hash(tool, tag, project, machineLocal); }

    @Override
    public String toString() {
        return "ActiveContext{tool=" + tool + ", tag=" + tag + ", project=" + project
                + (machineLocal ? ", machineLocal" : "") + "}";
    }
}
