// file: engine/src/main/java/io/strata/engine/format/FileFormat.java
package io.strata.engine.format;

import java.util.List;
import java.util.Locale;

/**
 * File kinds the merge engine distinguishes, chosen by file extension.
 * Everything that is not one of the structured formats is merged as plain text.
 */
public enum FileFormat {
    JSON("json"),
    YAML("yaml", "yml"),
    TOML("toml"),
    PROPERTIES("properties"),
    INI("ini", "cfg", "conf"),
    TEXT();

    private final List<String> extensions;

    FileFormat(String... extensions) {
        this.extensions = List.of(extensions);
    }

    public List<String> extensions() { return extensions; }

    /** True if files of this format are parsed into a Value and deep-merged. */
    public boolean isStructured() { return this != TEXT; }

    /** Format for {@code path}, by the extension of its last segment (case-insensitive). */
    public static FileFormat forPath(String path) {
        String name = path.substring(path.lastIndexOf('/') + 1);
        if (name.equals(".editorconfig")) return INI;
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) return TEXT; // ".env" style names have no extension
        String ext = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        for (FileFormat f : values()) {
            if (f.extensions.contains(ext)) return f;
        }
        return TEXT;
    }
}
