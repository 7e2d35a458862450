// file: engine/src/main/java/io/strata/engine/format/FormatException.java
package io.strata.engine.format;

/**
 * A structured file could not be parsed, or a value cannot be written in the
 * file's format. Reported per file; never aborts a whole merge run.
 */
public class FormatException extends RuntimeException {
    private final String path;
    private final FileFormat format;

    public FormatException(String path, FileFormat format, String message) {
        super(format + " " + path + ": " + message);
        this.path = path;
        this.format = format;
    }

    public FormatException(String path, FileFormat format, String message, Throwable cause) {
        super(format + " " + path + ": " + message, cause);
        this.path = path;
        this.format = format;
    }

    public String path() {
        return path;
    }

    public FileFormat format() {
        return format;
    }
}
