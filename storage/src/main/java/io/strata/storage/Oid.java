// file: storage/src/main/java/io/strata/storage/Oid.java
package io.strata.storage;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Content-derived object identifier (40 lowercase hex characters, SHA-1).
 * Equal content always yields an equal id.
 */
public record Oid(String hex) implements Comparable<Oid> {
    private static final Pattern HEX = Pattern.compile("[0-9a-f]{40}");

    public Oid {
        Objects.requireNonNull(hex, "hex");
        if (!HEX.matcher(hex).matches()) {
            throw new IllegalArgumentException("Not an object id: " + hex);
        }
    }

    public static Oid of(String hex) {
        return new Oid(hex);
    }

    /** First seven characters, for log lines. */
    public String abbreviated() {
        return hex.substring(0, 7);
    }

    @Override
    public int compareTo(Oid o) {
        return hex.compareTo(o.hex);
    }

    @Override
    public String toString() {
        return hex;
    }
}
