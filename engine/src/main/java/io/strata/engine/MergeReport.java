// file: engine/src/main/java/io/strata/engine/MergeReport.java
package io.strata.engine;

import io.strata.engine.format.FormatException;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Outcome of one orchestration run: merged files plus per-file format errors.
 * A path appears in at most one of the two maps.
 */
public record MergeReport(SortedMap<String, MergedFile> files, SortedMap<String, FormatException> errors) {

    public MergeReport {
        files = Collections.unmodifiableSortedMap(new TreeMap<>(files));
        errors = Collections.unmodifiableSortedMap(new TreeMap<>(errors));
    }

    /** Paths whose fold stopped at a conflict. */
    public List<String> conflicted() {
        return files.values().stream().filter(MergedFile::conflict).map(MergedFile::path).toList();
    }

    /** True if no file conflicted and none failed to parse. */
    public boolean isClean() {
        return errors.isEmpty() && conflicted().isEmpty();
    }
}
