// file: engine/src/main/java/io/strata/engine/ApplyResult.java
package io.strata.engine;

import io.strata.storage.Oid;

import java.util.List;

/**
 * What {@link WorkspaceApplier#apply} did to a directory.
 *
 * @param written    clean files written to their target path
 * @param conflicted paths whose conflict artifact was written instead of the target
 * @param removed    previously applied paths that no layer defines any more; their
 *                   target and conflict files were deleted
 * @param workspace  tree of every file written, conflict files included
 */
public record ApplyResult(List<String> written, List<String> conflicted, List<String> removed, Oid workspace) {

    public ApplyResult {
        written = List.copyOf(written);
        conflicted = List.copyOf(conflicted);
        removed = List.copyOf(removed);
    }
}
