// file: storage/src/main/java/io/strata/storage/tx/RefUpdate.java
package io.strata.storage.tx;

import io.strata.storage.Oid;

import java.util.Objects;

/**
 * One reference move inside a transaction.
 *
 * @param ref      full reference name
 * @param expected value the reference must hold when the transaction commits,
 *                 or null if the reference must not exist yet
 * @param newId    value the reference is set to
 */
public record RefUpdate(String ref, Oid expected, Oid newId) {

    public RefUpdate {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(newId, "newId");
    }

    public boolean mustNotExist() { return expected == null; }

    /** True when the update would leave the reference unchanged. */
    public boolean isNoOp() { return newId.equals(expected); }
}
