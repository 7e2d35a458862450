// file: storage/src/main/java/io/strata/storage/tx/RecoveryInconsistencyException.java
package io.strata.storage.tx;

import java.util.List;

/**
 * Fatal: a prepared transaction is partially applied, some references hold their new
 * values and some do not. Never repaired automatically; the journal entry is left
 * unresolved for manual intervention.
 */
public class RecoveryInconsistencyException extends RuntimeException {
    private final String txId;
    private final List<String> appliedRefs;
    private final List<String> unappliedRefs;

    public RecoveryInconsistencyException(String txId, List<String> appliedRefs, List<String> unappliedRefs) {
        super("Transaction " + txId + " is partially applied: applied=" + appliedRefs + ", unapplied=" + unappliedRefs);
        this.txId = txId;
        this.appliedRefs = List.copyOf(appliedRefs);
        this.unappliedRefs = List.copyOf(unappliedRefs);
    }

    public String txId() {
        return txId;
    }

    public List<String> appliedRefs() {
        return appliedRefs;
    }

    public List<String> unappliedRefs() {
        return unappliedRefs;
    }
}
