// file: storage/src/main/java/io/strata/storage/tx/TransactionState.java
package io.strata.storage.tx;

/**
 * Lifecycle of a {@link Transaction}.
 * <p>
 * OPEN -> PREPARED -> COMMITTED | ABORTED. A transaction may also go straight from
 * OPEN to ABORTED when a referenced object is missing, or to COMMITTED when empty.
 */
public enum TransactionState {
    OPEN,
    PREPARED,
    COMMITTED,
    ABORTED;

    public boolean isTerminal() {
        return this == COMMITTED || this == ABORTED;
    }
}
