// file: storage/src/main/java/io/strata/storage/tx/TransactionAbortedException.java
package io.strata.storage.tx;

/**
 * A commit was aborted and no reference was changed. Callers may retry,
 * typically after re-reading the references they depend on.
 */
public class TransactionAbortedException extends RuntimeException {
    private final CommitOutcome.Aborted outcome;

    public TransactionAbortedException(CommitOutcome.Aborted outcome) {
        super("Transaction " + outcome.txId() + " aborted (" + outcome.reason() + "): " + outcome.detail());
        this.outcome = outcome;
    }

    public AbortReason reason() {
        return outcome.reason();
    }

    public CommitOutcome.Aborted outcome() {
        return outcome;
    }
}
