// file: storage/src/main/java/io/strata/storage/tx/Transaction.java
package io.strata.storage.tx;

import io.strata.storage.Oid;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Handle for one atomic batch of reference updates, obtained from
 * {@link TransactionManager#begin()}.
 * <p>
 * Usage:
 * <pre>
 * var tx = manager.begin();
 * tx.add("refs/strata/layers/global", oldTree, newTree);
 * tx.add("refs/strata/layers/machine-local", null, firstTree); // must not exist yet
 * CommitOutcome outcome = tx.commit();
 * </pre>
 * A handle is meant for one thread. It can be committed once.
 */
public final class Transaction {
    private final String id;
    private final long startedAtMillis;
    private final TransactionManager manager;
    private final Map<String, RefUpdate> updates = new LinkedHashMap<>();
    private volatile TransactionState state = TransactionState.OPEN;

    Transaction(String id, long startedAtMillis, TransactionManager manager) {
        this.id = id;
        this.startedAtMillis = startedAtMillis;
        this.manager = manager;
    }

    public String id() { return id; }

    public long startedAtMillis() { return startedAtMillis; }

    public TransactionState state() { return state; }

    /** Updates in the order they were added. */
    public List<RefUpdate> updates() { return List.copyOf(updates.values()); }

    /**
     * Queue a move of {@code ref} from {@code expected} (null: must not exist) to {@code newId}.
     *
     * @throws IllegalStateException    if the transaction is no longer open
     * @throws IllegalArgumentException if {@code ref} already has an update in this transaction
     */
    public Transaction add(String ref, Oid expected, Oid newId) {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(newId, "newId");
        requireOpen();
        if (updates.containsKey(ref)) {
            throw new IllegalArgumentException("Reference already updated in this transaction: " + ref);
        }
        updates.put(ref, new RefUpdate(ref, expected, newId));
        return this;
    }

    /** Apply every queued update, or none. */
    public CommitOutcome commit() {
        return manager.commit(this);
    }

    /**
     * Like {@link #commit()} but raises on abort.
     *
     * @throws TransactionAbortedException if no update was applied
     */
    public CommitOutcome.Committed commitOrThrow() {
        CommitOutcome outcome = commit();
        if (outcome instanceof CommitOutcome.Aborted aborted) {
            throw new TransactionAbortedException(aborted);
        }
        return (CommitOutcome.Committed) outcome;
    }

    void requireOpen() {
        if (state != TransactionState.OPEN) {
            throw new IllegalStateException("Transaction " + id + " is " + state);
        }
    }

    void setState(TransactionState next) {
        this.state = next;
    }

    @Override
    public String toString() {
        return "Transaction{" + id + ", " + state + ", " + updates.size() + " updates}";
    }
}
