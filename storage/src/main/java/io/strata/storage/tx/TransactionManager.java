// file: storage/src/main/java/io/strata/storage/tx/TransactionManager.java
package io.strata.storage.tx;

import io.strata.storage.ObjectStore;
import io.strata.storage.Oid;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies batches of reference updates atomically.
 * <p>
 * Commit protocol:
 *  1) Every new object id must already be in the store, else abort (MISSING_OBJECT).
 *  2) Journal PREPARED with the full update list (fsync'd) before touching any reference.
 *  3) Lock every target reference in sorted order within the lock timeout, else abort
 *     (LOCK_TIMEOUT).
 *  4) Check every reference still holds its expected prior value, else abort
 *     (STALE_REFERENCE).
 *  5) Compare-and-swap each reference. If a swap is refused, roll back the swaps
 *     already made in reverse order and abort (SWAP_FAILED).
 *  6) Journal COMMITTED, release locks.
 * <p>
 * A crash between 2) and 6) leaves an unresolved PREPARED entry that
 * {@link RecoveryManager} settles on the next start.
 * <p>
 * Transactions over disjoint reference sets commit concurrently; overlapping ones
 * are serialized by the reference locks.
 */
public class TransactionManager {
    private static final Logger log = Logger.getLogger(TransactionManager.class.getName());

    private final ObjectStore store;
    private final TransactionJournal journal;
    private final RefLockTable locks;
    private final Duration lockTimeout;
    private final Clock clock;

    public TransactionManager(ObjectStore store, TransactionJournal journal, RefLockTable locks, Duration lockTimeout) {
        this(store, journal, locks, lockTimeout, Clock.systemUTC());
    }

    public TransactionManager(ObjectStore store, TransactionJournal journal, RefLockTable locks,
                              Duration lockTimeout, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.journal = Objects.requireNonNull(journal, "journal");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (lockTimeout.isNegative()) throw new IllegalArgumentException("lockTimeout must be >= 0");
    }

    /** Start a new, empty transaction. */
    public Transaction begin() {
        return new Transaction(UUID.randomUUID().toString(), clock.millis(), this);
    }

    CommitOutcome commit(Transaction tx) {
        if (tx.state() != TransactionState.OPEN) {
            throw new IllegalStateException("Transaction " + tx.id() + " is " + tx.state());
        }
        List<RefUpdate> updates = tx.updates();
        if (updates.isEmpty()) {
            tx.setState(TransactionState.COMMITTED);
            return new CommitOutcome.Committed(tx.id(), List.of());
        }

        for (RefUpdate u : updates) {
            if (!store.contains(u.newId())) {
                return abort(tx, AbortReason.MISSING_OBJECT, "object " + u.newId() + " for " + u.ref() + " is not in the store");
            }
        }

        journal.prepared(tx.id(), tx.startedAtMillis(), updates);
        tx.setState(TransactionState.PREPARED);
        try {
            return lockAndApply(tx, updates);
        } finally {
            if (tx.state() == TransactionState.PREPARED) {
                // escaped with an exception; leave the entry for recovery
                journal.abandon(tx.id());
            }
        }
    }

    private CommitOutcome lockAndApply(Transaction tx, List<RefUpdate> updates) {
        List<String> refs = updates.stream().map(RefUpdate::ref).toList();
        Optional<RefLockTable.Held> held = locks.tryLockAll(refs, lockTimeout);
        if (held.isEmpty()) {
            return abort(tx, AbortReason.LOCK_TIMEOUT, "could not lock " + refs + " within " + lockTimeout.toMillis() + " ms");
        }
        try (RefLockTable.Held ignored = held.get()) {
            for (RefUpdate u : updates) {
                Oid current = store.readRef(u.ref()).orElse(null);
                if (!Objects.equals(current, u.expected())) {
                    return abort(tx, AbortReason.STALE_REFERENCE,
                            u.ref() + " is " + describe(current) + ", expected " + describe(u.expected()));
                }
            }

            var applied = new ArrayList<RefUpdate>(updates.size());
            for (RefUpdate u : updates) {
                boolean swapped;
                try {
                    swapped = store.compareAndSwapRef(u.ref(), u.expected(), u.newId());
                } catch (RuntimeException e) {
                    log.log(Level.WARNING, "Swap of " + u.ref() + " failed in transaction " + tx.id(), e);
                    swapped = false;
                }
                if (!swapped) {
                    rollBack(tx, applied, updates);
                    return abort(tx, AbortReason.SWAP_FAILED, "swap of " + u.ref() + " was refused; "
                            + applied.size() + " earlier swap(s) rolled back");
                }
                applied.add(u);
            }

            journal.committed(tx.id());
            tx.setState(TransactionState.COMMITTED);
            log.log(Level.INFO, "Transaction " + tx.id() + " committed " + updates.size() + " reference(s)");
            return new CommitOutcome.Committed(tx.id(), applied);
        }
    }

    /**
     * Undo {@code applied} newest first. A refused undo means some reference now holds
     * a value this transaction can no longer take back.
     */
    private void rollBack(Transaction tx, List<RefUpdate> applied, List<RefUpdate> all) {
        for (int i = applied.size() - 1; i >= 0; i--) {
            RefUpdate u = applied.get(i);
            boolean undone;
            try {
                undone = store.compareAndSwapRef(u.ref(), u.newId(), u.expected());
            } catch (RuntimeException e) {
                log.log(Level.SEVERE, "Rollback of " + u.ref() + " failed in transaction " + tx.id(), e);
                undone = false;
            }
            if (!undone) {
                List<String> stillApplied = applied.subList(0, i + 1).stream().map(RefUpdate::ref).toList();
                List<String> unapplied = all.stream().map(RefUpdate::ref).filter(r -> !stillApplied.contains(r)).toList();
                journal.abandon(tx.id());
                tx.setState(TransactionState.ABORTED);
                log.log(Level.SEVERE, "Transaction " + tx.id() + " left partially applied: " + stillApplied);
                throw new RecoveryInconsistencyException(tx.id(), stillApplied, unapplied);
            }
        }
    }

    private CommitOutcome abort(Transaction tx, AbortReason reason, String detail) {
        if (tx.state() == TransactionState.PREPARED) {
            journal.aborted(tx.id());
        }
        tx.setState(TransactionState.ABORTED);
        log.log(Level.WARNING, "Transaction " + tx.id() + " aborted (" + reason + "): " + detail);
        return new CommitOutcome.Aborted(tx.id(), reason, detail);
    }

    private static String describe(Oid id) {
        return id == null ? "absent" : id.abbreviated();
    }
}
