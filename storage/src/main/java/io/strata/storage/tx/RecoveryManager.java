// file: storage/src/main/java/io/strata/storage/tx/RecoveryManager.java
package io.strata.storage.tx;

import io.strata.storage.ObjectStore;
import io.strata.storage.Oid;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Settles journal entries left PREPARED by a crash.
 * <p>
 * For each unresolved entry not in flight in this process, compare every target
 * reference with the entry's new value (updates that would not change their
 * reference are ignored):
 *  - all match:  the commit finished before the crash; record COMMITTED.
 *  - none match: nothing was applied; record ABORTED.
 *  - mixed:      partial application; log SEVERE and throw
 *                {@link RecoveryInconsistencyException}. The entry stays unresolved.
 * <p>
 * References are never modified here. The pass takes the same reference locks as
 * commits, so it can run at any time, not only at startup. Running it twice is
 * harmless.
 */
public class RecoveryManager {
    private static final Logger log = Logger.getLogger(RecoveryManager.class.getName());

    private final ObjectStore store;
    private final TransactionJournal journal;
    private final RefLockTable locks;
    private final Duration lockTimeout;

    public RecoveryManager(ObjectStore store, TransactionJournal journal, RefLockTable locks, Duration lockTimeout) {
        this.store = Objects.requireNonNull(store, "store");
        this.journal = Objects.requireNonNull(journal, "journal");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
    }

    /**
     * Run one recovery pass.
     *
     * @throws RecoveryInconsistencyException if an entry is partially applied
     */
    public synchronized RecoveryReport recover() {
        var completed = new ArrayList<String>();
        var discarded = new ArrayList<String>();
        var deferred = new ArrayList<String>();

        for (JournalRecord.Prepared entry : journal.recoverable()) {
            List<String> refs = entry.updates().stream().map(RefUpdate::ref).toList();
            Optional<RefLockTable.Held> held = locks.tryLockAll(refs, lockTimeout);
            if (held.isEmpty()) {
                log.log(Level.WARNING, "Recovery deferred for transaction " + entry.txId() + ": references busy");
                deferred.add(entry.txId());
                continue;
            }
            try (RefLockTable.Held ignored = held.get()) {
                settle(entry, completed, discarded);
            }
        }

        if (deferred.isEmpty()) {
            journal.checkpointIfIdle();
        }
        var report = new RecoveryReport(completed, discarded, deferred);
        if (!report.isEmpty()) {
            log.log(Level.INFO, "Recovery finished: completed=" + completed + ", discarded=" + discarded + ", deferred=" + deferred);
        }
        return report;
    }

    private void settle(JournalRecord.Prepared entry, List<String> completed, List<String> discarded) {
        var applied = new ArrayList<String>();
        var unapplied = new ArrayList<String>();
        for (RefUpdate u : entry.updates()) {
            if (u.isNoOp()) continue;
            Oid current = store.readRef(u.ref()).orElse(null);
            if (u.newId().equals(current)) {
                applied.add(u.ref());
            } else {
                unapplied.add(u.ref());
            }
        }

        if (unapplied.isEmpty()) {
            journal.committed(entry.txId());
            completed.add(entry.txId());
        } else if (applied.isEmpty()) {
            journal.aborted(entry.txId());
            discarded.add(entry.txId());
        } else {
            log.log(Level.SEVERE, "Transaction " + entry.txId() + " is partially applied; manual intervention required."
                    + " applied=" + applied + ", unapplied=" + unapplied);
            throw new RecoveryInconsistencyException(entry.txId(), applied, unapplied);
        }
    }
}
