// file: engine/src/main/java/io/strata/engine/Strata.java
package io.strata.engine;

import io.strata.core.ActiveContext;
import io.strata.storage.FileWal;
import io.strata.storage.JGitObjectStore;
import io.strata.storage.ObjectStore;
import io.strata.storage.tx.CommitOutcome;
import io.strata.storage.tx.RecoveryManager;
import io.strata.storage.tx.RecoveryReport;
import io.strata.storage.tx.RefLockTable;
import io.strata.storage.tx.Transaction;
import io.strata.storage.tx.TransactionJournal;
import io.strata.storage.tx.TransactionManager;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point wiring the object store, transaction journal, recovery, merge and
 * write path together.
 * <p>
 * Lifecycle:
 *  - {@link #open} opens the store and journal and runs recovery before returning,
 *    so no half-applied transaction from an earlier crash is visible to callers;
 *  - {@link #close} stops merge workers, then closes the journal and the store.
 * <p>
 * Thread-safe; one instance per repository and journal directory.
 */
public final class Strata implements AutoCloseable {
    private static final Logger log = Logger.getLogger(Strata.class.getName());

    private final ObjectStore store;
    private final TransactionJournal journal;
    private final TransactionManager transactions;
    private final RecoveryManager recovery;
    private final ExecutorService mergePool;
    private final LayerMergeOrchestrator orchestrator;
    private final LayerCommitter committer;
    private final WorkspaceApplier applier;

    private Strata(StrataConfig config, ObjectStore store, TransactionJournal journal) {
        var locks = new RefLockTable();
        this.store = store;
        this.journal = journal;
        this.transactions = new TransactionManager(store, journal, locks, config.lockTimeout());
        this.recovery = new RecoveryManager(store, journal, locks, config.lockTimeout());
        this.mergePool = config.mergeParallelism() > 1 ? newMergePool(config.mergeParallelism()) : null;
        this.orchestrator = new LayerMergeOrchestrator(store, mergePool);
        this.committer = new LayerCommitter(store, transactions);
        this.applier = new WorkspaceApplier(store, transactions);
    }

    /** Open over the Git repository named by {@code config}, creating it if needed. */
    public static Strata open(StrataConfig config) {
        return open(config, JGitObjectStore.open(config.repositoryDir()));
    }

    /**
     * Open over a caller-supplied store, which is closed with this instance.
     *
     * @throws io.strata.storage.tx.RecoveryInconsistencyException if recovery finds a
     *         partially applied transaction; nothing is left open in that case
     */
    public static Strata open(StrataConfig config, ObjectStore store) {
        TransactionJournal journal;
        try {
            journal = new TransactionJournal(new FileWal(config.journalDir(), config.journalRotateBytes()));
        } catch (RuntimeException e) {
            closeQuietly(store, e);
            throw e;
        }
        Strata strata = new Strata(config, store, journal);
        try {
            RecoveryReport report = strata.recover();
            if (!report.isEmpty()) {
                log.log(Level.INFO, "Recovered at open: " + report);
            }
        } catch (RuntimeException e) {
            try {
                strata.close();
            } catch (RuntimeException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
        return strata;
    }

    /** Resolve journal entries left by interrupted commits. Safe to call at any time. */
    public RecoveryReport recover() {
        return recovery.recover();
    }

    /** Effective files for {@code context}. Reads only. */
    public MergeReport merge(ActiveContext context) {
        return orchestrator.merge(context);
    }

    /** A raw transaction over layer references. */
    public Transaction begin() {
        return transactions.begin();
    }

    /** Write staged entries to their layers in one transaction. */
    public CommitOutcome commit(List<StagedEntry> entries) {
        return committer.commit(entries);
    }

    /** Merge {@code context} and materialize the result into {@code dir}. */
    public ApplyResult apply(ActiveContext context, Path dir) {
        return applier.apply(merge(context), dir);
    }

    public ObjectStore store() {
        return store;
    }

    @Override
    public void close() {
        if (mergePool != null) {
            mergePool.shutdownNow();
        }
        try {
            journal.close();
        } finally {
            store.close();
        }
    }

    private static ExecutorService newMergePool(int threads) {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "strata-merge-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private static void closeQuietly(ObjectStore store, RuntimeException cause) {
        try {
            store.close();
        } catch (RuntimeException suppressed) {
            cause.addSuppressed(suppressed);
        }
    }
}
