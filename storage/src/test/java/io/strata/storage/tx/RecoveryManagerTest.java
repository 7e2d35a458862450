// file: storage/src/test/java/io/strata/storage/tx/RecoveryManagerTest.java
package io.strata.storage.tx;

import io.strata.storage.FileWal;
import io.strata.storage.Oid;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RecoveryManagerTest {

    @TempDir Path journalDir;

    private final FailingSwapStore store = new FailingSwapStore();
    private TransactionJournal journal;

    private static final String R1 = "refs/strata/layers/global";
    private static final String R2 = "refs/strata/layers/project-base/api";

    @AfterEach
    void closeJournal() {
        if (journal != null) journal.close();
    }

    private Oid blob(String s) {
        return store.writeBlob(s.getBytes(StandardCharsets.UTF_8));
    }

    /** Write a PREPARED entry and "crash": the next journal instance sees it unresolved. */
    private void crashAfterPrepare(String txId, List<RefUpdate> updates) {
        var before = new TransactionJournal(new FileWal(journalDir, 1L << 20));
        before.prepared(txId, 1L, updates);
        before.close();
        journal = new TransactionJournal(new FileWal(journalDir, 1L << 20));
    }

    private RecoveryManager recovery() {
        return new RecoveryManager(store, journal, new RefLockTable(), Duration.ofSeconds(1));
    }

    @Test
    void fully_applied_entry_is_completed_without_touching_references() {
        Oid old1 = blob("o1");
        Oid new1 = blob("n1");
        Oid new2 = blob("n2");
        crashAfterPrepare("tx-a", List.of(new RefUpdate(R1, old1, new1), new RefUpdate(R2, null, new2)));
        store.force(R1, new1);
        store.force(R2, new2);

        var report = recovery().recover();

        assertEquals(List.of("tx-a"), report.completed());
        assertEquals(List.of(), report.discarded());
        assertEquals(0, store.swapCalls);
        assertEquals(Optional.of(new1), store.readRef(R1));
        assertEquals(Optional.of(new2), store.readRef(R2));
        assertEquals(List.of(), journal.unresolved());
    }

    @Test
    void unapplied_entry_is_discarded() {
        Oid old1 = blob("o1");
        store.force(R1, old1);
        crashAfterPrepare("tx-b", List.of(new RefUpdate(R1, old1, blob("n1")), new RefUpdate(R2, null, blob("n2"))));

        var report = recovery().recover();

        assertEquals(List.of("tx-b"), report.discarded());
        assertEquals(Optional.of(old1), store.readRef(R1));
        assertEquals(Optional.empty(), store.readRef(R2));
        assertEquals(List.of(), journal.unresolved());
    }

    @Test
    void partially_applied_entry_is_fatal_and_stays_unresolved() {
        Oid old1 = blob("o1");
        Oid new1 = blob("n1");
        store.force(R1, old1);
        crashAfterPrepare("tx-c", List.of(new RefUpdate(R1, old1, new1), new RefUpdate(R2, null, blob("n2"))));
        store.force(R1, new1);

        var ex = assertThrows(RecoveryInconsistencyException.class, () -> recovery().recover());

        assertEquals("tx-c", ex.txId());
        assertEquals(List.of(R1), ex.appliedRefs());
        assertEquals(List.of(R2), ex.unappliedRefs());
        assertEquals(1, journal.unresolved().size());
    }

    @Test
    void recovery_is_idempotent_and_checkpoints_the_journal() {
        Oid new1 = blob("n1");
        crashAfterPrepare("tx-d", List.of(new RefUpdate(R1, null, new1)));
        store.force(R1, new1);

        var rm = recovery();
        assertEquals(List.of("tx-d"), rm.recover().completed());
        assertTrue(rm.recover().isEmpty());
        assertEquals(List.of(), journal.readAll(), "journal truncated once nothing is pending");
    }

    @Test
    void updates_that_change_nothing_are_ignored_when_judging() {
        Oid same = blob("same");
        Oid new2 = blob("n2");
        store.force(R1, same);
        crashAfterPrepare("tx-e", List.of(new RefUpdate(R1, same, same), new RefUpdate(R2, null, new2)));
        store.force(R2, new2);

        assertEquals(List.of("tx-e"), recovery().recover().completed());
    }

    @Test
    void in_flight_transactions_of_this_process_are_skipped() {
        journal = new TransactionJournal(new FileWal(journalDir, 1L << 20));
        journal.prepared("tx-live", 1L, List.of(new RefUpdate(R1, null, blob("n1"))));

        var report = recovery().recover();

        assertTrue(report.isEmpty());
        assertEquals(1, journal.unresolved().size());
        assertTrue(journal.isInFlight("tx-live"));
    }

    @Test
    void resolved_entries_survive_restart_as_resolved() {
        Oid a = blob("a");
        journal = new TransactionJournal(new FileWal(journalDir, 1L << 20));
        var tm = new TransactionManager(store, journal, new RefLockTable(), Duration.ofSeconds(1));
        assertTrue(tm.begin().add(R1, null, a).commit().isCommitted());
        journal.close();

        journal = new TransactionJournal(new FileWal(journalDir, 1L << 20));
        assertEquals(List.of(), journal.unresolved());
        assertTrue(recovery().recover().isEmpty());
    }
}
