// file: storage/src/main/java/io/strata/storage/tx/TransactionJournal.java
package io.strata.storage.tx;

import io.strata.storage.Wal;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable intent log for transactions, layered over a {@link Wal}.
 * <p>
 * Responsibilities:
 *  - Append PREPARED / COMMITTED / ABORTED records, each fsync'd before returning.
 *  - Track which prepared transactions are still being driven by this process
 *    ("in flight"), so recovery leaves them alone.
 *  - Report unresolved PREPARED entries (no COMMITTED or ABORTED after them).
 *  - Checkpoint: when nothing is unresolved or in flight, drop the log segments.
 * <p>
 * All writes are serialized on this instance.
 */
public class TransactionJournal implements AutoCloseable {
    private static final Logger log = Logger.getLogger(TransactionJournal.class.getName());

    private final Wal wal;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public TransactionJournal(Wal wal) {
        this.wal = wal;
    }

    /** Durably record the intent of {@code txId} and mark it in flight. */
    public synchronized void prepared(String txId, long startedAtMillis, List<RefUpdate> updates) {
        append(new JournalRecord.Prepared(txId, startedAtMillis, updates));
        inFlight.add(txId);
    }

    public synchronized void committed(String txId) {
        append(new JournalRecord.Committed(txId));
        inFlight.remove(txId);
    }

    public synchronized void aborted(String txId) {
        append(new JournalRecord.Aborted(txId));
        inFlight.remove(txId);
    }

    /**
     * Stop tracking {@code txId} without resolving it. Its PREPARED entry stays
     * unresolved and becomes visible to recovery.
     */
    public void abandon(String txId) {
        inFlight.remove(txId);
    }

    public boolean isInFlight(String txId) {
        return inFlight.contains(txId);
    }

    /** Every record that survived in the log, oldest first. */
    public synchronized List<JournalRecord> readAll() {
        var out = new ArrayList<JournalRecord>();
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                out.add(JournalCodec.decode(payload));
            }
        }
        return out;
    }

    /** PREPARED entries with no outcome recorded, oldest first, including in-flight ones. */
    public synchronized List<JournalRecord.Prepared> unresolved() {
        Map<String, JournalRecord.Prepared> open = new LinkedHashMap<>();
        for (JournalRecord rec : readAll()) {
            if (rec instanceof JournalRecord.Prepared p) {
                open.put(p.txId(), p);
            } else {
                open.remove(rec.txId());
            }
        }
        return List.copyOf(open.values());
    }

    /** Unresolved entries that no transaction in this process is still driving. */
    public synchronized List<JournalRecord.Prepared> recoverable() {
        var out = new ArrayList<JournalRecord.Prepared>();
        for (JournalRecord.Prepared p : unresolved()) {
            if (!inFlight.contains(p.txId())) out.add(p);
        }
        return out;
    }

    /**
     * Drop the log if no entry is unresolved and nothing is in flight.
     *
     * @return true if the log was truncated
     */
    public synchronized boolean checkpointIfIdle() {
        if (!inFlight.isEmpty() || !unresolved().isEmpty()) return false;
        wal.truncate();
        log.log(Level.FINE, "Journal checkpointed");
        return true;
    }

    private void append(JournalRecord record) {
        wal.append(JournalCodec.encode(record));
        wal.rotateIfNeeded();
    }

    @Override
    public void close() {
        wal.close();
    }
}
