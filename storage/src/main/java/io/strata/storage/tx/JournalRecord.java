// file: storage/src/main/java/io/strata/storage/tx/JournalRecord.java
package io.strata.storage.tx;

import java.util.List;
import java.util.Objects;

/**
 * Entries of the transaction journal.
 * <p>
 * A transaction writes {@link Prepared} before touching any reference and later
 * exactly one of {@link Committed} or {@link Aborted}. A Prepared entry with neither
 * is unresolved and is handled by {@link RecoveryManager}.
 */
public sealed interface JournalRecord
        permits JournalRecord.Prepared, JournalRecord.Committed, JournalRecord.Aborted {

    String txId();

    record Prepared(String txId, long startedAtMillis, List<RefUpdate> updates) implements JournalRecord {
        public Prepared {
            Objects.requireNonNull(txId, "txId");
            updates = List.copyOf(updates);
        }
    }

    record Committed(String txId) implements JournalRecord {
        public Committed {
            Objects.requireNonNull(txId, "txId");
        }
    }

    record Aborted(String txId) implements JournalRecord {
        public Aborted {
            Objects.requireNonNull(txId, "txId");
        }
    }
}
