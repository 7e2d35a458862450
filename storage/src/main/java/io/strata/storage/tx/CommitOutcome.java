// file: storage/src/main/java/io/strata/storage/tx/CommitOutcome.java
package io.strata.storage.tx;

import java.util.List;
import java.util.Objects;

/**
 * Result of {@link Transaction#commit()}: either every update was applied or none was.
 */
public sealed interface CommitOutcome permits CommitOutcome.Committed, CommitOutcome.Aborted {

    String txId();

    default boolean isCommitted() {
        return this instanceof Committed;
    }

    record Committed(String txId, List<RefUpdate> applied) implements CommitOutcome {
        public Committed {
            Objects.requireNonNull(txId, "txId");
            applied = List.copyOf(applied);
        }
    }

    record Aborted(String txId, AbortReason reason, String detail) implements CommitOutcome {
        public Aborted {
            Objects.requireNonNull(txId, "txId");
            Objects.requireNonNull(reason, "reason");
            Objects.requireNonNull(detail, "detail");
        }
    }
}
