// file: storage/src/main/java/io/strata/storage/tx/RecoveryReport.java
package io.strata.storage.tx;

import java.util.List;

/**
 * What one {@link RecoveryManager#recover()} pass did.
 *
 * @param completed transactions found fully applied and marked committed
 * @param discarded transactions found not applied at all and marked aborted
 * @param deferred  transactions whose references could not be locked this pass
 */
public record RecoveryReport(List<String> completed, List<String> discarded, List<String> deferred) {

    public RecoveryReport {
        completed = List.copyOf(completed);
        discarded = List.copyOf(discarded);
        deferred = List.copyOf(deferred);
    }

    public static RecoveryReport empty() {
        return new RecoveryReport(List.of(), List.of(), List.of());
    }

    /** True if the pass found nothing to do. */
    public boolean isEmpty() {
        return completed.isEmpty() && discarded.isEmpty() && deferred.isEmpty();
    }
}
