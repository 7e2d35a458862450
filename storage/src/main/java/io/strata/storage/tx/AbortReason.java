// file: storage/src/main/java/io/strata/storage/tx/AbortReason.java
package io.strata.storage.tx;

/** Why a commit left every reference untouched. */
public enum AbortReason {
    /** A new object id named by an update is not in the store. */
    MISSING_OBJECT,
    /** Not every reference lock could be taken within the lock timeout. Retryable. */
    LOCK_TIMEOUT,
    /** A reference no longer held its expected prior value. */
    STALE_REFERENCE,
    /** A compare-and-swap was refused after locking; earlier swaps were rolled back. */
    SWAP_FAILED
}
