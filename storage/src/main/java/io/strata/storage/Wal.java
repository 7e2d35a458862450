// file: storage/src/main/java/io/strata/storage/Wal.java
package io.strata.storage;

/**
 * Write-ahead log abstraction for durability and recovery.
 * <p>
 * Contract:
 *  - append() is atomic at "record" granularity: a partial write is treated
 *    as absent during recovery (reader stops at first corrupt/truncated record).
 *  - append() must fsync the record to disk before returning, so that if
 *    the process crashes after append() returns, recovery will see the record.
 *  - truncate() discards every record; it is only safe once nothing in the log
 *    is still needed for recovery.
 */
public interface Wal extends AutoCloseable {

    /**
     * Append a single framed record and fsync it.
     *
     * @param framedRecord header+payload bytes, typically from {@link RecordFrame#frame(byte[])}
     */
    void append(byte[] framedRecord);

    /**
     * Rotate log segment if configured thresholds are hit.
     * Called by the writer after each append.
     */
    void rotateIfNeeded();

    /** Drop all segments and continue with a fresh, empty one. */
    void truncate();

    /**
     * Open a sequential reader over the log.
     * Reader starts from the earliest segment, moves through every later segment,
     * and stops at:
     *  - first corrupt header,
     *  - first truncated payload, or
     *  - end of the newest segment.
     */
    WalReader openReader();

    @Override
    void close();

    /**
     * Reader abstraction used during recovery.
     */
    interface WalReader extends AutoCloseable {

        /**
         * @return next valid payload (NOT including header), or null when:
         *   - at end of log, or
         *   - corruption/truncation is detected.
         */
        byte[] next();

        @Override
        void close();
    }
}
