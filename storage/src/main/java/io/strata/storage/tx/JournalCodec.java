// file: storage/src/main/java/io/strata/storage/tx/JournalCodec.java
package io.strata.storage.tx;

import io.strata.storage.Oid;
import io.strata.storage.RecordFrame;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Payload encoding for journal records. Framing (magic, length, CRC) is added by
 * {@link RecordFrame}.
 * <p>
 * Payload layout (little-endian):
 *  - type:  byte (1 = PREPARED, 2 = COMMITTED, 3 = ABORTED)
 *  - txId:  int32 len + UTF-8 bytes
 *  PREPARED only:
 *  - startedAtMillis: int64
 *  - count: int32 number of updates
 *      repeated count times:
 *        - ref:      int32 len + UTF-8 bytes
 *        - expected: int32 len + UTF-8 hex (len == -1 => must not exist)
 *        - newId:    int32 len + UTF-8 hex
 */
final class JournalCodec {
    static final byte PREPARED = 1;
    static final byte COMMITTED = 2;
    static final byte ABORTED = 3;

    private JournalCodec() {
    }

    /** Encode a record into header+payload bytes ready for append. */
    static byte[] encode(JournalRecord record) {
        return RecordFrame.frame(encodePayload(record));
    }

    static byte[] encodePayload(JournalRecord record) {
        byte[] txId = record.txId().getBytes(StandardCharsets.UTF_8);
        int size = 1 + 4 + txId.length;
        List<byte[][]> fields = new ArrayList<>();
        if (record instanceof JournalRecord.Prepared p) {
            size += 8 + 4;
            for (RefUpdate u : p.updates()) {
                byte[][] f = {
                        u.ref().getBytes(StandardCharsets.UTF_8),
                        u.expected() == null ? null : u.expected().hex().getBytes(StandardCharsets.UTF_8),
                        u.newId().hex().getBytes(StandardCharsets.UTF_8)
                };
                for (byte[] x : f) size += 4 + (x == null ? 0 : x.length);
                fields.add(f);
            }
        }

        ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        b.put(typeOf(record));
        writeBytes(b, txId);
        if (record instanceof JournalRecord.Prepared p) {
            b.putLong(p.startedAtMillis());
            b.putInt(fields.size());
            for (byte[][] f : fields) {
                for (byte[] x : f) writeBytes(b, x);
            }
        }
        return b.array();
    }

    private static byte typeOf(JournalRecord record) {
        if (record instanceof JournalRecord.Prepared) return PREPARED;
        if (record instanceof JournalRecord.Committed) return COMMITTED;
        if (record instanceof JournalRecord.Aborted) return ABORTED;
        throw new IllegalStateException("Unknown journal record type: " + record);
    }

    private static void writeBytes(ByteBuffer b, byte[] data) {
        if (data == null) { b.putInt(-1); return; }
        b.putInt(data.length).put(data);
    }

    /**
     * Decode a full payload (not including header).
     *
     * @throws IllegalArgumentException if the payload is not a journal record
     */
    static JournalRecord decode(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        try {
            byte type = b.get();
            String txId = readRequired(b);
            switch (type) {
                case PREPARED: {
                    long startedAt = b.getLong();
                    int count = b.getInt();
                    if (count < 0) throw new IllegalArgumentException("Negative update count: " + count);
                    var updates = new ArrayList<RefUpdate>(count);
                    for (int i = 0; i < count; i++) {
                        String ref = readRequired(b);
                        String expected = readString(b);
                        String newId = readRequired(b);
                        updates.add(new RefUpdate(ref, expected == null ? null : Oid.of(expected), Oid.of(newId)));
                    }
                    return new JournalRecord.Prepared(txId, startedAt, List.copyOf(updates));
                }
                case COMMITTED:
                    return new JournalRecord.Committed(txId);
                case ABORTED:
                    return new JournalRecord.Aborted(txId);
                default:
                    throw new IllegalArgumentException("Unknown journal record type: " + type);
            }
        } catch (BufferUnderflowException e) {
            throw new IllegalArgumentException("Malformed journal record", e);
        }
    }

    private static String readRequired(ByteBuffer b) {
        String s = readString(b);
        if (s == null) throw new IllegalArgumentException("Missing required field");
        return s;
    }

    private static String readString(ByteBuffer b) {
        int len = b.getInt();
        if (len == -1) return null;
        if (len < 0 || len > b.remaining()) throw new IllegalArgumentException("Bad string length: " + len);
        byte[] out = new byte[len];
        b.get(out);
        return new String(out, StandardCharsets.UTF_8);
    }
}
