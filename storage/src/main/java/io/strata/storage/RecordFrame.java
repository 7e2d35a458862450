// file: storage/src/main/java/io/strata/storage/RecordFrame.java
package io.strata.storage;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.zip.CRC32;

/**
 * Binary framing for log records.
 * <p>
 * On-disk layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0x57A7   (helps detect garbage)
 *     - version (1B)  = 1        (for future upgrades)
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes)]
 * <p>
 * The payload is opaque here; record codecs define its contents.
 */
public final class RecordFrame {
    public static final short MAGIC = (short) 0x57A7;
    public static final byte VERSION = 1;
    public static final int HEADER_BYTES = 2 + 1 + 4 + 4;

    private RecordFrame() {
    }

    /** Prefix {@code payload} with a header, ready for {@link Wal#append(byte[])}. */
    public static byte[] frame(byte[] payload) {
        ByteBuffer b = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        b.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        b.put(payload);
        return b.array();
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue(); // unsigned value truncated to int; compared as int
    }
}
