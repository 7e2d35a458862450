// file: storage/src/main/java/io/strata/storage/FileWal.java
package io.strata.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;

/**
 * File-backed WAL that appends framed records to numbered segment files.
 * <p>
 * Properties:
 *  - On construction, it:
 *      - creates the directory if needed,
 *      - finds the newest segment (e.g. "00000001.log", "00000002.log", ...),
 *      - cuts off a torn record at its tail, so new appends stay readable,
 *      - opens it for append.
 * <p>
 *  - append():
 *      - writes the bytes,
 *      - calls force(true) to fsync data and metadata,
 *      - tracks bytes written this segment.
 * <p>
 *  - rotateIfNeeded():
 *      - when written bytes >= rotateBytes, closes current segment and opens
 *        a new one with incremented index, resetting the counter.
 * <p>
 *  - truncate():
 *      - deletes every segment and reopens "00000001.log" empty.
 * <p>
 *  - Reader:
 *      - walks all segments in index order,
 *      - reads fixed-size header (11 bytes),
 *      - validates magic/version/length,
 *      - reads payload, validates CRC,
 *      - stops at the first truncated header/payload or bad CRC.
 * <p>
 * Writers are serialized on this instance.
 */
public class FileWal implements Wal {
    private static final Logger log = Logger.getLogger(FileWal.class.getName());
    private static final String FIRST_SEGMENT = "00000001.log";

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;

    public FileWal(Path dir, long rotateBytes) {
        if (rotateBytes <= 0) throw new IllegalArgumentException("rotateBytes must be > 0");
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create log directory " + dir, e);
        }
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] framedRecord) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(framedRecord);
            while (buf.hasRemaining()) ch.write(buf);
            ch.force(true); // fsync: metadata too, so new file appears durable after rotation
            writtenInSegment += framedRecord.length;
        } catch (IOException e) {
            throw new UncheckedIOException("WAL append failed", e);
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        try {
            ch.close();
            current = dir.resolve(String.format("%08d.log", segmentIndex(current) + 1));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
            log.log(Level.FINE, "Rotated log to " + current.getFileName());
        } catch (IOException e) {
            throw new UncheckedIOException("WAL rotation failed", e);
        }
    }

    @Override
    public synchronized void truncate() {
        try {
            ch.close();
            for (Path seg : segments(dir)) {
                Files.deleteIfExists(seg);
            }
            current = dir.resolve(FIRST_SEGMENT);
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
        } catch (IOException e) {
            throw new UncheckedIOException("WAL truncation failed", e);
        }
    }

    @Override
    public synchronized WalReader openReader() {
        return new Reader(segments(dir));
    }

    @Override
    public synchronized void close() {
        try {
            if (ch != null) ch.close();
        } catch (IOException e) {
            throw new UncheckedIOException("WAL close failed", e);
        }
    }

    /**
     * On startup:
     *  - If there are existing segments, open the newest one and position at the end.
     *  - If none, create "00000001.log".
     */
    private void openNewestOrCreate() {
        try {
            List<Path> segs = segments(dir);
            current = segs.isEmpty() ? dir.resolve(FIRST_SEGMENT) : segs.get(segs.size() - 1);
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            long valid = validLength(ch);
            if (valid < ch.size()) {
                log.log(Level.WARNING, "Discarding " + (ch.size() - valid) + " torn bytes at tail of " + current.getFileName());
                ch.truncate(valid);
                ch.force(true);
            }
            writtenInSegment = valid;
            ch.position(writtenInSegment);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open log segment in " + dir, e);
        }
    }

    /** Offset just past the last intact record of a segment. */
    private static long validLength(FileChannel ch) throws IOException {
        long pos = 0;
        long size = ch.size();
        while (pos + RecordFrame.HEADER_BYTES <= size) {
            ByteBuffer hdr = ByteBuffer.allocate(RecordFrame.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
            readFully(ch, hdr, pos);
            hdr.flip();
            short magic = hdr.getShort();
            byte ver = hdr.get();
            int len = hdr.getInt();
            int crc = hdr.getInt();
            if (magic != RecordFrame.MAGIC || ver != RecordFrame.VERSION || len < 0) break;
            if (pos + RecordFrame.HEADER_BYTES + len > size) break;
            ByteBuffer payload = ByteBuffer.allocate(len);
            readFully(ch, payload, pos + RecordFrame.HEADER_BYTES);
            if (RecordFrame.crc32(payload.array()) != crc) break;
            pos += RecordFrame.HEADER_BYTES + (long) len;
        }
        return pos;
    }

    private static void readFully(FileChannel ch, ByteBuffer buf, long position) throws IOException {
        long p = position;
        while (buf.hasRemaining()) {
            int n = ch.read(buf, p);
            if (n < 0) throw new IOException("Unexpected end of segment at offset " + p);
            p += n;
        }
    }

    private static List<Path> segments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> p.getFileName().toString().endsWith(".log"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list log segments in " + dir, e);
        }
    }

    private static int segmentIndex(Path segment) {
        return Integer.parseInt(segment.getFileName().toString().replace(".log", ""));
    }

    /**
     * Sequential reader over every segment, oldest first.
     * A torn or corrupt record ends the scan, even if later segments exist.
     */
    private static final class Reader implements WalReader {
        private final List<Path> segments;
        private int segment = -1;
        private FileChannel ch;
        private long pos = 0;
        private boolean stopped = false;

        Reader(List<Path> segments) {
            this.segments = segments;
        }

        @Override
        public byte[] next() {
            try {
                while (!stopped) {
                    if (ch == null && !openNextSegment()) return null;
                    ByteBuffer hdr = ByteBuffer.allocate(RecordFrame.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
                    int read = ch.read(hdr, pos);
                    if (read == -1 || read == 0) { // end of this segment
                        closeCurrent();
                        continue;
                    }
                    if (read < RecordFrame.HEADER_BYTES) return stop("truncated header");
                    hdr.flip();
                    short magic = hdr.getShort();
                    byte ver = hdr.get();
                    int len = hdr.getInt();
                    int crc = hdr.getInt();
                    if (magic != RecordFrame.MAGIC || ver != RecordFrame.VERSION || len < 0) return stop("bad header");
                    if (pos + RecordFrame.HEADER_BYTES + len > ch.size()) return stop("truncated payload");
                    ByteBuffer payload = ByteBuffer.allocate(len);
                    readFully(ch, payload, pos + RecordFrame.HEADER_BYTES);
                    byte[] bytes = payload.array();
                    if (RecordFrame.crc32(bytes) != crc) return stop("crc mismatch");
                    pos += RecordFrame.HEADER_BYTES + (long) len;
                    return bytes;
                }
                return null;
            } catch (IOException e) {
                throw new UncheckedIOException("WAL read failed", e);
            }
        }

        private boolean openNextSegment() throws IOException {
            if (segment + 1 >= segments.size()) return false;
            segment++;
            ch = FileChannel.open(segments.get(segment), READ);
            pos = 0;
            return true;
        }

        private void closeCurrent() throws IOException {
            ch.close();
            ch = null;
        }

        private byte[] stop(String reason) {
            log.log(Level.WARNING, "Log scan stopped at " + segments.get(segment).getFileName()
                    + " offset " + pos + ": " + reason);
            stopped = true;
            return null;
        }

        @Override
        public void close() {
            try {
                if (ch != null) closeCurrent();
            } catch (IOException e) {
                throw new UncheckedIOException("WAL reader close failed", e);
            }
        }
    }
}
