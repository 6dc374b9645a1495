package sdmitry.multimap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sdmitry.multimap.succinct.OrdinalIndex;
import sdmitry.multimap.succinct.OrdinalIndexFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;

/**
 * Companion index file of a {@link DiskMultimap}.
 *
 * <p><strong>Format (big-endian):</strong></p>
 * <pre>
 * [magic(9) "dmultimap"][version(4)]
 * [w(1)][record_size(w)]
 * [w(1)][record_count(w)]
 * [w(1)][max_key(w)]
 * [len(8)][bit vector blob(len)]
 * [len(8)][select blob(len)]
 * </pre>
 * Integers are size-prefixed: one byte giving the width {@code w} (1..8), then {@code w} bytes.
 * The writer always uses {@code w = 8}. Blobs are produced by the configured
 * {@link OrdinalIndexFactory}.
 *
 * <p>All integers, keys in the data file included, are big-endian on every platform rather than
 * in host byte order, so unsigned key bytes compare like the keys and files move between hosts.</p>
 *
 * <p>The file is written to a {@code .tmp} sibling, forced to disk and atomically moved over the
 * previous index, so readers see either the old or the new index in full. A failed write
 * removes the {@code .tmp} file.</p>
 */
final class IndexFile {
    private static final Logger log = LoggerFactory.getLogger(IndexFile.class);

    static final byte[] MAGIC = "dmultimap".getBytes(StandardCharsets.US_ASCII);
    static final int VERSION = 1;

    private IndexFile() {
    }

    /** Persisted fields of an index, before they are checked against the data file. */
    record Contents(long recordSize, long recordCount, long maxKey, OrdinalIndex keyStarts) {
    }

    /**
     * @return bytes written
     */
    static long write(Path file, Contents contents, OrdinalIndexFactory factory) throws IOException {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        byte[] bits = factory.bitsBlob(contents.keyStarts());
        byte[] select = factory.selectBlob(contents.keyStarts());
        long written;
        boolean moved = false;
        try {
            try (DataOutputStream out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(tmp,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)))) {
                out.write(MAGIC);
                out.writeInt(VERSION);
                writeSized(out, contents.recordSize());
                writeSized(out, contents.recordCount());
                writeSized(out, contents.maxKey());
                out.writeLong(bits.length);
                out.write(bits);
                out.writeLong(select.length);
                out.write(select);
            }
            written = Files.size(tmp);
            try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.READ)) {
                ch.force(true);
            }
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            moved = true;
        } finally {
            if (!moved) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    log.warn("Could not delete '{}'", tmp, e);
                }
            }
        }
        Path dir = file.toAbsolutePath().getParent();
        if (dir != null) {
            try (FileChannel d = FileChannel.open(dir, StandardOpenOption.READ)) {
                d.force(true);
            } catch (IOException e) {
                // some platforms cannot open directories; the move itself already happened
                log.debug("Could not fsync directory '{}'", dir, e);
            }
        }
        log.debug("Wrote index '{}' ({} bytes, {} records, max key {})",
                file, written, contents.recordCount(), contents.maxKey());
        return written;
    }

    static Contents read(Path file, OrdinalIndexFactory factory) throws IOException {
        long fileSize = Files.size(file);
        try (DataInputStream in = new DataInputStream(new BufferedInputStream(Files.newInputStream(file)))) {
            byte[] magic = new byte[MAGIC.length];
            in.readFully(magic);
            if (!Arrays.equals(magic, MAGIC)) {
                throw new IndexFormatException(file, "bad magic");
            }
            long version = Integer.toUnsignedLong(in.readInt());
            if (version != VERSION) {
                throw new IndexVersionException(file, VERSION, version);
            }
            long recordSize = readSized(in, file);
            long recordCount = readSized(in, file);
            long maxKey = readSized(in, file);
            byte[] bits = readBlob(in, file, fileSize, "bit vector");
            byte[] select = readBlob(in, file, fileSize, "select");
            OrdinalIndex keyStarts;
            try {
                keyStarts = factory.read(bits, select);
            } catch (IOException e) {
                throw new IndexFormatException(file, "unreadable select index", e);
            }
            return new Contents(recordSize, recordCount, maxKey, keyStarts);
        } catch (EOFException e) {
            throw new IndexFormatException(file, "truncated", e);
        }
    }

    private static void writeSized(DataOutputStream out, long value) throws IOException {
        out.writeByte(Long.BYTES);
        out.writeLong(value);
    }

    private static long readSized(DataInputStream in, Path file) throws IOException {
        int width = in.readUnsignedByte();
        if (width < 1 || width > Long.BYTES) {
            throw new IndexFormatException(file, "bad integer width " + width);
        }
        long value = 0;
        for (int i = 0; i < width; i++) {
            value = (value << 8) | in.readUnsignedByte();
        }
        return value;
    }

    private static byte[] readBlob(DataInputStream in, Path file, long fileSize, String what) throws IOException {
        long len = in.readLong();
        if (len < 0 || len > fileSize || len > Integer.MAX_VALUE - 8) {
            throw new IndexFormatException(file, "bad " + what + " blob length " + len);
        }
        byte[] blob = new byte[(int) len];
        in.readFully(blob);
        return blob;
    }
}
