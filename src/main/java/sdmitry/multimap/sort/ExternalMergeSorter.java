package sdmitry.multimap.sort;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Out-of-core sort of the data file.
 *
 * Algorithm:
 *   - read the file in chunks of at most {@code chunkBytes} (whole records);
 *   - radix-sort each chunk in memory;
 *   - a file that fits one chunk is written back in place and we are done;
 *   - otherwise spill every sorted chunk to a run file, k-way merge the runs into a sibling
 *     temporary file and move it over the data file.
 *
 * Memory is bounded by one chunk plus one read buffer per run during the merge.
 * Run files live in {@code tmpDir} (the data file's directory by default). They and the
 * {@code <file>.sorting} merge target are deleted when the sort fails.
 * Runs are deleted on success too.
 */
public final class ExternalMergeSorter implements RecordSorter {
    private static final Logger log = LoggerFactory.getLogger(ExternalMergeSorter.class);

    public static final long DEFAULT_CHUNK_BYTES = 64L << 20; // 64MiB
    private static final int STREAM_BUFFER_BYTES = 64 * 1024;

    private final long chunkBytes;
    private final Path tmpDir;
    private final int cutOff;

    public ExternalMergeSorter() {
        this(DEFAULT_CHUNK_BYTES, null);
    }

    /**
     * @param chunkBytes in-memory chunk budget; at least one record is always sorted per chunk
     * @param tmpDir     directory for run files, or {@code null} for the data file's directory
     */
    public ExternalMergeSorter(long chunkBytes, Path tmpDir) {
        this(chunkBytes, tmpDir, MappedRadixSorter.DEFAULT_CUT_OFF);
    }

    public ExternalMergeSorter(long chunkBytes, Path tmpDir, int cutOff) {
        if (chunkBytes <= 0) {
            throw new IllegalArgumentException("chunkBytes must be > 0");
        }
        if (cutOff < 1) {
            throw new IllegalArgumentException("cutOff must be >= 1");
        }
        this.chunkBytes = chunkBytes;
        this.tmpDir = tmpDir;
        this.cutOff = cutOff;
    }

    @Override
    public void sort(Path file, int recordSize, int keySize) throws IOException {
        long started = System.nanoTime();
        long size = Files.size(file);
        if (size % recordSize != 0) {
            throw new IOException("File '" + file + "' of " + size + " bytes is not a whole number of " + recordSize + "-byte records");
        }
        if (size == 0) return;

        long records = size / recordSize;
        int chunkRecords = (int) Math.max(1, Math.min(chunkBytes, Integer.MAX_VALUE) / recordSize);
        ByteBuffer chunk = ByteBuffer.allocate((int) Math.min(records, chunkRecords) * recordSize);

        if (records <= chunkRecords) {
            try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
                readChunk(ch, chunk, 0);
                RadixSort.sort(chunk, (int) records, recordSize, keySize, cutOff);
                chunk.rewind();
                writeFully(ch, chunk, 0);
                ch.force(true);
            }
            log.debug("Sorted {} records of '{}' in one chunk in {} ms",
                    records, file, (System.nanoTime() - started) / 1_000_000);
            return;
        }

        List<Path> runs = new ArrayList<>();
        try {
            try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ)) {
                for (long first = 0; first < records; first += chunkRecords) {
                    int n = (int) Math.min(chunkRecords, records - first);
                    chunk.clear().limit(n * recordSize);
                    readChunk(ch, chunk, first * recordSize);
                    RadixSort.sort(chunk, n, recordSize, keySize, cutOff);
                    chunk.rewind();
                    runs.add(spill(file, chunk));
                }
            }
            merge(file, runs, recordSize, keySize);
        } finally {
            for (Path run : runs) {
                deleteQuietly(run);
            }
        }
        log.debug("Sorted {} records of '{}' through {} runs in {} ms",
                records, file, runs.size(), (System.nanoTime() - started) / 1_000_000);
    }

    private Path spill(Path file, ByteBuffer sorted) throws IOException {
        Path dir = tmpDir != null ? tmpDir : file.toAbsolutePath().getParent();
        Path run = Files.createTempFile(dir, file.getFileName().toString() + "-", ".run");
        try (FileChannel out = FileChannel.open(run, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            writeFully(out, sorted, 0);
        }
        return run;
    }

    /** Merge sorted runs into {@code <file>.sorting}, then move it over {@code file}. */
    void merge(Path file, List<Path> runs, int recordSize, int keySize) throws IOException {
        Path tmp = file.resolveSibling(file.getFileName() + ".sorting");
        PriorityQueue<RunCursor> heads = new PriorityQueue<>(Math.max(1, runs.size()),
                (a, b) -> Arrays.compareUnsigned(a.record, 0, keySize, b.record, 0, keySize));
        List<RunCursor> open = new ArrayList<>(runs.size());
        boolean moved = false;
        try {
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(tmp,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING),
                    STREAM_BUFFER_BYTES)) {
                for (Path run : runs) {
                    RunCursor c = new RunCursor(run, recordSize);
                    open.add(c);
                    if (c.advance()) heads.add(c);
                }
                while (!heads.isEmpty()) {
                    RunCursor c = heads.poll();
                    out.write(c.record);
                    if (c.advance()) heads.add(c);
                }
            } finally {
                for (RunCursor c : open) c.close();
            }
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
            if (!moved) deleteQuietly(tmp);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete sort file '{}'", file, e);
        }
    }

    private static void readChunk(FileChannel ch, ByteBuffer chunk, long position) throws IOException {
        long pos = position;
        while (chunk.hasRemaining()) {
            int n = ch.read(chunk, pos);
            if (n < 0) throw new IOException("File shrank while sorting at byte " + pos);
            pos += n;
        }
    }

    private static void writeFully(FileChannel ch, ByteBuffer buf, long position) throws IOException {
        long pos = position;
        while (buf.hasRemaining()) {
            pos += ch.write(buf, pos);
        }
    }

    /** Sequential reader over one sorted run. */
    private static final class RunCursor implements AutoCloseable {
        private final DataInputStream in;
        private final long records;
        private long consumed;
        final byte[] record;

        RunCursor(Path run, int recordSize) throws IOException {
            this.records = Files.size(run) / recordSize;
            this.record = new byte[recordSize];
            this.in = new DataInputStream(new BufferedInputStream(Files.newInputStream(run), STREAM_BUFFER_BYTES));
        }

        boolean advance() throws IOException {
            if (consumed >= records) return false;
            in.readFully(record);
            consumed++;
            return true;
        }

        @Override
        public void close() throws IOException {
            in.close();
        }
    }
}
