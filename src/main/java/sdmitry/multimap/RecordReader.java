package sdmitry.multimap;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Random-access reader over the data file.
 *
 * <p>All reads are positional ({@code FileChannel.read(buf, position)}), so the reader has no
 * shared seek position and one instance can serve concurrent queries. Record {@code n} lives at
 * byte {@code n * recordSize}; its value at {@code n * recordSize + keyBytes}.</p>
 *
 * <p>Records appended after the reader was opened are visible once the writer flushed them.</p>
 */
public final class RecordReader<V> implements AutoCloseable {
    private static final int MAX_READ_BYTES = 1 << 20;

    private final Path path;
    private final RecordLayout<V> layout;
    private final FileChannel channel;

    public RecordReader(Path path, RecordLayout<V> layout) throws IOException {
        this.path = path;
        this.layout = layout;
        this.channel = FileChannel.open(path, StandardOpenOption.READ);
    }

    /**
     * Number of whole records in the file.
     *
     * @throws CorruptRecordFileException if the file size is not a multiple of the record size
     */
    public long recordCount() throws IOException {
        return recordCount(path, channel.size(), layout.recordSize());
    }

    static long recordCount(Path path, long size, int recordSize) throws CorruptRecordFileException {
        if (size % recordSize != 0) {
            throw new CorruptRecordFileException(path, size, recordSize);
        }
        return size / recordSize;
    }

    /** Key of record {@code n}. The caller guarantees {@code n < recordCount()}. */
    public long nthKey(long n) throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(layout.keyBytes());
        readFully(buf, n * layout.recordSize());
        buf.flip();
        long key = 0;
        while (buf.hasRemaining()) {
            key = (key << 8) | (buf.get() & 0xFF);
        }
        return key;
    }

    /** Value of record {@code n}. The caller guarantees {@code n < recordCount()}. */
    public V nthValue(long n) throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(layout.valueBytes());
        readFully(buf, n * layout.recordSize() + layout.keyBytes());
        buf.flip();
        return layout.codec().decode(buf);
    }

    /**
     * Values of every record in the run, in file order.
     *
     * @param skipNull drop records whose value bytes are all zero
     */
    public List<V> values(Run run, boolean skipNull) throws IOException {
        List<V> out = new ArrayList<>((int) Math.min(run.length(), 1024));
        int recordSize = layout.recordSize();
        int perRead = Math.max(1, MAX_READ_BYTES / recordSize);
        ByteBuffer buf = ByteBuffer.allocate((int) Math.min(run.length(), perRead) * recordSize);
        long next = run.start();
        while (next < run.end()) {
            int n = (int) Math.min(run.end() - next, perRead);
            buf.clear().limit(n * recordSize);
            readFully(buf, next * recordSize);
            for (int i = 0; i < n; i++) {
                int off = i * recordSize;
                if (skipNull && layout.isNullValue(buf, off)) continue;
                out.add(layout.readValue(buf, off));
            }
            next += n;
        }
        return out;
    }

    /**
     * Sequential cursor over records {@code [from, to)}.
     *
     * @param bufferRecords records fetched per read
     */
    public RecordCursor<V> cursor(long from, long to, int bufferRecords) {
        return new RecordCursor<>(this, layout, from, to, bufferRecords);
    }

    void readFully(ByteBuffer buf, long position) throws IOException {
        long pos = position;
        while (buf.hasRemaining()) {
            int n = channel.read(buf, pos);
            if (n < 0) {
                throw new EOFException("Unexpected end of '" + path + "' at byte " + pos);
            }
            pos += n;
        }
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
