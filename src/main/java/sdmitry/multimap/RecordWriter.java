package sdmitry.multimap;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Append-only writer for the data file.
 *
 * Does:
 *   - open/create the data file in append mode;
 *   - buffer whole records and write them to the end of the file.
 *
 * Concurrency:
 *   - append methods are synchronized, one writer per data file;
 *   - readers use their own channel ({@link RecordReader}) and only see flushed records.
 *
 * The owner must close this writer before the file is sorted: the sorter rewrites the file's
 * bytes and an open append handle would interleave with it.
 */
public final class RecordWriter<V> implements AutoCloseable {
    private final RecordLayout<V> layout;
    private final FileChannel channel;
    private final ByteBuffer buffer;

    /**
     * @param path        data file; created if absent
     * @param layout      record layout
     * @param bufferBytes write buffer size; rounded down to whole records, at least one record
     */
    public RecordWriter(Path path, RecordLayout<V> layout, int bufferBytes) throws IOException {
        this.layout = layout;
        int records = Math.max(1, bufferBytes / layout.recordSize());
        this.buffer = ByteBuffer.allocate(records * layout.recordSize());
        this.channel = FileChannel.open(
                path,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    /** Append one record with a real value. */
    public synchronized void append(long key, V value) throws IOException {
        ensureRoom();
        int start = buffer.position();
        try {
            layout.write(key, value, buffer);
        } catch (RuntimeException e) {
            // drop the partial record so the file stays a whole number of records
            buffer.position(start);
            throw e;
        }
    }

    /** Append one record carrying the null value. */
    public synchronized void appendNull(long key) throws IOException {
        ensureRoom();
        layout.writeNull(key, buffer);
    }

    /** Write buffered records to the file. */
    public synchronized void flush() throws IOException {
        buffer.flip();
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
        buffer.clear();
    }

    private void ensureRoom() throws IOException {
        if (buffer.remaining() < layout.recordSize()) {
            flush();
        }
    }

    /** Flush and close the underlying channel. */
    @Override
    public synchronized void close() throws IOException {
        try {
            flush();
        } finally {
            channel.close();
        }
    }
}
