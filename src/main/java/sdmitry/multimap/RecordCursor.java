package sdmitry.multimap;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Forward-only cursor over a record range, reading blocks of records at a time.
 *
 * <pre>
 * RecordCursor&lt;V&gt; c = reader.cursor(0, n, 4096);
 * while (c.next()) {
 *     long k = c.key();
 * }
 * </pre>
 *
 * Not thread safe; each scan owns its cursor.
 */
public final class RecordCursor<V> {
    private final RecordReader<V> reader;
    private final RecordLayout<V> layout;
    private final long to;
    private final ByteBuffer block;
    private final int blockRecords;

    private int filled;
    private int slot = -1;
    private long index;

    RecordCursor(RecordReader<V> reader, RecordLayout<V> layout, long from, long to, int bufferRecords) {
        if (from < 0 || to < from) {
            throw new IllegalArgumentException("bad range [" + from + ", " + to + ")");
        }
        this.reader = reader;
        this.layout = layout;
        this.to = to;
        this.blockRecords = Math.max(1, bufferRecords);
        this.block = ByteBuffer.allocate(blockRecords * layout.recordSize());
        this.index = from - 1;
    }

    /** Advance to the next record; false once the range is exhausted. */
    public boolean next() throws IOException {
        if (index + 1 >= to) {
            return false;
        }
        index++;
        slot++;
        if (slot >= filled) {
            filled = (int) Math.min(blockRecords, to - index);
            block.clear().limit(filled * layout.recordSize());
            reader.readFully(block, index * layout.recordSize());
            slot = 0;
        }
        return true;
    }

    /** Index of the current record in the file. */
    public long index() {
        return index;
    }

    public long key() {
        return layout.readKey(block, slot * layout.recordSize());
    }
}
