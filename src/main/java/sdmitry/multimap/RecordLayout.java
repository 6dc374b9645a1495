package sdmitry.multimap;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Binary layout of one fixed-width record in the data file.
 *
 * <p><strong>Wire format:</strong></p>
 * <pre>
 * [key(keyBytes)][value(codec.size())]
 *   key   : unsigned integer, big-endian, exactly keyBytes wide (1..8)
 *   value : codec-encoded value, exactly codec.size() wide
 * </pre>
 *
 * <p>Records are written back-to-back, no header and no padding, so record {@code n} starts at
 * byte {@code n * recordSize()}. Big-endian keys make the lexicographic order of the key bytes
 * equal to numeric order, which is all the sorter needs: it compares the first {@code keyBytes}
 * bytes of every record as unsigned bytes.</p>
 *
 * <p>The null value is {@code codec.size()} zero bytes.</p>
 */
public final class RecordLayout<V> {
    private final int keyBytes;
    private final ValueCodec<V> codec;
    private final int recordSize;
    private final long maxKey;
    private final byte[] nullValue;

    private RecordLayout(int keyBytes, ValueCodec<V> codec) {
        if (keyBytes < 1 || keyBytes > Long.BYTES) {
            throw new IllegalArgumentException("keyBytes must be in [1, 8]: " + keyBytes);
        }
        this.keyBytes = keyBytes;
        this.codec = Objects.requireNonNull(codec, "codec");
        if (codec.size() <= 0) {
            throw new IllegalArgumentException("value size must be > 0");
        }
        this.recordSize = keyBytes + codec.size();
        // widest key is capped at Long.MAX_VALUE, so key + 1 never overflows
        this.maxKey = keyBytes == Long.BYTES ? Long.MAX_VALUE : (1L << (8 * keyBytes)) - 1;
        this.nullValue = new byte[codec.size()];
    }

    public static <V> RecordLayout<V> of(int keyBytes, ValueCodec<V> codec) {
        return new RecordLayout<>(keyBytes, codec);
    }

    /** 8-byte keys (non-negative longs). */
    public static <V> RecordLayout<V> longKeys(ValueCodec<V> codec) {
        return new RecordLayout<>(Long.BYTES, codec);
    }

    public int keyBytes() {
        return keyBytes;
    }

    public int valueBytes() {
        return codec.size();
    }

    /** Total serialized size in bytes; constant for the lifetime of a multimap. */
    public int recordSize() {
        return recordSize;
    }

    /** Largest key representable in {@link #keyBytes()} bytes. */
    public long maxRepresentableKey() {
        return maxKey;
    }

    public ValueCodec<V> codec() {
        return codec;
    }

    public void checkKey(long key) {
        if (key < 0 || key > maxKey) {
            throw new IllegalArgumentException("key " + key + " outside [0, " + maxKey + "]");
        }
    }

    /**
     * Serialize one record at the buffer's position.
     */
    public void write(long key, V value, ByteBuffer out) {
        writeKey(key, out);
        int start = out.position();
        codec.encode(value, out);
        if (out.position() - start != codec.size()) {
            throw new IllegalStateException("codec wrote " + (out.position() - start) + " bytes, declared " + codec.size());
        }
    }

    /** Serialize one null-valued record at the buffer's position. */
    public void writeNull(long key, ByteBuffer out) {
        writeKey(key, out);
        out.put(nullValue);
    }

    private void writeKey(long key, ByteBuffer out) {
        for (int shift = 8 * (keyBytes - 1); shift >= 0; shift -= 8) {
            out.put((byte) (key >>> shift));
        }
    }

    /** Key of the record starting at absolute {@code offset} in the buffer. */
    public long readKey(ByteBuffer buf, int offset) {
        long key = 0;
        for (int i = 0; i < keyBytes; i++) {
            key = (key << 8) | (buf.get(offset + i) & 0xFF);
        }
        return key;
    }

    /** Value of the record starting at absolute {@code offset} in the buffer. */
    public V readValue(ByteBuffer buf, int offset) {
        ByteBuffer slice = buf.duplicate();
        slice.limit(offset + recordSize).position(offset + keyBytes);
        return codec.decode(slice);
    }

    /** True when the value bytes of the record at {@code offset} are all zero. */
    public boolean isNullValue(ByteBuffer buf, int offset) {
        for (int i = offset + keyBytes; i < offset + recordSize; i++) {
            if (buf.get(i) != 0) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return "RecordLayout[keyBytes=" + keyBytes + ", valueBytes=" + codec.size() + "]";
    }
}
