package sdmitry.multimap;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Fixed-width binary encoding of a value type.
 *
 * <p>Every encoded value occupies exactly {@link #size()} bytes; codecs never write a length
 * prefix. The all-zero byte pattern of that width is the null sentinel of the multimap, so a codec
 * should decode it to something the caller can recognise (0, an empty string, zero bytes).</p>
 */
public interface ValueCodec<V> {

    /** Encoded width in bytes (> 0). */
    int size();

    /** Write exactly {@link #size()} bytes at the buffer's position. */
    void encode(V value, ByteBuffer out);

    /** Read exactly {@link #size()} bytes from the buffer's position. */
    V decode(ByteBuffer in);

    ValueCodec<Long> LONG = new ValueCodec<>() {
        @Override
        public int size() { return Long.BYTES; }

        @Override
        public void encode(Long value, ByteBuffer out) { out.putLong(value); }

        @Override
        public Long decode(ByteBuffer in) { return in.getLong(); }
    };

    ValueCodec<Integer> INT = new ValueCodec<>() {
        @Override
        public int size() { return Integer.BYTES; }

        @Override
        public void encode(Integer value, ByteBuffer out) { out.putInt(value); }

        @Override
        public Integer decode(ByteBuffer in) { return in.getInt(); }
    };

    /**
     * Raw byte arrays of exactly {@code width} bytes.
     */
    static ValueCodec<byte[]> fixedBytes(int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("width must be > 0");
        }
        return new ValueCodec<>() {
            @Override
            public int size() { return width; }

            @Override
            public void encode(byte[] value, ByteBuffer out) {
                if (value.length != width) {
                    throw new IllegalArgumentException("expected " + width + " bytes, got " + value.length);
                }
                out.put(value);
            }

            @Override
            public byte[] decode(ByteBuffer in) {
                byte[] b = new byte[width];
                in.get(b);
                return b;
            }
        };
    }

    /**
     * UTF-8 strings stored in {@code width} bytes, zero-padded on the right.
     * Trailing zero bytes are stripped on decode, so the null sentinel decodes to {@code ""}.
     */
    static ValueCodec<String> fixedString(int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("width must be > 0");
        }
        return new ValueCodec<>() {
            @Override
            public int size() { return width; }

            @Override
            public void encode(String value, ByteBuffer out) {
                byte[] utf8 = value.getBytes(StandardCharsets.UTF_8);
                if (utf8.length > width) {
                    throw new IllegalArgumentException("string of " + utf8.length + " bytes does not fit in " + width);
                }
                out.put(utf8);
                for (int i = utf8.length; i < width; i++) out.put((byte) 0);
            }

            @Override
            public String decode(ByteBuffer in) {
                byte[] b = new byte[width];
                in.get(b);
                int len = width;
                while (len > 0 && b[len - 1] == 0) len--;
                return new String(Arrays.copyOf(b, len), StandardCharsets.UTF_8);
            }
        };
    }
}
