package sdmitry.multimap;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class RecordLayoutTest {

    @Test
    void recordSizeIsKeyPlusValue() {
        assertEquals(12, RecordLayout.of(4, ValueCodec.LONG).recordSize());
        assertEquals(16, RecordLayout.longKeys(ValueCodec.LONG).recordSize());
        assertEquals(3 + 10, RecordLayout.of(3, ValueCodec.fixedString(10)).recordSize());
        assertThrows(IllegalArgumentException.class, () -> RecordLayout.of(0, ValueCodec.LONG));
        assertThrows(IllegalArgumentException.class, () -> RecordLayout.of(9, ValueCodec.LONG));
    }

    @Test
    void keyBytesSortLikeNumbers() {
        RecordLayout<Integer> layout = RecordLayout.of(2, ValueCodec.INT);
        ByteBuffer a = ByteBuffer.allocate(layout.recordSize());
        ByteBuffer b = ByteBuffer.allocate(layout.recordSize());
        layout.write(255, 1, a);
        layout.write(256, 1, b);

        assertTrue(Arrays.compareUnsigned(a.array(), 0, 2, b.array(), 0, 2) < 0);
        assertEquals(255, layout.readKey(a, 0));
        assertEquals(256, layout.readKey(b, 0));
        assertEquals(65535, layout.maxRepresentableKey());
    }

    @Test
    void nullValueIsAllZeroBytes() {
        RecordLayout<String> layout = RecordLayout.of(4, ValueCodec.fixedString(6));
        ByteBuffer buf = ByteBuffer.allocate(2 * layout.recordSize());
        layout.writeNull(7, buf);
        layout.write(8, "hi", buf);

        assertTrue(layout.isNullValue(buf, 0));
        assertEquals("", layout.readValue(buf, 0));
        assertFalse(layout.isNullValue(buf, layout.recordSize()));
        assertEquals("hi", layout.readValue(buf, layout.recordSize()));
        assertEquals(8, layout.readKey(buf, layout.recordSize()));
    }

    @Test
    void oversizedValuesAreRejected() {
        RecordLayout<String> strings = RecordLayout.of(4, ValueCodec.fixedString(2));
        assertThrows(IllegalArgumentException.class, () -> strings.write(1, "abc", ByteBuffer.allocate(16)));

        RecordLayout<byte[]> bytes = RecordLayout.of(4, ValueCodec.fixedBytes(3));
        assertThrows(IllegalArgumentException.class, () -> bytes.write(1, new byte[4], ByteBuffer.allocate(16)));
    }
}
