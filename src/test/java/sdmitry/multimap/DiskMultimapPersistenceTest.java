package sdmitry.multimap;

import it.unimi.dsi.bits.LongArrayBitVector;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import sdmitry.multimap.succinct.EliasFanoOrdinalIndex;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class DiskMultimapPersistenceTest {

    private static Path buildAndSave(Path dir) throws Exception {
        Path data = dir.resolve("data.bin");
        Random rnd = new Random(3);
        try (DiskMultimap<Long> mm = new DiskMultimap<>(data, RecordLayout.of(4, ValueCodec.LONG))) {
            mm.start();
            for (long i = 1; i <= 400; i++) {
                mm.append(rnd.nextInt(90) * 2, i);
            }
            mm.index();
            long written = mm.save();
            assertEquals(Files.size(mm.indexFile()), written);
        }
        return data;
    }

    @Test
    void loadAnswersLikeTheBuiltIndex(@TempDir Path dir) throws Exception {
        Path data = dir.resolve("data.bin");
        Random rnd = new Random(11);
        try (DiskMultimap<Long> built = new DiskMultimap<>(data, RecordLayout.of(4, ValueCodec.LONG))) {
            built.start();
            for (long i = 1; i <= 1000; i++) {
                built.append(rnd.nextInt(250), i);
            }
            built.index();
            built.save();

            // 2nd instance over the same files must answer without rebuilding
            try (DiskMultimap<Long> loaded = new DiskMultimap<>(data, RecordLayout.of(4, ValueCodec.LONG))) {
                loaded.start();
                loaded.load();
                assertEquals(State.INDEXED, loaded.state());
                assertEquals(built.maxKey(), loaded.maxKey());
                assertEquals(built.recordCount(), loaded.recordCount());
                for (long k = 0; k <= built.maxKey(); k++) {
                    assertEquals(built.values(k), loaded.values(k), "values of key " + k);
                    assertEquals(built.run(k), loaded.run(k));
                }
            }
        }
    }

    @Test
    void indexFileSitsNextToDataFile(@TempDir Path dir) throws Exception {
        Path data = buildAndSave(dir);
        assertTrue(Files.exists(dir.resolve("data.bin.idx")));
        byte[] head = Arrays.copyOf(Files.readAllBytes(data.resolveSibling("data.bin.idx")), 13);
        assertArrayEquals("dmultimap".getBytes(), Arrays.copyOf(head, 9));
        assertEquals(1, ByteBuffer.wrap(head, 9, 4).getInt());
    }

    @Test
    void wrongVersionIsReported(@TempDir Path dir) throws Exception {
        Path data = buildAndSave(dir);
        Path idx = dir.resolve("data.bin.idx");
        byte[] bytes = Files.readAllBytes(idx);
        ByteBuffer.wrap(bytes).putInt(9, 2);
        Files.write(idx, bytes);

        try (DiskMultimap<Long> mm = new DiskMultimap<>(data, RecordLayout.of(4, ValueCodec.LONG))) {
            mm.start();
            IndexVersionException e = assertThrows(IndexVersionException.class, mm::load);
            assertEquals(2, e.getActualVersion());
            assertEquals(1, e.getExpectedVersion());
        }
    }

    @Test
    void dataChangedAfterSaveIsOutOfSync(@TempDir Path dir) throws Exception {
        Path data = buildAndSave(dir);
        try (DiskMultimap<Long> mm = new DiskMultimap<>(data, RecordLayout.of(4, ValueCodec.LONG))) {
            mm.start();
            mm.append(0, 12345L);
            IndexOutOfSyncException e = assertThrows(IndexOutOfSyncException.class, mm::load);
            assertEquals("record_count", e.getField());
        }
    }

    @Test
    void differentRecordLayoutIsOutOfSync(@TempDir Path dir) throws Exception {
        Path data = buildAndSave(dir);
        // 6-byte records divide the 12-byte ones, so the data file itself still looks whole
        try (DiskMultimap<Integer> mm = new DiskMultimap<>(data, RecordLayout.of(2, ValueCodec.INT))) {
            mm.start();
            IndexOutOfSyncException e = assertThrows(IndexOutOfSyncException.class, mm::load);
            assertEquals("record_size", e.getField());
            assertEquals(12, e.getStored());
            assertEquals(6, e.getActual());
        }
    }

    @Test
    void garbageAndTruncatedFilesAreFormatErrors(@TempDir Path dir) throws Exception {
        Path data = buildAndSave(dir);
        Path idx = dir.resolve("data.bin.idx");
        byte[] good = Files.readAllBytes(idx);

        Files.write(idx, "not an index file at all".getBytes());
        try (DiskMultimap<Long> mm = new DiskMultimap<>(data, RecordLayout.of(4, ValueCodec.LONG))) {
            mm.start();
            IndexFormatException e = assertThrows(IndexFormatException.class, mm::load);
            assertEquals(IndexFormatException.class, e.getClass());
            assertEquals(idx, e.getIndexFile());
        }

        Files.write(idx, Arrays.copyOf(good, 30));
        try (DiskMultimap<Long> mm = new DiskMultimap<>(data, RecordLayout.of(4, ValueCodec.LONG))) {
            mm.start();
            IndexFormatException e = assertThrows(IndexFormatException.class, mm::load);
            assertEquals(IndexFormatException.class, e.getClass());
        }
    }

    @Test
    void lastKeyRewrittenAfterSaveIsOutOfSync(@TempDir Path dir) throws Exception {
        Path data = buildAndSave(dir);
        long maxKey;
        try (DiskMultimap<Long> mm = new DiskMultimap<>(data, RecordLayout.of(4, ValueCodec.LONG))) {
            mm.start();
            mm.load();
            maxKey = mm.maxKey();
        }
        byte[] bytes = Files.readAllBytes(data);
        ByteBuffer.wrap(bytes).putInt(bytes.length - 12, (int) maxKey - 1);
        Files.write(data, bytes);

        try (DiskMultimap<Long> mm = new DiskMultimap<>(data, RecordLayout.of(4, ValueCodec.LONG))) {
            mm.start();
            IndexOutOfSyncException e = assertThrows(IndexOutOfSyncException.class, mm::load);
            assertEquals("max_key", e.getField());
            assertEquals(maxKey, e.getStored());
            assertEquals(maxKey - 1, e.getActual());
        }
    }

    /** Three records with keys 0, 1, 2, one per key, and no index file. */
    private static Path threeKeys(Path dir) throws Exception {
        Path data = dir.resolve("data.bin");
        try (DiskMultimap<Long> mm = new DiskMultimap<>(data, RecordLayout.of(4, ValueCodec.LONG))) {
            mm.start();
            for (long k = 0; k < 3; k++) {
                mm.append(k, k + 1);
            }
        }
        return data;
    }

    private static void writeIndex(Path data, LongArrayBitVector keyStarts) throws Exception {
        Path idx = data.resolveSibling(data.getFileName() + ".idx");
        IndexFile.write(idx,
                new IndexFile.Contents(12, 3, 2, EliasFanoOrdinalIndex.of(keyStarts)),
                EliasFanoOrdinalIndex.FACTORY);
    }

    @Test
    void keyStartsOfAnotherLengthAreOutOfSync(@TempDir Path dir) throws Exception {
        Path data = threeKeys(dir);
        LongArrayBitVector bits = LongArrayBitVector.ofLength(4);
        bits.set(0);
        bits.set(1);
        bits.set(2);
        writeIndex(data, bits);

        try (DiskMultimap<Long> mm = new DiskMultimap<>(data, RecordLayout.of(4, ValueCodec.LONG))) {
            mm.start();
            IndexOutOfSyncException e = assertThrows(IndexOutOfSyncException.class, mm::load);
            assertEquals("key_starts length", e.getField());
            assertEquals(4, e.getStored());
            assertEquals(3, e.getActual());
        }
    }

    @Test
    void keyStartsMissingAKeyAreOutOfSync(@TempDir Path dir) throws Exception {
        Path data = threeKeys(dir);
        LongArrayBitVector bits = LongArrayBitVector.ofLength(3);
        bits.set(0);
        bits.set(2);
        writeIndex(data, bits);

        try (DiskMultimap<Long> mm = new DiskMultimap<>(data, RecordLayout.of(4, ValueCodec.LONG))) {
            mm.start();
            IndexOutOfSyncException e = assertThrows(IndexOutOfSyncException.class, mm::load);
            assertEquals("key_starts count", e.getField());
            assertEquals(2, e.getStored());
            assertEquals(3, e.getActual());
            assertEquals(State.APPENDING, mm.state());
        }
    }

    @Test
    void matchingHandWrittenIndexLoads(@TempDir Path dir) throws Exception {
        Path data = threeKeys(dir);
        LongArrayBitVector bits = LongArrayBitVector.ofLength(3);
        bits.set(0);
        bits.set(1);
        bits.set(2);
        writeIndex(data, bits);

        try (DiskMultimap<Long> mm = new DiskMultimap<>(data, RecordLayout.of(4, ValueCodec.LONG))) {
            mm.start();
            mm.load();
            assertEquals(List.of(2L), mm.values(1));
            assertEquals(List.of(3L), mm.values(2));
        }
    }

    @Test
    void failedSaveLeavesNoTemporaryFile(@TempDir Path dir) throws Exception {
        Path data = threeKeys(dir);
        // a non-empty directory where the index file should go makes the final move fail
        Path blocker = Files.createDirectory(dir.resolve("data.bin.idx"));
        Files.write(blocker.resolve("keep"), new byte[]{1});

        try (DiskMultimap<Long> mm = new DiskMultimap<>(data, RecordLayout.of(4, ValueCodec.LONG))) {
            mm.start();
            mm.index();
            assertThrows(IOException.class, mm::save);
        }
        assertFalse(Files.exists(dir.resolve("data.bin.idx.tmp")));
        assertTrue(Files.isDirectory(blocker));
    }

    @Test
    void saveRequiresIndex(@TempDir Path dir) throws Exception {
        try (DiskMultimap<Long> mm = new DiskMultimap<>(dir.resolve("data.bin"), RecordLayout.of(4, ValueCodec.LONG))) {
            mm.start();
            mm.append(1, 1L);
            assertThrows(IllegalStateException.class, mm::save);
        }
    }
}
