package sdmitry.multimap.sort;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static sdmitry.multimap.sort.SortFixtures.*;

public class ExternalMergeSorterTest {

    @Test
    void mergesManyRuns(@TempDir Path dir) throws Exception {
        byte[] input = randomRecords(4000, 700, 5);
        Path file = write(dir, input);

        // 100 records per chunk -> 40 runs
        new ExternalMergeSorter(100L * RECORD, null).sort(file, RECORD, KEY);

        byte[] out = Files.readAllBytes(file);
        assertSorted(out);
        assertSameRecords(input, out);
    }

    @Test
    void chunkSizeNotAMultipleOfRecordSize(@TempDir Path dir) throws Exception {
        byte[] input = randomRecords(333, 1 << 30, 6);
        Path file = write(dir, input);

        new ExternalMergeSorter(50, null).sort(file, RECORD, KEY);

        byte[] out = Files.readAllBytes(file);
        assertSorted(out);
        assertSameRecords(input, out);
    }

    @Test
    void singleChunkIsSortedInPlace(@TempDir Path dir) throws Exception {
        byte[] input = randomRecords(1000, 100, 7);
        Path file = write(dir, input);
        ExternalMergeSorter sorter = new ExternalMergeSorter();

        sorter.sort(file, RECORD, KEY);
        byte[] once = Files.readAllBytes(file);
        assertSorted(once);
        assertSameRecords(input, once);

        sorter.sort(file, RECORD, KEY);
        assertArrayEquals(once, Files.readAllBytes(file));
    }

    @Test
    void runFilesAreRemoved(@TempDir Path dir) throws Exception {
        Path runs = Files.createDirectory(dir.resolve("runs"));
        Path file = write(dir, randomRecords(1000, 1000, 8));

        new ExternalMergeSorter(64L * RECORD, runs).sort(file, RECORD, KEY);

        assertSorted(Files.readAllBytes(file));
        try (Stream<Path> left = Files.list(runs)) {
            assertEquals(0, left.count());
        }
        try (Stream<Path> siblings = Files.list(dir)) {
            assertTrue(siblings.noneMatch(p -> p.getFileName().toString().endsWith(".sorting")));
        }
    }

    @Test
    void failedMergeLeavesDataAndNoTemporaryFile(@TempDir Path dir) throws Exception {
        byte[] input = randomRecords(50, 10, 9);
        Path file = write(dir, input);
        Path run = Files.write(dir.resolve("a.run"), input);

        ExternalMergeSorter sorter = new ExternalMergeSorter();
        assertThrows(NoSuchFileException.class,
                () -> sorter.merge(file, List.of(run, dir.resolve("missing.run")), RECORD, KEY));

        assertFalse(Files.exists(dir.resolve("records.bin.sorting")));
        assertArrayEquals(input, Files.readAllBytes(file));
    }

    @Test
    void rejectsBadConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new ExternalMergeSorter(0, null));
        assertThrows(IllegalArgumentException.class, () -> new ExternalMergeSorter(1024, null, 0));
    }
}
