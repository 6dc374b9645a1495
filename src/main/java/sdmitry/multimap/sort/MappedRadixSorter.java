package sdmitry.multimap.sort;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Sorts the data file in place through a read-write memory mapping.
 *
 * <p>No extra disk space is needed and the OS pages the file in and out, but the whole file must
 * fit one mapping (at most {@link Integer#MAX_VALUE} bytes). Larger files belong to
 * {@link ExternalMergeSorter}.</p>
 */
public final class MappedRadixSorter implements RecordSorter {
    private static final Logger log = LoggerFactory.getLogger(MappedRadixSorter.class);

    /** Buckets at or below this many records are finished with insertion sort. */
    public static final int DEFAULT_CUT_OFF = 4;

    private final int cutOff;

    public MappedRadixSorter() {
        this(DEFAULT_CUT_OFF);
    }

    /**
     * @param cutOff bucket size at which radix passes stop and insertion sort takes over (>= 1)
     */
    public MappedRadixSorter(int cutOff) {
        if (cutOff < 1) {
            throw new IllegalArgumentException("cutOff must be >= 1");
        }
        this.cutOff = cutOff;
    }

    @Override
    public void sort(Path file, int recordSize, int keySize) throws IOException {
        long started = System.nanoTime();
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            long size = ch.size();
            if (size % recordSize != 0) {
                throw new IOException("File '" + file + "' of " + size + " bytes is not a whole number of " + recordSize + "-byte records");
            }
            if (size > Integer.MAX_VALUE) {
                throw new IOException("File '" + file + "' of " + size + " bytes does not fit one mapping");
            }
            if (size == 0) return;
            MappedByteBuffer map = ch.map(FileChannel.MapMode.READ_WRITE, 0, size);
            RadixSort.sort(map, (int) (size / recordSize), recordSize, keySize, cutOff);
            map.force();
            log.debug("Sorted {} records of '{}' in place in {} ms",
                    size / recordSize, file, (System.nanoTime() - started) / 1_000_000);
        }
    }
}
