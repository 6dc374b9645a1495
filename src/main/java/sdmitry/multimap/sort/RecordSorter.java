package sdmitry.multimap.sort;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Sorts a file of fixed-size records in place by a fixed-width key prefix.
 *
 * <p>Keys are compared as unsigned bytes over the first {@code keySize} bytes of each record.
 * A record is never split: each {@code recordSize}-byte block moves as a unit. Ties keep no
 * particular order. Sorting a sorted file must leave its contents intact.</p>
 *
 * <p>No handle on {@code file} may be open for writing while {@link #sort} runs.</p>
 */
public interface RecordSorter {
    void sort(Path file, int recordSize, int keySize) throws IOException;
}
