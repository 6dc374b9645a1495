package sdmitry.multimap;

/**
 * Contiguous range of record indexes sharing one key in the sorted, densified data file.
 *
 * <p>{@code start} is inclusive, {@code end} exclusive. After indexing every key in
 * {@code [0, maxKey]} owns a non-empty run, and the run of key {@code k + 1} starts exactly where
 * the run of {@code k} ends.</p>
 *
 * @param start index of the first record of the run
 * @param end   index one past the last record of the run
 */
public record Run(long start, long end) {

    /**
     * @throws IllegalArgumentException if {@code start < 0} or {@code end < start}
     */
    public Run {
        if (start < 0) {
            throw new IllegalArgumentException("start must be >= 0");
        }
        if (end < start) {
            throw new IllegalArgumentException("end must be >= start");
        }
    }

    /** Number of records in the run. */
    public long length() {
        return end - start;
    }
}
