package sdmitry.multimap.succinct;

/**
 * Compressed, read-only view of a bit vector answering select queries.
 *
 * <p>Used to locate the first record of every key: bit {@code i} of the underlying vector is set
 * iff record {@code i} starts a new key, so {@code select(k)} is where key {@code k} begins.</p>
 *
 * Implementations are immutable and safe for concurrent reads.
 */
public interface OrdinalIndex {

    /**
     * Position of the set bit of the given rank (0-based).
     *
     * @throws IndexOutOfBoundsException if {@code rank < 0} or {@code rank >= count()}
     */
    long select(long rank);

    /** Length of the underlying bit vector. */
    long length();

    /** Number of set bits. */
    long count();

    /** Approximate in-memory footprint in bits. */
    long numBits();
}
