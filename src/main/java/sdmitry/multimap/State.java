package sdmitry.multimap;

/**
 * Lifecycle of a {@link DiskMultimap}.
 *
 * <pre>
 * EMPTY -append-> APPENDING -sort-> SORTED -pad-> DENSIFIED -index-> INDEXED
 *                    ^                 |
 *                    +-----append------+
 * EMPTY/APPENDING -load-> INDEXED
 * </pre>
 */
public enum State {
    /** No records. */
    EMPTY,
    /** Records present, order unknown. */
    APPENDING,
    /** Non-decreasing by key. */
    SORTED,
    /** Sorted and every key in {@code [0, maxKey]} has a record. */
    DENSIFIED,
    /** Select index built or loaded; queryable and read-only. */
    INDEXED
}
