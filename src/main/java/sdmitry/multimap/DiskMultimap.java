package sdmitry.multimap;

import it.unimi.dsi.bits.LongArrayBitVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sdmitry.multimap.succinct.OrdinalIndex;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Disk-backed multimap over dense, non-negative integer keys and fixed-width values.
 *
 * Does:
 *   - append (key, value) records to a flat data file, no header;
 *   - sort the file by key with the configured {@link sdmitry.multimap.sort.RecordSorter};
 *   - pad the key space: append a null-valued record for every key in {@code [0, maxKey]} that
 *     has none, then sort again;
 *   - mark the first record of every key in a bit vector and compress it into a select index;
 *   - answer {@code values(k)} with two select queries and one sequential read;
 *   - save/load the select index to a companion file ({@code <data>.idx}).
 *
 * Lifecycle ({@link State}): EMPTY -> APPENDING -> SORTED -> DENSIFIED -> INDEXED.
 * {@link #index()} runs sort and pad itself and is the usual entry point after appending.
 * {@link #load()} jumps straight to INDEXED when a saved index matches the data file.
 *
 * Concurrency:
 *   - building (append, sort, pad, index) is single-threaded, one owner, no concurrent readers;
 *   - the writer is closed before every sort and reopened lazily on the next append;
 *   - once INDEXED the structure is read-only; {@link #values(long)} may be called from many
 *     threads since every read is positional.
 *
 * Notes:
 *   - interrupting sort or pad leaves the data file in an undefined state;
 *   - the null value is all-zero bytes; {@link #realValues(long)} drops it.
 */
public final class DiskMultimap<V> implements Multimap<V> {
    private static final Logger log = LoggerFactory.getLogger(DiskMultimap.class);

    private final RecordLayout<V> layout;
    private final MultimapOptions options;

    private Path dataFile;
    private Path indexFile;

    private RecordWriter<V> writer;
    private volatile RecordReader<V> reader;
    private volatile State state;

    private long maxKey = -1;
    private long indexedRecords;
    private OrdinalIndex keyStarts;

    public DiskMultimap(Path dataFile, RecordLayout<V> layout) {
        this(dataFile, layout, new MultimapOptions());
    }

    /**
     * @param dataFile data file; created on first append if absent
     * @param layout   key width and value codec
     * @param options  sorter, select index and buffer settings
     */
    public DiskMultimap(Path dataFile, RecordLayout<V> layout, MultimapOptions options) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.options = Objects.requireNonNull(options, "options");
        setBaseFile(dataFile);
    }

    /**
     * Point this multimap at another data file. Only allowed before {@link #start()}.
     * The index file follows the data file: {@code <data file name><index suffix>}.
     */
    public void setBaseFile(Path dataFile) {
        if (state != null) {
            throw new IllegalStateException("base file cannot change after start()");
        }
        this.dataFile = Objects.requireNonNull(dataFile, "dataFile");
        this.indexFile = dataFile.resolveSibling(dataFile.getFileName() + options.getIndexSuffix());
    }

    /**
     * Inspect the data file: EMPTY if absent or empty, APPENDING (order unknown) otherwise.
     *
     * @throws CorruptRecordFileException if the existing file is not a whole number of records
     */
    public void start() throws IOException {
        Path dir = dataFile.toAbsolutePath().getParent();
        if (dir != null) Files.createDirectories(dir);
        long records = fileRecordCount();
        state = records == 0 ? State.EMPTY : State.APPENDING;
        log.debug("Opened multimap '{}' with {} records ({})", dataFile, records, layout);
    }

    /**
     * Append one record. Invalidates sortedness.
     *
     * @throws IllegalArgumentException if the key does not fit the key width or is negative
     * @throws IllegalStateException    once the store was padded or indexed
     */
    @Override
    public void append(long key, V value) throws IOException {
        requireStarted();
        Objects.requireNonNull(value, "value");
        if (state == State.DENSIFIED || state == State.INDEXED) {
            throw new IllegalStateException("append after pad()/index() is not supported (state " + state + ")");
        }
        layout.checkKey(key);
        writer().append(key, value);
        state = State.APPENDING;
    }

    /**
     * Number of records currently in the data file (buffered appends included).
     *
     * @throws CorruptRecordFileException if the file is not a whole number of records
     */
    @Override
    public long recordCount() throws IOException {
        requireStarted();
        flushWriter();
        return fileRecordCount();
    }

    /**
     * Sort the data file by key. No-op if the file is known to be sorted or is empty.
     */
    @Override
    public void sort() throws IOException {
        requireStarted();
        if (state != State.APPENDING) return;
        sortFile();
        state = State.SORTED;
    }

    /**
     * Append a null-valued record for every missing key in {@code [0, maxKey]}, then re-sort if
     * anything was appended. A dense store is scanned and left untouched.
     *
     * @throws EmptyMultimapException if there are no records
     * @throws IllegalStateException  if the store is not sorted
     */
    @Override
    public void pad() throws IOException {
        requireStarted();
        if (state == State.EMPTY) {
            throw new EmptyMultimapException("cannot pad an empty multimap: no max key");
        }
        if (state == State.APPENDING) {
            throw new IllegalStateException("pad() requires a sorted store; call sort() first");
        }
        long started = System.nanoTime();
        long n = recordCount();
        long prev = -1; // one below key 0
        long appended = 0;
        RecordWriter<V> w = null;
        RecordCursor<V> c = reader().cursor(0, n, options.getScanBufferRecords());
        while (c.next()) {
            long curr = c.key();
            while (prev + 1 < curr) {
                if (w == null) w = writer();
                w.appendNull(++prev);
                appended++;
            }
            prev = curr;
        }
        if (appended > 0) {
            sortFile();
            if (state == State.INDEXED) dropIndex();
        }
        if (state != State.INDEXED) state = State.DENSIFIED;
        log.debug("Padded '{}': scanned {} records, appended {} in {} ms",
                dataFile, n, appended, (System.nanoTime() - started) / 1_000_000);
    }

    /**
     * Sort, pad and build the select index over the first record of every key.
     *
     * @throws EmptyMultimapException if there are no records
     */
    @Override
    public void index() throws IOException {
        requireStarted();
        if (state == State.EMPTY) {
            throw new EmptyMultimapException("cannot index an empty multimap: no max key");
        }
        sort();
        pad();

        long started = System.nanoTime();
        long n = recordCount();
        LongArrayBitVector bits = LongArrayBitVector.ofLength(n);
        long visited = 0;
        long last = -1;
        RecordCursor<V> c = reader().cursor(0, n, options.getScanBufferRecords());
        while (c.next()) {
            long curr = c.key();
            if (visited == 0 || curr != last) {
                bits.set(c.index());
                last = curr;
            }
            visited++;
        }
        if (visited != n) {
            throw new IllegalStateException("index scan visited " + visited + " of " + n + " records");
        }
        if (bits.count() != last + 1) {
            throw new IllegalStateException("key space not dense: " + bits.count() + " distinct keys, max key " + last);
        }

        keyStarts = options.getOrdinalIndexFactory().build(bits);
        maxKey = last;
        indexedRecords = n;
        state = State.INDEXED;
        log.info("Indexed '{}': {} records, {} keys, select index {} bits, {} ms",
                dataFile, n, maxKey + 1, keyStarts.numBits(), (System.nanoTime() - started) / 1_000_000);
    }

    /**
     * Write the index to {@link #indexFile()}.
     *
     * @return bytes written
     * @throws IllegalStateException if not indexed
     */
    @Override
    public long save() throws IOException {
        requireIndexed();
        return IndexFile.write(indexFile,
                new IndexFile.Contents(layout.recordSize(), indexedRecords, maxKey, keyStarts),
                options.getOrdinalIndexFactory());
    }

    /**
     * Read the index saved for this data file and become queryable without rebuilding.
     *
     * @throws IndexVersionException   if the file has an unsupported version
     * @throws IndexOutOfSyncException if record size, record count or max key disagree with the data
     * @throws IndexFormatException    if the file is not an index file or is truncated
     */
    @Override
    public void load() throws IOException {
        requireStarted();
        IndexFile.Contents c = IndexFile.read(indexFile, options.getOrdinalIndexFactory());
        if (c.recordSize() != layout.recordSize()) {
            throw new IndexOutOfSyncException(indexFile, "record_size", c.recordSize(), layout.recordSize());
        }
        long n = recordCount();
        if (c.recordCount() != n) {
            throw new IndexOutOfSyncException(indexFile, "record_count", c.recordCount(), n);
        }
        long lastKey = n == 0 ? -1 : nthKey(n - 1);
        if (c.maxKey() != lastKey) {
            throw new IndexOutOfSyncException(indexFile, "max_key", c.maxKey(), lastKey);
        }
        OrdinalIndex starts = c.keyStarts();
        if (starts.length() != n) {
            throw new IndexOutOfSyncException(indexFile, "key_starts length", starts.length(), n);
        }
        if (starts.count() != c.maxKey() + 1) {
            throw new IndexOutOfSyncException(indexFile, "key_starts count", starts.count(), c.maxKey() + 1);
        }
        keyStarts = starts;
        maxKey = c.maxKey();
        indexedRecords = n;
        state = State.INDEXED;
        log.debug("Loaded index '{}': {} records, max key {}", indexFile, n, maxKey);
    }

    /**
     * All values stored under {@code key}, in file order. Keys filled in by padding return a
     * single null value (all-zero bytes, decoded by the codec).
     *
     * @throws IllegalStateException    if not indexed
     * @throws IllegalArgumentException if {@code key} is outside {@code [0, maxKey]}
     */
    @Override
    public List<V> values(long key) throws IOException {
        Run run = run(key);
        return reader().values(run, false);
    }

    /**
     * Like {@link #values(long)} but without null values.
     */
    public List<V> realValues(long key) throws IOException {
        Run run = run(key);
        return reader().values(run, true);
    }

    /**
     * Record range of {@code key}: from its first record to the first record of {@code key + 1},
     * or to the end of the file for the max key.
     */
    public Run run(long key) {
        requireIndexed();
        if (key < 0 || key > maxKey) {
            throw new IllegalArgumentException("key " + key + " outside [0, " + maxKey + "]");
        }
        long start = keyStarts.select(key);
        long end = key < maxKey ? keyStarts.select(key + 1) : indexedRecords;
        return new Run(start, end);
    }

    /** Key of record {@code n} (0-based, file order). */
    @Override
    public long nthKey(long n) throws IOException {
        requireStarted();
        checkPosition(n);
        return reader().nthKey(n);
    }

    /** Value of record {@code n} (0-based, file order). */
    @Override
    public V nthValue(long n) throws IOException {
        requireStarted();
        checkPosition(n);
        return reader().nthValue(n);
    }

    /** Greatest key; valid once indexed. */
    public long maxKey() {
        requireIndexed();
        return maxKey;
    }

    /** Number of distinct keys, {@code maxKey() + 1}; valid once indexed. */
    public long keyCount() {
        requireIndexed();
        return maxKey + 1;
    }

    public State state() {
        return state;
    }

    public Path dataFile() {
        return dataFile;
    }

    public Path indexFile() {
        return indexFile;
    }

    /** Close the writer and reader; the files stay on disk. */
    @Override
    public void close() throws IOException {
        closeHandles();
    }

    // --------- internals ---------

    private void sortFile() throws IOException {
        closeHandles();
        long started = System.nanoTime();
        options.getSorter().sort(dataFile, layout.recordSize(), layout.keyBytes());
        log.debug("Sorted '{}' in {} ms", dataFile, (System.nanoTime() - started) / 1_000_000);
    }

    private void dropIndex() {
        keyStarts = null;
        maxKey = -1;
        indexedRecords = 0;
        state = State.SORTED;
    }

    private long fileRecordCount() throws IOException {
        long size = Files.exists(dataFile) ? Files.size(dataFile) : 0;
        return RecordReader.recordCount(dataFile, size, layout.recordSize());
    }

    private RecordWriter<V> writer() throws IOException {
        if (writer == null) {
            writer = new RecordWriter<>(dataFile, layout, options.getWriteBufferBytes());
        }
        return writer;
    }

    private RecordReader<V> reader() throws IOException {
        RecordReader<V> r = reader;
        if (r == null) {
            synchronized (this) {
                r = reader;
                if (r == null) {
                    r = new RecordReader<>(dataFile, layout);
                    reader = r;
                }
            }
        }
        flushWriter();
        return r;
    }

    private void flushWriter() throws IOException {
        RecordWriter<V> w = writer;
        if (w != null) w.flush();
    }

    private synchronized void closeHandles() throws IOException {
        RecordWriter<V> w = writer;
        RecordReader<V> r = reader;
        writer = null;
        reader = null;
        try {
            if (w != null) w.close();
        } finally {
            if (r != null) r.close();
        }
    }

    private void checkPosition(long n) {
        if (n < 0) {
            throw new IndexOutOfBoundsException("record index " + n + " < 0");
        }
    }

    private void requireStarted() {
        if (state == null) {
            throw new IllegalStateException("multimap not started; call start() first");
        }
    }

    private void requireIndexed() {
        requireStarted();
        if (state != State.INDEXED) {
            throw new IllegalStateException("multimap not indexed (state " + state + "); call index() or load()");
        }
    }
}
