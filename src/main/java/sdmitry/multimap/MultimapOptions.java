package sdmitry.multimap;

import sdmitry.multimap.sort.ExternalMergeSorter;
import sdmitry.multimap.sort.RecordSorter;
import sdmitry.multimap.succinct.EliasFanoOrdinalIndex;
import sdmitry.multimap.succinct.OrdinalIndexFactory;

import java.util.Objects;

/**
 * Tuning and collaborator options for a {@link DiskMultimap}.
 *
 * <p>Defaults: out-of-core merge sort with 64MiB chunks, Elias-Fano select index, {@code .idx}
 * companion file suffix, 1MiB write buffer, 4096-record scan buffer.</p>
 */
public class MultimapOptions {

    private RecordSorter sorter = new ExternalMergeSorter();
    private OrdinalIndexFactory ordinalIndexFactory = EliasFanoOrdinalIndex.FACTORY;
    private String indexSuffix = ".idx";
    private int writeBufferBytes = 1 << 20;
    private int scanBufferRecords = 4096;

    /**
     * Creates default options.
     */
    public MultimapOptions() {
    }

    /**
     * Sets the strategy used to sort the data file by key.
     *
     * @param sorter the sorter
     * @return this MultimapOptions instance
     */
    public MultimapOptions setSorter(RecordSorter sorter) {
        this.sorter = Objects.requireNonNull(sorter, "sorter");
        return this;
    }

    public RecordSorter getSorter() {
        return sorter;
    }

    /**
     * Sets the compressed select structure used for the key-starts bit vector.
     * An index file can only be loaded with the factory that saved it.
     *
     * @param factory the factory
     * @return this MultimapOptions instance
     */
    public MultimapOptions setOrdinalIndexFactory(OrdinalIndexFactory factory) {
        this.ordinalIndexFactory = Objects.requireNonNull(factory, "factory");
        return this;
    }

    public OrdinalIndexFactory getOrdinalIndexFactory() {
        return ordinalIndexFactory;
    }

    /**
     * Sets the suffix appended to the data file name to form the index file name.
     *
     * @param indexSuffix non-empty suffix, e.g. {@code .idx}
     * @return this MultimapOptions instance
     */
    public MultimapOptions setIndexSuffix(String indexSuffix) {
        if (indexSuffix == null || indexSuffix.isEmpty()) {
            throw new IllegalArgumentException("indexSuffix must be non-empty");
        }
        this.indexSuffix = indexSuffix;
        return this;
    }

    public String getIndexSuffix() {
        return indexSuffix;
    }

    /**
     * Sets the append buffer size. Appends become visible to readers when the buffer is flushed.
     *
     * @param writeBufferBytes buffer size in bytes (> 0)
     * @return this MultimapOptions instance
     */
    public MultimapOptions setWriteBufferBytes(int writeBufferBytes) {
        if (writeBufferBytes <= 0) {
            throw new IllegalArgumentException("writeBufferBytes must be > 0");
        }
        this.writeBufferBytes = writeBufferBytes;
        return this;
    }

    public int getWriteBufferBytes() {
        return writeBufferBytes;
    }

    /**
     * Sets how many records a sequential scan (pad, index) reads at once.
     *
     * @param scanBufferRecords records per read (> 0)
     * @return this MultimapOptions instance
     */
    public MultimapOptions setScanBufferRecords(int scanBufferRecords) {
        if (scanBufferRecords <= 0) {
            throw new IllegalArgumentException("scanBufferRecords must be > 0");
        }
        this.scanBufferRecords = scanBufferRecords;
        return this;
    }

    public int getScanBufferRecords() {
        return scanBufferRecords;
    }
}
