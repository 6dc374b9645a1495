package sdmitry.multimap;

import java.nio.file.Path;

/**
 * The index file was written with a format version this reader does not support.
 */
public class IndexVersionException extends IndexFormatException {
    private static final long serialVersionUID = 1L;

    private final long expectedVersion;
    private final long actualVersion;

    public IndexVersionException(Path indexFile, long expectedVersion, long actualVersion) {
        super(indexFile, String.format("unsupported version %d, expected %d", actualVersion, expectedVersion));
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
