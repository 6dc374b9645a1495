package sdmitry.multimap;

import java.nio.file.Path;

/**
 * A field stored in the index file disagrees with the live data file or record layout.
 */
public class IndexOutOfSyncException extends IndexFormatException {
    private static final long serialVersionUID = 1L;

    private final String field;
    private final long stored;
    private final long actual;

    public IndexOutOfSyncException(Path indexFile, String field, long stored, long actual) {
        super(indexFile, String.format("%s is %d in the index but %d in the data file", field, stored, actual));
        this.field = field;
        this.stored = stored;
        this.actual = actual;
    }

    public String getField() {
        return field;
    }

    public long getStored() {
        return stored;
    }

    public long getActual() {
        return actual;
    }
}
