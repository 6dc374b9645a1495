package sdmitry.multimap;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The companion index file cannot be used with this multimap.
 *
 * Thrown as-is for an unknown magic tag or a truncated file. The subclasses separate a format
 * version the reader does not support ({@link IndexVersionException}) from an index that was
 * built over different data ({@link IndexOutOfSyncException}).
 */
public class IndexFormatException extends IOException {
    private static final long serialVersionUID = 1L;

    private final Path indexFile;

    public IndexFormatException(Path indexFile, String message) {
        super("Index file '" + indexFile + "': " + message);
        this.indexFile = indexFile;
    }

    public IndexFormatException(Path indexFile, String message, Throwable cause) {
        super("Index file '" + indexFile + "': " + message, cause);
        this.indexFile = indexFile;
    }

    public Path getIndexFile() {
        return indexFile;
    }
}
