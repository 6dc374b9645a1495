package sdmitry.multimap;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The data file size is not a whole number of records: a torn append or a foreign file.
 */
public class CorruptRecordFileException extends IOException {
    private static final long serialVersionUID = 1L;

    private final Path file;
    private final long size;
    private final int recordSize;

    public CorruptRecordFileException(Path file, long size, int recordSize) {
        super(String.format("Data file '%s' has %d bytes, not a multiple of record size %d", file, size, recordSize));
        this.file = file;
        this.size = size;
        this.recordSize = recordSize;
    }

    public Path getFile() {
        return file;
    }

    public long getSize() {
        return size;
    }

    public int getRecordSize() {
        return recordSize;
    }
}
