package sdmitry.multimap;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

public interface Multimap<V> extends Closeable {
    void append(long key, V value) throws IOException;
    long recordCount() throws IOException;
    void sort() throws IOException;
    void pad() throws IOException;
    void index() throws IOException;
    long save() throws IOException;
    void load() throws IOException;
    List<V> values(long key) throws IOException;
    long nthKey(long n) throws IOException;
    V nthValue(long n) throws IOException;
}
