package sdmitry.multimap.succinct;

import it.unimi.dsi.bits.BitVector;

import java.io.IOException;

/**
 * Builds and (de)serializes one kind of {@link OrdinalIndex}.
 *
 * <p>The persisted form has two parts, matching the index file layout: the compressed bit vector
 * and the select structure built over it. Each part is an opaque blob; the index file frames them
 * with their lengths.</p>
 */
public interface OrdinalIndexFactory {

    OrdinalIndex build(BitVector bits);

    byte[] bitsBlob(OrdinalIndex index) throws IOException;

    byte[] selectBlob(OrdinalIndex index) throws IOException;

    /**
     * Rebuild an index from the two blobs written by {@link #bitsBlob} and {@link #selectBlob}.
     *
     * @throws IOException if the blobs are malformed or do not belong together
     */
    OrdinalIndex read(byte[] bitsBlob, byte[] selectBlob) throws IOException;
}
