package sdmitry.multimap.succinct;

import it.unimi.dsi.bits.BitVector;
import it.unimi.dsi.fastutil.longs.LongIterator;
import it.unimi.dsi.sux4j.util.EliasFanoMonotoneLongBigList;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.ObjectInputFilter;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.NoSuchElementException;

/**
 * Sparse bit vector stored as the Elias-Fano encoding of its set-bit positions.
 *
 * <p>Space is about {@code 2 + log2(length / count)} bits per set bit, so it depends on the
 * number of distinct keys rather than on the number of records. {@code select(r)} is a positional
 * lookup into the monotone list; the select inventory over the upper bits lives inside the sux4j
 * list.</p>
 *
 * <p><strong>Blobs:</strong></p>
 * <pre>
 * bits   : [length(8)][java-serialized EliasFanoMonotoneLongBigList]
 * select : [length(8)][count(8)]   bounds the select structure was built for
 * </pre>
 */
public final class EliasFanoOrdinalIndex implements OrdinalIndex {

    public static final OrdinalIndexFactory FACTORY = new Factory();

    /** Classes a bit vector blob may contain; primitive arrays pass any pattern filter. */
    private static final ObjectInputFilter BLOB_FILTER =
            ObjectInputFilter.Config.createFilter("it.unimi.dsi.**;!*");

    private final EliasFanoMonotoneLongBigList ones;
    private final long length;

    private EliasFanoOrdinalIndex(EliasFanoMonotoneLongBigList ones, long length) {
        this.ones = ones;
        this.length = length;
    }

    public static EliasFanoOrdinalIndex of(BitVector bits) {
        long length = bits.length();
        EliasFanoMonotoneLongBigList ones =
                new EliasFanoMonotoneLongBigList(bits.count(), Math.max(1, length), new OnesIterator(bits));
        return new EliasFanoOrdinalIndex(ones, length);
    }

    @Override
    public long select(long rank) {
        if (rank < 0 || rank >= ones.size64()) {
            throw new IndexOutOfBoundsException("rank " + rank + " outside [0, " + ones.size64() + ")");
        }
        return ones.getLong(rank);
    }

    @Override
    public long length() {
        return length;
    }

    @Override
    public long count() {
        return ones.size64();
    }

    @Override
    public long numBits() {
        return ones.numBits();
    }

    @Override
    public String toString() {
        return "EliasFanoOrdinalIndex[length=" + length + ", count=" + count() + "]";
    }

    /** Positions of the set bits, ascending. */
    private static final class OnesIterator implements LongIterator {
        private final BitVector bits;
        private long next;

        OnesIterator(BitVector bits) {
            this.bits = bits;
            this.next = bits.length() == 0 ? -1 : bits.nextOne(0);
        }

        @Override
        public boolean hasNext() {
            return next != -1;
        }

        @Override
        public long nextLong() {
            if (next == -1) throw new NoSuchElementException();
            long current = next;
            next = current + 1 < bits.length() ? bits.nextOne(current + 1) : -1;
            return current;
        }
    }

    private static final class Factory implements OrdinalIndexFactory {

        @Override
        public OrdinalIndex build(BitVector bits) {
            return EliasFanoOrdinalIndex.of(bits);
        }

        @Override
        public byte[] bitsBlob(OrdinalIndex index) throws IOException {
            EliasFanoOrdinalIndex ef = cast(index);
            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            try (DataOutputStream out = new DataOutputStream(bytes)) {
                out.writeLong(ef.length);
                ObjectOutputStream oos = new ObjectOutputStream(out);
                oos.writeObject(ef.ones);
                oos.flush();
            }
            return bytes.toByteArray();
        }

        @Override
        public byte[] selectBlob(OrdinalIndex index) throws IOException {
            EliasFanoOrdinalIndex ef = cast(index);
            ByteArrayOutputStream bytes = new ByteArrayOutputStream(16);
            try (DataOutputStream out = new DataOutputStream(bytes)) {
                out.writeLong(ef.length);
                out.writeLong(ef.count());
            }
            return bytes.toByteArray();
        }

        @Override
        public OrdinalIndex read(byte[] bitsBlob, byte[] selectBlob) throws IOException {
            long length;
            EliasFanoMonotoneLongBigList ones;
            try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(bitsBlob))) {
                length = in.readLong();
                ObjectInputStream ois = new ObjectInputStream(in);
                ois.setObjectInputFilter(BLOB_FILTER);
                ones = (EliasFanoMonotoneLongBigList) ois.readObject();
            } catch (ClassNotFoundException | ClassCastException e) {
                throw new IOException("bit vector blob does not hold an Elias-Fano list", e);
            }
            try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(selectBlob))) {
                long selectLength = in.readLong();
                long selectCount = in.readLong();
                if (selectLength != length || selectCount != ones.size64()) {
                    throw new IOException(String.format(
                            "select structure built for %d/%d bits, bit vector has %d/%d",
                            selectCount, selectLength, ones.size64(), length));
                }
            }
            return new EliasFanoOrdinalIndex(ones, length);
        }

        private static EliasFanoOrdinalIndex cast(OrdinalIndex index) {
            if (!(index instanceof EliasFanoOrdinalIndex)) {
                throw new IllegalArgumentException("not an Elias-Fano index: " + index.getClass().getName());
            }
            return (EliasFanoOrdinalIndex) index;
        }
    }
}
