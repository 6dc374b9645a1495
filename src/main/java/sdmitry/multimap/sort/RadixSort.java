package sdmitry.multimap.sort;

import java.nio.ByteBuffer;

/**
 * In-place MSD radix sort (American flag) of fixed-size records held in a {@link ByteBuffer}.
 *
 * <p>Records are permuted bucket by bucket on the key byte at the current depth, then each bucket
 * is sorted on the next byte. Buckets with at most {@code cutOff} records fall back to insertion
 * sort on the remaining key bytes. Recursion depth is bounded by the key size.</p>
 */
final class RadixSort {
    private static final int RADIX = 256;

    private final ByteBuffer buf;
    private final int recordSize;
    private final int keySize;
    private final int cutOff;
    private final byte[] tmpA;
    private final byte[] tmpB;

    private RadixSort(ByteBuffer buf, int recordSize, int keySize, int cutOff) {
        this.buf = buf;
        this.recordSize = recordSize;
        this.keySize = keySize;
        this.cutOff = Math.max(1, cutOff);
        this.tmpA = new byte[recordSize];
        this.tmpB = new byte[recordSize];
    }

    /**
     * Sort the first {@code count} records of {@code buf} (absolute indexing from 0).
     */
    static void sort(ByteBuffer buf, int count, int recordSize, int keySize, int cutOff) {
        if (keySize <= 0 || keySize > recordSize) {
            throw new IllegalArgumentException("keySize must be in [1, recordSize]");
        }
        if (count < 2) return;
        new RadixSort(buf, recordSize, keySize, cutOff).radix(0, count, 0);
    }

    private void radix(int lo, int hi, int digit) {
        if (hi - lo <= cutOff) {
            insertion(lo, hi, digit);
            return;
        }
        if (digit >= keySize) return;

        int[] counts = new int[RADIX];
        for (int i = lo; i < hi; i++) counts[digitAt(i, digit)]++;

        int[] next = new int[RADIX];
        int[] ends = new int[RADIX];
        int sum = lo;
        for (int b = 0; b < RADIX; b++) {
            next[b] = sum;
            sum += counts[b];
            ends[b] = sum;
        }
        int[] starts = next.clone();

        for (int b = 0; b < RADIX; b++) {
            while (next[b] < ends[b]) {
                int d = digitAt(next[b], digit);
                if (d == b) {
                    next[b]++;
                } else {
                    swap(next[b], next[d]);
                    next[d]++;
                }
            }
        }

        if (digit + 1 < keySize) {
            for (int b = 0; b < RADIX; b++) {
                if (counts[b] > 1) radix(starts[b], ends[b], digit + 1);
            }
        }
    }

    private void insertion(int lo, int hi, int digit) {
        for (int i = lo + 1; i < hi; i++) {
            for (int j = i; j > lo && compare(j - 1, j, digit) > 0; j--) {
                swap(j - 1, j);
            }
        }
    }

    private int compare(int a, int b, int fromDigit) {
        for (int d = fromDigit; d < keySize; d++) {
            int x = digitAt(a, d);
            int y = digitAt(b, d);
            if (x != y) return x - y;
        }
        return 0;
    }

    private int digitAt(int record, int digit) {
        return buf.get(record * recordSize + digit) & 0xFF;
    }

    private void swap(int a, int b) {
        if (a == b) return;
        int offA = a * recordSize;
        int offB = b * recordSize;
        buf.get(offA, tmpA);
        buf.get(offB, tmpB);
        buf.put(offA, tmpB);
        buf.put(offB, tmpA);
    }
}
