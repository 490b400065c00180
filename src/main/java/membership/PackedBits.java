package membership;

import java.util.Arrays;
import java.util.Objects;

/**
 * Fixed-length bit vector packed into 64-bit words.
 *
 * Bit {@code i} lives in word {@code i >>> 6} at position {@code i & 63}, so the
 * byte image produced by {@link #toByteArray()} is little-endian and least significant bit first.
 * Bits past {@link #length()} in the last word are always zero.
 */
public final class PackedBits {

    private final long[] words;
    private final long length;

    public PackedBits(long length) {
        if (length < 0) throw new IllegalArgumentException("length must be >= 0");
        if (length > FilterParameters.MAX_TOTAL_BITS) {
            throw new IllegalArgumentException("length " + length + " exceeds " + FilterParameters.MAX_TOTAL_BITS);
        }
        this.length = length;
        this.words = new long[wordCount(length)];
    }

    private PackedBits(long[] words, long length) {
        this.words = words;
        this.length = length;
    }

    private static int wordCount(long bits) {
        return (int) ((bits + 63) >>> 6);
    }

    public long length() { return length; }

    public boolean get(long index) {
        Objects.checkIndex(index, length);
        return (words[(int) (index >>> 6)] & (1L << index)) != 0;
    }

    public void set(long index) {
        Objects.checkIndex(index, length);
        words[(int) (index >>> 6)] |= 1L << index;
    }

    // Sets the bit and reports whether it was already set.
    public boolean getAndSet(long index) {
        Objects.checkIndex(index, length);
        int w = (int) (index >>> 6);
        long mask = 1L << index;
        boolean was = (words[w] & mask) != 0;
        words[w] |= mask;
        return was;
    }

    public long cardinality() {
        long c = 0;
        for (long w : words) c += Long.bitCount(w);
        return c;
    }

    public void or(PackedBits other) {
        checkSameLength(other);
        for (int i = 0; i < words.length; i++) words[i] |= other.words[i];
    }

    public void and(PackedBits other) {
        checkSameLength(other);
        for (int i = 0; i < words.length; i++) words[i] &= other.words[i];
    }

    private void checkSameLength(PackedBits other) {
        if (other.length != length) {
            throw new IllegalArgumentException("bit vector lengths differ: " + length + " vs " + other.length);
        }
    }

    public PackedBits copy() {
        return new PackedBits(words.clone(), length);
    }

    public int byteLength() {
        return (int) ((length + 7) >>> 3);
    }

    public byte[] toByteArray() {
        byte[] out = new byte[byteLength()];
        for (int i = 0; i < out.length; i++) {
            out[i] = (byte) (words[i >>> 3] >>> ((i & 7) << 3));
        }
        return out;
    }

    /**
     * Rebuilds a vector of {@code length} bits from its little-endian byte image.
     * {@code bytes} must hold exactly {@code ceil(length / 8)} bytes; padding bits in the last byte are dropped.
     */
    public static PackedBits fromByteArray(byte[] bytes, long length) {
        PackedBits bits = new PackedBits(length);
        if (bytes.length != bits.byteLength()) {
            throw new IllegalArgumentException("expected " + bits.byteLength() + " bytes for " + length
                    + " bits, got " + bytes.length);
        }
        for (int i = 0; i < bytes.length; i++) {
            bits.words[i >>> 3] |= (bytes[i] & 0xFFL) << ((i & 7) << 3);
        }
        int tail = (int) (length & 63);
        if (tail != 0) {
            bits.words[bits.words.length - 1] &= (1L << tail) - 1;
        }
        return bits;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PackedBits)) return false;
        PackedBits that = (PackedBits) o;
        return length == that.length && Arrays.equals(words, that.words);
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(length) + Arrays.hashCode(words);
    }

    @Override
    public String toString() {
        return "PackedBits[length=" + length + ", set=" + cardinality() + "]";
    }
}
