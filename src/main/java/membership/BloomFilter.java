package membership;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import utilities.BloomLogger;
import utilities.SliceHasher;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Locale;
import java.util.Objects;

/**
 * Fixed-capacity bloom filter over a partitioned bit vector.
 *
 * The vector holds {@code sliceCount} contiguous slices of {@code bitsPerSlice} bits; a key sets
 * exactly one bit in every slice. Parameters are final, only {@code count} and the bits change.
 *
 * <p>Binary layout (little-endian): {@code double errorRate, u64 sliceCount, u64 bitsPerSlice,
 * u64 capacity, u64 count}, then {@code ceil(totalBits / 8)} bytes of bits, least significant bit first.
 *
 * <p>Text layout: {@code errorRate:sliceCount:bitsPerSlice:capacity:count:little:hexBits}.
 */
public class BloomFilter implements SerializableMembership {

    public static final double DEFAULT_ERROR_RATE = 0.001;
    public static final int HEADER_BYTES = Double.BYTES + 4 * Long.BYTES;

    static final String LITTLE_ENDIAN = "little";
    static final String BIG_ENDIAN = "big";

    private final double errorRate;
    private final FilterParameters params;
    private final long capacity;
    private long count;
    private final PackedBits bits;
    private final SliceHasher hasher;

    public BloomFilter(long capacity) {
        this(capacity, DEFAULT_ERROR_RATE);
    }

    public BloomFilter(long capacity, double errorRate) {
        this(errorRate, FilterParameters.solve(capacity, errorRate), capacity, 0L, null);
    }

    private BloomFilter(double errorRate, FilterParameters params, long capacity, long count, PackedBits bits) {
        this.errorRate = errorRate;
        this.params = params;
        this.capacity = capacity;
        this.count = count;
        this.bits = (bits != null) ? bits : new PackedBits(params.totalBits());
        this.hasher = new SliceHasher(params.sliceCount(), params.bitsPerSlice());
    }

    @Override public double errorRate() { return errorRate; }
    @Override public long capacity() { return capacity; }
    @Override public long count() { return count; }

    public int sliceCount() { return params.sliceCount(); }
    public long bitsPerSlice() { return params.bitsPerSlice(); }
    public long totalBits() { return params.totalBits(); }
    public FilterParameters parameters() { return params; }

    public long setBitCount() { return bits.cardinality(); }

    // Little-endian image of the bit vector, as written after the binary header.
    public byte[] bitImage() { return bits.toByteArray(); }

    // (set bits / total bits) ^ k; the design rate is errorRate().
    public double estimatedFalsePositiveRate() {
        double fill = (double) bits.cardinality() / params.totalBits();
        if (fill <= 0) return 0.0;
        if (fill >= 1) return 1.0;
        return Math.pow(fill, params.sliceCount());
    }

    @Override
    public boolean contains(Object key) {
        final long bitsPerSlice = params.bitsPerSlice();
        SliceHasher.Positions positions = hasher.positions(key);
        long offset = 0;
        while (positions.hasNext()) {
            if (!bits.get(offset + positions.nextLong())) return false;
            offset += bitsPerSlice;
        }
        return true;
    }

    @Override
    public boolean insert(Object key) {
        return insert(key, false);
    }

    /**
     * Sets the key's bit in every slice.
     *
     * @param skipCheck count the key as new without looking at the previous bit values
     * @return true if every bit was already set (the key was probably present); always false with skipCheck
     * @throws FilterCapacityExceededException if count already exceeds capacity; no bit is touched
     */
    public boolean insert(Object key, boolean skipCheck) {
        // Strict '>': the filter takes one insertion past capacity before refusing.
        if (count > capacity) {
            throw new FilterCapacityExceededException(capacity, count);
        }
        final long bitsPerSlice = params.bitsPerSlice();
        SliceHasher.Positions positions = hasher.positions(key);
        boolean foundAllBits = true;
        long offset = 0;
        while (positions.hasNext()) {
            if (!bits.getAndSet(offset + positions.nextLong())) {
                foundAllBits = false;
            }
            offset += bitsPerSlice;
        }
        if (skipCheck || !foundAllBits) {
            count++;
            return false;
        }
        return true;
    }

    public BloomFilter copy() {
        return new BloomFilter(errorRate, params, capacity, count, bits.copy());
    }

    /**
     * New filter holding the bitwise OR of both vectors. The count of the result is estimated from
     * the fill ratio, not recounted.
     */
    public BloomFilter union(BloomFilter other) {
        checkCompatible(other, "Unioning");
        BloomFilter result = copy();
        result.bits.or(other.bits);
        result.count = estimateCount(result.bits.cardinality(), params.totalBits(), params.sliceCount());
        return result;
    }

    // New filter holding the bitwise AND of both vectors; count is estimated as for union.
    public BloomFilter intersection(BloomFilter other) {
        checkCompatible(other, "Intersecting");
        BloomFilter result = copy();
        result.bits.and(other.bits);
        result.count = estimateCount(result.bits.cardinality(), params.totalBits(), params.sliceCount());
        return result;
    }

    private void checkCompatible(BloomFilter other, String operation) {
        Objects.requireNonNull(other, "other");
        if (capacity != other.capacity || errorRate != other.errorRate) {
            throw new IncompatibleFiltersException(operation + " filters requires both filters to have the same"
                    + " capacity and error rate (" + capacity + "/" + errorRate + " vs "
                    + other.capacity + "/" + other.errorRate + ")");
        }
    }

    /**
     * Cardinality estimate from the number of set bits (Papapetrou et al.):
     * {@code n ~= ln(1 - X/M) / (k * ln(1 - 1/M))}. Falls back to {@code M} where the formula is undefined.
     */
    static long estimateCount(long setBits, long totalBits, int sliceCount) {
        double denominator = sliceCount * Math.log(1.0 - 1.0 / totalBits);
        double estimate = Math.log(1.0 - (double) setBits / totalBits) / denominator;
        if (denominator == 0.0 || !Double.isFinite(denominator) || !Double.isFinite(estimate)) {
            return totalBits;
        }
        return (long) estimate;
    }

    // ======================
    // === Binary format ====
    // ======================

    @Override
    public void writeTo(OutputStream out) throws IOException {
        ByteBuffer header = ByteBuffer.allocate(HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        header.putDouble(errorRate)
              .putLong(params.sliceCount())
              .putLong(params.bitsPerSlice())
              .putLong(capacity)
              .putLong(count);
        out.write(header.array());
        out.write(bits.toByteArray());
    }

    // Reads one filter, consuming the rest of the stream as its bit vector.
    public static BloomFilter readFrom(InputStream in) throws IOException {
        return readFrom(in, -1);
    }

    /**
     * Reads one filter occupying exactly {@code length} bytes (header included). A non-positive
     * length reads to the end of the stream.
     */
    public static BloomFilter readFrom(InputStream in, long length) throws IOException {
        if (length > 0 && length < HEADER_BYTES) {
            throw new IllegalArgumentException("length " + length + " is smaller than the "
                    + HEADER_BYTES + " byte header");
        }
        byte[] header = in.readNBytes(HEADER_BYTES);
        if (header.length < HEADER_BYTES) {
            throw new CorruptFilterException("Truncated header: " + header.length + " of " + HEADER_BYTES + " bytes");
        }
        ByteBuffer buf = ByteBuffer.wrap(header).order(ByteOrder.LITTLE_ENDIAN);
        double errorRate = buf.getDouble();
        long sliceCount = buf.getLong();
        long bitsPerSlice = buf.getLong();
        long capacity = buf.getLong();
        long count = buf.getLong();
        FilterParameters params = checkHeader(errorRate, sliceCount, bitsPerSlice, capacity, count);

        byte[] payload;
        if (length > 0) {
            long remaining = length - HEADER_BYTES;
            if (remaining != params.byteLength()) {
                throw bitLengthMismatch(params, remaining);
            }
            payload = in.readNBytes((int) remaining);
        } else {
            payload = in.readAllBytes();
        }
        if (payload.length != params.byteLength()) {
            throw bitLengthMismatch(params, payload.length);
        }
        return new BloomFilter(errorRate, params, capacity, count,
                PackedBits.fromByteArray(payload, params.totalBits()));
    }

    private static CorruptFilterException bitLengthMismatch(FilterParameters params, long actualBytes) {
        String msg = "Bit length mismatch! " + params.sliceCount() + " x " + params.bitsPerSlice()
                + " bits needs " + params.byteLength() + " bytes, got " + actualBytes;
        BloomLogger.warning(msg);
        return new CorruptFilterException(msg);
    }

    private static FilterParameters checkHeader(double errorRate, long sliceCount, long bitsPerSlice,
                                                long capacity, long count) throws CorruptFilterException {
        if (!(errorRate > 0 && errorRate < 1) || sliceCount <= 0 || sliceCount > Integer.MAX_VALUE
                || bitsPerSlice <= 0 || capacity <= 0 || count < 0) {
            String msg = String.format(Locale.ROOT,
                    "Invalid filter header: errorRate=%s, sliceCount=%d, bitsPerSlice=%d, capacity=%d, count=%d",
                    errorRate, sliceCount, bitsPerSlice, capacity, count);
            BloomLogger.warning(msg);
            throw new CorruptFilterException(msg);
        }
        try {
            return FilterParameters.of((int) sliceCount, bitsPerSlice);
        } catch (IllegalArgumentException e) {
            throw new CorruptFilterException("Invalid filter header: " + e.getMessage(), e);
        }
    }

    // ======================
    // === Text format ======
    // ======================

    @Override
    public String toText() {
        return String.join(":",
                Double.toString(errorRate),
                Integer.toString(params.sliceCount()),
                Long.toString(params.bitsPerSlice()),
                Long.toString(capacity),
                Long.toString(count),
                LITTLE_ENDIAN,
                Hex.encodeHexString(bits.toByteArray()));
    }

    public static BloomFilter fromText(String text) throws CorruptFilterException {
        Objects.requireNonNull(text, "text");
        String[] values = text.split(":", -1);
        if (values.length != 7) {
            throw new CorruptFilterException("Expected 7 ':' separated fields, got " + values.length);
        }
        double errorRate;
        long sliceCount, bitsPerSlice, capacity, count;
        try {
            errorRate = Double.parseDouble(values[0]);
            sliceCount = Long.parseLong(values[1]);
            bitsPerSlice = Long.parseLong(values[2]);
            capacity = Long.parseLong(values[3]);
            count = Long.parseLong(values[4]);
        } catch (NumberFormatException e) {
            throw new CorruptFilterException("Unparsable filter field: " + e.getMessage(), e);
        }
        FilterParameters params = checkHeader(errorRate, sliceCount, bitsPerSlice, capacity, count);

        byte[] raw;
        try {
            raw = Hex.decodeHex(values[6]);
        } catch (DecoderException e) {
            throw new CorruptFilterException("Bad hex bit vector: " + e.getMessage(), e);
        }
        if (BIG_ENDIAN.equals(values[5])) {
            for (int i = 0; i < raw.length; i++) {
                raw[i] = (byte) (Integer.reverse(raw[i] & 0xFF) >>> 24);
            }
        } else if (!LITTLE_ENDIAN.equals(values[5])) {
            throw new CorruptFilterException("Unknown bit order '" + values[5] + "'");
        }
        if (raw.length != params.byteLength()) {
            throw bitLengthMismatch(params, raw.length);
        }
        return new BloomFilter(errorRate, params, capacity, count, PackedBits.fromByteArray(raw, params.totalBits()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BloomFilter)) return false;
        BloomFilter that = (BloomFilter) o;
        return Double.compare(errorRate, that.errorRate) == 0
                && capacity == that.capacity
                && count == that.count
                && params.equals(that.params)
                && bits.equals(that.bits);
    }

    @Override
    public int hashCode() {
        return Objects.hash(errorRate, capacity, count, params, bits);
    }

    @Override public String toString() {
        return String.format(Locale.ROOT, "capacity=%d, count=%d, k=%d, m=%d, p=%.4g",
                capacity, count, params.sliceCount(), params.bitsPerSlice(), errorRate);
    }
}
