package membership;

/**
 * Optimal slice layout for a target capacity and false positive rate.
 *
 * <pre>
 *   k = ceil(log2(1/P))
 *   m = ceil(n * |ln P| / (k * ln(2)^2))     bits per slice
 *   M = k * m                                total bits
 * </pre>
 */
public record FilterParameters(int sliceCount, long bitsPerSlice, long totalBits) {

    private static final double LN2 = Math.log(2);

    // The serialized bit image is a single byte[].
    static final long MAX_TOTAL_BITS = (long) (Integer.MAX_VALUE - 8) * Byte.SIZE;

    public FilterParameters {
        if (sliceCount <= 0)   throw new IllegalArgumentException("sliceCount must be > 0");
        if (bitsPerSlice <= 0) throw new IllegalArgumentException("bitsPerSlice must be > 0");
        if (bitsPerSlice > MAX_TOTAL_BITS / sliceCount) {
            throw new IllegalArgumentException(sliceCount + " x " + bitsPerSlice + " bits exceeds " + MAX_TOTAL_BITS);
        }
        if (totalBits != sliceCount * bitsPerSlice) {
            throw new IllegalArgumentException("totalBits must equal sliceCount * bitsPerSlice");
        }
    }

    public static FilterParameters of(int sliceCount, long bitsPerSlice) {
        if (sliceCount > 0 && bitsPerSlice > 0 && bitsPerSlice > MAX_TOTAL_BITS / sliceCount) {
            throw new IllegalArgumentException(sliceCount + " x " + bitsPerSlice + " bits exceeds " + MAX_TOTAL_BITS);
        }
        return new FilterParameters(sliceCount, bitsPerSlice, (long) sliceCount * bitsPerSlice);
    }

    public static FilterParameters solve(long capacity, double errorRate) {
        checkCapacity(capacity);
        checkErrorRate(errorRate);

        int k = (int) Math.ceil(Math.log(1.0 / errorRate) / LN2);
        double m = Math.ceil((capacity * Math.abs(Math.log(errorRate))) / (k * (LN2 * LN2)));
        if (m * k > MAX_TOTAL_BITS) {
            throw new IllegalArgumentException("capacity " + capacity + " at error rate " + errorRate
                    + " needs " + (long) (m * k) + " bits, more than " + MAX_TOTAL_BITS);
        }
        long bitsPerSlice = (long) m;
        return of(k, bitsPerSlice);
    }

    public static void checkCapacity(long capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("Capacity must be > 0, got " + capacity);
    }

    public static void checkErrorRate(double errorRate) {
        if (!(errorRate > 0 && errorRate < 1)) {
            throw new IllegalArgumentException("Error rate must be in (0,1), got " + errorRate);
        }
    }

    public long byteLength() {
        return (totalBits + 7) >>> 3;
    }
}
