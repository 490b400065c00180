package membership;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import utilities.BloomLogger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Scalable bloom filter (Almeida et al.): a chain of fixed filters that grows as keys arrive while
 * keeping the compound false positive rate under {@code errorRate}.
 *
 * The first sub-filter gets {@code initialCapacity} keys at {@code errorRate * (1 - ratio)}; each
 * following one multiplies capacity by the growth scale and tightens its error rate by {@code ratio}.
 * Capacity and count are sums over the chain.
 */
public class ScalableBloomFilter implements SerializableMembership {

    public static final double DEFAULT_RATIO = 0.9;
    public static final long DEFAULT_INITIAL_CAPACITY = 100;

    static final int HEADER_BYTES = Integer.BYTES + Double.BYTES + Long.BYTES + Double.BYTES;

    private final GrowthMode mode;
    private final double ratio;
    private final long initialCapacity;
    private final double errorRate;
    private final ObjectArrayList<BloomFilter> filters;

    public ScalableBloomFilter() {
        this(DEFAULT_INITIAL_CAPACITY, BloomFilter.DEFAULT_ERROR_RATE, GrowthMode.SMALL_SET_GROWTH);
    }

    public ScalableBloomFilter(long initialCapacity, double errorRate, GrowthMode mode) {
        this(mode, DEFAULT_RATIO, initialCapacity, errorRate, new ObjectArrayList<>());
    }

    private ScalableBloomFilter(GrowthMode mode, double ratio, long initialCapacity, double errorRate,
                                ObjectArrayList<BloomFilter> filters) {
        this.mode = Objects.requireNonNull(mode, "mode");
        FilterParameters.checkCapacity(initialCapacity);
        FilterParameters.checkErrorRate(errorRate);
        if (!(ratio > 0 && ratio < 1)) throw new IllegalArgumentException("ratio must be in (0,1), got " + ratio);
        this.ratio = ratio;
        this.initialCapacity = initialCapacity;
        this.errorRate = errorRate;
        this.filters = filters;
    }

    public GrowthMode mode() { return mode; }
    public double ratio() { return ratio; }
    public long initialCapacity() { return initialCapacity; }
    @Override public double errorRate() { return errorRate; }

    public int filterCount() { return filters.size(); }

    public List<BloomFilter> filters() { return Collections.unmodifiableList(filters); }

    // Newest first: the most recent sub-filter holds the most keys.
    @Override
    public boolean contains(Object key) {
        for (int i = filters.size() - 1; i >= 0; i--) {
            if (filters.get(i).contains(key)) return true;
        }
        return false;
    }

    @Override
    public boolean insert(Object key) {
        if (contains(key)) return true;
        BloomFilter filter;
        if (filters.isEmpty()) {
            filter = new BloomFilter(initialCapacity, errorRate * (1.0 - ratio));
            filters.add(filter);
        } else {
            filter = filters.get(filters.size() - 1);
            if (filter.count() >= filter.capacity()) {
                filter = new BloomFilter(filter.capacity() * mode.scale(), filter.errorRate() * ratio);
                filters.add(filter);
                if (BloomLogger.isDebugEnabled()) {
                    BloomLogger.debug("Scalable filter grew to " + filters.size() + " sub-filters: " + filter);
                }
            }
        }
        filter.insert(key, true);
        return false;
    }

    @Override
    public long capacity() {
        long sum = 0;
        for (BloomFilter f : filters) sum += f.capacity();
        return sum;
    }

    @Override
    public long count() {
        long sum = 0;
        for (BloomFilter f : filters) sum += f.count();
        return sum;
    }

    public ScalableBloomFilter copy() {
        ObjectArrayList<BloomFilter> copies = new ObjectArrayList<>(filters.size());
        for (BloomFilter f : filters) copies.add(f.copy());
        return new ScalableBloomFilter(mode, ratio, initialCapacity, errorRate, copies);
    }

    // Header: i32 scale, f64 ratio, u64 initialCapacity, f64 errorRate; then the sub-filter list.
    @Override
    public void writeTo(OutputStream out) throws IOException {
        ByteBuffer header = ByteBuffer.allocate(HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        header.putInt(mode.scale()).putDouble(ratio).putLong(initialCapacity).putDouble(errorRate);
        out.write(header.array());
        SubFilters.write(filters, out);
    }

    public static ScalableBloomFilter readFrom(InputStream in) throws IOException {
        ByteBuffer header = ByteBuffer.wrap(SubFilters.readFully(in, HEADER_BYTES, "scalable filter header"))
                .order(ByteOrder.LITTLE_ENDIAN);
        int scale = header.getInt();
        double ratio = header.getDouble();
        long initialCapacity = header.getLong();
        double errorRate = header.getDouble();
        return restore(scale, ratio, initialCapacity, errorRate, SubFilters.read(in));
    }

    @Override
    public String toText() {
        return String.join(",",
                Integer.toString(mode.scale()),
                Double.toString(ratio),
                Long.toString(initialCapacity),
                Double.toString(errorRate),
                SubFilters.toText(filters));
    }

    public static ScalableBloomFilter fromText(String text) throws CorruptFilterException {
        Objects.requireNonNull(text, "text");
        String[] values = text.split(",", -1);
        if (values.length != 5) {
            throw new CorruptFilterException("Expected 5 ',' separated fields, got " + values.length);
        }
        int scale;
        double ratio, errorRate;
        long initialCapacity;
        try {
            scale = Integer.parseInt(values[0]);
            ratio = Double.parseDouble(values[1]);
            initialCapacity = Long.parseLong(values[2]);
            errorRate = Double.parseDouble(values[3]);
        } catch (NumberFormatException e) {
            throw new CorruptFilterException("Unparsable scalable filter field: " + e.getMessage(), e);
        }
        return restore(scale, ratio, initialCapacity, errorRate, SubFilters.fromText(values[4]));
    }

    private static ScalableBloomFilter restore(int scale, double ratio, long initialCapacity, double errorRate,
                                               ObjectArrayList<BloomFilter> filters) throws CorruptFilterException {
        try {
            return new ScalableBloomFilter(GrowthMode.fromScale(scale), ratio, initialCapacity, errorRate, filters);
        } catch (IllegalArgumentException e) {
            throw new CorruptFilterException("Invalid scalable filter header: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScalableBloomFilter)) return false;
        ScalableBloomFilter that = (ScalableBloomFilter) o;
        return mode == that.mode
                && Double.compare(ratio, that.ratio) == 0
                && initialCapacity == that.initialCapacity
                && Double.compare(errorRate, that.errorRate) == 0
                && filters.equals(that.filters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, ratio, initialCapacity, errorRate, filters);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "ScalableBloomFilter[mode=%s, filters=%d, capacity=%d, count=%d, p=%.4g]",
                mode, filters.size(), capacity(), count(), errorRate);
    }
}
