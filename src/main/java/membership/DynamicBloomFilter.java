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
 * Dynamic bloom filter: grows like {@link ScalableBloomFilter} but out of uniform sub-filters of
 * {@code baseCapacity} keys at one shared error rate, which makes union and intersection with
 * another dynamic filter of the same shape well defined.
 *
 * The per-filter rate is chosen so that {@code ceil(maxCapacity / baseCapacity)} sub-filters together
 * stay under {@code maxErrorRate}: {@code 1 - (1 - p_i)^n <= maxErrorRate}.
 */
public class DynamicBloomFilter implements SerializableMembership {

    public static final int DEFAULT_BASE_CAPACITY = 100;
    public static final long DEFAULT_MAX_CAPACITY = 1_000_000;

    static final int HEADER_BYTES = Integer.BYTES + Long.BYTES + Double.BYTES;

    private final int baseCapacity;
    private final long maxCapacity;
    private final double maxErrorRate;
    private final double individualErrorRate;
    private final ObjectArrayList<BloomFilter> filters;

    public DynamicBloomFilter() {
        this(DEFAULT_BASE_CAPACITY, DEFAULT_MAX_CAPACITY, BloomFilter.DEFAULT_ERROR_RATE);
    }

    public DynamicBloomFilter(int baseCapacity, long maxCapacity, double errorRate) {
        this(baseCapacity, maxCapacity, errorRate, new ObjectArrayList<>());
    }

    private DynamicBloomFilter(int baseCapacity, long maxCapacity, double errorRate,
                               ObjectArrayList<BloomFilter> filters) {
        FilterParameters.checkCapacity(baseCapacity);
        FilterParameters.checkErrorRate(errorRate);
        // A maxCapacity below baseCapacity still plans for one sub-filter.
        if (maxCapacity <= 0) {
            throw new IllegalArgumentException("maxCapacity must be > 0, got " + maxCapacity);
        }
        this.baseCapacity = baseCapacity;
        this.maxCapacity = maxCapacity;
        this.maxErrorRate = errorRate;
        this.individualErrorRate = individualErrorRate(baseCapacity, maxCapacity, errorRate);
        this.filters = filters;
    }

    static double individualErrorRate(int baseCapacity, long maxCapacity, double maxErrorRate) {
        double filterCount = Math.ceil((double) maxCapacity / baseCapacity);
        return 1.0 - Math.exp(Math.log(1.0 - maxErrorRate) / filterCount);
    }

    public int baseCapacity() { return baseCapacity; }
    public long maxCapacity() { return maxCapacity; }
    public double maxErrorRate() { return maxErrorRate; }
    public double individualErrorRate() { return individualErrorRate; }

    // The configured bound; holds while count() <= maxCapacity.
    @Override public double errorRate() { return maxErrorRate; }

    public int filterCount() { return filters.size(); }

    public List<BloomFilter> filters() { return Collections.unmodifiableList(filters); }

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
            filter = newSubFilter();
            filters.add(filter);
        } else {
            filter = filters.get(filters.size() - 1);
            if (filter.count() >= filter.capacity()) {
                filter = newSubFilter();
                filters.add(filter);
                if (BloomLogger.isDebugEnabled()) {
                    BloomLogger.debug("Dynamic filter grew to " + filters.size() + " sub-filters");
                }
            }
        }
        filter.insert(key, true);
        return false;
    }

    private BloomFilter newSubFilter() {
        return new BloomFilter(baseCapacity, individualErrorRate);
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

    public DynamicBloomFilter copy() {
        return new DynamicBloomFilter(baseCapacity, maxCapacity, maxErrorRate, copyOf(filters));
    }

    private static ObjectArrayList<BloomFilter> copyOf(List<BloomFilter> source) {
        ObjectArrayList<BloomFilter> copies = new ObjectArrayList<>(source.size());
        for (BloomFilter f : source) copies.add(f.copy());
        return copies;
    }

    /**
     * Union that keeps each sub-filter's error rate. Every sub-filter of this filter is OR-merged
     * into the latest slot of {@code other}'s (copied) list whose merged count stays below
     * {@code baseCapacity}; when no slot fits it is appended as its own slot. Neither operand changes.
     *
     * <p>If merged counts go past capacity the compound error rate can exceed {@code maxErrorRate}.
     */
    public DynamicBloomFilter union(DynamicBloomFilter other) {
        checkCompatible(other, "Unioning");
        ObjectArrayList<BloomFilter> slots = copyOf(other.filters);
        int merged = 0;
        for (BloomFilter mine : filters) {
            boolean foundUnionMate = false;
            for (int j = slots.size() - 1; j >= 0; j--) {
                BloomFilter candidate = mine.union(slots.get(j));
                if (candidate.count() < baseCapacity) {
                    slots.set(j, candidate);
                    foundUnionMate = true;
                    merged++;
                    break;
                }
            }
            if (!foundUnionMate) slots.add(mine.copy());
        }
        if (BloomLogger.isDebugEnabled()) {
            BloomLogger.debug("Dynamic union: " + filters.size() + " + " + other.filters.size() + " sub-filters -> "
                    + slots.size() + " (" + merged + " merged)");
        }
        return new DynamicBloomFilter(baseCapacity, maxCapacity, maxErrorRate, slots);
    }

    /**
     * Intersection with one result slot per sub-filter of this filter. Each slot accumulates
     * {@code mine AND theirs} over every sub-filter of {@code other}, so counts are estimates and
     * may over-count; empty slots are kept.
     */
    public DynamicBloomFilter intersection(DynamicBloomFilter other) {
        checkCompatible(other, "Intersecting");
        ObjectArrayList<BloomFilter> slots = new ObjectArrayList<>(filters.size());
        for (BloomFilter mine : filters) {
            BloomFilter accumulator = newSubFilter();
            for (BloomFilter theirs : other.filters) {
                accumulator = accumulator.union(mine.intersection(theirs));
            }
            slots.add(accumulator);
        }
        return new DynamicBloomFilter(baseCapacity, maxCapacity, maxErrorRate, slots);
    }

    private void checkCompatible(DynamicBloomFilter other, String operation) {
        Objects.requireNonNull(other, "other");
        if (baseCapacity != other.baseCapacity || individualErrorRate != other.individualErrorRate) {
            throw new IncompatibleFiltersException(operation + " dynamic filters requires both filters to have"
                    + " equal base capacity and individual error rate (" + baseCapacity + "/" + individualErrorRate
                    + " vs " + other.baseCapacity + "/" + other.individualErrorRate + ")");
        }
    }

    // Header: i32 baseCapacity, u64 maxCapacity, f64 maxErrorRate; then the sub-filter list.
    @Override
    public void writeTo(OutputStream out) throws IOException {
        ByteBuffer header = ByteBuffer.allocate(HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        header.putInt(baseCapacity).putLong(maxCapacity).putDouble(maxErrorRate);
        out.write(header.array());
        SubFilters.write(filters, out);
    }

    public static DynamicBloomFilter readFrom(InputStream in) throws IOException {
        ByteBuffer header = ByteBuffer.wrap(SubFilters.readFully(in, HEADER_BYTES, "dynamic filter header"))
                .order(ByteOrder.LITTLE_ENDIAN);
        int baseCapacity = header.getInt();
        long maxCapacity = header.getLong();
        double maxErrorRate = header.getDouble();
        return restore(baseCapacity, maxCapacity, maxErrorRate, SubFilters.read(in));
    }

    @Override
    public String toText() {
        return String.join(",",
                Integer.toString(baseCapacity),
                Long.toString(maxCapacity),
                Double.toString(maxErrorRate),
                SubFilters.toText(filters));
    }

    public static DynamicBloomFilter fromText(String text) throws CorruptFilterException {
        Objects.requireNonNull(text, "text");
        String[] values = text.split(",", -1);
        if (values.length != 4) {
            throw new CorruptFilterException("Expected 4 ',' separated fields, got " + values.length);
        }
        int baseCapacity;
        long maxCapacity;
        double maxErrorRate;
        try {
            baseCapacity = Integer.parseInt(values[0]);
            maxCapacity = Long.parseLong(values[1]);
            maxErrorRate = Double.parseDouble(values[2]);
        } catch (NumberFormatException e) {
            throw new CorruptFilterException("Unparsable dynamic filter field: " + e.getMessage(), e);
        }
        return restore(baseCapacity, maxCapacity, maxErrorRate, SubFilters.fromText(values[3]));
    }

    private static DynamicBloomFilter restore(int baseCapacity, long maxCapacity, double maxErrorRate,
                                              ObjectArrayList<BloomFilter> filters) throws CorruptFilterException {
        try {
            return new DynamicBloomFilter(baseCapacity, maxCapacity, maxErrorRate, filters);
        } catch (IllegalArgumentException e) {
            throw new CorruptFilterException("Invalid dynamic filter header: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DynamicBloomFilter)) return false;
        DynamicBloomFilter that = (DynamicBloomFilter) o;
        return baseCapacity == that.baseCapacity
                && maxCapacity == that.maxCapacity
                && Double.compare(maxErrorRate, that.maxErrorRate) == 0
                && filters.equals(that.filters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseCapacity, maxCapacity, maxErrorRate, filters);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
                "DynamicBloomFilter[base=%d, max=%d, filters=%d, count=%d, p=%.4g, p_i=%.4g]",
                baseCapacity, maxCapacity, filters.size(), count(), maxErrorRate, individualErrorRate);
    }
}
