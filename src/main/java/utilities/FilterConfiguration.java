package utilities;

import membership.BloomFilter;
import membership.DynamicBloomFilter;
import membership.FilterParameters;
import membership.GrowthMode;
import membership.ScalableBloomFilter;

import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

// Immutable configuration for constructing filters through FilterFactory.
public final class FilterConfiguration {

    public enum Kind {
        FIXED,     // membership.BloomFilter
        SCALABLE,  // membership.ScalableBloomFilter
        DYNAMIC    // membership.DynamicBloomFilter
    }

    public static final String KIND_PROPERTY = "bloom.kind";
    public static final String CAPACITY_PROPERTY = "bloom.capacity";
    public static final String ERROR_RATE_PROPERTY = "bloom.errorRate";
    public static final String GROWTH_PROPERTY = "bloom.growth";
    public static final String MAX_CAPACITY_PROPERTY = "bloom.maxCapacity";

    private final Kind kind;
    private final long capacity;
    private final double errorRate;
    private final GrowthMode growthMode;
    private final long maxCapacity;

    private FilterConfiguration(Builder builder) {
        this.kind = Objects.requireNonNull(builder.kind, "kind");
        this.capacity = builder.capacity;
        this.errorRate = builder.errorRate;
        this.growthMode = Objects.requireNonNull(builder.growthMode, "growthMode");
        this.maxCapacity = builder.maxCapacity;
        validate();
    }

    public static Builder builder() { return new Builder(); }

    private void validate() {
        FilterParameters.checkCapacity(capacity);
        FilterParameters.checkErrorRate(errorRate);
        if (kind == Kind.DYNAMIC) {
            if (capacity > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("dynamic base capacity must fit in an int, got " + capacity);
            }
            if (maxCapacity <= 0) {
                throw new IllegalArgumentException("maxCapacity must be > 0, got " + maxCapacity);
            }
        }
    }

    public Kind kind() { return kind; }
    // Fixed capacity, initial capacity (scalable) or base capacity (dynamic).
    public long capacity() { return capacity; }
    public double errorRate() { return errorRate; }
    public GrowthMode growthMode() { return growthMode; }
    public long maxCapacity() { return maxCapacity; }

    /**
     * Reads {@code bloom.kind}, {@code bloom.capacity}, {@code bloom.errorRate}, {@code bloom.growth}
     * (2, 4 or a {@link GrowthMode} name) and {@code bloom.maxCapacity}; absent keys keep the builder defaults.
     */
    public static FilterConfiguration fromProperties(Properties props) {
        Objects.requireNonNull(props, "props");
        Builder b = builder();
        String kind = props.getProperty(KIND_PROPERTY);
        if (kind != null) b.kind(Kind.valueOf(kind.trim().toUpperCase(Locale.ROOT)));
        String capacity = props.getProperty(CAPACITY_PROPERTY);
        if (capacity != null) b.capacity(Long.parseLong(capacity.trim()));
        String errorRate = props.getProperty(ERROR_RATE_PROPERTY);
        if (errorRate != null) b.errorRate(Double.parseDouble(errorRate.trim()));
        String growth = props.getProperty(GROWTH_PROPERTY);
        if (growth != null) b.growthMode(parseGrowth(growth.trim()));
        String maxCapacity = props.getProperty(MAX_CAPACITY_PROPERTY);
        if (maxCapacity != null) b.maxCapacity(Long.parseLong(maxCapacity.trim()));
        return b.build();
    }

    private static GrowthMode parseGrowth(String value) {
        if (!value.isEmpty() && Character.isDigit(value.charAt(0))) {
            return GrowthMode.fromScale(Integer.parseInt(value));
        }
        return GrowthMode.valueOf(value.toUpperCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return "FilterConfiguration[kind=" + kind + ", capacity=" + capacity + ", errorRate=" + errorRate
                + ", growthMode=" + growthMode + ", maxCapacity=" + maxCapacity + "]";
    }

    public static final class Builder {
        private Kind kind = Kind.FIXED;
        private long capacity = ScalableBloomFilter.DEFAULT_INITIAL_CAPACITY;
        private double errorRate = BloomFilter.DEFAULT_ERROR_RATE;
        private GrowthMode growthMode = GrowthMode.SMALL_SET_GROWTH;
        private long maxCapacity = DynamicBloomFilter.DEFAULT_MAX_CAPACITY;

        private Builder() {
        }

        public Builder kind(Kind kind) {
            this.kind = kind;
            return this;
        }

        public Builder capacity(long capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder errorRate(double errorRate) {
            this.errorRate = errorRate;
            return this;
        }

        public Builder growthMode(GrowthMode growthMode) {
            this.growthMode = growthMode;
            return this;
        }

        public Builder maxCapacity(long maxCapacity) {
            this.maxCapacity = maxCapacity;
            return this;
        }

        public FilterConfiguration build() {
            return new FilterConfiguration(this);
        }
    }
}
