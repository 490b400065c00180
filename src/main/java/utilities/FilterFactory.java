package utilities;

import membership.BloomFilter;
import membership.DynamicBloomFilter;
import membership.GrowthMode;
import membership.Membership;
import membership.ScalableBloomFilter;
import membership.SerializableMembership;

import java.util.function.Supplier;

/**
 * Central place to construct filters from a {@link FilterConfiguration}.
 */
public final class FilterFactory {

    private FilterFactory() {}

    public static SerializableMembership create(FilterConfiguration config) {
        return switch (config.kind()) {
            case FIXED -> new BloomFilter(config.capacity(), config.errorRate());
            case SCALABLE -> new ScalableBloomFilter(config.capacity(), config.errorRate(), config.growthMode());
            case DYNAMIC -> new DynamicBloomFilter((int) config.capacity(), config.maxCapacity(), config.errorRate());
        };
    }

    // A fresh, empty filter per call.
    public static Supplier<Membership> supplier(FilterConfiguration config) {
        return () -> create(config);
    }

    public static BloomFilter createFixed(long capacity, double errorRate) {
        return new BloomFilter(capacity, errorRate);
    }

    public static ScalableBloomFilter createScalable(long initialCapacity, double errorRate, int growthScale) {
        return new ScalableBloomFilter(initialCapacity, errorRate, GrowthMode.fromScale(growthScale));
    }

    public static DynamicBloomFilter createDynamic(int baseCapacity, long maxCapacity, double errorRate) {
        return new DynamicBloomFilter(baseCapacity, maxCapacity, errorRate);
    }
}
