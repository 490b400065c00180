package membership;

import java.util.EnumSet;

// Capacity multiplier applied each time a ScalableBloomFilter appends a sub-filter.
public enum GrowthMode {
    SMALL_SET_GROWTH(2), // slower, but takes up less memory
    LARGE_SET_GROWTH(4); // faster, but takes up more memory faster

    private final int scale;

    GrowthMode(int scale) { this.scale = scale; }

    public int scale() { return scale; }

    public static GrowthMode fromScale(int scale) {
        return EnumSet.allOf(GrowthMode.class).stream()
                .filter(mode -> mode.scale == scale)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown growth scale: " + scale
                        + " (expected 2 or 4)"));
    }
}
