package utilities;

/**
 * JOL report for one filter: the report text, the retained size in MiB and the bytes of raw bit
 * storage the filter's parameters call for.
 */
public record MemoryUsageReport(String filter, String report, double totalMiB, long bitStorageBytes) {

    // Retained bytes per byte of bit storage; NaN for a filter with no sub-filters yet.
    public double overheadRatio() {
        if (bitStorageBytes == 0) return Double.NaN;
        return totalMiB * 1024.0 * 1024.0 / bitStorageBytes;
    }
}
