package utilities;

import membership.BloomFilter;
import membership.DynamicBloomFilter;
import membership.Membership;
import membership.ScalableBloomFilter;
import org.openjdk.jol.info.GraphLayout;
import org.openjdk.jol.vm.VM;

import java.util.List;
import java.util.Locale;

public class MemUtil {

    private static final double MIB = 1024.0 * 1024.0;

    // Retained bytes of the filter's object graph, bit vectors included.
    public long footprint(Membership filter) {
        return GraphLayout.parseInstance(filter).totalSize();
    }

    // Bytes of raw bit storage the filter's parameters call for, ignoring object overhead.
    public long bitStorageBytes(Membership filter) {
        long total = 0;
        for (BloomFilter f : subFilters(filter)) total += f.parameters().byteLength();
        return total;
    }

    // Detailed JOL report for a filter, optionally including per-sub-filter and class footprint.
    public String jolMemoryReport(boolean includePerFilter, boolean includeFootprintTable, Membership filter) {
        StringBuilder sb = new StringBuilder(4_096);

        // VM details (useful to interpret alignment, header sizes, and compressed oops status)
        sb.append("=== JOL / VM details ===\n");
        sb.append(VM.current().details()).append('\n');

        GraphLayout total = GraphLayout.parseInstance(filter);
        sb.append("\n=== ").append(filter.getClass().getSimpleName()).append(" total ===\n");
        sb.append("Total bytes       : ").append(total.totalSize()).append(" B\n");
        sb.append("Total bytes (MiB) : ")
                .append(String.format(Locale.ROOT, "%.3f", total.totalSize() / MIB))
                .append(" MiB\n");
        sb.append("Bit storage       : ").append(bitStorageBytes(filter)).append(" B\n");

        if (includeFootprintTable) {
            sb.append("\n--- Class footprint ---\n");
            sb.append(total.toFootprint()).append('\n');
        }

        if (includePerFilter) {
            List<BloomFilter> filters = subFilters(filter);
            sb.append("\n=== Per sub-filter (each as its own root) ===\n");
            for (int i = 0; i < filters.size(); i++) {
                BloomFilter f = filters.get(i);
                GraphLayout gl = GraphLayout.parseInstance(f);
                sb.append("Filter #").append(i)
                        .append("  bytes=").append(gl.totalSize()).append(" B")
                        .append("  ").append(f).append('\n');
            }
        }

        return sb.toString();
    }

    // Like jolMemoryReport but also returns the totals.
    public MemoryUsageReport jolMemoryReportWithTotal(boolean includePerFilter, boolean includeFootprintTable,
                                                      Membership filter) {
        String txt = jolMemoryReport(includePerFilter, includeFootprintTable, filter);
        return new MemoryUsageReport(filter.getClass().getSimpleName(), txt, footprint(filter) / MIB,
                bitStorageBytes(filter));
    }

    static List<BloomFilter> subFilters(Membership filter) {
        if (filter instanceof BloomFilter) return List.of((BloomFilter) filter);
        if (filter instanceof ScalableBloomFilter) return ((ScalableBloomFilter) filter).filters();
        if (filter instanceof DynamicBloomFilter) return ((DynamicBloomFilter) filter).filters();
        throw new IllegalArgumentException("Unsupported filter type: " + filter.getClass().getName());
    }
}
