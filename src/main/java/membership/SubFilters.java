package membership;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;
import java.util.StringJoiner;

/**
 * Encodes the ordered sub-filter list shared by the growth orchestrators.
 *
 * Binary: {@code i32 n}, then {@code n} little-endian u64 byte lengths, then the {@code n} filter
 * encodings back to back. Text: filter texts joined by {@code '|'}, empty for no filters.
 */
final class SubFilters {
    static final char TEXT_SEPARATOR = '|';

    private SubFilters() {}

    static void write(List<BloomFilter> filters, OutputStream out) throws IOException {
        ByteBuffer count = ByteBuffer.allocate(Integer.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        out.write(count.putInt(filters.size()).array());
        if (filters.isEmpty()) return;

        // Lengths precede the bodies, so encode first.
        ObjectArrayList<byte[]> encoded = new ObjectArrayList<>(filters.size());
        ByteBuffer table = ByteBuffer.allocate(Long.BYTES * filters.size()).order(ByteOrder.LITTLE_ENDIAN);
        for (BloomFilter filter : filters) {
            ByteArrayOutputStream bos = new ByteArrayOutputStream(BloomFilter.HEADER_BYTES
                    + (int) filter.parameters().byteLength());
            filter.writeTo(bos);
            byte[] bytes = bos.toByteArray();
            encoded.add(bytes);
            table.putLong(bytes.length);
        }
        out.write(table.array());
        for (byte[] bytes : encoded) out.write(bytes);
    }

    static ObjectArrayList<BloomFilter> read(InputStream in) throws IOException {
        int n = ByteBuffer.wrap(readFully(in, Integer.BYTES, "filter count"))
                .order(ByteOrder.LITTLE_ENDIAN).getInt();
        if (n < 0) throw new CorruptFilterException("Negative filter count: " + n);
        ObjectArrayList<BloomFilter> filters = new ObjectArrayList<>();
        if (n == 0) return filters;

        ByteBuffer table = ByteBuffer.wrap(readFully(in, (long) Long.BYTES * n, "filter length table"))
                .order(ByteOrder.LITTLE_ENDIAN);
        for (int i = 0; i < n; i++) {
            long length = table.getLong();
            if (length < BloomFilter.HEADER_BYTES) {
                throw new CorruptFilterException("Filter " + i + " declares " + length + " bytes, less than its header");
            }
            filters.add(BloomFilter.readFrom(in, length));
        }
        return filters;
    }

    static byte[] readFully(InputStream in, long length, String what) throws IOException {
        if (length > Integer.MAX_VALUE) throw new CorruptFilterException(what + " too large: " + length + " bytes");
        byte[] bytes = in.readNBytes((int) length);
        if (bytes.length != length) {
            throw new CorruptFilterException("Truncated " + what + ": " + bytes.length + " of " + length + " bytes");
        }
        return bytes;
    }

    static String toText(List<BloomFilter> filters) {
        StringJoiner joiner = new StringJoiner(String.valueOf(TEXT_SEPARATOR));
        for (BloomFilter filter : filters) joiner.add(filter.toText());
        return joiner.toString();
    }

    static ObjectArrayList<BloomFilter> fromText(String field) throws CorruptFilterException {
        ObjectArrayList<BloomFilter> filters = new ObjectArrayList<>();
        if (field.isEmpty()) return filters;
        int start = 0;
        while (true) {
            int end = field.indexOf(TEXT_SEPARATOR, start);
            filters.add(BloomFilter.fromText(end < 0 ? field.substring(start) : field.substring(start, end)));
            if (end < 0) return filters;
            start = end + 1;
        }
    }
}
