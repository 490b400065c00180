package membership;

public class FilterCapacityExceededException extends IllegalStateException {

    private final long capacity;
    private final long count;

    public FilterCapacityExceededException(long capacity, long count) {
        super("BloomFilter is at capacity (capacity=" + capacity + ", count=" + count + ")");
        this.capacity = capacity;
        this.count = count;
    }

    public long capacity() { return capacity; }
    public long count() { return count; }
}
