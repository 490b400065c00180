package membership;

// Probabilistic set membership shared by the fixed filter and both growth orchestrators.
public interface Membership {

    // False means definitely absent, true means probably present.
    boolean contains(Object key);

    // Returns true when the key was (probably) already present.
    boolean insert(Object key);

    long count();

    long capacity();

    double errorRate();
}
