import membership.Membership;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import utilities.BloomLogger;
import utilities.FilterConfiguration;
import utilities.FilterFactory;

import java.util.Locale;

/**
 * FalsePositiveExperiment fills a filter with the integer keys {@code 0 .. inserts-1} and then probes
 * keys from a disjoint space ({@code "probe-<random long>"}), so every hit is a false positive.
 *
 * We report per run:
 *    alreadyPresent   inserts that the filter reported as duplicates (false positives during fill)
 *    observedRate     false positives / probes
 *    upperBound       Wilson score upper bound of the observed rate at the requested confidence
 */
public class FalsePositiveExperiment {

    private static final long INSERTS = 10_000;
    private static final long PROBES = 100_000;
    private static final long SEED = 42L;
    private static final double CONFIDENCE = 0.99;

    public record Result(String filter,
                         long inserted,
                         long alreadyPresent,
                         long probes,
                         long falsePositives,
                         double observedRate,
                         double upperBound,
                         double targetRate) {

        @Override
        public String toString() {
            return String.format(Locale.ROOT,
                    "%s: inserted=%d alreadyPresent=%d probes=%d fp=%d observed=%.5f upper=%.5f target=%.5f",
                    filter, inserted, alreadyPresent, probes, falsePositives, observedRate, upperBound, targetRate);
        }
    }

    public static Result run(Membership filter, long inserts, long probes, long seed, double confidence) {
        if (inserts < 0) throw new IllegalArgumentException("inserts must be >= 0");
        if (probes <= 0) throw new IllegalArgumentException("probes must be > 0");
        if (confidence <= 0.0 || confidence >= 1.0) {
            throw new IllegalArgumentException("confidence must be in (0,1)");
        }

        long alreadyPresent = 0;
        for (long i = 0; i < inserts; i++) {
            if (filter.insert(i)) alreadyPresent++;
        }

        RandomGenerator rng = new Well19937c(seed);
        long falsePositives = 0;
        for (long i = 0; i < probes; i++) {
            if (filter.contains("probe-" + rng.nextLong())) falsePositives++;
        }

        double observed = (double) falsePositives / probes;
        double upper = wilsonUpperBound(falsePositives, probes, confidence);
        return new Result(filter.getClass().getSimpleName(), inserts, alreadyPresent, probes,
                falsePositives, observed, upper, filter.errorRate());
    }

    static double wilsonUpperBound(long successes, long trials, double confidence) {
        double z = new NormalDistribution(0.0, 1.0).inverseCumulativeProbability(1.0 - (1.0 - confidence) / 2.0);
        double n = trials;
        double p = successes / n;
        double z2 = z * z;
        double centre = p + z2 / (2 * n);
        double margin = z * Math.sqrt(p * (1 - p) / n + z2 / (4 * n * n));
        return Math.min(1.0, (centre + margin) / (1 + z2 / n));
    }

    public static void main(String[] args) {
        for (FilterConfiguration.Kind kind : FilterConfiguration.Kind.values()) {
            FilterConfiguration config = FilterConfiguration.builder()
                    .kind(kind)
                    .capacity(kind == FilterConfiguration.Kind.FIXED ? INSERTS : 1_000)
                    .errorRate(0.001)
                    .build();
            Result result = run(FilterFactory.create(config), INSERTS, PROBES, SEED, CONFIDENCE);
            BloomLogger.info(result.toString());
        }
    }
}
