package loadgrid.controlplane.findmax;

import org.HdrHistogram.Histogram;
import org.HdrHistogram.HistogramIterationValue;

/**
 * Nearest-rank percentiles over latency histograms recorded in microseconds.
 */
public final class Percentiles {

    /** Significant decimal digits kept by every latency histogram. */
    public static final int SIGNIFICANT_DIGITS = 3;

    private Percentiles() {
    }

    /** Latency in milliseconds as the microsecond value a histogram records. */
    public static long toMicros(double latencyMs) {
        return Math.max(0, Math.round(latencyMs * 1000.0));
    }

    /**
     * Value at zero-based rank {@code floor(n * p / 100)} of the recorded
     * samples, clamped to the largest, in milliseconds. Returns 0 for an
     * empty histogram.
     */
    public static double percentile(Histogram histogram, double p) {
        long n = histogram.getTotalCount();
        if (n == 0) {
            return 0.0;
        }
        long rank = Math.min(n, (long) (n * p / 100.0) + 1);
        long seen = 0;
        for (HistogramIterationValue v : histogram.recordedValues()) {
            seen += v.getCountAtValueIteratedTo();
            if (seen >= rank) {
                return v.getValueIteratedTo() / 1000.0;
            }
        }
        return histogram.getMaxValue() / 1000.0;
    }
}
