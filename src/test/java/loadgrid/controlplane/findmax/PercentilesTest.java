package loadgrid.controlplane.findmax;

import org.HdrHistogram.Histogram;
import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

class PercentilesTest {

    private static Histogram histogram(double... latenciesMs) {
        Histogram h = new Histogram(Percentiles.SIGNIFICANT_DIGITS);
        for (double ms : latenciesMs) {
            h.recordValue(Percentiles.toMicros(ms));
        }
        return h;
    }

    @Test
    void emptyHistogramGivesZero() {
        assertEquals(0.0, Percentiles.percentile(histogram(), 95));
    }

    @Test
    void nearestRankOverRecordedSamples() {
        double[] samples = new double[100];
        for (int i = 0; i < 100; i++) {
            samples[i] = 100 - i; // 100..1
        }
        Histogram h = histogram(samples);

        assertEquals(96.0, Percentiles.percentile(h, 95), 0.1);
        assertEquals(100.0, Percentiles.percentile(h, 99.9), 0.1);
        assertEquals(1.0, Percentiles.percentile(h, 0), 0.001);
    }

    @Test
    void singleSampleIsEveryPercentile() {
        assertEquals(7.5, Percentiles.percentile(histogram(7.5), 50), 0.01);
        assertEquals(7.5, Percentiles.percentile(histogram(7.5), 99), 0.01);
    }

    @Test
    void repeatedValuesCountByRank() {
        // 90 fast samples and 10 slow: p95 lands in the slow tail
        double[] samples = new double[100];
        for (int i = 0; i < 100; i++) {
            samples[i] = i < 90 ? 2.0 : 40.0;
        }
        Histogram h = histogram(samples);

        assertEquals(2.0, Percentiles.percentile(h, 50), 0.01);
        assertEquals(40.0, Percentiles.percentile(h, 95), 0.1);
    }

    @Test
    void latencyIsRecordedInMicroseconds() {
        assertEquals(1500, Percentiles.toMicros(1.5));
        assertEquals(0, Percentiles.toMicros(-3));
    }

    @Test
    void longWindowKeepsBoundedHistogram() {
        Histogram h = new Histogram(Percentiles.SIGNIFICANT_DIGITS);
        for (int i = 0; i < 1_000_000; i++) {
            h.recordValue(Percentiles.toMicros(1 + (i % 50)));
        }
        int footprint = h.getEstimatedFootprintInBytes();
        for (int i = 0; i < 1_000_000; i++) {
            h.recordValue(Percentiles.toMicros(1 + (i % 50)));
        }

        assertEquals(2_000_000, h.getTotalCount());
        assertEquals(footprint, h.getEstimatedFootprintInBytes());
        assertEquals(48.0, Percentiles.percentile(h, 95), 0.1);
    }
}
