package loadgrid.controlplane.worker;

import loadgrid.controlplane.findmax.Percentiles;
import loadgrid.controlplane.findmax.StepMeasurement;
import loadgrid.controlplane.model.KindMetrics;
import loadgrid.controlplane.model.OperationKind;
import org.HdrHistogram.Histogram;
import org.HdrHistogram.Recorder;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Collects operation outcomes for the current window. {@link #snapshotAndReset}
 * closes the window and opens the next, so each find-max step sees only its own
 * operations. Lifetime totals survive resets.
 * <p>
 * Latencies of successful operations go into one HdrHistogram recorder per
 * kind, so a window's footprint does not grow with its operation count.
 */
public final class MeasurementWindow {

    private final Map<OperationKind, KindSamples> samples = new EnumMap<>(OperationKind.class);
    private final AtomicLong totalOperations = new AtomicLong();
    private final AtomicLong totalErrors = new AtomicLong();
    private long windowStartNanos = System.nanoTime();

    public MeasurementWindow() {
        for (OperationKind kind : OperationKind.values()) {
            samples.put(kind, new KindSamples());
        }
    }

    public void record(OperationKind kind, OperationResult result) {
        totalOperations.incrementAndGet();
        if (!result.success()) {
            totalErrors.incrementAndGet();
        }
        synchronized (this) {
            samples.get(kind).add(result);
        }
    }

    /** Discard the current window and start a new one now. */
    public synchronized void reset() {
        samples.values().forEach(KindSamples::clear);
        windowStartNanos = System.nanoTime();
    }

    /**
     * Close the current window, measured at {@code concurrency}, and start a new one.
     */
    public synchronized StepMeasurement snapshotAndReset(int concurrency) {
        double elapsed = Math.max((System.nanoTime() - windowStartNanos) / 1_000_000_000.0, 1e-9);

        long operations = 0;
        long errors = 0;
        Histogram all = new Histogram(Percentiles.SIGNIFICANT_DIGITS);
        Map<OperationKind, KindMetrics> perKind = new EnumMap<>(OperationKind.class);
        for (Map.Entry<OperationKind, KindSamples> e : samples.entrySet()) {
            KindSamples s = e.getValue();
            Histogram latencies = s.latencies.getIntervalHistogram();
            if (s.operations == 0) {
                continue;
            }
            operations += s.operations;
            errors += s.errors;
            all.add(latencies);
            boolean hasLatency = latencies.getTotalCount() > 0;
            perKind.put(e.getKey(), new KindMetrics(s.operations, s.errors,
                    hasLatency ? Percentiles.percentile(latencies, 95) : null,
                    hasLatency ? Percentiles.percentile(latencies, 99) : null,
                    s.errors * 100.0 / s.operations));
        }

        StepMeasurement m = new StepMeasurement(
                concurrency,
                elapsed,
                operations,
                errors,
                (operations - errors) / elapsed,
                Percentiles.percentile(all, 95),
                Percentiles.percentile(all, 99),
                operations > 0 ? errors * 100.0 / operations : 0.0,
                perKind);

        reset();
        return m;
    }

    public long totalOperations() {
        return totalOperations.get();
    }

    public long totalErrors() {
        return totalErrors.get();
    }

    /** Latencies of successful operations plus counters for one kind. */
    private static final class KindSamples {
        private final Recorder latencies = new Recorder(Percentiles.SIGNIFICANT_DIGITS);
        private long operations;
        private long errors;

        void add(OperationResult result) {
            operations++;
            if (!result.success()) {
                errors++;
                return;
            }
            latencies.recordValue(Percentiles.toMicros(result.latencyMs()));
        }

        void clear() {
            latencies.reset();
            operations = 0;
            errors = 0;
        }
    }
}
