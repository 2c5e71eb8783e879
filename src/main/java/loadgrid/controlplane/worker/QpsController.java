package loadgrid.controlplane.worker;

import loadgrid.controlplane.model.QpsSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.BooleanSupplier;

/**
 * Holds one worker's share of a target QPS by resizing its client task pool.
 * <p>
 * Every control interval the successful-operation rate since the previous
 * decision is measured and the pool is resized to
 * {@code ceil(target / qpsPerTask)}, clamped to the configured bounds.
 * With no measured throughput the pool grows by one.
 */
public class QpsController {

    private static final Logger log = LoggerFactory.getLogger(QpsController.class);
    private static final long SLICE_MS = 20;

    private final String workerId;
    private final QpsSettings settings;
    private final double targetQps;
    private final ClientTaskPool pool;
    private final MeasurementWindow window;
    private final BooleanSupplier stopRequested;

    private volatile double lastQps;

    /**
     * @param targetQps this worker's share of the run's target
     */
    public QpsController(String workerId, QpsSettings settings, double targetQps, ClientTaskPool pool,
            MeasurementWindow window, BooleanSupplier stopRequested) {
        this.workerId = workerId;
        this.settings = settings;
        this.targetQps = targetQps;
        this.pool = pool;
        this.window = window;
        this.stopRequested = stopRequested;
    }

    /** Successful operations per second measured in the last interval. */
    public double lastQps() {
        return lastQps;
    }

    /** Runs until a stop is requested. */
    public void run() throws InterruptedException {
        long lastSuccesses = successes();
        long lastNanos = System.nanoTime();
        while (!stopRequested.getAsBoolean()) {
            sleepUnlessStopped(settings.controlIntervalMillis());
            if (stopRequested.getAsBoolean()) {
                return;
            }
            long nowSuccesses = successes();
            long nowNanos = System.nanoTime();
            double elapsed = (nowNanos - lastNanos) / 1_000_000_000.0;
            lastQps = elapsed > 0 ? (nowSuccesses - lastSuccesses) / elapsed : 0;
            lastSuccesses = nowSuccesses;
            lastNanos = nowNanos;

            int current = pool.target();
            int desired = desiredConcurrency(targetQps, lastQps, current,
                    settings.minConcurrency(), settings.maxConcurrency());
            if (desired != current) {
                log.debug("Worker {}: QPS {} of {}, scaling {} -> {}", workerId,
                        String.format("%.1f", lastQps), String.format("%.1f", targetQps), current, desired);
                pool.scaleTo(desired);
            }
        }
    }

    /**
     * Pool size that should deliver {@code targetQps} given the rate
     * {@code currentQps} measured at {@code current} tasks.
     */
    public static int desiredConcurrency(double targetQps, double currentQps, int current, int min, int max) {
        int desired;
        if (currentQps > 0) {
            double perTask = currentQps / Math.max(1, current);
            desired = (int) Math.min(Integer.MAX_VALUE, Math.ceil(targetQps / perTask));
        } else {
            desired = current + 1;
        }
        return Math.max(min, Math.min(max, desired));
    }

    private long successes() {
        return window.totalOperations() - window.totalErrors();
    }

    private void sleepUnlessStopped(long millis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + millis;
        long remaining;
        while ((remaining = deadline - System.currentTimeMillis()) > 0) {
            if (stopRequested.getAsBoolean()) {
                return;
            }
            Thread.sleep(Math.min(SLICE_MS, remaining));
        }
    }
}
