package loadgrid.controlplane.simulation;

import loadgrid.controlplane.model.OperationKind;
import loadgrid.controlplane.worker.OperationResult;
import loadgrid.controlplane.worker.TargetClient;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Stand-in for a shared target database.
 * <p>
 * Latency is flat up to {@code saturationConcurrency} operations in flight
 * and grows linearly beyond it. Share one instance between all simulated
 * workers so they saturate the same target.
 */
public final class SimulatedTargetClient implements TargetClient {

    private final double baseLatencyMs;
    private final int saturationConcurrency;
    private final double errorRate;
    private final Map<OperationKind, Double> kindFactors = new EnumMap<>(OperationKind.class);
    private final AtomicInteger inFlight = new AtomicInteger();

    /**
     * @param baseLatencyMs         latency of an unloaded operation
     * @param saturationConcurrency in-flight count where latency starts to grow
     * @param errorRate             probability (0..1) that an operation fails
     */
    public SimulatedTargetClient(double baseLatencyMs, int saturationConcurrency, double errorRate) {
        if (saturationConcurrency <= 0) {
            throw new IllegalArgumentException("saturationConcurrency must be positive");
        }
        this.baseLatencyMs = baseLatencyMs;
        this.saturationConcurrency = saturationConcurrency;
        this.errorRate = errorRate;
        kindFactors.put(OperationKind.POINT_LOOKUP, 1.0);
        kindFactors.put(OperationKind.RANGE_SCAN, 3.0);
        kindFactors.put(OperationKind.INSERT, 1.5);
        kindFactors.put(OperationKind.UPDATE, 1.5);
    }

    @Override
    public OperationResult execute(OperationKind kind, String key) {
        int current = inFlight.incrementAndGet();
        try {
            double latency = latencyAt(current) * kindFactors.getOrDefault(kind, 1.0)
                    * (0.9 + ThreadLocalRandom.current().nextDouble() * 0.2);
            sleep(latency);
            if (errorRate > 0 && ThreadLocalRandom.current().nextDouble() < errorRate) {
                return OperationResult.failure(latency, "simulated failure for " + key);
            }
            return OperationResult.success(latency);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return OperationResult.failure(0, "interrupted");
        } finally {
            inFlight.decrementAndGet();
        }
    }

    /** Noise-free latency with {@code concurrency} operations in flight. */
    public double latencyAt(int concurrency) {
        return baseLatencyMs * Math.max(1.0, concurrency / (double) saturationConcurrency);
    }

    public int inFlight() {
        return inFlight.get();
    }

    private static void sleep(double millis) throws InterruptedException {
        long whole = (long) millis;
        int nanos = (int) ((millis - whole) * 1_000_000);
        Thread.sleep(whole, nanos);
    }
}
