package loadgrid.controlplane.model;

/**
 * Parameters of QPS-target load.
 *
 * @param targetQps             successful operations per second over the whole run
 * @param minConcurrency        lower bound of each worker's pool, also its warmup size
 * @param maxConcurrency        upper bound of each worker's pool
 * @param controlIntervalMillis time between two rescaling decisions
 */
public record QpsSettings(double targetQps, int minConcurrency, int maxConcurrency, long controlIntervalMillis) {

    public static QpsSettings defaults() {
        return new QpsSettings(0, 1, 100, 2000);
    }

    public void validate() {
        if (!(targetQps > 0) || Double.isInfinite(targetQps)) {
            throw new IllegalArgumentException("targetQps must be positive");
        }
        if (minConcurrency <= 0) {
            throw new IllegalArgumentException("minConcurrency must be positive");
        }
        if (maxConcurrency < minConcurrency) {
            throw new IllegalArgumentException("maxConcurrency must be >= minConcurrency");
        }
        if (controlIntervalMillis <= 0) {
            throw new IllegalArgumentException("controlIntervalMillis must be positive");
        }
    }
}
