package loadgrid.controlplane.model;

/**
 * Parameters of the adaptive max-concurrency search.
 *
 * @param startConcurrency     concurrency of the first (baseline) step
 * @param concurrencyIncrement added after every stable step
 * @param stepDurationSeconds  how long each level is held and measured
 * @param maxConcurrency       upper bound; a stable step here ends the search
 * @param latencyStabilityPct  allowed latency drift; the guardrail is
 *                             {@code baseline * (1 + 2 * pct / 100)}
 * @param maxErrorRatePct      highest error rate a stable step may show
 * @param maxBackoffAttempts   confirmatory retries after instability, 0 disables
 * @param settleMillis         pause after scaling before a step's window opens
 */
public record FindMaxSettings(
        int startConcurrency,
        int concurrencyIncrement,
        double stepDurationSeconds,
        int maxConcurrency,
        double latencyStabilityPct,
        double maxErrorRatePct,
        int maxBackoffAttempts,
        long settleMillis) {

    public static FindMaxSettings defaults() {
        return new FindMaxSettings(5, 10, 30.0, 100, 20.0, 1.0, 0, 500);
    }

    public FindMaxSettings withStepDurationSeconds(double seconds) {
        return new FindMaxSettings(startConcurrency, concurrencyIncrement, seconds, maxConcurrency,
                latencyStabilityPct, maxErrorRatePct, maxBackoffAttempts, settleMillis);
    }

    public FindMaxSettings withSettleMillis(long millis) {
        return new FindMaxSettings(startConcurrency, concurrencyIncrement, stepDurationSeconds, maxConcurrency,
                latencyStabilityPct, maxErrorRatePct, maxBackoffAttempts, millis);
    }

    public void validate() {
        if (startConcurrency <= 0) {
            throw new IllegalArgumentException("startConcurrency must be positive");
        }
        if (concurrencyIncrement <= 0) {
            throw new IllegalArgumentException("concurrencyIncrement must be positive");
        }
        if (maxConcurrency < startConcurrency) {
            throw new IllegalArgumentException("maxConcurrency must be >= startConcurrency");
        }
        if (stepDurationSeconds <= 0) {
            throw new IllegalArgumentException("stepDurationSeconds must be positive");
        }
        if (latencyStabilityPct < 0) {
            throw new IllegalArgumentException("latencyStabilityPct must be non-negative");
        }
        if (maxErrorRatePct < 0 || maxErrorRatePct > 100) {
            throw new IllegalArgumentException("maxErrorRatePct must be between 0 and 100");
        }
        if (maxBackoffAttempts < 0) {
            throw new IllegalArgumentException("maxBackoffAttempts must be non-negative");
        }
        if (settleMillis < 0) {
            throw new IllegalArgumentException("settleMillis must be non-negative");
        }
    }
}
