package loadgrid.controlplane.model;

/**
 * Per-operation-kind slice of a step's measurements. Latencies are null
 * when no operation of the kind succeeded during the step.
 */
public record KindMetrics(long operations, long errors, Double p95LatencyMs, Double p99LatencyMs, double errorRatePct) {

    public static KindMetrics empty() {
        return new KindMetrics(0, 0, null, null, 0.0);
    }
}
