package loadgrid.controlplane.findmax;

import loadgrid.controlplane.model.KindMetrics;
import loadgrid.controlplane.model.OperationKind;
import loadgrid.controlplane.model.StepRecord;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Metrics of one step's window. Latencies cover successful operations only
 * and are 0 when there were none.
 */
public record StepMeasurement(
        int concurrency,
        double elapsedSeconds,
        long operations,
        long errors,
        double qps,
        double p95LatencyMs,
        double p99LatencyMs,
        double errorRatePct,
        Map<OperationKind, KindMetrics> kindMetrics) {

    public StepMeasurement {
        kindMetrics = kindMetrics == null || kindMetrics.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(kindMetrics));
    }

    /** True if at least one operation succeeded, so the latency figures mean something. */
    public boolean hasLatency() {
        return operations > errors;
    }

    public KindMetrics kind(OperationKind kind) {
        return kindMetrics.getOrDefault(kind, KindMetrics.empty());
    }

    public StepRecord toStep(int stepIndex, boolean stable, String stopReason, boolean backoff) {
        return new StepRecord(stepIndex, concurrency, qps, p95LatencyMs, p99LatencyMs, errorRatePct,
                stable, stopReason, backoff, kindMetrics);
    }
}
