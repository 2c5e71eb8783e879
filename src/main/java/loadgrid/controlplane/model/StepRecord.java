package loadgrid.controlplane.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * One measured find-max step. Immutable once written.
 *
 * @param stepIndex    position in the worker's step history, from 0
 * @param concurrency  pool size held during the step
 * @param stable       whether every guardrail held
 * @param stopReason   what exceeded its bound, or {@code reached max workers}; null otherwise
 * @param backoff      confirmatory re-run at reduced load after an instability
 * @param kindMetrics  breakdown per operation kind
 */
public record StepRecord(
        int stepIndex,
        int concurrency,
        double qps,
        double p95LatencyMs,
        double p99LatencyMs,
        double errorRatePct,
        boolean stable,
        String stopReason,
        @JsonProperty("is_backoff") boolean backoff,
        Map<OperationKind, KindMetrics> kindMetrics) {

    public StepRecord {
        kindMetrics = kindMetrics == null || kindMetrics.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(kindMetrics));
    }

    public StepRecord withStopReason(String reason) {
        return new StepRecord(stepIndex, concurrency, qps, p95LatencyMs, p99LatencyMs, errorRatePct,
                stable, reason, backoff, kindMetrics);
    }
}
