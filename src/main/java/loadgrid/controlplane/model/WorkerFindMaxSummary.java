package loadgrid.controlplane.model;

/**
 * One worker's entry in the aggregated find-max result.
 */
public record WorkerFindMaxSummary(
        String workerId,
        String nodeId,
        WorkerOutcome outcome,
        int finalBestConcurrency,
        double finalBestQps,
        Double baselineP95LatencyMs,
        Double baselineP99LatencyMs,
        String terminationReason,
        int stepCount) {
}
