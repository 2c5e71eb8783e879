package loadgrid.controlplane.model;

import java.time.Instant;

/**
 * Final report of one worker, written once when the worker stops.
 * {@code findMax} is null for FIXED and QPS runs and for workers that never started.
 */
public record WorkerResult(
        String runId,
        String workerId,
        String nodeId,
        WorkerOutcome outcome,
        long totalOperations,
        long totalErrors,
        String errorMessage,
        FindMaxResult findMax,
        Instant finishedAt) {
}
