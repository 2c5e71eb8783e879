package loadgrid.controlplane.model;

import java.util.List;

/**
 * Summary written to {@code run_status.summary} when the run reaches a terminal status.
 * {@code findMax} is null for FIXED and QPS runs.
 */
public record RunSummary(
        String runId,
        RunStatus finalStatus,
        LoadMode loadMode,
        long totalOperations,
        long totalErrors,
        double errorRatePct,
        int workersReported,
        int workersFailed,
        List<String> deadWorkers,
        AggregatedFindMaxResult findMax) {

    public RunSummary {
        deadWorkers = deadWorkers == null ? List.of() : List.copyOf(deadWorkers);
    }
}
