package loadgrid.controlplane.repository;

import loadgrid.controlplane.model.StepRecord;
import loadgrid.controlplane.model.WorkerResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository interface for per-worker step history ({@code worker_steps})
 * and final results ({@code worker_results}).
 */
public interface WorkerResultRepository {

    /**
     * Store one step. Re-saving the same step index replaces nothing it
     * would change, so retries are harmless.
     */
    void saveStep(String runId, String workerId, StepRecord step);

    /**
     * A worker's steps ordered by step index.
     */
    List<StepRecord> findSteps(String runId, String workerId);

    /**
     * Steps of every worker of a run, keyed by worker id.
     */
    Map<String, List<StepRecord>> findStepsByRun(String runId);

    /**
     * Store a worker's final result (one per worker and run).
     */
    void saveResult(WorkerResult result);

    Optional<WorkerResult> findResult(String runId, String workerId);

    List<WorkerResult> findResultsByRun(String runId);
}
