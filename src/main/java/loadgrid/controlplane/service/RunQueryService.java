package loadgrid.controlplane.service;

import loadgrid.controlplane.model.AggregatedStep;
import loadgrid.controlplane.model.HeartbeatSummary;
import loadgrid.controlplane.model.Run;
import loadgrid.controlplane.model.StepRecord;
import loadgrid.controlplane.model.WorkerResult;
import loadgrid.controlplane.repository.RunStatusRepository;
import loadgrid.controlplane.repository.WorkerResultRepository;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only query surface over the control-plane tables, for dashboards and tooling.
 */
public class RunQueryService {

    private final RunStatusRepository runRepository;
    private final WorkerResultRepository resultRepository;
    private final HeartbeatRegistry heartbeatRegistry;
    private final ResultsAggregator aggregator;

    public RunQueryService(RunStatusRepository runRepository, WorkerResultRepository resultRepository,
            HeartbeatRegistry heartbeatRegistry, ResultsAggregator aggregator) {
        this.runRepository = runRepository;
        this.resultRepository = resultRepository;
        this.heartbeatRegistry = heartbeatRegistry;
        this.aggregator = aggregator;
    }

    public Optional<Run> run(String runId) {
        return runRepository.findById(runId);
    }

    public HeartbeatSummary heartbeats(String runId) {
        return heartbeatRegistry.summarize(runId);
    }

    public List<StepRecord> workerSteps(String runId, String workerId) {
        return resultRepository.findSteps(runId, workerId);
    }

    public Map<String, List<StepRecord>> stepsByWorker(String runId) {
        return resultRepository.findStepsByRun(runId);
    }

    /** Live cross-worker step history, available before the run finishes. */
    public List<AggregatedStep> aggregatedSteps(String runId) {
        return aggregator.aggregateSteps(resultRepository.findStepsByRun(runId));
    }

    public List<WorkerResult> workerResults(String runId) {
        return resultRepository.findResultsByRun(runId);
    }
}
