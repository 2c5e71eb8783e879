package loadgrid.controlplane.service;

import loadgrid.controlplane.model.AggregatedFindMaxResult;
import loadgrid.controlplane.model.AggregatedStep;
import loadgrid.controlplane.model.FindMaxResult;
import loadgrid.controlplane.model.LoadMode;
import loadgrid.controlplane.model.RunStatus;
import loadgrid.controlplane.model.RunSummary;
import loadgrid.controlplane.model.StepRecord;
import loadgrid.controlplane.model.WorkerFindMaxSummary;
import loadgrid.controlplane.model.WorkerOutcome;
import loadgrid.controlplane.model.WorkerResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Merges per-worker results into run-level results. Stateless.
 */
public class ResultsAggregator {

    /**
     * Merge final find-max results. Best concurrency and QPS are summed over
     * all workers; a worker without a find-max result contributes zero.
     */
    public AggregatedFindMaxResult aggregate(List<WorkerResult> results) {
        int bestConcurrency = 0;
        double bestQps = 0.0;
        Double baselineP95 = null;
        Double baselineP99 = null;
        Set<String> nodes = new HashSet<>();
        List<WorkerFindMaxSummary> perWorker = new ArrayList<>();
        Map<String, List<StepRecord>> stepsByWorker = new LinkedHashMap<>();

        for (WorkerResult result : results) {
            nodes.add(result.nodeId() != null ? result.nodeId() : result.workerId());
            FindMaxResult fm = result.findMax();
            if (fm == null) {
                perWorker.add(new WorkerFindMaxSummary(result.workerId(), result.nodeId(), result.outcome(),
                        0, 0.0, null, null, null, 0));
                continue;
            }
            bestConcurrency += fm.finalBestConcurrency();
            bestQps += fm.finalBestQps();
            baselineP95 = max(baselineP95, fm.baselineP95LatencyMs());
            baselineP99 = max(baselineP99, fm.baselineP99LatencyMs());
            stepsByWorker.put(result.workerId(), fm.steps());
            perWorker.add(new WorkerFindMaxSummary(result.workerId(), result.nodeId(), result.outcome(),
                    fm.finalBestConcurrency(), fm.finalBestQps(), fm.baselineP95LatencyMs(),
                    fm.baselineP99LatencyMs(), fm.terminationReason(), fm.steps().size()));
        }

        return new AggregatedFindMaxResult(results.size(), nodes.size(), bestConcurrency, bestQps,
                baselineP95, baselineP99, perWorker, aggregateSteps(stepsByWorker));
    }

    /**
     * Group the steps of all workers by the per-worker concurrency they ran at.
     * Backoff re-runs are left out; they repeat a level already counted.
     */
    public List<AggregatedStep> aggregateSteps(Map<String, List<StepRecord>> stepsByWorker) {
        Map<Integer, List<StepRecord>> byLevel = new TreeMap<>();
        Map<Integer, Set<String>> workersByLevel = new TreeMap<>();
        for (Map.Entry<String, List<StepRecord>> entry : stepsByWorker.entrySet()) {
            for (StepRecord step : entry.getValue()) {
                if (step.backoff()) {
                    continue;
                }
                byLevel.computeIfAbsent(step.concurrency(), k -> new ArrayList<>()).add(step);
                workersByLevel.computeIfAbsent(step.concurrency(), k -> new HashSet<>()).add(entry.getKey());
            }
        }

        List<AggregatedStep> merged = new ArrayList<>();
        for (Map.Entry<Integer, List<StepRecord>> level : byLevel.entrySet()) {
            List<StepRecord> steps = level.getValue();
            double totalQps = 0;
            double maxP95 = 0;
            double sumP95 = 0;
            double maxP99 = 0;
            double sumP99 = 0;
            boolean degraded = false;
            Set<String> reasons = new LinkedHashSet<>();
            for (StepRecord step : steps) {
                totalQps += step.qps();
                maxP95 = Math.max(maxP95, step.p95LatencyMs());
                sumP95 += step.p95LatencyMs();
                maxP99 = Math.max(maxP99, step.p99LatencyMs());
                sumP99 += step.p99LatencyMs();
                degraded |= !step.stable();
                if (step.stopReason() != null) {
                    reasons.add(step.stopReason());
                }
            }
            merged.add(new AggregatedStep(level.getKey(), totalQps, maxP95, sumP95 / steps.size(),
                    maxP99, sumP99 / steps.size(), workersByLevel.get(level.getKey()).size(), degraded,
                    new ArrayList<>(reasons)));
        }
        return merged;
    }

    /**
     * Build the run summary stored with the terminal status.
     */
    public RunSummary summarize(String runId, RunStatus finalStatus, LoadMode loadMode,
            List<WorkerResult> results, Collection<String> deadWorkers) {
        long operations = 0;
        long errors = 0;
        int failed = 0;
        for (WorkerResult result : results) {
            operations += result.totalOperations();
            errors += result.totalErrors();
            if (result.outcome() == WorkerOutcome.FAILED) {
                failed++;
            }
        }
        double errorRate = operations > 0 ? errors * 100.0 / operations : 0.0;
        AggregatedFindMaxResult findMax = loadMode == LoadMode.FIND_MAX ? aggregate(results) : null;
        return new RunSummary(runId, finalStatus, loadMode, operations, errors, errorRate,
                results.size(), failed, new ArrayList<>(deadWorkers), findMax);
    }

    private static Double max(Double current, Double candidate) {
        if (candidate == null) {
            return current;
        }
        return current == null ? candidate : Math.max(current, candidate);
    }
}
