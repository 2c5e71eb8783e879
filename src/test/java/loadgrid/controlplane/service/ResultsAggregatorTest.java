package loadgrid.controlplane.service;

import loadgrid.controlplane.model.AggregatedFindMaxResult;
import loadgrid.controlplane.model.AggregatedStep;
import loadgrid.controlplane.model.FindMaxResult;
import loadgrid.controlplane.model.LoadMode;
import loadgrid.controlplane.model.RunStatus;
import loadgrid.controlplane.model.RunSummary;
import loadgrid.controlplane.model.StepRecord;
import loadgrid.controlplane.model.WorkerOutcome;
import loadgrid.controlplane.model.WorkerResult;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResultsAggregatorTest {

    private final ResultsAggregator aggregator = new ResultsAggregator();

    private static StepRecord step(int index, int concurrency, double qps, double p95, boolean stable,
            String reason, boolean backoff) {
        return new StepRecord(index, concurrency, qps, p95, p95 * 1.5, 0.0, stable, reason, backoff, Map.of());
    }

    private static WorkerResult worker(String id, String node, FindMaxResult findMax) {
        return new WorkerResult("run-1", id, node, WorkerOutcome.COMPLETED, 1000, 10, null, findMax, Instant.now());
    }

    private static FindMaxResult findMax(int best, double qps, double baseline, List<StepRecord> steps) {
        return new FindMaxResult(best, qps, baseline, baseline * 1.5, "P95 latency", steps);
    }

    @Test
    void bestConcurrencyAndQpsAreSummed() {
        List<WorkerResult> results = List.of(
                worker("w1", "node-a", findMax(15, 150.0, 20.0, List.of())),
                worker("w2", "node-a", findMax(25, 240.0, 22.0, List.of())),
                worker("w3", "node-b", findMax(15, 160.0, 18.0, List.of())));

        AggregatedFindMaxResult agg = aggregator.aggregate(results);

        assertEquals(55, agg.finalBestConcurrency());
        assertEquals(550.0, agg.finalBestQps(), 1e-9);
        assertEquals(3, agg.totalWorkers());
        assertEquals(2, agg.totalNodes());
        assertEquals(22.0, agg.baselineP95LatencyMs(), 1e-9);
        assertEquals(3, agg.perWorkerResults().size());
        assertTrue(agg.isAggregate());
    }

    @Test
    void workerWithoutFindMaxCountsAsZero() {
        WorkerResult failed = new WorkerResult("run-1", "w2", "node-a", WorkerOutcome.FAILED, 0, 0,
                "rendezvous timed out", null, Instant.now());

        AggregatedFindMaxResult agg = aggregator.aggregate(List.of(
                worker("w1", "node-a", findMax(15, 150.0, 20.0, List.of())), failed));

        assertEquals(15, agg.finalBestConcurrency());
        assertEquals(2, agg.totalWorkers());
        assertEquals(0, agg.perWorkerResults().get(1).finalBestConcurrency());
        assertEquals(WorkerOutcome.FAILED, agg.perWorkerResults().get(1).outcome());
    }

    @Test
    void stepsGroupByConcurrencyAndSkipBackoff() {
        List<StepRecord> w1 = List.of(
                step(0, 5, 50.0, 20.0, true, null, false),
                step(1, 15, 140.0, 22.0, true, null, false),
                step(2, 25, 150.0, 40.0, false, "P95 latency 40.00ms > 28.00ms (baseline 20.00ms)", false),
                step(3, 15, 130.0, 21.0, true, null, true));
        List<StepRecord> w2 = List.of(
                step(0, 5, 55.0, 18.0, true, null, false),
                step(1, 15, 150.0, 24.0, true, null, false));

        List<AggregatedStep> steps = aggregator.aggregateSteps(Map.of("w1", w1, "w2", w2));

        assertEquals(List.of(5, 15, 25), steps.stream().map(AggregatedStep::concurrency).toList());

        AggregatedStep fifteen = steps.get(1);
        assertEquals(290.0, fifteen.totalQps(), 1e-9);
        assertEquals(24.0, fifteen.maxP95LatencyMs(), 1e-9);
        assertEquals(23.0, fifteen.avgP95LatencyMs(), 1e-9);
        assertEquals(2, fifteen.activeWorkers());
        assertFalse(fifteen.degraded());

        AggregatedStep twentyFive = steps.get(2);
        assertEquals(1, twentyFive.activeWorkers());
        assertTrue(twentyFive.degraded());
        assertEquals(1, twentyFive.reasons().size());
    }

    @Test
    void summaryTotalsOperationsAndFailures() {
        WorkerResult ok = worker("w1", "node-a", null);
        WorkerResult failed = new WorkerResult("run-1", "w2", "node-a", WorkerOutcome.FAILED, 500, 490,
                "boom", null, Instant.now());

        RunSummary summary = aggregator.summarize("run-1", RunStatus.COMPLETED, LoadMode.FIXED,
                List.of(ok, failed), List.of("w3"));

        assertEquals(1500, summary.totalOperations());
        assertEquals(500, summary.totalErrors());
        assertEquals(500 * 100.0 / 1500, summary.errorRatePct(), 1e-9);
        assertEquals(2, summary.workersReported());
        assertEquals(1, summary.workersFailed());
        assertEquals(List.of("w3"), summary.deadWorkers());
        assertNull(summary.findMax());
    }
}
