package loadgrid.controlplane.findmax;

import loadgrid.controlplane.model.FindMaxResult;
import loadgrid.controlplane.model.FindMaxSettings;
import loadgrid.controlplane.model.StepRecord;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.IntToDoubleFunction;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrencyControllerTest {

    private static FindMaxSettings settings(int start, int increment, int max, int backoffAttempts) {
        return new FindMaxSettings(start, increment, 1.0, max, 20.0, 1.0, backoffAttempts, 0);
    }

    /** Executor whose p95 is a function of concurrency; p99 is 1.2x p95. */
    private static final class ScriptedExecutor implements StepExecutor {
        private final IntToDoubleFunction p95;
        private final List<Integer> levels = new ArrayList<>();

        ScriptedExecutor(IntToDoubleFunction p95) {
            this.p95 = p95;
        }

        @Override
        public StepMeasurement runStep(int concurrency, double durationSeconds) {
            levels.add(concurrency);
            double latency = p95.applyAsDouble(concurrency);
            return new StepMeasurement(concurrency, durationSeconds, concurrency * 10L, 0,
                    concurrency * 10.0, latency, latency * 1.2, 0.0, Map.of());
        }
    }

    private static FindMaxResult search(FindMaxSettings settings, StepExecutor executor, List<StepRecord> sink)
            throws InterruptedException {
        StabilityEvaluator evaluator = new StabilityEvaluator(settings, Map.of(), Map.of());
        return new ConcurrencyController(settings, evaluator, executor, sink::add, () -> false).run();
    }

    @Test
    void flatLatencyClimbsToMax() throws InterruptedException {
        ScriptedExecutor executor = new ScriptedExecutor(c -> 20.0);
        List<StepRecord> published = new ArrayList<>();

        FindMaxResult result = search(settings(5, 10, 35, 0), executor, published);

        assertEquals(List.of(5, 15, 25, 35), executor.levels);
        assertEquals(35, result.finalBestConcurrency());
        assertEquals(350.0, result.finalBestQps(), 1e-9);
        assertEquals(FindMaxResult.REACHED_MAX, result.terminationReason());
        assertEquals(4, result.steps().size());
        assertTrue(result.steps().stream().allMatch(StepRecord::stable));
        assertEquals(FindMaxResult.REACHED_MAX, result.steps().get(3).stopReason());
        assertEquals(result.steps(), published);
    }

    @Test
    void incrementIsClampedToMax() throws InterruptedException {
        ScriptedExecutor executor = new ScriptedExecutor(c -> 20.0);

        FindMaxResult result = search(settings(5, 10, 30, 0), executor, new ArrayList<>());

        assertEquals(List.of(5, 15, 25, 30), executor.levels);
        assertEquals(30, result.finalBestConcurrency());
    }

    @Test
    void latencyKneeStopsOneIncrementBelow() throws InterruptedException {
        // baseline 20ms, 20% stability -> guardrail 28ms; the knee sits at 25
        ScriptedExecutor executor = new ScriptedExecutor(c -> c >= 25 ? 35.0 : 20.0);

        FindMaxResult result = search(settings(5, 10, 100, 0), executor, new ArrayList<>());

        assertEquals(List.of(5, 15, 25), executor.levels);
        assertEquals(15, result.finalBestConcurrency());
        assertEquals(20.0, result.baselineP95LatencyMs(), 1e-9);

        StepRecord last = result.steps().get(2);
        assertFalse(last.stable());
        assertTrue(last.stopReason().contains("P95 latency 35.00ms > 28.00ms"), last.stopReason());
        assertEquals(last.stopReason(), result.terminationReason());
        assertSame(last, result.reportedUnstableStep().orElseThrow());
    }

    @Test
    void unstableFirstStepLeavesNoBest() throws InterruptedException {
        StepExecutor failing = (concurrency, duration) -> new StepMeasurement(concurrency, duration,
                100, 50, 50.0, 10.0, 12.0, 50.0, Map.of());

        FindMaxResult result = search(settings(5, 10, 100, 0), failing, new ArrayList<>());

        assertEquals(0, result.finalBestConcurrency());
        assertEquals(0.0, result.finalBestQps());
        assertEquals(1, result.steps().size());
        assertTrue(result.terminationReason().startsWith("Error rate 50.00% > 1.00%"));
    }

    @Test
    void stopRequestEndsSearchWithoutRecordingPartialStep() throws InterruptedException {
        ScriptedExecutor executor = new ScriptedExecutor(c -> 20.0);
        FindMaxSettings settings = settings(5, 10, 100, 0);
        StabilityEvaluator evaluator = new StabilityEvaluator(settings, Map.of(), Map.of());

        FindMaxResult result = new ConcurrencyController(settings, evaluator, executor, step -> { },
                () -> executor.levels.size() >= 3).run();

        assertEquals(FindMaxResult.STOPPED, result.terminationReason());
        assertEquals(3, executor.levels.size());
        assertEquals(2, result.steps().size());
        assertEquals(15, result.finalBestConcurrency());
    }

    @Test
    void backoffConfirmsLastStableLevelAndProbesMidpoint() throws InterruptedException {
        ScriptedExecutor executor = new ScriptedExecutor(c -> c > 20 ? 35.0 : 20.0);

        FindMaxResult result = search(settings(10, 20, 100, 1), executor, new ArrayList<>());

        // 10 ok, 30 breaks, 10 re-run as backoff, midpoint 20 ok, 40 breaks with no attempts left
        assertEquals(List.of(10, 30, 10, 20, 40), executor.levels);
        assertTrue(result.steps().get(2).backoff());
        assertTrue(result.steps().get(2).stable());
        assertFalse(result.steps().get(1).backoff());
        assertEquals(20, result.finalBestConcurrency());
        assertEquals(40, result.reportedUnstableStep().orElseThrow().concurrency());
    }

    @Test
    void stepIndexesAreContiguous() throws InterruptedException {
        ScriptedExecutor executor = new ScriptedExecutor(c -> c > 20 ? 35.0 : 20.0);

        FindMaxResult result = search(settings(10, 20, 100, 1), executor, new ArrayList<>());

        for (int i = 0; i < result.steps().size(); i++) {
            assertEquals(i, result.steps().get(i).stepIndex());
        }
    }
}
