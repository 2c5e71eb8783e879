package loadgrid.controlplane.findmax;

import loadgrid.controlplane.model.FindMaxSettings;
import loadgrid.controlplane.model.KindMetrics;
import loadgrid.controlplane.model.KindSlo;
import loadgrid.controlplane.model.OperationKind;
import org.junit.jupiter.api.*;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StabilityEvaluatorTest {

    private static final FindMaxSettings SETTINGS = new FindMaxSettings(5, 10, 1.0, 100, 20.0, 1.0, 0, 0);

    private static StepMeasurement step(long operations, long errors, double p95, double p99,
            Map<OperationKind, KindMetrics> kinds) {
        double errorRate = operations > 0 ? errors * 100.0 / operations : 0.0;
        return new StepMeasurement(10, 1.0, operations, errors, operations - errors, p95, p99, errorRate, kinds);
    }

    @Test
    void guardrailIsBaselineTimesOnePlusTwicePct() {
        StabilityEvaluator evaluator = new StabilityEvaluator(SETTINGS, Map.of(), Map.of());
        assertEquals(28.0, evaluator.guardrail(20.0), 1e-9);
    }

    @Test
    void withinGuardrailsIsStable() {
        StabilityEvaluator evaluator = new StabilityEvaluator(SETTINGS, Map.of(), Map.of());

        StabilityVerdict verdict = evaluator.evaluate(step(1000, 5, 27.0, 30.0, Map.of()), 20.0, 25.0);

        assertTrue(verdict.stable());
        assertNull(verdict.reason());
    }

    @Test
    void latencyAboveGuardrailIsUnstable() {
        StabilityEvaluator evaluator = new StabilityEvaluator(SETTINGS, Map.of(), Map.of());

        StabilityVerdict verdict = evaluator.evaluate(step(1000, 0, 35.0, 30.0, Map.of()), 20.0, 25.0);

        assertFalse(verdict.stable());
        assertEquals("P95 latency 35.00ms > 28.00ms (baseline 20.00ms)", verdict.reason());
    }

    @Test
    void reasonsAreJoined() {
        StabilityEvaluator evaluator = new StabilityEvaluator(SETTINGS, Map.of(), Map.of());

        StabilityVerdict verdict = evaluator.evaluate(step(100, 2, 35.0, 50.0, Map.of()), 20.0, 25.0);

        assertEquals(3, verdict.reasons().size());
        assertTrue(verdict.reason().startsWith("Error rate 2.00% > 1.00%; P95"));
    }

    @Test
    void stepWithoutOperationsIsUnstable() {
        StabilityEvaluator evaluator = new StabilityEvaluator(SETTINGS, Map.of(), Map.of());

        StabilityVerdict verdict = evaluator.evaluate(step(0, 0, 0.0, 0.0, Map.of()), 20.0, 25.0);

        assertFalse(verdict.stable());
        assertEquals("No operations completed", verdict.reason());
    }

    @Test
    void allFailedStepIsJudgedOnErrorRateOnly() {
        StabilityEvaluator evaluator = new StabilityEvaluator(SETTINGS, Map.of(), Map.of());

        StabilityVerdict verdict = evaluator.evaluate(step(50, 50, 0.0, 0.0, Map.of()), 20.0, 25.0);

        assertEquals(1, verdict.reasons().size());
        assertTrue(verdict.reason().startsWith("Error rate 100.00%"));
    }

    @Test
    void zeroBaselineDisablesLatencyGuardrail() {
        StabilityEvaluator evaluator = new StabilityEvaluator(SETTINGS, Map.of(), Map.of());

        assertTrue(evaluator.evaluate(step(100, 0, 500.0, 900.0, Map.of()), 0.0, 0.0).stable());
        assertTrue(evaluator.evaluate(step(100, 0, 500.0, 900.0, Map.of()), null, null).stable());
    }

    @Test
    void kindSloBreachNamesTheKind() {
        Map<OperationKind, Double> mix = Map.of(OperationKind.POINT_LOOKUP, 80.0, OperationKind.RANGE_SCAN, 20.0);
        Map<OperationKind, KindSlo> slos = Map.of(OperationKind.RANGE_SCAN, new KindSlo(50.0, null, null));
        StabilityEvaluator evaluator = new StabilityEvaluator(SETTINGS, mix, slos);

        Map<OperationKind, KindMetrics> kinds = Map.of(
                OperationKind.POINT_LOOKUP, new KindMetrics(800, 0, 5.0, 6.0, 0.0),
                OperationKind.RANGE_SCAN, new KindMetrics(200, 0, 80.0, 90.0, 0.0));
        StabilityVerdict verdict = evaluator.evaluate(step(1000, 0, 20.0, 25.0, kinds), 20.0, 25.0);

        assertFalse(verdict.stable());
        assertEquals("Range Scan: P95 80.00ms > 50.00ms", verdict.reason());
    }

    @Test
    void configuredKindWithoutOperationsIsUnstable() {
        Map<OperationKind, Double> mix = Map.of(OperationKind.POINT_LOOKUP, 80.0, OperationKind.INSERT, 20.0);
        Map<OperationKind, KindSlo> slos = Map.of(OperationKind.INSERT, new KindSlo(null, null, 0.5));
        StabilityEvaluator evaluator = new StabilityEvaluator(SETTINGS, mix, slos);

        Map<OperationKind, KindMetrics> kinds = Map.of(
                OperationKind.POINT_LOOKUP, new KindMetrics(1000, 0, 5.0, 6.0, 0.0));
        StabilityVerdict verdict = evaluator.evaluate(step(1000, 0, 20.0, 25.0, kinds), 20.0, 25.0);

        assertEquals("Insert: no operations observed", verdict.reason());
    }

    @Test
    void kindOutsideTheMixIsIgnored() {
        Map<OperationKind, Double> mix = Map.of(OperationKind.POINT_LOOKUP, 100.0, OperationKind.UPDATE, 0.0);
        Map<OperationKind, KindSlo> slos = Map.of(OperationKind.UPDATE, new KindSlo(1.0, 1.0, 0.0));
        StabilityEvaluator evaluator = new StabilityEvaluator(SETTINGS, mix, slos);

        assertTrue(evaluator.evaluate(step(1000, 0, 20.0, 25.0, Map.of()), 20.0, 25.0).stable());
    }
}
