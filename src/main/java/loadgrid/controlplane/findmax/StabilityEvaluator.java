package loadgrid.controlplane.findmax;

import loadgrid.controlplane.model.FindMaxSettings;
import loadgrid.controlplane.model.KindMetrics;
import loadgrid.controlplane.model.KindSlo;
import loadgrid.controlplane.model.OperationKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Judges a step against the run-wide guardrails and the per-kind targets.
 * <p>
 * A step is stable iff its error rate is at most {@code maxErrorRatePct} and
 * its p95 and p99 are at most {@code baseline * (1 + 2 * latencyStabilityPct / 100)}.
 * Latency guardrails need a positive baseline and at least one successful
 * operation in the step. A step that recorded no operations at all is unstable.
 */
public class StabilityEvaluator {

    private final FindMaxSettings settings;
    private final Map<OperationKind, Double> operationMix;
    private final Map<OperationKind, KindSlo> slos;

    public StabilityEvaluator(FindMaxSettings settings, Map<OperationKind, Double> operationMix,
            Map<OperationKind, KindSlo> slos) {
        this.settings = settings;
        this.operationMix = operationMix;
        this.slos = slos;
    }

    /** Highest latency a step may show given the baseline. */
    public double guardrail(double baselineMs) {
        return baselineMs * (1.0 + 2.0 * settings.latencyStabilityPct() / 100.0);
    }

    public StabilityVerdict evaluate(StepMeasurement m, Double baselineP95Ms, Double baselineP99Ms) {
        List<String> reasons = new ArrayList<>();

        if (m.operations() == 0) {
            reasons.add("No operations completed");
            return new StabilityVerdict(false, reasons);
        }

        if (m.errorRatePct() > settings.maxErrorRatePct()) {
            reasons.add(format("Error rate %.2f%% > %.2f%%", m.errorRatePct(), settings.maxErrorRatePct()));
        }

        if (m.hasLatency()) {
            if (baselineP95Ms != null && baselineP95Ms > 0) {
                double limit = guardrail(baselineP95Ms);
                if (m.p95LatencyMs() > limit) {
                    reasons.add(format("P95 latency %.2fms > %.2fms (baseline %.2fms)",
                            m.p95LatencyMs(), limit, baselineP95Ms));
                }
            }
            if (baselineP99Ms != null && baselineP99Ms > 0) {
                double limit = guardrail(baselineP99Ms);
                if (m.p99LatencyMs() > limit) {
                    reasons.add(format("P99 latency %.2fms > %.2fms (baseline %.2fms)",
                            m.p99LatencyMs(), limit, baselineP99Ms));
                }
            }
        }

        for (Map.Entry<OperationKind, KindSlo> entry : slos.entrySet()) {
            OperationKind kind = entry.getKey();
            KindSlo slo = entry.getValue();
            Double weight = operationMix.get(kind);
            if (weight == null || weight <= 0 || slo == null || !slo.anyEnabled()) {
                continue;
            }
            checkKind(kind, slo, m.kind(kind), reasons);
        }

        return reasons.isEmpty() ? StabilityVerdict.ok() : new StabilityVerdict(false, reasons);
    }

    private static void checkKind(OperationKind kind, KindSlo slo, KindMetrics metrics, List<String> reasons) {
        String label = kind.label();
        if (metrics.operations() == 0) {
            reasons.add(label + ": no operations observed");
            return;
        }
        if (slo.p95Enabled() && metrics.p95LatencyMs() != null && metrics.p95LatencyMs() > slo.targetP95Ms()) {
            reasons.add(format("%s: P95 %.2fms > %.2fms", label, metrics.p95LatencyMs(), slo.targetP95Ms()));
        }
        if (slo.p99Enabled() && metrics.p99LatencyMs() != null && metrics.p99LatencyMs() > slo.targetP99Ms()) {
            reasons.add(format("%s: P99 %.2fms > %.2fms", label, metrics.p99LatencyMs(), slo.targetP99Ms()));
        }
        if (slo.errorRateEnabled() && metrics.errorRatePct() > slo.targetErrorRatePct()) {
            reasons.add(format("%s: error rate %.2f%% > %.2f%%", label, metrics.errorRatePct(),
                    slo.targetErrorRatePct()));
        }
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
