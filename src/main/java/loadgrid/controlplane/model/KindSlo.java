package loadgrid.controlplane.model;

/**
 * Optional per-operation-kind targets a find-max step must meet.
 * A null (or non-positive latency) target is disabled; an error target of 0 is enabled.
 */
public record KindSlo(Double targetP95Ms, Double targetP99Ms, Double targetErrorRatePct) {

    public boolean p95Enabled() {
        return targetP95Ms != null && Double.isFinite(targetP95Ms) && targetP95Ms > 0;
    }

    public boolean p99Enabled() {
        return targetP99Ms != null && Double.isFinite(targetP99Ms) && targetP99Ms > 0;
    }

    public boolean errorRateEnabled() {
        return targetErrorRatePct != null && Double.isFinite(targetErrorRatePct) && targetErrorRatePct >= 0;
    }

    public boolean anyEnabled() {
        return p95Enabled() || p99Enabled() || errorRateEnabled();
    }
}
