package loadgrid.controlplane.model;

import java.util.List;

/**
 * Steps of all workers that ran at the same per-worker concurrency, merged.
 *
 * @param degraded true if any worker found the level unstable
 * @param reasons  distinct stop reasons reported at this level
 */
public record AggregatedStep(
        int concurrency,
        double totalQps,
        double maxP95LatencyMs,
        double avgP95LatencyMs,
        double maxP99LatencyMs,
        double avgP99LatencyMs,
        int activeWorkers,
        boolean degraded,
        List<String> reasons) {

    public AggregatedStep {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }
}
