package loadgrid.controlplane.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Run-level find-max result merged from every worker's final result.
 * Concurrency and QPS are sums; baselines are the highest per-worker baselines.
 */
@JsonIgnoreProperties(value = "is_aggregate", allowGetters = true)
public record AggregatedFindMaxResult(
        int totalWorkers,
        int totalNodes,
        int finalBestConcurrency,
        double finalBestQps,
        Double baselineP95LatencyMs,
        Double baselineP99LatencyMs,
        List<WorkerFindMaxSummary> perWorkerResults,
        List<AggregatedStep> steps) {

    public AggregatedFindMaxResult {
        perWorkerResults = perWorkerResults == null ? List.of() : List.copyOf(perWorkerResults);
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    @JsonProperty("is_aggregate")
    public boolean isAggregate() {
        return true;
    }
}
