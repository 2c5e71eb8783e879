package loadgrid.controlplane.model;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one worker's max-concurrency search.
 */
public record FindMaxResult(
        int finalBestConcurrency,
        double finalBestQps,
        Double baselineP95LatencyMs,
        Double baselineP99LatencyMs,
        String terminationReason,
        List<StepRecord> steps) {

    public static final String REACHED_MAX = "reached max workers";
    public static final String STOPPED = "stopped";

    public FindMaxResult {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    /**
     * The step that ended the search: the last unstable step that is not a backoff re-run.
     */
    public Optional<StepRecord> reportedUnstableStep() {
        for (int i = steps.size() - 1; i >= 0; i--) {
            StepRecord step = steps.get(i);
            if (!step.stable() && !step.backoff()) {
                return Optional.of(step);
            }
        }
        return Optional.empty();
    }
}
