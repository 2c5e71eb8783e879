package loadgrid.controlplane.model;

import java.util.List;

/**
 * Liveness picture of one run at a point in time.
 *
 * @param staleWorkers workers not refreshed within the heartbeat timeout (never STOPPED ones)
 */
public record HeartbeatSummary(
        int registered,
        int ready,
        int running,
        int stopped,
        List<String> staleWorkers,
        List<WorkerHeartbeat> workers) {

    public HeartbeatSummary {
        staleWorkers = staleWorkers == null ? List.of() : List.copyOf(staleWorkers);
        workers = workers == null ? List.of() : List.copyOf(workers);
    }

    /** Registered workers that are neither stale nor stopped. */
    public int alive() {
        return registered - stopped - staleWorkers.size();
    }
}
