package loadgrid.controlplane.repository;

import loadgrid.controlplane.model.WorkerHeartbeat;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for {@code worker_heartbeats} rows.
 */
public interface HeartbeatRepository {

    /**
     * Refresh a worker's heartbeat, creating the row on first call.
     * Sets {@code last_heartbeat} to now and increments {@code heartbeat_count}.
     *
     * @param heartbeat reported state; its count and timestamp are ignored
     */
    void upsert(WorkerHeartbeat heartbeat);

    /**
     * Find one worker's heartbeat.
     */
    Optional<WorkerHeartbeat> find(String runId, String workerId);

    /**
     * All heartbeats of a run, ordered by worker id.
     */
    List<WorkerHeartbeat> findByRun(String runId);

    /**
     * Delete a run's heartbeats (teardown).
     *
     * @return number of rows deleted
     */
    int deleteByRun(String runId);
}
