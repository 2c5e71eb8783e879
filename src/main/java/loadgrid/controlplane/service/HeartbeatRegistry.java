package loadgrid.controlplane.service;

import loadgrid.controlplane.config.ControlPlaneConfig;
import loadgrid.controlplane.model.HeartbeatSummary;
import loadgrid.controlplane.model.WorkerHeartbeat;
import loadgrid.controlplane.model.WorkerStatus;
import loadgrid.controlplane.repository.HeartbeatRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Service layer for worker liveness.
 * Handles heartbeats, registration, and staleness detection.
 */
public class HeartbeatRegistry {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatRegistry.class);

    private final HeartbeatRepository heartbeatRepository;
    private final ControlPlaneConfig config;

    public HeartbeatRegistry(HeartbeatRepository heartbeatRepository, ControlPlaneConfig config) {
        this.heartbeatRepository = heartbeatRepository;
        this.config = config;
    }

    /**
     * Register a worker for a run with status READY.
     */
    public void register(String runId, String workerId, String nodeId) {
        heartbeatRepository.upsert(WorkerHeartbeat.builder()
                .runId(runId)
                .workerId(workerId)
                .nodeId(nodeId)
                .status(WorkerStatus.READY)
                .build());
        log.info("Worker {} registered for run {} (node {})", workerId, runId, nodeId);
    }

    /**
     * Refresh a worker's heartbeat row.
     */
    public void beat(WorkerHeartbeat heartbeat) {
        heartbeatRepository.upsert(heartbeat);
        log.debug("Heartbeat from {}/{} status={} phase={} active={}", heartbeat.runId(), heartbeat.workerId(),
                heartbeat.status(), heartbeat.phase(), heartbeat.activeConnections());
    }

    public Optional<WorkerHeartbeat> find(String runId, String workerId) {
        return heartbeatRepository.find(runId, workerId);
    }

    public List<WorkerHeartbeat> findByRun(String runId) {
        return heartbeatRepository.findByRun(runId);
    }

    /**
     * Summarize a run's heartbeats against the configured staleness timeout.
     */
    public HeartbeatSummary summarize(String runId) {
        return summarize(runId, Instant.now());
    }

    public HeartbeatSummary summarize(String runId, Instant now) {
        Instant cutoff = now.minus(config.heartbeatTimeout());
        List<WorkerHeartbeat> heartbeats = heartbeatRepository.findByRun(runId);

        int ready = 0;
        int running = 0;
        int stopped = 0;
        List<String> stale = new ArrayList<>();
        for (WorkerHeartbeat hb : heartbeats) {
            switch (hb.status()) {
                case READY -> ready++;
                case RUNNING -> running++;
                case STOPPED -> stopped++;
            }
            if (hb.isStale(cutoff)) {
                stale.add(hb.workerId());
            }
        }
        return new HeartbeatSummary(heartbeats.size(), ready, running, stopped, stale, heartbeats);
    }

    /**
     * Delete a run's heartbeat rows.
     *
     * @return number of rows removed
     */
    public int teardown(String runId) {
        int deleted = heartbeatRepository.deleteByRun(runId);
        if (deleted > 0) {
            log.info("Removed {} heartbeat rows of run {}", deleted, runId);
        }
        return deleted;
    }
}
