package loadgrid.controlplane.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable view of one {@code worker_heartbeats} row.
 */
public final class WorkerHeartbeat {
    private final String runId;
    private final String workerId;
    private final String nodeId;
    private final WorkerStatus status;
    private final String phase;
    private final Instant lastHeartbeat;
    private final long heartbeatCount;
    private final int activeConnections;
    private final int targetConnections;
    private final long queriesProcessed;
    private final long errorCount;
    private final String lastError;

    private WorkerHeartbeat(Builder builder) {
        this.runId = Objects.requireNonNull(builder.runId, "runId is required");
        this.workerId = Objects.requireNonNull(builder.workerId, "workerId is required");
        this.nodeId = builder.nodeId;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.phase = builder.phase;
        this.lastHeartbeat = builder.lastHeartbeat;
        this.heartbeatCount = builder.heartbeatCount;
        this.activeConnections = builder.activeConnections;
        this.targetConnections = builder.targetConnections;
        this.queriesProcessed = builder.queriesProcessed;
        this.errorCount = builder.errorCount;
        this.lastError = builder.lastError;
    }

    public String runId() {
        return runId;
    }

    public String workerId() {
        return workerId;
    }

    public String nodeId() {
        return nodeId;
    }

    public WorkerStatus status() {
        return status;
    }

    public String phase() {
        return phase;
    }

    public Instant lastHeartbeat() {
        return lastHeartbeat;
    }

    public long heartbeatCount() {
        return heartbeatCount;
    }

    public int activeConnections() {
        return activeConnections;
    }

    public int targetConnections() {
        return targetConnections;
    }

    public long queriesProcessed() {
        return queriesProcessed;
    }

    public long errorCount() {
        return errorCount;
    }

    public String lastError() {
        return lastError;
    }

    /** True if the last refresh is older than the cutoff. STOPPED workers are never stale. */
    public boolean isStale(Instant cutoff) {
        if (status == WorkerStatus.STOPPED) {
            return false;
        }
        return lastHeartbeat == null || lastHeartbeat.isBefore(cutoff);
    }

    public Builder toBuilder() {
        return new Builder()
                .runId(runId)
                .workerId(workerId)
                .nodeId(nodeId)
                .status(status)
                .phase(phase)
                .lastHeartbeat(lastHeartbeat)
                .heartbeatCount(heartbeatCount)
                .activeConnections(activeConnections)
                .targetConnections(targetConnections)
                .queriesProcessed(queriesProcessed)
                .errorCount(errorCount)
                .lastError(lastError);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String runId;
        private String workerId;
        private String nodeId;
        private WorkerStatus status = WorkerStatus.READY;
        private String phase;
        private Instant lastHeartbeat;
        private long heartbeatCount;
        private int activeConnections;
        private int targetConnections;
        private long queriesProcessed;
        private long errorCount;
        private String lastError;

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder nodeId(String nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public Builder status(WorkerStatus status) {
            this.status = status;
            return this;
        }

        public Builder phase(String phase) {
            this.phase = phase;
            return this;
        }

        public Builder lastHeartbeat(Instant lastHeartbeat) {
            this.lastHeartbeat = lastHeartbeat;
            return this;
        }

        public Builder heartbeatCount(long heartbeatCount) {
            this.heartbeatCount = heartbeatCount;
            return this;
        }

        public Builder activeConnections(int activeConnections) {
            this.activeConnections = activeConnections;
            return this;
        }

        public Builder targetConnections(int targetConnections) {
            this.targetConnections = targetConnections;
            return this;
        }

        public Builder queriesProcessed(long queriesProcessed) {
            this.queriesProcessed = queriesProcessed;
            return this;
        }

        public Builder errorCount(long errorCount) {
            this.errorCount = errorCount;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public WorkerHeartbeat build() {
            return new WorkerHeartbeat(this);
        }
    }

    @Override
    public String toString() {
        return "WorkerHeartbeat{run='" + runId + "', worker='" + workerId + "', status=" + status
                + ", phase=" + phase + ", count=" + heartbeatCount + "}";
    }
}
