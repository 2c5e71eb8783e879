package loadgrid.controlplane.model;

/**
 * Status a worker reports in its heartbeat row.
 */
public enum WorkerStatus {
    /** Registered and waiting for the run to start */
    READY,
    /** Generating load */
    RUNNING,
    /** Finished, cancelled or aborted; no more heartbeats will follow */
    STOPPED;

    /** Worker statuses only move forward. */
    public boolean canMoveTo(WorkerStatus next) {
        return next.ordinal() >= ordinal();
    }
}
