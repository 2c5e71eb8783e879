package loadgrid.controlplane.model;

/**
 * Final outcome a worker records in {@code worker_results}.
 */
public enum WorkerOutcome {
    COMPLETED,
    CANCELLED,
    FAILED
}
