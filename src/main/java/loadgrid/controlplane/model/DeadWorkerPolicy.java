package loadgrid.controlplane.model;

/**
 * What the orchestrator does when a worker's heartbeat goes stale.
 */
public enum DeadWorkerPolicy {
    /** Fail the run as soon as any worker is presumed dead */
    FAIL_RUN,
    /** Keep running while at least {@code minWorkers} workers are alive */
    DEGRADE
}
