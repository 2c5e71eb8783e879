package loadgrid.controlplane.model;

/**
 * How a run drives concurrency.
 */
public enum LoadMode {
    /** Fixed total concurrency split across workers, for a fixed duration */
    FIXED,
    /** Each worker steps concurrency up until latency or errors degrade */
    FIND_MAX,
    /** Each worker scales its pool to hold its share of a target QPS, for a fixed duration */
    QPS;

    /** Whether the orchestrator ends the run after {@code durationSeconds} of measurement. */
    public boolean hasDuration() {
        return this != FIND_MAX;
    }
}
