package loadgrid.controlplane.model;

import java.util.Locale;

/**
 * Overall lifecycle status of a run, as stored in {@code run_status.status}.
 * Ordering rules live in {@link loadgrid.controlplane.state.PhaseStateMachine}.
 */
public enum RunStatus {
    /** Legacy alias of PREPARED written by older producers */
    PENDING,
    /** Run created, workers not yet asked to rendezvous */
    PREPARED,
    /** Orchestrator is waiting for workers to report READY */
    STARTING,
    /** All workers released, load is being generated */
    RUNNING,
    /** Planned end reached, workers are draining */
    STOPPING,
    /** External stop requested, workers are draining */
    CANCELLING,
    /** Run finished normally */
    COMPLETED,
    /** Run failed (rendezvous timeout, dead workers, ...) */
    FAILED,
    /** Run cancelled by an external stop request */
    CANCELLED,
    /** Run stopped without results */
    STOPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED || this == STOPPED;
    }

    /** Statuses during which a terminal phase must not be accepted. */
    public boolean isActive() {
        return this == RUNNING || this == CANCELLING || this == STOPPING;
    }

    /**
     * Parse a stored value, case-insensitively.
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static RunStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("run status is empty");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
