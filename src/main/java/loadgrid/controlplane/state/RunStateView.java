package loadgrid.controlplane.state;

import loadgrid.controlplane.model.RunPhase;
import loadgrid.controlplane.model.RunStatus;

/**
 * Locally materialized (status, phase) of a run plus the control-event cursor.
 * Every update goes through {@link PhaseStateMachine}, so the view never
 * moves backwards however updates are ordered or repeated. Thread-safe.
 */
public final class RunStateView {

    private String status;
    private String phase;
    private long lastSeenSequence;

    public RunStateView() {
        this("", "");
    }

    public RunStateView(String status, String phase) {
        this.status = PhaseStateMachine.normalizeStatus(status);
        this.phase = PhaseStateMachine.normalizePhase(phase);
    }

    /**
     * Apply a status update.
     *
     * @return true if the visible status changed
     */
    public synchronized boolean applyStatus(String next) {
        if (!PhaseStateMachine.acceptStatus(status, next)) {
            return false;
        }
        String normalized = PhaseStateMachine.normalizeStatus(next);
        boolean changed = !normalized.equals(status);
        status = normalized;
        return changed;
    }

    /**
     * Apply a phase update, judged against the current status.
     *
     * @return true if the visible phase changed
     */
    public synchronized boolean applyPhase(String next) {
        if (!PhaseStateMachine.acceptPhase(phase, next, status)) {
            return false;
        }
        String normalized = PhaseStateMachine.normalizePhase(next);
        boolean changed = !normalized.equals(phase);
        phase = normalized;
        return changed;
    }

    /**
     * Apply a (status, phase) pair read from the store. Status goes first so a
     * terminal pair written in one update is taken as a whole.
     *
     * @return true if either field changed
     */
    public synchronized boolean apply(String nextStatus, String nextPhase) {
        boolean statusChanged = applyStatus(nextStatus);
        boolean phaseChanged = nextPhase != null && applyPhase(nextPhase);
        return statusChanged || phaseChanged;
    }

    /**
     * Move the event cursor.
     *
     * @return false for a sequence already seen; the caller must then ignore the event
     */
    public synchronized boolean advanceCursor(long sequence) {
        if (sequence <= lastSeenSequence) {
            return false;
        }
        lastSeenSequence = sequence;
        return true;
    }

    public synchronized String status() {
        return status;
    }

    public synchronized String phase() {
        return phase;
    }

    public synchronized long lastSeenSequence() {
        return lastSeenSequence;
    }

    /** Typed status, or null while nothing has been observed. */
    public synchronized RunStatus runStatus() {
        return status.isEmpty() ? null : RunStatus.fromWire(status);
    }

    /** Typed phase, or null while no known phase has been observed. */
    public synchronized RunPhase runPhase() {
        return PhaseStateMachine.phaseRank(phase) < 0 ? null : RunPhase.fromWire(phase);
    }

    public synchronized boolean isTerminal() {
        return PhaseStateMachine.isTerminalStatus(status);
    }

    @Override
    public synchronized String toString() {
        return "RunStateView{status=" + status + ", phase=" + phase + ", seq=" + lastSeenSequence + "}";
    }
}
