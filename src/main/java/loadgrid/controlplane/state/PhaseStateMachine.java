package loadgrid.controlplane.state;

import loadgrid.controlplane.model.RunPhase;
import loadgrid.controlplane.model.RunStatus;

import java.util.Locale;
import java.util.Map;

/**
 * Accept/reject rules for run status and phase updates.
 * <p>
 * Both fields only move forward along the rank tables below, so updates
 * that arrive late or twice are no-ops. The orchestrator, the workers and
 * the query surface all decide through this class; it keeps no state.
 *
 * <pre>
 * status: "" 0, PENDING 0, PREPARED 1, STARTING 1, RUNNING 2,
 *         STOPPING 3, CANCELLING 3, COMPLETED/FAILED/CANCELLED/STOPPED 4
 * phase:  PREPARING 0, WARMUP 1, RUNNING (MEASUREMENT) 2, PROCESSING 3,
 *         COMPLETED/FAILED/CANCELLED/STOPPED 4
 * </pre>
 *
 * Unknown statuses rank 0; unknown phases rank -1.
 */
public final class PhaseStateMachine {

    private static final Map<String, Integer> STATUS_RANK = Map.ofEntries(
            Map.entry("", 0),
            Map.entry("PENDING", 0),
            Map.entry("PREPARED", 1),
            Map.entry("STARTING", 1),
            Map.entry("RUNNING", 2),
            Map.entry("STOPPING", 3),
            Map.entry("CANCELLING", 3),
            Map.entry("COMPLETED", 4),
            Map.entry("FAILED", 4),
            Map.entry("CANCELLED", 4),
            Map.entry("STOPPED", 4));

    private static final Map<String, Integer> PHASE_RANK = Map.of(
            "PREPARING", 0,
            "WARMUP", 1,
            "RUNNING", 2,
            "PROCESSING", 3,
            "COMPLETED", 4,
            "FAILED", 4,
            "CANCELLED", 4,
            "STOPPED", 4);

    private PhaseStateMachine() {
    }

    public static String normalizeStatus(String status) {
        return status == null ? "" : status.trim().toUpperCase(Locale.ROOT);
    }

    /** Upper-cases and maps the MEASUREMENT alias onto RUNNING. */
    public static String normalizePhase(String phase) {
        String upper = phase == null ? "" : phase.trim().toUpperCase(Locale.ROOT);
        return "MEASUREMENT".equals(upper) ? RunPhase.RUNNING.name() : upper;
    }

    public static int statusRank(String status) {
        return STATUS_RANK.getOrDefault(normalizeStatus(status), 0);
    }

    public static int phaseRank(String phase) {
        return PHASE_RANK.getOrDefault(normalizePhase(phase), -1);
    }

    public static boolean isTerminalStatus(String status) {
        return switch (normalizeStatus(status)) {
            case "COMPLETED", "FAILED", "CANCELLED", "STOPPED" -> true;
            default -> false;
        };
    }

    public static boolean isActiveStatus(String status) {
        return switch (normalizeStatus(status)) {
            case "RUNNING", "CANCELLING", "STOPPING" -> true;
            default -> false;
        };
    }

    public static boolean isTerminalPhase(String phase) {
        return switch (normalizePhase(phase)) {
            case "COMPLETED", "FAILED", "CANCELLED", "STOPPED" -> true;
            default -> false;
        };
    }

    /**
     * Whether a run whose status is {@code current} may take {@code next}.
     * A blank {@code next} carries no information and is rejected; a blank
     * {@code current} accepts anything.
     */
    public static boolean acceptStatus(String current, String next) {
        String n = normalizeStatus(next);
        if (n.isEmpty()) {
            return false;
        }
        String c = normalizeStatus(current);
        if (c.isEmpty() || c.equals(n)) {
            return true;
        }
        return statusRank(n) >= statusRank(c);
    }

    /**
     * Whether a run in phase {@code current}, with status {@code status},
     * may take phase {@code next}.
     * <ul>
     * <li>a terminal phase is refused while the status is RUNNING, CANCELLING or STOPPING</li>
     * <li>once the status is terminal only terminal phases and PROCESSING are taken</li>
     * <li>otherwise the phase rank must not decrease</li>
     * </ul>
     */
    public static boolean acceptPhase(String current, String next, String status) {
        String n = normalizePhase(next);
        if (n.isEmpty()) {
            return false;
        }
        if (isActiveStatus(status) && isTerminalPhase(n)) {
            return false;
        }
        if (isTerminalStatus(status) && !isTerminalPhase(n) && !RunPhase.PROCESSING.name().equals(n)) {
            return false;
        }
        int nextRank = phaseRank(n);
        if (nextRank < 0) {
            return false;
        }
        int currentRank = phaseRank(current);
        if (currentRank < 0) {
            return true;
        }
        return nextRank >= currentRank;
    }

    public static boolean acceptStatus(RunStatus current, RunStatus next) {
        return acceptStatus(current == null ? null : current.name(), next == null ? null : next.name());
    }

    public static boolean acceptPhase(RunPhase current, RunPhase next, RunStatus status) {
        return acceptPhase(current == null ? null : current.name(),
                next == null ? null : next.name(),
                status == null ? null : status.name());
    }
}
