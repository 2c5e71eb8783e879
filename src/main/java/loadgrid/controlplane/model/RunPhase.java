package loadgrid.controlplane.model;

import java.util.Locale;

/**
 * Lifecycle stage within a run.
 */
public enum RunPhase {
    PREPARING,
    WARMUP,
    RUNNING,
    PROCESSING,
    COMPLETED;

    /**
     * Parse a stored value. {@code MEASUREMENT} is an older name for RUNNING,
     * and FAILED/CANCELLED/STOPPED collapse onto COMPLETED.
     */
    public static RunPhase fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("run phase is empty");
        }
        String upper = value.trim().toUpperCase(Locale.ROOT);
        return switch (upper) {
            case "MEASUREMENT" -> RUNNING;
            case "FAILED", "CANCELLED", "STOPPED" -> COMPLETED;
            default -> valueOf(upper);
        };
    }
}
