package loadgrid.controlplane.model;

/**
 * Typed payload of a control event. Consumers dispatch on {@link #type()}
 * with an exhaustive switch.
 */
public interface ControlCommand {

    ControlEventType type();

    /**
     * Move the run to {@code phase}.
     */
    record SetPhase(RunPhase phase) implements ControlCommand {
        @Override
        public ControlEventType type() {
            return ControlEventType.SET_PHASE;
        }
    }

    /**
     * Set the target concurrency of one worker, or of every worker when
     * {@code workerId} is null.
     */
    record ScaleTo(int targetConcurrency, String workerId) implements ControlCommand {
        public ScaleTo {
            if (targetConcurrency < 0) {
                throw new IllegalArgumentException("targetConcurrency must be non-negative");
            }
        }

        public boolean appliesTo(String candidate) {
            return workerId == null || workerId.equals(candidate);
        }

        @Override
        public ControlEventType type() {
            return ControlEventType.SCALE_TO;
        }
    }

    /**
     * Stop generating load. {@code reason} is one of the constants below;
     * only {@code duration_elapsed} ends a worker as COMPLETED.
     */
    record Stop(String reason, double drainTimeoutSeconds) implements ControlCommand {
        public static final String CANCELLED = "cancelled";
        public static final String GUARDRAIL = "guardrail";
        public static final String DURATION_ELAPSED = "duration_elapsed";
        public static final String FAILED = "failed";

        @Override
        public ControlEventType type() {
            return ControlEventType.STOP;
        }
    }
}
