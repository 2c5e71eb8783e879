package loadgrid.controlplane.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry of a run's control event log. Never mutated after it is appended.
 */
public record ControlEvent(String runId, long sequence, ControlCommand command, Instant timestamp) {

    public ControlEvent {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(command, "command");
    }

    public ControlEventType type() {
        return command.type();
    }
}
