package loadgrid.controlplane.repository;

import loadgrid.controlplane.model.ControlCommand;
import loadgrid.controlplane.model.ControlEvent;
import loadgrid.controlplane.model.ControlEventType;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for the append-only {@code control_events} log.
 */
public interface ControlEventRepository {

    /**
     * Append an event with the next sequence number of the run.
     * Sequences are strictly increasing per run, starting at 1.
     *
     * @return the stored event, including its assigned sequence
     */
    ControlEvent append(String runId, ControlCommand command);

    /**
     * Events with {@code sequence > afterSequence}, in sequence order.
     */
    List<ControlEvent> findAfter(String runId, long afterSequence);

    /**
     * Most recent event of the given type.
     */
    Optional<ControlEvent> findLatest(String runId, ControlEventType type);
}
