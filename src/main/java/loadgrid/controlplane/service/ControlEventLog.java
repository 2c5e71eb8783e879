package loadgrid.controlplane.service;

import loadgrid.controlplane.model.ControlCommand;
import loadgrid.controlplane.model.ControlEvent;
import loadgrid.controlplane.model.ControlEventType;
import loadgrid.controlplane.repository.ControlEventRepository;
import loadgrid.controlplane.state.RunStateView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Append-only, sequenced control stream of a run.
 * The orchestrator appends; workers drain from their last seen sequence.
 */
public class ControlEventLog {

    private static final Logger log = LoggerFactory.getLogger(ControlEventLog.class);

    private final ControlEventRepository eventRepository;

    public ControlEventLog(ControlEventRepository eventRepository) {
        this.eventRepository = eventRepository;
    }

    public ControlEvent append(String runId, ControlCommand command) {
        ControlEvent event = eventRepository.append(runId, command);
        log.info("Run {}: appended control event #{} {}", runId, event.sequence(), command);
        return event;
    }

    /**
     * Deliver every event newer than the view's cursor, in sequence order.
     * SET_PHASE events are applied to the view before the handler sees them.
     * Events at or below the cursor are skipped without reaching the handler.
     *
     * @return number of events delivered
     */
    public int drain(String runId, RunStateView view, Consumer<ControlEvent> handler) {
        List<ControlEvent> events = eventRepository.findAfter(runId, view.lastSeenSequence());
        int delivered = 0;
        for (ControlEvent event : events) {
            if (!view.advanceCursor(event.sequence())) {
                continue;
            }
            if (event.command() instanceof ControlCommand.SetPhase setPhase) {
                view.applyPhase(setPhase.phase().name());
            }
            handler.accept(event);
            delivered++;
        }
        return delivered;
    }

    public List<ControlEvent> readAfter(String runId, long afterSequence) {
        return eventRepository.findAfter(runId, afterSequence);
    }

    public Optional<ControlEvent> latest(String runId, ControlEventType type) {
        return eventRepository.findLatest(runId, type);
    }
}
