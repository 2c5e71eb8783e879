package loadgrid.controlplane.service;

import loadgrid.controlplane.model.Run;
import loadgrid.controlplane.model.RunPhase;
import loadgrid.controlplane.model.RunStatus;
import loadgrid.controlplane.model.TransitionResult;
import loadgrid.controlplane.repository.RunStatusRepository;
import loadgrid.controlplane.state.PhaseStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Guarded writes to {@code run_status}. Each transition is checked against
 * {@link PhaseStateMachine} first and then applied as a conditional update;
 * a lost race is reported, never retried blindly.
 */
public class RunStatusService {

    private static final Logger log = LoggerFactory.getLogger(RunStatusService.class);

    private final RunStatusRepository runRepository;

    public RunStatusService(RunStatusRepository runRepository) {
        this.runRepository = runRepository;
    }

    public Optional<Run> find(String runId) {
        return runRepository.findById(runId);
    }

    /**
     * Move status from {@code expected} to {@code next}.
     */
    public TransitionResult transition(String runId, RunStatus expected, RunStatus next) {
        if (!PhaseStateMachine.acceptStatus(expected, next)) {
            log.warn("Run {}: refused status change {} -> {}", runId, expected, next);
            return TransitionResult.REJECTED;
        }
        if (runRepository.compareAndSetStatus(runId, expected, next)) {
            log.info("Run {}: status {} -> {}", runId, expected, next);
            return TransitionResult.APPLIED;
        }
        return classifyMiss(runId, next);
    }

    /**
     * Move status and phase together in one conditional write. Used for the
     * terminal write, where the phase becomes COMPLETED.
     */
    public TransitionResult transition(String runId, RunStatus expected, RunStatus next, RunPhase phase,
            String failureMessage) {
        if (!PhaseStateMachine.acceptStatus(expected, next)) {
            log.warn("Run {}: refused status change {} -> {}", runId, expected, next);
            return TransitionResult.REJECTED;
        }
        if (!PhaseStateMachine.acceptPhase(null, phase.name(), next.name())) {
            log.warn("Run {}: refused phase {} with status {}", runId, phase, next);
            return TransitionResult.REJECTED;
        }
        if (runRepository.compareAndSetStatusAndPhase(runId, expected, next, phase.name(), failureMessage)) {
            log.info("Run {}: status {} -> {}, phase {}{}", runId, expected, next, phase,
                    failureMessage != null ? " (" + failureMessage + ")" : "");
            return TransitionResult.APPLIED;
        }
        return classifyMiss(runId, next);
    }

    /**
     * Advance the phase of a run, judged against its current status and phase.
     */
    public TransitionResult advancePhase(String runId, RunPhase next) {
        Optional<Run> maybeRun = runRepository.findById(runId);
        if (maybeRun.isEmpty()) {
            return TransitionResult.NOT_FOUND;
        }
        Run run = maybeRun.get();
        String current = run.phaseValue();
        if (PhaseStateMachine.normalizePhase(current).equals(next.name())) {
            return TransitionResult.ALREADY_APPLIED;
        }
        if (!PhaseStateMachine.acceptPhase(current, next.name(), run.status().name())) {
            log.debug("Run {}: refused phase {} -> {} (status {})", runId, current, next, run.status());
            return TransitionResult.REJECTED;
        }
        if (runRepository.compareAndSetPhase(runId, current, next.name())) {
            log.info("Run {}: phase {} -> {}", runId, current, next);
            return TransitionResult.APPLIED;
        }
        return TransitionResult.CONFLICT;
    }

    private TransitionResult classifyMiss(String runId, RunStatus next) {
        Optional<Run> current = runRepository.findById(runId);
        if (current.isEmpty()) {
            return TransitionResult.NOT_FOUND;
        }
        if (current.get().status() == next) {
            return TransitionResult.ALREADY_APPLIED;
        }
        log.debug("Run {}: status write to {} lost, row holds {}", runId, next, current.get().status());
        return TransitionResult.CONFLICT;
    }
}
