package loadgrid.controlplane.orchestrator;

import loadgrid.controlplane.config.ControlPlaneConfig;
import loadgrid.controlplane.model.ControlCommand;
import loadgrid.controlplane.model.ControlEvent;
import loadgrid.controlplane.model.ControlEventType;
import loadgrid.controlplane.model.DeadWorkerPolicy;
import loadgrid.controlplane.model.HeartbeatSummary;
import loadgrid.controlplane.model.LoadMode;
import loadgrid.controlplane.model.Run;
import loadgrid.controlplane.model.RunPhase;
import loadgrid.controlplane.model.RunStatus;
import loadgrid.controlplane.model.RunSummary;
import loadgrid.controlplane.model.ScenarioConfig;
import loadgrid.controlplane.model.TransitionResult;
import loadgrid.controlplane.model.WorkerHeartbeat;
import loadgrid.controlplane.model.WorkerOutcome;
import loadgrid.controlplane.model.WorkerResult;
import loadgrid.controlplane.model.WorkerStatus;
import loadgrid.controlplane.repository.RunStatusRepository;
import loadgrid.controlplane.repository.WorkerResultRepository;
import loadgrid.controlplane.service.ControlEventLog;
import loadgrid.controlplane.service.HeartbeatRegistry;
import loadgrid.controlplane.service.ResultsAggregator;
import loadgrid.controlplane.service.RunStatusService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Drives one run from STARTING to a terminal status.
 * <p>
 * Every {@link #tick()} re-reads the run row and the heartbeat table and
 * takes at most the next step: release the rendezvous, end warmup, stop a
 * fixed-duration run, apply the dead-worker policy, or finalize. All timing
 * is derived from the run row, so a coordinator rebuilt after an
 * orchestrator restart picks up where the old one left off.
 */
public class RunCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RunCoordinator.class);

    private final String runId;
    private final ControlPlaneConfig config;
    private final RunStatusService runs;
    private final RunStatusRepository runRepository;
    private final HeartbeatRegistry heartbeats;
    private final ControlEventLog eventLog;
    private final WorkerResultRepository resultRepository;
    private final ResultsAggregator aggregator;

    private final Instant attachedAt = Instant.now();
    private final Set<String> deadWorkers = new LinkedHashSet<>();
    private boolean releaseComplete = false;
    private Instant drainStartedAt;
    private String pendingFailure;
    private volatile boolean done = false;

    RunCoordinator(String runId, ControlPlaneConfig config, RunStatusService runs,
            RunStatusRepository runRepository, HeartbeatRegistry heartbeats, ControlEventLog eventLog,
            WorkerResultRepository resultRepository, ResultsAggregator aggregator) {
        this.runId = runId;
        this.config = config;
        this.runs = runs;
        this.runRepository = runRepository;
        this.heartbeats = heartbeats;
        this.eventLog = eventLog;
        this.resultRepository = resultRepository;
        this.aggregator = aggregator;
    }

    public String runId() {
        return runId;
    }

    /** True once the run has a terminal status and its heartbeats are gone. */
    public boolean isDone() {
        return done;
    }

    /** Workers presumed dead so far. Once dead, a worker stays dead for this run. */
    public synchronized Set<String> deadWorkers() {
        return Set.copyOf(deadWorkers);
    }

    /**
     * Take the next step for this run, if one is due.
     */
    public synchronized void tick() {
        if (done) {
            return;
        }
        Optional<Run> maybeRun = runs.find(runId);
        if (maybeRun.isEmpty()) {
            log.warn("Run {} disappeared; dropping its coordinator", runId);
            done = true;
            return;
        }
        Run run = maybeRun.get();
        if (run.isTerminal()) {
            heartbeats.teardown(runId);
            done = true;
            return;
        }

        HeartbeatSummary summary = heartbeats.summarize(runId);
        runRepository.updateWorkerCounts(runId, summary.registered(), summary.running(), summary.stopped());

        switch (run.status()) {
            case STARTING -> tickStarting(run, summary);
            case RUNNING -> tickRunning(run, summary);
            case STOPPING, CANCELLING -> tickDraining(run, summary);
            default -> log.debug("Run {} is {}; nothing to do", runId, run.status());
        }
    }

    // ===== rendezvous =====

    private void tickStarting(Run run, HeartbeatSummary summary) {
        int expected = run.workersExpected();
        if (summary.ready() >= expected) {
            log.info("Run {}: {}/{} workers READY, releasing", runId, summary.ready(), expected);
            if (release()) {
                completeRelease(run);
            }
            return;
        }
        if (Instant.now().isAfter(attachedAt.plus(config.rendezvousTimeout()))) {
            String message = String.format("Rendezvous timed out: %d/%d workers ready after %ds",
                    summary.ready(), expected, config.rendezvousTimeout().toSeconds());
            log.warn("Run {}: {}", runId, message);
            eventLog.append(runId, new ControlCommand.Stop(ControlCommand.Stop.FAILED, 0));
            TransitionResult result = runs.transition(runId, RunStatus.STARTING, RunStatus.FAILED,
                    RunPhase.COMPLETED, message);
            if (result.succeeded()) {
                heartbeats.teardown(runId);
                done = true;
            }
        } else {
            log.debug("Run {}: waiting for workers ({}/{} ready)", runId, summary.ready(), expected);
        }
    }

    /**
     * STARTING -> RUNNING. The start time, initial phase and SET_PHASE event
     * are separate writes finished by {@link #completeRelease(Run)}, which
     * later ticks repeat until all of them have landed.
     */
    private boolean release() {
        TransitionResult result = runs.transition(runId, RunStatus.STARTING, RunStatus.RUNNING);
        if (!result.succeeded()) {
            log.info("Run {}: rendezvous release skipped ({})", runId, result);
            return false;
        }
        return true;
    }

    private void completeRelease(Run run) {
        if (releaseComplete) {
            return;
        }
        ScenarioConfig scenario = run.scenario();
        RunPhase initial = scenario.initialPhase();

        if (run.startTime() == null) {
            runRepository.markStarted(runId, Instant.now(), initial.name());
        }

        Optional<ControlEvent> lastPhase = eventLog.latest(runId, ControlEventType.SET_PHASE);
        if (lastPhase.isEmpty()) {
            eventLog.append(runId, new ControlCommand.SetPhase(initial));
        }

        if (scenario.loadMode() == LoadMode.FIXED
                && eventLog.latest(runId, ControlEventType.SCALE_TO).isEmpty()) {
            issueTargets(scenario, scenario.concurrency());
        }
        releaseComplete = true;
    }

    synchronized WorkerTargets issueTargets(ScenarioConfig scenario, int total) {
        List<String> workerIds = new ArrayList<>();
        for (WorkerHeartbeat hb : heartbeats.findByRun(runId)) {
            if (hb.status() != WorkerStatus.STOPPED && !deadWorkers.contains(hb.workerId())) {
                workerIds.add(hb.workerId());
            }
        }
        WorkerTargets targets = WorkerTargets.distribute(total, workerIds, scenario.perWorkerCap());
        for (var entry : targets.targets().entrySet()) {
            eventLog.append(runId, new ControlCommand.ScaleTo(entry.getValue(), entry.getKey()));
        }
        log.info("Run {}: concurrency {} split over {} workers: {}", runId, targets.effectiveTotal(),
                workerIds.size(), targets.targets());
        return targets;
    }

    // ===== running =====

    private void tickRunning(Run run, HeartbeatSummary summary) {
        completeRelease(run);
        Run current = runs.find(runId).orElse(run);

        if (applyDeadWorkerPolicy(current, summary)) {
            return;
        }

        ScenarioConfig scenario = current.scenario();
        Instant startTime = current.startTime();
        if (startTime == null) {
            return;
        }
        Instant now = Instant.now();

        Instant measurementStart = startTime.plus(seconds(scenario.warmupSeconds()));
        if (current.phase() == RunPhase.WARMUP && !now.isBefore(measurementStart)) {
            TransitionResult result = runs.advancePhase(runId, RunPhase.RUNNING);
            if (result == TransitionResult.APPLIED) {
                eventLog.append(runId, new ControlCommand.SetPhase(RunPhase.RUNNING));
            }
            return;
        }

        if (scenario.loadMode().hasDuration() && current.phase() == RunPhase.RUNNING
                && !now.isBefore(measurementStart.plus(seconds(scenario.durationSeconds())))) {
            log.info("Run {}: duration of {}s elapsed", runId, scenario.durationSeconds());
            eventLog.append(runId, new ControlCommand.Stop(ControlCommand.Stop.DURATION_ELAPSED,
                    config.drainTimeout().toMillis() / 1000.0));
            runs.transition(runId, RunStatus.RUNNING, RunStatus.STOPPING);
            return;
        }

        if (allLiveWorkersStopped(current, summary)) {
            log.info("Run {}: all workers stopped", runId);
            finalizeRun(current);
        }
    }

    /**
     * @return true if the run is now failing and this tick is over
     */
    private boolean applyDeadWorkerPolicy(Run run, HeartbeatSummary summary) {
        List<String> newlyDead = new ArrayList<>();
        for (String workerId : summary.staleWorkers()) {
            if (deadWorkers.add(workerId)) {
                newlyDead.add(workerId);
            }
        }
        if (newlyDead.isEmpty()) {
            return false;
        }
        log.warn("Run {}: no heartbeat for {}s from {}", runId, config.heartbeatTimeout().toSeconds(), newlyDead);

        ScenarioConfig scenario = run.scenario();
        int alive = run.workersExpected() - deadWorkers.size();
        if (scenario.deadWorkerPolicy() == DeadWorkerPolicy.FAIL_RUN) {
            fail(run, "Worker(s) " + newlyDead + " presumed dead");
            return true;
        }
        if (alive < scenario.minWorkers()) {
            fail(run, String.format("Only %d live workers left, %d required", alive, scenario.minWorkers()));
            return true;
        }
        log.warn("Run {}: continuing degraded with {} live workers", runId, alive);
        return false;
    }

    private void fail(Run run, String message) {
        pendingFailure = message;
        log.error("Run {}: failing - {}", runId, message);
        eventLog.append(runId, new ControlCommand.Stop(ControlCommand.Stop.FAILED,
                config.drainTimeout().toMillis() / 1000.0));
        runs.transition(runId, run.status(), RunStatus.STOPPING);
    }

    // ===== draining =====

    private void tickDraining(Run run, HeartbeatSummary summary) {
        for (String workerId : summary.staleWorkers()) {
            if (deadWorkers.add(workerId)) {
                log.warn("Run {}: worker {} went silent while draining", runId, workerId);
            }
        }
        if (drainStartedAt == null) {
            drainStartedAt = Instant.now();
        }
        if (allLiveWorkersStopped(run, summary)) {
            finalizeRun(run);
        } else if (Instant.now().isAfter(drainStartedAt.plus(config.drainTimeout()))) {
            log.warn("Run {}: drain timed out after {}s", runId, config.drainTimeout().toSeconds());
            for (WorkerHeartbeat hb : summary.workers()) {
                if (hb.status() != WorkerStatus.STOPPED) {
                    deadWorkers.add(hb.workerId());
                }
            }
            finalizeRun(run);
        }
    }

    private boolean allLiveWorkersStopped(Run run, HeartbeatSummary summary) {
        int stoppedOrDead = 0;
        for (WorkerHeartbeat hb : summary.workers()) {
            if (hb.status() == WorkerStatus.STOPPED || deadWorkers.contains(hb.workerId())) {
                stoppedOrDead++;
            }
        }
        return stoppedOrDead >= summary.registered()
                && (summary.registered() >= run.workersExpected() || run.status() != RunStatus.RUNNING);
    }

    // ===== finalization =====

    private void finalizeRun(Run run) {
        runs.advancePhase(runId, RunPhase.PROCESSING);

        List<WorkerResult> results = resultRepository.findResultsByRun(runId);
        RunStatus finalStatus = finalStatusFor(run.status(), results);
        RunSummary runSummary = aggregator.summarize(runId, finalStatus, run.scenario().loadMode(),
                results, deadWorkers);
        runRepository.saveSummary(runId, runSummary);

        String message = finalStatus == RunStatus.FAILED ? pendingFailure : null;
        TransitionResult result = runs.transition(runId, run.status(), finalStatus, RunPhase.COMPLETED, message);
        if (!result.succeeded()) {
            log.warn("Run {}: terminal write {} -> {} not applied ({}), retrying next tick",
                    runId, run.status(), finalStatus, result);
            return;
        }
        heartbeats.teardown(runId);
        done = true;
        log.info("Run {} finished {}: {} operations, {} errors, {} workers reported, dead {}", runId, finalStatus,
                runSummary.totalOperations(), runSummary.totalErrors(), runSummary.workersReported(),
                runSummary.deadWorkers());
    }

    /**
     * A failure already under way outranks a later cancel: a stop issued while
     * a failing run drains still ends FAILED with the failure message.
     */
    private RunStatus finalStatusFor(RunStatus current, List<WorkerResult> results) {
        if (pendingFailure != null) {
            return RunStatus.FAILED;
        }
        if (current == RunStatus.CANCELLING) {
            return RunStatus.CANCELLED;
        }
        if (!results.isEmpty()
                && results.stream().allMatch(r -> r.outcome() == WorkerOutcome.FAILED)) {
            pendingFailure = "All workers failed: " + results.get(0).errorMessage();
        }
        return pendingFailure != null ? RunStatus.FAILED : RunStatus.COMPLETED;
    }

    private static Duration seconds(double value) {
        return Duration.ofMillis((long) (value * 1000));
    }
}
