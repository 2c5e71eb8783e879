package loadgrid.controlplane.orchestrator;

import loadgrid.controlplane.config.ControlPlaneConfig;
import loadgrid.controlplane.model.ControlCommand;
import loadgrid.controlplane.model.LoadMode;
import loadgrid.controlplane.model.Run;
import loadgrid.controlplane.model.RunPhase;
import loadgrid.controlplane.model.RunStatus;
import loadgrid.controlplane.model.ScenarioConfig;
import loadgrid.controlplane.model.TransitionResult;
import loadgrid.controlplane.repository.RunStatusRepository;
import loadgrid.controlplane.repository.WorkerResultRepository;
import loadgrid.controlplane.scheduler.Scheduler;
import loadgrid.controlplane.service.ControlEventLog;
import loadgrid.controlplane.service.HeartbeatRegistry;
import loadgrid.controlplane.service.ResultsAggregator;
import loadgrid.controlplane.service.RunStatusService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Command surface of the control plane: create, start, stop and scale runs.
 * <p>
 * Commands only write rows. A poll job ticks one {@link RunCoordinator} per
 * active run; coordinators do the waiting (rendezvous, warmup, duration,
 * drain) and write the terminal status.
 */
public class Orchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private static final int STOP_ATTEMPTS = 5;

    private final ControlPlaneConfig config;
    private final RunStatusService runs;
    private final RunStatusRepository runRepository;
    private final HeartbeatRegistry heartbeats;
    private final ControlEventLog eventLog;
    private final WorkerResultRepository resultRepository;
    private final ResultsAggregator aggregator;
    private final Scheduler scheduler;
    private final Map<String, RunCoordinator> coordinators = new ConcurrentHashMap<>();

    public Orchestrator(ControlPlaneConfig config, RunStatusService runs, RunStatusRepository runRepository,
            HeartbeatRegistry heartbeats, ControlEventLog eventLog, WorkerResultRepository resultRepository,
            ResultsAggregator aggregator) {
        this.config = config;
        this.runs = runs;
        this.runRepository = runRepository;
        this.heartbeats = heartbeats;
        this.eventLog = eventLog;
        this.resultRepository = resultRepository;
        this.aggregator = aggregator;
        this.scheduler = new Scheduler("loadgrid-orchestrator")
                .every("run-poll", config.orchestratorPollInterval(), this::tick);
    }

    // ===== commands =====

    /**
     * Create a run in PREPARED with a generated id.
     */
    public String createRun(ScenarioConfig scenario) {
        String runId = UUID.randomUUID().toString();
        createRun(runId, scenario);
        return runId;
    }

    /**
     * Create a run in PREPARED. The scenario is stored with the run so
     * every worker loads the same plan.
     *
     * @throws IllegalArgumentException if the scenario is invalid
     */
    public Run createRun(String runId, ScenarioConfig scenario) {
        scenario.validate();
        Run run = Run.builder()
                .runId(runId)
                .status(RunStatus.PREPARED)
                .phase(RunPhase.PREPARING.name())
                .scenario(scenario)
                .workersExpected(scenario.workerCount())
                .build();
        runRepository.create(run);
        log.info("Created run {}: {} mode, {} workers", runId, scenario.loadMode(), scenario.workerCount());
        return run;
    }

    /**
     * PREPARED -> STARTING. Workers may register before or after this; the
     * run is released once all of them are READY.
     */
    public TransitionResult start(String runId) {
        TransitionResult result = runs.transition(runId, RunStatus.PREPARED, RunStatus.STARTING);
        if (result.succeeded()) {
            attach(runId);
        }
        return result;
    }

    /**
     * Cancel a run. Terminal runs are left alone. A run that never started
     * is cancelled directly; otherwise a STOP event is appended and the
     * status moves to CANCELLING, and the coordinator finalizes once the
     * workers have drained.
     */
    public TransitionResult stop(String runId) {
        for (int attempt = 0; attempt < STOP_ATTEMPTS; attempt++) {
            Optional<Run> maybeRun = runs.find(runId);
            if (maybeRun.isEmpty()) {
                return TransitionResult.NOT_FOUND;
            }
            Run run = maybeRun.get();
            if (run.isTerminal()) {
                log.info("Stop of run {} ignored: already {}", runId, run.status());
                return TransitionResult.REJECTED;
            }
            if (run.status() == RunStatus.CANCELLING) {
                return TransitionResult.ALREADY_APPLIED;
            }
            if (run.status() == RunStatus.PREPARED) {
                TransitionResult result = runs.transition(runId, RunStatus.PREPARED, RunStatus.CANCELLED,
                        RunPhase.COMPLETED, null);
                if (result != TransitionResult.CONFLICT) {
                    return result;
                }
                continue;
            }

            eventLog.append(runId, new ControlCommand.Stop(ControlCommand.Stop.CANCELLED,
                    config.drainTimeout().toMillis() / 1000.0));
            TransitionResult result = runs.transition(runId, run.status(), RunStatus.CANCELLING);
            if (result != TransitionResult.CONFLICT) {
                attach(runId);
                return result;
            }
            log.debug("Stop of run {} raced a status change, retrying", runId);
        }
        return TransitionResult.CONFLICT;
    }

    /**
     * Re-split the total concurrency of a running FIXED run over its live
     * workers.
     *
     * @throws IllegalStateException if the run is not a running FIXED run
     */
    public WorkerTargets scaleTo(String runId, int totalConcurrency) {
        if (totalConcurrency < 0) {
            throw new IllegalArgumentException("totalConcurrency must be non-negative");
        }
        Run run = runs.find(runId).orElseThrow(() -> new IllegalArgumentException("Unknown run: " + runId));
        ScenarioConfig scenario = run.scenario();
        if (scenario.loadMode() != LoadMode.FIXED) {
            throw new IllegalStateException("Run " + runId + " is " + scenario.loadMode() + "; only FIXED runs scale");
        }
        if (run.status() != RunStatus.RUNNING) {
            throw new IllegalStateException("Run " + runId + " is " + run.status() + ", not RUNNING");
        }
        return attach(runId).issueTargets(scenario, totalConcurrency);
    }

    /**
     * Block until the run is terminal or the timeout passes.
     *
     * @return the terminal run, or empty on timeout
     */
    public Optional<Run> awaitTerminal(String runId, Duration timeout) throws InterruptedException {
        Instant deadline = Instant.now().plus(timeout);
        while (Instant.now().isBefore(deadline)) {
            Optional<Run> run = runs.find(runId);
            if (run.isPresent() && run.get().isTerminal()) {
                return run;
            }
            Thread.sleep(Math.max(10, config.orchestratorPollInterval().toMillis() / 2));
        }
        return Optional.empty();
    }

    // ===== poll loop =====

    /**
     * Start the poll job. Runs left active by a previous orchestrator are
     * picked up again.
     */
    public void startPolling() {
        for (Run run : runRepository.findByStatusIn(EnumSet.of(RunStatus.STARTING, RunStatus.RUNNING,
                RunStatus.STOPPING, RunStatus.CANCELLING))) {
            log.info("Resuming run {} ({})", run.runId(), run.status());
            attach(run.runId());
        }
        scheduler.start();
    }

    /**
     * Tick every attached run once. Exposed for callers that drive the loop
     * themselves.
     */
    public void tick() {
        for (RunCoordinator coordinator : coordinators.values()) {
            try {
                coordinator.tick();
            } catch (RuntimeException e) {
                log.error("Run {}: coordinator tick failed", coordinator.runId(), e);
            }
            if (coordinator.isDone()) {
                coordinators.remove(coordinator.runId(), coordinator);
            }
        }
    }

    public Optional<RunCoordinator> coordinator(String runId) {
        return Optional.ofNullable(coordinators.get(runId));
    }

    private RunCoordinator attach(String runId) {
        return coordinators.computeIfAbsent(runId, id -> new RunCoordinator(id, config, runs, runRepository,
                heartbeats, eventLog, resultRepository, aggregator));
    }

    @Override
    public void close() {
        scheduler.stop();
        coordinators.clear();
    }
}
