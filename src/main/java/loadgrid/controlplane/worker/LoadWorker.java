package loadgrid.controlplane.worker;

import loadgrid.controlplane.config.ControlPlaneConfig;
import loadgrid.controlplane.findmax.ConcurrencyController;
import loadgrid.controlplane.findmax.StabilityEvaluator;
import loadgrid.controlplane.model.ControlCommand;
import loadgrid.controlplane.model.ControlEvent;
import loadgrid.controlplane.model.FindMaxResult;
import loadgrid.controlplane.model.FindMaxSettings;
import loadgrid.controlplane.model.LoadMode;
import loadgrid.controlplane.model.Run;
import loadgrid.controlplane.model.RunPhase;
import loadgrid.controlplane.model.RunStatus;
import loadgrid.controlplane.model.ScenarioConfig;
import loadgrid.controlplane.model.WorkerHeartbeat;
import loadgrid.controlplane.model.WorkerOutcome;
import loadgrid.controlplane.model.WorkerResult;
import loadgrid.controlplane.model.WorkerStatus;
import loadgrid.controlplane.repository.RunStatusRepository;
import loadgrid.controlplane.repository.WorkerResultRepository;
import loadgrid.controlplane.scheduler.Scheduler;
import loadgrid.controlplane.service.ControlEventLog;
import loadgrid.controlplane.service.HeartbeatRegistry;
import loadgrid.controlplane.state.PhaseStateMachine;
import loadgrid.controlplane.state.RunStateView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One worker of a run.
 * <p>
 * {@link #run()} blocks the calling thread through the whole worker lifecycle:
 * register READY, wait for the run to reach RUNNING, generate load (find-max
 * search, fixed concurrency or a QPS target), drain, write the final result and a STOPPED
 * heartbeat. Meanwhile a control loop on its own thread drains control
 * events, reads the run row and refreshes the heartbeat.
 */
public class LoadWorker {

    private static final Logger log = LoggerFactory.getLogger(LoadWorker.class);

    private final String runId;
    private final String workerId;
    private final String nodeId;
    private final ControlPlaneConfig config;
    private final RunStatusRepository runRepository;
    private final HeartbeatRegistry heartbeats;
    private final ControlEventLog eventLog;
    private final WorkerResultRepository resultRepository;
    private final TargetClient client;
    private final WorkloadValueProvider values;

    private final RunStateView view = new RunStateView();
    private final MeasurementWindow window = new MeasurementWindow();
    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private final Scheduler controlLoop;

    private volatile Run latestRun;
    private volatile String stopReason;
    private volatile Duration drainTimeout;
    private volatile WorkerStatus status = WorkerStatus.READY;
    private volatile String lastError;
    private long lastHeartbeatNanos;

    // guarded by this
    private ClientTaskPool pool;
    private int pendingTarget = -1;

    public LoadWorker(String runId, String workerId, String nodeId, ControlPlaneConfig config,
            RunStatusRepository runRepository, HeartbeatRegistry heartbeats, ControlEventLog eventLog,
            WorkerResultRepository resultRepository, TargetClient client, WorkloadValueProvider values) {
        this.runId = runId;
        this.workerId = workerId;
        this.nodeId = nodeId;
        this.config = config;
        this.runRepository = runRepository;
        this.heartbeats = heartbeats;
        this.eventLog = eventLog;
        this.resultRepository = resultRepository;
        this.client = client;
        this.values = values;
        this.drainTimeout = config.drainTimeout();
        this.controlLoop = new Scheduler("loadgrid-worker-" + workerId)
                .every("control-loop", config.pollInterval(), this::controlTick);
    }

    public String workerId() {
        return workerId;
    }

    /** Locally materialized run state, as this worker sees it. */
    public RunStateView view() {
        return view;
    }

    public WorkerStatus status() {
        return status;
    }

    /**
     * Run the worker to completion.
     *
     * @return the final result, also written to the store
     */
    public WorkerResult run() {
        Instant deadline = Instant.now().plus(config.rendezvousTimeout());
        Optional<Run> initial = runRepository.findById(runId);
        if (initial.isEmpty()) {
            log.warn("Worker {}: run {} not found", workerId, runId);
            return report(WorkerOutcome.FAILED, "Run " + runId + " not found");
        }
        if (initial.get().isTerminal()) {
            // heartbeats of a finished run are already torn down; leave no row behind
            log.info("Worker {}: run {} already {}", workerId, runId, initial.get().status());
            return report(WorkerOutcome.CANCELLED, "Run already " + initial.get().status());
        }
        try {
            heartbeats.register(runId, workerId, nodeId);
            markHeartbeatSent();
            controlLoop.start();

            Rendezvous rendezvous = awaitRunning(deadline);
            switch (rendezvous) {
                case TIMED_OUT -> {
                    String msg = "Rendezvous timed out after " + config.rendezvousTimeout().toSeconds() + "s";
                    log.warn("Worker {}: {}", workerId, msg);
                    return finish(WorkerOutcome.FAILED, msg, null);
                }
                case ABORTED -> {
                    log.info("Worker {}: run {} ended before it started ({})", workerId, runId, view.status());
                    return finish(WorkerOutcome.CANCELLED, "Run ended before start: " + view.status(), null);
                }
                case STARTED -> log.info("Worker {}: run {} is RUNNING", workerId, runId);
            }

            ScenarioConfig scenario = latestRun != null ? latestRun.scenario() : null;
            if (scenario == null) {
                return finish(WorkerOutcome.FAILED, "Run " + runId + " has no scenario", null);
            }

            setStatus(WorkerStatus.RUNNING);
            sendHeartbeat();
            startPool(scenario);

            FindMaxResult findMax = null;
            switch (scenario.loadMode()) {
                case FIND_MAX -> findMax = runFindMax(scenario);
                case QPS -> runQps(scenario);
                case FIXED -> runFixed();
            }

            drain();
            WorkerOutcome outcome = wasCancelled() ? WorkerOutcome.CANCELLED : WorkerOutcome.COMPLETED;
            return finish(outcome, null, findMax);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return finish(WorkerOutcome.FAILED, "Worker interrupted", null);
        } catch (RuntimeException e) {
            log.error("Worker {} failed", workerId, e);
            return finish(WorkerOutcome.FAILED, e.getMessage() != null ? e.getMessage() : e.toString(), null);
        } finally {
            controlLoop.stop();
            synchronized (this) {
                if (pool != null) {
                    pool.close();
                }
            }
        }
    }

    // ===== rendezvous =====

    private enum Rendezvous {
        STARTED, ABORTED, TIMED_OUT
    }

    /**
     * Polls the run row itself at half the poll interval, so the release is
     * seen within one poll interval of being written.
     */
    private Rendezvous awaitRunning(Instant deadline) throws InterruptedException {
        long sleepMillis = Math.max(1, config.pollInterval().toMillis() / 2);
        while (true) {
            refreshRun();
            int rank = PhaseStateMachine.statusRank(view.status());
            if (rank == PhaseStateMachine.statusRank(RunStatus.RUNNING.name()) && !stopRequested.get()) {
                return Rendezvous.STARTED;
            }
            if (rank > PhaseStateMachine.statusRank(RunStatus.RUNNING.name()) || stopRequested.get()) {
                return Rendezvous.ABORTED;
            }
            if (Instant.now().isAfter(deadline)) {
                return Rendezvous.TIMED_OUT;
            }
            Thread.sleep(sleepMillis);
        }
    }

    // ===== load generation =====

    private void startPool(ScenarioConfig scenario) {
        synchronized (this) {
            pool = new ClientTaskPool(workerId, client,
                    new SemaphoreConnectionPool(scenario.effectiveConnectionPoolSize()),
                    values, new OperationMix(scenario.operationMix()), window,
                    scenario.thinkTimeMs(), scenario.operationsPerTask());
            if (scenario.loadMode() == LoadMode.FIND_MAX) {
                // warmup load; the controller takes over in RUNNING
                pool.scaleTo(scenario.findMax().startConcurrency());
            } else if (scenario.loadMode() == LoadMode.QPS) {
                pool.scaleTo(scenario.qps().minConcurrency());
            } else if (pendingTarget >= 0) {
                pool.scaleTo(pendingTarget);
            }
        }
    }

    private void awaitMeasurement() throws InterruptedException {
        while (!shouldStop() && PhaseStateMachine.phaseRank(view.phase()) < PhaseStateMachine.phaseRank(RunPhase.RUNNING.name())) {
            Thread.sleep(config.pollInterval().toMillis());
        }
    }

    private FindMaxResult runFindMax(ScenarioConfig scenario) throws InterruptedException {
        awaitMeasurement();
        if (shouldStop()) {
            return null;
        }

        FindMaxSettings settings = scenario.findMax();
        ClientTaskPool taskPool;
        synchronized (this) {
            taskPool = pool;
        }
        ConcurrencyController controller = new ConcurrencyController(
                settings,
                new StabilityEvaluator(settings, scenario.operationMix(), scenario.slos()),
                new PoolStepExecutor(taskPool, window, settings.settleMillis(), this::shouldStop),
                step -> resultRepository.saveStep(runId, workerId, step),
                this::shouldStop);
        return controller.run();
    }

    private void runQps(ScenarioConfig scenario) throws InterruptedException {
        // warmup holds the minimum; rescaling starts with measurement
        awaitMeasurement();
        if (shouldStop()) {
            return;
        }
        ClientTaskPool taskPool;
        synchronized (this) {
            taskPool = pool;
        }
        log.info("Worker {}: holding {} QPS", workerId, String.format("%.1f", scenario.workerTargetQps()));
        new QpsController(workerId, scenario.qps(), scenario.workerTargetQps(), taskPool, window, this::shouldStop)
                .run();
    }

    private void runFixed() throws InterruptedException {
        while (!shouldStop()) {
            Thread.sleep(config.pollInterval().toMillis());
        }
    }

    private void drain() throws InterruptedException {
        ClientTaskPool taskPool;
        synchronized (this) {
            taskPool = pool;
        }
        taskPool.stopAll();
        if (!taskPool.awaitDrain(drainTimeout)) {
            log.warn("Worker {}: tasks still in flight after drain timeout {}s", workerId, drainTimeout.toSeconds());
        }
    }

    private boolean shouldStop() {
        return stopRequested.get()
                || PhaseStateMachine.statusRank(view.status()) > PhaseStateMachine.statusRank(RunStatus.RUNNING.name());
    }

    private boolean wasCancelled() {
        if (ControlCommand.Stop.DURATION_ELAPSED.equals(stopReason)) {
            return false;
        }
        if (stopReason != null) {
            return true;
        }
        String s = view.status();
        return RunStatus.CANCELLING.name().equals(s) || RunStatus.CANCELLED.name().equals(s)
                || RunStatus.FAILED.name().equals(s);
    }

    // ===== control loop =====

    private void controlTick() {
        eventLog.drain(runId, view, this::onControlEvent);
        refreshRun();

        if (heartbeatDue() && !runFinished()) {
            sendHeartbeat();
        }
    }

    private void refreshRun() {
        runRepository.findById(runId).ifPresent(run -> {
            latestRun = run;
            if (view.apply(run.status().name(), run.phaseValue())) {
                log.debug("Worker {}: run state now {}", workerId, view);
            }
        });
    }

    /** Terminal run: its heartbeat rows are gone and must not come back. */
    private boolean runFinished() {
        return PhaseStateMachine.isTerminalStatus(view.status());
    }

    private void onControlEvent(ControlEvent event) {
        switch (event.type()) {
            case SET_PHASE -> {
                RunPhase phase = ((ControlCommand.SetPhase) event.command()).phase();
                log.info("Worker {}: phase {} (event #{})", workerId, phase, event.sequence());
                if (phase == RunPhase.RUNNING && latestRun != null && latestRun.scenario() != null
                        && latestRun.scenario().loadMode() != LoadMode.FIND_MAX) {
                    window.reset();
                }
            }
            case SCALE_TO -> {
                ControlCommand.ScaleTo scale = (ControlCommand.ScaleTo) event.command();
                if (scale.appliesTo(workerId)) {
                    applyScale(scale.targetConcurrency());
                }
            }
            case STOP -> {
                ControlCommand.Stop stop = (ControlCommand.Stop) event.command();
                stopReason = stop.reason();
                if (stop.drainTimeoutSeconds() > 0) {
                    drainTimeout = Duration.ofMillis((long) (stop.drainTimeoutSeconds() * 1000));
                }
                stopRequested.set(true);
                log.info("Worker {}: stop requested ({})", workerId, stop.reason());
            }
        }
    }

    private synchronized void applyScale(int target) {
        ScenarioConfig scenario = latestRun != null ? latestRun.scenario() : null;
        if (scenario != null && scenario.loadMode() != LoadMode.FIXED) {
            log.debug("Worker {}: ignoring SCALE_TO {} in {} mode", workerId, target, scenario.loadMode());
            return;
        }
        if (pool == null) {
            pendingTarget = target;
            return;
        }
        pool.scaleTo(target);
        log.info("Worker {}: scaled to {}", workerId, target);
    }

    // ===== reporting =====

    private WorkerResult finish(WorkerOutcome outcome, String error, FindMaxResult findMax) {
        lastError = error;
        WorkerResult result = new WorkerResult(runId, workerId, nodeId, outcome,
                window.totalOperations(), window.totalErrors(), error, findMax, Instant.now());
        try {
            // result first: a STOPPED heartbeat promises the result is readable
            resultRepository.saveResult(result);
        } catch (RuntimeException e) {
            log.error("Worker {}: could not save result", workerId, e);
        }
        setStatus(WorkerStatus.STOPPED);
        try {
            refreshRun();
            if (runFinished()) {
                log.info("Worker {}: run {} already {}; skipping final heartbeat", workerId, runId, view.status());
            } else {
                sendHeartbeat();
            }
        } catch (RuntimeException e) {
            log.error("Worker {}: could not write final heartbeat", workerId, e);
        }
        log.info("Worker {} finished: {} ({} operations, {} errors){}", workerId, outcome,
                result.totalOperations(), result.totalErrors(), error != null ? " - " + error : "");
        return result;
    }

    /** Result of a worker that never joined the run; nothing is written to the store. */
    private WorkerResult report(WorkerOutcome outcome, String error) {
        lastError = error;
        setStatus(WorkerStatus.STOPPED);
        return new WorkerResult(runId, workerId, nodeId, outcome, 0, 0, error, null, Instant.now());
    }

    private void setStatus(WorkerStatus next) {
        if (status.canMoveTo(next)) {
            status = next;
        }
    }

    private synchronized boolean heartbeatDue() {
        return System.nanoTime() - lastHeartbeatNanos >= config.heartbeatInterval().toNanos();
    }

    private synchronized void markHeartbeatSent() {
        lastHeartbeatNanos = System.nanoTime();
    }

    private synchronized void sendHeartbeat() {
        int active = pool != null ? pool.running() : 0;
        int target = pool != null ? pool.target() : 0;
        heartbeats.beat(WorkerHeartbeat.builder()
                .runId(runId)
                .workerId(workerId)
                .nodeId(nodeId)
                .status(status)
                .phase(view.phase().isEmpty() ? null : view.phase())
                .activeConnections(active)
                .targetConnections(target)
                .queriesProcessed(window.totalOperations())
                .errorCount(window.totalErrors())
                .lastError(lastError)
                .build());
        lastHeartbeatNanos = System.nanoTime();
    }
}
