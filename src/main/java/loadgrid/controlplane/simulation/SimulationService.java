package loadgrid.controlplane.simulation;

import loadgrid.controlplane.config.Dependencies;
import loadgrid.controlplane.model.Run;
import loadgrid.controlplane.model.ScenarioConfig;
import loadgrid.controlplane.model.WorkerResult;
import loadgrid.controlplane.orchestrator.Orchestrator;
import loadgrid.controlplane.worker.SequentialValueProvider;
import loadgrid.controlplane.worker.TargetClient;
import loadgrid.controlplane.worker.WorkloadValueProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a whole load test in one process: one orchestrator plus N workers
 * on their own threads, all talking through the same store.
 * Call start() to create and launch a run, stop() to shut the workers down.
 */
public final class SimulationService {

    private static final Logger log = LoggerFactory.getLogger(SimulationService.class);

    private final Dependencies deps;
    private final int nodes;

    private ExecutorService executor;
    private final List<Future<WorkerResult>> workers = new ArrayList<>();
    private volatile boolean running;

    /**
     * @param nodes number of simulated hosts the workers are spread over
     */
    public SimulationService(Dependencies deps, int nodes) {
        this.deps = deps;
        this.nodes = Math.max(1, nodes);
    }

    /**
     * Create a run for {@code scenario}, start it and spawn its workers.
     *
     * @return the run id
     */
    public synchronized String start(ScenarioConfig scenario, TargetClient client) {
        if (running) {
            throw new IllegalStateException("Simulation already running");
        }
        Orchestrator orchestrator = deps.orchestrator();
        String runId = orchestrator.createRun(scenario);
        orchestrator.start(runId);

        int count = scenario.workerCount();
        workers.clear();
        executor = Executors.newFixedThreadPool(count, r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            return t;
        });

        WorkloadValueProvider values = new SequentialValueProvider();
        for (int i = 1; i <= count; i++) {
            String workerId = "worker-" + i;
            String nodeId = "sim-node-" + ((i - 1) % nodes + 1);
            workers.add(executor.submit(() -> {
                Thread.currentThread().setName("sim-" + workerId);
                return deps.newWorker(runId, workerId, nodeId, client, values).run();
            }));
        }

        running = true;
        log.info("Simulation started: run {} with {} workers on {} nodes", runId, count, nodes);
        return runId;
    }

    /**
     * Wait for the run to end and for every worker thread to return.
     *
     * @return the terminal run, or empty on timeout
     */
    public Optional<Run> awaitCompletion(String runId, Duration timeout) throws InterruptedException {
        Optional<Run> run = deps.orchestrator().awaitTerminal(runId, timeout);
        List<Future<WorkerResult>> pending;
        synchronized (this) {
            pending = new ArrayList<>(workers);
        }
        for (Future<WorkerResult> worker : pending) {
            try {
                worker.get(deps.config().drainTimeout().toMillis(), TimeUnit.MILLISECONDS);
            } catch (ExecutionException e) {
                log.warn("Simulated worker failed: {}", e.getCause().getMessage());
            } catch (TimeoutException e) {
                log.warn("Simulated worker did not return within the drain timeout");
            }
        }
        return run;
    }

    /**
     * Stop all simulated workers.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;

        if (executor != null) {
            executor.shutdownNow();
            try {
                executor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            executor = null;
        }
        workers.clear();
        log.info("Simulation stopped");
    }

    public boolean isRunning() {
        return running;
    }
}
