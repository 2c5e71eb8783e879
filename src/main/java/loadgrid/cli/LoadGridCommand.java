package loadgrid.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import loadgrid.controlplane.config.ControlPlaneConfig;
import loadgrid.controlplane.config.Dependencies;
import loadgrid.controlplane.config.IniScenarioLoader;
import loadgrid.controlplane.model.HeartbeatSummary;
import loadgrid.controlplane.model.Run;
import loadgrid.controlplane.model.RunStatus;
import loadgrid.controlplane.model.ScenarioConfig;
import loadgrid.controlplane.model.TransitionResult;
import loadgrid.controlplane.model.WorkerResult;
import loadgrid.controlplane.orchestrator.WorkerTargets;
import loadgrid.controlplane.simulation.SimulatedTargetClient;
import loadgrid.controlplane.simulation.SimulationService;
import loadgrid.controlplane.util.Jsons;
import loadgrid.controlplane.worker.SequentialValueProvider;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "loadgrid",
        mixinStandardHelpOptions = true,
        description = "Store-coordinated load test control plane",
        subcommands = {
                LoadGridCommand.CreateCommand.class,
                LoadGridCommand.StartCommand.class,
                LoadGridCommand.StopCommand.class,
                LoadGridCommand.ScaleCommand.class,
                LoadGridCommand.StatusCommand.class,
                LoadGridCommand.OrchestrateCommand.class,
                LoadGridCommand.WorkerCommand.class,
                LoadGridCommand.SimulateCommand.class
        }
)
public final class LoadGridCommand implements Runnable {

    @Option(names = {"--db-url"}, description = "JDBC URL of the shared store (default: LOADGRID_DB_URL or local H2)")
    String dbUrl;

    @Override
    public void run() {
        System.out.println("Use subcommands: create | start | stop | scale | status | orchestrate | worker | simulate");
    }

    ControlPlaneConfig config() {
        ControlPlaneConfig config = ControlPlaneConfig.fromEnv();
        return dbUrl != null ? config.withDatabaseUrl(dbUrl) : config;
    }

    Dependencies dependencies() {
        return Dependencies.create(config());
    }

    static void printJson(Object value) {
        try {
            System.out.println(Jsons.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render JSON", e);
        }
    }

    /** Options of the simulated target system. */
    static final class TargetOptions {
        @Option(names = {"--base-latency-ms"}, description = "Latency of an unloaded operation", defaultValue = "5")
        double baseLatencyMs;

        @Option(names = {"--saturation"}, description = "In-flight operations before latency grows", defaultValue = "50")
        int saturation;

        @Option(names = {"--error-rate"}, description = "Failure probability per operation (0..1)", defaultValue = "0")
        double errorRate;

        SimulatedTargetClient client() {
            return new SimulatedTargetClient(baseLatencyMs, saturation, errorRate);
        }
    }

    @Command(name = "create", description = "Create a run from a scenario INI file")
    static final class CreateCommand implements Callable<Integer> {
        @ParentCommand
        LoadGridCommand parent;

        @Parameters(index = "0", description = "Scenario INI file")
        File scenarioFile;

        @Option(names = {"--run-id"}, description = "Run id (generated when omitted)")
        String runId;

        @Override
        public Integer call() throws IOException {
            ScenarioConfig scenario = IniScenarioLoader.load(scenarioFile);
            try (Dependencies deps = parent.dependencies()) {
                String id = runId != null
                        ? deps.orchestrator().createRun(runId, scenario).runId()
                        : deps.orchestrator().createRun(scenario);
                System.out.println(id);
            }
            return 0;
        }
    }

    @Command(name = "start", description = "Move a PREPARED run to STARTING")
    static final class StartCommand implements Callable<Integer> {
        @ParentCommand
        LoadGridCommand parent;

        @Parameters(index = "0", description = "Run id")
        String runId;

        @Override
        public Integer call() {
            try (Dependencies deps = parent.dependencies()) {
                TransitionResult result = deps.orchestrator().start(runId);
                System.out.println(result);
                return result.succeeded() ? 0 : 1;
            }
        }
    }

    @Command(name = "stop", description = "Cancel a run")
    static final class StopCommand implements Callable<Integer> {
        @ParentCommand
        LoadGridCommand parent;

        @Parameters(index = "0", description = "Run id")
        String runId;

        @Override
        public Integer call() {
            try (Dependencies deps = parent.dependencies()) {
                TransitionResult result = deps.orchestrator().stop(runId);
                System.out.println(result);
                return result == TransitionResult.NOT_FOUND ? 1 : 0;
            }
        }
    }

    @Command(name = "scale", description = "Change the total concurrency of a running FIXED run")
    static final class ScaleCommand implements Callable<Integer> {
        @ParentCommand
        LoadGridCommand parent;

        @Parameters(index = "0", description = "Run id")
        String runId;

        @Parameters(index = "1", description = "Total concurrency over all workers")
        int total;

        @Override
        public Integer call() {
            try (Dependencies deps = parent.dependencies()) {
                WorkerTargets targets = deps.orchestrator().scaleTo(runId, total);
                printJson(targets);
            }
            return 0;
        }
    }

    @Command(name = "status", description = "Print a run, its heartbeats and its results")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        LoadGridCommand parent;

        @Parameters(index = "0", description = "Run id")
        String runId;

        @Override
        public Integer call() {
            try (Dependencies deps = parent.dependencies()) {
                Optional<Run> run = deps.runQueryService().run(runId);
                if (run.isEmpty()) {
                    System.err.println("Run not found: " + runId);
                    return 1;
                }
                printJson(describe(run.get(), deps.runQueryService().heartbeats(runId)));
                printJson(deps.runQueryService().aggregatedSteps(runId));
            }
            return 0;
        }

        private static Map<String, Object> describe(Run run, HeartbeatSummary heartbeats) {
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("run_id", run.runId());
            view.put("status", run.status());
            view.put("phase", run.phaseValue());
            view.put("workers_expected", run.workersExpected());
            view.put("workers_registered", heartbeats.registered());
            view.put("workers_ready", heartbeats.ready());
            view.put("workers_running", heartbeats.running());
            view.put("workers_stopped", heartbeats.stopped());
            view.put("stale_workers", heartbeats.staleWorkers());
            view.put("start_time", run.startTime());
            view.put("end_time", run.endTime());
            view.put("failure_message", run.failureMessage());
            view.put("summary", run.summary());
            return view;
        }
    }

    @Command(name = "orchestrate", description = "Run the orchestrator poll loop until interrupted")
    static final class OrchestrateCommand implements Callable<Integer> {
        @ParentCommand
        LoadGridCommand parent;

        @Override
        public Integer call() throws InterruptedException {
            CountDownLatch shutdown = new CountDownLatch(1);
            try (Dependencies deps = parent.dependencies()) {
                Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
                deps.orchestrator().startPolling();
                shutdown.await();
            }
            return 0;
        }
    }

    @Command(name = "worker", description = "Join a run as one worker, against a simulated target")
    static final class WorkerCommand implements Callable<Integer> {
        @ParentCommand
        LoadGridCommand parent;

        @Parameters(index = "0", description = "Run id")
        String runId;

        @Option(names = {"--worker-id"}, required = true, description = "Worker id, unique within the run")
        String workerId;

        @Option(names = {"--node-id"}, description = "Host the worker runs on", defaultValue = "local")
        String nodeId;

        @Mixin
        TargetOptions target = new TargetOptions();

        @Override
        public Integer call() {
            try (Dependencies deps = parent.dependencies()) {
                WorkerResult result = deps.newWorker(runId, workerId, nodeId, target.client(),
                        new SequentialValueProvider()).run();
                printJson(result);
                return switch (result.outcome()) {
                    case COMPLETED, CANCELLED -> 0;
                    case FAILED -> 1;
                };
            }
        }
    }

    @Command(name = "simulate", description = "Run a scenario end to end in this process")
    static final class SimulateCommand implements Callable<Integer> {
        @ParentCommand
        LoadGridCommand parent;

        @Parameters(index = "0", description = "Scenario INI file")
        File scenarioFile;

        @Option(names = {"--nodes"}, description = "Simulated hosts", defaultValue = "1")
        int nodes;

        @Option(names = {"--timeout-seconds"}, description = "Give up waiting after this long", defaultValue = "3600")
        long timeoutSeconds;

        @Mixin
        TargetOptions target = new TargetOptions();

        @Override
        public Integer call() throws IOException, InterruptedException {
            ScenarioConfig scenario = IniScenarioLoader.load(scenarioFile);
            try (Dependencies deps = parent.dependencies()) {
                deps.orchestrator().startPolling();
                SimulationService simulation = new SimulationService(deps, nodes);
                String runId = simulation.start(scenario, target.client());
                try {
                    Optional<Run> run = simulation.awaitCompletion(runId, Duration.ofSeconds(timeoutSeconds));
                    if (run.isEmpty()) {
                        System.err.println("Run " + runId + " did not finish in " + timeoutSeconds + "s");
                        deps.orchestrator().stop(runId);
                        return 2;
                    }
                    printJson(run.get().summary());
                    return run.get().status() == RunStatus.COMPLETED ? 0 : 1;
                } finally {
                    simulation.stop();
                }
            }
        }
    }
}
