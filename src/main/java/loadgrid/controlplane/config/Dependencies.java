package loadgrid.controlplane.config;

import loadgrid.controlplane.orchestrator.Orchestrator;
import loadgrid.controlplane.repository.ControlEventRepository;
import loadgrid.controlplane.repository.HeartbeatRepository;
import loadgrid.controlplane.repository.RunStatusRepository;
import loadgrid.controlplane.repository.WorkerResultRepository;
import loadgrid.controlplane.service.ControlEventLog;
import loadgrid.controlplane.service.HeartbeatRegistry;
import loadgrid.controlplane.service.ResultsAggregator;
import loadgrid.controlplane.service.RunQueryService;
import loadgrid.controlplane.service.RunStatusService;
import loadgrid.controlplane.store.Database;
import loadgrid.controlplane.store.JdbcControlEventRepository;
import loadgrid.controlplane.store.JdbcHeartbeatRepository;
import loadgrid.controlplane.store.JdbcRunStatusRepository;
import loadgrid.controlplane.store.JdbcWorkerResultRepository;
import loadgrid.controlplane.worker.LoadWorker;
import loadgrid.controlplane.worker.TargetClient;
import loadgrid.controlplane.worker.WorkloadValueProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all control-plane dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(ControlPlaneConfig.fromEnv());
 * deps.orchestrator().startPolling();
 * String runId = deps.orchestrator().createRun(scenario);
 * // ... workers call deps.newWorker(...).run() ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final ControlPlaneConfig config;
    private final Database database;
    private final RunStatusRepository runRepository;
    private final HeartbeatRepository heartbeatRepository;
    private final ControlEventRepository eventRepository;
    private final WorkerResultRepository resultRepository;
    private final RunStatusService runStatusService;
    private final HeartbeatRegistry heartbeatRegistry;
    private final ControlEventLog controlEventLog;
    private final ResultsAggregator resultsAggregator;
    private final RunQueryService runQueryService;

    // Orchestrator (lazy-initialized; workers never need one)
    private Orchestrator orchestrator;

    private Dependencies(ControlPlaneConfig config) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.runRepository = new JdbcRunStatusRepository(database);
        this.heartbeatRepository = new JdbcHeartbeatRepository(database);
        this.eventRepository = new JdbcControlEventRepository(database);
        this.resultRepository = new JdbcWorkerResultRepository(database);

        // Services
        this.runStatusService = new RunStatusService(runRepository);
        this.heartbeatRegistry = new HeartbeatRegistry(heartbeatRepository, config);
        this.controlEventLog = new ControlEventLog(eventRepository);
        this.resultsAggregator = new ResultsAggregator();
        this.runQueryService = new RunQueryService(runRepository, resultRepository, heartbeatRegistry,
                resultsAggregator);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(ControlPlaneConfig config) {
        return new Dependencies(config);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(ControlPlaneConfig.fromEnv());
    }

    // Getters
    public ControlPlaneConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public RunStatusRepository runRepository() {
        return runRepository;
    }

    public HeartbeatRepository heartbeatRepository() {
        return heartbeatRepository;
    }

    public ControlEventRepository eventRepository() {
        return eventRepository;
    }

    public WorkerResultRepository resultRepository() {
        return resultRepository;
    }

    public RunStatusService runStatusService() {
        return runStatusService;
    }

    public HeartbeatRegistry heartbeatRegistry() {
        return heartbeatRegistry;
    }

    public ControlEventLog controlEventLog() {
        return controlEventLog;
    }

    public ResultsAggregator resultsAggregator() {
        return resultsAggregator;
    }

    public RunQueryService runQueryService() {
        return runQueryService;
    }

    /**
     * Get the orchestrator (creates it if not yet created).
     */
    public synchronized Orchestrator orchestrator() {
        if (orchestrator == null) {
            orchestrator = new Orchestrator(config, runStatusService, runRepository, heartbeatRegistry,
                    controlEventLog, resultRepository, resultsAggregator);
        }
        return orchestrator;
    }

    /**
     * Build a worker for a run, wired to this container's store.
     */
    public LoadWorker newWorker(String runId, String workerId, String nodeId, TargetClient client,
            WorkloadValueProvider values) {
        return new LoadWorker(runId, workerId, nodeId, config, runRepository, heartbeatRegistry,
                controlEventLog, resultRepository, client, values);
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop the poll loop first
        synchronized (this) {
            if (orchestrator != null) {
                try {
                    orchestrator.close();
                } catch (Exception e) {
                    log.warn("Error stopping orchestrator: {}", e.getMessage());
                }
            }
        }

        // Close database
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
