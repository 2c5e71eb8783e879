package loadgrid.controlplane.simulation;

import loadgrid.controlplane.config.ControlPlaneConfig;
import loadgrid.controlplane.config.Dependencies;
import loadgrid.controlplane.model.FindMaxSettings;
import loadgrid.controlplane.model.LoadMode;
import loadgrid.controlplane.model.QpsSettings;
import loadgrid.controlplane.model.Run;
import loadgrid.controlplane.model.RunStatus;
import loadgrid.controlplane.model.ScenarioConfig;
import loadgrid.controlplane.model.StepRecord;
import loadgrid.controlplane.model.TransitionResult;
import loadgrid.controlplane.model.WorkerOutcome;
import loadgrid.controlplane.model.WorkerResult;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimulationServiceTest {

    private static Dependencies deps;
    private SimulationService simulation;

    @BeforeAll
    static void setup() {
        ControlPlaneConfig config = ControlPlaneConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-simulation;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withPollInterval(Duration.ofMillis(20))
                .withHeartbeatInterval(Duration.ofMillis(100))
                .withOrchestratorPollInterval(Duration.ofMillis(50))
                .withRendezvousTimeout(Duration.ofSeconds(10))
                .withDrainTimeout(Duration.ofSeconds(5));
        deps = Dependencies.create(config);
        deps.orchestrator().startPolling();
    }

    @AfterAll
    static void teardown() {
        if (deps != null)
            deps.close();
    }

    @BeforeEach
    void createSimulation() {
        simulation = new SimulationService(deps, 2);
    }

    @AfterEach
    void stopSimulation() {
        simulation.stop();
    }

    private static SimulatedTargetClient fastTarget() {
        return new SimulatedTargetClient(1.0, 1000, 0.0);
    }

    private Run await(String runId) throws InterruptedException {
        return simulation.awaitCompletion(runId, Duration.ofSeconds(20)).orElseThrow();
    }

    @Test
    void findMaxRunClimbsToMaxAndCompletes() throws Exception {
        ScenarioConfig scenario = ScenarioConfig.builder()
                .workerCount(2)
                .minWorkers(2)
                .loadMode(LoadMode.FIND_MAX)
                .findMax(new FindMaxSettings(2, 2, 0.3, 6, 2000.0, 50.0, 0, 0))
                .build();

        String runId = simulation.start(scenario, fastTarget());
        Run run = await(runId);

        assertEquals(RunStatus.COMPLETED, run.status());
        assertNotNull(run.summary().findMax());
        assertEquals(2, run.summary().findMax().totalWorkers());
        assertEquals(2, run.summary().findMax().totalNodes());
        assertTrue(run.summary().findMax().finalBestConcurrency() > 0);
        assertTrue(run.summary().findMax().finalBestConcurrency() <= 12);
        assertTrue(run.summary().totalOperations() > 0);

        List<StepRecord> steps = deps.resultRepository().findSteps(runId, "worker-1");
        assertFalse(steps.isEmpty());
        assertEquals(2, steps.get(0).concurrency());
        assertTrue(deps.heartbeatRegistry().findByRun(runId).isEmpty());
    }

    @Test
    void fixedRunEndsAfterItsDuration() throws Exception {
        ScenarioConfig scenario = ScenarioConfig.builder()
                .workerCount(2)
                .minWorkers(2)
                .loadMode(LoadMode.FIXED)
                .concurrency(4)
                .warmupSeconds(0.2)
                .durationSeconds(0.5)
                .build();

        String runId = simulation.start(scenario, fastTarget());
        Run run = await(runId);

        assertEquals(RunStatus.COMPLETED, run.status());
        assertEquals(LoadMode.FIXED, run.summary().loadMode());
        assertNull(run.summary().findMax());
        assertTrue(run.summary().totalOperations() > 0);
        assertNotNull(run.startTime());

        for (WorkerResult result : deps.resultRepository().findResultsByRun(runId)) {
            assertEquals(WorkerOutcome.COMPLETED, result.outcome());
        }
    }

    @Test
    void qpsRunHoldsTargetThenCompletes() throws Exception {
        ScenarioConfig scenario = ScenarioConfig.builder()
                .workerCount(2)
                .minWorkers(2)
                .loadMode(LoadMode.QPS)
                .qps(new QpsSettings(400, 1, 6, 150))
                .warmupSeconds(0.2)
                .durationSeconds(1.0)
                .build();

        String runId = simulation.start(scenario, fastTarget());
        Run run = await(runId);

        assertEquals(RunStatus.COMPLETED, run.status());
        assertEquals(LoadMode.QPS, run.summary().loadMode());
        assertNull(run.summary().findMax());
        assertTrue(run.summary().totalOperations() > 0);

        List<WorkerResult> results = deps.resultRepository().findResultsByRun(runId);
        assertEquals(2, results.size());
        for (WorkerResult result : results) {
            assertEquals(WorkerOutcome.COMPLETED, result.outcome());
        }
    }

    @Test
    void stoppedRunIsCancelled() throws Exception {
        ScenarioConfig scenario = ScenarioConfig.builder()
                .workerCount(2)
                .minWorkers(2)
                .loadMode(LoadMode.FIXED)
                .concurrency(2)
                .durationSeconds(60)
                .build();

        String runId = simulation.start(scenario, fastTarget());
        long deadline = System.currentTimeMillis() + 10_000;
        while (deps.runQueryService().run(runId).orElseThrow().status() != RunStatus.RUNNING
                && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertEquals(TransitionResult.APPLIED, deps.orchestrator().stop(runId));

        Run run = await(runId);

        assertEquals(RunStatus.CANCELLED, run.status());
        List<WorkerResult> results = deps.resultRepository().findResultsByRun(runId);
        assertEquals(2, results.size());
        for (WorkerResult result : results) {
            assertEquals(WorkerOutcome.CANCELLED, result.outcome());
        }
    }

    @Test
    void onlyOneSimulationAtATime() {
        ScenarioConfig scenario = ScenarioConfig.builder()
                .loadMode(LoadMode.FIXED)
                .concurrency(1)
                .durationSeconds(60)
                .build();

        String runId = simulation.start(scenario, fastTarget());
        assertTrue(simulation.isRunning());
        assertThrows(IllegalStateException.class, () -> simulation.start(scenario, fastTarget()));

        deps.orchestrator().stop(runId);
    }
}
