package loadgrid.controlplane.config;

import loadgrid.controlplane.model.DeadWorkerPolicy;
import loadgrid.controlplane.model.LoadMode;
import loadgrid.controlplane.model.OperationKind;
import loadgrid.controlplane.model.RunPhase;
import loadgrid.controlplane.model.ScenarioConfig;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.io.StringReader;

import static org.junit.jupiter.api.Assertions.*;

class IniScenarioLoaderTest {

    @Test
    void fullFindMaxScenario() throws IOException {
        String ini = """
                [RUN]
                worker_count = 3
                min_workers = 2
                dead_worker_policy = degrade
                load_mode = find_max
                warmup_seconds = 10
                think_time_ms = 5

                [FIND_MAX]
                start_concurrency = 5
                concurrency_increment = 10
                step_duration_seconds = 30
                max_concurrency = 200
                latency_stability_pct = 20
                max_error_rate_pct = 1
                max_backoff_attempts = 2

                [MIX]
                point_lookup = 70
                range_scan = 30

                [SLO.RANGE_SCAN]
                target_p95_ms = 50
                target_error_rate_pct = 0
                """;

        ScenarioConfig scenario = IniScenarioLoader.load(new StringReader(ini));

        assertEquals(3, scenario.workerCount());
        assertEquals(2, scenario.minWorkers());
        assertEquals(DeadWorkerPolicy.DEGRADE, scenario.deadWorkerPolicy());
        assertEquals(LoadMode.FIND_MAX, scenario.loadMode());
        assertEquals(RunPhase.WARMUP, scenario.initialPhase());
        assertEquals(5, scenario.thinkTimeMs());
        assertEquals(200, scenario.findMax().maxConcurrency());
        assertEquals(2, scenario.findMax().maxBackoffAttempts());
        assertEquals(70.0, scenario.operationMix().get(OperationKind.POINT_LOOKUP));
        assertEquals(50.0, scenario.slos().get(OperationKind.RANGE_SCAN).targetP95Ms());
        assertNull(scenario.slos().get(OperationKind.RANGE_SCAN).targetP99Ms());
        assertTrue(scenario.slos().get(OperationKind.RANGE_SCAN).errorRateEnabled());
    }

    @Test
    void fixedScenarioWithDefaults() throws IOException {
        String ini = """
                [RUN]
                worker_count = 4
                load_mode = FIXED
                concurrency = 100
                per_worker_cap = 30
                duration_seconds = 60
                """;

        ScenarioConfig scenario = IniScenarioLoader.load(new StringReader(ini));

        assertEquals(LoadMode.FIXED, scenario.loadMode());
        assertEquals(4, scenario.minWorkers());
        assertEquals(DeadWorkerPolicy.FAIL_RUN, scenario.deadWorkerPolicy());
        assertEquals(30, scenario.perWorkerCap());
        assertEquals(RunPhase.RUNNING, scenario.initialPhase());
        assertEquals(100.0, scenario.operationMix().get(OperationKind.POINT_LOOKUP));
    }

    @Test
    void missingRunSectionIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> IniScenarioLoader.load(new StringReader("[MIX]\ninsert = 1\n")));
    }

    @Test
    void invalidPlanIsRejected() {
        String ini = """
                [RUN]
                worker_count = 2
                min_workers = 3
                """;
        assertThrows(IllegalArgumentException.class, () -> IniScenarioLoader.load(new StringReader(ini)));
    }

    @Test
    void fixedRunNeedsADuration() {
        String ini = """
                [RUN]
                load_mode = FIXED
                concurrency = 10
                """;
        assertThrows(IllegalArgumentException.class, () -> IniScenarioLoader.load(new StringReader(ini)));
    }

    @Test
    void qpsScenario() throws IOException {
        String ini = """
                [RUN]
                worker_count = 2
                load_mode = qps
                warmup_seconds = 5
                duration_seconds = 120

                [QPS]
                target_qps = 1500
                min_concurrency = 4
                max_concurrency = 64
                control_interval_ms = 1000
                """;

        ScenarioConfig scenario = IniScenarioLoader.load(new StringReader(ini));

        assertEquals(LoadMode.QPS, scenario.loadMode());
        assertEquals(1500.0, scenario.qps().targetQps());
        assertEquals(4, scenario.qps().minConcurrency());
        assertEquals(64, scenario.qps().maxConcurrency());
        assertEquals(1000, scenario.qps().controlIntervalMillis());
        assertEquals(750.0, scenario.workerTargetQps());
        assertEquals(64, scenario.peakWorkerConcurrency());
        assertEquals(64, scenario.effectiveConnectionPoolSize());
    }

    @Test
    void qpsRunNeedsATarget() {
        String ini = """
                [RUN]
                load_mode = QPS
                duration_seconds = 60
                """;
        assertThrows(IllegalArgumentException.class, () -> IniScenarioLoader.load(new StringReader(ini)));
    }

    @Test
    void qpsBoundsMustBeOrdered() {
        String ini = """
                [RUN]
                load_mode = QPS
                duration_seconds = 60

                [QPS]
                target_qps = 100
                min_concurrency = 10
                max_concurrency = 5
                """;
        assertThrows(IllegalArgumentException.class, () -> IniScenarioLoader.load(new StringReader(ini)));
    }
}
