package loadgrid.controlplane.store;

import loadgrid.controlplane.config.ControlPlaneConfig;
import loadgrid.controlplane.model.ControlCommand;
import loadgrid.controlplane.model.ControlEvent;
import loadgrid.controlplane.model.ControlEventType;
import loadgrid.controlplane.model.Run;
import loadgrid.controlplane.model.RunPhase;
import loadgrid.controlplane.model.RunStatus;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class JdbcControlEventRepositoryTest {

    private static Database db;
    private static JdbcRunStatusRepository runs;
    private static JdbcControlEventRepository repo;

    @BeforeAll
    static void setup() {
        ControlPlaneConfig config = ControlPlaneConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-events;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        runs = new JdbcRunStatusRepository(db);
        repo = new JdbcControlEventRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void clean() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM control_events");
            st.execute("DELETE FROM run_status");
            conn.commit();
        }
        runs.create(Run.builder().runId("run-1").status(RunStatus.RUNNING).phase(RunPhase.RUNNING).build());
        runs.create(Run.builder().runId("run-2").status(RunStatus.RUNNING).phase(RunPhase.RUNNING).build());
    }

    @Test
    void sequencesStartAtOnePerRun() {
        assertEquals(1, repo.append("run-1", new ControlCommand.SetPhase(RunPhase.WARMUP)).sequence());
        assertEquals(2, repo.append("run-1", new ControlCommand.SetPhase(RunPhase.RUNNING)).sequence());
        assertEquals(1, repo.append("run-2", new ControlCommand.Stop(ControlCommand.Stop.CANCELLED, 30)).sequence());
    }

    @Test
    void payloadsRoundTrip() {
        repo.append("run-1", new ControlCommand.SetPhase(RunPhase.WARMUP));
        repo.append("run-1", new ControlCommand.ScaleTo(12, "worker-2"));
        repo.append("run-1", new ControlCommand.Stop(ControlCommand.Stop.DURATION_ELAPSED, 12.5));

        List<ControlEvent> events = repo.findAfter("run-1", 0);
        assertEquals(3, events.size());
        assertEquals(new ControlCommand.SetPhase(RunPhase.WARMUP), events.get(0).command());
        assertEquals(new ControlCommand.ScaleTo(12, "worker-2"), events.get(1).command());
        assertEquals(new ControlCommand.Stop(ControlCommand.Stop.DURATION_ELAPSED, 12.5), events.get(2).command());
        assertEquals(ControlEventType.STOP, events.get(2).type());
    }

    @Test
    void findAfterSkipsSeenEvents() {
        for (int i = 0; i < 5; i++) {
            repo.append("run-1", new ControlCommand.ScaleTo(i, null));
        }

        List<ControlEvent> events = repo.findAfter("run-1", 3);
        assertEquals(List.of(4L, 5L), events.stream().map(ControlEvent::sequence).toList());
    }

    @Test
    void findLatestByType() {
        repo.append("run-1", new ControlCommand.SetPhase(RunPhase.WARMUP));
        repo.append("run-1", new ControlCommand.ScaleTo(4, null));
        repo.append("run-1", new ControlCommand.SetPhase(RunPhase.RUNNING));

        ControlEvent latest = repo.findLatest("run-1", ControlEventType.SET_PHASE).orElseThrow();
        assertEquals(3, latest.sequence());
        assertEquals(new ControlCommand.SetPhase(RunPhase.RUNNING), latest.command());
        assertTrue(repo.findLatest("run-1", ControlEventType.STOP).isEmpty());
    }

    @Test
    void appendToUnknownRunFails() {
        assertThrows(StoreException.class,
                () -> repo.append("run-missing", new ControlCommand.SetPhase(RunPhase.RUNNING)));
    }

    @Test
    void concurrentAppendsGetDistinctSequences() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<Long>> futures = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                int target = i;
                futures.add(pool.submit(() -> repo.append("run-1", new ControlCommand.ScaleTo(target, null)).sequence()));
            }
            Set<Long> sequences = new HashSet<>();
            for (Future<Long> f : futures) {
                sequences.add(f.get());
            }
            assertEquals(20, sequences.size());
            assertEquals(20L, sequences.stream().mapToLong(Long::longValue).max().orElseThrow());
        } finally {
            pool.shutdownNow();
        }
    }
}
