package loadgrid.controlplane.orchestrator;

import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkerTargetsTest {

    private static List<String> workers(int n) {
        List<String> ids = new ArrayList<>();
        for (int i = 1; i <= n; i++) {
            ids.add("worker-" + i);
        }
        return ids;
    }

    @Test
    void evenSplitGivesRemainderToFirstWorkers() {
        WorkerTargets targets = WorkerTargets.distribute(10, workers(3), null);

        assertEquals(List.of(4, 3, 3), new ArrayList<>(targets.targets().values()));
        assertEquals(10, targets.effectiveTotal());
    }

    @Test
    void cappedSplitFillsWorkersInOrder() {
        WorkerTargets targets = WorkerTargets.distribute(100, workers(7), 15);

        assertEquals(List.of(15, 15, 15, 15, 15, 15, 10), new ArrayList<>(targets.targets().values()));
        assertEquals(100, targets.effectiveTotal());
    }

    @Test
    void totalAboveCapacityIsClamped() {
        WorkerTargets targets = WorkerTargets.distribute(100, workers(3), 20);

        assertEquals(60, targets.effectiveTotal());
        assertEquals(List.of(20, 20, 20), new ArrayList<>(targets.targets().values()));
    }

    @Test
    void zeroCapMeansNoCap() {
        assertEquals(List.of(2, 2), new ArrayList<>(WorkerTargets.distribute(4, workers(2), 0).targets().values()));
    }

    @Test
    void negativeTotalAndNoWorkers() {
        assertEquals(0, WorkerTargets.distribute(-5, workers(2), null).effectiveTotal());
        assertTrue(WorkerTargets.distribute(10, List.of(), null).targets().isEmpty());
        assertEquals(0, WorkerTargets.distribute(10, workers(2), 5).targetFor("worker-9"));
    }
}
