package loadgrid.controlplane.worker;

import loadgrid.controlplane.findmax.StepMeasurement;
import loadgrid.controlplane.model.KindMetrics;
import loadgrid.controlplane.model.OperationKind;
import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

class MeasurementWindowTest {

    @Test
    void snapshotComputesRatesAndPercentiles() {
        MeasurementWindow window = new MeasurementWindow();
        for (int i = 1; i <= 100; i++) {
            window.record(OperationKind.POINT_LOOKUP, OperationResult.success(i));
        }
        for (int i = 0; i < 10; i++) {
            window.record(OperationKind.RANGE_SCAN, OperationResult.failure(500, "timeout"));
        }

        StepMeasurement m = window.snapshotAndReset(8);

        assertEquals(8, m.concurrency());
        assertEquals(110, m.operations());
        assertEquals(10, m.errors());
        assertEquals(10 * 100.0 / 110, m.errorRatePct(), 1e-9);
        // failed operations carry no latency sample
        assertEquals(96.0, m.p95LatencyMs(), 0.1);
        assertEquals(100.0, m.p99LatencyMs(), 0.1);
        assertTrue(m.qps() > 0);

        KindMetrics scans = m.kind(OperationKind.RANGE_SCAN);
        assertEquals(10, scans.operations());
        assertEquals(100.0, scans.errorRatePct());
        assertNull(scans.p95LatencyMs());
        assertEquals(0, m.kind(OperationKind.INSERT).operations());
        assertEquals(96.0, m.kind(OperationKind.POINT_LOOKUP).p95LatencyMs(), 0.1);
    }

    @Test
    void snapshotStartsAFreshWindow() {
        MeasurementWindow window = new MeasurementWindow();
        window.record(OperationKind.POINT_LOOKUP, OperationResult.success(5));
        window.snapshotAndReset(1);

        StepMeasurement empty = window.snapshotAndReset(1);

        assertEquals(0, empty.operations());
        assertEquals(0.0, empty.p95LatencyMs());
        assertFalse(empty.hasLatency());
    }

    @Test
    void lifetimeTotalsSurviveResets() {
        MeasurementWindow window = new MeasurementWindow();
        window.record(OperationKind.INSERT, OperationResult.success(3));
        window.reset();
        window.record(OperationKind.INSERT, OperationResult.failure(3, "dup key"));
        window.snapshotAndReset(1);

        assertEquals(2, window.totalOperations());
        assertEquals(1, window.totalErrors());
    }

    @Test
    void percentilesAreComputedPerWindow() {
        MeasurementWindow window = new MeasurementWindow();
        for (int i = 0; i < 100_000; i++) {
            window.record(OperationKind.POINT_LOOKUP, OperationResult.success(50));
        }
        window.snapshotAndReset(4);

        for (int i = 0; i < 1_000; i++) {
            window.record(OperationKind.POINT_LOOKUP, OperationResult.success(2));
        }
        StepMeasurement second = window.snapshotAndReset(4);

        assertEquals(1_000, second.operations());
        assertEquals(2.0, second.p99LatencyMs(), 0.01);
        assertEquals(101_000, window.totalOperations());
    }
}
