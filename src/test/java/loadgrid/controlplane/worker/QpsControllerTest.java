package loadgrid.controlplane.worker;

import loadgrid.controlplane.model.OperationKind;
import loadgrid.controlplane.model.QpsSettings;
import org.junit.jupiter.api.*;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class QpsControllerTest {

    @Test
    void sizesPoolFromMeasuredRatePerTask() {
        // 4 tasks deliver 100 QPS, so 25 each; 260 QPS needs 11
        assertEquals(11, QpsController.desiredConcurrency(260, 100, 4, 1, 50));
        assertEquals(2, QpsController.desiredConcurrency(50, 100, 4, 1, 50));
    }

    @Test
    void growsByOneWithoutThroughput() {
        assertEquals(5, QpsController.desiredConcurrency(100, 0, 4, 1, 50));
        assertEquals(4, QpsController.desiredConcurrency(100, 0, 4, 1, 4));
    }

    @Test
    void clampsToBounds() {
        assertEquals(8, QpsController.desiredConcurrency(10_000, 10, 1, 2, 8));
        assertEquals(2, QpsController.desiredConcurrency(1, 1000, 10, 2, 8));
    }

    @Test
    void scalesPoolTowardsTarget() throws Exception {
        // each task manages roughly 100 operations per second
        TargetClient target = (kind, key) -> {
            try {
                Thread.sleep(10);
                return OperationResult.success(10.0);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return OperationResult.failure(0, "interrupted");
            }
        };
        MeasurementWindow window = new MeasurementWindow();
        AtomicBoolean stop = new AtomicBoolean();
        try (ClientTaskPool pool = new ClientTaskPool("worker-1", target, new SemaphoreConnectionPool(16),
                new SequentialValueProvider(), new OperationMix(Map.of(OperationKind.POINT_LOOKUP, 1.0)),
                window, 0, 0)) {
            pool.scaleTo(1);
            QpsController controller = new QpsController("worker-1", new QpsSettings(400, 1, 8, 200),
                    400, pool, window, stop::get);

            Thread runner = new Thread(() -> {
                try {
                    controller.run();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            runner.start();
            Thread.sleep(1_200);
            stop.set(true);
            runner.join(2_000);

            assertFalse(runner.isAlive());
            assertTrue(pool.target() >= 3, "target " + pool.target());
            assertTrue(pool.target() <= 8);
            assertTrue(controller.lastQps() > 0);
        }
    }
}
