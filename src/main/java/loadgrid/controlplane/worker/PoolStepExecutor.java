package loadgrid.controlplane.worker;

import loadgrid.controlplane.findmax.StepExecutor;
import loadgrid.controlplane.findmax.StepMeasurement;

import java.util.function.BooleanSupplier;

/**
 * Runs find-max steps on a worker's client task pool: scale, settle,
 * open a fresh window, hold for the step duration, snapshot.
 */
public class PoolStepExecutor implements StepExecutor {

    private static final long SLICE_MS = 20;

    private final ClientTaskPool pool;
    private final MeasurementWindow window;
    private final long settleMillis;
    private final BooleanSupplier stopRequested;

    public PoolStepExecutor(ClientTaskPool pool, MeasurementWindow window, long settleMillis,
            BooleanSupplier stopRequested) {
        this.pool = pool;
        this.window = window;
        this.settleMillis = settleMillis;
        this.stopRequested = stopRequested;
    }

    @Override
    public StepMeasurement runStep(int concurrency, double durationSeconds) throws InterruptedException {
        pool.scaleTo(concurrency);
        sleepUnlessStopped(settleMillis);
        window.reset();
        sleepUnlessStopped((long) (durationSeconds * 1000));
        return window.snapshotAndReset(concurrency);
    }

    private void sleepUnlessStopped(long millis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + millis;
        long remaining;
        while ((remaining = deadline - System.currentTimeMillis()) > 0) {
            if (stopRequested.getAsBoolean()) {
                return;
            }
            Thread.sleep(Math.min(SLICE_MS, remaining));
        }
    }
}
