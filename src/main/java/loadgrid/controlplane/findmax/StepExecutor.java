package loadgrid.controlplane.findmax;

/**
 * Holds a concurrency level for one step and measures it.
 */
public interface StepExecutor {

    /**
     * Scale to {@code concurrency}, let it settle, then measure for
     * {@code durationSeconds}. May return early with a partial window if a
     * stop is requested meanwhile.
     */
    StepMeasurement runStep(int concurrency, double durationSeconds) throws InterruptedException;
}
