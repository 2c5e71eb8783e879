package loadgrid.controlplane.worker;

import loadgrid.controlplane.model.OperationKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One simulated client: runs operations back to back until told to stop.
 * Both stop flags are checked once per iteration, so a stop takes effect
 * after the in-flight operation completes.
 */
final class ClientTask implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ClientTask.class);

    private final long taskId;
    private final String workerId;
    private final TargetClient client;
    private final ConnectionPool connections;
    private final WorkloadValueProvider values;
    private final OperationMix mix;
    private final MeasurementWindow window;
    private final AtomicBoolean globalStop;
    private final AtomicBoolean stopSignal = new AtomicBoolean();
    private final long thinkTimeMs;
    private final long operationBudget;

    ClientTask(long taskId, String workerId, TargetClient client, ConnectionPool connections,
            WorkloadValueProvider values, OperationMix mix, MeasurementWindow window,
            AtomicBoolean globalStop, long thinkTimeMs, long operationBudget) {
        this.taskId = taskId;
        this.workerId = workerId;
        this.client = client;
        this.connections = connections;
        this.values = values;
        this.mix = mix;
        this.window = window;
        this.globalStop = globalStop;
        this.thinkTimeMs = thinkTimeMs;
        this.operationBudget = operationBudget;
    }

    long taskId() {
        return taskId;
    }

    void signalStop() {
        stopSignal.set(true);
    }

    boolean isSignalled() {
        return stopSignal.get();
    }

    @Override
    public void run() {
        long done = 0;
        try {
            while (!globalStop.get() && !stopSignal.get()) {
                OperationKind kind = mix.next();
                String key = values.nextValue(workerId);

                OperationResult result;
                connections.acquire();
                try {
                    result = client.execute(kind, key);
                } catch (RuntimeException e) {
                    result = OperationResult.failure(0.0, e.getMessage());
                } finally {
                    connections.release();
                }
                window.record(kind, result);

                done++;
                if (operationBudget > 0 && done >= operationBudget) {
                    break;
                }
                if (thinkTimeMs > 0) {
                    Thread.sleep(thinkTimeMs);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.debug("Client task {}-{} finished after {} operations", workerId, taskId, done);
    }
}
