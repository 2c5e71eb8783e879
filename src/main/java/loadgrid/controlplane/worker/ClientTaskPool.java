package loadgrid.controlplane.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Iterator;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Dynamically sized set of client tasks of one worker.
 * <p>
 * {@link #scaleTo} runs under the pool's lock: it forgets finished tasks,
 * starts tasks while fewer than the target are running, and signals the
 * newest tasks to stop while more are running. Stopping is cooperative.
 */
public class ClientTaskPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ClientTaskPool.class);

    private final String workerId;
    private final TargetClient client;
    private final ConnectionPool connections;
    private final WorkloadValueProvider values;
    private final OperationMix mix;
    private final MeasurementWindow window;
    private final long thinkTimeMs;
    private final long operationsPerTask;

    private final ExecutorService executor;
    private final AtomicBoolean globalStop = new AtomicBoolean();
    private final TreeMap<Long, Running> tasks = new TreeMap<>();
    private long nextTaskId = 1;
    private int target;

    public ClientTaskPool(String workerId, TargetClient client, ConnectionPool connections,
            WorkloadValueProvider values, OperationMix mix, MeasurementWindow window,
            long thinkTimeMs, long operationsPerTask) {
        this.workerId = workerId;
        this.client = client;
        this.connections = connections;
        this.values = values;
        this.mix = mix;
        this.window = window;
        this.thinkTimeMs = thinkTimeMs;
        this.operationsPerTask = operationsPerTask;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "loadgrid-client-" + workerId);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Adjust the number of running tasks to {@code newTarget}.
     *
     * @return number of tasks running (not signalled) afterwards
     */
    public synchronized int scaleTo(int newTarget) {
        if (newTarget < 0) {
            throw new IllegalArgumentException("target must be non-negative");
        }
        if (globalStop.get()) {
            log.debug("Worker {}: ignoring scale to {} after stop", workerId, newTarget);
            return 0;
        }
        target = newTarget;
        prune();

        int running = countRunning();
        if (running < newTarget) {
            for (int i = running; i < newTarget; i++) {
                long id = nextTaskId++;
                ClientTask task = new ClientTask(id, workerId, client, connections, values, mix, window,
                        globalStop, thinkTimeMs, operationsPerTask);
                tasks.put(id, new Running(task, executor.submit(task)));
            }
        } else if (running > newTarget) {
            int excess = running - newTarget;
            // newest first
            for (Long id : tasks.descendingKeySet()) {
                if (excess == 0) {
                    break;
                }
                Running r = tasks.get(id);
                if (!r.task.isSignalled()) {
                    r.task.signalStop();
                    excess--;
                }
            }
        }
        int after = countRunning();
        log.debug("Worker {}: scaled {} -> {} tasks (target {})", workerId, running, after, newTarget);
        return after;
    }

    /** Tasks that are neither finished nor signalled to stop. */
    public synchronized int running() {
        prune();
        return countRunning();
    }

    public synchronized int target() {
        return target;
    }

    public boolean isStopped() {
        return globalStop.get();
    }

    /** Ask every task to stop after its in-flight operation. */
    public void stopAll() {
        globalStop.set(true);
        synchronized (this) {
            tasks.values().forEach(r -> r.task.signalStop());
            target = 0;
        }
    }

    /**
     * Wait for all tasks to finish, up to {@code timeout}.
     *
     * @return true if every task finished in time
     */
    public boolean awaitDrain(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            synchronized (this) {
                prune();
                if (tasks.isEmpty()) {
                    return true;
                }
            }
            Thread.sleep(10);
        }
        synchronized (this) {
            prune();
            return tasks.isEmpty();
        }
    }

    @Override
    public void close() {
        stopAll();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Worker {}: client tasks still busy at shutdown", workerId);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void prune() {
        Iterator<Running> it = tasks.values().iterator();
        while (it.hasNext()) {
            if (it.next().future.isDone()) {
                it.remove();
            }
        }
    }

    private int countRunning() {
        int n = 0;
        for (Running r : tasks.values()) {
            if (!r.task.isSignalled()) {
                n++;
            }
        }
        return n;
    }

    private record Running(ClientTask task, Future<?> future) {
    }
}
