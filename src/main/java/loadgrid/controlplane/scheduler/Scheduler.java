package loadgrid.controlplane.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs named periodic jobs on one thread.
 * <p>
 * The orchestrator uses one for its run poll loop; every worker uses one for
 * its control loop (event drain, status read, heartbeat). A job that throws
 * is logged and runs again at its next tick.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final String name;
    private final ScheduledExecutorService executor;
    private final List<Job> jobs = new ArrayList<>();

    private volatile boolean running = false;

    public Scheduler(String name) {
        this.name = name;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Register a job. Jobs added after {@link #start()} are scheduled at once.
     */
    public synchronized Scheduler every(String jobName, Duration interval, Runnable task) {
        Job job = new Job(jobName, interval, task);
        jobs.add(job);
        if (running) {
            schedule(job);
        }
        return this;
    }

    /**
     * Start the scheduler.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Scheduler {} already running", name);
            return;
        }

        running = true;
        for (Job job : jobs) {
            schedule(job);
        }

        log.info("Scheduler {} started with {} jobs", name, jobs.size());
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
        }
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler {} forcefully stopped", name);
            } else {
                log.info("Scheduler {} stopped gracefully", name);
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    private void schedule(Job job) {
        long intervalMs = Math.max(1, job.interval.toMillis());
        executor.scheduleAtFixedRate(wrapRunnable(job.name, job.task), 0, intervalMs, TimeUnit.MILLISECONDS);
        log.debug("{}: {} scheduled every {}ms", name, job.name, intervalMs);
    }

    /**
     * Wrap a runnable with error handling.
     */
    private Runnable wrapRunnable(String jobName, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", jobName, e);
            }
        };
    }

    private record Job(String name, Duration interval, Runnable task) {
    }
}
