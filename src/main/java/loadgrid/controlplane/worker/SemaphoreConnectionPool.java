package loadgrid.controlplane.worker;

import java.util.concurrent.Semaphore;

/**
 * Connection pool that only enforces the ceiling; there are no real connections behind it.
 */
public class SemaphoreConnectionPool implements ConnectionPool {

    private final int ceiling;
    private final Semaphore permits;

    public SemaphoreConnectionPool(int ceiling) {
        if (ceiling <= 0) {
            throw new IllegalArgumentException("ceiling must be positive");
        }
        this.ceiling = ceiling;
        this.permits = new Semaphore(ceiling, true);
    }

    @Override
    public void acquire() throws InterruptedException {
        permits.acquire();
    }

    @Override
    public void release() {
        permits.release();
    }

    @Override
    public int ceiling() {
        return ceiling;
    }

    @Override
    public int inUse() {
        return ceiling - permits.availablePermits();
    }
}
