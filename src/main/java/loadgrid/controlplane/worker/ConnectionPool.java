package loadgrid.controlplane.worker;

/**
 * Bounded pool of connections to the target system.
 */
public interface ConnectionPool {

    /** Block until a connection is free. */
    void acquire() throws InterruptedException;

    void release();

    /** Maximum number of connections handed out at once. */
    int ceiling();

    int inUse();
}
