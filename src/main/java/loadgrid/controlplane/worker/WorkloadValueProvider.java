package loadgrid.controlplane.worker;

/**
 * Source of query keys. Keys handed to different workers never collide.
 */
public interface WorkloadValueProvider {

    String nextValue(String workerId);
}
