package loadgrid.controlplane.worker;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands out {@code <workerId>-<n>} keys from a per-worker counter.
 */
public class SequentialValueProvider implements WorkloadValueProvider {

    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();

    @Override
    public String nextValue(String workerId) {
        long n = counters.computeIfAbsent(workerId, id -> new AtomicLong()).incrementAndGet();
        return workerId + "-" + n;
    }
}
