package loadgrid.controlplane.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Split of a total concurrency over a run's workers.
 * <p>
 * With a per-worker cap, workers are filled to the cap in order and the last
 * one gets the remainder (100 over 7 workers, cap 15: six at 15, one at 10);
 * a total above {@code cap * workers} is clamped. Without a cap the split is
 * even and the first workers take the remainder.
 *
 * @param effectiveTotal total after clamping
 * @param targets        target per worker id, in the given worker order
 */
public record WorkerTargets(int effectiveTotal, Map<String, Integer> targets) {

    private static final Logger log = LoggerFactory.getLogger(WorkerTargets.class);

    public WorkerTargets {
        targets = Collections.unmodifiableMap(new LinkedHashMap<>(targets));
    }

    public static WorkerTargets distribute(int total, List<String> workerIds, Integer perWorkerCap) {
        if (workerIds.isEmpty()) {
            return new WorkerTargets(0, Map.of());
        }
        int workers = workerIds.size();
        int remaining = Math.max(0, total);
        Map<String, Integer> targets = new LinkedHashMap<>();

        if (perWorkerCap != null && perWorkerCap > 0) {
            long maxTotal = (long) perWorkerCap * workers;
            if (remaining > maxTotal) {
                log.warn("Target {} exceeds per-worker cap; clamping to {}", remaining, maxTotal);
                remaining = (int) maxTotal;
            }
            int effective = remaining;
            for (String workerId : workerIds) {
                int target = Math.min(perWorkerCap, remaining);
                remaining -= target;
                targets.put(workerId, target);
            }
            return new WorkerTargets(effective, targets);
        }

        int base = remaining / workers;
        int remainder = remaining % workers;
        for (int i = 0; i < workers; i++) {
            targets.put(workerIds.get(i), base + (i < remainder ? 1 : 0));
        }
        return new WorkerTargets(remaining, targets);
    }

    public int targetFor(String workerId) {
        return targets.getOrDefault(workerId, 0);
    }
}
