package loadgrid.controlplane.worker;

import loadgrid.controlplane.model.OperationKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Weighted random choice of the next operation kind.
 */
public final class OperationMix {

    private final OperationKind[] kinds;
    private final double[] cumulative;
    private final double total;

    public OperationMix(Map<OperationKind, Double> weights) {
        List<OperationKind> k = new ArrayList<>();
        List<Double> c = new ArrayList<>();
        double sum = 0;
        for (OperationKind kind : OperationKind.values()) {
            Double w = weights.get(kind);
            if (w != null && w > 0) {
                sum += w;
                k.add(kind);
                c.add(sum);
            }
        }
        if (k.isEmpty()) {
            throw new IllegalArgumentException("operation mix has no positive weight");
        }
        this.kinds = k.toArray(new OperationKind[0]);
        this.cumulative = c.stream().mapToDouble(Double::doubleValue).toArray();
        this.total = sum;
    }

    public OperationKind next() {
        return pick(ThreadLocalRandom.current().nextDouble(total));
    }

    /** Kind for a point in {@code [0, total)}. */
    OperationKind pick(double point) {
        for (int i = 0; i < cumulative.length; i++) {
            if (point < cumulative[i]) {
                return kinds[i];
            }
        }
        return kinds[kinds.length - 1];
    }
}
