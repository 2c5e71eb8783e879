package loadgrid.controlplane.worker;

import loadgrid.controlplane.model.OperationKind;
import org.junit.jupiter.api.*;

import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OperationMixTest {

    @Test
    void pickFollowsCumulativeWeights() {
        OperationMix mix = new OperationMix(Map.of(
                OperationKind.POINT_LOOKUP, 70.0,
                OperationKind.INSERT, 30.0));

        assertEquals(OperationKind.POINT_LOOKUP, mix.pick(0.0));
        assertEquals(OperationKind.POINT_LOOKUP, mix.pick(69.9));
        assertEquals(OperationKind.INSERT, mix.pick(70.0));
        assertEquals(OperationKind.INSERT, mix.pick(99.9));
    }

    @Test
    void zeroWeightKindsAreNeverPicked() {
        Map<OperationKind, Double> weights = new EnumMap<>(OperationKind.class);
        weights.put(OperationKind.RANGE_SCAN, 0.0);
        weights.put(OperationKind.UPDATE, 1.0);
        OperationMix mix = new OperationMix(weights);

        for (int i = 0; i < 1000; i++) {
            assertEquals(OperationKind.UPDATE, mix.next());
        }
    }

    @Test
    void emptyMixIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new OperationMix(Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> new OperationMix(Map.of(OperationKind.INSERT, 0.0)));
    }
}
