package loadgrid.controlplane.findmax;

import java.util.List;

/**
 * Whether a step held every guardrail, and which ones it broke.
 */
public record StabilityVerdict(boolean stable, List<String> reasons) {

    public StabilityVerdict {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public static StabilityVerdict ok() {
        return new StabilityVerdict(true, List.of());
    }

    /** All broken guardrails joined with "; ", or null when stable. */
    public String reason() {
        return reasons.isEmpty() ? null : String.join("; ", reasons);
    }
}
