package loadgrid.controlplane.worker;

/**
 * Outcome of one operation against the target system.
 */
public record OperationResult(double latencyMs, boolean success, String error) {

    public static OperationResult success(double latencyMs) {
        return new OperationResult(latencyMs, true, null);
    }

    public static OperationResult failure(double latencyMs, String error) {
        return new OperationResult(latencyMs, false, error);
    }
}
