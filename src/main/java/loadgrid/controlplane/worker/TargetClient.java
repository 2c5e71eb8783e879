package loadgrid.controlplane.worker;

import loadgrid.controlplane.model.OperationKind;

/**
 * Client of the system under test. Implementations execute one operation
 * and report its latency; they should return a failed result rather than throw.
 */
public interface TargetClient {

    OperationResult execute(OperationKind kind, String key);
}
