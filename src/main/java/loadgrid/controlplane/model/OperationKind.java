package loadgrid.controlplane.model;

/**
 * Kind of operation a simulated client sends to the target system.
 */
public enum OperationKind {
    POINT_LOOKUP("Point Lookup"),
    RANGE_SCAN("Range Scan"),
    INSERT("Insert"),
    UPDATE("Update");

    private final String label;

    OperationKind(String label) {
        this.label = label;
    }

    /** Human readable name used in stop reasons. */
    public String label() {
        return label;
    }
}
