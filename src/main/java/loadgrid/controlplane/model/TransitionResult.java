package loadgrid.controlplane.model;

/**
 * Result of a conditional status write.
 */
public enum TransitionResult {
    /** The row matched the expected status and was updated */
    APPLIED,

    /**
     * The row already holds the target status (someone else advanced it) -
     * idempotent success
     */
    ALREADY_APPLIED,

    /** The row holds a different status; the transition was not made */
    CONFLICT,

    /** The rank table forbids the transition */
    REJECTED,

    /** Run not found */
    NOT_FOUND;

    /** True when the row now holds the requested status */
    public boolean succeeded() {
        return this == APPLIED || this == ALREADY_APPLIED;
    }
}
