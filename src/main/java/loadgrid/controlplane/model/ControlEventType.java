package loadgrid.controlplane.model;

/**
 * Kind of a control event, as stored in {@code control_events.event_type}.
 * Each type is bound to the payload class its {@code event_data} decodes into.
 */
public enum ControlEventType {
    /** Move the run to another phase */
    SET_PHASE(ControlCommand.SetPhase.class),
    /** Change a worker's target concurrency */
    SCALE_TO(ControlCommand.ScaleTo.class),
    /** Drain and stop all workers */
    STOP(ControlCommand.Stop.class);

    private final Class<? extends ControlCommand> payloadType;

    ControlEventType(Class<? extends ControlCommand> payloadType) {
        this.payloadType = payloadType;
    }

    public Class<? extends ControlCommand> payloadType() {
        return payloadType;
    }
}
