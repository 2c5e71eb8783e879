package loadgrid.controlplane.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable view of one {@code run_status} row.
 * Status and phase are kept as stored strings; typed access goes through
 * {@link #status()} and {@link #phase()}.
 */
public final class Run {
    private final String runId;
    private final RunStatus status;
    private final String phase;
    private final ScenarioConfig scenario;
    private final int workersExpected;
    private final int workersRegistered;
    private final int workersActive;
    private final int workersCompleted;
    private final Instant startTime;
    private final Instant endTime;
    private final String failureMessage;
    private final RunSummary summary;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Run(Builder builder) {
        this.runId = Objects.requireNonNull(builder.runId, "runId is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.phase = Objects.requireNonNull(builder.phase, "phase is required");
        this.scenario = builder.scenario;
        this.workersExpected = builder.workersExpected;
        this.workersRegistered = builder.workersRegistered;
        this.workersActive = builder.workersActive;
        this.workersCompleted = builder.workersCompleted;
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.failureMessage = builder.failureMessage;
        this.summary = builder.summary;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    public String runId() {
        return runId;
    }

    public RunStatus status() {
        return status;
    }

    /** Phase exactly as stored (may be an alias such as MEASUREMENT). */
    public String phaseValue() {
        return phase;
    }

    public RunPhase phase() {
        return RunPhase.fromWire(phase);
    }

    public ScenarioConfig scenario() {
        return scenario;
    }

    public int workersExpected() {
        return workersExpected;
    }

    public int workersRegistered() {
        return workersRegistered;
    }

    public int workersActive() {
        return workersActive;
    }

    public int workersCompleted() {
        return workersCompleted;
    }

    public Instant startTime() {
        return startTime;
    }

    public Instant endTime() {
        return endTime;
    }

    public String failureMessage() {
        return failureMessage;
    }

    public RunSummary summary() {
        return summary;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Builder toBuilder() {
        return new Builder()
                .runId(runId)
                .status(status)
                .phase(phase)
                .scenario(scenario)
                .workersExpected(workersExpected)
                .workersRegistered(workersRegistered)
                .workersActive(workersActive)
                .workersCompleted(workersCompleted)
                .startTime(startTime)
                .endTime(endTime)
                .failureMessage(failureMessage)
                .summary(summary)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String runId;
        private RunStatus status = RunStatus.PREPARED;
        private String phase = RunPhase.PREPARING.name();
        private ScenarioConfig scenario;
        private int workersExpected = 1;
        private int workersRegistered;
        private int workersActive;
        private int workersCompleted;
        private Instant startTime;
        private Instant endTime;
        private String failureMessage;
        private RunSummary summary;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder status(RunStatus status) {
            this.status = status;
            return this;
        }

        public Builder phase(String phase) {
            this.phase = phase;
            return this;
        }

        public Builder phase(RunPhase phase) {
            this.phase = phase.name();
            return this;
        }

        public Builder scenario(ScenarioConfig scenario) {
            this.scenario = scenario;
            return this;
        }

        public Builder workersExpected(int workersExpected) {
            this.workersExpected = workersExpected;
            return this;
        }

        public Builder workersRegistered(int workersRegistered) {
            this.workersRegistered = workersRegistered;
            return this;
        }

        public Builder workersActive(int workersActive) {
            this.workersActive = workersActive;
            return this;
        }

        public Builder workersCompleted(int workersCompleted) {
            this.workersCompleted = workersCompleted;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder failureMessage(String failureMessage) {
            this.failureMessage = failureMessage;
            return this;
        }

        public Builder summary(RunSummary summary) {
            this.summary = summary;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Run build() {
            return new Run(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Run run))
            return false;
        return Objects.equals(runId, run.runId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(runId);
    }

    @Override
    public String toString() {
        return "Run{id='" + runId + "', status=" + status + ", phase=" + phase
                + ", workers=" + workersRegistered + "/" + workersExpected + "}";
    }
}
