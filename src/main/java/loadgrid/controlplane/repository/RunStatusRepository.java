package loadgrid.controlplane.repository;

import loadgrid.controlplane.model.Run;
import loadgrid.controlplane.model.RunStatus;
import loadgrid.controlplane.model.RunSummary;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for {@code run_status} rows.
 * Every write commits immediately; every read hits the store.
 */
public interface RunStatusRepository {

    /**
     * Insert a new run.
     *
     * @param run the run to create
     * @throws loadgrid.controlplane.store.StoreException if the id already exists
     */
    void create(Run run);

    /**
     * Find a run by ID.
     *
     * @param runId the run ID
     * @return the run if found
     */
    Optional<Run> findById(String runId);

    /**
     * Find runs whose status is one of the given values.
     *
     * @param statuses status filter
     * @return runs ordered by creation time
     */
    List<Run> findByStatusIn(Collection<RunStatus> statuses);

    /**
     * Conditional status write: {@code UPDATE ... WHERE status = expected}.
     *
     * @return true if the row was updated
     */
    boolean compareAndSetStatus(String runId, RunStatus expected, RunStatus next);

    /**
     * Conditional write of status and phase together. Sets {@code end_time}
     * when {@code next} is terminal.
     *
     * @param failureMessage stored when non-null
     * @return true if the row was updated
     */
    boolean compareAndSetStatusAndPhase(String runId, RunStatus expected, RunStatus next, String phase,
            String failureMessage);

    /**
     * Conditional phase write: {@code UPDATE ... WHERE phase = expectedPhase}.
     *
     * @return true if the row was updated
     */
    boolean compareAndSetPhase(String runId, String expectedPhase, String nextPhase);

    /**
     * Record the run start. Applies only while {@code start_time} is still unset.
     *
     * @return true if this call set the start time
     */
    boolean markStarted(String runId, Instant startTime, String phase);

    /**
     * Store the heartbeat roll-up counters.
     */
    void updateWorkerCounts(String runId, int registered, int active, int completed);

    /**
     * Store the final run summary.
     */
    void saveSummary(String runId, RunSummary summary);
}
