package loadgrid.controlplane.store;

import loadgrid.controlplane.model.Run;
import loadgrid.controlplane.model.RunStatus;
import loadgrid.controlplane.model.RunSummary;
import loadgrid.controlplane.model.ScenarioConfig;
import loadgrid.controlplane.repository.RunStatusRepository;
import loadgrid.controlplane.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static loadgrid.controlplane.store.JdbcSupport.getInstant;
import static loadgrid.controlplane.store.JdbcSupport.setTimestamp;

/**
 * JDBC implementation of RunStatusRepository.
 */
public class JdbcRunStatusRepository implements RunStatusRepository {

    private final Database db;

    public JdbcRunStatusRepository(Database db) {
        this.db = db;
    }

    @Override
    public void create(Run run) {
        String sql = """
                    INSERT INTO run_status (run_id, status, phase, scenario_config, workers_expected,
                                            workers_registered, workers_active, workers_completed,
                                            start_time, end_time, failure_message, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Instant now = Instant.now();
            ps.setString(1, run.runId());
            ps.setString(2, run.status().name());
            ps.setString(3, run.phaseValue());
            ps.setString(4, Jsons.toJson(run.scenario()));
            ps.setInt(5, run.workersExpected());
            ps.setInt(6, run.workersRegistered());
            ps.setInt(7, run.workersActive());
            ps.setInt(8, run.workersCompleted());
            setTimestamp(ps, 9, run.startTime());
            setTimestamp(ps, 10, run.endTime());
            ps.setString(11, run.failureMessage());
            setTimestamp(ps, 12, run.createdAt() != null ? run.createdAt() : now);
            setTimestamp(ps, 13, now);

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to create run: " + run.runId(), e);
        }
    }

    @Override
    public Optional<Run> findById(String runId) {
        String sql = "SELECT * FROM run_status WHERE run_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to find run: " + runId, e);
        }
    }

    @Override
    public List<Run> findByStatusIn(Collection<RunStatus> statuses) {
        if (statuses.isEmpty()) {
            return Collections.emptyList();
        }
        String placeholders = String.join(", ", Collections.nCopies(statuses.size(), "?"));
        String sql = "SELECT * FROM run_status WHERE status IN (" + placeholders + ") ORDER BY created_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int i = 1;
            for (RunStatus status : statuses) {
                ps.setString(i++, status.name());
            }
            List<Run> runs = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    runs.add(mapRow(rs));
                }
            }
            return runs;
        } catch (SQLException e) {
            throw new StoreException("Failed to find runs by status: " + statuses, e);
        }
    }

    @Override
    public boolean compareAndSetStatus(String runId, RunStatus expected, RunStatus next) {
        String sql = "UPDATE run_status SET status = ?, updated_at = ? WHERE run_id = ? AND status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, next.name());
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.setString(3, runId);
            ps.setString(4, expected.name());

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to update status of run: " + runId, e);
        }
    }

    @Override
    public boolean compareAndSetStatusAndPhase(String runId, RunStatus expected, RunStatus next, String phase,
            String failureMessage) {
        String sql = """
                    UPDATE run_status
                    SET status = ?, phase = ?, updated_at = ?,
                        end_time = COALESCE(?, end_time),
                        failure_message = COALESCE(?, failure_message)
                    WHERE run_id = ? AND status = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp now = Timestamp.from(Instant.now());
            ps.setString(1, next.name());
            ps.setString(2, phase);
            ps.setTimestamp(3, now);
            setTimestamp(ps, 4, next.isTerminal() ? now.toInstant() : null);
            ps.setString(5, failureMessage);
            ps.setString(6, runId);
            ps.setString(7, expected.name());

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to update status and phase of run: " + runId, e);
        }
    }

    @Override
    public boolean compareAndSetPhase(String runId, String expectedPhase, String nextPhase) {
        String sql = "UPDATE run_status SET phase = ?, updated_at = ? WHERE run_id = ? AND phase = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, nextPhase);
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.setString(3, runId);
            ps.setString(4, expectedPhase);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to update phase of run: " + runId, e);
        }
    }

    @Override
    public boolean markStarted(String runId, Instant startTime, String phase) {
        String sql = """
                    UPDATE run_status SET start_time = ?, phase = ?, updated_at = ?
                    WHERE run_id = ? AND start_time IS NULL
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(startTime));
            ps.setString(2, phase);
            ps.setTimestamp(3, Timestamp.from(Instant.now()));
            ps.setString(4, runId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to mark run started: " + runId, e);
        }
    }

    @Override
    public void updateWorkerCounts(String runId, int registered, int active, int completed) {
        String sql = """
                    UPDATE run_status
                    SET workers_registered = ?, workers_active = ?, workers_completed = ?
                    WHERE run_id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, registered);
            ps.setInt(2, active);
            ps.setInt(3, completed);
            ps.setString(4, runId);

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to update worker counts of run: " + runId, e);
        }
    }

    @Override
    public void saveSummary(String runId, RunSummary summary) {
        String sql = "UPDATE run_status SET summary = ?, updated_at = ? WHERE run_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, Jsons.toJson(summary));
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.setString(3, runId);

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to save summary of run: " + runId, e);
        }
    }

    private Run mapRow(ResultSet rs) throws SQLException {
        return Run.builder()
                .runId(rs.getString("run_id"))
                .status(RunStatus.fromWire(rs.getString("status")))
                .phase(rs.getString("phase"))
                .scenario(Jsons.fromJson(rs.getString("scenario_config"), ScenarioConfig.class))
                .workersExpected(rs.getInt("workers_expected"))
                .workersRegistered(rs.getInt("workers_registered"))
                .workersActive(rs.getInt("workers_active"))
                .workersCompleted(rs.getInt("workers_completed"))
                .startTime(getInstant(rs, "start_time"))
                .endTime(getInstant(rs, "end_time"))
                .failureMessage(rs.getString("failure_message"))
                .summary(Jsons.fromJson(rs.getString("summary"), RunSummary.class))
                .createdAt(getInstant(rs, "created_at"))
                .updatedAt(getInstant(rs, "updated_at"))
                .build();
    }
}
