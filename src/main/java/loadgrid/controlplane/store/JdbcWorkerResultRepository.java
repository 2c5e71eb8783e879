package loadgrid.controlplane.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import loadgrid.controlplane.model.FindMaxResult;
import loadgrid.controlplane.model.KindMetrics;
import loadgrid.controlplane.model.OperationKind;
import loadgrid.controlplane.model.StepRecord;
import loadgrid.controlplane.model.WorkerOutcome;
import loadgrid.controlplane.model.WorkerResult;
import loadgrid.controlplane.repository.WorkerResultRepository;
import loadgrid.controlplane.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static loadgrid.controlplane.store.JdbcSupport.getInstant;
import static loadgrid.controlplane.store.JdbcSupport.setTimestamp;

/**
 * JDBC implementation of WorkerResultRepository.
 */
public class JdbcWorkerResultRepository implements WorkerResultRepository {

    private static final TypeReference<Map<OperationKind, KindMetrics>> KIND_METRICS = new TypeReference<>() {
    };

    private final Database db;

    public JdbcWorkerResultRepository(Database db) {
        this.db = db;
    }

    @Override
    public void saveStep(String runId, String workerId, StepRecord step) {
        String sql = """
                    MERGE INTO worker_steps (run_id, worker_id, step_index, concurrency, qps, p95_latency_ms,
                                             p99_latency_ms, error_rate_pct, stable, stop_reason, is_backoff,
                                             kind_metrics, recorded_at)
                    KEY (run_id, worker_id, step_index)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            ps.setString(2, workerId);
            ps.setInt(3, step.stepIndex());
            ps.setInt(4, step.concurrency());
            ps.setDouble(5, step.qps());
            ps.setDouble(6, step.p95LatencyMs());
            ps.setDouble(7, step.p99LatencyMs());
            ps.setDouble(8, step.errorRatePct());
            ps.setBoolean(9, step.stable());
            ps.setString(10, step.stopReason());
            ps.setBoolean(11, step.backoff());
            ps.setString(12, Jsons.toJson(step.kindMetrics()));
            ps.setTimestamp(13, Timestamp.from(Instant.now()));

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to save step " + step.stepIndex() + " of worker: "
                    + runId + "/" + workerId, e);
        }
    }

    @Override
    public List<StepRecord> findSteps(String runId, String workerId) {
        String sql = "SELECT * FROM worker_steps WHERE run_id = ? AND worker_id = ? ORDER BY step_index";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            ps.setString(2, workerId);
            List<StepRecord> steps = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    steps.add(mapStep(rs));
                }
            }
            return steps;
        } catch (SQLException e) {
            throw new StoreException("Failed to find steps of worker: " + runId + "/" + workerId, e);
        }
    }

    @Override
    public Map<String, List<StepRecord>> findStepsByRun(String runId) {
        String sql = "SELECT * FROM worker_steps WHERE run_id = ? ORDER BY worker_id, step_index";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            Map<String, List<StepRecord>> byWorker = new LinkedHashMap<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    byWorker.computeIfAbsent(rs.getString("worker_id"), k -> new ArrayList<>()).add(mapStep(rs));
                }
            }
            return byWorker;
        } catch (SQLException e) {
            throw new StoreException("Failed to find steps of run: " + runId, e);
        }
    }

    @Override
    public void saveResult(WorkerResult result) {
        String sql = """
                    MERGE INTO worker_results (run_id, worker_id, node_id, outcome, total_operations,
                                               total_errors, error_message, find_max, finished_at)
                    KEY (run_id, worker_id)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, result.runId());
            ps.setString(2, result.workerId());
            ps.setString(3, result.nodeId());
            ps.setString(4, result.outcome().name());
            ps.setLong(5, result.totalOperations());
            ps.setLong(6, result.totalErrors());
            ps.setString(7, result.errorMessage());
            ps.setString(8, Jsons.toJson(result.findMax()));
            setTimestamp(ps, 9, result.finishedAt() != null ? result.finishedAt() : Instant.now());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to save result of worker: " + result.runId() + "/" + result.workerId(), e);
        }
    }

    @Override
    public Optional<WorkerResult> findResult(String runId, String workerId) {
        String sql = "SELECT * FROM worker_results WHERE run_id = ? AND worker_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            ps.setString(2, workerId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapResult(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to find result of worker: " + runId + "/" + workerId, e);
        }
    }

    @Override
    public List<WorkerResult> findResultsByRun(String runId) {
        String sql = "SELECT * FROM worker_results WHERE run_id = ? ORDER BY worker_id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            List<WorkerResult> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapResult(rs));
                }
            }
            return results;
        } catch (SQLException e) {
            throw new StoreException("Failed to find results of run: " + runId, e);
        }
    }

    private StepRecord mapStep(ResultSet rs) throws SQLException {
        return new StepRecord(
                rs.getInt("step_index"),
                rs.getInt("concurrency"),
                rs.getDouble("qps"),
                rs.getDouble("p95_latency_ms"),
                rs.getDouble("p99_latency_ms"),
                rs.getDouble("error_rate_pct"),
                rs.getBoolean("stable"),
                rs.getString("stop_reason"),
                rs.getBoolean("is_backoff"),
                parseKindMetrics(rs.getString("kind_metrics")));
    }

    private WorkerResult mapResult(ResultSet rs) throws SQLException {
        return new WorkerResult(
                rs.getString("run_id"),
                rs.getString("worker_id"),
                rs.getString("node_id"),
                WorkerOutcome.valueOf(rs.getString("outcome")),
                rs.getLong("total_operations"),
                rs.getLong("total_errors"),
                rs.getString("error_message"),
                Jsons.fromJson(rs.getString("find_max"), FindMaxResult.class),
                getInstant(rs, "finished_at"));
    }

    private static Map<OperationKind, KindMetrics> parseKindMetrics(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return Jsons.mapper().readValue(json, KIND_METRICS);
        } catch (JsonProcessingException e) {
            throw new StoreException("Corrupt kind_metrics column: " + json, e);
        }
    }
}
