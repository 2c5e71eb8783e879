package loadgrid.controlplane.store;

import loadgrid.controlplane.model.WorkerHeartbeat;
import loadgrid.controlplane.model.WorkerStatus;
import loadgrid.controlplane.repository.HeartbeatRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static loadgrid.controlplane.store.JdbcSupport.getInstant;

/**
 * JDBC implementation of HeartbeatRepository.
 */
public class JdbcHeartbeatRepository implements HeartbeatRepository {

    private final Database db;

    public JdbcHeartbeatRepository(Database db) {
        this.db = db;
    }

    @Override
    public void upsert(WorkerHeartbeat hb) {
        // UPDATE + INSERT pattern (more portable than MERGE with an increment)
        String updateSql = """
                    UPDATE worker_heartbeats
                    SET node_id = ?, status = ?, phase = ?, last_heartbeat = ?,
                        heartbeat_count = heartbeat_count + 1,
                        active_connections = ?, target_connections = ?,
                        queries_processed = ?, error_count = ?, last_error = ?
                    WHERE run_id = ? AND worker_id = ?
                """;

        String insertSql = """
                    INSERT INTO worker_heartbeats (run_id, worker_id, node_id, status, phase, last_heartbeat,
                                                   heartbeat_count, active_connections, target_connections,
                                                   queries_processed, error_count, last_error, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, 1, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            Timestamp now = Timestamp.from(Instant.now());

            try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                ps.setString(1, hb.nodeId());
                ps.setString(2, hb.status().name());
                ps.setString(3, hb.phase());
                ps.setTimestamp(4, now);
                ps.setInt(5, hb.activeConnections());
                ps.setInt(6, hb.targetConnections());
                ps.setLong(7, hb.queriesProcessed());
                ps.setLong(8, hb.errorCount());
                ps.setString(9, hb.lastError());
                ps.setString(10, hb.runId());
                ps.setString(11, hb.workerId());

                int updated = ps.executeUpdate();

                if (updated == 0) {
                    try (PreparedStatement insertPs = conn.prepareStatement(insertSql)) {
                        insertPs.setString(1, hb.runId());
                        insertPs.setString(2, hb.workerId());
                        insertPs.setString(3, hb.nodeId());
                        insertPs.setString(4, hb.status().name());
                        insertPs.setString(5, hb.phase());
                        insertPs.setTimestamp(6, now);
                        insertPs.setInt(7, hb.activeConnections());
                        insertPs.setInt(8, hb.targetConnections());
                        insertPs.setLong(9, hb.queriesProcessed());
                        insertPs.setLong(10, hb.errorCount());
                        insertPs.setString(11, hb.lastError());
                        insertPs.setTimestamp(12, now);
                        insertPs.executeUpdate();
                    }
                }
            }

            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to update heartbeat for worker: " + hb.runId() + "/" + hb.workerId(), e);
        }
    }

    @Override
    public Optional<WorkerHeartbeat> find(String runId, String workerId) {
        String sql = "SELECT * FROM worker_heartbeats WHERE run_id = ? AND worker_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            ps.setString(2, workerId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to find heartbeat: " + runId + "/" + workerId, e);
        }
    }

    @Override
    public List<WorkerHeartbeat> findByRun(String runId) {
        String sql = "SELECT * FROM worker_heartbeats WHERE run_id = ? ORDER BY worker_id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            List<WorkerHeartbeat> result = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapRow(rs));
                }
            }
            return result;
        } catch (SQLException e) {
            throw new StoreException("Failed to find heartbeats of run: " + runId, e);
        }
    }

    @Override
    public int deleteByRun(String runId) {
        String sql = "DELETE FROM worker_heartbeats WHERE run_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted;
        } catch (SQLException e) {
            throw new StoreException("Failed to delete heartbeats of run: " + runId, e);
        }
    }

    private WorkerHeartbeat mapRow(ResultSet rs) throws SQLException {
        return WorkerHeartbeat.builder()
                .runId(rs.getString("run_id"))
                .workerId(rs.getString("worker_id"))
                .nodeId(rs.getString("node_id"))
                .status(WorkerStatus.valueOf(rs.getString("status")))
                .phase(rs.getString("phase"))
                .lastHeartbeat(getInstant(rs, "last_heartbeat"))
                .heartbeatCount(rs.getLong("heartbeat_count"))
                .activeConnections(rs.getInt("active_connections"))
                .targetConnections(rs.getInt("target_connections"))
                .queriesProcessed(rs.getLong("queries_processed"))
                .errorCount(rs.getLong("error_count"))
                .lastError(rs.getString("last_error"))
                .build();
    }
}
