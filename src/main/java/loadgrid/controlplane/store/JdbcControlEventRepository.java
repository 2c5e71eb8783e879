package loadgrid.controlplane.store;

import loadgrid.controlplane.model.ControlCommand;
import loadgrid.controlplane.model.ControlEvent;
import loadgrid.controlplane.model.ControlEventType;
import loadgrid.controlplane.repository.ControlEventRepository;
import loadgrid.controlplane.util.Jsons;

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
 * JDBC implementation of ControlEventRepository.
 * Appends serialize on the run row lock, so concurrent appenders never
 * see the same {@code MAX(sequence)}.
 */
public class JdbcControlEventRepository implements ControlEventRepository {

    private final Database db;

    public JdbcControlEventRepository(Database db) {
        this.db = db;
    }

    @Override
    public ControlEvent append(String runId, ControlCommand command) {
        String lockSql = "SELECT run_id FROM run_status WHERE run_id = ? FOR UPDATE";
        String maxSql = "SELECT COALESCE(MAX(sequence), 0) FROM control_events WHERE run_id = ?";
        String insertSql = """
                    INSERT INTO control_events (run_id, sequence, event_type, event_data, created_at)
                    VALUES (?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(lockSql)) {
                ps.setString(1, runId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        conn.rollback();
                        throw new StoreException("Cannot append control event, run not found: " + runId);
                    }
                }
            }

            long sequence;
            try (PreparedStatement ps = conn.prepareStatement(maxSql)) {
                ps.setString(1, runId);
                try (ResultSet rs = ps.executeQuery()) {
                    rs.next();
                    sequence = rs.getLong(1) + 1;
                }
            }

            Instant now = Instant.now();
            try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                ps.setString(1, runId);
                ps.setLong(2, sequence);
                ps.setString(3, command.type().name());
                ps.setString(4, Jsons.toJson(command));
                ps.setTimestamp(5, Timestamp.from(now));
                ps.executeUpdate();
            }

            conn.commit();
            return new ControlEvent(runId, sequence, command, now);
        } catch (SQLException e) {
            throw new StoreException("Failed to append " + command.type() + " event to run: " + runId, e);
        }
    }

    @Override
    public List<ControlEvent> findAfter(String runId, long afterSequence) {
        String sql = "SELECT * FROM control_events WHERE run_id = ? AND sequence > ? ORDER BY sequence";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            ps.setLong(2, afterSequence);
            List<ControlEvent> events = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    events.add(mapRow(rs));
                }
            }
            return events;
        } catch (SQLException e) {
            throw new StoreException("Failed to read control events of run: " + runId, e);
        }
    }

    @Override
    public Optional<ControlEvent> findLatest(String runId, ControlEventType type) {
        String sql = """
                    SELECT * FROM control_events WHERE run_id = ? AND event_type = ?
                    ORDER BY sequence DESC LIMIT 1
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            ps.setString(2, type.name());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to read latest " + type + " event of run: " + runId, e);
        }
    }

    private ControlEvent mapRow(ResultSet rs) throws SQLException {
        ControlEventType type = ControlEventType.valueOf(rs.getString("event_type"));
        ControlCommand command = Jsons.fromJson(rs.getString("event_data"), type.payloadType());
        return new ControlEvent(rs.getString("run_id"), rs.getLong("sequence"), command,
                getInstant(rs, "created_at"));
    }
}
