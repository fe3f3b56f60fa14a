package reportflow.engine.store;

import reportflow.engine.exception.StoreException;
import reportflow.engine.model.NotificationChannel;
import reportflow.engine.model.NotificationRecord;
import reportflow.engine.model.NotificationStatus;
import reportflow.engine.model.RunState;
import reportflow.engine.repository.NotificationRepository;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC implementation of NotificationRepository. Insert-only.
 */
public class JdbcNotificationRepository implements NotificationRepository {

    private final Database db;

    public JdbcNotificationRepository(Database db) {
        this.db = db;
    }

    @Override
    public void append(NotificationRecord record) {
        String sql = """
                    INSERT INTO notifications (id, run_id, channel, status, run_state, message, sent_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, record.id());
            ps.setString(2, record.runId());
            ps.setString(3, record.channel().name());
            ps.setString(4, record.status().name());
            ps.setString(5, record.runState().name());
            ps.setString(6, record.message());
            ps.setTimestamp(7, Timestamp.from(record.sentAt()));

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to append notification for run: " + record.runId(), e);
        }
    }

    @Override
    public List<NotificationRecord> findByRunId(String runId) {
        String sql = "SELECT * FROM notifications WHERE run_id = ? ORDER BY sent_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            List<NotificationRecord> records = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(new NotificationRecord(
                            rs.getString("id"),
                            rs.getString("run_id"),
                            NotificationChannel.valueOf(rs.getString("channel")),
                            NotificationStatus.valueOf(rs.getString("status")),
                            RunState.valueOf(rs.getString("run_state")),
                            rs.getString("message"),
                            rs.getTimestamp("sent_at").toInstant()));
                }
            }
            return records;
        } catch (SQLException e) {
            throw new StoreException("Failed to find notifications for run: " + runId, e);
        }
    }
}
