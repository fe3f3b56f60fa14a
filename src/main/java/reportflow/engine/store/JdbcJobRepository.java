package reportflow.engine.store;

import reportflow.engine.exception.StoreException;
import reportflow.engine.model.Job;
import reportflow.engine.model.OutputFormat;
import reportflow.engine.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of JobRepository.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);

    private final Database db;

    public JdbcJobRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Job job) {
        String sql = """
                    INSERT INTO jobs (id, name, description, query_text, schedule_cron, output_format, is_active, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Instant createdAt = job.createdAt() != null ? job.createdAt() : Instant.now();
            ps.setString(1, job.id());
            ps.setString(2, job.name());
            ps.setString(3, job.description());
            ps.setString(4, job.query());
            ps.setString(5, job.schedule());
            ps.setString(6, job.outputFormat().name());
            ps.setBoolean(7, job.active());
            ps.setTimestamp(8, Timestamp.from(createdAt));
            ps.setTimestamp(9, Timestamp.from(job.updatedAt() != null ? job.updatedAt() : createdAt));

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved job: {}", job.id());
        } catch (SQLException e) {
            throw new StoreException("Failed to save job: " + job.id(), e);
        }
    }

    @Override
    public boolean update(Job job) {
        String sql = """
                    UPDATE jobs
                    SET name = ?, description = ?, query_text = ?, schedule_cron = ?, output_format = ?,
                        is_active = ?, updated_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, job.name());
            ps.setString(2, job.description());
            ps.setString(3, job.query());
            ps.setString(4, job.schedule());
            ps.setString(5, job.outputFormat().name());
            ps.setBoolean(6, job.active());
            ps.setTimestamp(7, Timestamp.from(job.updatedAt() != null ? job.updatedAt() : Instant.now()));
            ps.setString(8, job.id());

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to update job: " + job.id(), e);
        }
    }

    @Override
    public Optional<Job> findById(String jobId) {
        String sql = "SELECT * FROM jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to find job: " + jobId, e);
        }
    }

    @Override
    public List<Job> findAll(int offset, int limit) {
        String sql = "SELECT * FROM jobs ORDER BY created_at, id LIMIT ? OFFSET ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            ps.setInt(2, offset);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to list jobs", e);
        }
    }

    @Override
    public List<Job> findActive() {
        String sql = "SELECT * FROM jobs WHERE is_active = TRUE ORDER BY created_at, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find active jobs", e);
        }
    }

    @Override
    public String generateId() {
        return "job-" + UUID.randomUUID().toString().substring(0, 8);
    }

    // --- Helpers ---

    private List<Job> executeQuery(PreparedStatement ps) throws SQLException {
        List<Job> jobs = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                jobs.add(mapRow(rs));
            }
        }
        return jobs;
    }

    private Job mapRow(ResultSet rs) throws SQLException {
        return Job.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .description(rs.getString("description"))
                .query(rs.getString("query_text"))
                .schedule(rs.getString("schedule_cron"))
                .outputFormat(OutputFormat.parse(rs.getString("output_format")).orElse(OutputFormat.CSV))
                .active(rs.getBoolean("is_active"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }

    private Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
