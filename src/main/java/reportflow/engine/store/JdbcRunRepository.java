package reportflow.engine.store;

import reportflow.engine.exception.StoreException;
import reportflow.engine.model.Run;
import reportflow.engine.model.RunState;
import reportflow.engine.model.RunTrigger;
import reportflow.engine.repository.RunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of RunRepository.
 *
 * Updates only touch rows that are not yet terminal, so a terminal run can
 * never be rewritten; repeating the same terminal update is a no-op.
 */
public class JdbcRunRepository implements RunRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcRunRepository.class);

    private final Database db;

    public JdbcRunRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Run run) {
        String sql = """
                    INSERT INTO runs (id, job_id, trigger_type, state, started_at, finished_at, row_count, artifact_path, error_message)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, run.id());
            ps.setString(2, run.jobId());
            ps.setString(3, run.trigger().name());
            ps.setString(4, run.state().name());
            ps.setTimestamp(5, Timestamp.from(run.startedAt()));
            setTimestampOrNull(ps, 6, run.finishedAt());
            setIntOrNull(ps, 7, run.rowCount());
            ps.setString(8, run.artifactPath());
            ps.setString(9, run.error());

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved run {} for job {}", run.id(), run.jobId());
        } catch (SQLException e) {
            throw new StoreException("Failed to save run: " + run.id(), e);
        }
    }

    @Override
    public void update(Run run) {
        String sql = """
                    UPDATE runs
                    SET state = ?, finished_at = ?, row_count = ?, artifact_path = ?, error_message = ?
                    WHERE id = ? AND state NOT IN ('SUCCESS', 'FAILED')
                """;

        int updated;
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, run.state().name());
            setTimestampOrNull(ps, 2, run.finishedAt());
            setIntOrNull(ps, 3, run.rowCount());
            ps.setString(4, run.artifactPath());
            ps.setString(5, run.error());
            ps.setString(6, run.id());

            updated = ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to update run: " + run.id(), e);
        }

        if (updated > 0) {
            log.debug("Run {} -> {}", run.id(), run.state());
            return;
        }

        // Nothing updated: either unknown or already terminal
        Run stored = findById(run.id())
                .orElseThrow(() -> new StoreException("Run not found: " + run.id()));
        if (stored.sameOutcome(run)) {
            log.debug("Run {} already {} (idempotent)", run.id(), stored.state());
            return;
        }
        throw new IllegalStateException(
                "Run " + run.id() + " is terminal (" + stored.state() + "); cannot change to " + run.state());
    }

    @Override
    public Optional<Run> findById(String runId) {
        String sql = "SELECT * FROM runs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to find run: " + runId, e);
        }
    }

    @Override
    public List<Run> findByJobId(String jobId, int offset, int limit) {
        String sql = "SELECT * FROM runs WHERE job_id = ? ORDER BY started_at DESC, id LIMIT ? OFFSET ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ps.setInt(2, limit);
            ps.setInt(3, offset);

            List<Run> runs = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    runs.add(mapRow(rs));
                }
            }
            return runs;
        } catch (SQLException e) {
            throw new StoreException("Failed to find runs for job: " + jobId, e);
        }
    }

    @Override
    public String generateId() {
        return "run-" + UUID.randomUUID();
    }

    // --- Helpers ---

    private Run mapRow(ResultSet rs) throws SQLException {
        int rowCount = rs.getInt("row_count");
        Integer rowCountOrNull = rs.wasNull() ? null : rowCount;

        return Run.builder()
                .id(rs.getString("id"))
                .jobId(rs.getString("job_id"))
                .trigger(RunTrigger.valueOf(rs.getString("trigger_type")))
                .state(RunState.valueOf(rs.getString("state")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .finishedAt(toInstant(rs.getTimestamp("finished_at")))
                .rowCount(rowCountOrNull)
                .artifactPath(rs.getString("artifact_path"))
                .error(rs.getString("error_message"))
                .build();
    }

    private Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private void setTimestampOrNull(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value != null) {
            ps.setTimestamp(index, Timestamp.from(value));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }

    private void setIntOrNull(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value != null) {
            ps.setInt(index, value);
        } else {
            ps.setNull(index, Types.INTEGER);
        }
    }
}
