package cockpit.jobs.store;

import cockpit.jobs.model.JobRun;
import cockpit.jobs.model.Page;
import cockpit.jobs.model.RunErrorCode;
import cockpit.jobs.model.RunQuery;
import cockpit.jobs.model.RunStatus;
import cockpit.jobs.model.TransitionResult;
import cockpit.jobs.repository.JobRunRepository;
import cockpit.jobs.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of JobRunRepository.
 * Every transition is a single conditional UPDATE guarded by the current
 * status, so concurrent writers cannot move a run out of a terminal state.
 */
public class JdbcJobRunRepository implements JobRunRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRunRepository.class);

    private static final int MAX_ERROR_MESSAGE = 2048;

    private final Database db;

    public JdbcJobRunRepository(Database db) {
        this.db = db;
    }

    @Override
    public boolean insert(JobRun run) {
        String sql = """
                    INSERT INTO job_runs (id, job_schedule_id, job_template_id, external_task_id, job_name, job_type,
                                          status, triggered_by, scheduled_for, queued_at, parameters, target_devices)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, run.id());
            ps.setString(2, run.scheduleId());
            ps.setString(3, run.templateId());
            ps.setString(4, run.externalTaskId());
            ps.setString(5, run.jobName());
            ps.setString(6, run.jobType());
            ps.setString(7, run.status().name());
            ps.setString(8, run.triggeredBy());
            SqlTimes.set(ps, 9, run.scheduledFor());
            SqlTimes.set(ps, 10, run.queuedAt() != null ? run.queuedAt() : Instant.now());
            ps.setString(11, Json.write(run.parameters()));
            ps.setString(12, Json.write(run.targetDevices()));

            ps.executeUpdate();
            conn.commit();

            log.debug("Inserted run: {} ({})", run.id(), run.jobType());
            return true;
        } catch (SQLException e) {
            if (Database.isUniqueViolation(e) && run.scheduleId() != null) {
                log.debug("Run for schedule {} at {} already exists", run.scheduleId(), run.scheduledFor());
                return false;
            }
            throw new RuntimeException("Failed to insert run: " + run.id(), e);
        }
    }

    @Override
    public Optional<JobRun> findById(String runId) {
        String sql = "SELECT * FROM job_runs WHERE id = ?";

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
            throw new RuntimeException("Failed to find run: " + runId, e);
        }
    }

    @Override
    public Optional<JobRun> findByOccurrence(String scheduleId, Instant scheduledFor) {
        String sql = "SELECT * FROM job_runs WHERE job_schedule_id = ? AND scheduled_for = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, scheduleId);
            SqlTimes.set(ps, 2, scheduledFor);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find run for schedule: " + scheduleId, e);
        }
    }

    @Override
    public Page<JobRun> query(RunQuery query) {
        StringBuilder where = new StringBuilder(" WHERE 1 = 1");
        List<Object> args = new ArrayList<>();

        if (query.status() != null) {
            where.append(" AND status = ?");
            args.add(query.status().name());
        }
        if (query.templateId() != null) {
            where.append(" AND job_template_id = ?");
            args.add(query.templateId());
        }
        if (query.scheduleId() != null) {
            where.append(" AND job_schedule_id = ?");
            args.add(query.scheduleId());
        }
        if (query.queuedFrom() != null) {
            where.append(" AND queued_at >= ?");
            args.add(SqlTimes.param(query.queuedFrom()));
        }
        if (query.queuedTo() != null) {
            where.append(" AND queued_at <= ?");
            args.add(SqlTimes.param(query.queuedTo()));
        }

        try (Connection conn = db.getConnection()) {
            long total;
            try (PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM job_runs" + where)) {
                bind(ps, args);
                try (ResultSet rs = ps.executeQuery()) {
                    rs.next();
                    total = rs.getLong(1);
                }
            }

            List<JobRun> items = new ArrayList<>();
            String sql = "SELECT * FROM job_runs" + where + " ORDER BY queued_at DESC, id LIMIT ? OFFSET ?";
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                bind(ps, args);
                ps.setInt(args.size() + 1, query.pageSize());
                ps.setLong(args.size() + 2, query.offset());
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        items.add(mapRow(rs));
                    }
                }
            }
            return new Page<>(items, total, query.page(), query.pageSize());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to query runs", e);
        }
    }

    @Override
    public boolean recordExternalTaskId(String runId, String externalTaskId) {
        // Not guarded by status: a fast worker may already have started the run
        String sql = "UPDATE job_runs SET external_task_id = ? WHERE id = ? AND external_task_id IS NULL";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, externalTaskId);
            ps.setString(2, runId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record task id for run: " + runId, e);
        }
    }

    @Override
    public TransitionResult markStarted(String runId, String executedBy, Instant now) {
        String sql = """
                    UPDATE job_runs
                    SET status = 'RUNNING',
                        attempts = attempts + 1,
                        started_at = COALESCE(started_at, ?),
                        heartbeat_at = ?,
                        executed_by = ?
                    WHERE id = ? AND status IN ('QUEUED', 'RUNNING')
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            SqlTimes.set(ps, 1, now);
            SqlTimes.set(ps, 2, now);
            ps.setString(3, executedBy);
            ps.setString(4, runId);
            return finish(conn, ps.executeUpdate(), runId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark run started: " + runId, e);
        }
    }

    @Override
    public TransitionResult markSucceeded(String runId, Map<String, Object> result, Instant now) {
        String sql = """
                    UPDATE job_runs
                    SET status = 'SUCCEEDED', completed_at = ?, heartbeat_at = ?, result = ?
                    WHERE id = ? AND status = 'RUNNING'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            SqlTimes.set(ps, 1, now);
            SqlTimes.set(ps, 2, now);
            ps.setString(3, Json.write(result));
            ps.setString(4, runId);
            return finish(conn, ps.executeUpdate(), runId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark run succeeded: " + runId, e);
        }
    }

    @Override
    public TransitionResult markFailed(String runId, RunErrorCode code, String message, Map<String, Object> result,
            Instant now) {
        String sql = """
                    UPDATE job_runs
                    SET status = 'FAILED', completed_at = ?, error_code = ?, error_message = ?,
                        result = COALESCE(CAST(? AS CLOB), result)
                    WHERE id = ? AND status IN ('QUEUED', 'RUNNING')
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            SqlTimes.set(ps, 1, now);
            ps.setString(2, code.code());
            ps.setString(3, truncate(message));
            ps.setString(4, Json.write(result));
            ps.setString(5, runId);
            return finish(conn, ps.executeUpdate(), runId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark run failed: " + runId, e);
        }
    }

    @Override
    public TransitionResult markCancelled(String runId, Map<String, Object> result, Instant now) {
        String sql = """
                    UPDATE job_runs
                    SET status = 'CANCELLED', completed_at = ?, error_code = ?, error_message = ?,
                        result = COALESCE(CAST(? AS CLOB), result)
                    WHERE id = ? AND status IN ('QUEUED', 'RUNNING')
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            SqlTimes.set(ps, 1, now);
            ps.setString(2, RunErrorCode.CANCELLED.code());
            ps.setString(3, "Run cancelled");
            ps.setString(4, Json.write(result));
            ps.setString(5, runId);
            return finish(conn, ps.executeUpdate(), runId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark run cancelled: " + runId, e);
        }
    }

    @Override
    public boolean requestCancel(String runId) {
        String sql = "UPDATE job_runs SET cancel_requested = TRUE WHERE id = ? AND status = 'RUNNING'";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to request cancel for run: " + runId, e);
        }
    }

    @Override
    public boolean isCancelRequested(String runId) {
        String sql = "SELECT cancel_requested FROM job_runs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read cancel flag for run: " + runId, e);
        }
    }

    @Override
    public boolean heartbeat(String runId, Instant now) {
        String sql = "UPDATE job_runs SET heartbeat_at = ? WHERE id = ? AND status = 'RUNNING'";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            SqlTimes.set(ps, 1, now);
            ps.setString(2, runId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to heartbeat run: " + runId, e);
        }
    }

    @Override
    public List<JobRun> findStale(Instant lastSeenBefore) {
        String sql = """
                    SELECT * FROM job_runs
                    WHERE status IN ('QUEUED', 'RUNNING')
                      AND COALESCE(heartbeat_at, started_at, queued_at) < ?
                    ORDER BY queued_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            SqlTimes.set(ps, 1, lastSeenBefore);
            List<JobRun> runs = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    runs.add(mapRow(rs));
                }
            }
            return runs;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find stale runs", e);
        }
    }

    @Override
    public int countByStatus(RunStatus status) {
        String sql = "SELECT COUNT(*) FROM job_runs WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count runs by status", e);
        }
    }

    @Override
    public String generateId() {
        return "run-" + UUID.randomUUID().toString().substring(0, 12);
    }

    // --- Helpers ---

    /**
     * Commit a conditional update and explain a miss by looking at the row.
     */
    private TransitionResult finish(Connection conn, int updated, String runId) throws SQLException {
        if (updated > 0) {
            conn.commit();
            return TransitionResult.APPLIED;
        }

        try (PreparedStatement ps = conn.prepareStatement("SELECT status FROM job_runs WHERE id = ?")) {
            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                conn.commit();
                if (!rs.next()) {
                    return TransitionResult.NOT_FOUND;
                }
                RunStatus current = RunStatus.valueOf(rs.getString(1));
                return current.isTerminal() ? TransitionResult.ALREADY_TERMINAL : TransitionResult.INVALID_STATE;
            }
        }
    }

    private void bind(PreparedStatement ps, List<Object> args) throws SQLException {
        for (int i = 0; i < args.size(); i++) {
            ps.setObject(i + 1, args.get(i));
        }
    }

    private JobRun mapRow(ResultSet rs) throws SQLException {
        return JobRun.builder()
                .id(rs.getString("id"))
                .scheduleId(rs.getString("job_schedule_id"))
                .templateId(rs.getString("job_template_id"))
                .externalTaskId(rs.getString("external_task_id"))
                .jobName(rs.getString("job_name"))
                .jobType(rs.getString("job_type"))
                .status(RunStatus.valueOf(rs.getString("status")))
                .triggeredBy(rs.getString("triggered_by"))
                .scheduledFor(SqlTimes.get(rs, "scheduled_for"))
                .queuedAt(SqlTimes.get(rs, "queued_at"))
                .startedAt(SqlTimes.get(rs, "started_at"))
                .completedAt(SqlTimes.get(rs, "completed_at"))
                .errorCode(RunErrorCode.fromCode(rs.getString("error_code")))
                .errorMessage(rs.getString("error_message"))
                .result(Json.readMap(rs.getString("result")))
                .parameters(Json.readMap(rs.getString("parameters")))
                .targetDevices(Json.readStringList(rs.getString("target_devices")))
                .executedBy(rs.getString("executed_by"))
                .attempts(rs.getInt("attempts"))
                .cancelRequested(rs.getBoolean("cancel_requested"))
                .heartbeatAt(SqlTimes.get(rs, "heartbeat_at"))
                .build();
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_MESSAGE) {
            return message;
        }
        return message.substring(0, MAX_ERROR_MESSAGE);
    }
}
