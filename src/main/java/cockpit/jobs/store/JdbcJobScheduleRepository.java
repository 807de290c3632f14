package cockpit.jobs.store;

import cockpit.jobs.error.NotFoundException;
import cockpit.jobs.model.JobSchedule;
import cockpit.jobs.repository.JobScheduleRepository;
import cockpit.jobs.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of JobScheduleRepository.
 */
public class JdbcJobScheduleRepository implements JobScheduleRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobScheduleRepository.class);

    private final Database db;

    public JdbcJobScheduleRepository(Database db) {
        this.db = db;
    }

    /**
     * Insert a schedule. The referenced template row is locked for the
     * duration of the insert so a concurrent template delete either sees
     * this schedule or makes the insert fail.
     *
     * @throws NotFoundException if the referenced template does not exist
     */
    @Override
    public void save(JobSchedule schedule) {
        String sql = """
                    INSERT INTO job_schedules (id, name, template_id, cron_expression, time_zone, enabled,
                                               parameter_overrides, target_devices, next_run_at, last_run_id,
                                               created_by, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try {
                if (schedule.templateId() != null && !lockTemplate(conn, schedule.templateId())) {
                    conn.rollback();
                    throw new NotFoundException("Job template", schedule.templateId());
                }

                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    Instant now = Instant.now();
                    ps.setString(1, schedule.id());
                    ps.setString(2, schedule.name());
                    ps.setString(3, schedule.templateId());
                    ps.setString(4, schedule.cronExpression());
                    ps.setString(5, schedule.timeZone());
                    ps.setBoolean(6, schedule.isEnabled());
                    ps.setString(7, Json.write(schedule.parameterOverrides()));
                    ps.setString(8, Json.write(schedule.targetDevices()));
                    SqlTimes.set(ps, 9, schedule.nextRunAt());
                    ps.setString(10, schedule.lastRunId());
                    ps.setString(11, schedule.createdBy());
                    SqlTimes.set(ps, 12, schedule.createdAt() != null ? schedule.createdAt() : now);
                    SqlTimes.set(ps, 13, schedule.updatedAt() != null ? schedule.updatedAt() : now);
                    ps.executeUpdate();
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }

            log.debug("Saved schedule: {} (next run {})", schedule.id(), schedule.nextRunAt());
        } catch (SQLException e) {
            if (Database.isForeignKeyViolation(e)) {
                throw new NotFoundException("Job template", schedule.templateId());
            }
            throw new RuntimeException("Failed to save schedule: " + schedule.id(), e);
        }
    }

    @Override
    public boolean update(JobSchedule schedule) {
        String sql = """
                    UPDATE job_schedules
                    SET name = ?, cron_expression = ?, time_zone = ?, enabled = ?,
                        parameter_overrides = ?, target_devices = ?, next_run_at = ?, updated_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, schedule.name());
            ps.setString(2, schedule.cronExpression());
            ps.setString(3, schedule.timeZone());
            ps.setBoolean(4, schedule.isEnabled());
            ps.setString(5, Json.write(schedule.parameterOverrides()));
            ps.setString(6, Json.write(schedule.targetDevices()));
            SqlTimes.set(ps, 7, schedule.nextRunAt());
            SqlTimes.set(ps, 8, schedule.updatedAt() != null ? schedule.updatedAt() : Instant.now());
            ps.setString(9, schedule.id());

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update schedule: " + schedule.id(), e);
        }
    }

    @Override
    public Optional<JobSchedule> findById(String scheduleId) {
        String sql = "SELECT * FROM job_schedules WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, scheduleId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find schedule: " + scheduleId, e);
        }
    }

    @Override
    public List<JobSchedule> findAll(String templateId) {
        String sql = templateId == null
                ? "SELECT * FROM job_schedules ORDER BY name"
                : "SELECT * FROM job_schedules WHERE template_id = ? ORDER BY name";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            if (templateId != null) {
                ps.setString(1, templateId);
            }
            return mapRows(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schedules", e);
        }
    }

    @Override
    public List<JobSchedule> findDue(Instant now, int limit) {
        String sql = """
                    SELECT * FROM job_schedules
                    WHERE enabled = TRUE AND template_id IS NOT NULL
                      AND next_run_at IS NOT NULL AND next_run_at <= ?
                    ORDER BY next_run_at
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            SqlTimes.set(ps, 1, now);
            ps.setInt(2, limit);
            return mapRows(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find due schedules", e);
        }
    }

    @Override
    public int countEnabledByTemplate(String templateId) {
        String sql = "SELECT COUNT(*) FROM job_schedules WHERE template_id = ? AND enabled = TRUE";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, templateId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count schedules for template: " + templateId, e);
        }
    }

    @Override
    public boolean advance(String scheduleId, Instant expectedNextRunAt, Instant newNextRunAt, String lastRunId) {
        String sql = """
                    UPDATE job_schedules
                    SET next_run_at = ?, last_run_id = COALESCE(?, last_run_id), updated_at = ?
                    WHERE id = ? AND next_run_at = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            SqlTimes.set(ps, 1, newNextRunAt);
            ps.setString(2, lastRunId);
            SqlTimes.set(ps, 3, Instant.now());
            ps.setString(4, scheduleId);
            SqlTimes.set(ps, 5, expectedNextRunAt);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to advance schedule: " + scheduleId, e);
        }
    }

    @Override
    public boolean delete(String scheduleId) {
        String sql = "DELETE FROM job_schedules WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, scheduleId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete schedule: " + scheduleId, e);
        }
    }

    @Override
    public String generateId() {
        return "sch-" + UUID.randomUUID().toString().substring(0, 12);
    }

    // --- Helpers ---

    private boolean lockTemplate(Connection conn, String templateId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT id FROM job_templates WHERE id = ? FOR UPDATE")) {
            ps.setString(1, templateId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private List<JobSchedule> mapRows(PreparedStatement ps) throws SQLException {
        List<JobSchedule> schedules = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                schedules.add(mapRow(rs));
            }
        }
        return schedules;
    }

    private JobSchedule mapRow(ResultSet rs) throws SQLException {
        return JobSchedule.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .templateId(rs.getString("template_id"))
                .cronExpression(rs.getString("cron_expression"))
                .timeZone(rs.getString("time_zone"))
                .enabled(rs.getBoolean("enabled"))
                .parameterOverrides(Json.readMap(rs.getString("parameter_overrides")))
                .targetDevices(Json.readStringList(rs.getString("target_devices")))
                .nextRunAt(SqlTimes.get(rs, "next_run_at"))
                .lastRunId(rs.getString("last_run_id"))
                .createdBy(rs.getString("created_by"))
                .createdAt(SqlTimes.get(rs, "created_at"))
                .updatedAt(SqlTimes.get(rs, "updated_at"))
                .build();
    }
}
