package cockpit.jobs.store;

import cockpit.jobs.error.ConflictException;
import cockpit.jobs.model.InventorySource;
import cockpit.jobs.model.JobTemplate;
import cockpit.jobs.model.TemplateParameter;
import cockpit.jobs.repository.JobTemplateRepository;
import cockpit.jobs.util.Json;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of JobTemplateRepository.
 */
public class JdbcJobTemplateRepository implements JobTemplateRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobTemplateRepository.class);

    private static final TypeReference<List<TemplateParameter>> PARAMETERS_TYPE = new TypeReference<>() {
    };

    private final Database db;

    public JdbcJobTemplateRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(JobTemplate template) {
        String sql = """
                    INSERT INTO job_templates (id, name, job_type, description, inventory_source, parameters,
                                               is_global, owner_id, scope_key, created_by, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Instant now = Instant.now();
            ps.setString(1, template.id());
            ps.setString(2, template.name());
            ps.setString(3, template.jobType());
            ps.setString(4, template.description());
            ps.setString(5, template.inventorySource().name());
            ps.setString(6, Json.write(template.parameters()));
            ps.setBoolean(7, template.isGlobal());
            ps.setString(8, template.ownerId());
            ps.setString(9, scopeKey(template.ownerId()));
            ps.setString(10, template.createdBy());
            SqlTimes.set(ps, 11, template.createdAt() != null ? template.createdAt() : now);
            SqlTimes.set(ps, 12, template.updatedAt() != null ? template.updatedAt() : now);

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved template: {}", template.id());
        } catch (SQLException e) {
            if (Database.isUniqueViolation(e)) {
                throw new ConflictException("A job template with name '" + template.name() + "' already exists");
            }
            throw new RuntimeException("Failed to save template: " + template.id(), e);
        }
    }

    @Override
    public boolean update(JobTemplate template) {
        String sql = """
                    UPDATE job_templates
                    SET name = ?, job_type = ?, description = ?, inventory_source = ?, parameters = ?,
                        is_global = ?, owner_id = ?, scope_key = ?, updated_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, template.name());
            ps.setString(2, template.jobType());
            ps.setString(3, template.description());
            ps.setString(4, template.inventorySource().name());
            ps.setString(5, Json.write(template.parameters()));
            ps.setBoolean(6, template.isGlobal());
            ps.setString(7, template.ownerId());
            ps.setString(8, scopeKey(template.ownerId()));
            SqlTimes.set(ps, 9, template.updatedAt() != null ? template.updatedAt() : Instant.now());
            ps.setString(10, template.id());

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            if (Database.isUniqueViolation(e)) {
                throw new ConflictException("A job template with name '" + template.name() + "' already exists");
            }
            throw new RuntimeException("Failed to update template: " + template.id(), e);
        }
    }

    @Override
    public Optional<JobTemplate> findById(String templateId) {
        String sql = "SELECT * FROM job_templates WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, templateId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find template: " + templateId, e);
        }
    }

    @Override
    public List<JobTemplate> findVisible(String userId, String jobType) {
        StringBuilder sql = new StringBuilder("SELECT * FROM job_templates WHERE (is_global = TRUE");
        List<Object> args = new ArrayList<>();
        if (userId != null) {
            sql.append(" OR owner_id = ?");
            args.add(userId);
        }
        sql.append(")");
        if (jobType != null) {
            sql.append(" AND job_type = ?");
            args.add(jobType);
        }
        sql.append(" ORDER BY name");

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql.toString())) {

            for (int i = 0; i < args.size(); i++) {
                ps.setObject(i + 1, args.get(i));
            }
            List<JobTemplate> templates = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    templates.add(mapRow(rs));
                }
            }
            return templates;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list templates", e);
        }
    }

    @Override
    public boolean existsByName(String name, String ownerId, String excludeId) {
        String sql = "SELECT COUNT(*) FROM job_templates WHERE scope_key = ? AND name = ? AND id <> ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, scopeKey(ownerId));
            ps.setString(2, name);
            ps.setString(3, excludeId != null ? excludeId : "");
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getInt(1) > 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to check template name: " + name, e);
        }
    }

    @Override
    public DeleteResult delete(String templateId, boolean cascade) {
        try (Connection conn = db.getConnection()) {
            try {
                // Lock the template row so a concurrent schedule insert sees a consistent state
                try (PreparedStatement ps = conn.prepareStatement(
                        "SELECT id FROM job_templates WHERE id = ? FOR UPDATE")) {
                    ps.setString(1, templateId);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) {
                            conn.rollback();
                            return DeleteResult.NOT_FOUND;
                        }
                    }
                }

                int enabled;
                try (PreparedStatement ps = conn.prepareStatement(
                        "SELECT COUNT(*) FROM job_schedules WHERE template_id = ? AND enabled = TRUE")) {
                    ps.setString(1, templateId);
                    try (ResultSet rs = ps.executeQuery()) {
                        rs.next();
                        enabled = rs.getInt(1);
                    }
                }

                if (enabled > 0 && !cascade) {
                    conn.rollback();
                    return DeleteResult.REFERENCED;
                }

                int detached;
                try (PreparedStatement ps = conn.prepareStatement("""
                            UPDATE job_schedules
                            SET enabled = FALSE, template_id = NULL, next_run_at = NULL, updated_at = ?
                            WHERE template_id = ?
                        """)) {
                    SqlTimes.set(ps, 1, Instant.now());
                    ps.setString(2, templateId);
                    detached = ps.executeUpdate();
                }

                try (PreparedStatement ps = conn.prepareStatement("DELETE FROM job_templates WHERE id = ?")) {
                    ps.setString(1, templateId);
                    ps.executeUpdate();
                }

                conn.commit();
                if (detached > 0) {
                    log.info("Deleted template {} and disabled {} schedule(s)", templateId, detached);
                }
                return DeleteResult.DELETED;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete template: " + templateId, e);
        }
    }

    @Override
    public String generateId() {
        return "tpl-" + UUID.randomUUID().toString().substring(0, 12);
    }

    // --- Helpers ---

    private static String scopeKey(String ownerId) {
        return ownerId == null ? "global" : "user:" + ownerId;
    }

    private JobTemplate mapRow(ResultSet rs) throws SQLException {
        String parameters = rs.getString("parameters");
        return JobTemplate.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .jobType(rs.getString("job_type"))
                .description(rs.getString("description"))
                .inventorySource(InventorySource.valueOf(rs.getString("inventory_source")))
                .parameters(parameters == null ? List.of() : Json.read(parameters, PARAMETERS_TYPE))
                .global(rs.getBoolean("is_global"))
                .ownerId(rs.getString("owner_id"))
                .createdBy(rs.getString("created_by"))
                .createdAt(SqlTimes.get(rs, "created_at"))
                .updatedAt(SqlTimes.get(rs, "updated_at"))
                .build();
    }
}
