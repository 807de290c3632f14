package cockpit.jobs.repository;

import cockpit.jobs.model.JobSchedule;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for JobSchedule persistence.
 */
public interface JobScheduleRepository {

    void save(JobSchedule schedule);

    /**
     * Replace a schedule's definition (name, cron, overrides, enabled, next run).
     *
     * @return true if updated
     */
    boolean update(JobSchedule schedule);

    Optional<JobSchedule> findById(String scheduleId);

    /**
     * @param templateId optional filter
     */
    List<JobSchedule> findAll(String templateId);

    /**
     * Enabled schedules whose next run is at or before {@code now}, earliest first.
     */
    List<JobSchedule> findDue(Instant now, int limit);

    /**
     * Count enabled schedules that reference a template.
     */
    int countEnabledByTemplate(String templateId);

    /**
     * Move a schedule past an occurrence. Only applies when next_run_at still
     * equals {@code expectedNextRunAt}, so an occurrence is advanced once.
     *
     * @param lastRunId run created for the occurrence, may be null
     * @return true if this call advanced the schedule
     */
    boolean advance(String scheduleId, Instant expectedNextRunAt, Instant newNextRunAt, String lastRunId);

    boolean delete(String scheduleId);

    /**
     * Generate a new unique schedule ID.
     *
     * @return unique ID like "sch-{uuid}"
     */
    String generateId();
}
