package cockpit.jobs.repository;

import cockpit.jobs.model.JobTemplate;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for JobTemplate persistence.
 */
public interface JobTemplateRepository {

    /** Result of a delete request. */
    enum DeleteResult {
        DELETED,
        NOT_FOUND,
        /** Enabled schedules reference the template and cascade was not requested */
        REFERENCED
    }

    /**
     * Save a new template.
     *
     * @throws cockpit.jobs.error.ConflictException if the name is taken in the template's scope
     */
    void save(JobTemplate template);

    /**
     * Replace an existing template's mutable fields.
     *
     * @return true if updated
     * @throws cockpit.jobs.error.ConflictException if the new name is taken in the scope
     */
    boolean update(JobTemplate template);

    Optional<JobTemplate> findById(String templateId);

    /**
     * Templates visible to a user: global ones plus the user's private ones.
     *
     * @param userId  null returns global templates only
     * @param jobType optional filter
     */
    List<JobTemplate> findVisible(String userId, String jobType);

    /**
     * Check whether a name is used in a visibility scope.
     *
     * @param ownerId   null for the global scope
     * @param excludeId template to ignore (the one being renamed), may be null
     */
    boolean existsByName(String name, String ownerId, String excludeId);

    /**
     * Delete a template in a single transaction.
     * With cascade, referencing schedules are disabled and detached first.
     */
    DeleteResult delete(String templateId, boolean cascade);

    /**
     * Generate a new unique template ID.
     *
     * @return unique ID like "tpl-{uuid}"
     */
    String generateId();
}
