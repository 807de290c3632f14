package cockpit.jobs.model;

import java.time.Instant;

/**
 * Filter and paging for the run history. Null filters match everything.
 * Pages are 1-based.
 */
public record RunQuery(
        RunStatus status,
        String templateId,
        String scheduleId,
        Instant queuedFrom,
        Instant queuedTo,
        int page,
        int pageSize) {

    public static final int DEFAULT_PAGE_SIZE = 25;
    public static final int MAX_PAGE_SIZE = 100;

    public RunQuery {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1");
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("pageSize must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (queuedFrom != null && queuedTo != null && queuedFrom.isAfter(queuedTo)) {
            throw new IllegalArgumentException("from must not be after to");
        }
    }

    public static RunQuery firstPage() {
        return new RunQuery(null, null, null, null, null, 1, DEFAULT_PAGE_SIZE);
    }

    public long offset() {
        return (long) (page - 1) * pageSize;
    }
}
