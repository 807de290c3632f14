package cockpit.jobs.model;

import java.util.List;

/**
 * One page of a query result with the total row count.
 */
public record Page<T>(List<T> items, long total, int page, int pageSize) {

    public int totalPages() {
        if (pageSize <= 0) {
            return 0;
        }
        return (int) ((total + pageSize - 1) / pageSize);
    }
}
