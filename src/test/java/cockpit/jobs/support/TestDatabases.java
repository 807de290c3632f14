package cockpit.jobs.support;

import cockpit.jobs.config.JobsConfig;
import cockpit.jobs.store.Database;

/**
 * In-memory H2 databases for tests.
 */
public final class TestDatabases {

    private TestDatabases() {
    }

    public static Database create(String name) {
        return new Database(JobsConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:" + name + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE"));
    }

    public static void clear(Database db) throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM job_runs");
            st.execute("DELETE FROM job_schedules");
            st.execute("DELETE FROM job_templates");
            conn.commit();
        }
    }
}
