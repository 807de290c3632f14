package cockpit.jobs.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.File;
import java.io.IOException;
import java.time.Duration;

/**
 * Configuration holder for the job orchestration service.
 * All settings have sensible defaults.
 */
public final class JobsConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/cockpit-jobs;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Worker settings
    private int workerSlots = 4;
    private int maxAttempts = 3;
    private Duration heartbeatInterval = Duration.ofSeconds(15);
    private Duration resultRetention = Duration.ofHours(24);

    // Scheduler settings
    private boolean schedulerEnabled = true;
    private Duration tickInterval = Duration.ofSeconds(30);
    private Duration reconcileInterval = Duration.ofMinutes(2);
    private Duration staleThreshold = Duration.ofMinutes(10);

    private JobsConfig() {
    }

    public static JobsConfig defaults() {
        return new JobsConfig();
    }

    /**
     * Defaults, then the INI file named by COCKPIT_CONFIG (if any), then
     * individual environment variables.
     */
    public static JobsConfig fromEnv() {
        JobsConfig config = new JobsConfig();

        String configFile = System.getenv("COCKPIT_CONFIG");
        if (configFile != null && !configFile.isBlank()) {
            config.applyIni(new File(configFile));
        }

        String dbUrl = System.getenv("COCKPIT_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("COCKPIT_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String slots = System.getenv("COCKPIT_WORKER_SLOTS");
        if (slots != null && !slots.isBlank()) {
            config.workerSlots = Integer.parseInt(slots);
        }

        String maxAttempts = System.getenv("COCKPIT_MAX_ATTEMPTS");
        if (maxAttempts != null && !maxAttempts.isBlank()) {
            config.maxAttempts = Integer.parseInt(maxAttempts);
        }

        String stale = System.getenv("COCKPIT_STALE_THRESHOLD_SECONDS");
        if (stale != null && !stale.isBlank()) {
            config.staleThreshold = Duration.ofSeconds(Long.parseLong(stale));
        }

        String tick = System.getenv("COCKPIT_TICK_SECONDS");
        if (tick != null && !tick.isBlank()) {
            config.tickInterval = Duration.ofSeconds(Long.parseLong(tick));
        }

        String retention = System.getenv("COCKPIT_RESULT_RETENTION_HOURS");
        if (retention != null && !retention.isBlank()) {
            config.resultRetention = Duration.ofHours(Long.parseLong(retention));
        }

        String scheduler = System.getenv("COCKPIT_SCHEDULER_ENABLED");
        if (scheduler != null && !scheduler.isBlank()) {
            config.schedulerEnabled = Boolean.parseBoolean(scheduler);
        }

        return config;
    }

    /**
     * Load settings from an INI file on top of the defaults.
     * Sections: [database], [server], [workers], [scheduler].
     */
    public static JobsConfig fromIni(File file) {
        JobsConfig config = new JobsConfig();
        config.applyIni(file);
        return config;
    }

    private void applyIni(File file) {
        Ini ini;
        try {
            ini = new Ini(file);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file: " + file, e);
        }

        Profile.Section database = ini.get("database");
        if (database != null) {
            databaseUrl = opt(database, "url", databaseUrl);
            databasePoolSize = Integer.parseInt(opt(database, "pool_size", String.valueOf(databasePoolSize)));
        }

        Profile.Section server = ini.get("server");
        if (server != null) {
            serverHost = opt(server, "host", serverHost);
            serverPort = Integer.parseInt(opt(server, "port", String.valueOf(serverPort)));
        }

        Profile.Section workers = ini.get("workers");
        if (workers != null) {
            workerSlots = Integer.parseInt(opt(workers, "slots", String.valueOf(workerSlots)));
            maxAttempts = Integer.parseInt(opt(workers, "max_attempts", String.valueOf(maxAttempts)));
            heartbeatInterval = seconds(workers, "heartbeat_seconds", heartbeatInterval);
            String retention = workers.get("result_retention_hours");
            if (retention != null && !retention.isBlank()) {
                resultRetention = Duration.ofHours(Long.parseLong(retention.trim()));
            }
        }

        Profile.Section scheduler = ini.get("scheduler");
        if (scheduler != null) {
            schedulerEnabled = Boolean.parseBoolean(opt(scheduler, "enabled", String.valueOf(schedulerEnabled)));
            tickInterval = seconds(scheduler, "tick_seconds", tickInterval);
            reconcileInterval = seconds(scheduler, "reconcile_seconds", reconcileInterval);
            staleThreshold = seconds(scheduler, "stale_threshold_seconds", staleThreshold);
        }
    }

    private static String opt(Profile.Section s, String key, String def) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? def : v.trim();
    }

    private static Duration seconds(Profile.Section s, String key, Duration def) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? def : Duration.ofSeconds(Long.parseLong(v.trim()));
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public int workerSlots() {
        return workerSlots;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration heartbeatInterval() {
        return heartbeatInterval;
    }

    /** How long finished backend tasks stay queryable before eviction. */
    public Duration resultRetention() {
        return resultRetention;
    }

    public boolean schedulerEnabled() {
        return schedulerEnabled;
    }

    public Duration tickInterval() {
        return tickInterval;
    }

    public Duration reconcileInterval() {
        return reconcileInterval;
    }

    public Duration staleThreshold() {
        return staleThreshold;
    }

    // Fluent setters for testing/customization
    public JobsConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public JobsConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public JobsConfig withWorkerSlots(int slots) {
        this.workerSlots = slots;
        return this;
    }

    public JobsConfig withMaxAttempts(int attempts) {
        this.maxAttempts = attempts;
        return this;
    }

    public JobsConfig withHeartbeatInterval(Duration interval) {
        this.heartbeatInterval = interval;
        return this;
    }

    public JobsConfig withResultRetention(Duration retention) {
        this.resultRetention = retention;
        return this;
    }

    public JobsConfig withSchedulerEnabled(boolean enabled) {
        this.schedulerEnabled = enabled;
        return this;
    }

    public JobsConfig withTickInterval(Duration interval) {
        this.tickInterval = interval;
        return this;
    }

    public JobsConfig withReconcileInterval(Duration interval) {
        this.reconcileInterval = interval;
        return this;
    }

    public JobsConfig withStaleThreshold(Duration threshold) {
        this.staleThreshold = threshold;
        return this;
    }

    @Override
    public String toString() {
        return "JobsConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", workerSlots=" + workerSlots +
                ", maxAttempts=" + maxAttempts +
                ", resultRetention=" + resultRetention +
                ", schedulerEnabled=" + schedulerEnabled +
                ", tickInterval=" + tickInterval +
                ", staleThreshold=" + staleThreshold +
                '}';
    }
}
