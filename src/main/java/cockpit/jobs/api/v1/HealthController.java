package cockpit.jobs.api.v1;

import cockpit.jobs.api.Controller;
import cockpit.jobs.api.v1.dto.HealthResponse;
import cockpit.jobs.backend.ExecutionBackend;
import cockpit.jobs.model.RunStatus;
import cockpit.jobs.service.JobRunService;
import cockpit.jobs.service.ProgressTracker;
import cockpit.jobs.store.Database;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final ExecutionBackend backend;
    private final JobRunService runService;
    private final ProgressTracker progressTracker;
    private final BooleanSupplier schedulerRunning;

    public HealthController(Database database, ExecutionBackend backend, JobRunService runService,
            ProgressTracker progressTracker, BooleanSupplier schedulerRunning) {
        this.database = database;
        this.backend = backend;
        this.runService = runService;
        this.progressTracker = progressTracker;
        this.schedulerRunning = schedulerRunning;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        HealthResponse.unhealthy("connection failed"));
            }

            Map<String, Integer> runs = new LinkedHashMap<>();
            for (Map.Entry<RunStatus, Integer> e : runService.countsByStatus().entrySet()) {
                runs.put(e.getKey().name().toLowerCase(Locale.ROOT), e.getValue());
            }

            HealthResponse response = HealthResponse.healthy(
                    formatUptime(),
                    VERSION,
                    schedulerRunning.getAsBoolean(),
                    backend.stats(),
                    runs,
                    progressTracker.trackedCount());
            return ControllerResponse.json(response);

        } catch (RuntimeException e) {
            log.error("Health check failed", e);
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    HealthResponse.unhealthy(e.getMessage()));
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
