package cockpit.jobs;

import cockpit.jobs.config.Dependencies;
import cockpit.jobs.config.JobsConfig;
import cockpit.jobs.server.JobsHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Service entry point.
 *
 * Wires dependencies, starts the HTTP API and, when enabled, the scheduler
 * loops. Runs until the JVM is asked to shut down.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        JobsConfig config = JobsConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        JobsHttpServer server = new JobsHttpServer(deps.routerHandler());
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping job service...");
            server.stop();
            deps.close();
            stopped.countDown();
        }, "cockpit-shutdown"));

        try {
            server.start(config.serverHost(), config.serverPort());
        } catch (IllegalStateException e) {
            log.error("Failed to start HTTP server", e);
            deps.close();
            System.exit(1);
        }

        if (config.schedulerEnabled()) {
            deps.startScheduler();
        } else {
            log.info("Scheduler disabled by configuration");
        }

        log.info("Job service ready on {}:{}", config.serverHost(), config.serverPort());
        stopped.await();
    }
}
