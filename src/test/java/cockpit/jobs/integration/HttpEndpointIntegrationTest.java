package cockpit.jobs.integration;

import cockpit.jobs.api.PermissionGate;
import cockpit.jobs.config.Dependencies;
import cockpit.jobs.config.JobsConfig;
import cockpit.jobs.server.JobsHttpServer;
import cockpit.jobs.worker.JobTypeRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that hits the HTTP endpoints of a fully wired service.
 * Runs execute on the in-process worker pool.
 */
class HttpEndpointIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int TEST_PORT = 18080;
    private static final String BASE_URL = "http://127.0.0.1:" + TEST_PORT;

    private Dependencies deps;
    private JobsHttpServer server;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() {
        start(null);
        httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        if (server != null)
            server.stop();
        if (deps != null)
            deps.close();
    }

    private void start(PermissionGate gate) {
        JobsConfig config = JobsConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-http-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withServerPort(TEST_PORT)
                .withWorkerSlots(2);
        deps = gate == null
                ? Dependencies.create(config)
                : Dependencies.create(config, JobTypeRegistry.withDefaults(), gate);
        server = new JobsHttpServer(deps.routerHandler());
        server.start("127.0.0.1", TEST_PORT);
    }

    private HttpResponse<String> send(String method, String path, String body, String user) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(BASE_URL + path))
                .timeout(Duration.ofSeconds(10))
                .header("Content-Type", "application/json")
                .method(method, body == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofString(body));
        if (user != null) {
            builder.header("X-Cockpit-User", user);
        }
        return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode json(HttpResponse<String> response) throws Exception {
        return MAPPER.readTree(response.body());
    }

    private String createTemplate(String name) throws Exception {
        String body = """
                {
                    "name": "%s",
                    "jobType": "example",
                    "description": "Echo parameters per device",
                    "inventorySource": "inventory",
                    "isGlobal": true,
                    "parameters": [
                        {"name": "retention", "type": "INTEGER", "required": false, "defaultValue": 7}
                    ]
                }
                """.formatted(name);
        HttpResponse<String> response = send("POST", "/api/v1/templates", body, "admin");
        assertEquals(201, response.statusCode(), response.body());
        return json(response).get("id").asText();
    }

    private JsonNode awaitStatus(String runId, String status) throws Exception {
        long deadline = System.currentTimeMillis() + 10_000;
        while (true) {
            JsonNode run = json(send("GET", "/api/v1/job-runs/" + runId, null, null));
            if (status.equals(run.get("status").asText())) {
                return run;
            }
            if (System.currentTimeMillis() > deadline) {
                fail("Run " + runId + " stuck in " + run.get("status").asText());
            }
            Thread.sleep(25);
        }
    }

    @Test
    @DisplayName("Health reports database, backend and run counts")
    void health() throws Exception {
        HttpResponse<String> response = send("GET", "/api/v1/health", null, null);

        assertEquals(200, response.statusCode());
        JsonNode body = json(response);
        assertEquals("healthy", body.get("status").asText());
        assertEquals("ok", body.get("database").asText());
        assertFalse(body.get("schedulerRunning").asBoolean());
        assertEquals(2, body.get("backend").get("workerSlots").asInt());
        assertTrue(body.get("backend").has("retainedTasks"));
        assertEquals(0, body.get("backend").get("evictedTasks").asLong());
        assertEquals(0, body.get("runs").get("queued").asInt());
    }

    @Test
    void jobTypesAreListed() throws Exception {
        JsonNode body = json(send("GET", "/api/v1/job-types", null, null));
        assertEquals("example", body.get("jobTypes").get(0).get("value").asText());
    }

    @Test
    @DisplayName("Template run executes on the worker pool and lands in history")
    void dispatchRunToCompletion() throws Exception {
        String templateId = createTemplate("Backup");

        HttpResponse<String> dispatched = send("POST", "/api/v1/job-runs", """
                {"templateId": "%s", "parameters": {"retention": 3}, "targetDevices": ["dev-a", "dev-b"]}
                """.formatted(templateId), "alice");
        assertEquals(202, dispatched.statusCode(), dispatched.body());
        String runId = json(dispatched).get("id").asText();
        assertEquals("alice", json(dispatched).get("triggeredBy").asText());

        JsonNode run = awaitStatus(runId, "succeeded");
        assertTrue(run.get("result").get("success").asBoolean());
        assertEquals(3, run.get("result").get("job_parameters").get("retention").asInt());
        assertEquals("dev-b", run.get("result").get("target_devices").get(1).asText());
        assertFalse(run.get("completedAt").isNull());
        assertTrue(run.get("durationMs").asLong() >= 0);

        assertEquals(404, send("GET", "/api/v1/job-runs/" + runId + "/progress", null, null).statusCode());

        HttpResponse<String> cancel = send("POST", "/api/v1/job-runs/" + runId + "/cancel", null, "alice");
        assertEquals(200, cancel.statusCode());
        assertEquals("already_terminal", json(cancel).get("outcome").asText());
        assertEquals("succeeded", json(cancel).get("status").asText());

        JsonNode history = json(send("GET", "/api/v1/job-runs?status=succeeded&templateId=" + templateId,
                null, null));
        assertEquals(1, history.get("total").asInt());
        assertEquals(runId, history.get("items").get(0).get("id").asText());
    }

    @Test
    void batchProgressReportsMissingRuns() throws Exception {
        HttpResponse<String> response = send("POST", "/api/v1/job-runs/progress",
                "{\"runIds\": [\"run-a\", \"run-b\"]}", null);

        assertEquals(200, response.statusCode(), response.body());
        JsonNode body = json(response);
        assertEquals(0, body.get("progress").size());
        assertEquals(2, body.get("missing").size());
    }

    @Test
    @DisplayName("Template with an enabled schedule needs cascade to delete")
    void templateDeleteCascade() throws Exception {
        String templateId = createTemplate("Nightly backup");
        HttpResponse<String> schedule = send("POST", "/api/v1/schedules", """
                {"name": "Nightly", "templateId": "%s", "cronExpression": "0 2 * * *", "timeZone": "UTC"}
                """.formatted(templateId), "admin");
        assertEquals(201, schedule.statusCode(), schedule.body());
        String scheduleId = json(schedule).get("id").asText();
        assertTrue(json(schedule).get("enabled").asBoolean());

        HttpResponse<String> refused = send("DELETE", "/api/v1/templates/" + templateId, null, "admin");
        assertEquals(409, refused.statusCode());
        assertEquals("conflict", json(refused).get("code").asText());

        assertEquals(204, send("DELETE", "/api/v1/templates/" + templateId + "?cascade=true", null, "admin")
                .statusCode());

        JsonNode detached = json(send("GET", "/api/v1/schedules/" + scheduleId, null, null));
        assertFalse(detached.get("enabled").asBoolean());
        assertTrue(detached.get("templateId").isNull());
    }

    @Test
    void manualScheduleRunIsDispatched() throws Exception {
        String templateId = createTemplate("On demand");
        String scheduleId = json(send("POST", "/api/v1/schedules", """
                {"name": "Weekly", "templateId": "%s", "cronExpression": "0 3 * * 0",
                 "targetDevices": ["dev-x"]}
                """.formatted(templateId), "admin")).get("id").asText();

        HttpResponse<String> response = send("POST", "/api/v1/schedules/" + scheduleId + "/run", null, "bob");

        assertEquals(202, response.statusCode(), response.body());
        JsonNode run = awaitStatus(json(response).get("id").asText(), "succeeded");
        assertEquals(scheduleId, run.get("jobScheduleId").asText());
        assertEquals("dev-x", run.get("targetDevices").get(0).asText());
    }

    @Test
    void errorsMapToStatusCodes() throws Exception {
        createTemplate("Duplicate");

        HttpResponse<String> duplicate = send("POST", "/api/v1/templates",
                "{\"name\": \"Duplicate\", \"jobType\": \"example\", \"isGlobal\": true}", "admin");
        assertEquals(409, duplicate.statusCode());

        HttpResponse<String> invalid = send("POST", "/api/v1/templates",
                "{\"name\": \"\", \"jobType\": \"example\"}", "admin");
        assertEquals(400, invalid.statusCode());
        assertEquals("validation_error", json(invalid).get("code").asText());

        HttpResponse<String> badJson = send("POST", "/api/v1/job-runs", "{not json", "admin");
        assertEquals(400, badJson.statusCode());

        HttpResponse<String> badCron = send("POST", "/api/v1/schedules",
                "{\"name\": \"x\", \"templateId\": \"tpl-missing\", \"cronExpression\": \"* * * * *\"}", "admin");
        assertEquals(400, badCron.statusCode());

        assertEquals(404, send("GET", "/api/v1/job-runs/run-missing", null, null).statusCode());
        assertEquals(404, send("POST", "/api/v1/job-runs/run-missing/cancel", null, null).statusCode());
        assertEquals(404, send("GET", "/api/v1/nothing-here", null, null).statusCode());
        assertEquals(400, send("GET", "/api/v1/job-runs?status=bogus", null, null).statusCode());
    }

    @Test
    void privateTemplatesFollowTheCaller() throws Exception {
        HttpResponse<String> created = send("POST", "/api/v1/templates",
                "{\"name\": \"Mine\", \"jobType\": \"example\", \"isGlobal\": false}", "alice");
        assertEquals(201, created.statusCode(), created.body());
        String templateId = json(created).get("id").asText();

        assertEquals(200, send("GET", "/api/v1/templates/" + templateId, null, "alice").statusCode());
        assertEquals(404, send("GET", "/api/v1/templates/" + templateId, null, "bob").statusCode());
        assertEquals(0, json(send("GET", "/api/v1/templates", null, "bob")).get("total").asInt());
    }

    @Test
    void deniedCapabilityIsForbidden() throws Exception {
        server.stop();
        deps.close();
        start((user, capability) -> capability.endsWith(":read"));

        assertEquals(200, send("GET", "/api/v1/templates", null, "alice").statusCode());
        HttpResponse<String> denied = send("POST", "/api/v1/templates",
                "{\"name\": \"x\", \"jobType\": \"example\", \"isGlobal\": true}", "alice");
        assertEquals(403, denied.statusCode());
        assertEquals("forbidden", json(denied).get("code").asText());
    }
}
