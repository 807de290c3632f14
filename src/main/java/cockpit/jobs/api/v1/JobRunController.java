package cockpit.jobs.api.v1;

import cockpit.jobs.api.Controller;
import cockpit.jobs.api.PermissionGate;
import cockpit.jobs.api.Requests;
import cockpit.jobs.api.v1.dto.BatchProgressRequest;
import cockpit.jobs.api.v1.dto.BatchProgressResponse;
import cockpit.jobs.api.v1.dto.CancelResponse;
import cockpit.jobs.api.v1.dto.DispatchRunRequest;
import cockpit.jobs.api.v1.dto.JobRunResponse;
import cockpit.jobs.api.v1.dto.PageResponse;
import cockpit.jobs.api.v1.dto.ProgressResponse;
import cockpit.jobs.error.NotFoundException;
import cockpit.jobs.model.CancelResult;
import cockpit.jobs.model.JobRun;
import cockpit.jobs.model.ProgressSnapshot;
import cockpit.jobs.model.RunErrorCode;
import cockpit.jobs.model.RunQuery;
import cockpit.jobs.model.RunStatus;
import cockpit.jobs.service.DispatchRequest;
import cockpit.jobs.service.Dispatcher;
import cockpit.jobs.service.JobRunService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for job runs.
 *
 * POST /api/v1/job-runs - Dispatch a run (template or ad hoc)
 * GET /api/v1/job-runs - Paginated history
 * GET /api/v1/job-runs/{id} - Get a run
 * POST /api/v1/job-runs/{id}/cancel - Cancel a run
 * GET /api/v1/job-runs/{id}/progress - Live progress of a run
 * POST /api/v1/job-runs/progress - Live progress of many runs
 */
public class JobRunController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(JobRunController.class);

    private static final Pattern RUNS_PATTERN = Pattern.compile("^/api/v1/job-runs$");
    private static final Pattern BATCH_PROGRESS_PATTERN = Pattern.compile("^/api/v1/job-runs/progress$");
    private static final Pattern RUN_BY_ID_PATTERN = Pattern.compile("^/api/v1/job-runs/([^/]+)$");
    private static final Pattern RUN_CANCEL_PATTERN = Pattern.compile("^/api/v1/job-runs/([^/]+)/cancel$");
    private static final Pattern RUN_PROGRESS_PATTERN = Pattern.compile("^/api/v1/job-runs/([^/]+)/progress$");

    private final Dispatcher dispatcher;
    private final JobRunService runService;

    public JobRunController(Dispatcher dispatcher, JobRunService runService) {
        this.dispatcher = dispatcher;
        this.runService = runService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return RUNS_PATTERN.matcher(path).matches()
                    || BATCH_PROGRESS_PATTERN.matcher(path).matches()
                    || RUN_CANCEL_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return RUNS_PATTERN.matcher(path).matches()
                    || RUN_PROGRESS_PATTERN.matcher(path).matches()
                    || (RUN_BY_ID_PATTERN.matcher(path).matches() && !BATCH_PROGRESS_PATTERN.matcher(path).matches());
        }
        return false;
    }

    @Override
    public String capability(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET) || BATCH_PROGRESS_PATTERN.matcher(path).matches()) {
            return PermissionGate.RUNS_READ;
        }
        return PermissionGate.RUNS_WRITE;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        HttpMethod method = req.method();

        if (RUNS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) ? handleDispatch(req) : handleHistory(req);
        }
        if (BATCH_PROGRESS_PATTERN.matcher(path).matches()) {
            return handleBatchProgress(req);
        }

        Matcher cancel = RUN_CANCEL_PATTERN.matcher(path);
        if (cancel.matches()) {
            return handleCancel(cancel.group(1));
        }

        Matcher progress = RUN_PROGRESS_PATTERN.matcher(path);
        if (progress.matches()) {
            return handleProgress(progress.group(1));
        }

        Matcher byId = RUN_BY_ID_PATTERN.matcher(path);
        if (byId.matches()) {
            return ControllerResponse.json(JobRunResponse.from(runService.get(byId.group(1))));
        }
        return ControllerResponse.notFound("unknown job-run endpoint");
    }

    /**
     * POST /api/v1/job-runs
     */
    private ControllerResponse handleDispatch(FullHttpRequest req) {
        DispatchRunRequest request = Requests.body(req, DispatchRunRequest.class);
        String triggeredBy = triggeredBy(Requests.user(req));

        DispatchRequest dispatch = request.templateId() != null
                ? new DispatchRequest(request.templateId(), request.jobName(), null, triggeredBy,
                        request.parameters(), request.targetDevices(), null, null)
                : DispatchRequest.adHoc(request.jobName(), request.jobType(), triggeredBy,
                        request.parameters(), request.targetDevices());

        return dispatchResponse(dispatcher.dispatch(dispatch));
    }

    /**
     * GET /api/v1/job-runs?status=&templateId=&scheduleId=&from=&to=&page=&pageSize=
     */
    private ControllerResponse handleHistory(FullHttpRequest req) {
        String status = Requests.query(req, "status");
        RunStatus statusFilter = null;
        if (status != null) {
            try {
                statusFilter = RunStatus.valueOf(status.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("unknown status: " + status);
            }
        }

        RunQuery query = new RunQuery(
                statusFilter,
                Requests.query(req, "templateId"),
                Requests.query(req, "scheduleId"),
                Requests.queryInstant(req, "from"),
                Requests.queryInstant(req, "to"),
                Requests.queryInt(req, "page", 1),
                Requests.queryInt(req, "pageSize", RunQuery.DEFAULT_PAGE_SIZE));

        return ControllerResponse.json(PageResponse.from(runService.history(query), JobRunResponse::from));
    }

    /**
     * POST /api/v1/job-runs/{id}/cancel
     */
    private ControllerResponse handleCancel(String runId) {
        CancelResult result = runService.cancel(runId);
        if (result == CancelResult.NOT_FOUND) {
            throw new NotFoundException("Job run", runId);
        }
        JobRun run = runService.get(runId);
        CancelResponse response = new CancelResponse(
                runId,
                result.name().toLowerCase(Locale.ROOT),
                run.status().name().toLowerCase(Locale.ROOT));
        return ControllerResponse.json(result == CancelResult.CANCEL_REQUESTED
                ? HttpResponseStatus.ACCEPTED : HttpResponseStatus.OK, response);
    }

    /**
     * GET /api/v1/job-runs/{id}/progress
     */
    private ControllerResponse handleProgress(String runId) {
        Optional<ProgressSnapshot> snapshot = runService.progress(runId);
        if (snapshot.isEmpty()) {
            return ControllerResponse.notFound("no live progress for run " + runId);
        }
        return ControllerResponse.json(ProgressResponse.from(snapshot.get()));
    }

    /**
     * POST /api/v1/job-runs/progress
     */
    private ControllerResponse handleBatchProgress(FullHttpRequest req) {
        BatchProgressRequest request = Requests.body(req, BatchProgressRequest.class);
        request.validate();

        Map<String, ProgressSnapshot> snapshots = runService.progress(request.runIds());
        Map<String, ProgressResponse> progress = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        for (String runId : request.runIds()) {
            ProgressSnapshot snapshot = snapshots.get(runId);
            if (snapshot != null) {
                progress.put(runId, ProgressResponse.from(snapshot));
            } else {
                missing.add(runId);
            }
        }
        return ControllerResponse.json(new BatchProgressResponse(progress, missing));
    }

    /**
     * 202 for a queued run, 502 with the failed run when the backend refused it.
     */
    static ControllerResponse dispatchResponse(JobRun run) {
        if (run.status() == RunStatus.FAILED && run.errorCode() == RunErrorCode.DISPATCH_ERROR) {
            log.warn("Returning failed dispatch of run {}", run.id());
            return ControllerResponse.json(HttpResponseStatus.BAD_GATEWAY, JobRunResponse.from(run));
        }
        return ControllerResponse.json(HttpResponseStatus.ACCEPTED, JobRunResponse.from(run));
    }

    static String triggeredBy(String user) {
        return user != null ? user : "api";
    }
}
