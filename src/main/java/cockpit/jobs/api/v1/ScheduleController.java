package cockpit.jobs.api.v1;

import cockpit.jobs.api.Controller;
import cockpit.jobs.api.PermissionGate;
import cockpit.jobs.api.Requests;
import cockpit.jobs.api.v1.dto.DispatchRunRequest;
import cockpit.jobs.api.v1.dto.JobRunResponse;
import cockpit.jobs.api.v1.dto.ScheduleRequest;
import cockpit.jobs.api.v1.dto.ScheduleResponse;
import cockpit.jobs.error.ValidationException;
import cockpit.jobs.model.JobRun;
import cockpit.jobs.model.JobSchedule;
import cockpit.jobs.service.DispatchRequest;
import cockpit.jobs.service.Dispatcher;
import cockpit.jobs.service.ScheduleService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for job schedules.
 *
 * GET /api/v1/schedules?templateId= - List schedules
 * POST /api/v1/schedules - Create a schedule
 * GET /api/v1/schedules/{id} - Get a schedule
 * PUT /api/v1/schedules/{id} - Replace a schedule
 * DELETE /api/v1/schedules/{id} - Delete a schedule
 * POST /api/v1/schedules/{id}/run - Run the schedule's template now
 */
public class ScheduleController implements Controller {

    private static final Pattern SCHEDULES_PATTERN = Pattern.compile("^/api/v1/schedules$");
    private static final Pattern SCHEDULE_BY_ID_PATTERN = Pattern.compile("^/api/v1/schedules/([^/]+)$");
    private static final Pattern SCHEDULE_RUN_PATTERN = Pattern.compile("^/api/v1/schedules/([^/]+)/run$");

    private final ScheduleService scheduleService;
    private final Dispatcher dispatcher;

    public ScheduleController(ScheduleService scheduleService, Dispatcher dispatcher) {
        this.scheduleService = scheduleService;
        this.dispatcher = dispatcher;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (SCHEDULES_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.POST);
        }
        if (SCHEDULE_BY_ID_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.PUT)
                    || method.equals(HttpMethod.DELETE);
        }
        return method.equals(HttpMethod.POST) && SCHEDULE_RUN_PATTERN.matcher(path).matches();
    }

    @Override
    public String capability(HttpMethod method, String path) {
        if (SCHEDULE_RUN_PATTERN.matcher(path).matches()) {
            return PermissionGate.RUNS_WRITE;
        }
        return method.equals(HttpMethod.GET) ? PermissionGate.SCHEDULES_READ : PermissionGate.SCHEDULES_WRITE;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        String user = Requests.user(req);
        HttpMethod method = req.method();

        if (SCHEDULES_PATTERN.matcher(path).matches()) {
            if (method.equals(HttpMethod.POST)) {
                ScheduleRequest request = Requests.body(req, ScheduleRequest.class);
                JobSchedule created = scheduleService.create(request.toDraft(), user);
                return ControllerResponse.json(HttpResponseStatus.CREATED, ScheduleResponse.from(created));
            }
            List<ScheduleResponse> schedules = scheduleService.list(Requests.query(req, "templateId"))
                    .stream()
                    .map(ScheduleResponse::from)
                    .toList();
            return ControllerResponse.json(Map.of("schedules", schedules, "total", schedules.size()));
        }

        Matcher run = SCHEDULE_RUN_PATTERN.matcher(path);
        if (run.matches()) {
            return handleRunNow(req, run.group(1), user);
        }

        Matcher byId = SCHEDULE_BY_ID_PATTERN.matcher(path);
        if (!byId.matches()) {
            return ControllerResponse.notFound("unknown schedule endpoint");
        }
        String scheduleId = byId.group(1);

        if (method.equals(HttpMethod.PUT)) {
            ScheduleRequest request = Requests.body(req, ScheduleRequest.class);
            return ControllerResponse.json(ScheduleResponse.from(scheduleService.update(scheduleId, request.toDraft())));
        }
        if (method.equals(HttpMethod.DELETE)) {
            scheduleService.delete(scheduleId);
            return ControllerResponse.noContent();
        }
        return ControllerResponse.json(ScheduleResponse.from(scheduleService.get(scheduleId)));
    }

    /**
     * POST /api/v1/schedules/{id}/run - manual trigger outside the cron cadence
     */
    private ControllerResponse handleRunNow(FullHttpRequest req, String scheduleId, String user) {
        JobSchedule schedule = scheduleService.get(scheduleId);
        if (schedule.templateId() == null) {
            throw new ValidationException("schedule " + scheduleId + " has no template");
        }
        DispatchRunRequest request = Requests.optionalBody(req, DispatchRunRequest.class);

        JobRun run = dispatcher.dispatch(new DispatchRequest(
                schedule.templateId(), null, null, JobRunController.triggeredBy(user),
                request != null ? request.parameters() : null,
                request != null ? request.targetDevices() : null,
                schedule.id(), null));
        return JobRunController.dispatchResponse(run);
    }
}
