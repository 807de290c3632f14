package cockpit.jobs.api.v1;

import cockpit.jobs.api.Controller;
import cockpit.jobs.api.PermissionGate;
import cockpit.jobs.service.TemplateService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

import java.util.Map;

/**
 * Registered job types.
 * GET /api/v1/job-types
 */
public class JobTypeController implements Controller {

    private final TemplateService templateService;

    public JobTypeController(TemplateService templateService) {
        this.templateService = templateService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/job-types".equals(path);
    }

    @Override
    public String capability(HttpMethod method, String path) {
        return PermissionGate.TEMPLATES_READ;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        return ControllerResponse.json(Map.of("jobTypes", templateService.jobTypes()));
    }
}
