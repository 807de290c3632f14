package cockpit.jobs.api.v1;

import cockpit.jobs.api.Controller;
import cockpit.jobs.api.PermissionGate;
import cockpit.jobs.api.Requests;
import cockpit.jobs.api.v1.dto.TemplateRequest;
import cockpit.jobs.api.v1.dto.TemplateResponse;
import cockpit.jobs.model.JobTemplate;
import cockpit.jobs.service.TemplateService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for job templates.
 *
 * GET /api/v1/templates?jobType= - Templates visible to the caller
 * POST /api/v1/templates - Create a template
 * GET /api/v1/templates/{id} - Get a template
 * PUT /api/v1/templates/{id} - Replace a template
 * DELETE /api/v1/templates/{id}?cascade=true - Delete a template
 *
 * Exceptions bubble to RouterHandler, which maps them to status codes.
 */
public class TemplateController implements Controller {

    private static final Pattern TEMPLATES_PATTERN = Pattern.compile("^/api/v1/templates$");
    private static final Pattern TEMPLATE_BY_ID_PATTERN = Pattern.compile("^/api/v1/templates/([^/]+)$");

    private final TemplateService templateService;

    public TemplateController(TemplateService templateService) {
        this.templateService = templateService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (TEMPLATES_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.POST);
        }
        if (TEMPLATE_BY_ID_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.PUT)
                    || method.equals(HttpMethod.DELETE);
        }
        return false;
    }

    @Override
    public String capability(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) ? PermissionGate.TEMPLATES_READ : PermissionGate.TEMPLATES_WRITE;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        String user = Requests.user(req);
        HttpMethod method = req.method();

        if (TEMPLATES_PATTERN.matcher(path).matches()) {
            if (method.equals(HttpMethod.POST)) {
                TemplateRequest request = Requests.body(req, TemplateRequest.class);
                JobTemplate created = templateService.create(request.toDraft(), user);
                return ControllerResponse.json(HttpResponseStatus.CREATED, TemplateResponse.from(created));
            }
            List<TemplateResponse> templates = templateService.list(user, Requests.query(req, "jobType"))
                    .stream()
                    .map(TemplateResponse::from)
                    .toList();
            return ControllerResponse.json(Map.of("templates", templates, "total", templates.size()));
        }

        Matcher byId = TEMPLATE_BY_ID_PATTERN.matcher(path);
        if (!byId.matches()) {
            return ControllerResponse.notFound("unknown template endpoint");
        }
        String templateId = byId.group(1);

        if (method.equals(HttpMethod.PUT)) {
            TemplateRequest request = Requests.body(req, TemplateRequest.class);
            JobTemplate updated = templateService.update(templateId, request.toDraft(), user);
            return ControllerResponse.json(TemplateResponse.from(updated));
        }
        if (method.equals(HttpMethod.DELETE)) {
            templateService.delete(templateId, Requests.queryBoolean(req, "cascade"), user);
            return ControllerResponse.noContent();
        }
        return ControllerResponse.json(TemplateResponse.from(templateService.get(templateId, user)));
    }
}
