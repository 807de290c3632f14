package cockpit.jobs.server;

import cockpit.jobs.api.Controller;
import cockpit.jobs.api.Controller.ControllerResponse;
import cockpit.jobs.api.PermissionGate;
import cockpit.jobs.api.Requests;
import cockpit.jobs.error.ConflictException;
import cockpit.jobs.error.JobsException;
import cockpit.jobs.error.NotFoundException;
import cockpit.jobs.error.ValidationException;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.*;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 *
 * Every matched request is checked against the permission gate first.
 * Exceptions from controllers are mapped to status codes here:
 * validation 400, not found 404, conflict 409, anything else 500.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);

    private final List<Controller> controllers = new ArrayList<>();
    private final PermissionGate permissionGate;

    public RouterHandler(PermissionGate permissionGate) {
        this.permissionGate = permissionGate;
    }

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    public int controllerCount() {
        return controllers.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();

        // Extract path without query string
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        ControllerResponse response;
        try {
            response = route(ctx, req, method, path);
        } catch (ValidationException e) {
            log.warn("Validation error on {} {}: {}", method, path, e.getMessage());
            response = ControllerResponse.badRequest(e.getMessage());
        } catch (IllegalArgumentException e) {
            log.warn("Bad request on {} {}: {}", method, path, e.getMessage());
            response = ControllerResponse.badRequest(e.getMessage());
        } catch (NotFoundException e) {
            response = ControllerResponse.notFound(e.getMessage());
        } catch (ConflictException e) {
            log.info("Conflict on {} {}: {}", method, path, e.getMessage());
            response = ControllerResponse.conflict(e.getMessage());
        } catch (JobsException e) {
            log.error("Job error on {} {}", method, path, e);
            response = ControllerResponse.error(INTERNAL_SERVER_ERROR, e.errorCode(), e.getMessage());
        } catch (Exception e) {
            log.error("Handler error: {} {}", method, path, e);
            response = ControllerResponse.error(INTERNAL_SERVER_ERROR, "internal_error", e.toString());
        }

        writeSafe(ctx, response.status(), response.contentType(), response.body());
    }

    private ControllerResponse route(ChannelHandlerContext ctx, FullHttpRequest req, HttpMethod method,
            String path) {
        for (Controller controller : controllers) {
            if (controller.matches(method, path)) {
                String capability = controller.capability(method, path);
                String user = Requests.user(req);
                if (capability != null && !permissionGate.isAuthorized(user, capability)) {
                    log.warn("User {} lacks {} for {} {}", user, capability, method, path);
                    return ControllerResponse.forbidden("missing capability " + capability);
                }
                return controller.handle(ctx, req, path);
            }
        }

        log.debug("No handler for: {} {}", method, path);
        return ControllerResponse.notFound("not found");
    }

    /**
     * Safe write that catches any exceptions during response writing.
     * Ensures we never silently close the connection.
     */
    private void writeSafe(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body) {
        try {
            byte[] bytes = (body == null ? "" : body).getBytes(StandardCharsets.UTF_8);
            FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
            response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            ctx.writeAndFlush(response);
        } catch (Exception e) {
            log.error("Failed to write response: {}", e.getMessage(), e);
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        ctx.close();
    }
}
