package cockpit.jobs.api;

import cockpit.jobs.util.Json;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base interface for HTTP controllers.
 * Controllers handle specific URL patterns and HTTP methods.
 */
public interface Controller {

    /**
     * Check if this controller can handle the given request.
     *
     * @param method HTTP method
     * @param path   Request path (without query string)
     * @return true if this controller handles this request
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Capability the caller needs for this request, or null if none.
     * Checked by the router against the {@link PermissionGate} before {@link #handle}.
     */
    default String capability(HttpMethod method, String path) {
        return null;
    }

    /**
     * Handle the request.
     *
     * @param ctx  Netty channel context
     * @param req  Full HTTP request
     * @param path Request path (without query string)
     * @return Response to send back
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path);

    /**
     * Response from a controller.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        public static ControllerResponse json(Object body) {
            return json(HttpResponseStatus.OK, body);
        }

        public static ControllerResponse json(HttpResponseStatus status, Object body) {
            return new ControllerResponse(status, "application/json", Json.write(body));
        }

        public static ControllerResponse noContent() {
            return new ControllerResponse(HttpResponseStatus.NO_CONTENT, "application/json", "");
        }

        public static ControllerResponse error(HttpResponseStatus status, String code, String message) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", message != null ? message : status.reasonPhrase());
            body.put("code", code);
            return json(status, body);
        }

        public static ControllerResponse notFound(String message) {
            return error(HttpResponseStatus.NOT_FOUND, "not_found", message);
        }

        public static ControllerResponse badRequest(String message) {
            return error(HttpResponseStatus.BAD_REQUEST, "validation_error", message);
        }

        public static ControllerResponse forbidden(String message) {
            return error(HttpResponseStatus.FORBIDDEN, "forbidden", message);
        }

        public static ControllerResponse conflict(String message) {
            return error(HttpResponseStatus.CONFLICT, "conflict", message);
        }
    }
}
