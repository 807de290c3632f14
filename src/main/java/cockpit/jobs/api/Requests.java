package cockpit.jobs.api;

import cockpit.jobs.error.ValidationException;
import cockpit.jobs.util.Json;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * Request parsing shared by the controllers.
 */
public final class Requests {

    /** Header carrying the authenticated user id */
    public static final String USER_HEADER = "X-Cockpit-User";

    private Requests() {
    }

    public static String user(FullHttpRequest req) {
        String user = req.headers().get(USER_HEADER);
        return user == null || user.isBlank() ? null : user.trim();
    }

    /**
     * Decode the JSON body.
     *
     * @throws ValidationException if the body is missing or malformed
     */
    public static <T> T body(FullHttpRequest req, Class<T> type) {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new ValidationException("request body is required");
        }
        try {
            return Json.read(body, type);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }
    }

    /**
     * Like {@link #body} but an empty body yields null.
     */
    public static <T> T optionalBody(FullHttpRequest req, Class<T> type) {
        if (req.content().readableBytes() == 0) {
            return null;
        }
        return body(req, type);
    }

    public static String query(FullHttpRequest req, String name) {
        Map<String, List<String>> params = new QueryStringDecoder(req.uri()).parameters();
        List<String> values = params.get(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0).trim();
    }

    public static int queryInt(FullHttpRequest req, String name, int defaultValue) {
        String value = query(req, name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ValidationException(name + " must be an integer");
        }
    }

    public static boolean queryBoolean(FullHttpRequest req, String name) {
        return Boolean.parseBoolean(query(req, name));
    }

    /** ISO-8601 instant, e.g. 2024-05-01T00:00:00Z */
    public static Instant queryInstant(FullHttpRequest req, String name) {
        String value = query(req, name);
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new ValidationException(name + " must be an ISO-8601 instant");
        }
    }
}
