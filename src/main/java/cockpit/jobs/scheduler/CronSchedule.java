package cockpit.jobs.scheduler;

import cockpit.jobs.error.ValidationException;
import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * A parsed 5-field UNIX cron expression evaluated in a time zone.
 */
public final class CronSchedule {

    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private final String expression;
    private final ZoneId zone;
    private final ExecutionTime executionTime;

    private CronSchedule(String expression, ZoneId zone, ExecutionTime executionTime) {
        this.expression = expression;
        this.zone = zone;
        this.executionTime = executionTime;
    }

    /**
     * Parse and validate an expression.
     *
     * @param timeZone IANA zone id, blank means UTC
     * @throws ValidationException if the expression or zone is invalid
     */
    public static CronSchedule parse(String expression, String timeZone) {
        if (expression == null || expression.isBlank()) {
            throw new ValidationException("cron expression is required");
        }
        ZoneId zone;
        try {
            zone = ZoneId.of(timeZone == null || timeZone.isBlank() ? "UTC" : timeZone.trim());
        } catch (DateTimeException e) {
            throw new ValidationException("invalid time zone: " + timeZone);
        }
        Cron cron;
        try {
            cron = PARSER.parse(expression.trim());
            cron.validate();
        } catch (IllegalArgumentException e) {
            throw new ValidationException("invalid cron expression '" + expression + "': " + e.getMessage());
        }
        CronSchedule schedule = new CronSchedule(expression.trim(), zone, ExecutionTime.forCron(cron));
        schedule.nextAfter(Instant.now());
        return schedule;
    }

    /**
     * First occurrence strictly after {@code instant}.
     *
     * @throws ValidationException if the expression never fires again
     */
    public Instant nextAfter(Instant instant) {
        return executionTime.nextExecution(ZonedDateTime.ofInstant(instant, zone))
                .map(ZonedDateTime::toInstant)
                .orElseThrow(() -> new ValidationException("cron expression has no next execution: " + expression));
    }

    public String expression() {
        return expression;
    }

    public ZoneId zone() {
        return zone;
    }
}
