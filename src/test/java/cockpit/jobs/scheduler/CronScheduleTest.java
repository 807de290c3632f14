package cockpit.jobs.scheduler;

import cockpit.jobs.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class CronScheduleTest {

    @Test
    void nextAfterIsStrictlyLater() {
        CronSchedule cron = CronSchedule.parse("*/15 * * * *", "UTC");

        assertEquals(Instant.parse("2026-03-01T10:15:00Z"), cron.nextAfter(Instant.parse("2026-03-01T10:00:00Z")));
        assertEquals(Instant.parse("2026-03-01T10:15:00Z"), cron.nextAfter(Instant.parse("2026-03-01T10:14:59Z")));
    }

    @Test
    void blankZoneMeansUtc() {
        assertEquals(ZoneId.of("UTC"), CronSchedule.parse("0 * * * *", " ").zone());
        assertEquals(ZoneId.of("UTC"), CronSchedule.parse("0 * * * *", null).zone());
    }

    @Test
    void zoneShiftsOccurrences() {
        CronSchedule cron = CronSchedule.parse("30 8 * * *", "America/New_York");
        // 08:30 EST is 13:30 UTC
        assertEquals(Instant.parse("2026-01-15T13:30:00Z"), cron.nextAfter(Instant.parse("2026-01-15T12:00:00Z")));
    }

    @Test
    void invalidInputIsRejected() {
        assertThrows(ValidationException.class, () -> CronSchedule.parse("", "UTC"));
        assertThrows(ValidationException.class, () -> CronSchedule.parse("* * *", "UTC"));
        assertThrows(ValidationException.class, () -> CronSchedule.parse("* * * * *", "Nowhere/Special"));
    }

    @Test
    void expressionIsTrimmed() {
        assertEquals("0 2 * * *", CronSchedule.parse("  0 2 * * * ", "UTC").expression());
    }
}
