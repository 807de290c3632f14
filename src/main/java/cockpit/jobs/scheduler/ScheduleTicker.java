package cockpit.jobs.scheduler;

import cockpit.jobs.error.JobsException;
import cockpit.jobs.model.JobRun;
import cockpit.jobs.model.JobSchedule;
import cockpit.jobs.repository.JobScheduleRepository;
import cockpit.jobs.service.DispatchRequest;
import cockpit.jobs.service.Dispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * One pass of the scheduler loop: dispatch every due schedule once and move
 * its next_run_at past "now".
 *
 * Occurrences missed while the process was down collapse into the single
 * run dispatched for the stored next_run_at.
 */
public class ScheduleTicker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ScheduleTicker.class);

    public static final String TRIGGERED_BY = "scheduler";

    private static final int BATCH_LIMIT = 100;

    private final JobScheduleRepository scheduleRepository;
    private final Dispatcher dispatcher;
    private final Clock clock;

    public ScheduleTicker(JobScheduleRepository scheduleRepository, Dispatcher dispatcher, Clock clock) {
        this.scheduleRepository = scheduleRepository;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            tick();
        } catch (Exception e) {
            log.error("Schedule tick error", e);
        }
    }

    /**
     * Evaluate due schedules.
     *
     * @return number of schedules that fired
     */
    public int tick() {
        Instant now = clock.instant();
        List<JobSchedule> due = scheduleRepository.findDue(now, BATCH_LIMIT);

        if (due.isEmpty()) {
            log.debug("No due schedules at {}", now);
            return 0;
        }

        int fired = 0;
        for (JobSchedule schedule : due) {
            try {
                if (fire(schedule, now)) {
                    fired++;
                }
            } catch (Exception e) {
                log.error("Failed to fire schedule {}", schedule.id(), e);
            }
        }

        log.info("Schedule tick: {} of {} due schedule(s) fired", fired, due.size());
        return fired;
    }

    private boolean fire(JobSchedule schedule, Instant now) {
        Instant occurrence = schedule.nextRunAt();
        Instant next = CronSchedule.parse(schedule.cronExpression(), schedule.timeZone()).nextAfter(now);

        if (occurrence.isBefore(now.minusSeconds(60))) {
            log.info("Schedule {} missed occurrences since {}, firing once", schedule.id(), occurrence);
        }

        String runId = null;
        try {
            JobRun run = dispatcher.dispatch(new DispatchRequest(
                    schedule.templateId(), null, null, TRIGGERED_BY, null, null, schedule.id(), occurrence));
            runId = run.id();
            log.info("Schedule {} fired for {}: run {} ({})", schedule.id(), occurrence, run.id(), run.status());
        } catch (JobsException | IllegalArgumentException e) {
            // the definition is broken; skip this occurrence instead of retrying it every tick
            log.error("Schedule {} could not dispatch for {}: {}", schedule.id(), occurrence, e.getMessage());
        }

        boolean advanced = scheduleRepository.advance(schedule.id(), occurrence, next, runId);
        if (!advanced) {
            log.info("Schedule {} was advanced concurrently", schedule.id());
        }
        return runId != null && advanced;
    }
}
