package com.jobhistory.history;

import com.jobhistory.domain.Job;
import com.jobhistory.domain.Schedule;
import com.jobhistory.domain.TimeFormats;
import com.jobhistory.domain.WorkflowStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Maintains a job's recurrence bookkeeping (run_count, total_recurrences, last_run, next_run) when one of its
 * executions starts. Other statuses leave the job untouched.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RecurrenceScheduler {

    /** total_recurrences value for schedules without an end. */
    public static final long UNBOUNDED = 0;

    private final Clock clock;

    /**
     * Applies the run statistics update for an execution observed with the given status. Mutates and returns the job.
     *
     * @throws com.jobhistory.domain.TimeFormatException if the schedule start or end cannot be parsed
     * @throws ScheduleExpressionException              if the recurrence expression is invalid
     */
    public Job updateRunStats(Job job, WorkflowStatus status) {
        if (status != WorkflowStatus.IN_PROGRESS) {
            return job;
        }
        Instant now = clock.instant();
        if (job.getRunCount() > 0) {
            return advance(job, now);
        }
        return firstRun(job, now);
    }

    private Job advance(Job job, Instant now) {
        Optional<Schedule> schedule = job.scheduleValue();
        if (schedule.isEmpty()) {
            return job;
        }
        job.setLastRun(job.getNextRun());
        job.setRunCount(job.getRunCount() + 1);
        if (job.getRunCount() == job.getTotalRecurrences()) {
            log.debug("Job {} reached its final run ({})", job.getId(), job.getRunCount());
            return job;
        }
        Optional<String> timeCycle = schedule.get().timeCycleValue();
        if (timeCycle.isEmpty()) {
            return job;
        }
        CronRecurrence cron = CronRecurrence.parse(timeCycle.get(), clock.getZone());
        job.setNextRun(nextAfter(cron, now));
        return job;
    }

    private Job firstRun(Job job, Instant now) {
        job.setRunCount(1);
        job.setTotalRecurrences(1);
        job.setLastRun(now);
        job.setNextRun(now);

        Optional<Schedule> scheduleOpt = job.scheduleValue();
        if (scheduleOpt.isEmpty()) {
            return job;
        }
        Schedule schedule = scheduleOpt.get();
        if (job.isRunNow()) {
            job.setNextRun(TimeFormats.parse(schedule.getStart()));
        }

        Optional<String> timeCycle = schedule.timeCycleValue();
        if (timeCycle.isEmpty()) {
            if (job.isRunNow()) {
                job.setTotalRecurrences(job.getTotalRecurrences() + 1);
            }
            return job;
        }

        CronRecurrence cron = CronRecurrence.parse(timeCycle.get(), clock.getZone());
        job.setNextRun(nextAfter(cron, now));

        Optional<String> end = schedule.endValue();
        if (end.isEmpty()) {
            job.setTotalRecurrences(UNBOUNDED);
            return job;
        }
        long occurrences = countOccurrences(cron, job.getNextRun(), TimeFormats.parse(end.get()));
        job.setTotalRecurrences(job.isRunNow() ? occurrences + 1 : occurrences);
        return job;
    }

    /** Occurrences from {@code first} (inclusive) up to and including {@code end}. */
    static long countOccurrences(CronRecurrence cron, Instant first, Instant end) {
        long count = 0;
        Optional<Instant> t = Optional.of(first);
        while (t.isPresent() && !t.get().isAfter(end)) {
            count++;
            t = cron.next(t.get());
        }
        return count;
    }

    private static Instant nextAfter(CronRecurrence cron, Instant now) {
        return cron.next(now).orElseThrow(() ->
                new ScheduleExpressionException("cron expression \"" + cron + "\" has no occurrence after " + now));
    }
}
