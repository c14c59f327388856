package com.jobhistory.history;

import com.jobhistory.domain.TimeFormats;
import com.jobhistory.domain.WorkflowStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Elapsed time of an execution formatted as HH:MM:SS. Days fold into hours, so hours may exceed 24.
 */
@Component
@RequiredArgsConstructor
public class DurationCalculator {

    private static final long NANOS_PER_SECOND = 1_000_000_000L;
    private static final long NANOS_PER_MINUTE = 60 * NANOS_PER_SECOND;
    private static final long NANOS_PER_HOUR = 60 * NANOS_PER_MINUTE;
    private static final long NANOS_PER_DAY = 24 * NANOS_PER_HOUR;

    private final Clock clock;

    /**
     * Duration between start and end.
     *
     * @param start  run date; blank means no duration
     * @param end    end date; blank with {@code IN_PROGRESS} means now
     * @param status only in-progress, completed and failed executions have a duration
     * @return formatted duration, or empty string when not applicable
     * @throws com.jobhistory.domain.TimeFormatException if either timestamp cannot be parsed
     */
    public String duration(String start, String end, WorkflowStatus status) {
        if (start == null || start.isEmpty()) {
            return "";
        }
        if (status != WorkflowStatus.IN_PROGRESS && status != WorkflowStatus.COMPLETED
                && status != WorkflowStatus.FAILED) {
            return "";
        }
        Instant startT = TimeFormats.parse(start);
        Instant endT = status == WorkflowStatus.IN_PROGRESS && (end == null || end.isEmpty())
                ? clock.instant()
                : TimeFormats.parse(end);
        return format(Duration.between(startT, endT));
    }

    /** Negative elapsed time renders as 00:00:00. */
    static String format(Duration elapsed) {
        long delta = elapsed.isNegative() ? 0 : elapsed.toNanos();
        long days = delta / NANOS_PER_DAY;
        delta -= days * NANOS_PER_DAY;
        long hours = delta / NANOS_PER_HOUR;
        delta -= hours * NANOS_PER_HOUR;
        long minutes = delta / NANOS_PER_MINUTE;
        delta -= minutes * NANOS_PER_MINUTE;
        long seconds = delta / NANOS_PER_SECOND;
        hours += 24 * days;
        return String.format("%02d:%02d:%02d", hours, minutes, seconds);
    }
}
