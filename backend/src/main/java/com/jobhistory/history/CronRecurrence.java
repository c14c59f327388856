package com.jobhistory.history;

import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Standard 5-field cron expression (minute hour day-of-month month day-of-week) evaluated in a fixed zone.
 * Descriptors such as {@code @daily} and {@code @hourly} are accepted as well.
 *
 * <p>When both day-of-month and day-of-week are restricted, a day matches if either field matches.
 * Spring's {@link CronExpression} requires both, so such expressions are split into one expression per day
 * field and the earliest occurrence wins.
 */
public final class CronRecurrence {

    private static final int STANDARD_FIELDS = 5;
    private static final int DAY_OF_MONTH = 2;
    private static final int DAY_OF_WEEK = 4;
    private static final String ANY = "*";

    private final String expression;
    private final List<CronExpression> crons;
    private final ZoneId zone;

    private CronRecurrence(String expression, List<CronExpression> crons, ZoneId zone) {
        this.expression = expression;
        this.crons = crons;
        this.zone = zone;
    }

    /**
     * @throws ScheduleExpressionException if the expression is not a valid 5-field cron expression or descriptor
     */
    public static CronRecurrence parse(String expression, ZoneId zone) {
        if (expression == null || expression.isBlank()) {
            throw new ScheduleExpressionException("empty cron expression");
        }
        String trimmed = expression.strip();
        List<String> springExpressions = new ArrayList<>();
        if (trimmed.startsWith("@")) {
            springExpressions.add(trimmed);
        } else {
            String[] fields = trimmed.split("\\s+");
            if (fields.length != STANDARD_FIELDS) {
                throw new ScheduleExpressionException("expected exactly " + STANDARD_FIELDS
                        + " fields, found " + fields.length + ": \"" + expression + "\"");
            }
            if (isRestricted(fields[DAY_OF_MONTH]) && isRestricted(fields[DAY_OF_WEEK])) {
                springExpressions.add(toSpring(fields, fields[DAY_OF_MONTH], ANY));
                springExpressions.add(toSpring(fields, ANY, fields[DAY_OF_WEEK]));
            } else {
                springExpressions.add(toSpring(fields, fields[DAY_OF_MONTH], fields[DAY_OF_WEEK]));
            }
        }
        try {
            List<CronExpression> crons = new ArrayList<>(springExpressions.size());
            for (String s : springExpressions) {
                crons.add(CronExpression.parse(s));
            }
            return new CronRecurrence(trimmed, List.copyOf(crons), zone);
        } catch (IllegalArgumentException e) {
            throw new ScheduleExpressionException("invalid cron expression \"" + expression + "\": "
                    + e.getMessage(), e);
        }
    }

    /** First occurrence strictly after the given instant; empty if the expression never fires again. */
    public Optional<Instant> next(Instant after) {
        ZonedDateTime from = after.atZone(zone);
        Instant earliest = null;
        for (CronExpression cron : crons) {
            ZonedDateTime next = cron.next(from);
            if (next != null && (earliest == null || next.toInstant().isBefore(earliest))) {
                earliest = next.toInstant();
            }
        }
        return Optional.ofNullable(earliest);
    }

    // A field starting with * or ? (including steps like */2) does not restrict the day.
    private static boolean isRestricted(String field) {
        return !field.startsWith(ANY) && !field.startsWith("?");
    }

    // Spring expressions lead with a seconds field.
    private static String toSpring(String[] fields, String dayOfMonth, String dayOfWeek) {
        return String.join(" ", "0", fields[0], fields[1], dayOfMonth, fields[3], dayOfWeek);
    }

    @Override
    public String toString() {
        return expression;
    }
}
