package io.jobcast4j.utils;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Date;
import java.util.TimeZone;

import org.quartz.CronExpression;

/**
 * Evaluates schedule cron strings.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Standard 5-field cron: "minute hour day-of-month month day-of-week", e.g. "*&#47;5 * * * *"</li>
 *   <li>6-field cron with a leading seconds field, e.g. "0 0 2 * * *"</li>
 * </ul>
 * <p>
 * Both are rewritten to the Quartz dialect before evaluation. Numeric day-of-week values in 5-field
 * expressions use the Unix numbering (0 or 7 = Sunday) and are shifted to Quartz numbering (1 = Sunday).
 * <p>
 * Restricting both day-of-month and day-of-week (e.g. "0 0 1 * 1", which Unix cron reads as "the 1st
 * OR a Monday") is not supported: Quartz can only evaluate one of the two day fields, so such
 * expressions are rejected with an {@link IllegalArgumentException} naming both fields.
 */
public final class CronExpressions {
    private CronExpressions() {
    }

    /**
     * Computes the first cron occurrence strictly after {@code from}.
     *
     * @param spec cron expression (5 or 6 fields)
     * @param zone zone the expression is evaluated in; null means system default
     * @param from base instant
     * @return next fire time
     * @throws IllegalArgumentException if the expression is invalid or never fires again
     */
    public static Instant nextRunAt(String spec, ZoneId zone, Instant from) {
        if (from == null) {
            throw new IllegalArgumentException("from must not be null");
        }
        String cron = normalizeCron(spec);
        if (!CronExpression.isValidExpression(cron)) {
            throw new IllegalArgumentException("Invalid cron expression: " + spec);
        }

        CronExpression exp;
        try {
            exp = new CronExpression(cron);
        } catch (Exception ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + spec, ex);
        }
        exp.setTimeZone(TimeZone.getTimeZone(zone != null ? zone : ZoneId.systemDefault()));

        Date next = exp.getNextValidTimeAfter(Date.from(from));
        if (next == null) {
            throw new IllegalArgumentException("Cron expression produced no next execution time: " + spec);
        }
        return next.toInstant();
    }

    /**
     * Returns true if the string can be evaluated by {@link #nextRunAt(String, ZoneId, Instant)}.
     */
    public static boolean isValid(String spec) {
        try {
            return CronExpression.isValidExpression(normalizeCron(spec));
        } catch (Exception ignored) {
            return false;
        }
    }

    /**
     * Normalize cron expressions into Quartz syntax:
     * - 5-field cron gets a "0" seconds field and Unix day-of-week numbering is shifted.
     * - 6-field cron is passed through apart from the day-of-month/day-of-week "?" rule.
     */
    public static String normalizeCron(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("spec must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], shiftDayOfWeek(parts[4]));
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        throw new IllegalArgumentException("Expected 5 or 6 cron fields: " + spec);
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = dayOfWeek;

        // Quartz needs exactly one of the two day fields to be '?'
        if (!"?".equals(dom) && !"?".equals(dow)) {
            if ("*".equals(dow)) {
                dow = "?";
            } else if ("*".equals(dom)) {
                dom = "?";
            } else {
                throw new IllegalArgumentException("Restricting both day-of-month (" + dayOfMonth
                        + ") and day-of-week (" + dayOfWeek + ") is not supported; use '*' in one of them");
            }
        }

        return String.join(" ", sec, min, hour, dom, month, dow);
    }

    private static String shiftDayOfWeek(String field) {
        StringBuilder out = new StringBuilder();
        String[] items = field.split(",");
        for (int i = 0; i < items.length; i++) {
            if (i > 0) {
                out.append(',');
            }
            String item = items[i];
            int slash = item.indexOf('/');
            String range = slash < 0 ? item : item.substring(0, slash);
            String step = slash < 0 ? "" : item.substring(slash);

            String[] bounds = range.split("-", -1);
            for (int b = 0; b < bounds.length; b++) {
                if (b > 0) {
                    out.append('-');
                }
                out.append(bounds[b].matches("^\\d+$") ? toQuartzDay(bounds[b]) : bounds[b]);
            }
            out.append(step);
        }
        return out.toString();
    }

    private static String toQuartzDay(String unixDay) {
        int n = Integer.parseInt(unixDay);
        if (n < 0 || n > 7) {
            throw new IllegalArgumentException("Day-of-week out of range: " + unixDay);
        }
        return Integer.toString(n == 7 ? 1 : n + 1);
    }
}
