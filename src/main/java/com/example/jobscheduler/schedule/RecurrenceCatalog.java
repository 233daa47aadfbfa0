package com.example.jobscheduler.schedule;

import com.example.jobscheduler.domain.enums.SchedulePreset;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Normalizes schedule input into five-field cron expressions and describes them back.
 * <p>
 * Supported input:
 * <ul>
 *   <li>Preset names and aliases: "daily", "weekly", "weekly_friday", "biweekly", "monthly", ...</li>
 *   <li>Times of day in 24-hour "H:MM" / "HH:MM" form</li>
 * </ul>
 * <p>
 * {@link #describe(String)} only recognizes the shapes produced by
 * {@link #buildExpression(SchedulePreset, String)}; any other expression is returned unchanged.
 */
public final class RecurrenceCatalog {

    public static final String DEFAULT_TIME = "09:00";

    private static final Pattern TIME_PATTERN = Pattern.compile("^(\\d{1,2}):(\\d{2})$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Map<String, SchedulePreset> ALIASES = Map.of(
            "daily", SchedulePreset.DAILY_9AM,
            "daily_9am", SchedulePreset.DAILY_9AM,
            "weekly", SchedulePreset.WEEKLY_MONDAY,
            "weekly_monday", SchedulePreset.WEEKLY_MONDAY,
            "weekly_friday", SchedulePreset.WEEKLY_FRIDAY,
            "biweekly", SchedulePreset.BIWEEKLY,
            "monthly", SchedulePreset.MONTHLY_FIRST,
            "monthly_first", SchedulePreset.MONTHLY_FIRST
    );

    private RecurrenceCatalog() {
    }

    /**
     * Resolve a preset name or alias, case-insensitively.
     *
     * @param name user supplied schedule name
     * @return the preset, or empty if the name is unknown
     */
    public static Optional<SchedulePreset> normalizePreset(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(ALIASES.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Validate a time of day and format it as zero-padded "HH:MM".
     *
     * @param text time such as "9:05" or "18:30"
     * @return the normalized time, or empty if malformed or out of range
     */
    public static Optional<String> normalizeTimeOfDay(String text) {
        return parseTime(text).map(hm -> formatTime(hm[0], hm[1]));
    }

    /**
     * Build the cron expression for a preset at {@link #DEFAULT_TIME}.
     */
    public static Optional<String> buildExpression(SchedulePreset preset) {
        return buildExpression(preset, DEFAULT_TIME);
    }

    /**
     * Build the cron expression for a preset at the given time of day.
     *
     * @return the expression, or empty if the time is invalid
     */
    public static Optional<String> buildExpression(SchedulePreset preset, String time) {
        if (preset == null) {
            return Optional.empty();
        }
        return parseTime(time).map(hm -> {
            int hour = hm[0];
            int minute = hm[1];
            return switch (preset) {
                case DAILY_9AM -> minute + " " + hour + " * * *";
                case WEEKLY_MONDAY -> minute + " " + hour + " * * 1";
                case WEEKLY_FRIDAY -> minute + " " + hour + " * * 5";
                case BIWEEKLY -> minute + " " + hour + " 1,15 * *";
                case MONTHLY_FIRST -> minute + " " + hour + " 1 * *";
            };
        });
    }

    /**
     * Human-readable description of a cron expression.
     * Best effort: unknown shapes come back unchanged. Never throws.
     */
    public static String describe(String cronExpression) {
        if (cronExpression == null) {
            return null;
        }

        var parts = WHITESPACE.split(cronExpression.trim());
        if (parts.length != 5) {
            return cronExpression;
        }

        var minute = parseSmallInt(parts[0]);
        var hour = parseSmallInt(parts[1]);
        if (minute < 0 || minute > 59 || hour < 0 || hour > 23) {
            return cronExpression;
        }

        var time = formatTime(hour, minute);
        var dayOfMonth = parts[2];
        var month = parts[3];
        var dayOfWeek = parts[4];

        if (!"*".equals(month)) {
            return cronExpression;
        }
        if ("*".equals(dayOfMonth) && "*".equals(dayOfWeek)) {
            return "Daily at " + time;
        }
        if ("*".equals(dayOfMonth) && "1".equals(dayOfWeek)) {
            return "Every Monday at " + time;
        }
        if ("*".equals(dayOfMonth) && "5".equals(dayOfWeek)) {
            return "Every Friday at " + time;
        }
        if ("1,15".equals(dayOfMonth) && "*".equals(dayOfWeek)) {
            return "Every two weeks at " + time;
        }
        if ("1".equals(dayOfMonth) && "*".equals(dayOfWeek)) {
            return "Monthly (day 1) at " + time;
        }

        return cronExpression;
    }

    private static Optional<int[]> parseTime(String time) {
        if (time == null) {
            return Optional.empty();
        }
        var matcher = TIME_PATTERN.matcher(time.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }

        var hour = Integer.parseInt(matcher.group(1));
        var minute = Integer.parseInt(matcher.group(2));
        if (hour > 23 || minute > 59) {
            return Optional.empty();
        }
        return Optional.of(new int[]{hour, minute});
    }

    /**
     * Parse a plain non-negative field value of at most two digits, -1 otherwise
     */
    private static int parseSmallInt(String field) {
        if (field.isEmpty() || field.length() > 2) {
            return -1;
        }
        for (var i = 0; i < field.length(); i++) {
            if (!Character.isDigit(field.charAt(i))) {
                return -1;
            }
        }
        return Integer.parseInt(field);
    }

    private static String formatTime(int hour, int minute) {
        return String.format(Locale.ROOT, "%02d:%02d", hour, minute);
    }
}
