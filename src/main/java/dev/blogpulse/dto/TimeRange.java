package dev.blogpulse.dto;

import java.time.Duration;
import java.util.Locale;

/**
 * Reporting window parsed from the {@code range} query parameter.
 *
 * @param window how far back from now the report looks
 * @param label  human readable label, also used as the cache key suffix
 */
public record TimeRange(Duration window, String label) {

    public static final int MAX_DAYS = 365;

    /**
     * Accepts {@code 1h}, {@code 24h}, {@code 7d}, {@code 30d}, {@code 90d}, {@code 365d}, their word
     * aliases, or a plain number of days (capped at 365). Anything else yields {@code fallbackDays}.
     */
    public static TimeRange parse(String range, int fallbackDays) {
        String r = range == null ? "" : range.trim().toLowerCase(Locale.ROOT);
        return switch (r) {
            case "1h", "hour", "last_hour" -> new TimeRange(Duration.ofHours(1), "last hour");
            case "24h", "1d", "day", "last_day" -> new TimeRange(Duration.ofHours(24), "last 24 hours");
            case "7d", "week", "last_week" -> ofDays(7);
            case "30d", "month", "last_month" -> ofDays(30);
            case "90d", "quarter" -> ofDays(90);
            case "365d", "year", "last_year" -> new TimeRange(Duration.ofDays(365), "last year");
            default -> parseDays(r, fallbackDays);
        };
    }

    public static TimeRange ofDays(int days) {
        int clamped = Math.max(1, Math.min(MAX_DAYS, days));
        return new TimeRange(Duration.ofDays(clamped), "last " + clamped + " days");
    }

    private static TimeRange parseDays(String raw, int fallbackDays) {
        String digits = raw.endsWith("d") ? raw.substring(0, raw.length() - 1) : raw;
        try {
            int days = Integer.parseInt(digits);
            return days > 0 ? ofDays(days) : ofDays(fallbackDays);
        } catch (NumberFormatException e) {
            return ofDays(fallbackDays);
        }
    }

    /** Cache key friendly form of the label. */
    public String key() {
        return label.replace(' ', '_');
    }
}
