package com.healthmetrics.core.config;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses ISO-8601 durations ("PT30S") and shorthand such as "500ms", "30s", "5m", "1h", "1d" or
 * combinations like "1h30m".
 */
public final class DurationParser {

    private static final Pattern SHORTHAND = Pattern.compile("(\\d+)(ms|s|m|h|d)");

    private DurationParser() {}

    public static Duration parse(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Duration cannot be null or empty");
        }

        String trimmed = input.trim();
        if (trimmed.regionMatches(true, 0, "P", 0, 1)) {
            try {
                return Duration.parse(trimmed.toUpperCase(Locale.ROOT));
            } catch (Exception ex) {
                throw new IllegalArgumentException("Unsupported duration format: " + input, ex);
            }
        }

        String lower = trimmed.toLowerCase(Locale.ROOT);
        Matcher matcher = SHORTHAND.matcher(lower);
        Duration total = Duration.ZERO;
        int position = 0;
        while (matcher.find()) {
            if (matcher.start() != position) {
                throw new IllegalArgumentException("Unsupported duration format: " + input);
            }
            long value = Long.parseLong(matcher.group(1));
            total = total.plus(switch (matcher.group(2)) {
                case "ms" -> Duration.ofMillis(value);
                case "s" -> Duration.ofSeconds(value);
                case "m" -> Duration.ofMinutes(value);
                case "h" -> Duration.ofHours(value);
                default -> Duration.ofDays(value);
            });
            position = matcher.end();
        }
        if (position == 0 || position != lower.length()) {
            throw new IllegalArgumentException("Unsupported duration format: " + input);
        }
        return total;
    }

    /** Returns {@code fallback} when the input is missing, malformed or not positive. */
    public static Duration parseOrDefault(String input, Duration fallback) {
        if (input == null || input.isBlank()) {
            return fallback;
        }
        try {
            Duration parsed = parse(input);
            return parsed.isZero() || parsed.isNegative() ? fallback : parsed;
        } catch (IllegalArgumentException | ArithmeticException ex) {
            return fallback;
        }
    }
}
