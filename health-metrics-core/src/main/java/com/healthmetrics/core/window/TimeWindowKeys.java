package com.healthmetrics.core.window;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Derives fixed-width {@code yyyyMMddHHmmss} keys (UTC) for fixed-duration time windows.
 * Keys sort lexicographically in chronological order.
 */
public final class TimeWindowKeys {

    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);

    private static final DateTimeFormatter KEY_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

    private final Duration window;
    private final long windowSeconds;
    private final Clock clock;

    public TimeWindowKeys(Duration window, Clock clock) {
        Objects.requireNonNull(window, "window");
        if (window.getSeconds() < 1) {
            throw new IllegalArgumentException("Window must be at least one second: " + window);
        }
        if (window.getNano() != 0) {
            throw new IllegalArgumentException("Window must be a whole number of seconds: " + window);
        }
        this.window = window;
        this.windowSeconds = window.getSeconds();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static TimeWindowKeys defaults() {
        return new TimeWindowKeys(DEFAULT_WINDOW, Clock.systemUTC());
    }

    public Duration window() {
        return window;
    }

    public Clock clock() {
        return clock;
    }

    public String currentKey() {
        return keyFor(clock.instant());
    }

    public String keyFor(Instant instant) {
        return format(align(instant));
    }

    public Instant align(Instant instant) {
        long epoch = instant.getEpochSecond();
        return Instant.ofEpochSecond(Math.floorDiv(epoch, windowSeconds) * windowSeconds);
    }

    /** Formats at second precision without aligning to a window boundary. */
    public static String format(Instant instant) {
        return KEY_FORMAT.format(instant);
    }

    public static Instant parse(String key) {
        if (key == null || key.length() != 14) {
            throw new IllegalArgumentException("Invalid window key: " + key);
        }
        try {
            return LocalDateTime.parse(key, KEY_FORMAT).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Invalid window key: " + key, ex);
        }
    }
}
