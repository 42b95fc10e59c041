package com.healthmetrics.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single write event. Counters carry the value 1.0.
 */
public record RawMetricPoint(Instant timestamp, String component, String name, double value, MetricKind kind) {

    public static final String GLOBAL_COMPONENT = "Global";

    public RawMetricPoint {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        component = normalizeComponent(component);
    }

    public static RawMetricPoint counter(Instant timestamp, String component, String name) {
        return new RawMetricPoint(timestamp, component, name, 1.0d, MetricKind.COUNTER);
    }

    public static RawMetricPoint measurement(Instant timestamp, String component, String name, double value) {
        return new RawMetricPoint(timestamp, component, name, value, MetricKind.MEASUREMENT);
    }

    public static String normalizeComponent(String component) {
        return component == null || component.isBlank() ? GLOBAL_COMPONENT : component;
    }

    /** Empty and whitespace-only names are dropped by every recording path. */
    public static boolean isValidName(String name) {
        return name != null && !name.isBlank();
    }
}
