package com.healthmetrics.core.collect;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Map;
import java.util.TreeMap;

/**
 * Current-window view rendered by {@code dump()}: counters as a plain count, measurements as
 * {@code {count, min, max, avg}}.
 */
@JsonPropertyOrder({"Identity", "Started", "Metrics"})
public record MetricsSnapshot(
        @JsonProperty("Identity") String identity,
        @JsonProperty("Started") long started,
        @JsonProperty("Metrics") Map<String, Map<String, Object>> metrics) {

    static MetricsSnapshot of(
            String identity, long started, Map<String, Map<String, TimeWindowedCollector.SeriesSummary>> window) {
        Map<String, Map<String, Object>> metrics = new TreeMap<>();
        window.forEach((component, summaries) -> {
            Map<String, Object> rendered = new TreeMap<>();
            summaries.forEach((name, summary) ->
                    rendered.put(name, summary.counter() ? (Object) summary.stats().count() : summary.stats()));
            metrics.put(component, rendered);
        });
        return new MetricsSnapshot(identity, started, metrics);
    }
}
