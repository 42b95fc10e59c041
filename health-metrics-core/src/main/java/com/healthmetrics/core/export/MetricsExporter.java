package com.healthmetrics.core.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.healthmetrics.core.json.JsonSupport;
import com.healthmetrics.core.model.AggregatedEntry;
import com.healthmetrics.core.storage.PersistenceManager;
import com.healthmetrics.core.storage.StorageException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Renders persisted metrics as JSON documents for offline analysis. */
@Slf4j
@RequiredArgsConstructor
public class MetricsExporter {

    public static final String FORMAT_JSON = "json";

    private final PersistenceManager persistence;

    public String exportComponent(String component, Instant start, Instant end) {
        return JsonSupport.toPrettyJson(componentExport(component, start, end));
    }

    public String exportAll(Instant start, Instant end, String format) {
        if (!FORMAT_JSON.equalsIgnoreCase(Objects.requireNonNullElse(format, ""))) {
            throw new IllegalArgumentException("unsupported format: " + format + " (only 'json' supported)");
        }
        return JsonSupport.toPrettyJson(allExport(start, end));
    }

    public ComponentExport componentExport(String component, Instant start, Instant end) {
        List<AggregatedEntry> entries = persistence.readMetrics(component, start, end);
        return new ComponentExport(component, toMetrics(entries));
    }

    public AllMetricsExport allExport(Instant start, Instant end) {
        List<ComponentExport> components = new ArrayList<>();
        int totalMetrics = 0;
        for (String component : persistence.listComponents()) {
            List<AggregatedEntry> entries;
            try {
                entries = persistence.readMetrics(component, start, end);
            } catch (StorageException ex) {
                log.warn("Skipping component in export component={} reason={}", component, ex.getMessage());
                continue;
            }
            List<ExportedMetric> metrics = toMetrics(entries);
            components.add(new ComponentExport(component, metrics));
            totalMetrics += metrics.size();
        }
        int spanHours = (int) Duration.between(start, end).toHours();
        return new AllMetricsExport(
                start, end, components, new ExportSummary(components.size(), totalMetrics, spanHours));
    }

    private static List<ExportedMetric> toMetrics(List<AggregatedEntry> entries) {
        List<ExportedMetric> metrics = new ArrayList<>(entries.size());
        for (AggregatedEntry entry : entries) {
            if (entry.isCounter()) {
                metrics.add(new ExportedMetric(entry.windowStart(), entry.metricName(), "counter", entry.count()));
            } else {
                metrics.add(new ExportedMetric(entry.windowStart(), entry.metricName(), "value", entry.stats()));
            }
        }
        return metrics;
    }

    public record ExportedMetric(Instant timestamp, String name, String type, Object value) {}

    public record ComponentExport(String component, List<ExportedMetric> metrics) {}

    public record ExportSummary(
            @JsonProperty("total_components") int totalComponents,
            @JsonProperty("total_metrics") int totalMetrics,
            @JsonProperty("time_span_hours") int timeSpanHours) {}

    public record AllMetricsExport(
            @JsonProperty("start_time") Instant startTime,
            @JsonProperty("end_time") Instant endTime,
            List<ComponentExport> components,
            ExportSummary summary) {}
}
