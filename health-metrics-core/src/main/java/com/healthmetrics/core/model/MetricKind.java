package com.healthmetrics.core.model;

public enum MetricKind {
    COUNTER,
    MEASUREMENT
}
