package com.healthmetrics.core.collect;

import com.healthmetrics.core.aggregate.Aggregation;
import com.healthmetrics.core.aggregate.MetricStats;
import java.util.Arrays;

/**
 * Append-only sequence of raw values for one metric in one window.
 */
public final class ValueSeries {

    private static final int INITIAL_CAPACITY = 8;

    private double[] values = new double[INITIAL_CAPACITY];
    private int size;

    public synchronized void append(double value) {
        if (size == values.length) {
            values = Arrays.copyOf(values, size << 1);
        }
        values[size++] = value;
    }

    public synchronized void appendAll(ValueSeries other) {
        double[] incoming = other.toArray();
        int required = size + incoming.length;
        if (required > values.length) {
            values = Arrays.copyOf(values, Math.max(required, values.length << 1));
        }
        System.arraycopy(incoming, 0, values, size, incoming.length);
        size = required;
    }

    public synchronized int size() {
        return size;
    }

    public synchronized int capacity() {
        return values.length;
    }

    public synchronized double[] toArray() {
        return Arrays.copyOf(values, size);
    }

    public synchronized MetricStats summarize() {
        return Aggregation.summarize(values, size);
    }

    public synchronized boolean allOnes() {
        return Aggregation.allOnes(values, size);
    }
}
