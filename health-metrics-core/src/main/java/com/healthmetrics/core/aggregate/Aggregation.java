package com.healthmetrics.core.aggregate;

import java.util.Collection;

/**
 * Min/max/avg/count reduction shared by the flush path and query-side rollups.
 */
public final class Aggregation {

    private Aggregation() {}

    /** A NaN anywhere in the input makes min, max and avg NaN, regardless of its position. */
    public static MetricStats summarize(double[] values, int length) {
        if (values == null || length <= 0) {
            return MetricStats.EMPTY;
        }
        double min = values[0];
        double max = values[0];
        double sum = 0.0d;
        for (int i = 0; i < length; i++) {
            double v = values[i];
            min = Math.min(min, v);
            max = Math.max(max, v);
            sum += v;
        }
        return new MetricStats(min, max, sum / length, length);
    }

    public static MetricStats summarize(double[] values) {
        return values == null ? MetricStats.EMPTY : summarize(values, values.length);
    }

    public static MetricStats summarize(Collection<Double> values) {
        if (values == null || values.isEmpty()) {
            return MetricStats.EMPTY;
        }
        double[] copy = new double[values.size()];
        int i = 0;
        for (Double v : values) {
            copy[i++] = v;
        }
        return summarize(copy, copy.length);
    }

    /** True when every recorded value is exactly 1.0, which is how counter increments are stored. */
    public static boolean allOnes(double[] values, int length) {
        if (values == null || length <= 0) {
            return false;
        }
        for (int i = 0; i < length; i++) {
            if (values[i] != 1.0d) {
                return false;
            }
        }
        return true;
    }

    /**
     * Combines two partial reductions. The mean is weighted by count so merging is
     * associative and independent of order.
     */
    public static MetricStats merge(MetricStats left, MetricStats right) {
        if (left == null || left.isEmpty()) {
            return right == null ? MetricStats.EMPTY : right;
        }
        if (right == null || right.isEmpty()) {
            return left;
        }
        long count = left.count() + right.count();
        double avg = (left.avg() * left.count() + right.avg() * right.count()) / count;
        return new MetricStats(
                Math.min(left.min(), right.min()), Math.max(left.max(), right.max()), avg, count);
    }

    public static MetricStats mergeAll(Collection<MetricStats> parts) {
        MetricStats result = MetricStats.EMPTY;
        if (parts == null) {
            return result;
        }
        for (MetricStats part : parts) {
            result = merge(result, part);
        }
        return result;
    }
}
