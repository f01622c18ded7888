package com.z254.prism.metrics;

import java.util.List;

/**
 * Cleaned samples of one datapoint; {@code values.get(i)} was sampled at {@code timestamps.get(i)}
 * (epoch seconds).
 */
public record MetricSeries(List<Double> values, List<Long> timestamps) {

    public MetricSeries {
        if (values.size() != timestamps.size()) {
            throw new IllegalArgumentException("values and timestamps must have the same length: "
                    + values.size() + " != " + timestamps.size());
        }
        values = List.copyOf(values);
        timestamps = List.copyOf(timestamps);
    }

    public static MetricSeries empty() {
        return new MetricSeries(List.of(), List.of());
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }
}
