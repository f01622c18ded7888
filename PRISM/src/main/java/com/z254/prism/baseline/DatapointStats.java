package com.z254.prism.baseline;

import com.z254.prism.stats.StatsPrimitives;

import java.util.List;

/**
 * Summary statistics of one datapoint over a baseline window.
 * All four statistics are {@code null} when no samples were available.
 */
public record DatapointStats(Double mean, Double min, Double max, Double stddev, int sampleCount) {

    public static DatapointStats unavailable() {
        return new DatapointStats(null, null, null, null, 0);
    }

    /**
     * Stats over the given samples; the stddev is the sample stddev, 0 for a single sample.
     */
    public static DatapointStats of(List<Double> values) {
        if (values.isEmpty()) {
            return unavailable();
        }
        return new DatapointStats(
                StatsPrimitives.mean(values),
                StatsPrimitives.min(values),
                StatsPrimitives.max(values),
                StatsPrimitives.sampleStddev(values),
                values.size());
    }

    public boolean hasData() {
        return sampleCount > 0;
    }
}
