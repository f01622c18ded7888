package com.z254.prism.metrics;

/**
 * One cell of a raw metric column after classification.
 */
public sealed interface MetricSample permits MetricSample.Present, MetricSample.Missing {

    /**
     * Epoch seconds of the row, or {@code null} when the row has no timestamp.
     */
    Long timestamp();

    record Present(double value, Long timestamp) implements MetricSample {
    }

    record Missing(Long timestamp) implements MetricSample {
    }
}
