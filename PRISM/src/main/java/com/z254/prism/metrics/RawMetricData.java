package com.z254.prism.metrics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Instance data as returned by the monitoring API: one row per sample time, one column per datapoint.
 * <p>
 * Cells are left untyped; the API mixes numbers, {@code null} and a textual missing-data sentinel.
 * Timestamps may be seconds or milliseconds.
 */
public record RawMetricData(List<String> datapointNames, List<List<Object>> values, List<Long> timestamps) {

    public RawMetricData {
        datapointNames = datapointNames != null ? List.copyOf(datapointNames) : List.of();
        // rows may contain nulls, which List.copyOf rejects
        values = values != null ? Collections.unmodifiableList(new ArrayList<>(values)) : List.of();
        timestamps = timestamps != null ? List.copyOf(timestamps) : List.of();
    }

    public static RawMetricData empty() {
        return new RawMetricData(List.of(), List.of(), List.of());
    }
}
