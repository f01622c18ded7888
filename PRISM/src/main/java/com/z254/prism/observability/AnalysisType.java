package com.z254.prism.observability;

/**
 * Analyses PRISM runs, used as the {@code analysis} metric tag and in structured logs.
 */
public enum AnalysisType {
    BASELINE_SAVE("baseline_save"),
    BASELINE_COMPARE("baseline_compare"),
    CHANGE_CORRELATION("change_correlation"),
    ALERT_NOISE("alert_noise"),
    BLAST_RADIUS("blast_radius"),
    FORECAST("forecast"),
    CHANGE_POINTS("change_points"),
    TREND("trend"),
    SEASONALITY("seasonality"),
    ANOMALIES("anomalies");

    private final String tag;

    AnalysisType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
