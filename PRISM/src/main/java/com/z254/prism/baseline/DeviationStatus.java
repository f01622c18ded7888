package com.z254.prism.baseline;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of a datapoint's deviation from its baseline mean.
 */
public enum DeviationStatus {
    /** Within the normal band */
    NORMAL("normal"),
    /** Moderately above the baseline */
    ELEVATED("elevated"),
    /** Moderately below the baseline */
    REDUCED("reduced"),
    /** Beyond the anomalous band in either direction */
    ANOMALOUS("anomalous"),
    /** No fresh samples to compare */
    NO_DATA("no_data");

    private final String value;

    DeviationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
