package com.z254.prism.stats;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A CUSUM changepoint.
 *
 * @param index     position in the analysed series
 * @param direction whether the level shifted up or down
 * @param magnitude the running sum that crossed the threshold
 */
public record ChangePoint(int index, Direction direction, double magnitude) {

    public enum Direction {
        INCREASE("increase"),
        DECREASE("decrease");

        private final String value;

        Direction(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }
}
