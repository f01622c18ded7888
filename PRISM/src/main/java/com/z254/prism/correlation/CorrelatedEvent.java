package com.z254.prism.correlation;

/**
 * A change followed, within the correlation window, by an alert spike.
 *
 * @param change         the change
 * @param spike          the first spike that started within the window after it
 * @param timeGapMinutes minutes from the change to the spike bucket start
 * @param confidence     1.0 for a spike at the change time, decaying linearly to 0.5 at the window edge
 */
public record CorrelatedEvent(ChangeSummary change, TimeBucket spike, double timeGapMinutes, double confidence) {
}
