package com.z254.prism.correlation;

/**
 * A change as reported in correlation results; the timestamp is always epoch seconds.
 *
 * @param id audit entry id the change was read from, may be {@code null}
 */
public record ChangeSummary(String id, long timestamp, String user, String description) {
}
