package com.z254.prism.correlation;

/**
 * A configuration change from the audit log.
 *
 * @param id          audit entry id, may be {@code null}
 * @param timestamp   when the change happened, seconds or milliseconds
 * @param user        who made the change
 * @param description what changed
 */
public record ChangeEvent(String id, long timestamp, String user, String description) {
}
