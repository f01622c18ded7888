package com.z254.prism.correlation;

import java.util.List;

/**
 * Outcome of a change correlation run.
 * The uncorrelated lists are truncated; the totals are not.
 */
public record ChangeCorrelationReport(int totalAlerts,
                                      int totalChanges,
                                      int totalSpikes,
                                      double spikeThreshold,
                                      List<CorrelatedEvent> correlatedEvents,
                                      List<ChangeSummary> uncorrelatedChanges,
                                      List<TimeBucket> uncorrelatedSpikes,
                                      int hoursBack,
                                      int correlationWindowMinutes) {
}
