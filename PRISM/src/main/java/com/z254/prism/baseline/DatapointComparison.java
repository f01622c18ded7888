package com.z254.prism.baseline;

/**
 * Fresh data of one datapoint measured against its baseline.
 * {@code currentMean} and {@code deviationPercent} are {@code null} for {@link DeviationStatus#NO_DATA}.
 */
public record DatapointComparison(DeviationStatus status,
                                  double baselineMean,
                                  Double currentMean,
                                  Double deviationPercent) {

    public static DatapointComparison noData(double baselineMean) {
        return new DatapointComparison(DeviationStatus.NO_DATA, baselineMean, null, null);
    }
}
