package com.z254.prism.correlation;

/**
 * Alerts that started within one fixed-width window.
 * A bucket whose count is above the run's spike threshold, and above 1, is a spike.
 *
 * @param bucketStart epoch seconds, a multiple of the bucket width
 * @param alertCount  alerts that started in the bucket
 */
public record TimeBucket(long bucketStart, int alertCount) {

    public boolean isSpike(double threshold) {
        return alertCount > threshold && alertCount > 1;
    }
}
