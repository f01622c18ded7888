package com.z254.prism.stats;

import com.z254.prism.exception.InvalidInputException;

import java.util.ArrayList;
import java.util.List;

/**
 * Pure statistical functions over numeric sequences.
 * <p>
 * Stateless and side-effect free; no Spring dependencies. Used by the baseline,
 * correlation and trend components.
 *
 * <h3>Functions</h3>
 * <ul>
 *     <li>Ordinary-least-squares regression</li>
 *     <li>Pearson correlation and autocorrelation</li>
 *     <li>Two-sided CUSUM changepoint detection</li>
 *     <li>Shannon entropy and coefficient of variation</li>
 * </ul>
 */
public final class StatsPrimitives {

    /** Minimum series length for CUSUM detection. */
    private static final int CUSUM_MIN_POINTS = 4;

    /** Drift correction applied per step, as a fraction of stddev. */
    private static final double CUSUM_DRIFT_FACTOR = 0.5;

    /** Threshold multiplier applied to {@code sensitivity * stddev}. */
    private static final double CUSUM_THRESHOLD_FACTOR = 2.0;

    private StatsPrimitives() {
    }

    // ── Regression & correlation ───────────────────────────────────────────

    /**
     * Fits {@code y = slope * x + intercept} by closed-form OLS sums.
     * <p>
     * When every {@code x} is identical the slope is undefined; the fit then
     * degrades to {@code slope = 0, intercept = mean(y), rSquared = 0}.
     *
     * @throws InvalidInputException if the lengths differ or fewer than 2 points are given
     */
    public static Regression linearRegression(List<Double> x, List<Double> y) {
        requirePaired(x, y, "regression");
        int n = x.size();

        double sumX = 0, sumY = 0, sumXY = 0, sumX2 = 0;
        for (int i = 0; i < n; i++) {
            double xi = x.get(i);
            double yi = y.get(i);
            sumX += xi;
            sumY += yi;
            sumXY += xi * yi;
            sumX2 += xi * xi;
        }

        double denominator = n * sumX2 - sumX * sumX;
        if (denominator == 0) {
            return new Regression(0.0, sumY / n, 0.0);
        }

        double slope = (n * sumXY - sumX * sumY) / denominator;
        double intercept = (sumY - slope * sumX) / n;

        double meanY = sumY / n;
        double ssTot = 0, ssRes = 0;
        for (int i = 0; i < n; i++) {
            double yi = y.get(i);
            double predicted = slope * x.get(i) + intercept;
            ssTot += (yi - meanY) * (yi - meanY);
            ssRes += (yi - predicted) * (yi - predicted);
        }
        double rSquared = ssTot != 0 ? 1.0 - ssRes / ssTot : 0.0;

        return new Regression(slope, intercept, rSquared);
    }

    /**
     * Pearson correlation coefficient in [-1, 1].
     * Returns 0.0 if either series has zero variance.
     *
     * @throws InvalidInputException if the lengths differ or fewer than 2 points are given
     */
    public static double pearsonCorrelation(List<Double> x, List<Double> y) {
        requirePaired(x, y, "correlation");
        int n = x.size();

        double meanX = mean(x);
        double meanY = mean(y);

        double covariance = 0, varX = 0, varY = 0;
        for (int i = 0; i < n; i++) {
            double dx = x.get(i) - meanX;
            double dy = y.get(i) - meanY;
            covariance += dx * dy;
            varX += dx * dx;
            varY += dy * dy;
        }

        double denominator = Math.sqrt(varX * varY);
        if (denominator == 0) {
            return 0.0;
        }
        return covariance / denominator;
    }

    /**
     * Autocorrelation of a series with itself shifted by {@code lag} steps.
     * Returns 0.0 for a non-positive lag, a lag at or beyond the series length,
     * fewer than 2 points, or zero variance.
     */
    public static double autocorrelation(List<Double> values, int lag) {
        int n = values == null ? 0 : values.size();
        if (lag <= 0 || lag >= n || n < 2) {
            return 0.0;
        }

        double mean = mean(values);
        double variance = 0;
        for (double v : values) {
            variance += (v - mean) * (v - mean);
        }
        variance /= n;
        if (variance == 0) {
            return 0.0;
        }

        double covariance = 0;
        for (int i = 0; i < n - lag; i++) {
            covariance += (values.get(i) - mean) * (values.get(i + lag) - mean);
        }
        covariance /= (n - lag);

        return covariance / variance;
    }

    // ── Changepoint detection ──────────────────────────────────────────────

    /**
     * Two-sided CUSUM changepoint detection around the series mean.
     *
     * @see #cusum(List, Double, double)
     */
    public static List<ChangePoint> cusum(List<Double> values, double sensitivity) {
        return cusum(values, null, sensitivity);
    }

    /**
     * Two-sided cumulative-sum changepoint detection.
     * <p>
     * The dispersion estimate is the root-mean-square deviation from
     * {@code target}. Each step subtracts a drift of {@code 0.5 * stddev} from
     * both running sums; a sum above {@code sensitivity * stddev * 2} emits a
     * changepoint at that index and resets to zero. The two sums are independent
     * and may both fire at the same index.
     *
     * @param values      the series
     * @param target      expected level, or {@code null} for the series mean
     * @param sensitivity threshold multiplier; lower detects smaller shifts
     * @return changepoints in index order, empty for fewer than 4 points or zero dispersion
     */
    public static List<ChangePoint> cusum(List<Double> values, Double target, double sensitivity) {
        if (values == null || values.size() < CUSUM_MIN_POINTS) {
            return List.of();
        }

        double level = target != null ? target : mean(values);

        double variance = 0;
        for (double v : values) {
            variance += (v - level) * (v - level);
        }
        variance /= values.size();
        double stddev = variance > 0 ? Math.sqrt(variance) : 0.0;
        if (stddev == 0) {
            return List.of();
        }

        double threshold = sensitivity * stddev * CUSUM_THRESHOLD_FACTOR;
        double drift = stddev * CUSUM_DRIFT_FACTOR;

        double positive = 0.0;
        double negative = 0.0;
        List<ChangePoint> changePoints = new ArrayList<>();

        for (int i = 0; i < values.size(); i++) {
            double deviation = values.get(i) - level;
            positive = Math.max(0.0, positive + deviation - drift);
            negative = Math.max(0.0, negative - deviation - drift);

            if (positive > threshold) {
                changePoints.add(new ChangePoint(i, ChangePoint.Direction.INCREASE, positive));
                positive = 0.0;
            }
            if (negative > threshold) {
                changePoints.add(new ChangePoint(i, ChangePoint.Direction.DECREASE, negative));
                negative = 0.0;
            }
        }

        return changePoints;
    }

    // ── Dispersion & information ───────────────────────────────────────────

    /**
     * Shannon entropy in bits, {@code -Σ p·log2(p)} over {@code p > 0}.
     * Empty and single-element distributions have zero entropy.
     */
    public static double shannonEntropy(List<Double> probabilities) {
        if (probabilities == null || probabilities.size() <= 1) {
            return 0.0;
        }

        double entropy = 0.0;
        for (double p : probabilities) {
            if (p > 0) {
                entropy -= p * (Math.log(p) / Math.log(2));
            }
        }
        return entropy;
    }

    /**
     * {@code |sampleStddev / mean|}; 0.0 for fewer than 2 values or a mean of exactly zero.
     */
    public static double coefficientOfVariation(List<Double> values) {
        if (values == null || values.size() < 2) {
            return 0.0;
        }
        double mean = mean(values);
        if (mean == 0) {
            return 0.0;
        }
        return Math.abs(sampleStddev(values) / mean);
    }

    // ── Descriptive helpers ────────────────────────────────────────────────

    public static double mean(List<Double> values) {
        if (values == null || values.isEmpty()) {
            throw new InvalidInputException("At least 1 data point required for mean");
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    /**
     * Sample standard deviation (n-1 denominator); 0.0 for fewer than 2 values.
     */
    public static double sampleStddev(List<Double> values) {
        if (values == null || values.size() < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double sumSquares = 0;
        for (double v : values) {
            sumSquares += (v - mean) * (v - mean);
        }
        return Math.sqrt(sumSquares / (values.size() - 1));
    }

    public static double min(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).min()
                .orElseThrow(() -> new InvalidInputException("At least 1 data point required for min"));
    }

    public static double max(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).max()
                .orElseThrow(() -> new InvalidInputException("At least 1 data point required for max"));
    }

    private static void requirePaired(List<Double> x, List<Double> y, String operation) {
        if (x == null || y == null || x.size() != y.size()) {
            throw new InvalidInputException("x and y must have the same length");
        }
        if (x.size() < 2) {
            throw new InvalidInputException("At least 2 data points required for " + operation);
        }
    }
}
