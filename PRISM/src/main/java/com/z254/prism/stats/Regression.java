package com.z254.prism.stats;

/**
 * Result of a simple linear regression.
 *
 * @param slope     fitted slope
 * @param intercept fitted intercept
 * @param rSquared  coefficient of determination
 */
public record Regression(double slope, double intercept, double rSquared) {

    public double predict(double x) {
        return slope * x + intercept;
    }
}
