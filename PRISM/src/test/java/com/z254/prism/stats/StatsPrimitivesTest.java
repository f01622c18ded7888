package com.z254.prism.stats;

import com.z254.prism.exception.InvalidInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link StatsPrimitives}.
 */
class StatsPrimitivesTest {

    @Nested
    @DisplayName("Linear regression")
    class LinearRegressionTests {

        @Test
        @DisplayName("should recover slope and intercept of an exact line")
        void exactLine() {
            Regression fit = StatsPrimitives.linearRegression(
                    List.of(0.0, 1.0, 2.0, 3.0, 4.0),
                    List.of(1.0, 3.0, 5.0, 7.0, 9.0));

            assertThat(fit.slope()).isCloseTo(2.0, within(1e-9));
            assertThat(fit.intercept()).isCloseTo(1.0, within(1e-9));
            assertThat(fit.rSquared()).isCloseTo(1.0, within(1e-9));
            assertThat(fit.predict(10.0)).isCloseTo(21.0, within(1e-9));
        }

        @Test
        @DisplayName("should keep r-squared within [0, 1] for noisy data")
        void noisyData() {
            Regression fit = StatsPrimitives.linearRegression(
                    List.of(1.0, 2.0, 3.0, 4.0, 5.0, 6.0),
                    List.of(2.0, 1.0, 4.0, 3.0, 6.0, 5.0));

            assertThat(fit.slope()).isPositive();
            assertThat(fit.rSquared()).isBetween(0.0, 1.0);
        }

        @Test
        @DisplayName("should return zero slope and mean intercept when x is constant")
        void constantX() {
            Regression fit = StatsPrimitives.linearRegression(
                    List.of(3.0, 3.0, 3.0),
                    List.of(1.0, 2.0, 6.0));

            assertThat(fit.slope()).isZero();
            assertThat(fit.intercept()).isCloseTo(3.0, within(1e-9));
            assertThat(fit.rSquared()).isZero();
        }

        @Test
        @DisplayName("should reject series of different length")
        void differentLengths() {
            assertThatThrownBy(() -> StatsPrimitives.linearRegression(List.of(1.0, 2.0), List.of(1.0)))
                    .isInstanceOf(InvalidInputException.class)
                    .hasMessageContaining("same length");
        }

        @Test
        @DisplayName("should reject fewer than two points")
        void singlePoint() {
            assertThatThrownBy(() -> StatsPrimitives.linearRegression(List.of(1.0), List.of(1.0)))
                    .isInstanceOf(InvalidInputException.class)
                    .extracting("code").isEqualTo(InvalidInputException.CODE);
        }
    }

    @Nested
    @DisplayName("Correlation")
    class CorrelationTests {

        private final List<Double> x = List.of(1.0, 2.0, 4.0, 8.0, 16.0);

        @Test
        @DisplayName("should be 1 for a series with itself")
        void selfCorrelation() {
            assertThat(StatsPrimitives.pearsonCorrelation(x, x)).isCloseTo(1.0, within(1e-9));
        }

        @Test
        @DisplayName("should be -1 for a series with its negation")
        void negatedCorrelation() {
            List<Double> negated = x.stream().map(v -> -v).toList();

            assertThat(StatsPrimitives.pearsonCorrelation(x, negated)).isCloseTo(-1.0, within(1e-9));
        }

        @Test
        @DisplayName("should be 0 when one series is constant")
        void constantSeries() {
            assertThat(StatsPrimitives.pearsonCorrelation(x, List.of(5.0, 5.0, 5.0, 5.0, 5.0))).isZero();
        }

        @Test
        @DisplayName("autocorrelation should detect period-2 alternation")
        void autocorrelationAlternating() {
            List<Double> alternating = List.of(1.0, -1.0, 1.0, -1.0, 1.0, -1.0);

            assertThat(StatsPrimitives.autocorrelation(alternating, 2)).isCloseTo(1.0, within(1e-9));
            assertThat(StatsPrimitives.autocorrelation(alternating, 1)).isCloseTo(-1.0, within(1e-9));
        }

        @Test
        @DisplayName("autocorrelation should be 0 for out-of-range lags and flat series")
        void autocorrelationDegenerate() {
            List<Double> values = List.of(1.0, 2.0, 3.0);

            assertThat(StatsPrimitives.autocorrelation(values, 0)).isZero();
            assertThat(StatsPrimitives.autocorrelation(values, -1)).isZero();
            assertThat(StatsPrimitives.autocorrelation(values, 3)).isZero();
            assertThat(StatsPrimitives.autocorrelation(List.of(4.0, 4.0, 4.0), 1)).isZero();
            assertThat(StatsPrimitives.autocorrelation(List.of(), 1)).isZero();
        }
    }

    @Nested
    @DisplayName("CUSUM")
    class CusumTests {

        @Test
        @DisplayName("should find no change points in a flat series")
        void flatSeries() {
            assertThat(StatsPrimitives.cusum(List.of(7.0, 7.0, 7.0, 7.0, 7.0, 7.0), 1.0)).isEmpty();
        }

        @Test
        @DisplayName("should need at least four points")
        void tooShort() {
            assertThat(StatsPrimitives.cusum(List.of(0.0, 100.0, 0.0), 1.0)).isEmpty();
        }

        @Test
        @DisplayName("should report a step in both running sums")
        void stepChange() {
            List<Double> step = List.of(0.0, 0.0, 0.0, 0.0, 0.0, 10.0, 10.0, 10.0, 10.0, 10.0);

            List<ChangePoint> points = StatsPrimitives.cusum(step, 1.0);

            assertThat(points).hasSize(2);
            assertThat(points.get(0).index()).isEqualTo(4);
            assertThat(points.get(0).direction()).isEqualTo(ChangePoint.Direction.DECREASE);
            assertThat(points.get(0).magnitude()).isCloseTo(12.5, within(1e-9));
            assertThat(points.get(1).index()).isEqualTo(9);
            assertThat(points.get(1).direction()).isEqualTo(ChangePoint.Direction.INCREASE);
        }

        @Test
        @DisplayName("should detect more with lower sensitivity")
        void sensitivity() {
            List<Double> step = List.of(0.0, 0.0, 0.0, 0.0, 0.0, 10.0, 10.0, 10.0, 10.0, 10.0);

            assertThat(StatsPrimitives.cusum(step, 0.25).size())
                    .isGreaterThan(StatsPrimitives.cusum(step, 1.0).size());
        }

        @Test
        @DisplayName("should measure against an explicit target")
        void explicitTarget() {
            List<Double> aboveTarget = List.of(10.0, 10.0, 10.0, 10.0, 10.0);

            List<ChangePoint> points = StatsPrimitives.cusum(aboveTarget, 0.0, 1.0);

            assertThat(points).isNotEmpty()
                    .allMatch(point -> point.direction() == ChangePoint.Direction.INCREASE);
        }
    }

    @Nested
    @DisplayName("Entropy and dispersion")
    class DispersionTests {

        @Test
        @DisplayName("entropy of empty and single-element distributions is 0")
        void degenerateEntropy() {
            assertThat(StatsPrimitives.shannonEntropy(List.of())).isZero();
            assertThat(StatsPrimitives.shannonEntropy(List.of(1.0))).isZero();
        }

        @Test
        @DisplayName("entropy of a fair coin is 1 bit")
        void fairCoin() {
            assertThat(StatsPrimitives.shannonEntropy(List.of(0.5, 0.5))).isCloseTo(1.0, within(1e-12));
            assertThat(StatsPrimitives.shannonEntropy(List.of(0.25, 0.25, 0.25, 0.25))).isCloseTo(2.0, within(1e-12));
        }

        @Test
        @DisplayName("entropy ignores zero probabilities")
        void zeroProbabilities() {
            assertThat(StatsPrimitives.shannonEntropy(List.of(0.5, 0.0, 0.5))).isCloseTo(1.0, within(1e-12));
        }

        @Test
        @DisplayName("coefficient of variation is sample stddev over mean")
        void coefficientOfVariation() {
            assertThat(StatsPrimitives.coefficientOfVariation(List.of(2.0, 4.0)))
                    .isCloseTo(Math.sqrt(2.0) / 3.0, within(1e-12));
        }

        @Test
        @DisplayName("coefficient of variation is 0 for short series and zero mean")
        void coefficientOfVariationDegenerate() {
            assertThat(StatsPrimitives.coefficientOfVariation(List.of(5.0))).isZero();
            assertThat(StatsPrimitives.coefficientOfVariation(List.of(-1.0, 1.0))).isZero();
        }

        @Test
        @DisplayName("sample stddev uses n-1")
        void sampleStddev() {
            assertThat(StatsPrimitives.sampleStddev(List.of(10.0, 20.0, 30.0))).isCloseTo(10.0, within(1e-12));
            assertThat(StatsPrimitives.sampleStddev(List.of(10.0))).isZero();
        }
    }
}
