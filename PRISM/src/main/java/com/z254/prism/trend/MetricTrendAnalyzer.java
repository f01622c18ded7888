package com.z254.prism.trend;

import com.fasterxml.jackson.annotation.JsonValue;
import com.z254.prism.config.PrismProperties;
import com.z254.prism.metrics.MetricSeries;
import com.z254.prism.metrics.MetricSeriesFetcher;
import com.z254.prism.metrics.ResourceIdentity;
import com.z254.prism.observability.AnalysisType;
import com.z254.prism.observability.PrismMetrics;
import com.z254.prism.stats.ChangePoint;
import com.z254.prism.stats.Regression;
import com.z254.prism.stats.StatsPrimitives;
import io.micrometer.core.instrument.Timer;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Per-datapoint trend analyses over a fetched metric window.
 * <p>
 * Provides:
 * <ul>
 *     <li>Linear forecast of when a threshold will be breached</li>
 *     <li>CUSUM change point detection</li>
 *     <li>Trend classification (volatile, cyclic, increasing, decreasing, stable)</li>
 *     <li>Seasonality at standard periods and peak hours of day</li>
 *     <li>Z-score anomaly detection</li>
 * </ul>
 * Every analysis reports each fetched datapoint, including those with too few samples.
 */
@Slf4j
@Component
public class MetricTrendAnalyzer {

    private static final double SECONDS_PER_HOUR = 3600.0;
    private static final double FLAT_SLOPE = 1e-10;
    private static final double VOLATILE_CV = 0.5;
    private static final double CYCLIC_AUTOCORRELATION = 0.7;
    private static final double TREND_R_SQUARED = 0.5;
    private static final int[] SEASONAL_PERIOD_HOURS = {1, 4, 12, 24, 168};

    private final MetricSeriesFetcher fetcher;
    private final PrismProperties.Trend config;
    private final PrismMetrics metrics;

    public MetricTrendAnalyzer(MetricSeriesFetcher fetcher,
                               PrismProperties prismProperties,
                               PrismMetrics metrics) {
        this.fetcher = fetcher;
        this.config = prismProperties.getTrend();
        this.metrics = metrics;
    }

    /**
     * Fit a linear trend per datapoint and project when it crosses {@code threshold}.
     */
    public Mono<TrendReport<DatapointForecast>> forecast(ResourceIdentity resource, double threshold,
                                                         String datapointFilter, int hoursBack) {
        return analyze(AnalysisType.FORECAST, resource, datapointFilter, hoursBack,
                series -> forecastDatapoint(series, threshold));
    }

    /**
     * Locate mean shifts per datapoint.
     *
     * @param sensitivity CUSUM threshold multiplier; lower finds smaller shifts
     */
    public Mono<TrendReport<DatapointChangePoints>> detectChangePoints(ResourceIdentity resource,
                                                                       String datapointFilter,
                                                                       int hoursBack, double sensitivity) {
        return analyze(AnalysisType.CHANGE_POINTS, resource, datapointFilter, hoursBack,
                series -> changePointsOf(series, sensitivity));
    }

    public Mono<TrendReport<DatapointTrend>> classifyTrend(ResourceIdentity resource,
                                                           String datapointFilter, int hoursBack) {
        return analyze(AnalysisType.TREND, resource, datapointFilter, hoursBack, this::classify);
    }

    public Mono<TrendReport<DatapointSeasonality>> detectSeasonality(ResourceIdentity resource,
                                                                     String datapointFilter, int hoursBack) {
        return analyze(AnalysisType.SEASONALITY, resource, datapointFilter, hoursBack, this::seasonalityOf);
    }

    /**
     * Flag samples whose z-score magnitude exceeds {@code zThreshold}.
     */
    public Mono<TrendReport<DatapointAnomalies>> detectAnomalies(ResourceIdentity resource,
                                                                 String datapointFilter,
                                                                 int hoursBack, double zThreshold) {
        return analyze(AnalysisType.ANOMALIES, resource, datapointFilter, hoursBack,
                series -> anomaliesOf(series, zThreshold));
    }

    // ========== Per-Datapoint Analyses ==========

    DatapointForecast forecastDatapoint(MetricSeries series, double threshold) {
        List<Double> values = series.values();
        List<Long> timestamps = series.timestamps();
        if (values.size() < 2) {
            return DatapointForecast.builder()
                    .trend(TrendClass.INSUFFICIENT_DATA)
                    .threshold(threshold)
                    .sampleCount(values.size())
                    .build();
        }

        long t0 = timestamps.get(0);
        long last = timestamps.get(timestamps.size() - 1);
        Regression fit = StatsPrimitives.linearRegression(hoursSince(t0, timestamps), values);

        TrendClass trend;
        if (Math.abs(fit.slope()) < FLAT_SLOPE) {
            trend = TrendClass.STABLE;
        } else {
            trend = fit.slope() > 0 ? TrendClass.INCREASING : TrendClass.DECREASING;
        }

        Double daysUntilBreach = null;
        Long predictedBreachEpoch = null;
        if (fit.slope() != 0) {
            double hoursToBreach = (threshold - fit.intercept()) / fit.slope();
            double remainingHours = hoursToBreach - (last - t0) / SECONDS_PER_HOUR;
            if (remainingHours > 0) {
                daysUntilBreach = remainingHours / 24.0;
                predictedBreachEpoch = (long) (last + remainingHours * SECONDS_PER_HOUR);
            }
        }

        return DatapointForecast.builder()
                .trend(trend)
                .currentValue(values.get(values.size() - 1))
                .threshold(threshold)
                .slopePerHour(fit.slope())
                .intercept(fit.intercept())
                .rSquared(fit.rSquared())
                .daysUntilBreach(daysUntilBreach)
                .predictedBreachEpoch(predictedBreachEpoch)
                .sampleCount(values.size())
                .build();
    }

    DatapointChangePoints changePointsOf(MetricSeries series, double sensitivity) {
        List<TimedChangePoint> points = new ArrayList<>();
        for (ChangePoint point : StatsPrimitives.cusum(series.values(), sensitivity)) {
            points.add(new TimedChangePoint(series.timestamps().get(point.index()), point.direction(),
                    point.magnitude(), point.index()));
        }
        return DatapointChangePoints.builder()
                .changePoints(points)
                .changePointCount(points.size())
                .sampleCount(series.size())
                .build();
    }

    DatapointTrend classify(MetricSeries series) {
        List<Double> values = series.values();
        if (values.size() < 2) {
            return DatapointTrend.builder()
                    .classification(TrendClass.INSUFFICIENT_DATA)
                    .confidence(0.0)
                    .sampleCount(values.size())
                    .build();
        }

        List<Long> timestamps = series.timestamps();
        double cv = StatsPrimitives.coefficientOfVariation(values);
        Regression fit = StatsPrimitives.linearRegression(hoursSince(timestamps.get(0), timestamps), values);

        double interval = averageInterval(timestamps);
        int dayLag = interval > 0 ? Math.max(1, (int) (86400 / interval)) : 1;
        double autocorrelation = StatsPrimitives.autocorrelation(values, dayLag);

        TrendClass classification;
        double confidence;
        if (cv > VOLATILE_CV) {
            classification = TrendClass.VOLATILE;
            confidence = Math.min(1.0, cv);
        } else if (Math.abs(autocorrelation) > CYCLIC_AUTOCORRELATION) {
            classification = TrendClass.CYCLIC;
            confidence = Math.abs(autocorrelation);
        } else if (fit.rSquared() > TREND_R_SQUARED && fit.slope() > 0) {
            classification = TrendClass.INCREASING;
            confidence = fit.rSquared();
        } else if (fit.rSquared() > TREND_R_SQUARED && fit.slope() < 0) {
            classification = TrendClass.DECREASING;
            confidence = fit.rSquared();
        } else {
            classification = TrendClass.STABLE;
            confidence = Math.max(0.0, 1.0 - cv);
        }

        return DatapointTrend.builder()
                .classification(classification)
                .confidence(confidence)
                .slopePerHour(fit.slope())
                .volatilityIndex(cv)
                .autocorrelation24h(autocorrelation)
                .rSquared(fit.rSquared())
                .sampleCount(values.size())
                .build();
    }

    DatapointSeasonality seasonalityOf(MetricSeries series) {
        List<Double> values = series.values();
        if (values.size() < 4) {
            return DatapointSeasonality.builder()
                    .seasonal(false)
                    .insufficientData(true)
                    .correlations(Map.of())
                    .peakHours(List.of())
                    .sampleCount(values.size())
                    .build();
        }

        double interval = averageInterval(series.timestamps());
        Map<String, Double> correlations = new LinkedHashMap<>();
        for (int periodHours : SEASONAL_PERIOD_HOURS) {
            int lag = interval > 0 ? (int) (periodHours * SECONDS_PER_HOUR / interval) : 0;
            if (lag < 1 || lag >= values.size() / 2) {
                continue;
            }
            correlations.put(periodHours + "h", StatsPrimitives.autocorrelation(values, lag));
        }

        String dominantPeriod = null;
        double maxAutocorrelation = 0.0;
        for (Map.Entry<String, Double> entry : correlations.entrySet()) {
            if (dominantPeriod == null || entry.getValue() > maxAutocorrelation) {
                dominantPeriod = entry.getKey();
                maxAutocorrelation = entry.getValue();
            }
        }

        return DatapointSeasonality.builder()
                .seasonal(dominantPeriod != null && maxAutocorrelation > config.getSeasonalityThreshold())
                .insufficientData(false)
                .dominantPeriod(dominantPeriod)
                .maxAutocorrelation(maxAutocorrelation)
                .correlations(correlations)
                .peakHours(peakHours(series))
                .sampleCount(values.size())
                .build();
    }

    DatapointAnomalies anomaliesOf(MetricSeries series, double zThreshold) {
        List<Double> values = series.values();
        List<Anomaly> anomalies = new ArrayList<>();
        Double mean = null;
        Double stddev = null;

        if (values.size() >= 2) {
            mean = StatsPrimitives.mean(values);
            stddev = StatsPrimitives.sampleStddev(values);
            if (stddev > 0) {
                for (int i = 0; i < values.size(); i++) {
                    double z = (values.get(i) - mean) / stddev;
                    if (Math.abs(z) > zThreshold) {
                        anomalies.add(new Anomaly(series.timestamps().get(i), values.get(i), z));
                    }
                }
            }
        }

        return DatapointAnomalies.builder()
                .mean(mean)
                .stddev(stddev)
                .zThreshold(zThreshold)
                .anomalies(anomalies)
                .anomalyCount(anomalies.size())
                .sampleCount(values.size())
                .build();
    }

    // ========== Private Methods ==========

    private <T> Mono<TrendReport<T>> analyze(AnalysisType analysis, ResourceIdentity resource,
                                             String datapointFilter, int hoursBack,
                                             Function<MetricSeries, T> perDatapoint) {
        Timer.Sample sample = metrics.startTimer();
        return fetcher.fetch(resource, datapointFilter, hoursBack)
                .map(series -> {
                    Map<String, T> results = new LinkedHashMap<>();
                    series.forEach((datapoint, data) -> results.put(datapoint, perDatapoint.apply(data)));
                    return TrendReport.<T>builder()
                            .resource(resource)
                            .hoursBack(hoursBack)
                            .datapoints(results)
                            .build();
                })
                .doOnSuccess(report -> {
                    metrics.recordLatency(sample, analysis);
                    log.debug("{} analysis completed for {}: {} datapoints",
                            analysis.tag(), resource.key(), report.getDatapoints().size());
                });
    }

    private List<Double> hoursSince(long t0, List<Long> timestamps) {
        return timestamps.stream()
                .map(t -> (t - t0) / SECONDS_PER_HOUR)
                .toList();
    }

    private double averageInterval(List<Long> timestamps) {
        if (timestamps.size() < 2) {
            return 0.0;
        }
        return (double) (timestamps.get(timestamps.size() - 1) - timestamps.get(0)) / (timestamps.size() - 1);
    }

    /**
     * UTC hours of day whose mean value is above the overall mean, ascending.
     */
    private List<Integer> peakHours(MetricSeries series) {
        Map<Integer, List<Double>> byHour = new TreeMap<>();
        for (int i = 0; i < series.size(); i++) {
            int hour = (int) (Math.floorMod(series.timestamps().get(i), 86400L) / 3600);
            byHour.computeIfAbsent(hour, h -> new ArrayList<>()).add(series.values().get(i));
        }

        double overallMean = StatsPrimitives.mean(series.values());
        List<Integer> peaks = new ArrayList<>();
        byHour.forEach((hour, values) -> {
            if (StatsPrimitives.mean(values) > overallMean) {
                peaks.add(hour);
            }
        });
        return peaks;
    }

    // ========== Data Classes ==========

    public enum TrendClass {
        INCREASING("increasing"),
        DECREASING("decreasing"),
        STABLE("stable"),
        VOLATILE("volatile"),
        CYCLIC("cyclic"),
        INSUFFICIENT_DATA("insufficient_data");

        private final String value;

        TrendClass(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }

    @Data
    @Builder
    public static class TrendReport<T> {
        private ResourceIdentity resource;
        private int hoursBack;
        private Map<String, T> datapoints;
    }

    @Data
    @Builder
    public static class DatapointForecast {
        private TrendClass trend;
        private Double currentValue;
        private double threshold;
        private Double slopePerHour;
        private Double intercept;
        private Double rSquared;
        /** Null when the trend never reaches the threshold */
        private Double daysUntilBreach;
        private Long predictedBreachEpoch;
        private int sampleCount;
    }

    @Data
    @Builder
    public static class DatapointChangePoints {
        private List<TimedChangePoint> changePoints;
        private int changePointCount;
        private int sampleCount;
    }

    public record TimedChangePoint(long timestamp, ChangePoint.Direction direction, double magnitude, int index) {
    }

    @Data
    @Builder
    public static class DatapointTrend {
        private TrendClass classification;
        private double confidence;
        private Double slopePerHour;
        private Double volatilityIndex;
        private Double autocorrelation24h;
        private Double rSquared;
        private int sampleCount;
    }

    @Data
    @Builder
    public static class DatapointSeasonality {
        private boolean seasonal;
        private boolean insufficientData;
        private String dominantPeriod;
        private double maxAutocorrelation;
        /** Autocorrelation per period label such as {@code 24h} */
        private Map<String, Double> correlations;
        private List<Integer> peakHours;
        private int sampleCount;
    }

    @Data
    @Builder
    public static class DatapointAnomalies {
        private Double mean;
        private Double stddev;
        private double zThreshold;
        private List<Anomaly> anomalies;
        private int anomalyCount;
        private int sampleCount;
    }

    public record Anomaly(long timestamp, double value, double zScore) {
    }
}
