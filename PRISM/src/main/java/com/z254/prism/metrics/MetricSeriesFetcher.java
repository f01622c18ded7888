package com.z254.prism.metrics;

import com.z254.prism.client.MetricQueryClient;
import com.z254.prism.config.PrismProperties;
import com.z254.prism.exception.InvalidInputException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fetches instance data for a look-back window and turns the row-oriented response
 * into one cleaned {@link MetricSeries} per datapoint.
 * <p>
 * Cleaning rules, applied column by column:
 * <ul>
 *     <li>millisecond timestamps are converted to seconds</li>
 *     <li>the missing-data sentinel, {@code null}, NaN and text that does not parse as a number are dropped;
 *     numeric text is parsed</li>
 *     <li>cells in rows shorter than the column index are dropped</li>
 *     <li>a value whose row has no timestamp is dropped</li>
 * </ul>
 * Fetch failures are not recovered here.
 */
@Slf4j
@Service
public class MetricSeriesFetcher {

    private static final long SECONDS_PER_HOUR = 3600L;

    private final MetricQueryClient metricQueryClient;
    private final PrismProperties.Metrics config;
    private final Clock clock;

    public MetricSeriesFetcher(MetricQueryClient metricQueryClient,
                               PrismProperties prismProperties,
                               Clock clock) {
        this.metricQueryClient = metricQueryClient;
        this.config = prismProperties.getMetrics();
        this.clock = clock;
    }

    /**
     * Fetch the last {@code hoursBack} hours of an instance.
     *
     * @param resource        the monitored instance
     * @param datapointFilter comma-separated datapoint names, or {@code null} for all
     * @param hoursBack       look-back window, at least 1
     * @return series keyed by datapoint name, in the order the API listed them
     */
    public Mono<Map<String, MetricSeries>> fetch(ResourceIdentity resource, String datapointFilter, int hoursBack) {
        if (hoursBack < 1) {
            return Mono.error(new InvalidInputException("hoursBack must be at least 1, got " + hoursBack));
        }

        long end = clock.instant().getEpochSecond();
        long start = end - hoursBack * SECONDS_PER_HOUR;

        log.debug("Fetching metric series: resource={}, datapoints={}, start={}, end={}",
                resource.key(), datapointFilter, start, end);

        return metricQueryClient.fetch(resource, datapointFilter, start, end)
                .defaultIfEmpty(RawMetricData.empty())
                .map(this::toSeries)
                .doOnSuccess(series -> log.debug("Fetched {} datapoint series for {}",
                        series.size(), resource.key()));
    }

    /**
     * Transpose raw rows into per-datapoint series.
     */
    Map<String, MetricSeries> toSeries(RawMetricData raw) {
        List<Long> timestamps = raw.timestamps().stream()
                .map(this::toEpochSeconds)
                .toList();

        Map<String, MetricSeries> series = new LinkedHashMap<>();
        List<String> names = raw.datapointNames();
        for (int column = 0; column < names.size(); column++) {
            List<Double> values = new ArrayList<>();
            List<Long> times = new ArrayList<>();

            for (MetricSample sample : column(raw.values(), column, timestamps)) {
                if (sample instanceof MetricSample.Present present && present.timestamp() != null) {
                    values.add(present.value());
                    times.add(present.timestamp());
                }
            }

            series.put(names.get(column), new MetricSeries(values, times));
        }
        return series;
    }

    /**
     * Classify every cell of one column.
     */
    List<MetricSample> column(List<List<Object>> rows, int column, List<Long> timestamps) {
        List<MetricSample> samples = new ArrayList<>(rows.size());
        for (int row = 0; row < rows.size(); row++) {
            Long timestamp = row < timestamps.size() ? timestamps.get(row) : null;
            List<Object> cells = rows.get(row);
            Object cell = cells != null && column < cells.size() ? cells.get(column) : null;
            samples.add(classify(cell, timestamp));
        }
        return samples;
    }

    MetricSample classify(Object cell, Long timestamp) {
        if (cell == null || config.getMissingValueSentinel().equals(cell)) {
            return new MetricSample.Missing(timestamp);
        }
        double value;
        if (cell instanceof Number number) {
            value = number.doubleValue();
        } else if (cell instanceof String text) {
            value = parse(text);
        } else {
            return new MetricSample.Missing(timestamp);
        }
        if (Double.isNaN(value)) {
            return new MetricSample.Missing(timestamp);
        }
        return new MetricSample.Present(value, timestamp);
    }

    /**
     * Numeric text such as {@code "42.5"}; NaN when the text is not a number.
     */
    private static double parse(String text) {
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    long toEpochSeconds(long timestamp) {
        return timestamp > config.getMillisecondThreshold() ? timestamp / 1000 : timestamp;
    }
}
