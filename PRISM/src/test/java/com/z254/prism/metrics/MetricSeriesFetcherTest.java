package com.z254.prism.metrics;

import com.z254.prism.client.MetricQueryClient;
import com.z254.prism.exception.CollaboratorException;
import com.z254.prism.exception.InvalidInputException;
import com.z254.prism.support.PrismTestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Arrays;
import java.util.List;

import static com.z254.prism.support.PrismTestData.NOW;
import static com.z254.prism.support.PrismTestData.RESOURCE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link MetricSeriesFetcher}.
 */
@ExtendWith(MockitoExtension.class)
class MetricSeriesFetcherTest {

    @Mock
    private MetricQueryClient metricQueryClient;

    private MetricSeriesFetcher fetcher;

    @BeforeEach
    void setUp() {
        fetcher = new MetricSeriesFetcher(metricQueryClient, PrismTestData.properties(), PrismTestData.fixedClock());
    }

    @Nested
    @DisplayName("Fetch window")
    class FetchWindowTests {

        @Test
        @DisplayName("should request the last hoursBack hours ending now")
        void requestsWindow() {
            when(metricQueryClient.fetch(any(), any(), anyLong(), anyLong()))
                    .thenReturn(Mono.just(RawMetricData.empty()));

            StepVerifier.create(fetcher.fetch(RESOURCE, "cpu", 2))
                    .assertNext(series -> assertThat(series).isEmpty())
                    .verifyComplete();

            verify(metricQueryClient).fetch(RESOURCE, "cpu", NOW - 7200, NOW);
        }

        @Test
        @DisplayName("should reject a window shorter than one hour without calling the API")
        void rejectsShortWindow() {
            StepVerifier.create(fetcher.fetch(RESOURCE, null, 0))
                    .expectError(InvalidInputException.class)
                    .verify();

            verifyNoInteractions(metricQueryClient);
        }

        @Test
        @DisplayName("should propagate API failures")
        void propagatesFailure() {
            when(metricQueryClient.fetch(any(), any(), anyLong(), anyLong()))
                    .thenReturn(Mono.error(new CollaboratorException("metric-data", "HTTP 500", null)));

            StepVerifier.create(fetcher.fetch(RESOURCE, null, 1))
                    .expectError(CollaboratorException.class)
                    .verify();
        }

        @Test
        @DisplayName("should treat an empty response as no datapoints")
        void emptyResponse() {
            when(metricQueryClient.fetch(any(), any(), anyLong(), anyLong())).thenReturn(Mono.empty());

            StepVerifier.create(fetcher.fetch(RESOURCE, null, 1))
                    .assertNext(series -> assertThat(series).isEmpty())
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Cleaning")
    class CleaningTests {

        @Test
        @DisplayName("should drop sentinel, null, NaN, non-numeric text and short-row cells")
        void dropsMissingCells() {
            RawMetricData raw = new RawMetricData(
                    List.of("cpu", "mem"),
                    Arrays.asList(
                            Arrays.<Object>asList(1.5, "No Data"),
                            Arrays.<Object>asList(null, 2),
                            Arrays.<Object>asList("abc", Double.NaN),
                            Arrays.<Object>asList(3)),
                    List.of(1_700_000_000_000L, 1_700_000_060L, 1_700_000_120L, 1_700_000_180L));

            var series = fetcher.toSeries(raw);

            assertThat(series).containsOnlyKeys("cpu", "mem");
            assertThat(series.get("cpu").values()).containsExactly(1.5, 3.0);
            assertThat(series.get("cpu").timestamps()).containsExactly(1_700_000_000L, 1_700_000_180L);
            assertThat(series.get("mem").values()).containsExactly(2.0);
            assertThat(series.get("mem").timestamps()).containsExactly(1_700_000_060L);
        }

        @Test
        @DisplayName("should drop values whose row has no timestamp")
        void dropsUntimedValues() {
            RawMetricData raw = new RawMetricData(
                    List.of("cpu"),
                    List.<List<Object>>of(List.of(1.0), List.of(2.0), List.of(3.0)),
                    List.of(100L, 200L));

            MetricSeries cpu = fetcher.toSeries(raw).get("cpu");

            assertThat(cpu.values()).containsExactly(1.0, 2.0);
            assertThat(cpu.timestamps()).containsExactly(100L, 200L);
        }

        @Test
        @DisplayName("should keep datapoints in API order, including empty ones")
        void keepsOrder() {
            RawMetricData raw = new RawMetricData(
                    List.of("zeta", "alpha", "mid"),
                    List.of(Arrays.<Object>asList(1, null, 3)),
                    List.of(100L));

            var series = fetcher.toSeries(raw);

            assertThat(series.keySet()).containsExactly("zeta", "alpha", "mid");
            assertThat(series.get("alpha").isEmpty()).isTrue();
        }

        @Test
        @DisplayName("should classify integers and longs as present")
        void classifiesNumbers() {
            assertThat(fetcher.classify(7, 10L)).isEqualTo(new MetricSample.Present(7.0, 10L));
            assertThat(fetcher.classify(7L, 10L)).isEqualTo(new MetricSample.Present(7.0, 10L));
        }

        @Test
        @DisplayName("should parse numeric text and drop text that is not a number")
        void classifiesText() {
            assertThat(fetcher.classify("7", 10L)).isEqualTo(new MetricSample.Present(7.0, 10L));
            assertThat(fetcher.classify("42.5", 10L)).isEqualTo(new MetricSample.Present(42.5, 10L));
            assertThat(fetcher.classify("-1e3", 10L)).isEqualTo(new MetricSample.Present(-1000.0, 10L));
            assertThat(fetcher.classify("abc", 10L)).isEqualTo(new MetricSample.Missing(10L));
            assertThat(fetcher.classify("NaN", 10L)).isEqualTo(new MetricSample.Missing(10L));
            assertThat(fetcher.classify("", 10L)).isEqualTo(new MetricSample.Missing(10L));
            assertThat(fetcher.classify(Boolean.TRUE, 10L)).isEqualTo(new MetricSample.Missing(10L));
        }

        @Test
        @DisplayName("should keep numeric text cells in the series")
        void keepsNumericText() {
            RawMetricData raw = new RawMetricData(
                    List.of("cpu"),
                    List.<List<Object>>of(List.of("42.5"), List.of(10.0)),
                    List.of(100L, 200L));

            MetricSeries cpu = fetcher.toSeries(raw).get("cpu");

            assertThat(cpu.values()).containsExactly(42.5, 10.0);
            assertThat(cpu.timestamps()).containsExactly(100L, 200L);
        }

        @Test
        @DisplayName("should convert only millisecond timestamps")
        void convertsTimestamps() {
            assertThat(fetcher.toEpochSeconds(1_700_000_000_123L)).isEqualTo(1_700_000_000L);
            assertThat(fetcher.toEpochSeconds(1_700_000_000L)).isEqualTo(1_700_000_000L);
        }
    }
}
