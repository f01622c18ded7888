package com.z254.prism.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PrismStructuredLoggerTest {

    private final PrismStructuredLogger structuredLogger = new PrismStructuredLogger();

    @Test
    @DisplayName("should render details as a flat JSON object")
    void formatsLogData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("baselineName", "web \"prod\"");
        data.put("datapoints", 3);
        data.put("degraded", false);
        data.put("error", null);

        assertThat(structuredLogger.formatLogData(data))
                .isEqualTo("{\"baselineName\": \"web \\\"prod\\\"\", \"datapoints\": 3, \"degraded\": false, \"error\": null}");
    }

    @Test
    @DisplayName("should clear MDC keys when the scope closes")
    void mdcScope() {
        try (var scope = structuredLogger.withContext(Map.of(PrismStructuredLogger.MDC_DEVICE_ID, "42"))) {
            assertThat(MDC.get(PrismStructuredLogger.MDC_DEVICE_ID)).isEqualTo("42");
        }

        assertThat(MDC.get(PrismStructuredLogger.MDC_DEVICE_ID)).isNull();
    }

    @Test
    @DisplayName("should leave no analysis type in MDC after logging an event")
    void analysisEventCleansUp() {
        structuredLogger.logAnalysisEvent(AnalysisType.TREND, PrismStructuredLogger.AnalysisEventType.COMPLETED,
                "Trend analysis completed", Map.of("datapoints", 2));

        assertThat(MDC.get(PrismStructuredLogger.MDC_ANALYSIS_TYPE)).isNull();
    }
}
