package com.z254.prism.observability;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured logging utility for PRISM service.
 * <p>
 * Provides consistent, machine-readable log output with:
 * <ul>
 *     <li>MDC context for the analysed resource, baseline or device</li>
 *     <li>Analysis lifecycle events</li>
 *     <li>Degraded collaborator reporting</li>
 * </ul>
 */
@Slf4j
@Component
public class PrismStructuredLogger {

    // MDC keys
    public static final String MDC_ANALYSIS_TYPE = "analysisType";
    public static final String MDC_RESOURCE_KEY = "resourceKey";
    public static final String MDC_BASELINE_NAME = "baselineName";
    public static final String MDC_DEVICE_ID = "deviceId";

    /**
     * Log an analysis lifecycle event.
     */
    public void logAnalysisEvent(AnalysisType analysis, AnalysisEventType eventType,
                                 String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_ANALYSIS_TYPE, analysis.tag()))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("analysis", analysis.tag());

            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case STARTED -> log.debug("{} | data={}", message, formatLogData(logData));
                case COMPLETED -> log.info("{} | data={}", message, formatLogData(logData));
                case FAILED -> log.error("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a collaborator failure that the caller tolerates.
     */
    public void logDegradation(String collaborator, String operation, Throwable error,
                               Map<String, Object> details) {
        Map<String, Object> logData = new LinkedHashMap<>();
        logData.put("event", "COLLABORATOR_DEGRADED");
        logData.put("collaborator", collaborator);
        logData.put("operation", operation);
        logData.put("error", error.getMessage());

        if (details != null) {
            logData.putAll(details);
        }

        log.warn("{} unavailable, continuing without it | data={}", collaborator, formatLogData(logData));
    }

    /**
     * Set MDC context.
     */
    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    public enum AnalysisEventType {
        STARTED, COMPLETED, FAILED
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
