package com.z254.prism.exception;

import lombok.Getter;

/**
 * Base exception for PRISM analytics failures.
 * <p>
 * Carries a stable error code and an optional operator-facing suggestion so the
 * API layer can render a structured error instead of a partial report.
 */
@Getter
public class PrismException extends RuntimeException {

    private final String code;
    private final String suggestion;

    public PrismException(String message, String code, String suggestion) {
        super(message);
        this.code = code;
        this.suggestion = suggestion;
    }

    public PrismException(String message, String code, String suggestion, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.suggestion = suggestion;
    }
}
