package com.z254.prism.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Body of every failed API call.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    @Builder.Default
    private boolean error = true;
    private String code;
    private String message;
    /** Operator hint, when one is known */
    private String suggestion;
    private String path;
    private Instant timestamp;
}
