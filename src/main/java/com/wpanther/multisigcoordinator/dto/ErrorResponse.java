package com.wpanther.multisigcoordinator.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Error body returned for every failed request
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    private String error;
    private String message;
    private int status;
    private String path;
    private long timestamp;

    // Field errors, only for validation failures
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Map<String, String> errors;
}
