package com.example.flowbridge.api;

import com.example.flowbridge.errors.FlowConversionException;
import com.example.flowbridge.validation.ValidationError;

import java.util.List;
import java.util.Map;

/**
 * Standard error response body (4xx/5xx): message, optional error code and details, optional field errors.
 */
public record ErrorResponse(String message, String code, Map<String, Object> details, List<ValidationError> errors) {

    public ErrorResponse(String message) {
        this(message, null, null, null);
    }

    public static ErrorResponse withErrors(String message, List<ValidationError> errors) {
        return new ErrorResponse(message, null, null, errors != null ? List.copyOf(errors) : null);
    }

    public static ErrorResponse of(FlowConversionException ex) {
        return new ErrorResponse(ex.getMessage(), ex.getCode().name(), ex.getDetails(), null);
    }
}
