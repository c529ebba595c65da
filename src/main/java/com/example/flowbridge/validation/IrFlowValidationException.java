package com.example.flowbridge.validation;

import com.example.flowbridge.errors.FlowErrorCode;
import com.example.flowbridge.errors.UnsupportedPatternException;

import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * Thrown when an IR graph breaks a structural invariant (dangling edge, duplicate label, unreachable node).
 * <p>
 * Mapped to HTTP 400 with {@link #getErrors()} in the response body by {@link com.example.flowbridge.api.GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class IrFlowValidationException extends UnsupportedPatternException {

    private final List<ValidationError> errors;

    public IrFlowValidationException(List<ValidationError> errors) {
        super(FlowErrorCode.INVALID_IR,
                "IR graph validation failed: " + (errors != null ? errors.size() + " error(s)" : ""),
                Map.of("errorCount", errors != null ? errors.size() : 0));
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }
}
