package com.example.flowbridge.errors;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base error of the conversion pipeline: a code, a human-readable message and a details payload
 * naming the offending node, literal or field.
 * <p>
 * Mapped to HTTP 400 by {@link com.example.flowbridge.api.GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class FlowConversionException extends RuntimeException {

    private final FlowErrorCode code;
    private final Map<String, Object> details;

    public FlowConversionException(FlowErrorCode code, String message) {
        this(code, message, Map.of(), null);
    }

    public FlowConversionException(FlowErrorCode code, String message, Map<String, ?> details) {
        this(code, message, details, null);
    }

    public FlowConversionException(FlowErrorCode code, String message, Map<String, ?> details, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.details = details != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
                : Map.of();
    }

    @Override
    public String toString() {
        String base = "[" + code + "] " + getMessage();
        return details.isEmpty() ? base : base + " | details=" + details;
    }
}
