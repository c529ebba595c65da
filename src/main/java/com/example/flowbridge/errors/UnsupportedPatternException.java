package com.example.flowbridge.errors;

import java.util.Map;

/**
 * The input does not match any recognized shape (branch test, return schema, graph shape, end source).
 */
public class UnsupportedPatternException extends FlowConversionException {

    public UnsupportedPatternException(FlowErrorCode code, String message) {
        super(code, message);
    }

    public UnsupportedPatternException(FlowErrorCode code, String message, Map<String, ?> details) {
        super(code, message, details);
    }
}
