package com.example.flowbridge.errors;

import java.util.Map;

/**
 * No rule pack is registered for the requested or detected version.
 */
public class RulePackNotFoundException extends FlowConversionException {

    public RulePackNotFoundException(FlowErrorCode code, String message, Map<String, ?> details) {
        super(code, message, details);
    }
}
