package com.example.flowbridge.errors;

import java.util.Map;

/**
 * A conversion would discard information. Raised instead of dropping it in strict mode.
 */
public class LossyMappingException extends FlowConversionException {

    public LossyMappingException(String message, Map<String, ?> details) {
        super(FlowErrorCode.LOSSY_MAPPING, message, details);
    }
}
