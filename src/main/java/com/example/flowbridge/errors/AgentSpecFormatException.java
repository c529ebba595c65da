package com.example.flowbridge.errors;

import java.util.Map;

/**
 * An Agent Spec document cannot be read: malformed YAML/JSON, unknown component type or dangling reference.
 */
public class AgentSpecFormatException extends FlowConversionException {

    public AgentSpecFormatException(String message, Map<String, ?> details) {
        super(FlowErrorCode.INVALID_AGENTSPEC, message, details);
    }

    public AgentSpecFormatException(String message, Map<String, ?> details, Throwable cause) {
        super(FlowErrorCode.INVALID_AGENTSPEC, message, details, cause);
    }
}
