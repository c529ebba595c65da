package com.example.flowbridge.agentspec;

import java.util.List;

/**
 * A tool whose call is answered by the client, e.g. a user approval.
 */
public record ClientTool(String id, String name, String description, List<Property> inputs, List<Property> outputs)
        implements Tool {

    public ClientTool {
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
    }
}
