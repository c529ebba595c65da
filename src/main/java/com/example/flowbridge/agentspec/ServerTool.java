package com.example.flowbridge.agentspec;

import java.util.List;

/**
 * A tool executed by the runtime hosting the flow.
 */
public record ServerTool(String id, String name, String description, List<Property> inputs, List<Property> outputs)
        implements Tool {

    public ServerTool {
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
    }
}
