package com.example.flowbridge.agentspec;

import java.util.List;

public record EndNode(String id, String name, List<Property> inputs, List<Property> outputs) implements FlowNode {

    public EndNode {
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
    }
}
