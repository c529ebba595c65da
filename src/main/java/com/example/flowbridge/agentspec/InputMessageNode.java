package com.example.flowbridge.agentspec;

import java.util.List;

public record InputMessageNode(String id, String name, String message, List<Property> inputs, List<Property> outputs) implements FlowNode {

    public InputMessageNode {
        message = message != null ? message : "";
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
    }
}
