package com.example.flowbridge.agentspec;

import java.util.List;
import java.util.Objects;

public record ToolNode(String id, String name, Tool tool, List<Property> inputs, List<Property> outputs) implements FlowNode {

    public ToolNode {
        Objects.requireNonNull(tool, "tool");
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
    }
}
