package com.example.flowbridge.agentspec;

import java.util.List;
import java.util.Objects;

public record LlmNode(String id, String name, LlmConfig llmConfig, String promptTemplate,
                      List<Property> inputs, List<Property> outputs) implements FlowNode {

    public LlmNode {
        Objects.requireNonNull(llmConfig, "llmConfig");
        promptTemplate = promptTemplate != null ? promptTemplate : "";
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
    }
}
