package com.example.flowbridge.agentspec;

import java.util.List;
import java.util.Objects;

/**
 * Runs an {@link Agent} on the conversation so far.
 */
public record AgentNode(String id, String name, Agent agent, List<Property> inputs, List<Property> outputs) implements FlowNode {

    public AgentNode {
        Objects.requireNonNull(agent, "agent");
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
    }
}
