package com.example.flowbridge.agentspec;

import java.util.Objects;

public record DataFlowEdge(String id, String name, String sourceNode, String sourceOutput, String destinationNode,
                           String destinationInput) implements AgentSpecComponent {

    public DataFlowEdge {
        Objects.requireNonNull(sourceNode, "sourceNode");
        Objects.requireNonNull(destinationNode, "destinationNode");
    }
}
