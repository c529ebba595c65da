package com.example.flowbridge.agentspec;

import java.util.Objects;

/**
 * Control transfer between two nodes, referenced by id. A null {@code fromBranch} is the default transition.
 */
public record ControlFlowEdge(String id, String name, String fromNode, String fromBranch, String toNode)
        implements AgentSpecComponent {

    public ControlFlowEdge {
        Objects.requireNonNull(fromNode, "fromNode");
        Objects.requireNonNull(toNode, "toNode");
    }
}
