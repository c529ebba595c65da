package com.example.flowbridge.agentspec;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A flow: nodes, the start node id and the control/data connections between nodes.
 */
public record Flow(String id, String name, String startNode, List<FlowNode> nodes,
                   List<ControlFlowEdge> controlFlowConnections, List<DataFlowEdge> dataFlowConnections)
        implements AgentSpecComponent {

    public Flow {
        Objects.requireNonNull(startNode, "startNode");
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        controlFlowConnections = controlFlowConnections != null ? List.copyOf(controlFlowConnections) : List.of();
        dataFlowConnections = dataFlowConnections != null ? List.copyOf(dataFlowConnections) : List.of();
    }

    public Optional<FlowNode> findNode(String nodeId) {
        return nodes.stream().filter(n -> n.id().equals(nodeId)).findFirst();
    }
}
