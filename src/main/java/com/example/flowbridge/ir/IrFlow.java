package com.example.flowbridge.ir;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The graph aggregate: entry node id, nodes, control edges and data edges.
 * Structural invariants are checked by {@link com.example.flowbridge.validation.IrFlowValidator}.
 */
public record IrFlow(String name, String startId, List<IrNode> nodes, List<IrControlEdge> controlEdges, List<IrDataEdge> dataEdges) {

    public IrFlow {
        Objects.requireNonNull(startId, "startId");
        name = name != null ? name : "workflow";
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        controlEdges = controlEdges != null ? List.copyOf(controlEdges) : List.of();
        dataEdges = dataEdges != null ? List.copyOf(dataEdges) : List.of();
    }

    public Optional<IrNode> findNode(String id) {
        return nodes.stream().filter(n -> n.id().equals(id)).findFirst();
    }

    public IrNode node(String id) {
        return findNode(id).orElseThrow(() -> new IllegalArgumentException("Unknown node id: " + id));
    }

    public List<IrControlEdge> outgoing(String nodeId) {
        return controlEdges.stream().filter(e -> e.fromId().equals(nodeId)).toList();
    }

    public List<IrDataEdge> dataEdgesInto(String nodeId) {
        return dataEdges.stream().filter(e -> e.destId().equals(nodeId)).toList();
    }

    public List<IrNode> nodesOfKind(IrNodeKind kind) {
        return nodes.stream().filter(n -> n.kind() == kind).toList();
    }
}
