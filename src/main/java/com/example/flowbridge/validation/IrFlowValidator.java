package com.example.flowbridge.validation;

import com.example.flowbridge.ir.IrControlEdge;
import com.example.flowbridge.ir.IrDataEdge;
import com.example.flowbridge.ir.IrFlow;
import com.example.flowbridge.ir.IrNode;
import com.example.flowbridge.ir.IrNodeKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates an IR graph: node identity, reference integrity, edge-label rules and reachability.
 * Cycles are allowed here; the code generator rejects them when it walks the graph.
 */
public final class IrFlowValidator {

    private IrFlowValidator() {
    }

    /**
     * Validates the flow. Throws {@link IrFlowValidationException} with all errors if invalid.
     */
    public static void validate(IrFlow flow) {
        List<ValidationError> errors = new ArrayList<>();

        Map<String, IrNode> byId = new HashMap<>();
        for (IrNode node : flow.nodes()) {
            if (byId.putIfAbsent(node.id(), node) != null) {
                errors.add(ValidationError.ofNode(node.id(), "duplicate node id"));
            }
        }

        IrNode start = byId.get(flow.startId());
        if (start == null) {
            errors.add(ValidationError.ofField("startId", "startId must reference an existing node id: " + flow.startId()));
        } else if (start.kind() != IrNodeKind.START) {
            errors.add(ValidationError.ofField("startId", "startId must reference a start node, got " + start.kind().wireName()));
        }

        validateControlEdges(flow, byId, errors);
        validateDataEdges(flow, byId, errors);

        if (start != null && errors.isEmpty()) {
            Set<String> reached = reachableFrom(flow, start.id());
            for (IrNode node : flow.nodes()) {
                if (!reached.contains(node.id())) {
                    errors.add(ValidationError.ofNode(node.id(), "node is not reachable from " + start.id()));
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new IrFlowValidationException(errors);
        }
    }

    private static void validateControlEdges(IrFlow flow, Map<String, IrNode> byId, List<ValidationError> errors) {
        Set<String> withNext = new HashSet<>();
        Set<String> labels = new HashSet<>();
        for (IrControlEdge edge : flow.controlEdges()) {
            IrNode from = byId.get(edge.fromId());
            if (from == null) {
                errors.add(ValidationError.ofControlEdge(edge, "fromId", "fromId must reference an existing node id: " + edge.fromId()));
            }
            if (!byId.containsKey(edge.toId())) {
                errors.add(ValidationError.ofControlEdge(edge, "toId", "toId must reference an existing node id: " + edge.toId()));
            }
            if (edge.isUnconditional()) {
                if (!withNext.add(edge.fromId())) {
                    errors.add(ValidationError.ofControlEdge(edge, null, "node " + edge.fromId() + " has more than one unconditional successor"));
                }
                continue;
            }
            if (from != null && from.kind() != IrNodeKind.BRANCH) {
                errors.add(ValidationError.ofControlEdge(edge, "branch", "branch label '" + edge.branch() + "' on an edge leaving a " + from.kind().wireName() + " node"));
            }
            if (!labels.add(edge.fromId() + "\u0000" + edge.branch())) {
                errors.add(ValidationError.ofControlEdge(edge, "branch", "duplicate branch label '" + edge.branch() + "' on node " + edge.fromId()));
            }
        }
    }

    private static void validateDataEdges(IrFlow flow, Map<String, IrNode> byId, List<ValidationError> errors) {
        Set<String> inputs = new HashSet<>();
        for (IrDataEdge edge : flow.dataEdges()) {
            if (!byId.containsKey(edge.sourceId())) {
                errors.add(ValidationError.ofDataEdge(edge, "sourceId", "sourceId must reference an existing node id: " + edge.sourceId()));
            }
            if (!byId.containsKey(edge.destId())) {
                errors.add(ValidationError.ofDataEdge(edge, "destId", "destId must reference an existing node id: " + edge.destId()));
            }
            if (!inputs.add(edge.destId() + "\u0000" + edge.destInput())) {
                errors.add(ValidationError.ofDataEdge(edge, "destInput", "input '" + edge.destInput() + "' of node " + edge.destId() + " is fed more than once"));
            }
        }
    }

    private static Set<String> reachableFrom(IrFlow flow, String startId) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.push(startId);
        while (!pending.isEmpty()) {
            String id = pending.pop();
            if (!seen.add(id)) {
                continue;
            }
            for (IrControlEdge edge : flow.outgoing(id)) {
                pending.push(edge.toId());
            }
        }
        return seen;
    }
}
