package com.example.flowbridge.validation;

import com.example.flowbridge.ir.IrControlEdge;
import com.example.flowbridge.ir.IrDataEdge;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * One problem found in an IR graph or a request body. {@code field} is the path of the offending element,
 * such as {@code controlEdges[a->b].toId}; {@code nodeId} names the node the problem is anchored on, when
 * there is one.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationError(String field, String message, String nodeId) {

    public ValidationError {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(message, "message");
    }

    public static ValidationError ofField(String field, String message) {
        return new ValidationError(field, message, null);
    }

    public static ValidationError ofNode(String nodeId, String message) {
        return new ValidationError("nodes[" + nodeId + "]", message, nodeId);
    }

    /** Anchored on the edge's source node; {@code attribute} may be null for the edge as a whole. */
    public static ValidationError ofControlEdge(IrControlEdge edge, String attribute, String message) {
        String path = "controlEdges[" + edge.fromId() + "->" + edge.toId() + "]";
        return new ValidationError(attribute == null ? path : path + "." + attribute, message, edge.fromId());
    }

    /** Anchored on the node the edge feeds. */
    public static ValidationError ofDataEdge(IrDataEdge edge, String attribute, String message) {
        String path = "dataEdges[" + edge.sourceId() + "." + edge.sourceOutput() + "->" + edge.destId() + "." + edge.destInput() + "]";
        return new ValidationError(attribute == null ? path : path + "." + attribute, message, edge.destId());
    }
}
