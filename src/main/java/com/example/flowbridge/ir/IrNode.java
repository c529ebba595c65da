package com.example.flowbridge.ir;

import java.util.Objects;

/**
 * Immutable graph node. The payload kind always matches {@link #kind()}.
 */
public record IrNode(String id, String name, IrNodeKind kind, NodePayload payload) {

    public IrNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(payload, "payload");
        name = name != null ? name : id;
        if (payload.kind() != kind) {
            throw new IllegalArgumentException("Payload of kind " + payload.kind() + " does not fit node " + id + " of kind " + kind);
        }
    }

    public IrNode(String id, String name, NodePayload payload) {
        this(id, name, payload.kind(), payload);
    }

    public <T extends NodePayload> T payloadAs(Class<T> type) {
        return type.cast(payload);
    }
}
