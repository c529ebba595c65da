package com.example.flowbridge.ir;

import java.util.List;
import java.util.Objects;

/**
 * Structural description of a tool: name, kind and its input/output fields.
 */
public record ToolDefinition(String name, ToolKind kind, List<IoField> inputs, List<IoField> outputs) {

    public ToolDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
    }
}
