package com.example.flowbridge.ir;

import java.util.Objects;

/**
 * Named output of one node feeding a named input of another.
 */
public record IrDataEdge(String sourceId, String sourceOutput, String destId, String destInput) {

    public IrDataEdge {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(sourceOutput, "sourceOutput");
        Objects.requireNonNull(destId, "destId");
        Objects.requireNonNull(destInput, "destInput");
    }
}
