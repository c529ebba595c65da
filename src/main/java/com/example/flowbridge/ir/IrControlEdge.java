package com.example.flowbridge.ir;

import java.util.Objects;

/**
 * Directed control edge. A null {@code branch} is an unconditional ("next") edge; otherwise it names
 * the arm of a branch node, {@link #DEFAULT_BRANCH} being the else arm.
 */
public record IrControlEdge(String fromId, String toId, String branch) {

    public static final String DEFAULT_BRANCH = "default";
    public static final String NEXT = "next";

    public IrControlEdge {
        Objects.requireNonNull(fromId, "fromId");
        Objects.requireNonNull(toId, "toId");
        if (NEXT.equals(branch)) {
            branch = null;
        }
    }

    public IrControlEdge(String fromId, String toId) {
        this(fromId, toId, null);
    }

    public boolean isUnconditional() {
        return branch == null;
    }
}
