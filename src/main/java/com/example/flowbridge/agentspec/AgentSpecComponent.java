package com.example.flowbridge.agentspec;

/**
 * Common shape of every Agent Spec component: an id, a display name and the {@code component_type}
 * discriminator written into documents.
 */
public interface AgentSpecComponent {

    /** Version stamped on the root of every serialized document. */
    String AGENTSPEC_VERSION = "25.4.1";

    String id();

    String name();

    default String componentType() {
        return getClass().getSimpleName();
    }
}
