package com.example.flowbridge.agentspec;

import java.util.List;

/**
 * A callable tool with typed inputs and outputs.
 */
public interface Tool extends AgentSpecComponent {

    String description();

    List<Property> inputs();

    List<Property> outputs();
}
