package com.example.flowbridge.agentspec;

import java.util.List;

/**
 * A node of a {@link Flow}.
 */
public interface FlowNode extends AgentSpecComponent {

    List<Property> inputs();

    List<Property> outputs();
}
