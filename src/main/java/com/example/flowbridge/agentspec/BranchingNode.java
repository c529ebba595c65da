package com.example.flowbridge.agentspec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Routes to the branch named by {@code mapping.get(value)} of its single input; unmapped values take
 * the {@code default} branch.
 */
public record BranchingNode(String id, String name, Map<String, String> mapping, List<Property> inputs,
                            List<Property> outputs) implements FlowNode {

    public BranchingNode {
        mapping = mapping != null ? Collections.unmodifiableMap(new LinkedHashMap<>(mapping)) : Map.of();
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
    }
}
