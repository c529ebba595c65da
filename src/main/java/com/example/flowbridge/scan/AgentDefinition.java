package com.example.flowbridge.scan;

import com.example.flowbridge.agentspec.GenerationParameters;

import java.util.List;
import java.util.Objects;

/**
 * A module-level {@code var = Agent(...)} construction. Unset or non-constant arguments are null.
 */
public record AgentDefinition(String variable, String displayName, String modelId, String instructions,
                              GenerationParameters generation, List<String> toolNames, String outputType) {

    public AgentDefinition {
        Objects.requireNonNull(variable, "variable");
        displayName = displayName != null ? displayName : variable;
        generation = generation != null ? generation : GenerationParameters.NONE;
        toolNames = toolNames != null ? List.copyOf(toolNames) : List.of();
    }
}
