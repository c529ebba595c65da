package com.example.flowbridge.agentspec;

import java.util.List;
import java.util.Objects;

/**
 * A conversational agent: model configuration, system prompt, tools and optional structured outputs.
 */
public record Agent(String id, String name, String description, LlmConfig llmConfig, String systemPrompt,
                    List<Tool> tools, List<Property> inputs, List<Property> outputs) implements AgentSpecComponent {

    public Agent {
        Objects.requireNonNull(llmConfig, "llmConfig");
        systemPrompt = systemPrompt != null ? systemPrompt : "";
        tools = tools != null ? List.copyOf(tools) : List.of();
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
    }
}
