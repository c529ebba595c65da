package com.example.flowbridge.builder;

import com.example.flowbridge.agentspec.Agent;
import com.example.flowbridge.agentspec.AgentSpecSerializer;
import com.example.flowbridge.agentspec.OpenAiConfig;
import com.example.flowbridge.agentspec.Property;
import com.example.flowbridge.agentspec.ServerTool;
import com.example.flowbridge.agentspec.Tool;
import com.example.flowbridge.errors.FlowErrorCode;
import com.example.flowbridge.errors.UnsupportedPatternException;
import com.example.flowbridge.ir.IoField;
import com.example.flowbridge.ir.ToolDefinition;
import com.example.flowbridge.naming.Naming;
import com.example.flowbridge.scan.AgentDefinition;
import com.example.flowbridge.scan.FieldSchema;
import com.example.flowbridge.scan.ScanFacts;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a scanned agent definition into the Agent Spec {@code Agent} carried by an agent node.
 * Ids derive from the script variable so repeated runs of one agent share a single identity.
 */
@Slf4j
public class AgentSnippetFactory {

    public static final String DEFAULT_MODEL = "gpt-4o-mini";

    private final AgentSpecSerializer serializer;

    public AgentSnippetFactory(AgentSpecSerializer serializer) {
        this.serializer = Objects.requireNonNull(serializer, "serializer");
    }

    public Agent agentOf(AgentDefinition definition, ScanFacts facts, boolean strict) {
        String model = definition.modelId() != null ? definition.modelId() : DEFAULT_MODEL;
        OpenAiConfig llmConfig = new OpenAiConfig(Naming.stableId("llm:" + definition.variable()), model, model,
                definition.generation());

        List<Tool> tools = new ArrayList<>();
        for (String toolName : definition.toolNames()) {
            ToolDefinition tool = facts.tools().get(toolName);
            if (tool == null) {
                if (strict) {
                    throw new UnsupportedPatternException(FlowErrorCode.UNSUPPORTED_TOOL,
                            "Agent references an unsupported or unknown tool",
                            Map.of("agent", definition.variable(), "tool", toolName));
                }
                log.warn("Agent {} skips unknown tool {}", definition.variable(), toolName);
                continue;
            }
            tools.add(new ServerTool(Naming.stableId("tool:" + tool.name()), tool.name(), null,
                    properties(tool.inputs()), properties(tool.outputs())));
        }

        List<Property> outputs = new ArrayList<>();
        for (Map.Entry<String, FieldSchema> field : facts.outputFieldsOf(definition).entrySet()) {
            outputs.add(Property.of(field.getKey(), field.getValue().type(), field.getValue().enumValues()));
        }
        return new Agent(Naming.stableId("agent:" + definition.variable()), definition.displayName(), null,
                llmConfig, definition.instructions(), tools, List.of(), outputs);
    }

    public String snippetOf(AgentDefinition definition, ScanFacts facts, boolean strict) {
        return serializer.toYaml(agentOf(definition, facts, strict));
    }

    private static List<Property> properties(List<IoField> fields) {
        return fields.stream().map(f -> Property.of(f.title(), f.type(), f.enumValues())).toList();
    }
}
