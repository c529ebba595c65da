package com.example.flowbridge.scan;

import com.example.flowbridge.ir.ToolDefinition;
import com.example.flowbridge.script.Stmt;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What one pass over a workflow script found: agents by variable, function tools by name, structured-output
 * records by class name, the entry input fields, the entry function body and the flow name.
 */
public record ScanFacts(Map<String, AgentDefinition> agents,
                        Map<String, ToolDefinition> tools,
                        Map<String, Map<String, FieldSchema>> models,
                        Map<String, FieldSchema> workflowInput,
                        List<Stmt> entryBody,
                        String flowName) {

    public static final String DEFAULT_FLOW_NAME = "workflow";

    public ScanFacts {
        agents = Collections.unmodifiableMap(new LinkedHashMap<>(agents));
        tools = Collections.unmodifiableMap(new LinkedHashMap<>(tools));
        models = Collections.unmodifiableMap(new LinkedHashMap<>(models));
        workflowInput = Collections.unmodifiableMap(new LinkedHashMap<>(workflowInput));
        entryBody = List.copyOf(entryBody);
        flowName = flowName != null ? flowName : DEFAULT_FLOW_NAME;
    }

    /** Fields of the record named by an agent's {@code output_type}; empty for unstructured agents. */
    public Map<String, FieldSchema> outputFieldsOf(AgentDefinition agent) {
        if (agent.outputType() == null) {
            return Map.of();
        }
        return models.getOrDefault(agent.outputType(), Map.of());
    }
}
