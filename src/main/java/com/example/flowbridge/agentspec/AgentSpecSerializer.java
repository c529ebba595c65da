package com.example.flowbridge.agentspec;

import com.example.flowbridge.errors.AgentSpecFormatException;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.dataformat.yaml.YAMLMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes Agent Spec components as YAML or JSON documents.
 * <p>
 * Keys are snake_case and every component carries {@code component_type}, {@code id} and {@code name}.
 * Flow nodes are written once under {@code $referenced_components} and referenced from the node list,
 * the start node and the edges as {@code {"$component_ref": id}}. The root carries {@code agentspec_version}.
 * </p>
 */
public class AgentSpecSerializer {

    static final String COMPONENT_REF = "$component_ref";
    static final String REFERENCED_COMPONENTS = "$referenced_components";

    private final YAMLMapper yamlMapper;
    private final JsonMapper jsonMapper;

    public AgentSpecSerializer(YAMLMapper yamlMapper, JsonMapper jsonMapper) {
        this.yamlMapper = Objects.requireNonNull(yamlMapper, "yamlMapper");
        this.jsonMapper = Objects.requireNonNull(jsonMapper, "jsonMapper");
    }

    public AgentSpecSerializer() {
        this(YAMLMapper.builder().build(), JsonMapper.builder().build());
    }

    public String toYaml(AgentSpecComponent component) {
        return write(component, DocumentFormat.YAML);
    }

    public String toJson(AgentSpecComponent component) {
        return write(component, DocumentFormat.JSON);
    }

    public String write(AgentSpecComponent component, DocumentFormat format) {
        Map<String, Object> document = toDocument(component);
        try {
            return format == DocumentFormat.JSON
                    ? jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document)
                    : yamlMapper.writeValueAsString(document);
        } catch (JacksonException e) {
            throw new AgentSpecFormatException("Failed to write " + component.componentType() + " as " + format.wireName(),
                    Map.of("component", component.componentType(), "error", String.valueOf(e.getMessage())), e);
        }
    }

    /**
     * Root document map: the component with {@code agentspec_version} and, for flows, the referenced components.
     */
    public Map<String, Object> toDocument(AgentSpecComponent component) {
        Map<String, Object> referenced = new LinkedHashMap<>();
        Map<String, Object> body = toMap(component, referenced);
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("component_type", component.componentType());
        root.put("agentspec_version", AgentSpecComponent.AGENTSPEC_VERSION);
        root.putAll(body);
        if (!referenced.isEmpty()) {
            root.put(REFERENCED_COMPONENTS, referenced);
        }
        return root;
    }

    private Map<String, Object> toMap(AgentSpecComponent component, Map<String, Object> referenced) {
        Map<String, Object> map = header(component);
        if (component instanceof Flow flow) {
            writeFlow(flow, map, referenced);
        } else if (component instanceof Agent agent) {
            writeAgent(agent, map);
        } else if (component instanceof LlmConfig llmConfig) {
            writeLlmConfig(llmConfig, map);
        } else if (component instanceof Tool tool) {
            writeTool(tool, map);
        } else if (component instanceof FlowNode node) {
            writeNode(node, map);
        } else if (component instanceof ControlFlowEdge edge) {
            map.put("from_node", ref(edge.fromNode()));
            map.put("from_branch", edge.fromBranch());
            map.put("to_node", ref(edge.toNode()));
        } else if (component instanceof DataFlowEdge edge) {
            map.put("source_node", ref(edge.sourceNode()));
            map.put("source_output", edge.sourceOutput());
            map.put("destination_node", ref(edge.destinationNode()));
            map.put("destination_input", edge.destinationInput());
        } else {
            throw new AgentSpecFormatException("Cannot serialize component " + component.componentType(),
                    Map.of("component_type", component.componentType()));
        }
        return map;
    }

    private void writeFlow(Flow flow, Map<String, Object> map, Map<String, Object> referenced) {
        map.put("start_node", ref(flow.startNode()));
        List<Object> nodes = new ArrayList<>();
        for (FlowNode node : flow.nodes()) {
            referenced.put(node.id(), toMap(node, referenced));
            nodes.add(ref(node.id()));
        }
        map.put("nodes", nodes);
        List<Object> control = new ArrayList<>();
        for (ControlFlowEdge edge : flow.controlFlowConnections()) {
            control.add(toMap(edge, referenced));
        }
        map.put("control_flow_connections", control);
        List<Object> data = new ArrayList<>();
        for (DataFlowEdge edge : flow.dataFlowConnections()) {
            data.add(toMap(edge, referenced));
        }
        map.put("data_flow_connections", data);
    }

    private void writeAgent(Agent agent, Map<String, Object> map) {
        if (agent.description() != null) {
            map.put("description", agent.description());
        }
        map.put("llm_config", toMap(agent.llmConfig(), Map.of()));
        map.put("system_prompt", agent.systemPrompt());
        List<Object> tools = new ArrayList<>();
        for (Tool tool : agent.tools()) {
            tools.add(toMap(tool, Map.of()));
        }
        map.put("tools", tools);
        map.put("inputs", properties(agent.inputs()));
        map.put("outputs", properties(agent.outputs()));
    }

    private void writeLlmConfig(LlmConfig config, Map<String, Object> map) {
        map.put("model_id", config.modelId());
        if (config instanceof OpenAiCompatibleConfig compatible) {
            map.put("url", compatible.url());
        } else if (config instanceof OllamaConfig ollama) {
            map.put("url", ollama.url());
        }
        GenerationParameters params = config.defaultGenerationParameters();
        if (params != null && !params.isEmpty()) {
            Map<String, Object> gen = new LinkedHashMap<>();
            if (params.temperature() != null) {
                gen.put("temperature", params.temperature());
            }
            if (params.topP() != null) {
                gen.put("top_p", params.topP());
            }
            if (params.maxTokens() != null) {
                gen.put("max_tokens", params.maxTokens());
            }
            map.put("default_generation_parameters", gen);
        }
    }

    private void writeTool(Tool tool, Map<String, Object> map) {
        if (tool.description() != null) {
            map.put("description", tool.description());
        }
        map.put("inputs", properties(tool.inputs()));
        map.put("outputs", properties(tool.outputs()));
    }

    private void writeNode(FlowNode node, Map<String, Object> map) {
        if (node instanceof AgentNode agentNode) {
            map.put("agent", toMap(agentNode.agent(), Map.of()));
        } else if (node instanceof LlmNode llmNode) {
            map.put("llm_config", toMap(llmNode.llmConfig(), Map.of()));
            map.put("prompt_template", llmNode.promptTemplate());
        } else if (node instanceof ToolNode toolNode) {
            map.put("tool", toMap(toolNode.tool(), Map.of()));
        } else if (node instanceof BranchingNode branching) {
            map.put("mapping", new LinkedHashMap<>(branching.mapping()));
        } else if (node instanceof OutputMessageNode message) {
            map.put("message", message.message());
        } else if (node instanceof InputMessageNode message) {
            map.put("message", message.message());
        }
        map.put("inputs", properties(node.inputs()));
        map.put("outputs", properties(node.outputs()));
    }

    private static Map<String, Object> header(AgentSpecComponent component) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("component_type", component.componentType());
        map.put("id", component.id());
        map.put("name", component.name());
        return map;
    }

    private static List<Object> properties(List<Property> properties) {
        List<Object> out = new ArrayList<>();
        for (Property property : properties) {
            out.add(property.toJsonSchema());
        }
        return out;
    }

    private static Map<String, Object> ref(String id) {
        return Map.of(COMPONENT_REF, id);
    }
}
