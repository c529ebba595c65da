package com.example.flowbridge.agentspec;

import com.example.flowbridge.errors.AgentSpecFormatException;
import com.example.flowbridge.naming.Naming;

import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.dataformat.yaml.YAMLMapper;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads Agent Spec YAML or JSON documents into component records.
 * <p>
 * Components may appear inline or as {@code {"$component_ref": id}} references resolved against
 * {@code $referenced_components} maps found on the way down; each referenced component is built once.
 * Malformed input, unknown {@code component_type} values and dangling references raise
 * {@link AgentSpecFormatException}.
 * </p>
 */
public class AgentSpecDeserializer {

    private static final TypeReference<Map<String, Object>> DOCUMENT_TYPE = new TypeReference<>() { };

    private final YAMLMapper yamlMapper;
    private final JsonMapper jsonMapper;

    public AgentSpecDeserializer(YAMLMapper yamlMapper, JsonMapper jsonMapper) {
        this.yamlMapper = Objects.requireNonNull(yamlMapper, "yamlMapper");
        this.jsonMapper = Objects.requireNonNull(jsonMapper, "jsonMapper");
    }

    public AgentSpecDeserializer() {
        this(YAMLMapper.builder().build(), JsonMapper.builder().build());
    }

    public AgentSpecComponent read(String text, DocumentFormat format) {
        return fromDocument(parse(text, format));
    }

    public AgentSpecComponent fromYaml(String yaml) {
        return read(yaml, DocumentFormat.YAML);
    }

    public AgentSpecComponent fromJson(String json) {
        return read(json, DocumentFormat.JSON);
    }

    public Flow readFlow(String text, DocumentFormat format) {
        return expect(read(text, format), Flow.class);
    }

    public Agent readAgent(String yaml) {
        return expect(fromYaml(yaml), Agent.class);
    }

    public LlmConfig readLlmConfig(String yaml) {
        return expect(fromYaml(yaml), LlmConfig.class);
    }

    public AgentSpecComponent fromDocument(Map<String, Object> document) {
        return new Resolver().component(document, "$");
    }

    private Map<String, Object> parse(String text, DocumentFormat format) {
        if (text == null || text.isBlank()) {
            throw new AgentSpecFormatException("Agent Spec document is empty", Map.of("format", format.wireName()));
        }
        Map<String, Object> document;
        try {
            document = format == DocumentFormat.JSON
                    ? jsonMapper.readValue(text, DOCUMENT_TYPE)
                    : yamlMapper.readValue(text, DOCUMENT_TYPE);
        } catch (JacksonException e) {
            throw new AgentSpecFormatException("Agent Spec document is not valid " + format.wireName(),
                    Map.of("format", format.wireName(), "error", String.valueOf(e.getMessage())), e);
        }
        if (document == null) {
            throw new AgentSpecFormatException("Agent Spec document is empty", Map.of("format", format.wireName()));
        }
        return document;
    }

    private static <T> T expect(AgentSpecComponent component, Class<T> type) {
        if (!type.isInstance(component)) {
            throw new AgentSpecFormatException("Expected a " + type.getSimpleName() + " document but found " + component.componentType(),
                    Map.of("expected", type.getSimpleName(), "component_type", component.componentType()));
        }
        return type.cast(component);
    }

    /** Per-document reference table and cache. */
    private final class Resolver {

        private final Map<String, Object> referenced = new HashMap<>();
        private final Map<String, AgentSpecComponent> built = new HashMap<>();

        AgentSpecComponent component(Object value, String path) {
            Map<String, Object> map = asMap(value, path);
            collectReferences(map, path);
            Object ref = map.get(AgentSpecSerializer.COMPONENT_REF);
            if (ref != null) {
                String id = String.valueOf(ref);
                AgentSpecComponent cached = built.get(id);
                if (cached != null) {
                    return cached;
                }
                Object target = referenced.get(id);
                if (target == null) {
                    throw new AgentSpecFormatException("Unresolved component reference: " + id, Map.of("ref", id, "path", path));
                }
                AgentSpecComponent resolved = component(target, path + "<" + id + ">");
                built.put(id, resolved);
                return resolved;
            }
            AgentSpecComponent component = build(map, path);
            built.putIfAbsent(component.id(), component);
            return component;
        }

        private void collectReferences(Map<String, Object> map, String path) {
            Object refs = map.get(AgentSpecSerializer.REFERENCED_COMPONENTS);
            if (refs != null) {
                asMap(refs, path + "." + AgentSpecSerializer.REFERENCED_COMPONENTS).forEach(referenced::putIfAbsent);
            }
        }

        private AgentSpecComponent build(Map<String, Object> map, String path) {
            String type = requiredString(map, "component_type", path);
            String name = string(map, "name");
            String id = string(map, "id");
            if (id == null) {
                id = Naming.stableId(type + ":" + (name != null ? name : path));
            }
            if (name == null) {
                name = id;
            }
            return switch (type) {
                case "Flow" -> flow(map, id, name, path);
                case "Agent" -> new Agent(id, name, string(map, "description"),
                        llmConfig(map.get("llm_config"), path + ".llm_config"),
                        string(map, "system_prompt"), tools(map.get("tools"), path + ".tools"),
                        properties(map, "inputs", path), properties(map, "outputs", path));
                case "OpenAiConfig" -> new OpenAiConfig(id, name, string(map, "model_id"), generation(map, path));
                case "OpenAiCompatibleConfig" -> new OpenAiCompatibleConfig(id, name, string(map, "model_id"),
                        string(map, "url"), generation(map, path));
                case "OllamaConfig" -> new OllamaConfig(id, name, string(map, "model_id"), string(map, "url"), generation(map, path));
                case "ServerTool" -> new ServerTool(id, name, string(map, "description"),
                        properties(map, "inputs", path), properties(map, "outputs", path));
                case "ClientTool" -> new ClientTool(id, name, string(map, "description"),
                        properties(map, "inputs", path), properties(map, "outputs", path));
                case "StartNode" -> new StartNode(id, name, properties(map, "inputs", path), properties(map, "outputs", path));
                case "EndNode" -> new EndNode(id, name, properties(map, "inputs", path), properties(map, "outputs", path));
                case "AgentNode" -> new AgentNode(id, name, expectAt(component(required(map, "agent", path), path + ".agent"), Agent.class, path),
                        properties(map, "inputs", path), properties(map, "outputs", path));
                case "LlmNode" -> new LlmNode(id, name, llmConfig(required(map, "llm_config", path), path + ".llm_config"),
                        string(map, "prompt_template"), properties(map, "inputs", path), properties(map, "outputs", path));
                case "ToolNode" -> new ToolNode(id, name, expectAt(component(required(map, "tool", path), path + ".tool"), Tool.class, path),
                        properties(map, "inputs", path), properties(map, "outputs", path));
                case "BranchingNode" -> new BranchingNode(id, name, mapping(map.get("mapping"), path),
                        properties(map, "inputs", path), properties(map, "outputs", path));
                case "OutputMessageNode" -> new OutputMessageNode(id, name, string(map, "message"),
                        properties(map, "inputs", path), properties(map, "outputs", path));
                case "InputMessageNode" -> new InputMessageNode(id, name, string(map, "message"),
                        properties(map, "inputs", path), properties(map, "outputs", path));
                case "ControlFlowEdge" -> new ControlFlowEdge(id, name,
                        nodeId(required(map, "from_node", path), path + ".from_node"),
                        string(map, "from_branch"),
                        nodeId(required(map, "to_node", path), path + ".to_node"));
                case "DataFlowEdge" -> new DataFlowEdge(id, name,
                        nodeId(required(map, "source_node", path), path + ".source_node"),
                        requiredString(map, "source_output", path),
                        nodeId(required(map, "destination_node", path), path + ".destination_node"),
                        requiredString(map, "destination_input", path));
                default -> throw new AgentSpecFormatException("Unknown component_type: " + type,
                        Map.of("component_type", type, "path", path));
            };
        }

        private Flow flow(Map<String, Object> map, String id, String name, String path) {
            List<FlowNode> nodes = new ArrayList<>();
            int index = 0;
            for (Object node : list(map.get("nodes"), path + ".nodes")) {
                nodes.add(expectAt(component(node, path + ".nodes[" + index++ + "]"), FlowNode.class, path));
            }
            String startNode = nodeId(required(map, "start_node", path), path + ".start_node");
            List<ControlFlowEdge> control = new ArrayList<>();
            index = 0;
            for (Object edge : list(map.get("control_flow_connections"), path + ".control_flow_connections")) {
                control.add(expectAt(component(edge, path + ".control_flow_connections[" + index++ + "]"), ControlFlowEdge.class, path));
            }
            List<DataFlowEdge> data = new ArrayList<>();
            index = 0;
            for (Object edge : list(map.get("data_flow_connections"), path + ".data_flow_connections")) {
                data.add(expectAt(component(edge, path + ".data_flow_connections[" + index++ + "]"), DataFlowEdge.class, path));
            }
            return new Flow(id, name, startNode, nodes, control, data);
        }

        private String nodeId(Object value, String path) {
            return expectAt(component(value, path), FlowNode.class, path).id();
        }

        private LlmConfig llmConfig(Object value, String path) {
            if (value == null) {
                throw new AgentSpecFormatException("Missing llm_config", Map.of("path", path));
            }
            return expectAt(component(value, path), LlmConfig.class, path);
        }

        private List<Tool> tools(Object value, String path) {
            List<Tool> tools = new ArrayList<>();
            int index = 0;
            for (Object tool : list(value, path)) {
                tools.add(expectAt(component(tool, path + "[" + index++ + "]"), Tool.class, path));
            }
            return tools;
        }

        private GenerationParameters generation(Map<String, Object> map, String path) {
            Object raw = map.get("default_generation_parameters");
            if (raw == null) {
                return GenerationParameters.NONE;
            }
            Map<String, Object> gen = asMap(raw, path + ".default_generation_parameters");
            Number temperature = number(gen.get("temperature"), path);
            Number topP = number(gen.get("top_p"), path);
            Number maxTokens = number(gen.get("max_tokens"), path);
            return new GenerationParameters(
                    temperature != null ? temperature.doubleValue() : null,
                    topP != null ? topP.doubleValue() : null,
                    maxTokens != null ? maxTokens.intValue() : null);
        }

        private Map<String, String> mapping(Object value, String path) {
            Map<String, String> mapping = new LinkedHashMap<>();
            if (value != null) {
                asMap(value, path + ".mapping").forEach((k, v) -> mapping.put(k, String.valueOf(v)));
            }
            return mapping;
        }

        private List<Property> properties(Map<String, Object> map, String key, String path) {
            List<Property> properties = new ArrayList<>();
            int index = 0;
            for (Object raw : list(map.get(key), path + "." + key)) {
                String at = path + "." + key + "[" + index++ + "]";
                Map<String, Object> schema = asMap(raw, at);
                Object jsonSchema = schema.get("json_schema");
                if (jsonSchema instanceof Map<?, ?>) {
                    Map<String, Object> merged = new LinkedHashMap<>(asMap(jsonSchema, at + ".json_schema"));
                    schema.forEach(merged::putIfAbsent);
                    schema = merged;
                }
                properties.add(new Property(
                        requiredString(schema, "title", at),
                        schemaType(schema.get("type")),
                        schema.get("enum") != null ? list(schema.get("enum"), at + ".enum") : List.of(),
                        string(schema, "description"),
                        schema.get("default")));
            }
            return properties;
        }

        private String schemaType(Object type) {
            if (type instanceof List<?> types) {
                return types.stream()
                        .filter(t -> t != null && !"null".equals(t))
                        .map(String::valueOf)
                        .findFirst()
                        .orElse("string");
            }
            return type != null ? String.valueOf(type) : "string";
        }
    }

    private static <T> T expectAt(AgentSpecComponent component, Class<T> type, String path) {
        if (!type.isInstance(component)) {
            throw new AgentSpecFormatException("Expected a " + type.getSimpleName() + " at " + path + " but found " + component.componentType(),
                    Map.of("expected", type.getSimpleName(), "component_type", component.componentType(), "path", path));
        }
        return type.cast(component);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String path) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new AgentSpecFormatException("Expected an object at " + path, Map.of("path", path));
    }

    @SuppressWarnings("unchecked")
    private static List<Object> list(Object value, String path) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return (List<Object>) list;
        }
        throw new AgentSpecFormatException("Expected a list at " + path, Map.of("path", path));
    }

    private static Object required(Map<String, Object> map, String key, String path) {
        Object value = map.get(key);
        if (value == null) {
            throw new AgentSpecFormatException("Missing '" + key + "' at " + path, Map.of("field", key, "path", path));
        }
        return value;
    }

    private static String requiredString(Map<String, Object> map, String key, String path) {
        return String.valueOf(required(map, key, path));
    }

    private static String string(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value != null ? String.valueOf(value) : null;
    }

    private static Number number(Object value, String path) {
        if (value == null || value instanceof Number) {
            return (Number) value;
        }
        try {
            return Double.valueOf(String.valueOf(value));
        } catch (NumberFormatException e) {
            throw new AgentSpecFormatException("Expected a number at " + path + " but found " + value, Map.of("path", path, "value", String.valueOf(value)));
        }
    }
}
