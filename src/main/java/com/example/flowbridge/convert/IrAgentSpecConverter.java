package com.example.flowbridge.convert;

import com.example.flowbridge.agentspec.Agent;
import com.example.flowbridge.agentspec.AgentNode;
import com.example.flowbridge.agentspec.AgentSpecDeserializer;
import com.example.flowbridge.agentspec.AgentSpecSerializer;
import com.example.flowbridge.agentspec.BranchingNode;
import com.example.flowbridge.agentspec.ClientTool;
import com.example.flowbridge.agentspec.ControlFlowEdge;
import com.example.flowbridge.agentspec.DataFlowEdge;
import com.example.flowbridge.agentspec.EndNode;
import com.example.flowbridge.agentspec.Flow;
import com.example.flowbridge.agentspec.FlowNode;
import com.example.flowbridge.agentspec.GenerationParameters;
import com.example.flowbridge.agentspec.LlmConfig;
import com.example.flowbridge.agentspec.LlmNode;
import com.example.flowbridge.agentspec.OpenAiConfig;
import com.example.flowbridge.agentspec.OutputMessageNode;
import com.example.flowbridge.agentspec.Property;
import com.example.flowbridge.agentspec.ServerTool;
import com.example.flowbridge.agentspec.StartNode;
import com.example.flowbridge.agentspec.Tool;
import com.example.flowbridge.agentspec.ToolNode;
import com.example.flowbridge.errors.FlowErrorCode;
import com.example.flowbridge.errors.LossyMappingException;
import com.example.flowbridge.errors.UnsupportedPatternException;
import com.example.flowbridge.ir.IoField;
import com.example.flowbridge.ir.IrControlEdge;
import com.example.flowbridge.ir.IrDataEdge;
import com.example.flowbridge.ir.IrFlow;
import com.example.flowbridge.ir.IrNode;
import com.example.flowbridge.ir.IrNodeKind;
import com.example.flowbridge.ir.NodePayload;
import com.example.flowbridge.ir.ToolDefinition;
import com.example.flowbridge.ir.ToolKind;
import com.example.flowbridge.naming.Naming;
import com.example.flowbridge.validation.IrFlowValidator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Stateless mapping between the IR and Agent Spec {@link Flow} components.
 * <p>
 * Node ids are kept in both directions. Agent and LLM configurations travel through the IR as YAML
 * snippets and are parsed into first-class components on the way out.
 * </p>
 */
@Slf4j
public class IrAgentSpecConverter {

    static final String DEFAULT_MODEL = "gpt-4o-mini";

    private final AgentSpecSerializer serializer;
    private final AgentSpecDeserializer deserializer;

    public IrAgentSpecConverter(AgentSpecSerializer serializer, AgentSpecDeserializer deserializer) {
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.deserializer = Objects.requireNonNull(deserializer, "deserializer");
    }

    public Flow toAgentSpec(IrFlow ir, boolean strict) {
        IrFlowValidator.validate(ir);
        List<FlowNode> nodes = new ArrayList<>();
        for (IrNode node : ir.nodes()) {
            nodes.add(toFlowNode(node, strict));
        }

        List<ControlFlowEdge> control = new ArrayList<>();
        for (IrControlEdge edge : ir.controlEdges()) {
            if (ir.node(edge.fromId()).kind() == IrNodeKind.END) {
                continue;
            }
            String name = edge.fromId() + "_to_" + edge.toId();
            control.add(new ControlFlowEdge(Naming.stableId("control:" + name + ":" + edge.branch()), name,
                    edge.fromId(), edge.branch(), edge.toId()));
        }

        List<DataFlowEdge> data = new ArrayList<>();
        for (IrDataEdge edge : ir.dataEdges()) {
            String name = edge.sourceId() + "__" + edge.sourceOutput() + "__to__" + edge.destId() + "__" + edge.destInput();
            data.add(new DataFlowEdge(Naming.stableId("data:" + name), name, edge.sourceId(), edge.sourceOutput(),
                    edge.destId(), edge.destInput()));
        }

        log.debug("Converted IR to Agent Spec flow name={} nodes={}", ir.name(), nodes.size());
        return new Flow(Naming.stableId("flow:" + ir.name()), ir.name(), ir.startId(), nodes, control, data);
    }

    public IrFlow toIr(Flow flow, boolean strict) {
        List<IrNode> nodes = new ArrayList<>();
        for (FlowNode node : flow.nodes()) {
            nodes.add(new IrNode(node.id(), node.name(), toPayload(node, strict)));
        }
        List<IrControlEdge> control = flow.controlFlowConnections().stream()
                .map(e -> new IrControlEdge(e.fromNode(), e.toNode(), e.fromBranch()))
                .toList();
        List<IrDataEdge> data = flow.dataFlowConnections().stream()
                .map(e -> new IrDataEdge(e.sourceNode(), e.sourceOutput(), e.destinationNode(), e.destinationInput()))
                .toList();
        log.debug("Converted Agent Spec flow to IR name={} nodes={}", flow.name(), nodes.size());
        return new IrFlow(flow.name(), flow.startNode(), nodes, control, data);
    }

    private FlowNode toFlowNode(IrNode node, boolean strict) {
        NodePayload payload = node.payload();
        if (payload instanceof NodePayload.StartPayload start) {
            return new StartNode(node.id(), node.name(), properties(start.inputs()), properties(start.outputs()));
        }
        if (payload instanceof NodePayload.EndPayload end) {
            return new EndNode(node.id(), node.name(), List.of(), properties(end.outputs()));
        }
        if (payload instanceof NodePayload.AgentPayload agentPayload) {
            Agent agent = agentOf(node, agentPayload.agentSpecYaml(), strict);
            return new AgentNode(node.id(), node.name(), agent, agent.inputs(), agent.outputs());
        }
        if (payload instanceof NodePayload.LlmPayload llm) {
            return new LlmNode(node.id(), node.name(), llmConfigOf(node, llm.llmConfigYaml(), strict),
                    llm.promptTemplate(), List.of(), properties(llm.outputs()));
        }
        if (payload instanceof NodePayload.ToolPayload toolPayload) {
            ToolDefinition definition = toolPayload.tool();
            String toolId = Naming.stableId("tool:" + definition.name());
            Tool tool = definition.kind() == ToolKind.CLIENT
                    ? new ClientTool(toolId, definition.name(), null, properties(definition.inputs()), properties(definition.outputs()))
                    : new ServerTool(toolId, definition.name(), null, properties(definition.inputs()), properties(definition.outputs()));
            return new ToolNode(node.id(), node.name(), tool, tool.inputs(), tool.outputs());
        }
        if (payload instanceof NodePayload.MessagePayload message) {
            return new OutputMessageNode(node.id(), node.name(), message.message(), List.of(), List.of());
        }
        if (payload instanceof NodePayload.BranchPayload branch) {
            List<Property> inputs = branch.inputKey() != null ? List.of(Property.of(branch.inputKey(), "string")) : List.of();
            return new BranchingNode(node.id(), node.name(), branch.mapping(), inputs, List.of());
        }
        throw new UnsupportedPatternException(FlowErrorCode.UNSUPPORTED_NODE_KIND,
                "Unsupported IR node kind: " + node.kind().wireName(), Map.of("node", node.id()));
    }

    private Agent agentOf(IrNode node, String yaml, boolean strict) {
        if (yaml != null && !yaml.isBlank()) {
            return deserializer.readAgent(yaml);
        }
        if (strict) {
            throw new UnsupportedPatternException(FlowErrorCode.AGENT_YAML_MISSING,
                    "Agent node '" + node.name() + "' lacks an agent snippet", Map.of("node", node.id()));
        }
        log.warn("Agent node {} has no snippet, substituting a default agent", node.id());
        return new Agent(Naming.stableId("agent:" + node.id()), "inline_agent", null, defaultLlmConfig(node.id()),
                "", List.of(), List.of(), List.of());
    }

    private LlmConfig llmConfigOf(IrNode node, String yaml, boolean strict) {
        if (yaml != null && !yaml.isBlank()) {
            return deserializer.readLlmConfig(yaml);
        }
        if (strict) {
            throw new UnsupportedPatternException(FlowErrorCode.LLM_YAML_MISSING,
                    "LLM node '" + node.name() + "' lacks an LLM configuration snippet", Map.of("node", node.id()));
        }
        log.warn("LLM node {} has no configuration snippet, substituting {}", node.id(), DEFAULT_MODEL);
        return defaultLlmConfig(node.id());
    }

    private static OpenAiConfig defaultLlmConfig(String seed) {
        return new OpenAiConfig(Naming.stableId("llm:" + seed), DEFAULT_MODEL, DEFAULT_MODEL, GenerationParameters.NONE);
    }

    private NodePayload toPayload(FlowNode node, boolean strict) {
        if (node instanceof StartNode start) {
            return new NodePayload.StartPayload(fields(node, start.inputs(), strict), fields(node, start.outputs(), strict));
        }
        if (node instanceof EndNode end) {
            return new NodePayload.EndPayload(fields(node, end.outputs(), strict));
        }
        if (node instanceof AgentNode agentNode) {
            return new NodePayload.AgentPayload(serializer.toYaml(agentNode.agent()));
        }
        if (node instanceof LlmNode llm) {
            return new NodePayload.LlmPayload(serializer.toYaml(llm.llmConfig()), llm.promptTemplate(),
                    fields(node, llm.outputs(), strict));
        }
        if (node instanceof ToolNode toolNode) {
            Tool tool = toolNode.tool();
            ToolKind kind = tool instanceof ClientTool ? ToolKind.CLIENT : ToolKind.SERVER;
            return new NodePayload.ToolPayload(new ToolDefinition(tool.name(), kind,
                    fields(node, tool.inputs(), strict), fields(node, tool.outputs(), strict)));
        }
        if (node instanceof OutputMessageNode message) {
            return new NodePayload.MessagePayload(message.message());
        }
        if (node instanceof BranchingNode branching) {
            if (branching.inputs().isEmpty()) {
                throw new UnsupportedPatternException(FlowErrorCode.BRANCH_INPUT_KEY_MISSING,
                        "Branching node '" + node.name() + "' has no input to branch on", Map.of("node", node.id()));
            }
            return new NodePayload.BranchPayload(branching.mapping(), branching.inputs().get(0).title());
        }
        throw new UnsupportedPatternException(FlowErrorCode.UNSUPPORTED_NODE,
                "Unsupported node type for IR conversion: " + node.componentType(),
                Map.of("node", node.id(), "component_type", node.componentType()));
    }

    /** IR fields carry title, type and enum; descriptions and defaults have nowhere to go. */
    private static List<IoField> fields(FlowNode node, List<Property> properties, boolean strict) {
        List<IoField> fields = new ArrayList<>();
        for (Property property : properties) {
            if (property.description() != null || property.defaultValue() != null) {
                if (strict) {
                    throw new LossyMappingException("Property '" + property.title() + "' carries a description or default the IR cannot keep",
                            Map.of("node", node.id(), "property", property.title()));
                }
                log.warn("Dropping description/default of property {} on node {}", property.title(), node.id());
            }
            fields.add(new IoField(property.title(), property.type(), property.enumValues()));
        }
        return fields;
    }

    private static List<Property> properties(List<IoField> fields) {
        return fields.stream().map(f -> Property.of(f.title(), f.type(), f.enumValues())).toList();
    }
}
