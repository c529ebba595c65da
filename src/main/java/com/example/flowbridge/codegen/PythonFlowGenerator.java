package com.example.flowbridge.codegen;

import com.example.flowbridge.agentspec.Agent;
import com.example.flowbridge.agentspec.AgentSpecDeserializer;
import com.example.flowbridge.agentspec.GenerationParameters;
import com.example.flowbridge.agentspec.Property;
import com.example.flowbridge.agentspec.ServerTool;
import com.example.flowbridge.agentspec.Tool;
import com.example.flowbridge.errors.FlowErrorCode;
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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Renders an IR flow as a deterministic workflow script.
 * <p>
 * The script holds, in order: imports and the tool registry, the {@code WorkflowInput} record and one
 * schema record per structured agent, tool stubs delegating to the registry, one {@code Agent(...)}
 * construction per distinct agent, and {@code run_workflow}. The entry body is a walk of the control
 * graph from the start node. Arms of a branch stop at the node every arm flows into, which is emitted
 * once after the {@code if} ladder, so the script scans back into the same graph shape. When that node
 * returns the latest agent result and the arms ran different agents, each arm assigns its own result to a
 * shared variable that the join returns.
 * </p>
 */
@Slf4j
public class PythonFlowGenerator {

    private static final String INDENT = "  ";
    private static final String EXIT = "<exit>";
    private static final String OUTPUT_TEXT = "output_text";
    private static final String DEFAULT_INPUT = "input_as_text";
    private static final Set<String> UNSTRUCTURED_FIELDS = Set.of(OUTPUT_TEXT, "text", "result");
    private static final Set<String> RESERVED_NAMES = Set.of(
            "workflow", "workflow_input", "conversation_history", "tools", "item", "impl", "trace",
            "function_tool", "run_workflow", "str", "int", "float", "bool", "list", "dict", "print");
    private static final Set<String> RESERVED_CLASSES = Set.of(
            "WorkflowInput", "BaseModel", "Agent", "ModelSettings", "TResponseInputItem", "Runner", "RunConfig",
            "Any", "Literal");

    private final AgentSpecDeserializer deserializer;

    public PythonFlowGenerator(AgentSpecDeserializer deserializer) {
        this.deserializer = Objects.requireNonNull(deserializer, "deserializer");
    }

    public String generate(IrFlow ir) {
        if (ir.findNode(ir.startId()).filter(n -> n.kind() == IrNodeKind.START).isEmpty()) {
            throw new UnsupportedPatternException(FlowErrorCode.MISSING_START,
                    "IR has no start node", Map.of("start", ir.startId()));
        }
        IrFlowValidator.validate(ir);
        return new Generation(ir).render();
    }

    private record AgentDeclaration(Agent agent, String variable, String schemaClass) {

        boolean structured() {
            return schemaClass != null;
        }

        String result() {
            return variable + "_result";
        }
    }

    /**
     * What the walk knows at a point of the entry body: the expression holding the latest agent result,
     * the agent nodes that result may come from, whether it is a shared variable assigned on several arms,
     * and every agent node whose result variable is defined.
     */
    private record PathState(String lastResult, Set<String> lastAgents, boolean shared, Set<String> executed) {

        static final PathState INITIAL = new PathState(null, Set.of(), false, Set.of());

        PathState ran(String agentNode, String result) {
            Set<String> next = new HashSet<>(executed);
            next.add(agentNode);
            return new PathState(result, Set.of(agentNode), false, Set.copyOf(next));
        }
    }

    /** Where the walk continues and with what state; a null step means the path has returned. */
    private record Step(PathState state, String next) {
    }

    private record Arm(String header, String target) {

        boolean isElse() {
            return header.equals("else:");
        }
    }

    /** A path arriving at the join; {@code position} is where its arm body ends, -1 when it falls through. */
    private record ArmExit(PathState state, int position, String indent) {
    }

    private record Frame(String node, Iterator<IrControlEdge> edges) {
    }

    private final class Generation {

        private final IrFlow ir;
        private final Map<String, Agent> agentsById = new LinkedHashMap<>();
        private final Map<String, String> agentIdByNode = new HashMap<>();
        private final Map<String, AgentDeclaration> declarations = new LinkedHashMap<>();
        private final Map<String, ServerTool> serverTools = new LinkedHashMap<>();
        private final Map<String, ToolDefinition> approvalTools = new LinkedHashMap<>();
        private final Map<String, String> toolFunctions = new HashMap<>();
        private final Map<String, String> postDominators = new HashMap<>();
        private final Map<String, Integer> finishRank = new HashMap<>();
        private final List<String> discovered = new ArrayList<>();
        private final List<String> finished = new ArrayList<>();
        private final Set<String> usedNames = new HashSet<>();
        private final Set<String> usedClasses = new HashSet<>(RESERVED_CLASSES);
        private final List<IoField> entryFields;
        private boolean usesLiteral;

        Generation(IrFlow ir) {
            this.ir = ir;
            List<IoField> inputs = ir.node(ir.startId()).payloadAs(NodePayload.StartPayload.class).inputs();
            this.entryFields = inputs.isEmpty() ? List.of(new IoField(DEFAULT_INPUT, "string")) : inputs;
            usedNames.addAll(PythonLiterals.KEYWORDS);
            usedNames.addAll(RESERVED_NAMES);
        }

        String render() {
            traverse();
            computePostDominators();
            for (String nodeId : discovered) {
                collect(ir.node(nodeId));
            }
            declareNames();

            List<String> records = renderRecords();
            List<String> stubs = renderToolStubs();
            List<String> agents = renderAgents();
            List<String> entry = renderEntry();

            List<String> lines = new ArrayList<>(renderPreamble());
            for (List<String> section : List.of(records, stubs, agents, entry)) {
                if (!section.isEmpty()) {
                    lines.add("");
                    lines.addAll(section);
                }
            }
            log.debug("Generated script for flow={} agents={} tools={} lines={}",
                    ir.name(), declarations.size(), serverTools.size() + approvalTools.size(), lines.size());
            return String.join("\n", lines) + "\n";
        }

        // graph analysis

        /**
         * Depth-first walk from the start node with an explicit stack. Records nodes in discovery order and in
         * finishing order, and rejects a control edge back into the current path.
         */
        private void traverse() {
            Set<String> onPath = new HashSet<>();
            Set<String> seen = new HashSet<>();
            Deque<Frame> stack = new ArrayDeque<>();
            String start = ir.startId();
            seen.add(start);
            onPath.add(start);
            discovered.add(start);
            stack.push(new Frame(start, ir.outgoing(start).iterator()));
            while (!stack.isEmpty()) {
                Frame top = stack.peek();
                if (!top.edges().hasNext()) {
                    stack.pop();
                    onPath.remove(top.node());
                    finished.add(top.node());
                    continue;
                }
                String target = top.edges().next().toId();
                if (onPath.contains(target)) {
                    throw new UnsupportedPatternException(FlowErrorCode.CFG_CYCLE,
                            "Control flow contains a cycle", Map.of("node", target));
                }
                if (seen.add(target)) {
                    onPath.add(target);
                    discovered.add(target);
                    stack.push(new Frame(target, ir.outgoing(target).iterator()));
                }
            }
        }

        /**
         * Immediate post-dominator of every reachable node. Successors finish before their predecessors in an
         * acyclic graph, so one pass in finishing order sees every successor settled.
         */
        private void computePostDominators() {
            for (int i = 0; i < finished.size(); i++) {
                String nodeId = finished.get(i);
                finishRank.put(nodeId, i);
                String dominator = null;
                for (IrControlEdge edge : ir.outgoing(nodeId)) {
                    dominator = dominator == null ? edge.toId() : commonPostDominator(dominator, edge.toId());
                }
                postDominators.put(nodeId, dominator == null ? EXIT : dominator);
            }
        }

        /** Walks both nodes up the post-dominator tree until they meet; the exit ranks below every node. */
        private String commonPostDominator(String first, String second) {
            String a = first;
            String b = second;
            while (!a.equals(b)) {
                if (rank(a) > rank(b)) {
                    a = postDominators.get(a);
                } else {
                    b = postDominators.get(b);
                }
            }
            return a;
        }

        private int rank(String nodeId) {
            return EXIT.equals(nodeId) ? -1 : finishRank.get(nodeId);
        }

        private void collect(IrNode node) {
            if (node.kind() == IrNodeKind.AGENT) {
                collectAgent(node);
            } else if (node.kind() == IrNodeKind.TOOL) {
                ToolDefinition tool = node.payloadAs(NodePayload.ToolPayload.class).tool();
                if (tool.kind() == ToolKind.CLIENT && approvalBranchOf(node) != null) {
                    approvalTools.putIfAbsent(tool.name(), tool);
                }
            }
        }

        private void collectAgent(IrNode node) {
            String yaml = node.payloadAs(NodePayload.AgentPayload.class).agentSpecYaml();
            if (yaml == null || yaml.isBlank()) {
                throw new UnsupportedPatternException(FlowErrorCode.AGENT_YAML_MISSING,
                        "Agent node '" + node.name() + "' lacks an agent snippet", Map.of("node", node.id()));
            }
            Agent agent = deserializer.readAgent(yaml);
            agentIdByNode.put(node.id(), agent.id());
            if (agentsById.putIfAbsent(agent.id(), agent) != null) {
                return;
            }
            String modelId = agent.llmConfig().modelId();
            if (modelId == null || modelId.isBlank()) {
                throw new UnsupportedPatternException(FlowErrorCode.MODEL_ID_MISSING,
                        "Agent '" + agent.name() + "' has no model id", Map.of("agent", agent.name()));
            }
            for (Tool tool : agent.tools()) {
                if (!(tool instanceof ServerTool serverTool)) {
                    log.warn("Agent {} tool {} runs client side and has no script counterpart, skipping it",
                            agent.name(), tool.name());
                    continue;
                }
                if (serverTool.outputs().size() > 1) {
                    throw new UnsupportedPatternException(FlowErrorCode.MULTI_OUTPUT_TOOL_UNSUPPORTED,
                            "Tool '" + serverTool.name() + "' declares more than one output",
                            Map.of("tool", serverTool.name()));
                }
                serverTools.putIfAbsent(serverTool.name(), serverTool);
            }
        }

        /** Tool functions claim their names before agent variables; result variables are claimed last. */
        private void declareNames() {
            for (String tool : serverTools.keySet()) {
                toolFunctions.put(tool, claim(Naming.snakeCase(tool)));
            }
            for (String tool : approvalTools.keySet()) {
                toolFunctions.putIfAbsent(tool, claim(Naming.snakeCase(tool)));
            }
            for (Agent agent : agentsById.values()) {
                String variable = claim(Naming.snakeCase(agent.name()));
                String schemaClass = agent.outputs().isEmpty() ? null : claimClass(Naming.schemaClassName(agent.name()));
                declarations.put(agent.id(), new AgentDeclaration(agent, variable, schemaClass));
            }
            for (AgentDeclaration declaration : declarations.values()) {
                usedNames.add(declaration.result());
                usedNames.add(declaration.result() + "_temp");
            }
        }

        private String claim(String base) {
            String candidate = base;
            int suffix = 2;
            while (!usedNames.add(candidate)) {
                candidate = base + "_" + suffix++;
            }
            return candidate;
        }

        private String claimClass(String base) {
            String candidate = base;
            int suffix = 2;
            while (!usedClasses.add(candidate)) {
                candidate = base + suffix++;
            }
            return candidate;
        }

        private AgentDeclaration declarationOf(String agentNode) {
            return declarations.get(agentIdByNode.get(agentNode));
        }

        /** The single unconditional successor, or null when the node has none. */
        private String next(IrNode node) {
            Set<String> successors = new LinkedHashSet<>();
            for (IrControlEdge edge : ir.outgoing(node.id())) {
                if (edge.isUnconditional()) {
                    successors.add(edge.toId());
                }
            }
            if (successors.size() > 1) {
                throw new UnsupportedPatternException(FlowErrorCode.MULTI_SUCCESSOR,
                        "Node '" + node.name() + "' has more than one unconditional successor",
                        Map.of("node", node.id(), "successors", List.copyOf(successors)));
            }
            return successors.isEmpty() ? null : successors.iterator().next();
        }

        /** The branch a client tool feeds with its result, or null. */
        private String approvalBranchOf(IrNode tool) {
            String successor = next(tool);
            if (successor == null || ir.node(successor).kind() != IrNodeKind.BRANCH) {
                return null;
            }
            boolean feeds = ir.dataEdgesInto(successor).stream().anyMatch(e -> e.sourceId().equals(tool.id()));
            return feeds ? successor : null;
        }

        /** Arm label to target; an unconditional edge out of a branch counts as its default arm. */
        private Map<String, String> armTargets(String branchId) {
            Map<String, String> targets = new LinkedHashMap<>();
            for (IrControlEdge edge : ir.outgoing(branchId)) {
                if (!edge.isUnconditional()) {
                    targets.putIfAbsent(edge.branch(), edge.toId());
                }
            }
            for (IrControlEdge edge : ir.outgoing(branchId)) {
                if (edge.isUnconditional()) {
                    targets.putIfAbsent(IrControlEdge.DEFAULT_BRANCH, edge.toId());
                }
            }
            return targets;
        }

        /** The nearest node every path out of the branch passes through; null when the arms never meet. */
        private String joinOf(String branchId) {
            String join = postDominators.get(branchId);
            return EXIT.equals(join) ? null : join;
        }

        private Set<String> reachableFrom(String nodeId) {
            Set<String> reached = new LinkedHashSet<>();
            Deque<String> pending = new ArrayDeque<>();
            pending.push(nodeId);
            while (!pending.isEmpty()) {
                String current = pending.pop();
                if (reached.add(current)) {
                    ir.outgoing(current).forEach(edge -> pending.push(edge.toId()));
                }
            }
            return reached;
        }

        /** Agent nodes whose results are read by a data edge at or after {@code nodeId}. */
        private Set<String> agentReadsFrom(String nodeId) {
            Set<String> reached = reachableFrom(nodeId);
            Set<String> sources = new LinkedHashSet<>();
            for (IrDataEdge edge : ir.dataEdges()) {
                if (reached.contains(edge.destId()) && ir.node(edge.sourceId()).kind() == IrNodeKind.AGENT) {
                    sources.add(edge.sourceId());
                }
            }
            return sources;
        }

        /**
         * True when something at or after {@code nodeId} uses the latest agent result before another agent
         * replaces it: an end node with nothing wired in, an approval gate, or a branch without a data edge.
         */
        private boolean readsLastResult(String nodeId) {
            Set<String> seen = new HashSet<>();
            Deque<String> pending = new ArrayDeque<>();
            pending.push(nodeId);
            while (!pending.isEmpty()) {
                IrNode node = ir.node(pending.pop());
                if (!seen.add(node.id()) || node.kind() == IrNodeKind.AGENT) {
                    continue;
                }
                boolean wired = !ir.dataEdgesInto(node.id()).isEmpty();
                if (node.kind() == IrNodeKind.END
                        && node.payloadAs(NodePayload.EndPayload.class).outputs().isEmpty() && !wired) {
                    return true;
                }
                if (node.kind() == IrNodeKind.TOOL && approvalBranchOf(node) != null) {
                    return true;
                }
                if (node.kind() == IrNodeKind.BRANCH) {
                    String key = node.payloadAs(NodePayload.BranchPayload.class).inputKey();
                    if (ir.dataEdgesInto(node.id()).stream().noneMatch(e -> e.destInput().equals(key))) {
                        return true;
                    }
                }
                ir.outgoing(node.id()).forEach(edge -> pending.push(edge.toId()));
            }
            return false;
        }

        // module sections

        private List<String> renderPreamble() {
            List<String> lines = new ArrayList<>();
            String agentsImport = "Agent, ModelSettings, TResponseInputItem, Runner, RunConfig, trace";
            lines.add("from agents import " + (serverTools.isEmpty() ? "" : "function_tool, ") + agentsImport);
            lines.add("from pydantic import BaseModel");
            lines.add("from typing import Any" + (usesLiteral ? ", Literal" : ""));
            lines.add("");
            lines.add("# Filled by run_workflow(tools=...) and read by the tool stubs below");
            lines.add("_TOOL_REGISTRY: dict[str, Any] = {}");
            return lines;
        }

        private List<String> renderRecords() {
            List<String> lines = new ArrayList<>();
            lines.add("class WorkflowInput(BaseModel):");
            for (IoField field : entryFields) {
                lines.add(INDENT + Naming.snakeCase(field.title()) + ": " + annotation(field.type(), field.enumValues()));
            }
            for (AgentDeclaration declaration : declarations.values()) {
                if (!declaration.structured()) {
                    continue;
                }
                lines.add("");
                lines.add("class " + declaration.schemaClass() + "(BaseModel):");
                for (Property property : declaration.agent().outputs()) {
                    lines.add(INDENT + Naming.snakeCase(property.title()) + ": "
                            + annotation(property.type(), property.enumValues()));
                }
            }
            return lines;
        }

        private List<String> renderToolStubs() {
            List<String> lines = new ArrayList<>();
            for (ServerTool tool : serverTools.values()) {
                List<Param> params = tool.inputs().stream()
                        .map(p -> new Param(Naming.snakeCase(p.title()), annotation(p.type(), List.of())))
                        .toList();
                String returns = tool.outputs().isEmpty() ? "None" : pythonType(tool.outputs().get(0).type());
                if (!lines.isEmpty()) {
                    lines.add("");
                }
                lines.add("@function_tool");
                lines.addAll(stub(tool.name(), params, returns));
            }
            for (ToolDefinition tool : approvalTools.values()) {
                List<Param> params = tool.inputs().stream()
                        .map(f -> new Param(Naming.snakeCase(f.title()), annotation(f.type(), List.of())))
                        .toList();
                if (!lines.isEmpty()) {
                    lines.add("");
                }
                lines.addAll(stub(tool.name(), params, "bool"));
            }
            return lines;
        }

        private List<String> stub(String toolName, List<Param> params, String returns) {
            String signature = String.join(", ", params.stream().map(p -> p.name() + ": " + p.annotation()).toList());
            String arguments = String.join(", ", params.stream().map(Param::name).toList());
            List<String> lines = new ArrayList<>();
            lines.add("def " + toolFunctions.get(toolName) + "(" + signature + ") -> " + returns + ":");
            lines.add(INDENT + "impl = _TOOL_REGISTRY.get(" + PythonLiterals.string(toolName) + ")");
            lines.add(INDENT + "if impl is None:");
            lines.add(INDENT + INDENT + "raise RuntimeError(" + PythonLiterals.string("Required tool not provided: " + toolName) + ")");
            lines.add(INDENT + "return impl(" + arguments + ")");
            return lines;
        }

        private List<String> renderAgents() {
            List<String> lines = new ArrayList<>();
            for (AgentDeclaration declaration : declarations.values()) {
                Agent agent = declaration.agent();
                if (!lines.isEmpty()) {
                    lines.add("");
                }
                lines.add(declaration.variable() + " = Agent(");
                lines.add(INDENT + "name=" + PythonLiterals.string(agent.name()) + ",");
                lines.add(INDENT + "instructions=" + PythonLiterals.text(agent.systemPrompt()) + ",");
                lines.add(INDENT + "model=" + PythonLiterals.string(agent.llmConfig().modelId()) + ",");
                List<String> tools = agent.tools().stream()
                        .filter(t -> t instanceof ServerTool)
                        .map(t -> toolFunctions.get(t.name()))
                        .toList();
                if (!tools.isEmpty()) {
                    lines.add(INDENT + "tools=[");
                    tools.forEach(t -> lines.add(INDENT + INDENT + t + ","));
                    lines.add(INDENT + "],");
                }
                if (declaration.structured()) {
                    lines.add(INDENT + "output_type=" + declaration.schemaClass() + ",");
                }
                GenerationParameters generation = agent.llmConfig().defaultGenerationParameters();
                if (generation != null && !generation.isEmpty()) {
                    lines.add(INDENT + "model_settings=ModelSettings(");
                    if (generation.temperature() != null) {
                        lines.add(INDENT + INDENT + "temperature=" + PythonLiterals.literal(generation.temperature()) + ",");
                    }
                    if (generation.topP() != null) {
                        lines.add(INDENT + INDENT + "top_p=" + PythonLiterals.literal(generation.topP()) + ",");
                    }
                    if (generation.maxTokens() != null) {
                        lines.add(INDENT + INDENT + "max_tokens=" + generation.maxTokens() + ",");
                    }
                    lines.add(INDENT + "),");
                }
                lines.add(")");
            }
            return lines;
        }

        private List<String> renderEntry() {
            String body = INDENT + INDENT;
            List<String> lines = new ArrayList<>();
            lines.add("# Main code entrypoint");
            lines.add("async def run_workflow(workflow_input: WorkflowInput, tools: dict | None = None):");
            lines.add(INDENT + "_TOOL_REGISTRY.clear()");
            lines.add(INDENT + "_TOOL_REGISTRY.update(tools or {})");
            lines.add(INDENT + "with trace(" + PythonLiterals.string(ir.name()) + "):");
            lines.add(body + "workflow = workflow_input.model_dump()");
            lines.add(body + "conversation_history: list[TResponseInputItem] = [");
            lines.add(body + INDENT + "{");
            lines.add(body + INDENT + INDENT + "\"role\": \"user\",");
            lines.add(body + INDENT + INDENT + "\"content\": [");
            lines.add(body + INDENT + INDENT + INDENT + "{");
            lines.add(body + INDENT + INDENT + INDENT + INDENT + "\"type\": \"input_text\",");
            lines.add(body + INDENT + INDENT + INDENT + INDENT + "\"text\": " + workflowRead(entryFields.get(0).title()));
            lines.add(body + INDENT + INDENT + INDENT + "}");
            lines.add(body + INDENT + INDENT + "]");
            lines.add(body + INDENT + "}");
            lines.add(body + "]");
            emit(ir.startId(), null, PathState.INITIAL, body, lines);
            return lines;
        }

        // entry body walk

        /**
         * Emits the walk from {@code nodeId} until it reaches {@code stop}. Returns the state on arrival at
         * {@code stop}, or null when every path returned first. Straight runs are walked in a loop; only
         * branch arms nest.
         */
        private PathState emit(String nodeId, String stop, PathState state, String indent, List<String> out) {
            String current = nodeId;
            PathState path = state;
            while (current != null) {
                if (current.equals(stop)) {
                    return path;
                }
                IrNode node = ir.node(current);
                Step step = switch (node.kind()) {
                    case START -> new Step(path, next(node));
                    case AGENT -> emitAgent(node, path, indent, out);
                    case BRANCH -> emitLadder(node, path, indent, out);
                    case TOOL -> emitApprovalGate(node, path, indent, out);
                    case END -> {
                        emitEnd(node, path, indent, out);
                        yield null;
                    }
                    default -> throw new UnsupportedPatternException(FlowErrorCode.UNSUPPORTED_CODEGEN_NODE,
                            "Node kind " + node.kind().wireName() + " has no script counterpart",
                            Map.of("node", node.id(), "kind", node.kind().wireName()));
                };
                if (step == null) {
                    return null;
                }
                path = step.state();
                current = step.next();
            }
            out.add(indent + "return " + Objects.requireNonNullElse(path.lastResult(), "{}"));
            return null;
        }

        private Step emitAgent(IrNode node, PathState state, String indent, List<String> out) {
            AgentDeclaration declaration = declarationOf(node.id());
            String variable = declaration.variable();
            String temp = declaration.result() + "_temp";
            out.add(indent + temp + " = await Runner.run(");
            out.add(indent + INDENT + variable + ",");
            out.add(indent + INDENT + "input=[");
            out.add(indent + INDENT + INDENT + "*conversation_history");
            out.add(indent + INDENT + "],");
            out.add(indent + INDENT + "run_config=RunConfig(trace_metadata={");
            out.add(indent + INDENT + INDENT + "\"__trace_source__\": \"agent-builder\",");
            out.add(indent + INDENT + INDENT + "\"workflow_id\": \"wf_auto_generated\"");
            out.add(indent + INDENT + "})");
            out.add(indent + ")");
            out.add(indent + "conversation_history.extend([item.to_input_item() for item in " + temp + ".new_items])");
            out.add(indent + declaration.result() + " = {");
            if (declaration.structured()) {
                out.add(indent + INDENT + "\"output_text\": " + temp + ".final_output.model_dump_json(),");
                out.add(indent + INDENT + "\"output_parsed\": " + temp + ".final_output.model_dump()");
            } else {
                out.add(indent + INDENT + "\"output_text\": " + temp + ".final_output_as(str)");
            }
            out.add(indent + "}");
            return new Step(state.ran(node.id(), declaration.result()), next(node));
        }

        private Step emitLadder(IrNode node, PathState state, String indent, List<String> out) {
            NodePayload.BranchPayload branch = node.payloadAs(NodePayload.BranchPayload.class);
            if (branch.inputKey() == null || branch.inputKey().isBlank()) {
                throw new UnsupportedPatternException(FlowErrorCode.BRANCH_INPUT_KEY_MISSING,
                        "Branch '" + node.name() + "' has no input key", Map.of("node", node.id()));
            }
            String subject = branchSubject(node, branch.inputKey(), state);
            Map<String, String> targets = armTargets(node.id());
            String fallback = targets.get(IrControlEdge.DEFAULT_BRANCH);
            if (branch.mapping().isEmpty()) {
                if (fallback == null) {
                    out.add(indent + "return {}");
                    return null;
                }
                return new Step(state, fallback);
            }

            List<Arm> arms = new ArrayList<>();
            String keyword = "if ";
            for (String literal : new TreeSet<>(branch.mapping().keySet())) {
                arms.add(new Arm(keyword + subject + " == " + PythonLiterals.string(literal) + ":",
                        targets.get(branch.mapping().get(literal))));
                keyword = "elif ";
            }
            arms.add(new Arm("else:", fallback));
            return emitArms(arms, joinOf(node.id()), state, indent, out);
        }

        private Step emitApprovalGate(IrNode node, PathState state, String indent, List<String> out) {
            ToolDefinition tool = node.payloadAs(NodePayload.ToolPayload.class).tool();
            String branchId = tool.kind() == ToolKind.CLIENT ? approvalBranchOf(node) : null;
            if (branchId == null) {
                throw new UnsupportedPatternException(FlowErrorCode.UNSUPPORTED_CODEGEN_NODE,
                        "Tool node '" + node.name() + "' does not gate a branch and has no script counterpart",
                        Map.of("node", node.id(), "kind", node.kind().wireName()));
            }
            String argument;
            if (state.lastResult() == null) {
                argument = workflowRead(entryFields.get(0).title());
            } else if (state.shared()) {
                argument = state.lastResult() + ".get(\"output_text\", \"\")";
            } else {
                argument = state.lastResult() + "[\"output_text\"]";
            }
            Map<String, String> targets = armTargets(branchId);
            String rejected = targets.containsKey("false") ? targets.get("false") : targets.get(IrControlEdge.DEFAULT_BRANCH);
            List<Arm> arms = List.of(
                    new Arm("if " + toolFunctions.get(tool.name()) + "(" + argument + "):", targets.get("true")),
                    new Arm("else:", rejected));
            return emitArms(arms, joinOf(branchId), state, indent, out);
        }

        /**
         * Emits an if ladder whose arms stop at {@code join}. An else arm that goes straight to the join is left
         * out. When the arms leave different latest results and the join needs one, a shared variable holds it.
         */
        private Step emitArms(List<Arm> arms, String join, PathState state, String indent, List<String> out) {
            int ladderStart = out.size();
            List<ArmExit> exits = new ArrayList<>();
            for (Arm arm : arms) {
                if (arm.isElse() && arm.target() != null && arm.target().equals(join)) {
                    exits.add(new ArmExit(state, -1, indent));
                    continue;
                }
                out.add(indent + arm.header());
                String body = indent + INDENT;
                if (arm.target() == null) {
                    out.add(body + "return {}");
                    continue;
                }
                int before = out.size();
                PathState arrived = emit(arm.target(), join, state, body, out);
                if (arrived != null) {
                    exits.add(new ArmExit(arrived, out.size(), body));
                }
                if (out.size() == before) {
                    out.add(body + "pass");
                }
            }
            if (join == null || exits.isEmpty()) {
                return null;
            }
            return new Step(merge(exits, join, state, ladderStart, indent, out), join);
        }

        /**
         * The state at a join. Agents some arms ran get a placeholder result before the ladder when the join
         * reads them, so the read is defined on every path.
         */
        private PathState merge(List<ArmExit> exits, String join, PathState before, int ladderStart,
                                String indent, List<String> out) {
            Set<String> executed = new HashSet<>();
            Set<String> everyArm = new HashSet<>(exits.get(0).state().executed());
            Set<String> lastAgents = new LinkedHashSet<>();
            Set<String> lastResults = new LinkedHashSet<>();
            boolean shared = false;
            for (ArmExit exit : exits) {
                executed.addAll(exit.state().executed());
                everyArm.retainAll(exit.state().executed());
                lastAgents.addAll(exit.state().lastAgents());
                lastResults.add(exit.state().lastResult());
                shared |= exit.state().shared();
            }

            Set<String> preamble = new LinkedHashSet<>();
            for (String source : agentReadsFrom(join)) {
                if (executed.contains(source) && !everyArm.contains(source)) {
                    AgentDeclaration declaration = declarationOf(source);
                    preamble.add(indent + declaration.result() + " = " + placeholder(declaration));
                }
            }

            String lastResult;
            if (lastResults.size() == 1) {
                lastResult = lastResults.iterator().next();
            } else if (readsLastResult(join)) {
                lastResult = claim("last_result");
                shared = true;
                preamble.add(indent + lastResult + " = " + Objects.requireNonNullElse(before.lastResult(), "{}"));
                for (int i = exits.size() - 1; i >= 0; i--) {
                    ArmExit exit = exits.get(i);
                    if (exit.position() >= 0 && !Objects.equals(exit.state().lastResult(), before.lastResult())) {
                        out.add(exit.position(), exit.indent() + lastResult + " = "
                                + Objects.requireNonNullElse(exit.state().lastResult(), "{}"));
                    }
                }
            } else {
                lastResult = null;
                lastAgents.clear();
                shared = false;
            }
            out.addAll(ladderStart, preamble);
            return new PathState(lastResult, Set.copyOf(lastAgents), shared, Set.copyOf(executed));
        }

        /** The result an agent that did not run on this path stands in with: empty text and typed defaults. */
        private String placeholder(AgentDeclaration declaration) {
            if (!declaration.structured()) {
                return "{\"output_text\": \"\"}";
            }
            List<String> fields = declaration.agent().outputs().stream()
                    .map(p -> PythonLiterals.string(Naming.snakeCase(p.title())) + ": " + defaultOf(p.type()))
                    .toList();
            return "{\"output_text\": \"\", \"output_parsed\": {" + String.join(", ", fields) + "}}";
        }

        private void emitEnd(IrNode node, PathState state, String indent, List<String> out) {
            List<IoField> outputs = node.payloadAs(NodePayload.EndPayload.class).outputs();
            Map<String, IrDataEdge> edges = new LinkedHashMap<>();
            for (IrDataEdge edge : ir.dataEdgesInto(node.id())) {
                if (edges.putIfAbsent(edge.destInput(), edge) != null) {
                    throw new UnsupportedPatternException(FlowErrorCode.AMBIGUOUS_END_INPUT,
                            "End input '" + edge.destInput() + "' is fed by more than one data edge",
                            Map.of("node", node.id(), "input", edge.destInput()));
                }
            }
            if (outputs.isEmpty() && edges.isEmpty()) {
                out.add(indent + "return " + Objects.requireNonNullElse(state.lastResult(), "{}"));
                return;
            }

            List<String> entries = new ArrayList<>();
            Set<String> written = new HashSet<>();
            for (IoField output : outputs) {
                IrDataEdge edge = edges.get(output.title());
                String value = edge != null
                        ? sourceValue(edge.sourceId(), edge.sourceOutput(), node, state)
                        : "workflow.get(" + PythonLiterals.string(Naming.snakeCase(output.title())) + ", " + defaultOf(output.type()) + ")";
                entries.add(PythonLiterals.string(output.title()) + ": " + value);
                written.add(output.title());
            }
            for (IrDataEdge edge : edges.values()) {
                if (written.add(edge.destInput())) {
                    entries.add(PythonLiterals.string(edge.destInput()) + ": "
                            + sourceValue(edge.sourceId(), edge.sourceOutput(), node, state));
                }
            }
            out.add(indent + "return {");
            for (int i = 0; i < entries.size(); i++) {
                out.add(indent + INDENT + entries.get(i) + (i < entries.size() - 1 ? "," : ""));
            }
            out.add(indent + "}");
        }

        private String branchSubject(IrNode branch, String inputKey, PathState state) {
            IrDataEdge edge = ir.dataEdgesInto(branch.id()).stream()
                    .filter(e -> e.destInput().equals(inputKey))
                    .findFirst()
                    .orElse(null);
            if (edge != null) {
                return sourceValue(edge.sourceId(), edge.sourceOutput(), branch, state);
            }
            if (state.lastResult() != null) {
                boolean structured = !state.lastAgents().isEmpty()
                        && state.lastAgents().stream().allMatch(agent -> declarationOf(agent).structured());
                return structured && !OUTPUT_TEXT.equals(inputKey)
                        ? state.lastResult() + "[\"output_parsed\"][" + PythonLiterals.string(inputKey) + "]"
                        : state.lastResult() + "[\"output_text\"]";
            }
            return workflowRead(inputKey);
        }

        /** The expression reading {@code field} of the source node, valid at the current point of the path. */
        private String sourceValue(String sourceId, String field, IrNode consumer, PathState state) {
            IrNode source = ir.node(sourceId);
            if (source.kind() == IrNodeKind.START) {
                return workflowRead(field);
            }
            if (source.kind() != IrNodeKind.AGENT) {
                throw new UnsupportedPatternException(FlowErrorCode.UNSUPPORTED_END_SOURCE,
                        "Values can only be read from the start node or an agent",
                        Map.of("node", consumer.id(), "source", sourceId, "kind", source.kind().wireName()));
            }
            if (!state.executed().contains(sourceId)) {
                throw new UnsupportedPatternException(FlowErrorCode.END_SOURCE_NOT_ON_PATH,
                        "Agent '" + source.name() + "' runs on no path into '" + consumer.name() + "'",
                        Map.of("node", consumer.id(), "source", sourceId));
            }
            AgentDeclaration declaration = declarationOf(sourceId);
            if (declaration.structured()) {
                return OUTPUT_TEXT.equals(field)
                        ? declaration.result() + "[\"output_text\"]"
                        : declaration.result() + "[\"output_parsed\"][" + PythonLiterals.string(field) + "]";
            }
            if (!UNSTRUCTURED_FIELDS.contains(field)) {
                throw new UnsupportedPatternException(FlowErrorCode.UNSTRUCTURED_SOURCE_FIELD,
                        "Agent '" + source.name() + "' has no structured output; only output_text can be read",
                        Map.of("node", consumer.id(), "source", sourceId, "field", field));
            }
            return declaration.result() + "[\"output_text\"]";
        }

        private String workflowRead(String field) {
            return "workflow[" + PythonLiterals.string(Naming.snakeCase(field)) + "]";
        }

        private String annotation(String type, List<Object> enumValues) {
            if (enumValues != null && !enumValues.isEmpty()) {
                usesLiteral = true;
                return "Literal[" + PythonLiterals.literalList(enumValues) + "]";
            }
            return pythonType(type);
        }
    }


    private record Param(String name, String annotation) {
    }

    static String pythonType(String schemaType) {
        if (schemaType == null) {
            return "str";
        }
        return switch (schemaType) {
            case "integer" -> "int";
            case "number" -> "float";
            case "boolean" -> "bool";
            case "array" -> "list[str]";
            case "object" -> "dict";
            default -> "str";
        };
    }

    static String defaultOf(String schemaType) {
        if (schemaType == null) {
            return "None";
        }
        return switch (schemaType) {
            case "string" -> "\"\"";
            case "integer" -> "0";
            case "number" -> "0.0";
            case "boolean" -> "False";
            case "array" -> "[]";
            case "object" -> "{}";
            default -> "None";
        };
    }
}
