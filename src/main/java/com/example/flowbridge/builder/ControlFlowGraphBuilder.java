package com.example.flowbridge.builder;

import com.example.flowbridge.errors.FlowErrorCode;
import com.example.flowbridge.errors.UnsupportedPatternException;
import com.example.flowbridge.ir.IoField;
import com.example.flowbridge.ir.IrControlEdge;
import com.example.flowbridge.ir.IrDataEdge;
import com.example.flowbridge.ir.IrFlow;
import com.example.flowbridge.ir.IrNode;
import com.example.flowbridge.ir.NodePayload;
import com.example.flowbridge.ir.ToolDefinition;
import com.example.flowbridge.ir.ToolKind;
import com.example.flowbridge.scan.AgentDefinition;
import com.example.flowbridge.scan.FieldSchema;
import com.example.flowbridge.scan.ScanFacts;
import com.example.flowbridge.scan.ScriptExpressions;
import com.example.flowbridge.script.Expr;
import com.example.flowbridge.script.Stmt;
import com.example.flowbridge.validation.IrFlowValidator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the IR graph of a scanned workflow script.
 * <p>
 * The entry body is walked statement by statement over a list of open {@link Tail}s. Delegate calls become
 * agent nodes, literal ladders and approval gates become branch nodes whose arms are built recursively,
 * and returns close the current path with an end node. Tails still open after the body are wired into a
 * synthesized end node. The result is validated before it is returned.
 * </p>
 */
@Slf4j
public class ControlFlowGraphBuilder {

    static final String APPROVAL_INPUT = "approval";

    private final AgentSnippetFactory snippets;

    public ControlFlowGraphBuilder(AgentSnippetFactory snippets) {
        this.snippets = Objects.requireNonNull(snippets, "snippets");
    }

    public IrFlow build(ScanFacts facts, boolean strict) {
        IrFlow flow = new Construction(facts, strict).run();
        IrFlowValidator.validate(flow);
        log.debug("Built flow name={} nodes={} controlEdges={} dataEdges={}",
                flow.name(), flow.nodes().size(), flow.controlEdges().size(), flow.dataEdges().size());
        return flow;
    }

    /** State of one build: the id counter and the growing node and edge lists. */
    private final class Construction {

        private final ScanFacts facts;
        private final boolean strict;
        private final List<IrNode> nodes = new ArrayList<>();
        private final List<IrControlEdge> controlEdges = new ArrayList<>();
        private final List<IrDataEdge> dataEdges = new ArrayList<>();
        private final Map<String, String> resultVariables = new HashMap<>();
        private final Map<String, AgentDefinition> agentsByNode = new HashMap<>();
        private int counter;
        private String startId;

        Construction(ScanFacts facts, boolean strict) {
            this.facts = facts;
            this.strict = strict;
        }

        IrFlow run() {
            startId = nextId();
            List<IoField> io = facts.workflowInput().entrySet().stream()
                    .map(e -> e.getValue().toIoField(e.getKey()))
                    .toList();
            nodes.add(new IrNode(startId, "Start", new NodePayload.StartPayload(io, io)));

            List<Tail> open = buildBlock(facts.entryBody(), List.of(Tail.of(startId, null)));
            if (!open.isEmpty()) {
                String endId = nextId();
                nodes.add(new IrNode(endId, "End", new NodePayload.EndPayload(List.of())));
                connect(open, endId);
            }
            return new IrFlow(facts.flowName(), startId, nodes, controlEdges, dataEdges);
        }

        private String nextId() {
            counter++;
            return "node_" + counter;
        }

        private List<Tail> buildBlock(List<Stmt> block, List<Tail> tails) {
            List<Tail> current = tails;
            for (int i = 0; i < block.size(); i++) {
                if (current.isEmpty()) {
                    log.debug("Ignoring {} unreachable statement(s) from line {}", block.size() - i, block.get(i).line());
                    break;
                }
                StatementShape shape = StatementShape.classify(block.get(i));
                if (shape instanceof StatementShape.SequentialCall call) {
                    current = sequentialCall(call, block, i, current);
                } else if (shape instanceof StatementShape.LiteralLadder ladder) {
                    current = literalLadder(ladder.statement(), current);
                } else if (shape instanceof StatementShape.ApprovalGate gate) {
                    current = approvalGate(gate, current);
                } else if (shape instanceof StatementShape.Return ret) {
                    returnStatement(ret.statement(), current);
                    current = List.of();
                } else {
                    trackAliases(block.get(i));
                }
            }
            return current;
        }

        private List<Tail> sequentialCall(StatementShape.SequentialCall shape, List<Stmt> block, int index, List<Tail> tails) {
            Expr.Call call = shape.call();
            String agentVariable = agentVariable(call);
            if (agentVariable == null) {
                throw new UnsupportedPatternException(FlowErrorCode.RUNNER_RUN_NO_AGENT,
                        "Runner.run missing agent variable", Map.of("line", shape.statement().line()));
            }
            if (!ConversationChecks.usesConversationHistory(call)) {
                strictOrWarn(FlowErrorCode.CONVERSATION_INPUT_MISSING,
                        "Runner.run must include conversation_history in its input",
                        Map.of("agent", agentVariable, "line", shape.statement().line()));
            }
            if (!ConversationChecks.propagatesHistory(block, index + 1, shape.resultVariable())) {
                strictOrWarn(FlowErrorCode.CONVERSATION_PROPAGATION_REQUIRED,
                        "Conversation history must be extended with '" + shape.resultVariable() + ".new_items' before the next step",
                        Map.of("result_var", shape.resultVariable(), "line", shape.statement().line()));
            }
            AgentDefinition definition = facts.agents().get(agentVariable);
            if (definition == null) {
                throw new UnsupportedPatternException(FlowErrorCode.UNKNOWN_AGENT,
                        "Runner.run references an agent that is not defined at module level",
                        Map.of("agent", agentVariable));
            }
            String id = nextId();
            nodes.add(new IrNode(id, definition.displayName(),
                    new NodePayload.AgentPayload(snippets.snippetOf(definition, facts, strict))));
            agentsByNode.put(id, definition);
            connect(tails, id);
            resultVariables.put(shape.resultVariable(), id);
            return List.of(Tail.of(id, id));
        }

        private List<Tail> literalLadder(Stmt.If statement, List<Tail> tails) {
            Expr lhs = BranchLiterals.equalityOperand(statement.test());
            Map<String, List<Stmt>> arms = new LinkedHashMap<>();
            List<Stmt> elseBody = null;
            Stmt.If current = statement;
            while (current != null) {
                String literal = BranchLiterals.equalityLiteral(current.test());
                if (literal == null || !lhs.equals(BranchLiterals.equalityOperand(current.test()))) {
                    throw new UnsupportedPatternException(FlowErrorCode.UNSUPPORTED_BRANCH_CONDITION,
                            "Every arm of an if/elif ladder must compare the same expression against a literal",
                            Map.of("line", current.line()));
                }
                if (arms.containsKey(literal)) {
                    throw new UnsupportedPatternException(FlowErrorCode.DUPLICATE_BRANCH_LITERAL,
                            "Duplicate literal in if/elif ladder", Map.of("literal", literal));
                }
                arms.put(literal, current.body());
                Stmt.If next = current.elifClause();
                if (next == null && !current.orElse().isEmpty()) {
                    elseBody = current.orElse();
                }
                current = next;
            }

            String lastAgent = lastAgentOf(tails);
            String inputKey = null;
            String sourceId = null;
            ResultRead read = ResultRead.of(lhs);
            if (read != null) {
                inputKey = read.field();
                sourceId = sourceOf(read.variable());
                if (sourceId == null) {
                    sourceId = lastAgent;
                }
            } else if (lastAgent != null && !isAmbiguous(tails)) {
                Map<String, FieldSchema> fields = facts.outputFieldsOf(agentsByNode.get(lastAgent));
                if (fields.size() == 1) {
                    inputKey = fields.keySet().iterator().next();
                    sourceId = lastAgent;
                }
            }
            if (inputKey == null || sourceId == null) {
                strictOrWarn(FlowErrorCode.BRANCH_INPUT_KEY_UNDETECTABLE,
                        "Unable to determine the branch input. Compare a structured output field, e.g. result[\"output_parsed\"][\"field\"] == \"value\"",
                        Map.of("line", statement.line()));
            }

            Map<String, String> mapping = new LinkedHashMap<>();
            arms.keySet().forEach(literal -> mapping.put(literal, literal));
            String branchId = nextId();
            nodes.add(new IrNode(branchId, "Branch", new NodePayload.BranchPayload(mapping, inputKey)));
            connect(tails, branchId);
            if (inputKey != null && sourceId != null) {
                dataEdges.add(new IrDataEdge(sourceId, inputKey, branchId, inputKey));
            }

            List<Tail> open = new ArrayList<>();
            for (Map.Entry<String, List<Stmt>> arm : arms.entrySet()) {
                open.addAll(buildBlock(arm.getValue(), List.of(Tail.labelled(branchId, lastAgent, arm.getKey()))));
            }
            Tail defaultSeed = Tail.labelled(branchId, lastAgent, IrControlEdge.DEFAULT_BRANCH);
            open.addAll(elseBody != null ? buildBlock(elseBody, List.of(defaultSeed)) : List.of(defaultSeed));
            return open;
        }

        private List<Tail> approvalGate(StatementShape.ApprovalGate gate, List<Tail> tails) {
            String toolId = nextId();
            ToolDefinition tool = new ToolDefinition(gate.toolName(), ToolKind.CLIENT,
                    List.of(new IoField("message", "string")), List.of(new IoField("result", "boolean")));
            nodes.add(new IrNode(toolId, gate.toolName(), new NodePayload.ToolPayload(tool)));
            connect(tails, toolId);

            String lastAgent = isAmbiguous(tails) ? null : lastAgentOf(tails);
            String branchId = nextId();
            Map<String, String> mapping = new LinkedHashMap<>();
            mapping.put("true", "true");
            mapping.put("false", "false");
            nodes.add(new IrNode(branchId, "Approval", new NodePayload.BranchPayload(mapping, APPROVAL_INPUT)));
            controlEdges.add(new IrControlEdge(toolId, branchId));
            dataEdges.add(new IrDataEdge(toolId, "result", branchId, APPROVAL_INPUT));

            List<Tail> open = new ArrayList<>(
                    buildBlock(gate.statement().body(), List.of(Tail.labelled(branchId, lastAgent, "true"))));
            Tail rejected = Tail.labelled(branchId, lastAgent, "false");
            List<Stmt> orElse = gate.statement().orElse();
            open.addAll(orElse.isEmpty() ? List.of(rejected) : buildBlock(orElse, List.of(rejected)));
            return open;
        }

        private void returnStatement(Stmt.Return statement, List<Tail> tails) {
            String endId = nextId();
            Map<String, IoField> outputs = new LinkedHashMap<>();
            Map<String, IrDataEdge> edges = new LinkedHashMap<>();
            if (statement.value() instanceof Expr.DictExpr dict) {
                for (Expr.DictEntry entry : dict.entries()) {
                    String key = entry.key() != null ? ScriptExpressions.constString(entry.key()) : null;
                    if (key == null) {
                        continue;
                    }
                    Object literal = ScriptExpressions.literalValue(entry.value());
                    if (literal != null) {
                        outputs.put(key, new IoField(key, ScriptExpressions.schemaTypeOf(literal)));
                        edges.remove(key);
                        continue;
                    }
                    IoField fallback = entryFallback(key, entry.value());
                    if (fallback != null) {
                        outputs.put(key, fallback);
                        edges.remove(key);
                        continue;
                    }
                    ResultRead read = ResultRead.of(entry.value());
                    String sourceId = read != null ? sourceOf(read.variable()) : null;
                    if (sourceId == null) {
                        log.debug("Return entry {} at line {} has no typed source, leaving it out", key, statement.line());
                        continue;
                    }
                    outputs.put(key, fieldOf(sourceId, read.field()).toIoField(key));
                    edges.put(key, new IrDataEdge(sourceId, read.field(), endId, key));
                }
            }
            nodes.add(new IrNode(endId, "End", new NodePayload.EndPayload(List.copyOf(outputs.values()))));
            dataEdges.addAll(edges.values());
            connect(tails, endId);
        }

        /** {@code workflow.get("k", default)}: an output typed by its default, fed by no edge. */
        private IoField entryFallback(String key, Expr value) {
            if (!(value instanceof Expr.Call call) || !(call.func() instanceof Expr.Attribute attribute)
                    || !"get".equals(attribute.attr()) || !(attribute.value() instanceof Expr.Name owner)
                    || !"workflow".equals(owner.id()) || call.args().isEmpty()) {
                return null;
            }
            Expr defaultValue = call.args().size() > 1 ? call.args().get(1) : null;
            Object literal = defaultValue != null ? ScriptExpressions.literalValue(defaultValue) : null;
            if (literal != null) {
                return new IoField(key, ScriptExpressions.schemaTypeOf(literal));
            }
            if (defaultValue instanceof Expr.ListExpr) {
                return new IoField(key, "array");
            }
            if (defaultValue instanceof Expr.DictExpr) {
                return new IoField(key, "object");
            }
            String field = ScriptExpressions.constString(call.args().get(0));
            FieldSchema schema = field != null ? facts.workflowInput().get(field) : null;
            return schema != null ? schema.toIoField(key) : new IoField(key, "string");
        }

        /** Variables assigned from expressions that read an agent result also name that result. */
        private void trackAliases(Stmt stmt) {
            List<Expr> targets;
            Expr value;
            if (stmt instanceof Stmt.Assign assign) {
                targets = assign.targets();
                value = assign.value();
            } else if (stmt instanceof Stmt.AnnAssign annAssign && annAssign.value() != null) {
                targets = List.of(annAssign.target());
                value = annAssign.value();
            } else {
                return;
            }
            String aliased = NameCollector.namesIn(value).stream()
                    .filter(resultVariables::containsKey)
                    .map(resultVariables::get)
                    .findFirst()
                    .orElse(null);
            for (Expr target : targets) {
                if (target instanceof Expr.Name name) {
                    if (aliased != null) {
                        resultVariables.put(name.id(), aliased);
                    } else {
                        resultVariables.remove(name.id());
                    }
                }
            }
        }

        private String sourceOf(String variable) {
            if ("workflow".equals(variable) || "workflow_input".equals(variable)) {
                return startId;
            }
            return resultVariables.get(variable);
        }

        private FieldSchema fieldOf(String sourceId, String field) {
            if (sourceId.equals(startId)) {
                return facts.workflowInput().getOrDefault(field, FieldSchema.of("string"));
            }
            AgentDefinition definition = agentsByNode.get(sourceId);
            if (definition == null || ResultRead.OUTPUT_TEXT.equals(field)) {
                return FieldSchema.of("string");
            }
            return facts.outputFieldsOf(definition).getOrDefault(field, FieldSchema.of("string"));
        }

        private void connect(List<Tail> tails, String targetId) {
            for (Tail tail : tails) {
                IrControlEdge edge = new IrControlEdge(tail.nodeId(), targetId, tail.pendingBranchLabel());
                if (!controlEdges.contains(edge)) {
                    controlEdges.add(edge);
                }
            }
        }

        private void strictOrWarn(FlowErrorCode code, String message, Map<String, ?> details) {
            if (strict) {
                throw new UnsupportedPatternException(code, message, details);
            }
            log.warn("Lenient build continues past {}: {} details={}", code, message, details);
        }
    }

    private static String agentVariable(Expr.Call call) {
        Expr agent = !call.args().isEmpty() ? call.args().get(0) : call.keyword("starting_agent");
        return agent instanceof Expr.Name name ? name.id() : null;
    }

    /** The most recent agent on the incoming tails, when they agree on one. */
    private static String lastAgentOf(List<Tail> tails) {
        Set<String> agents = distinctAgents(tails);
        return agents.size() == 1 ? agents.iterator().next() : null;
    }

    private static boolean isAmbiguous(List<Tail> tails) {
        return distinctAgents(tails).size() > 1;
    }

    private static Set<String> distinctAgents(List<Tail> tails) {
        Set<String> agents = new LinkedHashSet<>();
        for (Tail tail : tails) {
            if (tail.lastAgentId() != null) {
                agents.add(tail.lastAgentId());
            }
        }
        return agents;
    }
}
