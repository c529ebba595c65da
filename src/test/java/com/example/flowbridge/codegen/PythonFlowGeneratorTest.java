package com.example.flowbridge.codegen;

import com.example.flowbridge.TestScripts;
import com.example.flowbridge.agentspec.Agent;
import com.example.flowbridge.agentspec.AgentSpecDeserializer;
import com.example.flowbridge.agentspec.AgentSpecSerializer;
import com.example.flowbridge.agentspec.GenerationParameters;
import com.example.flowbridge.agentspec.OpenAiConfig;
import com.example.flowbridge.agentspec.Property;
import com.example.flowbridge.agentspec.ServerTool;
import com.example.flowbridge.agentspec.Tool;
import com.example.flowbridge.builder.AgentSnippetFactory;
import com.example.flowbridge.builder.ControlFlowGraphBuilder;
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
import com.example.flowbridge.naming.Naming;
import com.example.flowbridge.scan.ModuleScanner;
import com.example.flowbridge.validation.IrFlowValidationException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("PythonFlowGenerator")
class PythonFlowGeneratorTest {

    private final AgentSpecSerializer serializer = new AgentSpecSerializer();
    private final AgentSpecDeserializer deserializer = new AgentSpecDeserializer();
    private final ControlFlowGraphBuilder builder = new ControlFlowGraphBuilder(new AgentSnippetFactory(serializer));
    private final PythonFlowGenerator generator = new PythonFlowGenerator(deserializer);

    private IrFlow parse(String source) {
        return builder.build(new ModuleScanner(true).scan(source), true);
    }

    private String agentYaml(String name, List<Property> outputs, List<Tool> tools) {
        Agent agent = new Agent(Naming.stableId("agent:" + name), name, null,
                new OpenAiConfig(Naming.stableId("llm:" + name), "gpt-4o-mini", "gpt-4o-mini", GenerationParameters.NONE),
                "Act as " + name + ".", tools, List.of(), outputs);
        return serializer.toYaml(agent);
    }

    private IrNode agentNode(String id, String name, List<Property> outputs) {
        return new IrNode(id, name, new NodePayload.AgentPayload(agentYaml(name, outputs, List.of())));
    }

    private static IrNode start() {
        List<IoField> io = List.of(new IoField("input_as_text", "string"));
        return new IrNode("start", "Start", new NodePayload.StartPayload(io, io));
    }

    private static IrNode end(String id, IoField... outputs) {
        return new IrNode(id, "End", new NodePayload.EndPayload(List.of(outputs)));
    }

    private static UnsupportedPatternException rejected(Runnable generation) {
        return assertThrows(UnsupportedPatternException.class, generation::run);
    }

    @Nested
    @DisplayName("round trip")
    class RoundTrip {

        @ParameterizedTest(name = "{0}")
        @ValueSource(strings = {
                "flows/linear_chain_three_agents.py",
                "flows/simple_agent_no_tools.py",
                "flows/single_agent_three_tools_math.py",
                "flows/structured_schemas_variety.py",
                "flows/router_two_arms_no_else.py",
                "examples/router_math_flow.py",
                "examples/support_triage_flow.py",
                "examples/approval_gate_flow.py"})
        @DisplayName("generated script scans back into the same graph shape")
        void scansBackToSameShape(String path) {
            String source = path.startsWith("flows/")
                    ? TestScripts.fixture(path.substring("flows/".length()))
                    : TestScripts.example(path.substring("examples/".length()));
            IrFlow original = parse(source);

            String generated = generator.generate(original);
            IrFlow reparsed = parse(generated);

            assertEquals(FlowShapes.describe(original, deserializer), FlowShapes.describe(reparsed, deserializer));
        }

        @Test
        @DisplayName("identical input gives identical text")
        void deterministic() {
            IrFlow first = parse(TestScripts.example("support_triage_flow.py"));
            IrFlow second = parse(TestScripts.example("support_triage_flow.py"));
            assertEquals(generator.generate(first), generator.generate(second));
        }
    }

    @Nested
    @DisplayName("rendering")
    class Rendering {

        @Test
        @DisplayName("declares records, tool stubs and agents before the entry function")
        void moduleSections() {
            String script = generator.generate(parse(TestScripts.example("support_triage_flow.py")));

            assertThat(script).startsWith("from agents import function_tool, Agent, ModelSettings, TResponseInputItem, Runner, RunConfig, trace\n");
            assertThat(script).contains("from typing import Any, Literal\n");
            assertThat(script).contains("class WorkflowInput(BaseModel):\n  input_as_text: str\n");
            assertThat(script).contains("class TriageSchema(BaseModel):\n  category: Literal[\"billing\", \"technical\", \"other\"]\n");
            assertThat(script).contains("@function_tool\ndef lookup_invoice(invoice_id: str) -> str:\n"
                    + "  impl = _TOOL_REGISTRY.get(\"lookup_invoice\")\n"
                    + "  if impl is None:\n"
                    + "    raise RuntimeError(\"Required tool not provided: lookup_invoice\")\n"
                    + "  return impl(invoice_id)\n");
            assertThat(script).contains("  model_settings=ModelSettings(\n    temperature=0.0,\n    max_tokens=64,\n  ),\n");
            assertThat(script).contains("async def run_workflow(workflow_input: WorkflowInput, tools: dict | None = None):\n"
                    + "  _TOOL_REGISTRY.clear()\n"
                    + "  _TOOL_REGISTRY.update(tools or {})\n"
                    + "  with trace(\"Support triage\"):\n");
            assertThat(script.indexOf("class TriageSchema")).isLessThan(script.indexOf("def lookup_invoice"));
            assertThat(script.indexOf("def lookup_invoice")).isLessThan(script.indexOf("triage = Agent("));
            assertThat(script.indexOf("triage = Agent(")).isLessThan(script.indexOf("async def run_workflow"));
        }

        @Test
        @DisplayName("emits a join node once after the ladder")
        void joinAfterLadder() {
            String script = generator.generate(parse(TestScripts.example("support_triage_flow.py")));

            assertThat(script).contains("    if triage_result[\"output_parsed\"][\"category\"] == \"billing\":\n");
            assertThat(script).contains("    elif triage_result[\"output_parsed\"][\"category\"] == \"technical\":\n");
            assertThat(script).doesNotContain("    else:\n");
            assertThat(script.split("closer_result_temp = await Runner.run\\(", -1)).hasSize(2);
            assertThat(script).contains("      \"category\": triage_result[\"output_parsed\"][\"category\"]\n");
        }

        @Test
        @DisplayName("orders ladder arms by literal and keeps the else arm")
        void routerLadder() {
            String script = generator.generate(parse(TestScripts.example("router_math_flow.py")));

            assertThat(script.indexOf("== \"zwak\":")).isLessThan(script.indexOf("== \"zwik\":"));
            assertThat(script.indexOf("== \"zwik\":")).isLessThan(script.indexOf("== \"zwok\":"));
            assertThat(script).contains("    else:\n      fail_result_temp = await Runner.run(\n");
            assertThat(script).contains("zwik = Agent(\n");
            assertThat(script).contains("def calculate_zwik_function(a: int, b: int) -> int:\n");
            assertThat(script).contains("  instructions=\"\"\"You are a classifier.\n");
        }

        @Test
        @DisplayName("renders the approval gate with an undecorated stub")
        void approvalGate() {
            String script = generator.generate(parse(TestScripts.example("approval_gate_flow.py")));

            assertThat(script).startsWith("from agents import Agent,");
            assertThat(script).contains("\ndef approval_request(message: str) -> bool:\n");
            assertThat(script).doesNotContain("@function_tool");
            assertThat(script).contains("    if approval_request(drafter_result[\"output_text\"]):\n");
            assertThat(script).contains("    else:\n      return {\n        \"output_text\": workflow.get(\"output_text\", \"\")\n      }\n");
        }

        @Test
        @DisplayName("falls back to return {} when a ladder has no default arm")
        void ladderWithoutDefault() {
            IrNode judge = agentNode("judge", "Judge", List.of(Property.of("label", "string")));
            IrFlow ir = new IrFlow("No default", "start",
                    List.of(start(), judge, new IrNode("b", "Branch", new NodePayload.BranchPayload(Map.of("yes", "yes"), "label")),
                            agentNode("w", "Writer", List.of()), end("e")),
                    List.of(new IrControlEdge("start", "judge"), new IrControlEdge("judge", "b"),
                            new IrControlEdge("b", "w", "yes"), new IrControlEdge("w", "e")),
                    List.of(new IrDataEdge("judge", "label", "b", "label")));

            String script = generator.generate(ir);
            assertThat(script).contains("    if judge_result[\"output_parsed\"][\"label\"] == \"yes\":\n");
            assertThat(script).contains("    else:\n      return {}\n");
        }

        @Test
        @DisplayName("runs a linear chain in order and returns the last agent's result")
        void linearChain() {
            IrFlow ir = new IrFlow("Chain", "start",
                    List.of(start(), agentNode("n", "Normalizer", List.of()), agentNode("c", "Classifier", List.of()),
                            agentNode("r", "Responder", List.of()), end("e")),
                    List.of(new IrControlEdge("start", "n"), new IrControlEdge("n", "c"),
                            new IrControlEdge("c", "r"), new IrControlEdge("r", "e")),
                    List.of());

            String script = generator.generate(ir);
            assertThat(script.split("= await Runner.run\\(", -1)).hasSize(4);
            int normalizer = script.indexOf("normalizer_result_temp = await Runner.run(\n      normalizer,\n");
            int classifier = script.indexOf("classifier_result_temp = await Runner.run(\n      classifier,\n");
            int responder = script.indexOf("responder_result_temp = await Runner.run(\n      responder,\n");
            assertThat(normalizer).isPositive().isLessThan(classifier);
            assertThat(classifier).isLessThan(responder);
            assertThat(script).endsWith("    return responder_result\n");
        }

        @Test
        @DisplayName("reads the chain fixture's output from the last agent")
        void linearChainFixture() {
            String script = generator.generate(parse(TestScripts.fixture("linear_chain_three_agents.py")));

            assertThat(script.indexOf("normalizer,\n")).isLessThan(script.indexOf("classifier,\n"));
            assertThat(script.indexOf("classifier,\n")).isLessThan(script.indexOf("responder,\n"));
            assertThat(script).endsWith("    return {\n      \"output_text\": responder_result[\"output_text\"]\n    }\n");
        }

        @Test
        @DisplayName("returns the result of the arm that ran when ladder arms meet at a bare end")
        void sharedResultAtJoin() {
            String script = generator.generate(parse(TestScripts.fixture("router_two_arms_no_else.py")));

            assertThat(script).contains("    last_result = router_result\n"
                    + "    if router_result[\"output_parsed\"][\"route\"] == \"a\":\n"
                    + "      alpha_result_temp = await Runner.run(\n");
            assertThat(script).contains("        \"output_text\": alpha_result_temp.final_output_as(str)\n"
                    + "      }\n"
                    + "      last_result = alpha_result\n"
                    + "    elif router_result[\"output_parsed\"][\"route\"] == \"b\":\n");
            assertThat(script).endsWith("        \"output_text\": beta_result_temp.final_output_as(str)\n"
                    + "      }\n"
                    + "      last_result = beta_result\n"
                    + "    return last_result\n");
            assertThat(script).doesNotContain("return router_result", "    else:\n");
        }

        @Test
        @DisplayName("keeps a join that starts with an agent free of the shared result")
        void joinStartingWithAgent() {
            String script = generator.generate(parse(TestScripts.example("support_triage_flow.py")));
            assertThat(script).doesNotContain("last_result");
        }

        @Test
        @DisplayName("defines the result of an agent that runs on one arm before the ladder")
        void placeholderForSkippedAgent() {
            IrFlow ir = new IrFlow("Skippable", "start",
                    List.of(start(), new IrNode("b", "Branch", new NodePayload.BranchPayload(Map.of("go", "go"), "input_as_text")),
                            agentNode("w", "Writer", List.of()), end("e", new IoField("output_text", "string"))),
                    List.of(new IrControlEdge("start", "b"), new IrControlEdge("b", "w", "go"),
                            new IrControlEdge("b", "e", IrControlEdge.DEFAULT_BRANCH), new IrControlEdge("w", "e")),
                    List.of(new IrDataEdge("start", "input_as_text", "b", "input_as_text"),
                            new IrDataEdge("w", "output_text", "e", "output_text")));

            String script = generator.generate(ir);
            assertThat(script).contains("    writer_result = {\"output_text\": \"\"}\n"
                    + "    if workflow[\"input_as_text\"] == \"go\":\n");
            assertThat(script).endsWith("    return {\n      \"output_text\": writer_result[\"output_text\"]\n    }\n");
            assertThat(script).doesNotContain("last_result", "    else:\n");
        }

        @Test
        @DisplayName("fills a skipped structured agent's placeholder with typed defaults")
        void structuredPlaceholder() {
            IrFlow ir = new IrFlow("Skippable", "start",
                    List.of(start(), new IrNode("b", "Branch", new NodePayload.BranchPayload(Map.of("go", "go"), "input_as_text")),
                            agentNode("s", "Scorer", List.of(Property.of("score", "integer"), Property.of("label", "string"))),
                            end("e", new IoField("score", "integer"))),
                    List.of(new IrControlEdge("start", "b"), new IrControlEdge("b", "s", "go"),
                            new IrControlEdge("b", "e", IrControlEdge.DEFAULT_BRANCH), new IrControlEdge("s", "e")),
                    List.of(new IrDataEdge("start", "input_as_text", "b", "input_as_text"),
                            new IrDataEdge("s", "score", "e", "score")));

            String script = generator.generate(ir);
            assertThat(script).contains("    scorer_result = {\"output_text\": \"\", \"output_parsed\": {\"score\": 0, \"label\": \"\"}}\n");
            assertThat(script).contains("      \"score\": scorer_result[\"output_parsed\"][\"score\"]\n");
        }

        @Test
        @DisplayName("returns an empty result when the start node has no successor")
        void startOnly() {
            IrFlow ir = new IrFlow("Empty", "start", List.of(start()), List.of(), List.of());
            String script = generator.generate(ir);
            assertThat(script).endsWith("    return {}\n");
            assertThat(script).doesNotContain("= Agent(");
        }

        @Test
        @DisplayName("keeps generated names clear of keywords and of each other")
        void nameCollisions() {
            IrFlow ir = new IrFlow("Names", "start",
                    List.of(start(), agentNode("a1", "class", List.of()), agentNode("a2", "Helper", List.of()),
                            new IrNode("a3", "Helper", new NodePayload.AgentPayload(
                                    agentYaml("Helper", List.of(), List.of()).replace(Naming.stableId("agent:Helper"), "other-id"))),
                            end("e")),
                    List.of(new IrControlEdge("start", "a1"), new IrControlEdge("a1", "a2"),
                            new IrControlEdge("a2", "a3"), new IrControlEdge("a3", "e")),
                    List.of());

            String script = generator.generate(ir);
            assertThat(script).contains("class_2 = Agent(\n", "helper = Agent(\n", "helper_2 = Agent(\n");
            assertThat(script).contains("    return helper_2_result\n");
        }

        @Test
        @DisplayName("reads unmapped end outputs from the entry input with a typed default")
        void endFallbacks() {
            IrFlow ir = new IrFlow("Fallbacks", "start", List.of(start(),
                    end("e", new IoField("count", "integer"), new IoField("tags", "array"), new IoField("Input As Text", "string"))),
                    List.of(new IrControlEdge("start", "e")), List.of());

            String script = generator.generate(ir);
            assertThat(script).contains("      \"count\": workflow.get(\"count\", 0),\n");
            assertThat(script).contains("      \"tags\": workflow.get(\"tags\", []),\n");
            assertThat(script).contains("      \"Input As Text\": workflow.get(\"input_as_text\", \"\")\n");
        }
    }

    @Nested
    @DisplayName("unsupported graphs")
    class Unsupported {

        @Test
        @DisplayName("rejects a flow whose start id is not a start node")
        void missingStart() {
            IrFlow ir = new IrFlow("No start", "a", List.of(agentNode("a", "A", List.of())), List.of(), List.of());
            assertEquals(FlowErrorCode.MISSING_START, rejected(() -> generator.generate(ir)).getCode());
        }

        @Test
        @DisplayName("rejects control flow cycles")
        void cycle() {
            IrFlow ir = new IrFlow("Loop", "start",
                    List.of(start(), agentNode("a", "Judge", List.of(Property.of("label", "string"))),
                            new IrNode("b", "Branch", new NodePayload.BranchPayload(Map.of("again", "again"), "label")),
                            end("e")),
                    List.of(new IrControlEdge("start", "a"), new IrControlEdge("a", "b"),
                            new IrControlEdge("b", "a", "again"), new IrControlEdge("b", "e", IrControlEdge.DEFAULT_BRANCH)),
                    List.of(new IrDataEdge("a", "label", "b", "label")));

            UnsupportedPatternException ex = rejected(() -> generator.generate(ir));
            assertEquals(FlowErrorCode.CFG_CYCLE, ex.getCode());
            assertEquals("a", ex.getDetails().get("node"));
        }

        @Test
        @DisplayName("rejects two unconditional successors as invalid IR")
        void twoSuccessors() {
            IrFlow ir = new IrFlow("Fork", "start", List.of(start(), agentNode("a", "A", List.of()), end("e")),
                    List.of(new IrControlEdge("start", "a"), new IrControlEdge("start", "e"), new IrControlEdge("a", "e")),
                    List.of());
            assertThrows(IrFlowValidationException.class, () -> generator.generate(ir));
        }

        @Test
        @DisplayName("rejects node kinds with no script counterpart")
        void llmNode() {
            IrFlow ir = new IrFlow("Llm", "start", List.of(start(),
                    new IrNode("l", "Summarize", new NodePayload.LlmPayload("component_type: OpenAiConfig", "Summarize", List.of())),
                    end("e")),
                    List.of(new IrControlEdge("start", "l"), new IrControlEdge("l", "e")), List.of());

            UnsupportedPatternException ex = rejected(() -> generator.generate(ir));
            assertEquals(FlowErrorCode.UNSUPPORTED_CODEGEN_NODE, ex.getCode());
            assertEquals("llm", ex.getDetails().get("kind"));
        }

        @Test
        @DisplayName("rejects a branch without an input key")
        void branchWithoutKey() {
            IrFlow ir = new IrFlow("Keyless", "start",
                    List.of(start(), new IrNode("b", "Branch", new NodePayload.BranchPayload(Map.of("x", "x"), null)), end("e")),
                    List.of(new IrControlEdge("start", "b"), new IrControlEdge("b", "e", "x")), List.of());
            assertEquals(FlowErrorCode.BRANCH_INPUT_KEY_MISSING, rejected(() -> generator.generate(ir)).getCode());
        }

        @Test
        @DisplayName("rejects an agent node without a snippet")
        void agentWithoutSnippet() {
            IrFlow ir = new IrFlow("Bare", "start", List.of(start(), new IrNode("a", "A", new NodePayload.AgentPayload("")), end("e")),
                    List.of(new IrControlEdge("start", "a"), new IrControlEdge("a", "e")), List.of());
            assertEquals(FlowErrorCode.AGENT_YAML_MISSING, rejected(() -> generator.generate(ir)).getCode());
        }

        @Test
        @DisplayName("rejects a tool with more than one output")
        void multiOutputTool() {
            ServerTool tool = new ServerTool("t", "split", null, List.of(Property.of("text", "string")),
                    List.of(Property.of("head", "string"), Property.of("tail", "string")));
            IrNode agent = new IrNode("a", "Splitter",
                    new NodePayload.AgentPayload(agentYaml("Splitter", List.of(), List.of(tool))));
            IrFlow ir = new IrFlow("Split", "start", List.of(start(), agent, end("e")),
                    List.of(new IrControlEdge("start", "a"), new IrControlEdge("a", "e")), List.of());

            UnsupportedPatternException ex = rejected(() -> generator.generate(ir));
            assertEquals(FlowErrorCode.MULTI_OUTPUT_TOOL_UNSUPPORTED, ex.getCode());
            assertEquals("split", ex.getDetails().get("tool"));
        }

        @Test
        @DisplayName("rejects reading a field an unstructured agent does not have")
        void unstructuredField() {
            IrFlow ir = new IrFlow("Unstructured", "start",
                    List.of(start(), agentNode("w", "Writer", List.of()), end("e", new IoField("summary", "string"))),
                    List.of(new IrControlEdge("start", "w"), new IrControlEdge("w", "e")),
                    List.of(new IrDataEdge("w", "summary", "e", "summary")));

            UnsupportedPatternException ex = rejected(() -> generator.generate(ir));
            assertEquals(FlowErrorCode.UNSTRUCTURED_SOURCE_FIELD, ex.getCode());
            assertEquals("summary", ex.getDetails().get("field"));
        }

        @Test
        @DisplayName("rejects reading an agent that runs on no path into the end")
        void sourceNotOnPath() {
            IrFlow ir = new IrFlow("Elsewhere", "start",
                    List.of(start(), new IrNode("b", "Branch", new NodePayload.BranchPayload(Map.of("go", "go"), "input_as_text")),
                            agentNode("w", "Writer", List.of()), end("e1"), end("e2", new IoField("output_text", "string"))),
                    List.of(new IrControlEdge("start", "b"), new IrControlEdge("b", "w", "go"), new IrControlEdge("w", "e1"),
                            new IrControlEdge("b", "e2", IrControlEdge.DEFAULT_BRANCH)),
                    List.of(new IrDataEdge("start", "input_as_text", "b", "input_as_text"),
                            new IrDataEdge("w", "output_text", "e2", "output_text")));

            UnsupportedPatternException ex = rejected(() -> generator.generate(ir));
            assertEquals(FlowErrorCode.END_SOURCE_NOT_ON_PATH, ex.getCode());
            assertEquals("w", ex.getDetails().get("source"));
        }

        @Test
        @DisplayName("rejects a tool node that does not gate a branch")
        void plainToolNode() {
            IrNode tool = new IrNode("t", "lookup", new NodePayload.ToolPayload(new ToolDefinition(
                    "lookup", ToolKind.SERVER, List.of(), List.of(new IoField("result", "string")))));
            IrFlow ir = new IrFlow("Tool", "start", List.of(start(), tool, end("e")),
                    List.of(new IrControlEdge("start", "t"), new IrControlEdge("t", "e")), List.of());
            assertEquals(FlowErrorCode.UNSUPPORTED_CODEGEN_NODE, rejected(() -> generator.generate(ir)).getCode());
        }
    }

    @Nested
    @DisplayName("large graphs")
    class LargeGraphs {

        private static final int LENGTH = 5_000;

        @Test
        @DisplayName("renders a long agent chain without deep recursion")
        void longChain() {
            String yaml = agentYaml("Step", List.of(), List.of());
            List<IrNode> nodes = new ArrayList<>(List.of(start()));
            List<IrControlEdge> edges = new ArrayList<>();
            String previous = "start";
            for (int i = 0; i < LENGTH; i++) {
                nodes.add(new IrNode("s" + i, "Step", new NodePayload.AgentPayload(yaml)));
                edges.add(new IrControlEdge(previous, "s" + i));
                previous = "s" + i;
            }
            nodes.add(end("e"));
            edges.add(new IrControlEdge(previous, "e"));

            String script = generator.generate(new IrFlow("Long", "start", nodes, edges, List.of()));
            assertThat(script.split("step_result_temp = await Runner.run\\(", -1)).hasSize(LENGTH + 1);
            assertThat(script).endsWith("    return step_result\n");
        }

        @Test
        @DisplayName("finds a cycle closing a long chain")
        void longCycle() {
            List<IrNode> nodes = new ArrayList<>(List.of(start(), agentNode("judge", "Judge", List.of(Property.of("label", "string")))));
            List<IrControlEdge> edges = new ArrayList<>(List.of(new IrControlEdge("start", "judge")));
            String previous = "judge";
            for (int i = 0; i < LENGTH; i++) {
                nodes.add(new IrNode("b" + i, "Branch", new NodePayload.BranchPayload(Map.of("on", "on"), "label")));
                edges.add(new IrControlEdge(previous, "b" + i, previous.equals("judge") ? null : "on"));
                previous = "b" + i;
            }
            edges.add(new IrControlEdge(previous, "judge", "on"));
            IrFlow ir = new IrFlow("Loop", "start", nodes, edges, List.of());

            UnsupportedPatternException ex = rejected(() -> generator.generate(ir));
            assertEquals(FlowErrorCode.CFG_CYCLE, ex.getCode());
            assertEquals("judge", ex.getDetails().get("node"));
        }
    }
}
