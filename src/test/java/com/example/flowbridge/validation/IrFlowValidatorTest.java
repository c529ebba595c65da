package com.example.flowbridge.validation;

import com.example.flowbridge.errors.FlowErrorCode;
import com.example.flowbridge.ir.IrControlEdge;
import com.example.flowbridge.ir.IrDataEdge;
import com.example.flowbridge.ir.IrFlow;
import com.example.flowbridge.ir.IrNode;
import com.example.flowbridge.ir.NodePayload;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("IrFlowValidator")
class IrFlowValidatorTest {

    private static IrNode start(String id) {
        return new IrNode(id, "Start", new NodePayload.StartPayload(List.of(), List.of()));
    }

    private static IrNode end(String id) {
        return new IrNode(id, "End", new NodePayload.EndPayload(List.of()));
    }

    private static IrNode agent(String id) {
        return new IrNode(id, id, new NodePayload.AgentPayload("component_type: Agent"));
    }

    private static IrNode branch(String id) {
        return new IrNode(id, "Branch", new NodePayload.BranchPayload(Map.of("a", "a"), "label"));
    }

    private static IrFlowValidationException invalid(IrFlow flow) {
        IrFlowValidationException ex = assertThrows(IrFlowValidationException.class, () -> IrFlowValidator.validate(flow));
        assertEquals(FlowErrorCode.INVALID_IR, ex.getCode());
        return ex;
    }

    @Nested
    @DisplayName("valid graph")
    class ValidGraph {

        @Test
        @DisplayName("passes for a start-agent-end chain")
        void chainPasses() {
            IrFlow flow = new IrFlow("f", "s", List.of(start("s"), agent("a"), end("e")),
                    List.of(new IrControlEdge("s", "a"), new IrControlEdge("a", "e")),
                    List.of(new IrDataEdge("a", "output_text", "e", "output_text")));
            assertDoesNotThrow(() -> IrFlowValidator.validate(flow));
        }

        @Test
        @DisplayName("passes for labelled branch arms and a cycle back to an earlier node")
        void branchAndCyclePass() {
            IrFlow flow = new IrFlow("f", "s", List.of(start("s"), agent("a"), branch("b"), end("e")),
                    List.of(new IrControlEdge("s", "a"), new IrControlEdge("a", "b"),
                            new IrControlEdge("b", "a", "a"), new IrControlEdge("b", "e", IrControlEdge.DEFAULT_BRANCH)),
                    List.of());
            assertDoesNotThrow(() -> IrFlowValidator.validate(flow));
        }

        @Test
        @DisplayName("reads the next label as an unconditional edge")
        void nextLabelIsUnconditional() {
            IrControlEdge edge = new IrControlEdge("s", "e", IrControlEdge.NEXT);
            assertTrue(edge.isUnconditional());
            IrFlow flow = new IrFlow("f", "s", List.of(start("s"), end("e")), List.of(edge), List.of());
            assertDoesNotThrow(() -> IrFlowValidator.validate(flow));
        }
    }

    @Nested
    @DisplayName("invalid graph")
    class InvalidGraph {

        @Test
        @DisplayName("fails when startId does not reference any node")
        void missingStart() {
            IrFlowValidationException ex = invalid(new IrFlow("f", "missing", List.of(start("s")), List.of(), List.of()));
            assertEquals("startId", ex.getErrors().get(0).field());
            assertNull(ex.getErrors().get(0).nodeId());
        }

        @Test
        @DisplayName("fails when startId references a node that is not a start node")
        void startOfWrongKind() {
            IrFlowValidationException ex = invalid(new IrFlow("f", "a", List.of(agent("a")), List.of(), List.of()));
            assertEquals("startId", ex.getErrors().get(0).field());
        }

        @Test
        @DisplayName("fails on duplicate node ids")
        void duplicateIds() {
            IrFlowValidationException ex = invalid(new IrFlow("f", "s", List.of(start("s"), agent("a"), agent("a")),
                    List.of(new IrControlEdge("s", "a")), List.of()));
            assertEquals("nodes[a]", ex.getErrors().get(0).field());
        }

        @Test
        @DisplayName("fails when an edge points at an unknown node")
        void danglingEdge() {
            IrFlowValidationException ex = invalid(new IrFlow("f", "s", List.of(start("s")),
                    List.of(new IrControlEdge("s", "ghost")), List.of()));
            assertEquals("controlEdges[s->ghost].toId", ex.getErrors().get(0).field());
        }

        @Test
        @DisplayName("fails when a node has two unconditional successors")
        void twoUnconditionalEdges() {
            IrFlowValidationException ex = invalid(new IrFlow("f", "s", List.of(start("s"), agent("a"), end("e")),
                    List.of(new IrControlEdge("s", "a"), new IrControlEdge("s", "e"), new IrControlEdge("a", "e")),
                    List.of()));
            assertEquals(1, ex.getErrors().size());
            assertEquals("controlEdges[s->e]", ex.getErrors().get(0).field());
            assertEquals("s", ex.getErrors().get(0).nodeId());
        }

        @Test
        @DisplayName("fails when a non-branch node carries a branch label")
        void labelOnAgent() {
            IrFlowValidationException ex = invalid(new IrFlow("f", "s", List.of(start("s"), agent("a"), end("e")),
                    List.of(new IrControlEdge("s", "a"), new IrControlEdge("a", "e", "yes")), List.of()));
            assertEquals("controlEdges[a->e].branch", ex.getErrors().get(0).field());
            assertEquals("a", ex.getErrors().get(0).nodeId());
        }

        @Test
        @DisplayName("fails when a branch label repeats on one node")
        void duplicateLabel() {
            IrFlowValidationException ex = invalid(new IrFlow("f", "s",
                    List.of(start("s"), branch("b"), end("e1"), end("e2")),
                    List.of(new IrControlEdge("s", "b"), new IrControlEdge("b", "e1", "a"), new IrControlEdge("b", "e2", "a")),
                    List.of()));
            assertEquals("controlEdges[b->e2].branch", ex.getErrors().get(0).field());
        }

        @Test
        @DisplayName("fails when one input is fed by two data edges")
        void inputFedTwice() {
            IrFlowValidationException ex = invalid(new IrFlow("f", "s", List.of(start("s"), agent("a"), end("e")),
                    List.of(new IrControlEdge("s", "a"), new IrControlEdge("a", "e")),
                    List.of(new IrDataEdge("a", "output_text", "e", "out"), new IrDataEdge("s", "input_as_text", "e", "out"))));
            assertEquals("dataEdges[s.input_as_text->e.out].destInput", ex.getErrors().get(0).field());
            assertEquals("e", ex.getErrors().get(0).nodeId());
        }

        @Test
        @DisplayName("fails when a node cannot be reached from the start")
        void unreachable() {
            IrFlowValidationException ex = invalid(new IrFlow("f", "s", List.of(start("s"), end("e"), agent("orphan")),
                    List.of(new IrControlEdge("s", "e")), List.of()));
            assertEquals("nodes[orphan]", ex.getErrors().get(0).field());
            assertEquals("orphan", ex.getErrors().get(0).nodeId());
        }
    }
}
