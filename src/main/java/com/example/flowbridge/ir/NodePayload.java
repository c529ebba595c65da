package com.example.flowbridge.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Kind-specific data of an {@link IrNode}. Each record declares the node kind it belongs to.
 */
public sealed interface NodePayload {

    IrNodeKind kind();

    record StartPayload(List<IoField> inputs, List<IoField> outputs) implements NodePayload {
        public StartPayload {
            inputs = inputs != null ? List.copyOf(inputs) : List.of();
            outputs = outputs != null ? List.copyOf(outputs) : List.of();
        }

        @Override
        public IrNodeKind kind() {
            return IrNodeKind.START;
        }
    }

    record EndPayload(List<IoField> outputs) implements NodePayload {
        public EndPayload {
            outputs = outputs != null ? List.copyOf(outputs) : List.of();
        }

        @Override
        public IrNodeKind kind() {
            return IrNodeKind.END;
        }
    }

    /** Agent configuration serialized as an Agent Spec YAML snippet. */
    record AgentPayload(String agentSpecYaml) implements NodePayload {
        @Override
        public IrNodeKind kind() {
            return IrNodeKind.AGENT;
        }
    }

    record LlmPayload(String llmConfigYaml, String promptTemplate, List<IoField> outputs) implements NodePayload {
        public LlmPayload {
            outputs = outputs != null ? List.copyOf(outputs) : List.of();
        }

        @Override
        public IrNodeKind kind() {
            return IrNodeKind.LLM;
        }
    }

    record ToolPayload(ToolDefinition tool) implements NodePayload {
        public ToolPayload {
            Objects.requireNonNull(tool, "tool");
        }

        @Override
        public IrNodeKind kind() {
            return IrNodeKind.TOOL;
        }
    }

    /**
     * Literal-to-literal arm mapping plus the name of the field whose value selects the arm.
     */
    record BranchPayload(Map<String, String> mapping, String inputKey) implements NodePayload {
        public BranchPayload {
            mapping = mapping != null ? Collections.unmodifiableMap(new LinkedHashMap<>(mapping)) : Map.of();
        }

        @Override
        public IrNodeKind kind() {
            return IrNodeKind.BRANCH;
        }
    }

    record MessagePayload(String message) implements NodePayload {
        @Override
        public IrNodeKind kind() {
            return IrNodeKind.MESSAGE;
        }
    }
}
