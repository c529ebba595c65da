package com.example.flowbridge.errors;

/**
 * Machine-readable codes carried by every {@link FlowConversionException}.
 */
public enum FlowErrorCode {

    // script front end
    PARSE_ERROR,

    // scanner
    NO_RUN_WORKFLOW,
    TOOL_RETURN_SCHEMA_MISSING,
    UNSUPPORTED_MODEL_SETTINGS,
    UNSUPPORTED_AGENT_ARGUMENT,

    // graph builder
    UNKNOWN_AGENT,
    UNSUPPORTED_TOOL,
    RUNNER_RUN_NO_AGENT,
    CONVERSATION_INPUT_MISSING,
    CONVERSATION_PROPAGATION_REQUIRED,
    BRANCH_INPUT_KEY_UNDETECTABLE,
    UNSUPPORTED_BRANCH_CONDITION,
    DUPLICATE_BRANCH_LITERAL,

    // IR structure
    INVALID_IR,

    // schema conversion
    AGENT_YAML_MISSING,
    LLM_YAML_MISSING,
    UNSUPPORTED_NODE_KIND,
    UNSUPPORTED_NODE,
    INVALID_AGENTSPEC,
    LOSSY_MAPPING,

    // code generation
    BRANCH_INPUT_KEY_MISSING,
    MISSING_START,
    MODEL_ID_MISSING,
    MULTI_OUTPUT_TOOL_UNSUPPORTED,
    CFG_CYCLE,
    MULTI_SUCCESSOR,
    UNSUPPORTED_END_SOURCE,
    UNSTRUCTURED_SOURCE_FIELD,
    AMBIGUOUS_END_INPUT,
    END_SOURCE_NOT_ON_PATH,
    UNSUPPORTED_CODEGEN_NODE,

    // rule packs
    RULEPACK_NOT_FOUND,
    SDK_VERSION_UNAVAILABLE
}
