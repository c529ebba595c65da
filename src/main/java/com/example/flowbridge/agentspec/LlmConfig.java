package com.example.flowbridge.agentspec;

/**
 * Model endpoint configuration used by agents and LLM nodes.
 */
public interface LlmConfig extends AgentSpecComponent {

    String modelId();

    GenerationParameters defaultGenerationParameters();
}
