package com.example.flowbridge.agentspec;

public record OpenAiConfig(String id, String name, String modelId, GenerationParameters defaultGenerationParameters)
        implements LlmConfig {

    public OpenAiConfig {
        defaultGenerationParameters = defaultGenerationParameters != null ? defaultGenerationParameters : GenerationParameters.NONE;
    }
}
