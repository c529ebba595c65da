package com.example.flowbridge.agentspec;

public record OllamaConfig(String id, String name, String modelId, String url,
                           GenerationParameters defaultGenerationParameters) implements LlmConfig {

    public OllamaConfig {
        defaultGenerationParameters = defaultGenerationParameters != null ? defaultGenerationParameters : GenerationParameters.NONE;
    }
}
