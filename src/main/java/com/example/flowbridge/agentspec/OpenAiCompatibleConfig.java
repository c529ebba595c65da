package com.example.flowbridge.agentspec;

/**
 * An OpenAI-compatible endpoint reached at {@code url}.
 */
public record OpenAiCompatibleConfig(String id, String name, String modelId, String url,
                                     GenerationParameters defaultGenerationParameters) implements LlmConfig {

    public OpenAiCompatibleConfig {
        defaultGenerationParameters = defaultGenerationParameters != null ? defaultGenerationParameters : GenerationParameters.NONE;
    }
}
