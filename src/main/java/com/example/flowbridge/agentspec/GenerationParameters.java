package com.example.flowbridge.agentspec;

/**
 * Default sampling parameters of an LLM configuration. Absent values are null.
 */
public record GenerationParameters(Double temperature, Double topP, Integer maxTokens) {

    public static final GenerationParameters NONE = new GenerationParameters(null, null, null);

    public boolean isEmpty() {
        return temperature == null && topP == null && maxTokens == null;
    }
}
