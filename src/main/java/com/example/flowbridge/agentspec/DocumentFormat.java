package com.example.flowbridge.agentspec;

import java.util.Locale;

/**
 * Text encodings of Agent Spec documents.
 */
public enum DocumentFormat {
    YAML,
    JSON;

    /**
     * Parses a format name case-insensitively ({@code yml} is accepted for YAML).
     *
     * @throws IllegalArgumentException for any other name
     */
    public static DocumentFormat fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Document format must not be blank");
        }
        String normalized = name.strip().toUpperCase(Locale.ROOT);
        if ("YML".equals(normalized)) {
            return YAML;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported document format: " + name + " (expected yaml or json)", e);
        }
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
