package com.example.flowbridge.ir;

import java.util.Arrays;
import java.util.Locale;

/**
 * Node discriminant of the intermediate representation.
 */
public enum IrNodeKind {
    START,
    END,
    AGENT,
    LLM,
    TOOL,
    BRANCH,
    MESSAGE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static IrNodeKind fromWireName(String value) {
        return Arrays.stream(values())
                .filter(k -> k.wireName().equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown node kind: " + value));
    }
}
