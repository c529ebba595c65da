package com.example.flowbridge.script;

/**
 * A function or lambda parameter.
 */
public record Param(String name, Expr annotation, Expr defaultValue, Kind kind) {

    public enum Kind {
        POSITIONAL,
        VAR_POSITIONAL,
        KEYWORD_ONLY,
        VAR_KEYWORD
    }
}
