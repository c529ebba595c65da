package com.example.flowbridge.errors;

import lombok.Getter;

import java.util.Map;

/**
 * The workflow script is not valid in the supported Python syntax.
 */
@Getter
public class ScriptParseException extends FlowConversionException {

    private final int line;
    private final int column;

    public ScriptParseException(String message, int line, int column) {
        super(FlowErrorCode.PARSE_ERROR, message + " at line " + line + ", column " + column,
                Map.of("line", line, "column", column, "error", message));
        this.line = line;
        this.column = column;
    }
}
