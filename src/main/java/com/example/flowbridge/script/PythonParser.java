package com.example.flowbridge.script;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;

/**
 * Parses Python scripts into a {@link ScriptModule}.
 * <p>
 * Covers the statement and expression grammar used by workflow scripts: definitions, decorators,
 * control flow, async forms, comprehensions and f-strings. Syntax outside that grammar (match
 * statements, parenthesized context managers) is reported as a
 * {@link com.example.flowbridge.errors.ScriptParseException}.
 * </p>
 */
public final class PythonParser {

    private PythonParser() {
    }

    public static ScriptModule parse(String source) {
        String text = source == null ? "" : source;
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }
        ScriptErrorListener errors = new ScriptErrorListener();
        PythonScriptLexer lexer = new PythonScriptLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);
        PythonScriptParser parser = new PythonScriptParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errors);
        return new ScriptTreeBuilder().build(parser.fileInput());
    }
}
