package com.example.flowbridge.script;

import com.example.flowbridge.errors.ScriptParseException;
import lombok.extern.slf4j.Slf4j;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/**
 * Stops lexing or parsing at the first syntax error, reporting it as a {@link ScriptParseException}
 * with a 1-based column.
 */
@Slf4j
final class ScriptErrorListener extends BaseErrorListener {

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine,
                            String msg, RecognitionException e) {
        log.debug("Script syntax error at {}:{}: {}", line, charPositionInLine + 1, msg);
        throw new ScriptParseException(msg, line, charPositionInLine + 1);
    }
}
