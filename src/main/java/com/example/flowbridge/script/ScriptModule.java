package com.example.flowbridge.script;

import java.util.List;

/**
 * A parsed script: its top-level statements.
 */
public record ScriptModule(List<Stmt> body) {

    public ScriptModule {
        body = List.copyOf(body);
    }
}
