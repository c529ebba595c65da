package com.example.flowbridge.script;

import java.util.List;

/**
 * Statement nodes of the parsed script. Every statement records the line it starts on.
 */
public sealed interface Stmt {

    int line();

    record ExprStmt(int line, Expr value) implements Stmt {
    }

    /** {@code a = b = value}: one entry in {@code targets} per assignment target. */
    record Assign(int line, List<Expr> targets, Expr value) implements Stmt {
    }

    record AnnAssign(int line, Expr target, Expr annotation, Expr value) implements Stmt {
    }

    record AugAssign(int line, Expr target, String op, Expr value) implements Stmt {
    }

    record Return(int line, Expr value) implements Stmt {
    }

    /** {@code elif} is true when this statement was written as an {@code elif} clause of the enclosing if. */
    record If(int line, Expr test, List<Stmt> body, List<Stmt> orElse, boolean elif) implements Stmt {

        public If elifClause() {
            if (orElse.size() == 1 && orElse.get(0) instanceof If next && next.elif()) {
                return next;
            }
            return null;
        }
    }

    record For(int line, Expr target, Expr iter, List<Stmt> body, List<Stmt> orElse, boolean async) implements Stmt {
    }

    record While(int line, Expr test, List<Stmt> body, List<Stmt> orElse) implements Stmt {
    }

    record With(int line, List<WithItem> items, List<Stmt> body, boolean async) implements Stmt {
    }

    record WithItem(Expr context, Expr target) {
    }

    record Try(int line, List<Stmt> body, List<ExceptHandler> handlers, List<Stmt> orElse, List<Stmt> finalBody) implements Stmt {
    }

    record ExceptHandler(Expr type, String name, List<Stmt> body) {
    }

    record FunctionDef(int line, String name, List<Param> params, Expr returns, List<Expr> decorators,
                       List<Stmt> body, boolean async) implements Stmt {
    }

    record ClassDef(int line, String name, List<Expr> bases, List<Expr.Keyword> keywords, List<Expr> decorators,
                    List<Stmt> body) implements Stmt {
    }

    record Import(int line, List<Alias> names) implements Stmt {
    }

    record ImportFrom(int line, String module, List<Alias> names, int level) implements Stmt {
    }

    record Alias(String name, String asName) {
    }

    record Global(int line, List<String> names) implements Stmt {
    }

    record Nonlocal(int line, List<String> names) implements Stmt {
    }

    record Pass(int line) implements Stmt {
    }

    record Break(int line) implements Stmt {
    }

    record Continue(int line) implements Stmt {
    }

    record Raise(int line, Expr exception, Expr cause) implements Stmt {
    }

    record Assert(int line, Expr test, Expr message) implements Stmt {
    }

    record Delete(int line, List<Expr> targets) implements Stmt {
    }
}
