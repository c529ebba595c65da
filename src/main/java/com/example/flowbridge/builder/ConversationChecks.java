package com.example.flowbridge.builder;

import com.example.flowbridge.scan.ScriptExpressions;
import com.example.flowbridge.script.Expr;
import com.example.flowbridge.script.Stmt;

import java.util.List;

/**
 * Checks that a delegate call reads and then extends the shared {@code conversation_history} list.
 */
final class ConversationChecks {

    static final String HISTORY = "conversation_history";

    private ConversationChecks() {
    }

    /** {@code input=[*conversation_history, ...]} or {@code input=conversation_history}, by keyword or position. */
    static boolean usesConversationHistory(Expr.Call call) {
        Expr input = call.keyword("input");
        if (input == null && call.args().size() > 1) {
            input = call.args().get(1);
        }
        if (input instanceof Expr.Name name) {
            return HISTORY.equals(name.id());
        }
        if (input instanceof Expr.ListExpr list) {
            return list.elements().stream().anyMatch(e -> e instanceof Expr.Starred starred
                    && starred.value() instanceof Expr.Name name && HISTORY.equals(name.id()));
        }
        return false;
    }

    /**
     * True when, between {@code from} and the next effectful statement, the block extends the history with
     * {@code [item.to_input_item() for item in <resultVariable>.new_items]}.
     */
    static boolean propagatesHistory(List<Stmt> block, int from, String resultVariable) {
        int end = nextEffectfulIndex(block, from);
        for (int i = from; i < end; i++) {
            if (isHistoryExtend(block.get(i), resultVariable)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Index of the next statement that transfers control or calls out: a return, any compound statement,
     * or a simple statement that awaits or runs an agent. {@code block.size()} when there is none.
     */
    static int nextEffectfulIndex(List<Stmt> block, int from) {
        for (int i = from; i < block.size(); i++) {
            Stmt stmt = block.get(i);
            if (stmt instanceof Stmt.Return || stmt instanceof Stmt.If || stmt instanceof Stmt.For
                    || stmt instanceof Stmt.While || stmt instanceof Stmt.With || stmt instanceof Stmt.Try) {
                return i;
            }
            Expr value = valueOf(stmt);
            if (value instanceof Expr.Await || StatementShape.runnerCall(value) != null) {
                return i;
            }
        }
        return block.size();
    }

    private static boolean isHistoryExtend(Stmt stmt, String resultVariable) {
        if (!(stmt instanceof Stmt.ExprStmt exprStmt) || !(exprStmt.value() instanceof Expr.Call call)) {
            return false;
        }
        if (!(HISTORY + ".extend").equals(ScriptExpressions.dottedName(call.func())) || call.args().size() != 1) {
            return false;
        }
        List<Expr.Comprehension> generators;
        if (call.args().get(0) instanceof Expr.ListComp comp) {
            generators = comp.generators();
        } else if (call.args().get(0) instanceof Expr.GeneratorExp gen) {
            generators = gen.generators();
        } else {
            return false;
        }
        return generators.size() == 1
                && (resultVariable + ".new_items").equals(ScriptExpressions.dottedName(generators.get(0).iter()));
    }

    private static Expr valueOf(Stmt stmt) {
        if (stmt instanceof Stmt.ExprStmt exprStmt) {
            return exprStmt.value();
        }
        if (stmt instanceof Stmt.Assign assign) {
            return assign.value();
        }
        if (stmt instanceof Stmt.AnnAssign annAssign) {
            return annAssign.value();
        }
        if (stmt instanceof Stmt.AugAssign augAssign) {
            return augAssign.value();
        }
        return null;
    }
}
