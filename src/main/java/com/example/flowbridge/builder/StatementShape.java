package com.example.flowbridge.builder;

import com.example.flowbridge.errors.FlowErrorCode;
import com.example.flowbridge.errors.UnsupportedPatternException;
import com.example.flowbridge.scan.ScriptExpressions;
import com.example.flowbridge.script.Expr;
import com.example.flowbridge.script.Stmt;

import java.util.Map;

/**
 * The closed set of statement shapes the graph builder understands.
 */
sealed interface StatementShape {

    /** {@code result = await Runner.run(agent, input=...)}. */
    record SequentialCall(Stmt statement, Expr.Call call, String resultVariable) implements StatementShape {
    }

    /** {@code if lhs == literal: ... elif lhs == literal: ... else: ...}. */
    record LiteralLadder(Stmt.If statement) implements StatementShape {
    }

    /** {@code if approve(...):} or {@code if await approve(...):}. */
    record ApprovalGate(Stmt.If statement, String toolName) implements StatementShape {
    }

    record Return(Stmt.Return statement) implements StatementShape {
    }

    record Other(Stmt statement) implements StatementShape {
    }

    static StatementShape classify(Stmt stmt) {
        if (stmt instanceof Stmt.Return ret) {
            return new Return(ret);
        }
        if (stmt instanceof Stmt.If ifStmt) {
            return classifyIf(ifStmt);
        }
        if (stmt instanceof Stmt.Assign assign && assign.targets().size() == 1
                && assign.targets().get(0) instanceof Expr.Name target) {
            Expr.Call call = runnerCall(assign.value());
            if (call != null) {
                return new SequentialCall(stmt, call, target.id());
            }
        }
        if (stmt instanceof Stmt.AnnAssign annAssign && annAssign.target() instanceof Expr.Name target) {
            Expr.Call call = runnerCall(annAssign.value());
            if (call != null) {
                return new SequentialCall(stmt, call, target.id());
            }
        }
        return new Other(stmt);
    }

    /** The {@code Runner.run(...)} call of an expression, awaited or not; null for anything else. */
    static Expr.Call runnerCall(Expr value) {
        Expr inner = value instanceof Expr.Await await ? await.value() : value;
        if (inner instanceof Expr.Call call && "Runner.run".equals(ScriptExpressions.dottedName(call.func()))) {
            return call;
        }
        return null;
    }

    private static StatementShape classifyIf(Stmt.If ifStmt) {
        if (BranchLiterals.equalityLiteral(ifStmt.test()) != null) {
            return new LiteralLadder(ifStmt);
        }
        Expr test = ifStmt.test() instanceof Expr.Await await ? await.value() : ifStmt.test();
        if (test instanceof Expr.Call call && ScriptExpressions.dottedName(call.func()) != null) {
            if (ifStmt.elifClause() != null) {
                throw new UnsupportedPatternException(FlowErrorCode.UNSUPPORTED_BRANCH_CONDITION,
                        "elif is not supported after an approval test", Map.of("line", ifStmt.line()));
            }
            String dotted = ScriptExpressions.dottedName(call.func());
            return new ApprovalGate(ifStmt, dotted.substring(dotted.lastIndexOf('.') + 1));
        }
        throw new UnsupportedPatternException(FlowErrorCode.UNSUPPORTED_BRANCH_CONDITION,
                "If condition must be an equality against a literal or an approval call",
                Map.of("line", ifStmt.line()));
    }
}
