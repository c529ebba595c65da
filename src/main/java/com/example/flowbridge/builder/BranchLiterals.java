package com.example.flowbridge.builder;

import com.example.flowbridge.scan.ScriptExpressions;
import com.example.flowbridge.script.Expr;

/**
 * Reads the literal side of {@code lhs == literal} ladder tests.
 */
final class BranchLiterals {

    private BranchLiterals() {
    }

    /**
     * The compared literal as mapping text: strings as is, {@code True}/{@code False} as {@code "true"}/{@code "false"},
     * numbers as written. Null when the test is not a single {@code ==} against a literal.
     */
    static String equalityLiteral(Expr test) {
        if (!(test instanceof Expr.Compare compare) || compare.ops().size() != 1 || !"==".equals(compare.ops().get(0))) {
            return null;
        }
        return literalText(compare.comparators().get(0));
    }

    /** Left-hand side of a single equality test; null for any other test. */
    static Expr equalityOperand(Expr test) {
        if (test instanceof Expr.Compare compare && compare.ops().size() == 1 && "==".equals(compare.ops().get(0))) {
            return compare.left();
        }
        return null;
    }

    private static String literalText(Expr expr) {
        String s = ScriptExpressions.constString(expr);
        if (s != null) {
            return s;
        }
        if (expr instanceof Expr.Bool bool) {
            return bool.value() ? "true" : "false";
        }
        if (expr instanceof Expr.Num num) {
            return num.text();
        }
        if (expr instanceof Expr.UnaryOp unary && "-".equals(unary.op()) && unary.operand() instanceof Expr.Num num) {
            return "-" + num.text();
        }
        return null;
    }
}
