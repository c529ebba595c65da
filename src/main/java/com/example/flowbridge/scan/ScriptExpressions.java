package com.example.flowbridge.scan;

import com.example.flowbridge.script.Expr;

import java.util.Locale;

/**
 * Static readers for the literal and name shapes the scanner and builder recognize.
 */
public final class ScriptExpressions {

    private ScriptExpressions() {
    }

    /** {@code a.b.c} for a chain of attributes on a name; null for anything else. */
    public static String dottedName(Expr expr) {
        if (expr instanceof Expr.Name name) {
            return name.id();
        }
        if (expr instanceof Expr.Attribute attribute) {
            String left = dottedName(attribute.value());
            return left != null ? left + "." + attribute.attr() : null;
        }
        return null;
    }

    /** True when the dotted name equals {@code simpleName} or ends with {@code .simpleName}. */
    public static boolean isNamed(Expr expr, String simpleName) {
        String dotted = dottedName(expr);
        return dotted != null && (dotted.equals(simpleName) || dotted.endsWith("." + simpleName));
    }

    /**
     * Value of a constant string: a literal (adjacent literals are already merged), an f-string without
     * replacement fields, or a {@code +} concatenation of those. Null when the expression is not constant.
     */
    public static String constString(Expr expr) {
        if (expr instanceof Expr.Str str) {
            return str.value();
        }
        if (expr instanceof Expr.FStr fstr && !fstr.interpolated()) {
            return fstr.constantValue();
        }
        if (expr instanceof Expr.BinOp bin && "+".equals(bin.op())) {
            String left = constString(bin.left());
            String right = constString(bin.right());
            return left != null && right != null ? left + right : null;
        }
        return null;
    }

    /** A numeric literal (optionally negated) as Integer, Long or Double; null otherwise. */
    public static Number number(Expr expr) {
        if (expr instanceof Expr.UnaryOp unary && ("-".equals(unary.op()) || "+".equals(unary.op()))) {
            Number inner = number(unary.operand());
            if (inner == null || "+".equals(unary.op())) {
                return inner;
            }
            if (inner instanceof Integer i) {
                return -i;
            }
            if (inner instanceof Long l) {
                return -l;
            }
            return -inner.doubleValue();
        }
        if (!(expr instanceof Expr.Num num)) {
            return null;
        }
        String text = num.text().replace("_", "").toLowerCase(Locale.ROOT);
        if (text.endsWith("j")) {
            return null;
        }
        try {
            if (num.isInteger()) {
                long value;
                if (text.startsWith("0x")) {
                    value = Long.parseLong(text.substring(2), 16);
                } else if (text.startsWith("0o")) {
                    value = Long.parseLong(text.substring(2), 8);
                } else if (text.startsWith("0b")) {
                    value = Long.parseLong(text.substring(2), 2);
                } else {
                    value = Long.parseLong(text);
                }
                return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE ? (Number) (int) value : (Number) value;
            }
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** String, number or boolean literal value; null for anything else. */
    public static Object literalValue(Expr expr) {
        String s = constString(expr);
        if (s != null) {
            return s;
        }
        if (expr instanceof Expr.Bool bool) {
            return bool.value();
        }
        return number(expr);
    }

    /** The JSON schema type name of a literal value. */
    public static String schemaTypeOf(Object literal) {
        if (literal instanceof Boolean) {
            return "boolean";
        }
        if (literal instanceof Integer || literal instanceof Long) {
            return "integer";
        }
        if (literal instanceof Number) {
            return "number";
        }
        return "string";
    }
}
