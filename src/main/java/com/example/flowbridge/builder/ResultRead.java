package com.example.flowbridge.builder;

import com.example.flowbridge.scan.ScriptExpressions;
import com.example.flowbridge.script.Expr;

/**
 * A read of one named field from a variable: {@code v["k"]}, {@code v["output_parsed"]["k"]},
 * {@code v.final_output.k}, {@code v.final_output_as(str)} (field {@code output_text}) or
 * {@code workflow_input.k}.
 */
record ResultRead(String variable, String field) {

    static final String OUTPUT_TEXT = "output_text";

    /** Null when the expression is none of the recognized read shapes. */
    static ResultRead of(Expr expr) {
        if (expr instanceof Expr.Subscript subscript) {
            String key = ScriptExpressions.constString(subscript.index());
            Expr base = subscript.value();
            while (base instanceof Expr.Subscript inner) {
                base = inner.value();
            }
            if (key != null && base instanceof Expr.Name name) {
                return new ResultRead(name.id(), key);
            }
            return null;
        }
        if (expr instanceof Expr.Call call && call.func() instanceof Expr.Attribute attribute
                && "final_output_as".equals(attribute.attr()) && attribute.value() instanceof Expr.Name name) {
            return new ResultRead(name.id(), OUTPUT_TEXT);
        }
        if (expr instanceof Expr.Attribute attribute) {
            if (attribute.value() instanceof Expr.Attribute owner && "final_output".equals(owner.attr())
                    && owner.value() instanceof Expr.Name name) {
                return new ResultRead(name.id(), attribute.attr());
            }
            if (attribute.value() instanceof Expr.Name name && "workflow_input".equals(name.id())) {
                return new ResultRead(name.id(), attribute.attr());
            }
        }
        return null;
    }
}
