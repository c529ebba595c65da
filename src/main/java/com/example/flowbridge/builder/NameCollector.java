package com.example.flowbridge.builder;

import com.example.flowbridge.script.Expr;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects the variable names an expression reads, in source order.
 */
final class NameCollector {

    private NameCollector() {
    }

    static Set<String> namesIn(Expr expr) {
        Set<String> names = new LinkedHashSet<>();
        collect(expr, names);
        return names;
    }

    private static void collect(Expr expr, Set<String> names) {
        if (expr == null) {
            return;
        }
        if (expr instanceof Expr.Name name) {
            names.add(name.id());
        } else if (expr instanceof Expr.Attribute attribute) {
            collect(attribute.value(), names);
        } else if (expr instanceof Expr.Subscript subscript) {
            collect(subscript.value(), names);
            collect(subscript.index(), names);
        } else if (expr instanceof Expr.Slice slice) {
            collect(slice.lower(), names);
            collect(slice.upper(), names);
            collect(slice.step(), names);
        } else if (expr instanceof Expr.Call call) {
            collect(call.func(), names);
            call.args().forEach(a -> collect(a, names));
            call.keywords().forEach(k -> collect(k.value(), names));
        } else if (expr instanceof Expr.Starred starred) {
            collect(starred.value(), names);
        } else if (expr instanceof Expr.BinOp bin) {
            collect(bin.left(), names);
            collect(bin.right(), names);
        } else if (expr instanceof Expr.UnaryOp unary) {
            collect(unary.operand(), names);
        } else if (expr instanceof Expr.BoolOp bool) {
            bool.values().forEach(v -> collect(v, names));
        } else if (expr instanceof Expr.Compare compare) {
            collect(compare.left(), names);
            compare.comparators().forEach(c -> collect(c, names));
        } else if (expr instanceof Expr.IfExp ifExp) {
            collect(ifExp.test(), names);
            collect(ifExp.body(), names);
            collect(ifExp.orElse(), names);
        } else if (expr instanceof Expr.Await await) {
            collect(await.value(), names);
        } else if (expr instanceof Expr.NamedExpr named) {
            collect(named.value(), names);
        } else if (expr instanceof Expr.ListExpr list) {
            list.elements().forEach(e -> collect(e, names));
        } else if (expr instanceof Expr.TupleExpr tuple) {
            tuple.elements().forEach(e -> collect(e, names));
        } else if (expr instanceof Expr.SetExpr set) {
            set.elements().forEach(e -> collect(e, names));
        } else if (expr instanceof Expr.DictExpr dict) {
            for (Expr.DictEntry entry : dict.entries()) {
                collect(entry.key(), names);
                collect(entry.value(), names);
            }
        } else if (expr instanceof Expr.ListComp comp) {
            collect(comp.element(), names);
            comp.generators().forEach(g -> collect(g.iter(), names));
        } else if (expr instanceof Expr.SetComp comp) {
            collect(comp.element(), names);
            comp.generators().forEach(g -> collect(g.iter(), names));
        } else if (expr instanceof Expr.GeneratorExp comp) {
            collect(comp.element(), names);
            comp.generators().forEach(g -> collect(g.iter(), names));
        } else if (expr instanceof Expr.DictComp comp) {
            collect(comp.key(), names);
            collect(comp.value(), names);
            comp.generators().forEach(g -> collect(g.iter(), names));
        }
    }
}
