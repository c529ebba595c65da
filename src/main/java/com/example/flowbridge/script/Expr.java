package com.example.flowbridge.script;

import java.util.List;
import java.util.Locale;

/**
 * Expression nodes of the parsed script.
 */
public sealed interface Expr {

    record Name(String id) implements Expr {
    }

    record Str(String value) implements Expr {
    }

    /** An f-string kept as its template text; {@code interpolated} is false when it holds no replacement fields. */
    record FStr(String template, boolean interpolated) implements Expr {

        /** Template text with doubled braces collapsed, meaningful only when not interpolated. */
        public String constantValue() {
            return template.replace("{{", "{").replace("}}", "}");
        }
    }

    record Bytes(String value) implements Expr {
    }

    record Num(String text) implements Expr {

        public boolean isInteger() {
            String t = text.toLowerCase(Locale.ROOT);
            if (t.startsWith("0x") || t.startsWith("0o") || t.startsWith("0b")) {
                return true;
            }
            return !(t.contains(".") || t.contains("e") || t.endsWith("j"));
        }
    }

    record Bool(boolean value) implements Expr {
    }

    record NoneLiteral() implements Expr {
    }

    record EllipsisLiteral() implements Expr {
    }

    record Attribute(Expr value, String attr) implements Expr {
    }

    record Subscript(Expr value, Expr index) implements Expr {
    }

    record Slice(Expr lower, Expr upper, Expr step) implements Expr {
    }

    /** Positional arguments (including {@link Starred}) and keyword arguments ({@code name == null} for {@code **}). */
    record Call(Expr func, List<Expr> args, List<Keyword> keywords) implements Expr {

        public Expr keyword(String name) {
            return keywords.stream()
                    .filter(k -> name.equals(k.name()))
                    .map(Keyword::value)
                    .findFirst()
                    .orElse(null);
        }
    }

    record Keyword(String name, Expr value) {
    }

    record Starred(Expr value) implements Expr {
    }

    record BinOp(Expr left, String op, Expr right) implements Expr {
    }

    record UnaryOp(String op, Expr operand) implements Expr {
    }

    record BoolOp(String op, List<Expr> values) implements Expr {
    }

    record Compare(Expr left, List<String> ops, List<Expr> comparators) implements Expr {
    }

    record IfExp(Expr test, Expr body, Expr orElse) implements Expr {
    }

    record Lambda(List<Param> params, Expr body) implements Expr {
    }

    record Await(Expr value) implements Expr {
    }

    record Yield(Expr value, boolean delegating) implements Expr {
    }

    record NamedExpr(Expr target, Expr value) implements Expr {
    }

    record ListExpr(List<Expr> elements) implements Expr {
    }

    record TupleExpr(List<Expr> elements) implements Expr {
    }

    record SetExpr(List<Expr> elements) implements Expr {
    }

    /** Dict display; an entry with a null key is a {@code **mapping} unpacking. */
    record DictExpr(List<DictEntry> entries) implements Expr {
    }

    record DictEntry(Expr key, Expr value) {
    }

    record Comprehension(Expr target, Expr iter, List<Expr> conditions, boolean async) {
    }

    record ListComp(Expr element, List<Comprehension> generators) implements Expr {
    }

    record SetComp(Expr element, List<Comprehension> generators) implements Expr {
    }

    record GeneratorExp(Expr element, List<Comprehension> generators) implements Expr {
    }

    record DictComp(Expr key, Expr value, List<Comprehension> generators) implements Expr {
    }
}
