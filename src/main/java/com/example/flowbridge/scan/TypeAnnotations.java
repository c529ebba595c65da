package com.example.flowbridge.scan;

import com.example.flowbridge.script.Expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps Python type annotations to JSON schema types.
 * <p>
 * {@code str}, {@code int}, {@code float} and {@code bool} map to their schema types, list forms to
 * {@code array}, dict forms and other classes to {@code object}, and {@code Literal[...]} to an enum whose
 * base type is inferred from the literal kinds. {@code Optional[X]} and {@code X | None} read as {@code X}.
 * </p>
 */
public final class TypeAnnotations {

    private static final Map<String, String> SCALARS = Map.of(
            "str", "string",
            "string", "string",
            "int", "integer",
            "integer", "integer",
            "float", "number",
            "number", "number",
            "bool", "boolean",
            "dict", "object");

    private TypeAnnotations() {
    }

    /**
     * Scalar type of a tool parameter or return annotation; null when the annotation is absent or not encodable.
     */
    public static String scalarType(Expr annotation) {
        if (annotation == null) {
            return null;
        }
        Expr inner = unwrapOptional(annotation);
        String dotted = ScriptExpressions.dottedName(inner);
        if (dotted != null) {
            return SCALARS.get(dotted);
        }
        if (inner instanceof Expr.Subscript subscript && isList(subscript.value())) {
            return "array";
        }
        return null;
    }

    /** Field schema of a record field annotation; never null. */
    public static FieldSchema fieldSchema(Expr annotation) {
        Expr inner = unwrapOptional(annotation);
        if (inner instanceof Expr.Subscript subscript) {
            if (ScriptExpressions.isNamed(subscript.value(), "Literal")) {
                return literalSchema(subscript.index());
            }
            if (isList(subscript.value())) {
                return FieldSchema.of("array");
            }
            return FieldSchema.of("object");
        }
        String dotted = ScriptExpressions.dottedName(inner);
        if (dotted != null) {
            String scalar = SCALARS.get(dotted);
            if (scalar != null) {
                return FieldSchema.of(scalar);
            }
            if (isList(inner)) {
                return FieldSchema.of("array");
            }
        }
        return FieldSchema.of("object");
    }

    private static FieldSchema literalSchema(Expr index) {
        List<Expr> elements = index instanceof Expr.TupleExpr tuple ? tuple.elements() : List.of(index);
        List<Object> values = new ArrayList<>();
        for (Expr element : elements) {
            Object value = ScriptExpressions.literalValue(element);
            if (value != null) {
                values.add(value);
            }
        }
        String base = "string";
        if (!values.isEmpty()) {
            if (values.stream().allMatch(v -> v instanceof Boolean)) {
                base = "boolean";
            } else if (values.stream().allMatch(v -> v instanceof Integer || v instanceof Long)) {
                base = "integer";
            } else if (values.stream().allMatch(v -> v instanceof Number)) {
                base = "number";
            }
        }
        return new FieldSchema(base, values);
    }

    private static Expr unwrapOptional(Expr annotation) {
        if (annotation instanceof Expr.Subscript subscript && ScriptExpressions.isNamed(subscript.value(), "Optional")) {
            return unwrapOptional(subscript.index());
        }
        if (annotation instanceof Expr.BinOp bin && "|".equals(bin.op())) {
            if (bin.right() instanceof Expr.NoneLiteral) {
                return unwrapOptional(bin.left());
            }
            if (bin.left() instanceof Expr.NoneLiteral) {
                return unwrapOptional(bin.right());
            }
        }
        if (annotation instanceof Expr.Str str) {
            return new Expr.Name(str.value());
        }
        return annotation;
    }

    private static boolean isList(Expr expr) {
        String dotted = ScriptExpressions.dottedName(expr);
        return dotted != null && (dotted.equals("list") || dotted.equals("List") || dotted.equals("typing.List")
                || dotted.equals("Sequence") || dotted.equals("typing.Sequence"));
    }
}
