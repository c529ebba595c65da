package com.example.flowbridge.codegen;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders Java values as Python source literals.
 */
final class PythonLiterals {

    static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue",
            "def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in",
            "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield",
            "match", "case");

    private PythonLiterals() {
    }

    /** Double-quoted single-line string literal. */
    static String string(String value) {
        return "\"" + escape(value, true) + "\"";
    }

    /** Triple-quoted literal for multi-line text; a plain literal otherwise. */
    static String text(String value) {
        if (value == null || value.indexOf('\n') < 0) {
            return string(value != null ? value : "");
        }
        return "\"\"\"" + escape(value, false) + "\"\"\"";
    }

    /** Strings, booleans, numbers and null. */
    static String literal(Object value) {
        if (value == null) {
            return "None";
        }
        if (value instanceof String s) {
            return string(s);
        }
        if (value instanceof Boolean b) {
            return b ? "True" : "False";
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return "float(" + string(Double.toString(d).toLowerCase()) + ")";
            }
            return Double.toString(d);
        }
        return String.valueOf(value);
    }

    static String literalList(List<Object> values) {
        return values.stream().map(PythonLiterals::literal).collect(Collectors.joining(", "));
    }

    private static String escape(String value, boolean escapeNewlines) {
        StringBuilder out = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '"' -> out.append("\\\"");
                case '\n' -> out.append(escapeNewlines ? "\\n" : "\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        out.append(String.format("\\x%02x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        return out.toString();
    }
}
