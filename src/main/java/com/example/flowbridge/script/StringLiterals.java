package com.example.flowbridge.script;

import com.example.flowbridge.errors.ScriptParseException;
import org.antlr.v4.runtime.Token;

import java.util.List;
import java.util.Locale;

/**
 * Decodes STRING tokens and joins adjacent literals into a single {@link Expr}.
 */
final class StringLiterals {

    private StringLiterals() {
    }

    /** One decoded literal: its lower-cased prefix and its value with escapes applied. */
    record Literal(String prefix, String value) {

        boolean isFormatted() {
            return prefix.indexOf('f') >= 0;
        }

        boolean isBytes() {
            return prefix.indexOf('b') >= 0;
        }
    }

    static Expr join(List<Token> tokens) {
        List<Literal> parts = tokens.stream().map(StringLiterals::decode).toList();
        boolean formatted = parts.stream().anyMatch(Literal::isFormatted);
        boolean bytes = parts.stream().anyMatch(Literal::isBytes);
        if (bytes && parts.stream().anyMatch(p -> !p.isBytes())) {
            Token first = tokens.get(0);
            throw new ScriptParseException("cannot mix bytes and nonbytes literals", first.getLine(), first.getCharPositionInLine() + 1);
        }
        StringBuilder value = new StringBuilder();
        boolean interpolated = false;
        for (Literal part : parts) {
            if (!formatted) {
                value.append(part.value());
            } else if (part.isFormatted()) {
                value.append(part.value());
                interpolated |= hasReplacementField(part.value());
            } else {
                value.append(part.value().replace("{", "{{").replace("}", "}}"));
            }
        }
        if (formatted) {
            return new Expr.FStr(value.toString(), interpolated);
        }
        return bytes ? new Expr.Bytes(value.toString()) : new Expr.Str(value.toString());
    }

    static Literal decode(Token token) {
        String text = token.getText();
        int quote = 0;
        while (text.charAt(quote) != '\'' && text.charAt(quote) != '"') {
            quote++;
        }
        String prefix = text.substring(0, quote).toLowerCase(Locale.ROOT);
        int delimiter = text.startsWith(text.substring(quote, quote + 1).repeat(3), quote) && text.length() - quote >= 6 ? 3 : 1;
        String body = text.substring(quote + delimiter, text.length() - delimiter)
                .replace("\r\n", "\n")
                .replace('\r', '\n');
        if (prefix.indexOf('r') >= 0) {
            return new Literal(prefix, body);
        }
        return new Literal(prefix, decodeEscapes(body, prefix.indexOf('b') >= 0, token.getLine(), token.getCharPositionInLine() + 1));
    }

    static String decodeEscapes(String raw, boolean bytes, int line, int column) {
        StringBuilder out = new StringBuilder(raw.length());
        int i = 0;
        while (i < raw.length()) {
            char c = raw.charAt(i);
            if (c != '\\' || i + 1 >= raw.length()) {
                out.append(c);
                i++;
                continue;
            }
            char n = raw.charAt(i + 1);
            i += 2;
            switch (n) {
                case '\n' -> { }
                case '\\' -> out.append('\\');
                case '\'' -> out.append('\'');
                case '"' -> out.append('"');
                case 'a' -> out.append('\u0007');
                case 'b' -> out.append('\b');
                case 'f' -> out.append('\f');
                case 'n' -> out.append('\n');
                case 'r' -> out.append('\r');
                case 't' -> out.append('\t');
                case 'v' -> out.append('\u000B');
                case 'x' -> {
                    out.appendCodePoint(parseHex(raw, i, 2, line, column));
                    i += 2;
                }
                case 'u', 'U' -> {
                    if (bytes) {
                        out.append('\\').append(n);
                    } else {
                        int digits = n == 'u' ? 4 : 8;
                        out.appendCodePoint(parseHex(raw, i, digits, line, column));
                        i += digits;
                    }
                }
                default -> {
                    if (n >= '0' && n <= '7') {
                        int end = i - 1;
                        while (end < raw.length() && end < i + 2 && raw.charAt(end) >= '0' && raw.charAt(end) <= '7') {
                            end++;
                        }
                        out.appendCodePoint(Integer.parseInt(raw.substring(i - 1, end), 8));
                        i = end;
                    } else {
                        out.append('\\').append(n);
                    }
                }
            }
        }
        return out.toString();
    }

    private static int parseHex(String raw, int start, int digits, int line, int column) {
        if (start + digits > raw.length()) {
            throw new ScriptParseException("truncated \\x, \\u or \\U escape", line, column);
        }
        try {
            return Integer.parseInt(raw.substring(start, start + digits), 16);
        } catch (NumberFormatException e) {
            throw new ScriptParseException("invalid hexadecimal escape", line, column);
        }
    }

    private static boolean hasReplacementField(String template) {
        for (int i = 0; i < template.length(); i++) {
            char c = template.charAt(i);
            if (c == '{' || c == '}') {
                if (i + 1 < template.length() && template.charAt(i + 1) == c) {
                    i++;
                    continue;
                }
                return true;
            }
        }
        return false;
    }
}
