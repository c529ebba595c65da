package com.example.flowbridge.naming;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.zip.CRC32;

/**
 * Identifier helpers shared by the builder and the code generator.
 */
public final class Naming {

    private Naming() {
    }

    /**
     * Lower snake_case identifier: runs of non-alphanumerics become one underscore, leading and trailing
     * underscores are dropped. Blank input gives {@code agent}; a leading digit gets an {@code a_} prefix.
     */
    public static String snakeCase(String name) {
        String s = name != null ? name.strip() : "";
        s = s.replaceAll("[^0-9A-Za-z]+", "_").toLowerCase(Locale.ROOT);
        s = stripUnderscores(s);
        if (s.isEmpty()) {
            s = "agent";
        }
        if (Character.isDigit(s.charAt(0))) {
            s = "a_" + s;
        }
        return s;
    }

    /** PascalCase class name with a {@code Schema} suffix, e.g. {@code "Router agent"} → {@code RouterAgentSchema}. */
    public static String schemaClassName(String displayName) {
        String base = displayName != null ? displayName.replaceAll("[^0-9A-Za-z]+", " ").strip() : "";
        String joined = Arrays.stream(base.split(" "))
                .filter(p -> !p.isEmpty())
                .map(p -> Character.toUpperCase(p.charAt(0)) + p.substring(1).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining());
        String name = (joined.isEmpty() ? "Agent" : joined) + "Schema";
        return Character.isDigit(name.charAt(0)) ? "A" + name : name;
    }

    /** Eight lowercase hex digits of the CRC32 of the seed's UTF-8 bytes. */
    public static String stableId(String seed) {
        CRC32 crc = new CRC32();
        crc.update(seed.getBytes(StandardCharsets.UTF_8));
        return String.format("%08x", crc.getValue());
    }

    private static String stripUnderscores(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '_') {
            start++;
        }
        while (end > start && s.charAt(end - 1) == '_') {
            end--;
        }
        return s.substring(start, end);
    }
}
