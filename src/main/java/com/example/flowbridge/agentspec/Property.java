package com.example.flowbridge.agentspec;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A typed input or output, serialized as a JSON schema object
 * ({@code title}, {@code type}, optional {@code enum}, {@code description}, {@code default}).
 */
public record Property(String title, String type, List<Object> enumValues, String description, Object defaultValue) {

    public Property {
        Objects.requireNonNull(title, "title");
        type = type != null ? type : "string";
        enumValues = enumValues != null ? List.copyOf(enumValues) : List.of();
    }

    public static Property of(String title, String type) {
        return new Property(title, type, List.of(), null, null);
    }

    public static Property of(String title, String type, List<Object> enumValues) {
        return new Property(title, type, enumValues, null, null);
    }

    public Map<String, Object> toJsonSchema() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("title", title);
        schema.put("type", type);
        if (!enumValues.isEmpty()) {
            schema.put("enum", enumValues);
        }
        if (description != null) {
            schema.put("description", description);
        }
        if (defaultValue != null) {
            schema.put("default", defaultValue);
        }
        return schema;
    }
}
