package com.example.flowbridge.scan;

import com.example.flowbridge.ir.IoField;

import java.util.List;
import java.util.Objects;

/**
 * Schema of one field of a structured-output record: a JSON schema type and optional enum values.
 */
public record FieldSchema(String type, List<Object> enumValues) {

    public FieldSchema {
        Objects.requireNonNull(type, "type");
        enumValues = enumValues != null ? List.copyOf(enumValues) : List.of();
    }

    public static FieldSchema of(String type) {
        return new FieldSchema(type, List.of());
    }

    public IoField toIoField(String title) {
        return new IoField(title, type, enumValues);
    }
}
