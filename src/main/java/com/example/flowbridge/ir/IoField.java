package com.example.flowbridge.ir;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * A named, typed input or output of a node. {@code type} is a JSON schema type name
 * ({@code string}, {@code integer}, {@code number}, {@code boolean}, {@code array}, {@code object}).
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record IoField(String title, String type, List<Object> enumValues) {

    public IoField {
        Objects.requireNonNull(title, "title");
        type = type != null ? type : "string";
        enumValues = enumValues != null ? List.copyOf(enumValues) : List.of();
    }

    public IoField(String title, String type) {
        this(title, type, List.of());
    }

    public boolean hasEnum() {
        return !enumValues.isEmpty();
    }
}
