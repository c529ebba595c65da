package com.example.flowbridge.api;

import lombok.Getter;

/**
 * Thrown when no bundled example script has the requested name.
 * <p>
 * Mapped to HTTP 404 by {@link GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class ExampleFlowNotFoundException extends RuntimeException {

    private final String exampleName;

    public ExampleFlowNotFoundException(String exampleName) {
        super("Example flow not found: " + exampleName);
        this.exampleName = exampleName;
    }
}
