package com.example.flowbridge.api.v1.dto;

/**
 * A bundled example script and its exported Agent Spec YAML.
 */
public record ExampleFlowResponse(String name, String source, String document) {}
