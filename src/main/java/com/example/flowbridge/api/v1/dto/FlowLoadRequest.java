package com.example.flowbridge.api.v1.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request body for POST /api/v1/flows/load.
 */
public record FlowLoadRequest(
        @NotBlank String document,
        String format,
        String rulepackVersion
) {}
