package com.example.flowbridge.api.v1.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request body for POST /api/v1/flows/ir.
 */
public record FlowIrRequest(
        @NotBlank String source,
        Boolean strict,
        String rulepackVersion
) {}
