package com.example.flowbridge.api.v1.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request body for POST /api/v1/flows/export. Omitted options fall back to the configured defaults.
 */
public record FlowExportRequest(
        @NotBlank String source,
        Boolean strict,
        String rulepackVersion,
        String format
) {}
