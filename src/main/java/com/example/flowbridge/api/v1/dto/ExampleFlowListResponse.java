package com.example.flowbridge.api.v1.dto;

import java.util.List;

/**
 * Response for GET /api/v1/flows/examples: names of the bundled example scripts.
 */
public record ExampleFlowListResponse(List<String> examples) {}
