package com.example.flowbridge.api.v1.dto;

import java.util.List;

/**
 * Response for GET /api/v1/rulepacks: registered versions and the one picked without a hint (null when
 * the host SDK version is unknown or unregistered).
 */
public record RulePackListResponse(List<String> versions, String defaultVersion) {}
