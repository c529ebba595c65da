package com.example.flowbridge.api.v1.dto;

/**
 * Agent Spec document exported from a workflow script.
 */
public record FlowExportResponse(String format, String document) {}
