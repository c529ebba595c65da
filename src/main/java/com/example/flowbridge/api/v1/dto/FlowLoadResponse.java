package com.example.flowbridge.api.v1.dto;

public record FlowLoadResponse(String source) {}
