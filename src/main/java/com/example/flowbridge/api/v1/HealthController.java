package com.example.flowbridge.api.v1;

import com.example.flowbridge.api.v1.dto.RulePackListResponse;
import com.example.flowbridge.service.FlowConversionService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health check endpoint.
 * <p>
 * GET /api/v1/health returns 200 with the service name and the rule pack a request without a version hint
 * resolves to. Status is {@code DEGRADED} when no registered pack matches the host SDK version, since such
 * requests then fail until a version is passed.
 * </p>
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final FlowConversionService service;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        RulePackListResponse rulePacks = service.rulePacks();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", rulePacks.defaultVersion() != null ? "UP" : "DEGRADED");
        body.put("service", "flow-bridge");
        body.put("rulePack", rulePacks.defaultVersion());
        log.trace("Health check status={} rulePack={}", body.get("status"), rulePacks.defaultVersion());
        return ResponseEntity.ok(body);
    }
}
