package com.example.flowbridge.api.v1;

import com.example.flowbridge.api.v1.dto.RulePackListResponse;
import com.example.flowbridge.service.FlowConversionService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller listing the registered rule packs.
 */
@RestController
@RequestMapping("/api/v1/rulepacks")
@RequiredArgsConstructor
@Slf4j
public class RulePackController {

    private final FlowConversionService service;

    @GetMapping
    public ResponseEntity<RulePackListResponse> list() {
        RulePackListResponse response = service.rulePacks();
        log.debug("Listing rule packs versions={} default={}", response.versions(), response.defaultVersion());
        return ResponseEntity.ok(response);
    }
}
