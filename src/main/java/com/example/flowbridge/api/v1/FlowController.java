package com.example.flowbridge.api.v1;

import com.example.flowbridge.api.v1.dto.ExampleFlowListResponse;
import com.example.flowbridge.api.v1.dto.ExampleFlowResponse;
import com.example.flowbridge.api.v1.dto.FlowExportRequest;
import com.example.flowbridge.api.v1.dto.FlowExportResponse;
import com.example.flowbridge.api.v1.dto.FlowIrRequest;
import com.example.flowbridge.api.v1.dto.FlowLoadRequest;
import com.example.flowbridge.api.v1.dto.FlowLoadResponse;
import com.example.flowbridge.ir.IrFlow;
import com.example.flowbridge.service.ExampleFlowCatalog;
import com.example.flowbridge.service.FlowConversionService;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for flow conversion.
 * <p>
 * Exposes {@code /api/v1/flows} for export (script → Agent Spec document), load (document → script),
 * the intermediate graph of a script, and the bundled example scripts. Request bodies are validated
 * with {@code @Valid}.
 * </p>
 */
@RestController
@RequestMapping("/api/v1/flows")
@RequiredArgsConstructor
@Slf4j
public class FlowController {

    private final FlowConversionService service;
    private final ExampleFlowCatalog examples;

    @PostMapping("/export")
    public ResponseEntity<FlowExportResponse> export(@Valid @RequestBody FlowExportRequest request) {
        log.info("Exporting flow strict={} rulepackVersion={} format={} sourceLength={}",
                request.strict(), request.rulepackVersion(), request.format(), request.source().length());
        return ResponseEntity.ok(service.export(request));
    }

    @PostMapping("/load")
    public ResponseEntity<FlowLoadResponse> load(@Valid @RequestBody FlowLoadRequest request) {
        log.info("Loading flow format={} rulepackVersion={} documentLength={}",
                request.format(), request.rulepackVersion(), request.document().length());
        return ResponseEntity.ok(service.load(request));
    }

    @PostMapping("/ir")
    public ResponseEntity<IrFlow> ir(@Valid @RequestBody FlowIrRequest request) {
        log.info("Building IR strict={} rulepackVersion={}", request.strict(), request.rulepackVersion());
        return ResponseEntity.ok(service.toIr(request));
    }

    @GetMapping("/examples")
    public ResponseEntity<ExampleFlowListResponse> examples() {
        log.debug("Listing example flows");
        return ResponseEntity.ok(new ExampleFlowListResponse(examples.names()));
    }

    @GetMapping("/examples/{name}")
    public ResponseEntity<ExampleFlowResponse> example(@PathVariable String name) {
        log.info("Getting example flow name={}", name);
        String source = examples.source(name);
        FlowExportResponse exported = service.export(new FlowExportRequest(source, null, null, "yaml"));
        return ResponseEntity.ok(new ExampleFlowResponse(name, source, exported.document()));
    }
}
