package com.example.flowbridge.service;

import com.example.flowbridge.agentspec.AgentSpecDeserializer;
import com.example.flowbridge.agentspec.AgentSpecSerializer;
import com.example.flowbridge.agentspec.DocumentFormat;
import com.example.flowbridge.agentspec.Flow;
import com.example.flowbridge.api.v1.dto.FlowExportRequest;
import com.example.flowbridge.api.v1.dto.FlowExportResponse;
import com.example.flowbridge.api.v1.dto.FlowIrRequest;
import com.example.flowbridge.api.v1.dto.FlowLoadRequest;
import com.example.flowbridge.api.v1.dto.FlowLoadResponse;
import com.example.flowbridge.api.v1.dto.RulePackListResponse;
import com.example.flowbridge.ir.IrFlow;
import com.example.flowbridge.rulepack.RulePack;
import com.example.flowbridge.rulepack.RulePackRegistry;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Application service for the export and load use cases.
 * <p>
 * Export: script source → rule pack parse → IR → Agent Spec flow → YAML or JSON document.
 * Load: document → Agent Spec flow → IR → generated script. The rule pack is resolved per request.
 * </p>
 */
@Service
@Slf4j
public class FlowConversionService {

    private final RulePackRegistry registry;
    private final AgentSpecSerializer serializer;
    private final AgentSpecDeserializer deserializer;
    private final boolean strictDefault;
    private final DocumentFormat defaultFormat;

    public FlowConversionService(
            RulePackRegistry registry,
            AgentSpecSerializer serializer,
            AgentSpecDeserializer deserializer,
            @Value("${flow-bridge.strict-default:true}") boolean strictDefault,
            @Value("${flow-bridge.default-format:yaml}") String defaultFormat) {
        this.registry = registry;
        this.serializer = serializer;
        this.deserializer = deserializer;
        this.strictDefault = strictDefault;
        this.defaultFormat = DocumentFormat.fromName(defaultFormat);
    }

    public FlowExportResponse export(FlowExportRequest request) {
        boolean strict = request.strict() != null ? request.strict() : strictDefault;
        DocumentFormat format = formatOf(request.format());
        RulePack pack = registry.resolve(request.rulepackVersion());
        log.debug("Exporting script with rulepack={} strict={} format={}", pack.version(), strict, format.wireName());
        IrFlow ir = pack.parse(request.source(), strict);
        Flow flow = pack.toAgentSpec(ir, strict);
        return new FlowExportResponse(format.wireName(), serializer.write(flow, format));
    }

    public FlowLoadResponse load(FlowLoadRequest request) {
        DocumentFormat format = formatOf(request.format());
        RulePack pack = registry.resolve(request.rulepackVersion());
        log.debug("Loading {} document with rulepack={}", format.wireName(), pack.version());
        Flow flow = deserializer.readFlow(request.document(), format);
        IrFlow ir = pack.toIr(flow, strictDefault);
        return new FlowLoadResponse(pack.generate(ir));
    }

    public IrFlow toIr(FlowIrRequest request) {
        boolean strict = request.strict() != null ? request.strict() : strictDefault;
        RulePack pack = registry.resolve(request.rulepackVersion());
        log.debug("Building IR with rulepack={} strict={}", pack.version(), strict);
        return pack.parse(request.source(), strict);
    }

    public RulePackListResponse rulePacks() {
        return new RulePackListResponse(registry.versions(), registry.defaultVersion().orElse(null));
    }

    private DocumentFormat formatOf(String name) {
        return name == null || name.isBlank() ? defaultFormat : DocumentFormat.fromName(name);
    }
}
