package com.example.flowbridge.rulepack;

import com.example.flowbridge.agentspec.AgentSpecDeserializer;
import com.example.flowbridge.agentspec.AgentSpecSerializer;
import com.example.flowbridge.agentspec.Flow;
import com.example.flowbridge.builder.AgentSnippetFactory;
import com.example.flowbridge.builder.ControlFlowGraphBuilder;
import com.example.flowbridge.codegen.PythonFlowGenerator;
import com.example.flowbridge.convert.IrAgentSpecConverter;
import com.example.flowbridge.ir.IrFlow;
import com.example.flowbridge.scan.ModuleScanner;
import com.example.flowbridge.scan.ScanFacts;

/**
 * Rule pack for the 0.3.3 SDK idiom: module scanner, graph builder, schema converter and generator.
 */
public class V0RulePack implements RulePack {

    public static final String VERSION = "0.3.3";

    private final ControlFlowGraphBuilder builder;
    private final IrAgentSpecConverter converter;
    private final PythonFlowGenerator generator;

    public V0RulePack(AgentSpecSerializer serializer, AgentSpecDeserializer deserializer) {
        this.builder = new ControlFlowGraphBuilder(new AgentSnippetFactory(serializer));
        this.converter = new IrAgentSpecConverter(serializer, deserializer);
        this.generator = new PythonFlowGenerator(deserializer);
    }

    @Override
    public String version() {
        return VERSION;
    }

    @Override
    public IrFlow parse(String source, boolean strict) {
        ScanFacts facts = new ModuleScanner(strict).scan(source);
        return builder.build(facts, strict);
    }

    @Override
    public Flow toAgentSpec(IrFlow ir, boolean strict) {
        return converter.toAgentSpec(ir, strict);
    }

    @Override
    public IrFlow toIr(Flow flow, boolean strict) {
        return converter.toIr(flow, strict);
    }

    @Override
    public String generate(IrFlow ir) {
        return generator.generate(ir);
    }
}
