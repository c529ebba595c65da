package com.example.flowbridge.config;

import com.example.flowbridge.agentspec.AgentSpecDeserializer;
import com.example.flowbridge.agentspec.AgentSpecSerializer;
import com.example.flowbridge.rulepack.RulePack;
import com.example.flowbridge.rulepack.RulePackRegistry;
import com.example.flowbridge.rulepack.SdkVersionProvider;
import com.example.flowbridge.rulepack.V0RulePack;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import tools.jackson.databind.json.JsonMapper;
import tools.jackson.dataformat.yaml.YAMLMapper;

import java.util.List;

@Configuration
public class FlowBridgeConfiguration {

    @Bean
    public AgentSpecSerializer agentSpecSerializer(YAMLMapper yamlMapper, JsonMapper jsonMapper) {
        return new AgentSpecSerializer(yamlMapper, jsonMapper);
    }

    @Bean
    public AgentSpecDeserializer agentSpecDeserializer(YAMLMapper yamlMapper, JsonMapper jsonMapper) {
        return new AgentSpecDeserializer(yamlMapper, jsonMapper);
    }

    @Bean
    public V0RulePack v0RulePack(AgentSpecSerializer serializer, AgentSpecDeserializer deserializer) {
        return new V0RulePack(serializer, deserializer);
    }

    @Bean
    public SdkVersionProvider sdkVersionProvider(@Value("${flow-bridge.host-sdk-version:0.3.3}") String hostSdkVersion) {
        return SdkVersionProvider.fixed(hostSdkVersion);
    }

    @Bean
    public RulePackRegistry rulePackRegistry(SdkVersionProvider sdkVersionProvider, List<RulePack> rulePacks) {
        RulePackRegistry registry = new RulePackRegistry(sdkVersionProvider);
        rulePacks.forEach(registry::register);
        return registry;
    }
}
