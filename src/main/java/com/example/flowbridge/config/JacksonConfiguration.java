package com.example.flowbridge.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import tools.jackson.databind.json.JsonMapper;
import tools.jackson.dataformat.yaml.YAMLMapper;

/**
 * Jackson 3 mappers used by the Agent Spec serializer and the example loader.
 */
@Configuration
public class JacksonConfiguration {

    @Bean
    public JsonMapper jsonMapper() {
        return JsonMapper.builder().build();
    }

    @Bean
    public YAMLMapper yamlMapper() {
        return YAMLMapper.builder().build();
    }
}
