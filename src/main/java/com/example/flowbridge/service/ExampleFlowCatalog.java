package com.example.flowbridge.service;

import com.example.flowbridge.api.ExampleFlowNotFoundException;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Example workflow scripts by name, filled at startup by
 * {@link com.example.flowbridge.config.ExampleFlowsLoader}.
 */
@Service
@Slf4j
public class ExampleFlowCatalog {

    private final Map<String, String> sources = new ConcurrentHashMap<>();

    public void register(String name, String source) {
        if (sources.put(name, source) != null) {
            log.info("Replaced example flow: {}", name);
        }
    }

    public List<String> names() {
        return sources.keySet().stream().sorted().toList();
    }

    public String source(String name) {
        String source = sources.get(name);
        if (source == null) {
            throw new ExampleFlowNotFoundException(name);
        }
        return source;
    }
}
