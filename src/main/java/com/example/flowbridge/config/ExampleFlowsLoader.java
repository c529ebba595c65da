package com.example.flowbridge.config;

import com.example.flowbridge.errors.FlowConversionException;
import com.example.flowbridge.rulepack.RulePackRegistry;
import com.example.flowbridge.service.ExampleFlowCatalog;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Loads the example workflow scripts from classpath resources into the {@link ExampleFlowCatalog} at startup.
 * Each script is parsed once with the default rule pack; scripts that fail are logged and left out.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExampleFlowsLoader implements ApplicationRunner {

    private static final String EXAMPLES_DIR = "examples/";
    private static final List<String> EXAMPLE_FILES = List.of(
            "router_math_flow.py",
            "support_triage_flow.py",
            "approval_gate_flow.py"
    );

    private final ExampleFlowCatalog catalog;
    private final RulePackRegistry registry;

    @Override
    public void run(ApplicationArguments args) {
        for (String filename : EXAMPLE_FILES) {
            loadExample(filename);
        }
    }

    private void loadExample(String filename) {
        String path = EXAMPLES_DIR + filename;
        Resource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            log.warn("Example flow resource not found: {}", path);
            return;
        }
        String name = filename.substring(0, filename.length() - ".py".length());
        try (InputStream in = resource.getInputStream()) {
            String source = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            registry.resolve(null).parse(source, true);
            catalog.register(name, source);
            log.info("Loaded example flow: {}", name);
        } catch (FlowConversionException e) {
            log.error("Example flow {} does not convert: {}", path, e.toString());
        } catch (IOException e) {
            log.error("Failed to read example flow {}: {}", path, e.getMessage());
        }
    }
}
