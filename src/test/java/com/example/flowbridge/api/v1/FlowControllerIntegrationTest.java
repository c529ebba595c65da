package com.example.flowbridge.api.v1;

import com.example.flowbridge.TestScripts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@Import(FlowControllerIntegrationTest.RestClientTestConfig.class)
@DisplayName("Flow conversion API")
class FlowControllerIntegrationTest {

    @TestConfiguration
    static class RestClientTestConfig {
        @Bean
        public RestTemplate restTemplate() {
            RestTemplate rest = new RestTemplate();
            rest.setErrorHandler(new org.springframework.web.client.ResponseErrorHandler() {
                @Override
                public boolean hasError(ClientHttpResponse response) {
                    return false;
                }

                @Override
                public void handleError(java.net.URI url, HttpMethod method, ClientHttpResponse response) throws java.io.IOException {
                }
            });
            return rest;
        }
    }

    @LocalServerPort
    private int port;

    @Autowired
    private RestTemplate restTemplate;

    private String baseUrl() {
        return "http://localhost:" + port + "/api/v1";
    }

    private ResponseEntity<Map<String, Object>> post(String path, Map<String, Object> body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return restTemplate.exchange(baseUrl() + path, HttpMethod.POST, new HttpEntity<>(body, headers),
                new ParameterizedTypeReference<>() {});
    }

    private ResponseEntity<Map<String, Object>> get(String path) {
        return restTemplate.exchange(baseUrl() + path, HttpMethod.GET, null, new ParameterizedTypeReference<>() {});
    }

    private static Map<String, Object> body(Object... keyValues) {
        Map<String, Object> body = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            body.put((String) keyValues[i], keyValues[i + 1]);
        }
        return body;
    }

    @Test
    @DisplayName("GET /health returns UP with the rule pack used without a version hint")
    void health() {
        ResponseEntity<Map<String, Object>> resp = get("/health");
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody()).containsEntry("status", "UP").containsEntry("service", "flow-bridge")
                .containsEntry("rulePack", "0.3.3");
    }

    @Test
    @DisplayName("GET /rulepacks lists the built-in pack and the host default")
    void rulePacks() {
        ResponseEntity<Map<String, Object>> resp = get("/rulepacks");
        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody()).containsEntry("versions", List.of("0.3.3")).containsEntry("defaultVersion", "0.3.3");
    }

    @Nested
    @DisplayName("export and load")
    class ExportAndLoad {

        @Test
        @DisplayName("POST /flows/export returns a YAML document by default")
        void exportYaml() {
            ResponseEntity<Map<String, Object>> resp = post("/flows/export",
                    body("source", TestScripts.example("router_math_flow.py")));

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(resp.getBody()).containsEntry("format", "yaml");
            String document = (String) resp.getBody().get("document");
            assertThat(document).contains("component_type", "agentspec_version", "Router math flow", "BranchingNode");
        }

        @Test
        @DisplayName("POST /flows/export honors the JSON format and an explicit rule pack")
        void exportJson() {
            ResponseEntity<Map<String, Object>> resp = post("/flows/export",
                    body("source", TestScripts.example("support_triage_flow.py"), "format", "JSON",
                            "rulepackVersion", "0.3.3", "strict", true));

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(resp.getBody()).containsEntry("format", "json");
            assertThat((String) resp.getBody().get("document")).startsWith("{").contains("\"component_type\"");
        }

        @Test
        @DisplayName("exported document loads back into a runnable script")
        void exportThenLoad() {
            String document = (String) post("/flows/export",
                    body("source", TestScripts.example("approval_gate_flow.py"))).getBody().get("document");

            ResponseEntity<Map<String, Object>> resp = post("/flows/load", body("document", document, "format", "yaml"));

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat((String) resp.getBody().get("source"))
                    .contains("async def run_workflow(", "def approval_request(message: str) -> bool:", "with trace(\"Reply with approval\"):");
        }

        @Test
        @DisplayName("POST /flows/ir returns the graph of the script")
        void ir() {
            ResponseEntity<Map<String, Object>> resp = post("/flows/ir",
                    body("source", TestScripts.example("support_triage_flow.py")));

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(resp.getBody()).containsEntry("name", "Support triage").containsEntry("startId", "node_1");
            assertThat(resp.getBody().get("nodes")).asList().hasSize(7);
        }
    }

    @Nested
    @DisplayName("examples")
    class Examples {

        @Test
        @DisplayName("GET /flows/examples lists the bundled scripts")
        void list() {
            ResponseEntity<Map<String, Object>> resp = get("/flows/examples");
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(resp.getBody()).containsEntry("examples",
                    List.of("approval_gate_flow", "router_math_flow", "support_triage_flow"));
        }

        @Test
        @DisplayName("GET /flows/examples/{name} returns the script and its document")
        void byName() {
            ResponseEntity<Map<String, Object>> resp = get("/flows/examples/router_math_flow");
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
            assertThat(resp.getBody()).containsEntry("name", "router_math_flow");
            assertThat((String) resp.getBody().get("source")).contains("async def run_workflow");
            assertThat((String) resp.getBody().get("document")).contains("BranchingNode", "$component_ref");
        }

        @Test
        @DisplayName("GET /flows/examples/{name} returns 404 for an unknown name")
        void unknown() {
            ResponseEntity<Map<String, Object>> resp = get("/flows/examples/nope");
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
            assertThat(resp.getBody()).containsEntry("message", "Example flow not found: nope");
        }
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        @Test
        @DisplayName("blank source is rejected with a field error")
        void blankSource() {
            ResponseEntity<Map<String, Object>> resp = post("/flows/export", body("source", "  "));

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(resp.getBody()).containsEntry("message", "Validation failed");
            @SuppressWarnings("unchecked")
            List<Map<String, Object>> errors = (List<Map<String, Object>>) resp.getBody().get("errors");
            assertThat(errors).anyMatch(e -> "source".equals(e.get("field")));
        }

        @Test
        @DisplayName("unsupported script returns 400 with its error code")
        void conversionError() {
            ResponseEntity<Map<String, Object>> resp = post("/flows/export", body("source", "x = 1\n"));

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(resp.getBody()).containsEntry("code", "NO_RUN_WORKFLOW");
        }

        @Test
        @DisplayName("syntax errors carry line and column")
        void parseError() {
            ResponseEntity<Map<String, Object>> resp = post("/flows/ir", body("source", "def broken(:\n"));

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(resp.getBody()).containsEntry("code", "PARSE_ERROR");
            assertThat(resp.getBody().get("details")).asInstanceOf(org.assertj.core.api.InstanceOfAssertFactories.MAP)
                    .containsEntry("line", 1);
        }

        @Test
        @DisplayName("unknown rule pack returns 404 with the known versions")
        void unknownRulePack() {
            ResponseEntity<Map<String, Object>> resp = post("/flows/export",
                    body("source", TestScripts.example("router_math_flow.py"), "rulepackVersion", "9.9.9"));

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
            assertThat(resp.getBody()).containsEntry("code", "RULEPACK_NOT_FOUND");
            assertThat(resp.getBody().get("details")).asInstanceOf(org.assertj.core.api.InstanceOfAssertFactories.MAP)
                    .containsEntry("known_versions", List.of("0.3.3"));
        }

        @Test
        @DisplayName("unknown document format returns 400")
        void unknownFormat() {
            ResponseEntity<Map<String, Object>> resp = post("/flows/load", body("document", "{}", "format", "xml"));
            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        }

        @Test
        @DisplayName("malformed document returns 400 INVALID_AGENTSPEC")
        void malformedDocument() {
            ResponseEntity<Map<String, Object>> resp = post("/flows/load",
                    body("document", "component_type: Agent\nid: a\nname: a\n", "format", "yaml"));

            assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(resp.getBody()).containsEntry("code", "INVALID_AGENTSPEC");
        }
    }
}
