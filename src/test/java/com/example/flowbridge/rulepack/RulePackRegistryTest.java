package com.example.flowbridge.rulepack;

import com.example.flowbridge.TestScripts;
import com.example.flowbridge.agentspec.AgentSpecDeserializer;
import com.example.flowbridge.agentspec.AgentSpecSerializer;
import com.example.flowbridge.agentspec.Flow;
import com.example.flowbridge.errors.FlowErrorCode;
import com.example.flowbridge.errors.RulePackNotFoundException;
import com.example.flowbridge.ir.IrFlow;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("RulePackRegistry")
class RulePackRegistryTest {

    private final AgentSpecSerializer serializer = new AgentSpecSerializer();
    private final AgentSpecDeserializer deserializer = new AgentSpecDeserializer();

    private RulePackRegistry registry(String hostVersion) {
        return RulePackRegistry.withDefaults(SdkVersionProvider.fixed(hostVersion), serializer, deserializer);
    }

    @Nested
    @DisplayName("lookup")
    class Lookup {

        @Test
        @DisplayName("returns the built-in pack by exact version")
        void getBuiltIn() {
            RulePack pack = registry(null).get(V0RulePack.VERSION);
            assertEquals("0.3.3", pack.version());
            assertThat(pack).isInstanceOf(V0RulePack.class);
        }

        @Test
        @DisplayName("reports the known versions when a version is missing")
        void unknownVersion() {
            RulePackNotFoundException ex = assertThrows(RulePackNotFoundException.class,
                    () -> registry(null).get("9.9.9"));
            assertEquals(FlowErrorCode.RULEPACK_NOT_FOUND, ex.getCode());
            assertEquals(List.of("0.3.3"), ex.getDetails().get("known_versions"));
        }

        @Test
        @DisplayName("lists registered versions in order")
        void versionsSorted() {
            RulePackRegistry registry = registry(null);
            registry.register(new NamedPack("0.10.0"));
            registry.register(new NamedPack("0.1.0"));
            assertEquals(List.of("0.1.0", "0.10.0", "0.3.3"), registry.versions());
        }

        @Test
        @DisplayName("replaces a pack registered under the same version")
        void replace() {
            RulePackRegistry registry = registry(null);
            NamedPack replacement = new NamedPack(V0RulePack.VERSION);
            registry.register(replacement);
            assertSame(replacement, registry.get(V0RulePack.VERSION));
        }
    }

    @Nested
    @DisplayName("resolution")
    class Resolution {

        @Test
        @DisplayName("prefers an explicit hint over the host version")
        void hintWins() {
            RulePackRegistry registry = registry("0.3.3");
            NamedPack other = new NamedPack("1.0.0");
            registry.register(other);
            assertSame(other, registry.resolve(" 1.0.0 "));
        }

        @Test
        @DisplayName("falls back to the host SDK version")
        void hostVersion() {
            assertEquals("0.3.3", registry("0.3.3").resolve(null).version());
            assertEquals("0.3.3", registry("0.3.3").resolve("  ").version());
        }

        @Test
        @DisplayName("fails when neither a hint nor a host version is available")
        void noVersion() {
            RulePackNotFoundException ex = assertThrows(RulePackNotFoundException.class,
                    () -> registry("").resolve(null));
            assertEquals(FlowErrorCode.SDK_VERSION_UNAVAILABLE, ex.getCode());
        }

        @Test
        @DisplayName("fails when the host version has no pack")
        void hostVersionUnknown() {
            RulePackNotFoundException ex = assertThrows(RulePackNotFoundException.class,
                    () -> registry("0.4.0").resolve(null));
            assertEquals(FlowErrorCode.RULEPACK_NOT_FOUND, ex.getCode());
        }

        @Test
        @DisplayName("exposes the default version only when it resolves")
        void defaultVersion() {
            assertEquals(Optional.of("0.3.3"), registry("0.3.3").defaultVersion());
            assertEquals(Optional.empty(), registry("0.4.0").defaultVersion());
            assertEquals(Optional.empty(), registry(null).defaultVersion());
        }
    }

    @Test
    @DisplayName("built-in pack parses, converts and generates")
    void builtInPackPipeline() {
        RulePack pack = registry("0.3.3").resolve(null);
        IrFlow ir = pack.parse(TestScripts.example("router_math_flow.py"), true);
        Flow flow = pack.toAgentSpec(ir, true);
        IrFlow back = pack.toIr(flow, true);

        assertEquals(ir.nodes().size(), back.nodes().size());
        assertThat(pack.generate(back)).contains("async def run_workflow(");
    }

    private record NamedPack(String version) implements RulePack {

        @Override
        public IrFlow parse(String source, boolean strict) {
            throw new UnsupportedOperationException();
        }

        @Override
        public Flow toAgentSpec(IrFlow ir, boolean strict) {
            throw new UnsupportedOperationException();
        }

        @Override
        public IrFlow toIr(Flow flow, boolean strict) {
            throw new UnsupportedOperationException();
        }

        @Override
        public String generate(IrFlow ir) {
            throw new UnsupportedOperationException();
        }
    }
}
