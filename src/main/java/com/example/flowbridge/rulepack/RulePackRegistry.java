package com.example.flowbridge.rulepack;

import com.example.flowbridge.agentspec.AgentSpecDeserializer;
import com.example.flowbridge.agentspec.AgentSpecSerializer;
import com.example.flowbridge.errors.FlowErrorCode;
import com.example.flowbridge.errors.RulePackNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Version-keyed rule packs.
 * <p>
 * Packs are registered once at startup. {@link #resolve(String)} picks the pack for an explicit version
 * hint, falling back to the host SDK version.
 * </p>
 */
@Slf4j
public class RulePackRegistry {

    private final Map<String, RulePack> packs = new ConcurrentHashMap<>();
    private final SdkVersionProvider sdkVersionProvider;

    public RulePackRegistry(SdkVersionProvider sdkVersionProvider) {
        this.sdkVersionProvider = Objects.requireNonNull(sdkVersionProvider, "sdkVersionProvider");
    }

    /** A registry holding the built-in packs, for use outside Spring. */
    public static RulePackRegistry withDefaults(SdkVersionProvider sdkVersionProvider,
                                                AgentSpecSerializer serializer,
                                                AgentSpecDeserializer deserializer) {
        RulePackRegistry registry = new RulePackRegistry(sdkVersionProvider);
        registry.register(new V0RulePack(serializer, deserializer));
        return registry;
    }

    public void register(RulePack pack) {
        RulePack previous = packs.put(pack.version(), pack);
        if (previous != null && previous != pack) {
            log.warn("Rule pack version={} replaced by {}", pack.version(), pack.getClass().getSimpleName());
        }
        log.debug("Registered rule pack version={}", pack.version());
    }

    public RulePack get(String version) {
        RulePack pack = version != null ? packs.get(version.strip()) : null;
        if (pack == null) {
            throw new RulePackNotFoundException(FlowErrorCode.RULEPACK_NOT_FOUND,
                    "No rule pack registered for version " + version,
                    Map.of("known_versions", versions()));
        }
        return pack;
    }

    /**
     * The pack for {@code versionHint} when given, otherwise for the host SDK version.
     *
     * @throws RulePackNotFoundException with {@code SDK_VERSION_UNAVAILABLE} when there is no hint and
     *                                   the host version is unknown, {@code RULEPACK_NOT_FOUND} when no
     *                                   pack matches
     */
    public RulePack resolve(String versionHint) {
        if (versionHint != null && !versionHint.isBlank()) {
            return get(versionHint);
        }
        Optional<String> hostVersion = sdkVersionProvider.hostSdkVersion();
        if (hostVersion.isEmpty()) {
            throw new RulePackNotFoundException(FlowErrorCode.SDK_VERSION_UNAVAILABLE,
                    "Unable to determine the host SDK version", Map.of("known_versions", versions()));
        }
        RulePack pack = get(hostVersion.get());
        log.debug("Resolved rule pack version={} from host SDK version", pack.version());
        return pack;
    }

    /** Registered versions, sorted. */
    public List<String> versions() {
        return packs.keySet().stream().sorted().toList();
    }

    /** Version {@link #resolve(String)} picks without a hint; empty when it would fail. */
    public Optional<String> defaultVersion() {
        return sdkVersionProvider.hostSdkVersion().filter(packs::containsKey);
    }
}
