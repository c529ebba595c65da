package com.example.flowbridge.rulepack;

import java.util.Optional;

/**
 * Reports the workflow SDK version of the host environment, when known.
 */
@FunctionalInterface
public interface SdkVersionProvider {

    Optional<String> hostSdkVersion();

    static SdkVersionProvider fixed(String version) {
        Optional<String> value = version == null || version.isBlank() ? Optional.empty() : Optional.of(version.strip());
        return () -> value;
    }
}
