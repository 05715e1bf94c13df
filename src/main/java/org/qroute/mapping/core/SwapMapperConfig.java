package org.qroute.mapping.core;

import lombok.Builder;
import lombok.Value;

/**
 * Options for {@link SwapMapper}.
 */
@Value
@Builder
public class SwapMapperConfig {
    public static final String DEFAULT_REGISTER_NAME = "q";

    /**
     * Name of the single global quantum register the mapper owns. References to any
     * other register pass through untouched.
     */
    @Builder.Default
    String registerName = DEFAULT_REGISTER_NAME;

    /**
     * Returns the default configuration (register {@code q}).
     */
    public static SwapMapperConfig defaults() {
        return SwapMapperConfig.builder().build();
    }

    /**
     * Returns a configuration operating on the named register.
     */
    public static SwapMapperConfig forRegister(String registerName) {
        return SwapMapperConfig.builder()
                .registerName(registerName)
                .build();
    }
}
