package net.vortexdevelopment.vattribute.config;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Tunables for building analyzers.
 */
@Getter
@Builder
@ToString
public class AnalyzerSettings {

    public static final String CACHE_ENABLED = "vattribute.cache.enabled";
    public static final String CUSTOM_MAX_DEPTH = "vattribute.custom.max-depth";

    /**
     * Wrap the analyzer in a memoizing cache.
     */
    @Builder.Default
    private final boolean cacheEnabled = true;

    /**
     * Maximum nesting of custom resolution hooks calling back into the analyzer. 0 means unlimited.
     */
    @Builder.Default
    private final int customMaxDepth = 0;

    public static AnalyzerSettings defaults() {
        return AnalyzerSettings.builder().build();
    }

    public static AnalyzerSettings fromEnvironment() {
        return fromEnvironment(Environment.getInstance());
    }

    public static AnalyzerSettings fromEnvironment(Environment environment) {
        int maxDepth = environment.getPropertyAsInt(CUSTOM_MAX_DEPTH, 0);
        if (maxDepth < 0) {
            throw new IllegalArgumentException(CUSTOM_MAX_DEPTH + " must not be negative, got " + maxDepth);
        }
        return AnalyzerSettings.builder()
                .cacheEnabled(environment.getPropertyAsBoolean(CACHE_ENABLED, true))
                .customMaxDepth(maxDepth)
                .build();
    }
}
