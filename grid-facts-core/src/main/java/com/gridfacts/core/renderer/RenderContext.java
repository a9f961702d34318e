package com.gridfacts.core.renderer;

import java.nio.file.Path;
import java.util.Map;

/**
 * Context provided to renderers during execution.
 *
 * @param outputFile file to write to; null for standard output
 * @param settings renderer-specific settings
 */
public record RenderContext(
    Path outputFile,
    Map<String, String> settings
) {
    /**
     * Compact constructor with validation.
     */
    public RenderContext {
        if (settings == null) {
            settings = Map.of();
        }
    }

    /**
     * Creates a context writing to standard output with no settings.
     *
     * @return stdout context
     */
    public static RenderContext stdout() {
        return new RenderContext(null, Map.of());
    }

    /**
     * Gets a setting with a default.
     *
     * @param key setting key
     * @param defaultValue default value
     * @return setting value or default
     */
    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }
}
