package dev.tokenbench.config;

import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Base class for env-var backed configuration.
 *
 * <p>Every lookup first consults the override map handed to the constructor, then the process
 * environment. An override equal to {@link #NULL_OVERRIDE} forces the value to be absent even if
 * the environment defines it.
 */
abstract class BaseConfig {
    static final String NULL_OVERRIDE = "__TOKENBENCH_NULL_OVERRIDE__";

    private final Map<String, String> envOverrides;

    protected BaseConfig(Map<String, String> envOverrides) {
        this.envOverrides = Map.copyOf(envOverrides);
    }

    protected String getRequiredConfig(String name) {
        var value = lookup(name);
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(
                    "%s not found. Set it as an environment variable".formatted(name));
        }
        return value;
    }

    protected String getConfig(String name, String defaultValue) {
        return getConfig(name, defaultValue, String.class);
    }

    protected int getConfig(String name, int defaultValue) {
        return getConfig(name, defaultValue, Integer.class);
    }

    protected long getConfig(String name, long defaultValue) {
        return getConfig(name, defaultValue, Long.class);
    }

    @SuppressWarnings("unchecked")
    protected <T> T getConfig(String name, @Nullable T defaultValue, Class<T> type) {
        var raw = lookup(name);
        if (raw == null) {
            return defaultValue;
        }
        try {
            if (type == String.class) {
                return (T) raw;
            } else if (type == Integer.class) {
                return (T) Integer.valueOf(raw.trim());
            } else if (type == Long.class) {
                return (T) Long.valueOf(raw.trim());
            }
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                    "invalid value for %s: '%s'".formatted(name, raw), e);
        }
        throw new IllegalArgumentException("unsupported config type: " + type);
    }

    @Nullable
    private String lookup(String name) {
        Objects.requireNonNull(name);
        if (envOverrides.containsKey(name)) {
            var override = envOverrides.get(name);
            return NULL_OVERRIDE.equals(override) ? null : override;
        }
        return System.getenv(name);
    }
}
