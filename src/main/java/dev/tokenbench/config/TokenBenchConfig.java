package dev.tokenbench.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Configuration for the benchmark harness with sane defaults.
 *
 * <p>Most users will configure everything through envars. Any envar can also be overridden during
 * construction, which is what the tests do.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode(callSuper = false)
@ToString(exclude = "apiKey")
public final class TokenBenchConfig extends BaseConfig {
    private final String apiKey = getRequiredConfig("ANTHROPIC_API_KEY");
    private final String baseUrl = getConfig("ANTHROPIC_BASE_URL", "https://api.anthropic.com");
    private final String model = getConfig("TOKENBENCH_MODEL", "claude-sonnet-4-5-20250929");
    private final String graderModel =
            getConfig("TOKENBENCH_GRADER_MODEL", "claude-opus-4-5-20251101");
    private final long maxTokens = getConfig("TOKENBENCH_MAX_TOKENS", 2048L);
    private final long graderMaxTokens = getConfig("TOKENBENCH_GRADER_MAX_TOKENS", 256L);
    private final int maxConcurrency = getConfig("TOKENBENCH_MAX_CONCURRENCY", 4);
    private final Duration requestTimeout =
            Duration.ofSeconds(getConfig("TOKENBENCH_REQUEST_TIMEOUT", 600L));
    private final String skillTitle = getConfig("TOKENBENCH_SKILL_TITLE", "xl-cli");
    private final Path resultsDir = Path.of(getConfig("TOKENBENCH_RESULTS_DIR", "results"));

    public static TokenBenchConfig fromEnvironment() {
        return of();
    }

    public static TokenBenchConfig of(String... envOverrides) {
        if (envOverrides.length % 2 != 0) {
            throw new IllegalArgumentException(
                    "config overrides require key-value pairs. Found dangling key: %s"
                            .formatted(envOverrides[envOverrides.length - 1]));
        }
        var overridesMap = new HashMap<String, String>();
        for (int i = 0; i < envOverrides.length - 1; i = i + 2) {
            overridesMap.put(envOverrides[i], envOverrides[i + 1]);
        }
        return new TokenBenchConfig(overridesMap);
    }

    private TokenBenchConfig(Map<String, String> envOverrides) {
        super(envOverrides);
        if (maxConcurrency < 1) {
            throw new ConfigurationException(
                    "TOKENBENCH_MAX_CONCURRENCY must be at least 1, got " + maxConcurrency);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, String> envOverrides = new HashMap<>();

        public Builder apiKey(String value) {
            envOverrides.put("ANTHROPIC_API_KEY", value == null ? NULL_OVERRIDE : value);
            return this;
        }

        public Builder baseUrl(String value) {
            envOverrides.put("ANTHROPIC_BASE_URL", value);
            return this;
        }

        public Builder model(String value) {
            envOverrides.put("TOKENBENCH_MODEL", value);
            return this;
        }

        public Builder graderModel(String value) {
            envOverrides.put("TOKENBENCH_GRADER_MODEL", value);
            return this;
        }

        public Builder maxTokens(long value) {
            envOverrides.put("TOKENBENCH_MAX_TOKENS", String.valueOf(value));
            return this;
        }

        public Builder graderMaxTokens(long value) {
            envOverrides.put("TOKENBENCH_GRADER_MAX_TOKENS", String.valueOf(value));
            return this;
        }

        public Builder maxConcurrency(int value) {
            envOverrides.put("TOKENBENCH_MAX_CONCURRENCY", String.valueOf(value));
            return this;
        }

        public Builder requestTimeout(Duration value) {
            envOverrides.put("TOKENBENCH_REQUEST_TIMEOUT", String.valueOf(value.getSeconds()));
            return this;
        }

        public Builder skillTitle(String value) {
            envOverrides.put("TOKENBENCH_SKILL_TITLE", value);
            return this;
        }

        public Builder resultsDir(Path value) {
            envOverrides.put("TOKENBENCH_RESULTS_DIR", value.toString());
            return this;
        }

        public TokenBenchConfig build() {
            return new TokenBenchConfig(envOverrides);
        }
    }
}
