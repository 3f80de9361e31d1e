package dev.tokenbench.api;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;
import lombok.Builder;

/**
 * A single completion call: model, capabilities for the container, instructions and one user
 * message with its attached uploads.
 */
@Builder(toBuilder = true)
public record CompletionRequest(
        @Nonnull String model,
        long maxTokens,
        @Nonnull Optional<String> system,
        @Nonnull String userText,
        /** file ids mounted into the execution container, in order */
        @Nonnull List<String> containerUploads,
        @Nonnull List<SkillRef> skills,
        boolean codeExecution,
        /** beta feature flags sent as anthropic-beta headers */
        @Nonnull List<String> betas,
        /** JSON schema constraining the response text, if any */
        @Nonnull Optional<Map<String, Object>> outputSchema) {

    public CompletionRequest {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(userText, "userText");
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
        system = system == null ? Optional.empty() : system;
        containerUploads = containerUploads == null ? List.of() : List.copyOf(containerUploads);
        skills = skills == null ? List.of() : List.copyOf(skills);
        betas = betas == null ? List.of() : List.copyOf(betas);
        outputSchema = outputSchema == null ? Optional.empty() : outputSchema;
    }

    /** A skill loaded into the execution container. */
    public record SkillRef(@Nonnull String type, @Nonnull String skillId, @Nonnull String version) {
        public static SkillRef custom(String skillId) {
            return new SkillRef("custom", skillId, "latest");
        }

        public static SkillRef anthropic(String skillId) {
            return new SkillRef("anthropic", skillId, "latest");
        }

        Map<String, Object> toMap() {
            return Map.of("type", type, "skill_id", skillId, "version", version);
        }
    }
}
