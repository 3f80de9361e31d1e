package dev.tokenbench.bench;

import dev.tokenbench.task.Approach;
import dev.tokenbench.task.TaskDefinition;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * The result of running one task under one approach.
 *
 * <p>Invariants: {@code totalTokens == inputTokens + outputTokens}, and every token count is zero
 * when {@code success} is false. Instances are immutable; grading produces a copy via {@link
 * #withGrade}.
 */
public record TaskOutcome(
        @Nonnull String taskId,
        @Nonnull String taskName,
        @Nonnull Approach approach,
        boolean success,
        long inputTokens,
        long outputTokens,
        long totalTokens,
        long latencyMs,
        @Nonnull Optional<String> error,
        @Nonnull Optional<String> responseText,
        @Nonnull Optional<Grade> grade,
        @Nonnull Optional<String> gradeReasoning) {

    public TaskOutcome {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(taskName, "taskName");
        Objects.requireNonNull(approach, "approach");
        error = error == null ? Optional.empty() : error;
        responseText = responseText == null ? Optional.empty() : responseText;
        grade = grade == null ? Optional.empty() : grade;
        gradeReasoning = gradeReasoning == null ? Optional.empty() : gradeReasoning;
        if (inputTokens < 0 || outputTokens < 0 || latencyMs < 0) {
            throw new IllegalArgumentException("negative counter in outcome for " + taskId);
        }
        if (totalTokens != inputTokens + outputTokens) {
            throw new IllegalArgumentException(
                    "total_tokens %d != %d + %d for %s/%s"
                            .formatted(totalTokens, inputTokens, outputTokens, taskId, approach));
        }
        if (!success && totalTokens != 0) {
            throw new IllegalArgumentException(
                    "failed outcome must not carry tokens: %s/%s".formatted(taskId, approach));
        }
    }

    public static TaskOutcome succeeded(
            TaskDefinition task,
            Approach approach,
            long inputTokens,
            long outputTokens,
            long latencyMs,
            String responseText) {
        return new TaskOutcome(
                task.id(),
                task.name(),
                approach,
                true,
                inputTokens,
                outputTokens,
                inputTokens + outputTokens,
                latencyMs,
                Optional.empty(),
                Optional.ofNullable(responseText).filter(text -> !text.isEmpty()),
                Optional.empty(),
                Optional.empty());
    }

    public static TaskOutcome failed(
            TaskDefinition task, Approach approach, long latencyMs, String error) {
        return new TaskOutcome(
                task.id(),
                task.name(),
                approach,
                false,
                0,
                0,
                0,
                latencyMs,
                Optional.of(error),
                Optional.empty(),
                Optional.empty(),
                Optional.empty());
    }

    /** A copy of this outcome carrying the given grade. Token and success fields are unchanged. */
    public TaskOutcome withGrade(GradeResult result) {
        return new TaskOutcome(
                taskId,
                taskName,
                approach,
                success,
                inputTokens,
                outputTokens,
                totalTokens,
                latencyMs,
                error,
                responseText,
                Optional.of(result.grade()),
                Optional.of(result.reason()));
    }

    /** Successful with a non-empty response, so eligible for grading. */
    public boolean hasResponse() {
        return success && responseText.isPresent();
    }
}
