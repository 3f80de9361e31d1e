package dev.tokenbench.task;

import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * One benchmark task: the same goal phrased for each approach, plus an optional ground truth used
 * only for grading.
 */
public record TaskDefinition(
        @Nonnull String id,
        @Nonnull String name,
        @Nonnull Optional<String> description,
        @Nonnull String xlPrompt,
        @Nonnull String xlsxPrompt,
        /** reference answer shown to the grader, if any */
        @Nonnull Optional<String> expectedAnswer) {

    public TaskDefinition {
        requireText(id, "id");
        requireText(name, "name");
        requireText(xlPrompt, "xl_prompt");
        requireText(xlsxPrompt, "xlsx_prompt");
        description = description == null ? Optional.empty() : description;
        expectedAnswer = expectedAnswer == null ? Optional.empty() : expectedAnswer;
    }

    public static TaskDefinition of(
            String id, String name, String description, String prompt, String expectedAnswer) {
        return new TaskDefinition(
                id,
                name,
                Optional.ofNullable(description),
                prompt,
                prompt,
                Optional.ofNullable(expectedAnswer));
    }

    /** The prompt text sent to the given approach. */
    public String prompt(Approach approach) {
        return switch (approach) {
            case XL -> xlPrompt;
            case XLSX -> xlsxPrompt;
        };
    }

    private static void requireText(String value, String field) {
        Objects.requireNonNull(value, () -> "task is missing required field: " + field);
        if (value.isBlank()) {
            throw new IllegalArgumentException("task field must not be blank: " + field);
        }
    }
}
