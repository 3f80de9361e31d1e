package dev.tokenbench.bench;

import com.fasterxml.jackson.databind.JsonNode;
import dev.tokenbench.api.CompletionClient;
import dev.tokenbench.api.CompletionRequest;
import dev.tokenbench.json.BenchJsonMapper;
import dev.tokenbench.task.Approach;
import dev.tokenbench.task.TaskDefinition;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/** Grades with a second model call whose output is constrained to {@code {grade, reason}}. */
@Slf4j
public class LlmGrader implements Grader {
    static final String STRUCTURED_OUTPUTS_BETA = "structured-outputs-2025-11-13";

    static final Map<String, Object> GRADE_SCHEMA =
            Map.of(
                    "type", "object",
                    "properties",
                            Map.of(
                                    "grade",
                                    Map.of("type", "string", "enum", List.of("A", "B", "C", "D", "F")),
                                    "reason",
                                    Map.of("type", "string")),
                    "required", List.of("grade", "reason"),
                    "additionalProperties", false);

    private static final String PROMPT_TEMPLATE =
            """
            You are grading an AI's response to an Excel analysis task.

            TASK: %s
            PROMPT: %s

            EXPECTED ANSWER (ground truth):
            %s

            AI'S ACTUAL RESPONSE:
            %s

            Grade the response on correctness:
            - A: Fully correct, all key information present
            - B: Mostly correct, minor details missing or slight inaccuracies
            - C: Partially correct, some key information wrong or missing
            - D: Mostly incorrect, but shows some understanding
            - F: Completely wrong or didn't answer the question""";

    private final CompletionClient client;
    private final String model;
    private final long maxTokens;

    public LlmGrader(CompletionClient client, String model, long maxTokens) {
        this.client = Objects.requireNonNull(client);
        this.model = Objects.requireNonNull(model);
        this.maxTokens = maxTokens;
    }

    @Override
    public GradeResult grade(TaskDefinition task, Approach approach, String responseText) {
        try {
            var response = client.complete(buildRequest(task, approach, responseText));
            return parse(response.text());
        } catch (Exception e) {
            log.warn("Grading failed for {}/{}: {}", task.id(), approach, e.getMessage());
            return GradeResult.failure(e);
        }
    }

    CompletionRequest buildRequest(TaskDefinition task, Approach approach, String responseText) {
        return CompletionRequest.builder()
                .model(model)
                .maxTokens(maxTokens)
                .system(Optional.empty())
                .userText(prompt(task, approach, responseText))
                .containerUploads(List.of())
                .skills(List.of())
                .codeExecution(false)
                .betas(List.of(STRUCTURED_OUTPUTS_BETA))
                .outputSchema(Optional.of(GRADE_SCHEMA))
                .build();
    }

    static String prompt(TaskDefinition task, Approach approach, String responseText) {
        return PROMPT_TEMPLATE.formatted(
                task.name(),
                task.prompt(approach),
                task.expectedAnswer().orElse("No expected answer provided"),
                responseText);
    }

    /**
     * Read {@code {"grade": "A".."F", "reason": "..."}}.
     *
     * @throws IllegalArgumentException if the text is not that shape
     */
    static GradeResult parse(String text) {
        final JsonNode node;
        try {
            node = BenchJsonMapper.get().readTree(text);
        } catch (IOException e) {
            throw new IllegalArgumentException("grader returned invalid JSON: " + text, e);
        }
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("grader returned a non-object: " + text);
        }
        var grade =
                Grade.parse(node.path("grade").asText(null))
                        .filter(Grade::isReal)
                        .orElseThrow(
                                () ->
                                        new IllegalArgumentException(
                                                "grader returned an invalid grade: "
                                                        + node.path("grade")));
        return new GradeResult(grade, node.path("reason").asText(""));
    }
}
