package dev.tokenbench.bench;

import dev.tokenbench.api.CompletionRequest;
import dev.tokenbench.task.Approach;
import dev.tokenbench.task.TaskDefinition;
import java.util.List;
import java.util.Optional;

/** The built-in xlsx skill, driven through Python and openpyxl. */
public class XlsxApproachStrategy implements ApproachStrategy {
    static final String SKILL_ID = "xlsx";

    private static final String SYSTEM_PROMPT =
            """
            You have access to the xlsx skill for Excel operations.

            The Excel file is at /mnt/user/%s

            Use Python with openpyxl to complete the task. Be concise in your response.""";

    @Override
    public Approach approach() {
        return Approach.XLSX;
    }

    @Override
    public CompletionRequest buildRequest(
            TaskDefinition task, SharedArtifacts artifacts, String model, long maxTokens) {
        return CompletionRequest.builder()
                .model(model)
                .maxTokens(maxTokens)
                .system(Optional.of(SYSTEM_PROMPT.formatted(artifacts.sampleFilename())))
                .userText(task.prompt(Approach.XLSX))
                .containerUploads(List.of(artifacts.sampleFileId()))
                .skills(List.of(CompletionRequest.SkillRef.anthropic(SKILL_ID)))
                .codeExecution(true)
                .betas(BETAS)
                .outputSchema(Optional.empty())
                .build();
    }
}
