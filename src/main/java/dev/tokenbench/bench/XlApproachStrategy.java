package dev.tokenbench.bench;

import dev.tokenbench.api.CompletionRequest;
import dev.tokenbench.task.Approach;
import dev.tokenbench.task.TaskDefinition;
import java.util.List;
import java.util.Optional;

/** The xl CLI custom skill. The binary and the spreadsheet are both mounted into the container. */
public class XlApproachStrategy implements ApproachStrategy {
    private static final String SYSTEM_PROMPT =
            """
            You have access to the xl CLI tool for Excel operations.

            The xl binary has been uploaded to /mnt/user/%s - make it executable first.
            The Excel file is at /mnt/user/%s

            Use xl commands to complete the task. Be concise in your response.""";

    @Override
    public Approach approach() {
        return Approach.XL;
    }

    @Override
    public CompletionRequest buildRequest(
            TaskDefinition task, SharedArtifacts artifacts, String model, long maxTokens) {
        var skillId =
                artifacts
                        .xlSkillId()
                        .orElseThrow(() -> new IllegalStateException("xl skill was not provisioned"));
        var binaryFileId =
                artifacts
                        .xlBinaryFileId()
                        .orElseThrow(() -> new IllegalStateException("xl binary was not uploaded"));
        var binaryName = artifacts.xlBinaryName().orElse("xl");
        return CompletionRequest.builder()
                .model(model)
                .maxTokens(maxTokens)
                .system(Optional.of(SYSTEM_PROMPT.formatted(binaryName, artifacts.sampleFilename())))
                .userText(task.prompt(Approach.XL))
                .containerUploads(List.of(binaryFileId, artifacts.sampleFileId()))
                .skills(List.of(CompletionRequest.SkillRef.custom(skillId)))
                .codeExecution(true)
                .betas(BETAS)
                .outputSchema(Optional.empty())
                .build();
    }
}
