package dev.tokenbench.bench;

import dev.tokenbench.api.CompletionRequest;
import dev.tokenbench.task.Approach;
import dev.tokenbench.task.TaskDefinition;
import java.util.List;

/** Turns a task into the completion request one approach sends. */
public interface ApproachStrategy {
    /** Beta features every approach request enables. */
    List<String> BETAS =
            List.of("code-execution-2025-08-25", "skills-2025-10-02", "files-api-2025-04-14");

    Approach approach();

    /**
     * Build the request for {@code task}.
     *
     * @throws IllegalStateException if {@code artifacts} lacks a handle this approach needs
     */
    CompletionRequest buildRequest(
            TaskDefinition task, SharedArtifacts artifacts, String model, long maxTokens);

    static ApproachStrategy of(Approach approach) {
        return switch (approach) {
            case XL -> new XlApproachStrategy();
            case XLSX -> new XlsxApproachStrategy();
        };
    }
}
