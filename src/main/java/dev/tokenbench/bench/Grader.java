package dev.tokenbench.bench;

import dev.tokenbench.task.Approach;
import dev.tokenbench.task.TaskDefinition;

/** Scores a response against a task's expected answer. */
public interface Grader {
    /**
     * Grade {@code responseText}, produced by {@code approach} for {@code task}.
     *
     * <p>Implementations report their own failures as {@link GradeResult#failure}. The orchestrator
     * treats a thrown exception the same way.
     */
    GradeResult grade(TaskDefinition task, Approach approach, String responseText);
}
