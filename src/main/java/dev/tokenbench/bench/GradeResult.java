package dev.tokenbench.bench;

import java.util.Objects;

/** A grade plus the grader's short rationale. */
public record GradeResult(Grade grade, String reason) {
    public GradeResult {
        Objects.requireNonNull(grade, "grade");
        Objects.requireNonNull(reason, "reason");
    }

    /** The sentinel result for a grading call that failed. */
    public static GradeResult failure(Throwable cause) {
        var message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        return new GradeResult(Grade.UNGRADED, "Grading error: " + message);
    }
}
