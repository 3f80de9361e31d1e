package dev.tokenbench.bench;

import com.fasterxml.jackson.annotation.JsonIgnore;
import dev.tokenbench.task.Approach;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One full run: when it started, the model it drove, the sample spreadsheet it used and every
 * outcome in catalog order.
 *
 * <p>At most one outcome exists per (task id, approach) pair.
 */
public record BenchmarkRun(String timestamp, String model, String sampleFile, List<TaskOutcome> results) {

    public BenchmarkRun {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(sampleFile, "sampleFile");
        results = results == null ? List.of() : List.copyOf(results);
        var seen = new HashSet<String>();
        for (var outcome : results) {
            if (!seen.add(outcome.taskId() + "\u0000" + outcome.approach().label())) {
                throw new IllegalArgumentException(
                        "duplicate outcome for %s/%s".formatted(outcome.taskId(), outcome.approach()));
            }
        }
    }

    /** Approaches that appear in the results, in execution order. */
    @JsonIgnore
    public Set<Approach> approaches() {
        var present = new LinkedHashSet<Approach>();
        for (var approach : Approach.values()) {
            if (results.stream().anyMatch(r -> r.approach() == approach)) {
                present.add(approach);
            }
        }
        return present;
    }
}
