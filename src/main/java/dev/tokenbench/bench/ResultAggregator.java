package dev.tokenbench.bench;

import dev.tokenbench.task.Approach;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import javax.annotation.Nullable;

/**
 * Reduces a run's outcomes into per-task comparisons, per-approach statistics and an overall
 * verdict.
 *
 * <p>A task is comparable when both approaches have a successful outcome for it. Only comparable
 * tasks contribute to winners, savings, grade averages and the run-level totals; the rest are still
 * listed with whatever data exists.
 */
public final class ResultAggregator {
    private ResultAggregator() {}

    public static ComparisonReport aggregate(List<TaskOutcome> outcomes) {
        // task id -> approach -> outcome, in first-seen order
        Map<String, Map<Approach, TaskOutcome>> byTask = new LinkedHashMap<>();
        Map<String, String> names = new LinkedHashMap<>();
        for (var outcome : outcomes) {
            byTask.computeIfAbsent(outcome.taskId(), id -> new EnumMap<>(Approach.class))
                    .put(outcome.approach(), outcome);
            names.putIfAbsent(outcome.taskId(), outcome.taskName());
        }

        var comparisons = new ArrayList<TaskComparison>();
        Map<Approach, Integer> wins = new EnumMap<>(Approach.class);
        Map<Approach, List<Grade>> grades = new EnumMap<>(Approach.class);
        long xlInput = 0, xlOutput = 0, xlsxInput = 0, xlsxOutput = 0;
        int comparable = 0;
        for (var entry : byTask.entrySet()) {
            var xl = Optional.ofNullable(entry.getValue().get(Approach.XL));
            var xlsx = Optional.ofNullable(entry.getValue().get(Approach.XLSX));
            Optional<Verdict> verdict = Optional.empty();
            if (xl.isPresent() && xlsx.isPresent() && xl.get().success() && xlsx.get().success()) {
                comparable++;
                xlInput += xl.get().inputTokens();
                xlOutput += xl.get().outputTokens();
                xlsxInput += xlsx.get().inputTokens();
                xlsxOutput += xlsx.get().outputTokens();
                var v = Verdict.between(xl.get().totalTokens(), xlsx.get().totalTokens());
                v.winner().ifPresent(w -> wins.merge(w, 1, Integer::sum));
                collectGrade(grades, xl.get());
                collectGrade(grades, xlsx.get());
                verdict = Optional.of(v);
            }
            comparisons.add(
                    new TaskComparison(entry.getKey(), names.get(entry.getKey()), xl, xlsx, verdict));
        }

        Map<Approach, ApproachStats> stats = new EnumMap<>(Approach.class);
        for (var approach : Approach.values()) {
            var mine = outcomes.stream().filter(o -> o.approach() == approach).toList();
            if (!mine.isEmpty()) {
                stats.put(
                        approach,
                        ApproachStats.of(approach, mine, grades.getOrDefault(approach, List.of())));
            }
        }

        Optional<RunTotals> totals =
                comparable == 0
                        ? Optional.empty()
                        : Optional.of(
                                new RunTotals(
                                        comparable,
                                        xlInput,
                                        xlOutput,
                                        xlsxInput,
                                        xlsxOutput,
                                        Verdict.between(xlInput + xlOutput, xlsxInput + xlsxOutput)));
        return new ComparisonReport(comparisons, stats, wins, totals);
    }

    private static void collectGrade(Map<Approach, List<Grade>> grades, TaskOutcome outcome) {
        outcome.grade()
                .filter(Grade::isReal)
                .ifPresent(
                        g -> grades.computeIfAbsent(outcome.approach(), a -> new ArrayList<>()).add(g));
    }

    /**
     * Which approach used strictly fewer tokens, and by how much.
     *
     * @param winner empty on a tie
     * @param savingsPercent {@code (loser - winner) / loser * 100}, unrounded. 0 on a tie
     */
    public record Verdict(Optional<Approach> winner, double savingsPercent) {
        public static Verdict between(long xlTotal, long xlsxTotal) {
            if (xlTotal < xlsxTotal) {
                return new Verdict(Optional.of(Approach.XL), savings(xlTotal, xlsxTotal));
            } else if (xlsxTotal < xlTotal) {
                return new Verdict(Optional.of(Approach.XLSX), savings(xlsxTotal, xlTotal));
            }
            return new Verdict(Optional.empty(), 0.0);
        }

        private static double savings(long winnerTotal, long loserTotal) {
            return (loserTotal - winnerTotal) * 100.0 / loserTotal;
        }

        public boolean isTie() {
            return winner.isEmpty();
        }

        /** The winner's label, or {@code tie}. */
        public String label() {
            return winner.map(Approach::label).orElse("tie");
        }
    }

    /**
     * Both approaches' outcomes for one task.
     *
     * @param verdict present only when the task is comparable
     */
    public record TaskComparison(
            String taskId,
            String taskName,
            Optional<TaskOutcome> xl,
            Optional<TaskOutcome> xlsx,
            Optional<Verdict> verdict) {

        public boolean comparable() {
            return verdict.isPresent();
        }

        public Optional<TaskOutcome> outcome(Approach approach) {
            return approach == Approach.XL ? xl : xlsx;
        }
    }

    /** Token sums over comparable tasks only, and the verdict on those sums. */
    public record RunTotals(
            int comparableTasks,
            long xlInputTokens,
            long xlOutputTokens,
            long xlsxInputTokens,
            long xlsxOutputTokens,
            Verdict verdict) {

        public long xlTotalTokens() {
            return xlInputTokens + xlOutputTokens;
        }

        public long xlsxTotalTokens() {
            return xlsxInputTokens + xlsxOutputTokens;
        }

        public long totalTokens(Approach approach) {
            return approach == Approach.XL ? xlTotalTokens() : xlsxTotalTokens();
        }
    }

    /**
     * What one approach did across the whole run. Token sums and latency cover successful outcomes;
     * {@code grades} holds the real grades of comparable tasks only.
     */
    public record ApproachStats(
            Approach approach,
            int attempted,
            int succeeded,
            long inputTokens,
            long outputTokens,
            long totalTokens,
            double averageLatencyMs,
            List<Grade> grades) {

        public ApproachStats {
            grades = List.copyOf(grades);
        }

        static ApproachStats of(Approach approach, List<TaskOutcome> outcomes, List<Grade> grades) {
            var successes = outcomes.stream().filter(TaskOutcome::success).toList();
            return new ApproachStats(
                    approach,
                    outcomes.size(),
                    successes.size(),
                    successes.stream().mapToLong(TaskOutcome::inputTokens).sum(),
                    successes.stream().mapToLong(TaskOutcome::outputTokens).sum(),
                    successes.stream().mapToLong(TaskOutcome::totalTokens).sum(),
                    successes.stream().mapToLong(TaskOutcome::latencyMs).average().orElse(0.0),
                    grades);
        }

        public int failed() {
            return attempted - succeeded;
        }

        /** Bucketed mean of {@link #grades}, empty when nothing was graded. */
        public Optional<Grade> averageGrade() {
            return Grade.average(grades);
        }

        /** Count per letter, A to F, omitting letters never given. */
        public Map<Grade, Long> gradeDistribution() {
            Map<Grade, Long> counts = new EnumMap<>(Grade.class);
            for (var grade : grades) {
                counts.merge(grade, 1L, Long::sum);
            }
            return counts;
        }
    }

    /**
     * Everything the reporter prints.
     *
     * @param totals empty when no task is comparable
     */
    public record ComparisonReport(
            List<TaskComparison> tasks,
            Map<Approach, ApproachStats> stats,
            Map<Approach, Integer> wins,
            Optional<RunTotals> totals) {

        public ComparisonReport {
            tasks = List.copyOf(tasks);
            stats = stats.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(stats));
            wins = wins.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(wins));
        }

        public int wins(Approach approach) {
            return wins.getOrDefault(approach, 0);
        }

        @Nullable
        public ApproachStats stats(Approach approach) {
            return stats.get(approach);
        }

        /** True when any outcome carries a grade, the sentinel included. */
        public boolean hasGrades() {
            return tasks.stream()
                    .flatMap(t -> Stream.of(t.xl(), t.xlsx()))
                    .flatMap(Optional::stream)
                    .anyMatch(o -> o.grade().isPresent());
        }
    }
}
