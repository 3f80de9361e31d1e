package dev.tokenbench.bench;

import static dev.tokenbench.BenchUtils.formatPercent;
import static dev.tokenbench.BenchUtils.formatSavings;
import static dev.tokenbench.BenchUtils.formatTokens;
import static dev.tokenbench.BenchUtils.truncate;

import dev.tokenbench.task.Approach;
import java.io.PrintStream;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Renders a {@link ResultAggregator.ComparisonReport} as a fixed-width console table. */
public class ComparisonReporter {
    static final int WIDTH = 120;
    private static final String GRADED_ROW = "%-20s | %10s | %8s | %11s | %10s | %8s | %8s";
    private static final String TOKENS_ROW = "%-20s | %10s | %10s | %11s | %12s | %8s | %8s";

    private final PrintStream out;

    public ComparisonReporter(PrintStream out) {
        this.out = out;
    }

    /** Side-by-side table, totals, win summary and grade distribution. */
    public void printComparison(ResultAggregator.ComparisonReport report) {
        boolean graded = report.hasGrades();
        out.println();
        out.println("=".repeat(WIDTH));
        out.println("TOKEN EFFICIENCY COMPARISON: xl CLI vs Anthropic xlsx Skill");
        out.println("=".repeat(WIDTH));
        if (graded) {
            out.println(
                    GRADED_ROW.formatted(
                            "Task", "xl Tokens", "xl Grade", "xlsx Tokens", "xlsx Grade", "Winner",
                            "Savings"));
        } else {
            out.println(
                    TOKENS_ROW.formatted(
                            "Task", "xl Input", "xl Output", "xlsx Input", "xlsx Output", "Winner",
                            "Savings"));
        }
        out.println("-".repeat(WIDTH));
        for (var task : report.tasks()) {
            out.println(graded ? gradedRow(task) : tokensRow(task));
        }
        out.println("-".repeat(WIDTH));
        report.totals().ifPresent(totals -> out.println(totalRow(report, totals, graded)));
        out.println("=".repeat(WIDTH));

        long xlTotal = report.totals().map(ResultAggregator.RunTotals::xlTotalTokens).orElse(0L);
        long xlsxTotal = report.totals().map(ResultAggregator.RunTotals::xlsxTotalTokens).orElse(0L);
        out.println();
        out.println(
                "Summary: xl wins %d tasks, xlsx wins %d tasks"
                        .formatted(report.wins(Approach.XL), report.wins(Approach.XLSX)));
        out.println(
                "Total tokens: xl=%s, xlsx=%s".formatted(formatTokens(xlTotal), formatTokens(xlsxTotal)));
        report.totals()
                .map(ResultAggregator.RunTotals::verdict)
                .filter(verdict -> !verdict.isTie())
                .ifPresent(
                        verdict ->
                                out.println(
                                        "%s uses %s%% fewer tokens overall"
                                                .formatted(
                                                        verdict.winner().orElseThrow().displayName(),
                                                        formatPercent(verdict.savingsPercent(), 1))));

        if (graded) {
            printGradeDistribution(report);
        }
    }

    /** One line per approach that ran. Used for single-approach runs and the report command. */
    public void printStats(ResultAggregator.ComparisonReport report) {
        out.println();
        for (var stats : report.stats().values()) {
            var line =
                    new StringBuilder()
                            .append(stats.approach().displayName())
                            .append(": ")
                            .append(stats.succeeded())
                            .append('/')
                            .append(stats.attempted())
                            .append(" succeeded, ")
                            .append(formatTokens(stats.inputTokens()))
                            .append(" in / ")
                            .append(formatTokens(stats.outputTokens()))
                            .append(" out, avg latency ")
                            .append(Math.round(stats.averageLatencyMs()))
                            .append(" ms");
            stats.averageGrade().ifPresent(g -> line.append(", avg grade ").append(g.symbol()));
            out.println(line);
        }
    }

    private void printGradeDistribution(ResultAggregator.ComparisonReport report) {
        var withGrades =
                report.stats().values().stream().filter(s -> !s.grades().isEmpty()).toList();
        if (withGrades.isEmpty()) {
            return;
        }
        out.println();
        out.println("Grade distribution:");
        for (var stats : withGrades) {
            var counts =
                    stats.gradeDistribution().entrySet().stream()
                            .map(e -> e.getKey().symbol() + ":" + e.getValue())
                            .collect(Collectors.joining(", "));
            out.println("  %s: %s".formatted(stats.approach().label(), counts));
        }
    }

    private static String gradedRow(ResultAggregator.TaskComparison task) {
        var name = truncate(task.taskName(), 20);
        if (task.verdict().isPresent()) {
            var xl = task.xl().orElseThrow();
            var xlsx = task.xlsx().orElseThrow();
            var verdict = task.verdict().get();
            return GRADED_ROW.formatted(
                    name,
                    formatTokens(xl.totalTokens()),
                    gradeCell(xl),
                    formatTokens(xlsx.totalTokens()),
                    gradeCell(xlsx),
                    verdict.label(),
                    formatSavings(verdict.savingsPercent(), 0));
        }
        return GRADED_ROW.formatted(
                name,
                cell(task.xl(), TaskOutcome::totalTokens),
                "-",
                cell(task.xlsx(), TaskOutcome::totalTokens),
                "-",
                "N/A",
                "N/A");
    }

    private static String tokensRow(ResultAggregator.TaskComparison task) {
        var name = truncate(task.taskName(), 20);
        var savings =
                task.verdict().map(v -> formatSavings(v.savingsPercent(), 0)).orElse("N/A");
        var winner = task.verdict().map(ResultAggregator.Verdict::label).orElse("N/A");
        return TOKENS_ROW.formatted(
                name,
                cell(task.xl(), TaskOutcome::inputTokens),
                cell(task.xl(), TaskOutcome::outputTokens),
                cell(task.xlsx(), TaskOutcome::inputTokens),
                cell(task.xlsx(), TaskOutcome::outputTokens),
                winner,
                savings);
    }

    private static String totalRow(
            ResultAggregator.ComparisonReport report,
            ResultAggregator.RunTotals totals,
            boolean graded) {
        var verdict = totals.verdict();
        var savings = formatSavings(verdict.savingsPercent(), 1);
        if (graded) {
            return GRADED_ROW.formatted(
                    "TOTAL",
                    formatTokens(totals.xlTotalTokens()),
                    averageGrade(report, Approach.XL),
                    formatTokens(totals.xlsxTotalTokens()),
                    averageGrade(report, Approach.XLSX),
                    verdict.label(),
                    savings);
        }
        return TOKENS_ROW.formatted(
                "TOTAL",
                formatTokens(totals.xlInputTokens()),
                formatTokens(totals.xlOutputTokens()),
                formatTokens(totals.xlsxInputTokens()),
                formatTokens(totals.xlsxOutputTokens()),
                verdict.label(),
                savings);
    }

    private static String averageGrade(ResultAggregator.ComparisonReport report, Approach approach) {
        return Optional.ofNullable(report.stats(approach))
                .flatMap(ResultAggregator.ApproachStats::averageGrade)
                .map(Grade::symbol)
                .orElse("-");
    }

    private static String gradeCell(TaskOutcome outcome) {
        return outcome.grade().map(Grade::symbol).orElse("-");
    }

    /** The value for a successful outcome, otherwise {@code ERR}. */
    private static String cell(Optional<TaskOutcome> outcome, Function<TaskOutcome, Long> value) {
        return outcome.filter(TaskOutcome::success).map(o -> formatTokens(value.apply(o))).orElse("ERR");
    }
}
