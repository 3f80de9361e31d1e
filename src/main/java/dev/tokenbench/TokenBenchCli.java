package dev.tokenbench;

import dev.tokenbench.bench.ArtifactPaths;
import dev.tokenbench.bench.ComparisonReporter;
import dev.tokenbench.bench.ResultAggregator;
import dev.tokenbench.bench.ResultStore;
import dev.tokenbench.bench.RunOptions;
import dev.tokenbench.bench.SetupException;
import dev.tokenbench.config.ConfigurationException;
import dev.tokenbench.config.TokenBenchConfig;
import dev.tokenbench.task.Approach;
import dev.tokenbench.task.TaskCatalog;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;

/**
 * Command line entry point. Without a subcommand it runs the benchmark; {@code report} re-renders
 * a saved run record.
 *
 * <p>Exit codes: 0 on a completed run (even with failed tasks), 1 on a configuration or setup
 * failure, 2 on invalid arguments.
 */
@Slf4j
@CommandLine.Command(
        name = "tokenbench",
        mixinStandardHelpOptions = true,
        version = "tokenbench 0.1.0",
        description = "Token efficiency benchmark: xl CLI vs Anthropic xlsx skill",
        subcommands = {TokenBenchCli.ReportCommand.class})
public class TokenBenchCli implements Callable<Integer> {

    @CommandLine.Spec CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--task", description = "Run a single task by id")
    String taskId;

    @CommandLine.Option(names = "--xl-only", description = "Only run the xl CLI approach")
    boolean xlOnly;

    @CommandLine.Option(names = "--xlsx-only", description = "Only run the xlsx skill approach")
    boolean xlsxOnly;

    @CommandLine.Option(
            names = "--sequential",
            description = "Run tasks one at a time (default: concurrent)")
    boolean sequential;

    @CommandLine.Option(names = "--no-grade", description = "Skip correctness grading")
    boolean noGrade;

    @CommandLine.Option(names = "--large", description = "Include the large-file tasks")
    boolean large;

    @CommandLine.Option(
            names = "--tasks",
            description = "Load tasks from a JSON file instead of the built-in catalog")
    Path tasksFile;

    @CommandLine.Option(
            names = "--sample",
            description = "Spreadsheet to upload (default: ${DEFAULT-VALUE})",
            defaultValue = "sample.xlsx")
    Path sample;

    @CommandLine.Option(names = "--xl-binary", description = "xl CLI binary to upload")
    Path xlBinary;

    @CommandLine.Option(names = "--xl-skill", description = "xl skill bundle (zip)")
    Path xlSkill;

    @CommandLine.Option(
            names = "--assets-dir",
            description = "Where to look for the xl binary and skill bundle (default: ${DEFAULT-VALUE})",
            defaultValue = ".")
    Path assetsDir;

    @CommandLine.Option(
            names = {"-o", "--output"},
            description = "Output file for the JSON record (default: results/benchmark_<timestamp>.json)")
    Path output;

    private final Supplier<TokenBenchConfig> configSupplier;
    private final Function<TokenBenchConfig, TokenBench> benchFactory;
    private final PrintStream out;
    private final PrintStream err;

    public TokenBenchCli() {
        this(TokenBenchConfig::fromEnvironment, TokenBench::of, System.out, System.err);
    }

    TokenBenchCli(
            Supplier<TokenBenchConfig> configSupplier,
            Function<TokenBenchConfig, TokenBench> benchFactory,
            PrintStream out,
            PrintStream err) {
        this.configSupplier = configSupplier;
        this.benchFactory = benchFactory;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new TokenBenchCli()).execute(args));
    }

    @Override
    public Integer call() {
        if (xlOnly && xlsxOnly) {
            throw new CommandLine.ParameterException(
                    spec.commandLine(), "--xl-only and --xlsx-only are mutually exclusive");
        }
        var options = RunOptions.of(xlOnly, xlsxOnly, sequential, !noGrade);
        try {
            var catalog =
                    (tasksFile == null ? TaskCatalog.builtin(large) : TaskCatalog.fromJson(tasksFile))
                            .select(taskId);
            var paths =
                    ArtifactPaths.resolve(
                            sample, xlBinary, xlSkill, assetsDir, options.includes(Approach.XL));
            var config = configSupplier.get();

            out.println("=".repeat(60));
            out.println("Token Efficiency Benchmark: xl CLI vs Anthropic xlsx Skill");
            out.println("=".repeat(60));
            try (var bench = benchFactory.apply(config)) {
                bench.runBenchmark(catalog, options, paths, output, out);
            }
            return 0;
        } catch (ConfigurationException | SetupException e) {
            log.debug("run aborted", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    @CommandLine.Command(
            name = "report",
            mixinStandardHelpOptions = true,
            description = "Print the comparison for a saved run record")
    static class ReportCommand implements Callable<Integer> {
        @CommandLine.ParentCommand TokenBenchCli parent;

        @CommandLine.Parameters(index = "0", description = "Run record (JSON)")
        Path recordFile;

        @Override
        public Integer call() {
            try {
                var run = ResultStore.read(recordFile);
                var report = ResultAggregator.aggregate(run.results());
                var reporter = new ComparisonReporter(parent.out);
                parent.out.println(
                        "Run %s (%s, %s)".formatted(run.timestamp(), run.model(), run.sampleFile()));
                if (run.approaches().size() == Approach.values().length) {
                    reporter.printComparison(report);
                }
                reporter.printStats(report);
                return 0;
            } catch (UncheckedIOException e) {
                parent.err.println("Error: " + e.getMessage());
                return 1;
            }
        }
    }
}
