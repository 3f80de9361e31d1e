package dev.tokenbench;

import dev.tokenbench.api.ArtifactApiClient;
import dev.tokenbench.api.CompletionClient;
import dev.tokenbench.bench.ApproachRunner;
import dev.tokenbench.bench.ArtifactPaths;
import dev.tokenbench.bench.BenchmarkOrchestrator;
import dev.tokenbench.bench.BenchmarkRun;
import dev.tokenbench.bench.BenchmarkSetup;
import dev.tokenbench.bench.ComparisonReporter;
import dev.tokenbench.bench.LlmGrader;
import dev.tokenbench.bench.ResultAggregator;
import dev.tokenbench.bench.ResultStore;
import dev.tokenbench.bench.RunOptions;
import dev.tokenbench.config.TokenBenchConfig;
import dev.tokenbench.task.TaskCatalog;
import dev.tokenbench.trace.BenchTracing;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.LocalDateTime;
import javax.annotation.Nullable;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

/**
 * Everything a benchmark run shares: configuration, the completion and artifact clients, and the
 * telemetry they report to.
 *
 * <p>Build one per process and pass it where it is needed. There is no global instance.
 *
 * @see #of(TokenBenchConfig)
 * @see #runBenchmark
 */
@Slf4j
public class TokenBench implements AutoCloseable {

    /** Create an instance backed by the real Anthropic APIs and the global OpenTelemetry. */
    public static TokenBench of(TokenBenchConfig config) {
        return new TokenBench(
                config,
                CompletionClient.of(config),
                ArtifactApiClient.of(config),
                GlobalOpenTelemetry.get());
    }

    @Getter
    @Accessors(fluent = true)
    private final TokenBenchConfig config;

    @Getter
    @Accessors(fluent = true)
    private final CompletionClient completionClient;

    @Getter
    @Accessors(fluent = true)
    private final ArtifactApiClient artifactClient;

    @Getter
    @Accessors(fluent = true)
    private final OpenTelemetry openTelemetry;

    public TokenBench(
            TokenBenchConfig config,
            CompletionClient completionClient,
            ArtifactApiClient artifactClient,
            OpenTelemetry openTelemetry) {
        this.config = config;
        this.completionClient = completionClient;
        this.artifactClient = artifactClient;
        this.openTelemetry = openTelemetry;
    }

    /** An orchestrator wired to this instance's clients and configuration. */
    public BenchmarkOrchestrator.Builder orchestratorBuilder() {
        var tracer = BenchTracing.getTracer(openTelemetry);
        return BenchmarkOrchestrator.builder()
                .runner(
                        new ApproachRunner(
                                completionClient, config.model(), config.maxTokens(), tracer))
                .grader(
                        new LlmGrader(
                                completionClient, config.graderModel(), config.graderMaxTokens()))
                .setup(new BenchmarkSetup(artifactClient, config.skillTitle()))
                .tracer(tracer)
                .maxConcurrency(config.maxConcurrency());
    }

    /**
     * Run the catalog, print the comparison and persist the record.
     *
     * <p>Configuration and setup failures propagate before anything is printed or written. Failed
     * tasks do not: they are reported and saved like any other outcome.
     *
     * @param output record path, or null for the timestamped default under the results directory
     */
    public RunResult runBenchmark(
            TaskCatalog catalog,
            RunOptions options,
            ArtifactPaths paths,
            @Nullable Path output,
            PrintStream out) {
        var timestamp = BenchUtils.timestamp(LocalDateTime.now());
        log.info(
                "Running {} tasks, grading: {}",
                catalog.size(),
                options.grading() ? "on (" + config.graderModel() + ")" : "off");
        var outcomes = orchestratorBuilder().build().run(catalog, options, paths);
        var run = new BenchmarkRun(timestamp, config.model(), paths.sample().toString(), outcomes);
        var report = ResultAggregator.aggregate(outcomes);

        var reporter = new ComparisonReporter(out);
        if (options.comparing()) {
            reporter.printComparison(report);
        } else {
            reporter.printStats(report);
        }

        var path = output != null ? output : ResultStore.defaultPath(config.resultsDir(), timestamp);
        ResultStore.write(path, run);
        out.println();
        out.println("Results saved to: " + path);
        return new RunResult(run, report, path);
    }

    @Override
    public void close() {
        completionClient.close();
    }

    public record RunResult(
            BenchmarkRun run, ResultAggregator.ComparisonReport report, Path recordPath) {}
}
