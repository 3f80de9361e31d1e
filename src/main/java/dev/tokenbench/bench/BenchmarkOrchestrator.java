package dev.tokenbench.bench;

import dev.tokenbench.BenchUtils;
import dev.tokenbench.config.ConfigurationException;
import dev.tokenbench.task.Approach;
import dev.tokenbench.task.TaskCatalog;
import dev.tokenbench.task.TaskDefinition;
import dev.tokenbench.trace.BenchTracing;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives a task catalog through the selected approaches and collects every outcome in catalog
 * order.
 *
 * <p>A unit of work is one task: each selected approach runs in {@link Approach} order, and each
 * successful response is graded before the next approach starts. Units run one after another in
 * sequential mode, or all at once on a bounded pool in concurrent mode. Either way the returned
 * list is ordered by catalog position, then approach.
 *
 * <p>Setup runs before any unit is dispatched. A setup failure aborts the whole run with {@link
 * SetupException} and no outcomes.
 */
@Slf4j
public final class BenchmarkOrchestrator {
    private final @Nonnull ApproachRunner runner;
    private final @Nullable Grader grader;
    private final @Nonnull BenchmarkSetup setup;
    private final @Nonnull Tracer tracer;
    private final @Nonnull Map<Approach, ApproachStrategy> strategies;
    private final int maxConcurrency;

    private BenchmarkOrchestrator(Builder builder) {
        this.runner = Objects.requireNonNull(builder.runner);
        this.grader = builder.grader;
        this.setup = Objects.requireNonNull(builder.setup);
        this.tracer = Objects.requireNonNull(builder.tracer);
        this.strategies = Collections.unmodifiableMap(new EnumMap<>(builder.strategies));
        this.maxConcurrency = builder.maxConcurrency;
    }

    /**
     * Set up shared artifacts, run every task, then delete the uploads.
     *
     * @throws ConfigurationException if the catalog is empty or grading is requested without a
     *     grader
     * @throws SetupException if uploading or provisioning fails. No task has run
     */
    public List<TaskOutcome> run(TaskCatalog catalog, RunOptions options, ArtifactPaths paths) {
        if (catalog.isEmpty()) {
            throw new ConfigurationException("No tasks selected");
        }
        if (options.grading() && grader == null) {
            throw new ConfigurationException("Grading requested but no grader configured");
        }
        var rootSpan =
                tracer.spanBuilder(BenchTracing.SPAN_BENCHMARK)
                        .setNoParent()
                        .setAttribute(BenchTracing.CONCURRENCY, options.concurrency().name())
                        .setAttribute(BenchTracing.TASK_COUNT, (long) catalog.size())
                        .startSpan();
        try (var unused = rootSpan.makeCurrent()) {
            var artifacts = setup.provision(paths, options.includes(Approach.XL));
            try {
                log.info(
                        "Running benchmarks ({}, grading={})...",
                        options.concurrency() == RunOptions.ConcurrencyMode.SEQUENTIAL
                                ? "sequential"
                                : "parallel",
                        options.grading() ? "on" : "off");
                return switch (options.concurrency()) {
                    case SEQUENTIAL -> runSequential(catalog, options, artifacts);
                    case CONCURRENT -> runConcurrent(catalog, options, artifacts);
                };
            } finally {
                setup.cleanup(artifacts);
            }
        } catch (RuntimeException e) {
            BenchTracing.recordFailure(rootSpan, e);
            throw e;
        } finally {
            rootSpan.end();
        }
    }

    private List<TaskOutcome> runSequential(
            TaskCatalog catalog, RunOptions options, SharedArtifacts artifacts) {
        var outcomes = new ArrayList<TaskOutcome>();
        int i = 0;
        for (var task : catalog) {
            log.info("[{}/{}] {}", ++i, catalog.size(), task.name());
            outcomes.addAll(runUnit(task, options, artifacts));
        }
        return outcomes;
    }

    private List<TaskOutcome> runConcurrent(
            TaskCatalog catalog, RunOptions options, SharedArtifacts artifacts) {
        var tasks = catalog.tasks();
        int n = tasks.size();
        // one slot per catalog position, each written by exactly one unit
        List<List<TaskOutcome>> slots = new ArrayList<>(Collections.nCopies(n, List.of()));
        ExecutorService executor =
                BenchTracing.contextPassing(
                        Executors.newFixedThreadPool(
                                Math.min(maxConcurrency, n), new WorkerThreadFactory()));
        try {
            CompletableFuture<?>[] units = new CompletableFuture<?>[n];
            for (int i = 0; i < n; i++) {
                final int index = i;
                final var task = tasks.get(i);
                units[i] =
                        CompletableFuture.runAsync(
                                () -> slots.set(index, runUnit(task, options, artifacts)),
                                executor);
            }
            try {
                CompletableFuture.allOf(units).join();
            } catch (CompletionException | CancellationException e) {
                for (var unit : units) {
                    unit.cancel(true);
                }
                throw e.getCause() instanceof RuntimeException re ? re : e;
            }
        } finally {
            executor.shutdownNow();
        }
        var outcomes = new ArrayList<TaskOutcome>();
        slots.forEach(outcomes::addAll);
        return outcomes;
    }

    /** Run every selected approach for one task, grading as configured. */
    List<TaskOutcome> runUnit(TaskDefinition task, RunOptions options, SharedArtifacts artifacts) {
        var taskSpan =
                tracer.spanBuilder(BenchTracing.SPAN_TASK)
                        .setAttribute(BenchTracing.TASK_ID, task.id())
                        .startSpan();
        try (var unused = taskSpan.makeCurrent()) {
            var outcomes = new ArrayList<TaskOutcome>(options.approaches().size());
            for (var approach : options.approaches()) {
                var outcome = runner.run(task, strategy(approach), artifacts);
                if (options.grading() && outcome.hasResponse()) {
                    outcome = outcome.withGrade(grade(task, outcome));
                }
                logProgress(outcome);
                outcomes.add(outcome);
            }
            return outcomes;
        } finally {
            taskSpan.end();
        }
    }

    private GradeResult grade(TaskDefinition task, TaskOutcome outcome) {
        var span =
                tracer.spanBuilder(BenchTracing.SPAN_GRADE)
                        .setAttribute(BenchTracing.TASK_ID, task.id())
                        .setAttribute(BenchTracing.APPROACH, outcome.approach().label())
                        .startSpan();
        try (var unused = span.makeCurrent()) {
            GradeResult result;
            try {
                result =
                        Objects.requireNonNull(
                                grader.grade(task, outcome.approach(), outcome.responseText().get()),
                                "grader returned null");
            } catch (Exception e) {
                log.warn("Grading failed: {}", e.getMessage());
                result = GradeResult.failure(e);
            }
            if (!result.grade().isReal()) {
                span.setStatus(StatusCode.ERROR, result.reason());
            }
            span.setAttribute(BenchTracing.GRADE, result.grade().symbol());
            return result;
        } finally {
            span.end();
        }
    }

    private ApproachStrategy strategy(Approach approach) {
        var strategy = strategies.get(approach);
        if (strategy == null) {
            throw new IllegalStateException("no strategy registered for " + approach);
        }
        return strategy;
    }

    private static void logProgress(TaskOutcome outcome) {
        var status = outcome.success() ? "OK" : "ERR: " + outcome.error().orElse("");
        var grade = outcome.grade().map(g -> " [" + g.symbol() + "]").orElse("");
        log.info(
                "[{}] {}: {} in / {} out ({}){}",
                outcome.taskName(),
                outcome.approach(),
                BenchUtils.formatTokens(outcome.inputTokens()),
                BenchUtils.formatTokens(outcome.outputTokens()),
                status,
                grade);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private @Nullable ApproachRunner runner;
        private @Nullable Grader grader;
        private @Nullable BenchmarkSetup setup;
        private @Nullable Tracer tracer;
        private final Map<Approach, ApproachStrategy> strategies = new EnumMap<>(Approach.class);
        private int maxConcurrency = 4;

        private Builder() {
            for (var approach : Approach.values()) {
                strategies.put(approach, ApproachStrategy.of(approach));
            }
        }

        public BenchmarkOrchestrator build() {
            if (tracer == null) {
                tracer = BenchTracing.getTracer();
            }
            if (maxConcurrency < 1) {
                throw new IllegalArgumentException("maxConcurrency must be at least 1");
            }
            return new BenchmarkOrchestrator(this);
        }

        public Builder runner(@Nonnull ApproachRunner runner) {
            this.runner = Objects.requireNonNull(runner);
            return this;
        }

        /** Grader for successful responses. May be omitted when grading is never enabled. */
        public Builder grader(@Nullable Grader grader) {
            this.grader = grader;
            return this;
        }

        public Builder setup(@Nonnull BenchmarkSetup setup) {
            this.setup = Objects.requireNonNull(setup);
            return this;
        }

        public Builder tracer(Tracer tracer) {
            this.tracer = tracer;
            return this;
        }

        public Builder strategy(@Nonnull ApproachStrategy strategy) {
            strategies.put(strategy.approach(), strategy);
            return this;
        }

        public Builder maxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(@Nonnull Runnable r) {
            var thread = new Thread(r, "tokenbench-worker-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
