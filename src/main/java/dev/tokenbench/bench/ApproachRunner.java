package dev.tokenbench.bench;

import dev.tokenbench.api.CompletionClient;
import dev.tokenbench.task.TaskDefinition;
import dev.tokenbench.trace.BenchTracing;
import io.opentelemetry.api.trace.Tracer;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one task under one approach with exactly one completion call.
 *
 * <p>Never throws for a failed call: the failure is recorded on a failed {@link TaskOutcome} with
 * zero tokens and the wall time spent up to the failure.
 */
@Slf4j
public class ApproachRunner {
    private final CompletionClient client;
    private final String model;
    private final long maxTokens;
    private final Tracer tracer;

    public ApproachRunner(CompletionClient client, String model, long maxTokens, Tracer tracer) {
        this.client = Objects.requireNonNull(client);
        this.model = Objects.requireNonNull(model);
        this.maxTokens = maxTokens;
        this.tracer = Objects.requireNonNull(tracer);
    }

    public TaskOutcome run(TaskDefinition task, ApproachStrategy strategy, SharedArtifacts artifacts) {
        var approach = strategy.approach();
        var span =
                tracer.spanBuilder(BenchTracing.SPAN_APPROACH)
                        .setAttribute(BenchTracing.TASK_ID, task.id())
                        .setAttribute(BenchTracing.APPROACH, approach.label())
                        .setAttribute(BenchTracing.MODEL, model)
                        .startSpan();
        long start = System.nanoTime();
        try (var unused = span.makeCurrent()) {
            var request = strategy.buildRequest(task, artifacts, model, maxTokens);
            var response = client.complete(request);
            long latencyMs = elapsedMillis(start);
            var outcome =
                    TaskOutcome.succeeded(
                            task,
                            approach,
                            response.usage().inputTokens(),
                            response.usage().outputTokens(),
                            latencyMs,
                            response.text());
            span.setAttribute(BenchTracing.SUCCESS, true);
            span.setAttribute(BenchTracing.INPUT_TOKENS, outcome.inputTokens());
            span.setAttribute(BenchTracing.OUTPUT_TOKENS, outcome.outputTokens());
            span.setAttribute(BenchTracing.TOTAL_TOKENS, outcome.totalTokens());
            span.setAttribute(BenchTracing.LATENCY_MS, latencyMs);
            return outcome;
        } catch (Exception e) {
            long latencyMs = elapsedMillis(start);
            log.debug("{} failed for task {}", approach, task.id(), e);
            BenchTracing.recordFailure(span, e);
            span.setAttribute(BenchTracing.SUCCESS, false);
            span.setAttribute(BenchTracing.LATENCY_MS, latencyMs);
            return TaskOutcome.failed(task, approach, latencyMs, describe(e));
        } finally {
            span.end();
        }
    }

    /** Human-readable description of a call failure. Never empty. */
    static String describe(Throwable t) {
        var message = t.getMessage();
        if (message == null || message.isBlank()) {
            return t.getClass().getSimpleName();
        }
        return message;
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
