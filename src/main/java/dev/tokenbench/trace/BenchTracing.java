package dev.tokenbench.trace;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import java.util.concurrent.ExecutorService;

/** Span names, attribute keys and tracer access for benchmark runs. */
public final class BenchTracing {
    public static final String INSTRUMENTATION_NAME = "tokenbench";
    public static final String INSTRUMENTATION_VERSION = "0.1.0";

    public static final String SPAN_BENCHMARK = "benchmark";
    public static final String SPAN_TASK = "task";
    public static final String SPAN_APPROACH = "approach";
    public static final String SPAN_GRADE = "grade";

    public static final AttributeKey<String> TASK_ID = AttributeKey.stringKey("tokenbench.task_id");
    public static final AttributeKey<String> APPROACH = AttributeKey.stringKey("tokenbench.approach");
    public static final AttributeKey<String> MODEL = AttributeKey.stringKey("tokenbench.model");
    public static final AttributeKey<String> CONCURRENCY =
            AttributeKey.stringKey("tokenbench.concurrency");
    public static final AttributeKey<Long> TASK_COUNT = AttributeKey.longKey("tokenbench.task_count");
    public static final AttributeKey<Boolean> SUCCESS = AttributeKey.booleanKey("tokenbench.success");
    public static final AttributeKey<Long> INPUT_TOKENS =
            AttributeKey.longKey("tokenbench.input_tokens");
    public static final AttributeKey<Long> OUTPUT_TOKENS =
            AttributeKey.longKey("tokenbench.output_tokens");
    public static final AttributeKey<Long> TOTAL_TOKENS =
            AttributeKey.longKey("tokenbench.total_tokens");
    public static final AttributeKey<Long> LATENCY_MS = AttributeKey.longKey("tokenbench.latency_ms");
    public static final AttributeKey<String> GRADE = AttributeKey.stringKey("tokenbench.grade");

    private BenchTracing() {}

    public static Tracer getTracer() {
        return getTracer(GlobalOpenTelemetry.get());
    }

    public static Tracer getTracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer(INSTRUMENTATION_NAME, INSTRUMENTATION_VERSION);
    }

    /** Mark the span failed and attach the exception. */
    public static void recordFailure(Span span, Throwable t) {
        span.setStatus(StatusCode.ERROR, String.valueOf(t.getMessage()));
        span.recordException(t);
    }

    /**
     * Wraps an executor so every submitted task runs under the context that was current at
     * submission. Spans started by workers then parent to the submitting span.
     */
    public static ExecutorService contextPassing(ExecutorService executor) {
        return Context.taskWrapping(executor);
    }
}
