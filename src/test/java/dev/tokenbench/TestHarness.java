package dev.tokenbench;

import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.tokenbench.api.ArtifactApiClient;
import dev.tokenbench.config.TokenBenchConfig;
import dev.tokenbench.trace.BenchTracing;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nonnull;
import lombok.Getter;
import lombok.experimental.Accessors;

/** Fake clients and an in-memory OpenTelemetry pipeline for unit tests. */
public class TestHarness {

    public static TestHarness setup() {
        return setup(createTestConfig());
    }

    public static TestHarness setup(TokenBenchConfig config) {
        return new TestHarness(config);
    }

    @Getter
    @Accessors(fluent = true)
    private final TokenBenchConfig config;

    @Getter
    @Accessors(fluent = true)
    private final OpenTelemetrySdk openTelemetry;

    @Getter
    @Accessors(fluent = true)
    private final FakeCompletionClient completionClient = new FakeCompletionClient();

    @Getter
    @Accessors(fluent = true)
    private final ArtifactApiClient.InMemoryImpl artifactClient = new ArtifactApiClient.InMemoryImpl();

    private final @Nonnull InMemorySpanExporter spanExporter;

    private TestHarness(TokenBenchConfig config) {
        this.config = config;
        this.spanExporter = InMemorySpanExporter.create();
        this.openTelemetry =
                OpenTelemetrySdk.builder()
                        .setTracerProvider(
                                SdkTracerProvider.builder()
                                        .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                                        .build())
                        .build();
    }

    public Tracer tracer() {
        return BenchTracing.getTracer(openTelemetry);
    }

    public TokenBench tokenBench() {
        return new TokenBench(config, completionClient, artifactClient, openTelemetry);
    }

    /** flush all pending spans and return all spans which have been exported so far */
    public List<SpanData> awaitExportedSpans() {
        assertTrue(
                openTelemetry
                        .getSdkTracerProvider()
                        .forceFlush()
                        .join(10, TimeUnit.SECONDS)
                        .isSuccess());
        return spanExporter.getFinishedSpanItems();
    }

    public static TokenBenchConfig createTestConfig() {
        return TokenBenchConfig.of(
                "ANTHROPIC_API_KEY", "test-key",
                // NOTE: testhost is not real, just a placeholder value
                "ANTHROPIC_BASE_URL", "https://testhost:8000",
                "TOKENBENCH_MODEL", "test-model",
                "TOKENBENCH_GRADER_MODEL", "test-grader",
                "TOKENBENCH_MAX_CONCURRENCY", "4");
    }

    public static TokenBenchConfig createTestConfig(Path resultsDir) {
        return TokenBenchConfig.builder()
                .apiKey("test-key")
                .baseUrl("https://testhost:8000")
                .model("test-model")
                .graderModel("test-grader")
                .resultsDir(resultsDir)
                .build();
    }
}
