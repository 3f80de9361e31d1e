package dev.tokenbench.bench;

import static org.junit.jupiter.api.Assertions.*;

import dev.tokenbench.FakeCompletionClient;
import dev.tokenbench.TestHarness;
import dev.tokenbench.api.CompletionResponse;
import dev.tokenbench.task.Approach;
import dev.tokenbench.task.TaskDefinition;
import dev.tokenbench.trace.BenchTracing;
import io.opentelemetry.api.trace.StatusCode;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ApproachRunnerTest {
    private static final TaskDefinition TASK =
            TaskDefinition.of("revenue", "Total revenue", null, "Sum the revenue column", "42");
    private static final SharedArtifacts ARTIFACTS =
            SharedArtifacts.sampleOnly("file_sample", "sample.xlsx")
                    .withXl("file_bin", "xl-0.1.0-linux-amd64", "skill_xl");

    private TestHarness testHarness;
    private ApproachRunner runner;

    @BeforeEach
    void beforeEach() {
        testHarness = TestHarness.setup();
        runner =
                new ApproachRunner(
                        testHarness.completionClient(), "test-model", 1024, testHarness.tracer());
    }

    @Test
    void successfulCallRecordsUsageAndText() {
        testHarness
                .completionClient()
                .onTask(
                        request ->
                                new CompletionResponse(
                                        List.of(
                                                CompletionResponse.ContentFragment.ofText("Total: "),
                                                CompletionResponse.ContentFragment.ofType(
                                                        "server_tool_use"),
                                                CompletionResponse.ContentFragment.ofText("42")),
                                        new CompletionResponse.Usage(1500, 250),
                                        Optional.of("end_turn")));

        var outcome = runner.run(TASK, ApproachStrategy.of(Approach.XL), ARTIFACTS);

        assertTrue(outcome.success());
        assertEquals(Approach.XL, outcome.approach());
        assertEquals("revenue", outcome.taskId());
        assertEquals(1500, outcome.inputTokens());
        assertEquals(250, outcome.outputTokens());
        assertEquals(1750, outcome.totalTokens());
        assertEquals(Optional.of("Total: 42"), outcome.responseText());
        assertTrue(outcome.error().isEmpty());
        assertTrue(outcome.grade().isEmpty());

        var request = testHarness.completionClient().requests().get(0);
        assertEquals("test-model", request.model());
        assertEquals(1024, request.maxTokens());
        assertEquals("Sum the revenue column", request.userText());
    }

    @Test
    void failedCallYieldsZeroTokensAndError() {
        testHarness
                .completionClient()
                .onTask(
                        request -> {
                            throw new RuntimeException("429 rate limited");
                        });

        var outcome = runner.run(TASK, ApproachStrategy.of(Approach.XLSX), ARTIFACTS);

        assertFalse(outcome.success());
        assertEquals(0, outcome.inputTokens());
        assertEquals(0, outcome.outputTokens());
        assertEquals(0, outcome.totalTokens());
        assertEquals(Optional.of("429 rate limited"), outcome.error());
        assertTrue(outcome.responseText().isEmpty());
        assertTrue(outcome.latencyMs() >= 0);
        assertFalse(outcome.hasResponse());
    }

    @Test
    void failureWithoutMessageIsStillDescribed() {
        testHarness
                .completionClient()
                .onTask(
                        request -> {
                            throw new IllegalStateException();
                        });

        var outcome = runner.run(TASK, ApproachStrategy.of(Approach.XL), ARTIFACTS);

        assertEquals(Optional.of("IllegalStateException"), outcome.error());
    }

    @Test
    void missingHandleFailsOnlyThisAttempt() {
        var outcome =
                runner.run(
                        TASK,
                        ApproachStrategy.of(Approach.XL),
                        SharedArtifacts.sampleOnly("file_sample", "sample.xlsx"));

        assertFalse(outcome.success());
        assertTrue(outcome.error().orElseThrow().contains("xl skill"));
        assertTrue(testHarness.completionClient().requests().isEmpty());
    }

    @Test
    void emptyTextIsStoredAsAbsent() {
        testHarness.completionClient().onTask(request -> FakeCompletionClient.response(3, 0, ""));

        var outcome = runner.run(TASK, ApproachStrategy.of(Approach.XLSX), ARTIFACTS);

        assertTrue(outcome.success());
        assertTrue(outcome.responseText().isEmpty());
        assertFalse(outcome.hasResponse());
    }

    @Test
    void spanCarriesOutcomeAttributes() {
        runner.run(TASK, ApproachStrategy.of(Approach.XLSX), ARTIFACTS);
        testHarness
                .completionClient()
                .onTask(
                        request -> {
                            throw new RuntimeException("boom");
                        });
        runner.run(TASK, ApproachStrategy.of(Approach.XL), ARTIFACTS);

        var spans = testHarness.awaitExportedSpans();
        assertEquals(2, spans.size());
        var ok = spans.get(0);
        assertEquals(BenchTracing.SPAN_APPROACH, ok.getName());
        assertEquals("xlsx", ok.getAttributes().get(BenchTracing.APPROACH));
        assertEquals(15L, ok.getAttributes().get(BenchTracing.TOTAL_TOKENS));
        assertEquals(true, ok.getAttributes().get(BenchTracing.SUCCESS));

        var failed = spans.get(1);
        assertEquals(StatusCode.ERROR, failed.getStatus().getStatusCode());
        assertEquals(false, failed.getAttributes().get(BenchTracing.SUCCESS));
        assertFalse(failed.getEvents().isEmpty());
    }
}
