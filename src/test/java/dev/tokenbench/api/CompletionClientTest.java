package dev.tokenbench.api;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.junit.jupiter.api.Assertions.*;

import com.anthropic.client.okhttp.AnthropicOkHttpClient;
import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

public class CompletionClientTest {

    @RegisterExtension
    static WireMockExtension wireMock =
            WireMockExtension.newInstance().options(wireMockConfig().dynamicPort()).build();

    private CompletionClient completionClient;

    @BeforeEach
    void beforeEach() {
        wireMock.resetAll();
        completionClient =
                new CompletionClient.AnthropicImpl(
                        AnthropicOkHttpClient.builder()
                                .apiKey("test-api-key")
                                .baseUrl("http://localhost:" + wireMock.getPort())
                                .maxRetries(0)
                                .build());
    }

    @AfterEach
    void afterEach() {
        completionClient.close();
    }

    @Test
    void containerRequestCarriesUploadsSkillsAndTool() {
        stubMessage(
                """
                [
                  {"type": "text", "text": "Revenue is "},
                  {"type": "server_tool_use", "id": "srvtoolu_01", "name": "code_execution", "input": {}},
                  {"type": "text", "text": "42."}
                ]
                """);

        var response =
                completionClient.complete(
                        CompletionRequest.builder()
                                .model("claude-sonnet-4-5-20250929")
                                .maxTokens(2048)
                                .system(Optional.of("You have access to the xl CLI tool."))
                                .userText("What is the total revenue?")
                                .containerUploads(List.of("file_bin", "file_sample"))
                                .skills(List.of(CompletionRequest.SkillRef.custom("skill_123")))
                                .codeExecution(true)
                                .betas(List.of("code-execution-2025-08-25", "skills-2025-10-02"))
                                .build());

        assertEquals("Revenue is 42.", response.text());
        assertEquals(3, response.content().size());
        assertEquals(1200, response.usage().inputTokens());
        assertEquals(300, response.usage().outputTokens());
        assertEquals(Optional.of("end_turn"), response.stopReason());

        wireMock.verify(
                postRequestedFor(urlPathEqualTo("/v1/messages"))
                        .withHeader("x-api-key", equalTo("test-api-key"))
                        .withHeader("anthropic-beta", containing("code-execution-2025-08-25"))
                        .withHeader("anthropic-beta", containing("skills-2025-10-02"))
                        .withRequestBody(matchingJsonPath("$.model", equalTo("claude-sonnet-4-5-20250929")))
                        .withRequestBody(matchingJsonPath("$.max_tokens", equalTo("2048")))
                        .withRequestBody(
                                matchingJsonPath(
                                        "$.system", equalTo("You have access to the xl CLI tool.")))
                        .withRequestBody(
                                matchingJsonPath(
                                        "$.messages[0].content[0].text",
                                        equalTo("What is the total revenue?")))
                        .withRequestBody(
                                matchingJsonPath(
                                        "$.messages[0].content[1].type", equalTo("container_upload")))
                        .withRequestBody(
                                matchingJsonPath("$.messages[0].content[2].file_id", equalTo("file_sample")))
                        .withRequestBody(
                                matchingJsonPath(
                                        "$.tools[0].type",
                                        equalTo(CompletionClient.AnthropicImpl.CODE_EXECUTION_TOOL)))
                        .withRequestBody(
                                matchingJsonPath("$.container.skills[0].skill_id", equalTo("skill_123")))
                        .withRequestBody(
                                matchingJsonPath("$.container.skills[0].type", equalTo("custom"))));
    }

    @Test
    void plainRequestSendsTextMessageAndOutputFormat() {
        stubMessage(
                """
                [{"type": "text", "text": "{\\"grade\\": \\"A\\", \\"reason\\": \\"correct\\"}"}]
                """);

        var response =
                completionClient.complete(
                        CompletionRequest.builder()
                                .model("grader")
                                .maxTokens(256)
                                .userText("grade this")
                                .betas(List.of("structured-outputs-2025-11-13"))
                                .outputSchema(Optional.of(Map.of("type", "object")))
                                .build());

        assertEquals("{\"grade\": \"A\", \"reason\": \"correct\"}", response.text());
        wireMock.verify(
                postRequestedFor(urlPathEqualTo("/v1/messages"))
                        .withRequestBody(matchingJsonPath("$.messages[0].role", equalTo("user")))
                        .withRequestBody(matchingJsonPath("$.output_format.type", equalTo("json_schema")))
                        .withRequestBody(
                                matchingJsonPath("$.output_format.schema.type", equalTo("object")))
                        .withRequestBody(notContaining("container_upload"))
                        .withRequestBody(notContaining("\"tools\"")));
    }

    @Test
    void errorStatusIsThrown() {
        wireMock.stubFor(
                post(urlPathEqualTo("/v1/messages"))
                        .willReturn(
                                aResponse()
                                        .withStatus(500)
                                        .withHeader("Content-Type", "application/json")
                                        .withBody(
                                                "{\"type\": \"error\", \"error\": {\"type\": \"api_error\", \"message\": \"boom\"}}")));

        assertThrows(
                RuntimeException.class,
                () ->
                        completionClient.complete(
                                CompletionRequest.builder()
                                        .model("m")
                                        .maxTokens(10)
                                        .userText("hi")
                                        .build()));
        assertEquals(1, wireMock.getAllServeEvents().size());
    }

    private static void stubMessage(String contentJson) {
        wireMock.stubFor(
                post(urlPathEqualTo("/v1/messages"))
                        .willReturn(
                                aResponse()
                                        .withStatus(200)
                                        .withHeader("Content-Type", "application/json")
                                        .withBody(
                                                """
                                                {
                                                  "id": "msg_01",
                                                  "type": "message",
                                                  "role": "assistant",
                                                  "model": "claude-sonnet-4-5-20250929",
                                                  "content": %s,
                                                  "stop_reason": "end_turn",
                                                  "stop_sequence": null,
                                                  "usage": {"input_tokens": 1200, "output_tokens": 300}
                                                }
                                                """
                                                        .formatted(contentJson))));
    }
}
