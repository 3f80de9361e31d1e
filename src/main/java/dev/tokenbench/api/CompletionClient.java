package dev.tokenbench.api;

import com.anthropic.client.AnthropicClient;
import com.anthropic.client.okhttp.AnthropicOkHttpClient;
import com.anthropic.core.JsonValue;
import com.anthropic.models.beta.AnthropicBeta;
import com.anthropic.models.beta.messages.BetaContentBlock;
import com.anthropic.models.beta.messages.BetaMessage;
import com.anthropic.models.beta.messages.MessageCreateParams;
import dev.tokenbench.config.TokenBenchConfig;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * The completion service the benchmark drives. Implementations perform exactly one remote call per
 * {@link #complete} and never retry.
 */
public interface CompletionClient extends AutoCloseable {

    /**
     * Perform one completion call.
     *
     * @throws RuntimeException on any transport, timeout or API failure
     */
    CompletionResponse complete(CompletionRequest request);

    @Override
    default void close() {}

    static CompletionClient of(TokenBenchConfig config) {
        return new AnthropicImpl(config);
    }

    /** Calls the beta messages endpoint through the Anthropic Java SDK. */
    @Slf4j
    class AnthropicImpl implements CompletionClient {
        static final String CODE_EXECUTION_TOOL = "code_execution_20250825";
        private final AnthropicClient client;

        AnthropicImpl(TokenBenchConfig config) {
            this(
                    AnthropicOkHttpClient.builder()
                            .apiKey(config.apiKey())
                            .baseUrl(config.baseUrl())
                            .timeout(config.requestTimeout())
                            // failures are terminal for a (task, approach) attempt
                            .maxRetries(0)
                            .build());
        }

        public AnthropicImpl(AnthropicClient client) {
            this.client = Objects.requireNonNull(client);
        }

        @Override
        public CompletionResponse complete(CompletionRequest request) {
            var params = toParams(request);
            log.debug("completion request: model={} uploads={}", request.model(), request.containerUploads());
            BetaMessage message = client.beta().messages().create(params);
            return fromMessage(message);
        }

        @Override
        public void close() {
            client.close();
        }

        static MessageCreateParams toParams(CompletionRequest request) {
            var builder =
                    MessageCreateParams.builder()
                            .model(request.model())
                            .maxTokens(request.maxTokens());
            if (request.containerUploads().isEmpty()) {
                builder.addUserMessage(request.userText());
            } else {
                // container_upload blocks are passed as raw JSON through the typed setter
                List<Object> content = new ArrayList<>();
                content.add(Map.of("type", "text", "text", request.userText()));
                for (var fileId : request.containerUploads()) {
                    content.add(Map.of("type", "container_upload", "file_id", fileId));
                }
                builder.messages(
                        JsonValue.from(List.of(Map.of("role", "user", "content", content))));
            }
            request.system().ifPresent(builder::system);
            for (var beta : request.betas()) {
                builder.addBeta(AnthropicBeta.of(beta));
            }
            if (request.codeExecution()) {
                builder.tools(
                        JsonValue.from(
                                List.of(Map.of("type", CODE_EXECUTION_TOOL, "name", "code_execution"))));
            }
            if (!request.skills().isEmpty()) {
                var skills = request.skills().stream().map(CompletionRequest.SkillRef::toMap).toList();
                builder.putAdditionalBodyProperty("container", JsonValue.from(Map.of("skills", skills)));
            }
            request.outputSchema()
                    .ifPresent(
                            schema -> {
                                var format = new LinkedHashMap<String, Object>();
                                format.put("type", "json_schema");
                                format.put("schema", schema);
                                builder.putAdditionalBodyProperty(
                                        "output_format", JsonValue.from(format));
                            });
            return builder.build();
        }

        static CompletionResponse fromMessage(BetaMessage message) {
            var fragments = new ArrayList<CompletionResponse.ContentFragment>();
            for (BetaContentBlock block : message.content()) {
                fragments.add(
                        block.text()
                                .map(text -> CompletionResponse.ContentFragment.ofText(text.text()))
                                .orElseGet(() -> CompletionResponse.ContentFragment.ofType("non_text")));
            }
            var usage =
                    new CompletionResponse.Usage(
                            message.usage().inputTokens(), message.usage().outputTokens());
            return new CompletionResponse(
                    fragments, usage, message.stopReason().map(Object::toString));
        }
    }
}
