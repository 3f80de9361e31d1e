package dev.tokenbench.api;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;

/** What the runner needs from a completion: the content fragments, usage and stop reason. */
public record CompletionResponse(
        @Nonnull List<ContentFragment> content, @Nonnull Usage usage, Optional<String> stopReason) {

    public CompletionResponse {
        content = List.copyOf(content);
        stopReason = stopReason == null ? Optional.empty() : stopReason;
    }

    /** Concatenation of every text fragment, in order. Non-text fragments are skipped. */
    public String text() {
        return content.stream()
                .filter(ContentFragment::isText)
                .map(ContentFragment::text)
                .collect(Collectors.joining());
    }

    /** One content block of a response. Only text blocks carry text. */
    public record ContentFragment(@Nonnull String type, String text) {
        public static final String TEXT = "text";

        public static ContentFragment ofText(String text) {
            return new ContentFragment(TEXT, text);
        }

        public static ContentFragment ofType(String type) {
            return new ContentFragment(type, null);
        }

        public boolean isText() {
            return TEXT.equals(type) && text != null;
        }
    }

    public record Usage(long inputTokens, long outputTokens) {
        public long totalTokens() {
            return inputTokens + outputTokens;
        }
    }
}
