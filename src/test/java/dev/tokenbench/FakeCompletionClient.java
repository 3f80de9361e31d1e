package dev.tokenbench;

import dev.tokenbench.api.CompletionClient;
import dev.tokenbench.api.CompletionRequest;
import dev.tokenbench.api.CompletionResponse;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * A completion client driven by a function of the request. Every request is recorded. Grading
 * requests (those carrying an output schema) go to a separate handler.
 */
public class FakeCompletionClient implements CompletionClient {
    private final List<CompletionRequest> requests = new CopyOnWriteArrayList<>();
    private volatile Function<CompletionRequest, CompletionResponse> taskHandler =
            request -> response(10, 5, "ok");
    private volatile Function<CompletionRequest, CompletionResponse> gradeHandler =
            request -> response(1, 1, "{\"grade\":\"A\",\"reason\":\"matches\"}");

    public FakeCompletionClient onTask(Function<CompletionRequest, CompletionResponse> handler) {
        this.taskHandler = handler;
        return this;
    }

    public FakeCompletionClient onGrade(Function<CompletionRequest, CompletionResponse> handler) {
        this.gradeHandler = handler;
        return this;
    }

    @Override
    public CompletionResponse complete(CompletionRequest request) {
        requests.add(request);
        return request.outputSchema().isPresent()
                ? gradeHandler.apply(request)
                : taskHandler.apply(request);
    }

    public List<CompletionRequest> requests() {
        return List.copyOf(requests);
    }

    public List<CompletionRequest> taskRequests() {
        return requests.stream().filter(r -> r.outputSchema().isEmpty()).toList();
    }

    public List<CompletionRequest> gradeRequests() {
        return requests.stream().filter(r -> r.outputSchema().isPresent()).toList();
    }

    public static CompletionResponse response(long in, long out, String text) {
        return new CompletionResponse(
                List.of(CompletionResponse.ContentFragment.ofText(text)),
                new CompletionResponse.Usage(in, out),
                Optional.of("end_turn"));
    }
}
