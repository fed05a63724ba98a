package fr.lapetina.ocr.pipeline.support;

import fr.lapetina.ocr.pipeline.domain.model.ErrorType;
import fr.lapetina.ocr.pipeline.domain.model.InferenceRequest;
import fr.lapetina.ocr.pipeline.domain.model.InferenceResponse;
import fr.lapetina.ocr.pipeline.infrastructure.http.InferenceClient;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * Inference client answering from a script instead of the network.
 *
 * <p>The script receives the request and the 1-based number of calls already made
 * for the same page (keyed by correlation id), so a test can fail a page a fixed
 * number of times before answering.
 */
public class StubInferenceClient extends InferenceClient {

    private final BiFunction<InferenceRequest, Integer, InferenceResponse> script;
    private final Map<String, AtomicInteger> callsPerPage = new ConcurrentHashMap<>();
    private final List<InferenceRequest> requests = new CopyOnWriteArrayList<>();

    public StubInferenceClient(BiFunction<InferenceRequest, Integer, InferenceResponse> script) {
        super(URI.create("http://localhost:1"));
        this.script = script;
    }

    /**
     * Client that accepts every page with the given text.
     */
    public static StubInferenceClient answering(String naturalText) {
        return new StubInferenceClient((request, call) -> completion(request, pageJson(naturalText)));
    }

    /**
     * Client whose backend is never reachable.
     */
    public static StubInferenceClient unreachable() {
        return new StubInferenceClient((request, call) -> InferenceResponse.error(
                request.requestId(), request.model(), ErrorType.NETWORK_ERROR,
                "ConnectException: Connection refused", request.createdAt()));
    }

    public static InferenceResponse completion(InferenceRequest request, String content) {
        return InferenceResponse.success(request.requestId(), request.model(), content, 1000, 200, Instant.now());
    }

    public static String pageJson(String naturalText) {
        return "{\"primary_language\":\"en\",\"is_rotation_valid\":true,\"rotation_correction\":0,"
                + "\"is_table\":false,\"is_diagram\":false,\"natural_text\":\"" + naturalText + "\"}";
    }

    @Override
    public CompletableFuture<InferenceResponse> complete(InferenceRequest request, Duration timeout) {
        requests.add(request);
        int call = callsPerPage.computeIfAbsent(request.correlationId(), k -> new AtomicInteger()).incrementAndGet();
        return CompletableFuture.supplyAsync(() -> script.apply(request, call));
    }

    @Override
    public CompletableFuture<Boolean> isReady() {
        return CompletableFuture.completedFuture(true);
    }

    @Override
    public CompletableFuture<List<String>> listModels(Duration timeout) {
        return CompletableFuture.completedFuture(List.of("test-model"));
    }

    public List<InferenceRequest> getRequests() {
        return requests;
    }

    public int callsFor(String documentRef, int pageNumber) {
        AtomicInteger calls = callsPerPage.get(documentRef + "-" + pageNumber);
        return calls == null ? 0 : calls.get();
    }
}
