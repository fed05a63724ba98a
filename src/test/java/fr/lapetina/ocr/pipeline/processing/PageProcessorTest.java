package fr.lapetina.ocr.pipeline.processing;

import fr.lapetina.ocr.pipeline.domain.model.ErrorType;
import fr.lapetina.ocr.pipeline.domain.model.FallbackTextMode;
import fr.lapetina.ocr.pipeline.domain.model.PageResult;
import fr.lapetina.ocr.pipeline.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.ocr.pipeline.support.FakePageSource;
import fr.lapetina.ocr.pipeline.support.StubInferenceClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static fr.lapetina.ocr.pipeline.support.StubInferenceClient.completion;
import static fr.lapetina.ocr.pipeline.support.StubInferenceClient.pageJson;
import static org.assertj.core.api.Assertions.assertThat;

class PageProcessorTest {

    private static final String DOC = "/data/report.pdf";

    private FakePageSource pageSource;
    private MetricsRegistry metrics;
    private AtomicBoolean forced;

    @BeforeEach
    void setUp() {
        pageSource = new FakePageSource().withDocument(DOC, 3);
        metrics = new MetricsRegistry("test");
        forced = new AtomicBoolean(false);
    }

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    private PageProcessor processor(StubInferenceClient client, int maxAttempts, FallbackTextMode mode) {
        return new PageProcessor(
                client,
                pageSource,
                Runnable::run,
                new PromptBuilder(),
                new PageResponseParser(8192, new RepetitionDetector()),
                new SamplingSchedule(4500, 3000),
                "test-model",
                maxAttempts,
                1288,
                Duration.ofSeconds(5),
                mode,
                metrics,
                forced::get
        );
    }

    private static PageResult await(java.util.concurrent.CompletableFuture<PageResult> future) throws Exception {
        return future.get(10, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("should accept a page that answers correctly on the first attempt")
    void shouldAcceptFirstAttempt() throws Exception {
        StubInferenceClient client = StubInferenceClient.answering("Hello");

        PageResult result = await(processor(client, 4, FallbackTextMode.EMPTY).process(DOC, 1));

        assertThat(result.valid()).isTrue();
        assertThat(result.fallback()).isFalse();
        assertThat(result.text()).isEqualTo("Hello");
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(result.inputTokens()).isEqualTo(1000);
        assertThat(client.getRequests()).hasSize(1);
        assertThat(client.getRequests().get(0).prompt()).contains("text of page 1");
        assertThat(client.getRequests().get(0).temperature()).isEqualTo(0.1);
    }

    @Test
    @DisplayName("should retry malformed answers with escalated sampling until one is valid")
    void shouldRetryMalformedAnswers() throws Exception {
        StubInferenceClient client = new StubInferenceClient((request, call) ->
                call <= 2 ? completion(request, "{not json") : completion(request, pageJson("Recovered")));

        PageResult result = await(processor(client, 4, FallbackTextMode.EMPTY).process(DOC, 2));

        assertThat(result.valid()).isTrue();
        assertThat(result.text()).isEqualTo("Recovered");
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(client.getRequests()).extracting(r -> r.temperature()).containsExactly(0.1, 0.1, 0.2);
        assertThat(metrics.snapshot().pageRetries()).isEqualTo(2);
    }

    @Test
    @DisplayName("should stop after max attempts and fall back with the extracted text")
    void shouldFallBackAfterMaxAttempts() throws Exception {
        StubInferenceClient client = new StubInferenceClient((request, call) -> completion(request, "garbage"));

        PageResult result = await(processor(client, 3, FallbackTextMode.EXTRACTED_TEXT).process(DOC, 3));

        assertThat(result.fallback()).isTrue();
        assertThat(result.valid()).isFalse();
        assertThat(result.text()).isEqualTo("text of page 3");
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(result.errorReason()).startsWith("JSON_DECODE");
        assertThat(client.callsFor(DOC, 3)).isEqualTo(3);
        assertThat(metrics.snapshot().pagesFallback()).isEqualTo(1);
    }

    @Test
    @DisplayName("should keep the last raw completion when configured to")
    void shouldFallBackToLastResponse() throws Exception {
        StubInferenceClient client = new StubInferenceClient((request, call) ->
                completion(request, "raw answer " + call));

        PageResult result = await(processor(client, 2, FallbackTextMode.LAST_RESPONSE).process(DOC, 1));

        assertThat(result.text()).isEqualTo("raw answer 2");
    }

    @Test
    @DisplayName("should mark pages lost to an unreachable backend")
    void shouldRecordConnectivityFallback() throws Exception {
        PageResult result = await(processor(StubInferenceClient.unreachable(), 2, FallbackTextMode.EMPTY)
                .process(DOC, 1));

        assertThat(result.fallback()).isTrue();
        assertThat(result.errorType()).isEqualTo(ErrorType.NETWORK_ERROR);
        assertThat(result.lostToConnectivity()).isTrue();
        assertThat(result.text()).isEmpty();
    }

    @Test
    @DisplayName("should re-render the page with the reported rotation correction")
    void shouldRotateAfterInvalidRotation() throws Exception {
        String rotated = "{\"primary_language\":\"en\",\"is_rotation_valid\":false,\"rotation_correction\":90,"
                + "\"is_table\":false,\"is_diagram\":false,\"natural_text\":\"sideways\"}";
        StubInferenceClient client = new StubInferenceClient((request, call) ->
                call == 1 ? completion(request, rotated) : completion(request, pageJson("Upright")));

        PageResult result = await(processor(client, 4, FallbackTextMode.EMPTY).process(DOC, 1));

        assertThat(result.text()).isEqualTo("Upright");
        assertThat(pageSource.getRenderedRotations()).containsExactly(0, 90);
    }

    @Test
    @DisplayName("should fall back without calling the backend once shutdown is forced")
    void shouldFallBackWhenForced() throws Exception {
        StubInferenceClient client = StubInferenceClient.answering("never");
        forced.set(true);

        PageResult result = await(processor(client, 4, FallbackTextMode.EMPTY).process(DOC, 1));

        assertThat(result.fallback()).isTrue();
        assertThat(result.errorType()).isEqualTo(ErrorType.CANCELLED);
        assertThat(client.getRequests()).isEmpty();
    }

    @Test
    @DisplayName("should fall back when the page cannot be rendered")
    void shouldFallBackOnUnreadablePage() throws Exception {
        StubInferenceClient client = StubInferenceClient.answering("never");

        PageResult result = await(processor(client, 4, FallbackTextMode.EMPTY).process("/missing.pdf", 1));

        assertThat(result.fallback()).isTrue();
        assertThat(result.errorReason()).contains("SourceDocumentException");
        assertThat(client.getRequests()).isEmpty();
    }
}
