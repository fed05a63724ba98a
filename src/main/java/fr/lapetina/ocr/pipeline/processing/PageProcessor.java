package fr.lapetina.ocr.pipeline.processing;

import fr.lapetina.ocr.pipeline.domain.model.ErrorType;
import fr.lapetina.ocr.pipeline.domain.model.FallbackTextMode;
import fr.lapetina.ocr.pipeline.domain.model.InferenceResponse;
import fr.lapetina.ocr.pipeline.domain.model.PageRequest;
import fr.lapetina.ocr.pipeline.domain.model.PageResult;
import fr.lapetina.ocr.pipeline.domain.model.RenderedPage;
import fr.lapetina.ocr.pipeline.domain.model.SamplingParams;
import fr.lapetina.ocr.pipeline.infrastructure.http.InferenceClient;
import fr.lapetina.ocr.pipeline.infrastructure.metrics.PipelineMetrics;
import fr.lapetina.ocr.pipeline.infrastructure.render.PageSource;
import fr.lapetina.ocr.pipeline.infrastructure.render.SourceDocumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.BooleanSupplier;

/**
 * Turns one page of a document into exactly one {@link PageResult}.
 *
 * <p>Each attempt renders the page (on the render executor), builds a prompt,
 * calls the inference client and validates the completion. A rejected or failed
 * attempt is retried with escalated sampling parameters until {@code maxAttempts}
 * inference calls have been made; the page then falls back. The returned future
 * never completes exceptionally.
 */
public class PageProcessor {

    private static final Logger log = LoggerFactory.getLogger(PageProcessor.class);

    private final InferenceClient client;
    private final PageSource pageSource;
    private final Executor renderExecutor;
    private final PromptBuilder promptBuilder;
    private final PageResponseParser parser;
    private final SamplingSchedule schedule;
    private final String model;
    private final int maxAttempts;
    private final int targetLongestImageDim;
    private final Duration requestTimeout;
    private final FallbackTextMode fallbackTextMode;
    private final PipelineMetrics metrics;
    private final BooleanSupplier forcedShutdown;

    public PageProcessor(
            InferenceClient client,
            PageSource pageSource,
            Executor renderExecutor,
            PromptBuilder promptBuilder,
            PageResponseParser parser,
            SamplingSchedule schedule,
            String model,
            int maxAttempts,
            int targetLongestImageDim,
            Duration requestTimeout,
            FallbackTextMode fallbackTextMode,
            PipelineMetrics metrics,
            BooleanSupplier forcedShutdown
    ) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.client = client;
        this.pageSource = pageSource;
        this.renderExecutor = renderExecutor;
        this.promptBuilder = promptBuilder;
        this.parser = parser;
        this.schedule = schedule;
        this.model = model;
        this.maxAttempts = maxAttempts;
        this.targetLongestImageDim = targetLongestImageDim;
        this.requestTimeout = requestTimeout;
        this.fallbackTextMode = fallbackTextMode;
        this.metrics = metrics;
        this.forcedShutdown = forcedShutdown;
    }

    /**
     * Processes one page.
     *
     * @param pageNumber 1-based page number
     */
    public CompletableFuture<PageResult> process(String documentRef, int pageNumber) {
        PageState state = new PageState(documentRef, pageNumber);
        return attempt(state, schedule.initial())
                .exceptionally(ex -> {
                    Throwable cause = unwrap(ex);
                    if (cause instanceof SourceDocumentException) {
                        log.warn("Page unreadable, falling back: documentRef={}, page={}, error={}",
                                documentRef, pageNumber, cause.getMessage());
                    } else {
                        log.error("Unexpected error processing page: documentRef={}, page={}",
                                documentRef, pageNumber, cause);
                    }
                    state.lastReason = cause.getClass().getSimpleName() + ": " + cause.getMessage();
                    state.lastErrorType = null;
                    return fallback(state);
                })
                .whenComplete((result, ex) -> {
                    if (result != null) {
                        metrics.recordPage(result);
                        metrics.recordStage("page", Duration.between(state.startedAt, Instant.now()));
                    }
                });
    }

    private CompletableFuture<PageResult> attempt(PageState state, SamplingParams params) {
        if (forcedShutdown.getAsBoolean()) {
            state.lastReason = "Shutdown before attempt " + (state.attempts + 1);
            state.lastErrorType = ErrorType.CANCELLED;
            return CompletableFuture.completedFuture(fallback(state));
        }
        state.attempts++;
        int attempt = state.attempts;

        return CompletableFuture.supplyAsync(() -> prepare(state, params, attempt), renderExecutor)
                .thenCompose(request -> {
                    Instant sent = Instant.now();
                    return client.complete(request.toInferenceRequest(model), requestTimeout)
                            .thenApply(response -> {
                                metrics.recordStage("inference", Duration.between(sent, Instant.now()));
                                return response;
                            });
                })
                .thenCompose(response -> evaluate(state, params, response));
    }

    private PageRequest prepare(PageState state, SamplingParams params, int attempt) {
        Instant start = Instant.now();
        RenderedPage image = state.renders.computeIfAbsent(params.rotation(), rotation ->
                pageSource.render(state.documentRef, state.pageNumber, targetLongestImageDim, rotation));

        String anchor = null;
        if (params.usesAnchorText()) {
            String extracted = extractedText(state);
            anchor = extracted.length() > params.anchorTextLength()
                    ? extracted.substring(0, params.anchorTextLength())
                    : extracted;
        }
        metrics.recordStage("render", Duration.between(start, Instant.now()));

        return new PageRequest(
                state.documentRef, state.pageNumber, image, params, promptBuilder.build(anchor), attempt);
    }

    private CompletableFuture<PageResult> evaluate(PageState state, SamplingParams params, InferenceResponse response) {
        if (response.isError()) {
            state.lastErrorType = response.errorType();
            state.lastReason = response.errorType() + ": " + response.errorMessage();
            if (response.errorType() == ErrorType.CANCELLED) {
                return CompletableFuture.completedFuture(fallback(state));
            }
            log.warn("Page attempt failed: documentRef={}, page={}, attempt={}, errorType={}, error={}",
                    state.documentRef, state.pageNumber, state.attempts, response.errorType(), response.errorMessage());
            return retryOrFallback(state, schedule.next(params, state.attempts + 1, null),
                    response.errorType().name());
        }

        state.lastCompletion = response.text();
        state.lastErrorType = null;
        ParseOutcome outcome = parser.parse(response);
        if (outcome.isSuccess()) {
            log.debug("Page accepted: documentRef={}, page={}, attempt={}, inputTokens={}, outputTokens={}",
                    state.documentRef, state.pageNumber, state.attempts,
                    response.inputTokens(), response.outputTokens());
            return CompletableFuture.completedFuture(PageResult.accepted(
                    state.pageNumber, outcome.response(), response.inputTokens(), response.outputTokens(),
                    state.attempts));
        }

        state.lastReason = outcome.failure() + ": " + outcome.reason();
        log.warn("Page answer rejected: documentRef={}, page={}, attempt={}, failure={}, reason={}",
                state.documentRef, state.pageNumber, state.attempts, outcome.failure(), outcome.reason());
        return retryOrFallback(state, schedule.next(params, state.attempts + 1, outcome), outcome.failure().name());
    }

    private CompletableFuture<PageResult> retryOrFallback(PageState state, SamplingParams next, String reason) {
        if (state.attempts >= maxAttempts) {
            return CompletableFuture.completedFuture(fallback(state));
        }
        metrics.recordPageRetry(reason);
        log.debug("Retrying page: documentRef={}, page={}, nextAttempt={}, temperature={}, anchorLength={}, rotation={}",
                state.documentRef, state.pageNumber, state.attempts + 1,
                next.temperature(), next.anchorTextLength(), next.rotation());
        return attempt(state, next);
    }

    private PageResult fallback(PageState state) {
        String text;
        switch (fallbackTextMode) {
            case LAST_RESPONSE:
                text = state.lastCompletion != null ? state.lastCompletion : "";
                break;
            case EXTRACTED_TEXT:
                text = extractedText(state);
                break;
            case EMPTY:
            default:
                text = "";
                break;
        }
        log.warn("Page fell back: documentRef={}, page={}, attempts={}, errorType={}, reason={}",
                state.documentRef, state.pageNumber, state.attempts, state.lastErrorType, state.lastReason);
        return PageResult.fallback(state.pageNumber, text, state.lastReason, state.lastErrorType, state.attempts);
    }

    private String extractedText(PageState state) {
        String cached = state.extractedText;
        if (cached != null) {
            return cached;
        }
        String text;
        try {
            text = pageSource.extractText(state.documentRef, state.pageNumber);
        } catch (SourceDocumentException e) {
            log.debug("No text layer: documentRef={}, page={}, error={}",
                    state.documentRef, state.pageNumber, e.getMessage());
            text = "";
        }
        state.extractedText = text == null ? "" : text.strip();
        return state.extractedText;
    }

    private static Throwable unwrap(Throwable ex) {
        return ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
    }

    /**
     * Mutable progress of one page. Attempts run one after another, never concurrently.
     */
    private static final class PageState {
        final String documentRef;
        final int pageNumber;
        final Instant startedAt = Instant.now();
        final Map<Integer, RenderedPage> renders = new ConcurrentHashMap<>();
        volatile int attempts;
        volatile String extractedText;
        volatile String lastCompletion;
        volatile String lastReason;
        volatile ErrorType lastErrorType;

        PageState(String documentRef, int pageNumber) {
            this.documentRef = documentRef;
            this.pageNumber = pageNumber;
        }
    }
}
