package fr.lapetina.ocr.pipeline.processing;

import fr.lapetina.ocr.pipeline.domain.model.PageResponse;

import java.util.Objects;

/**
 * Result of validating one completion: an accepted {@link PageResponse},
 * or the reason it was rejected.
 *
 * @param response parsed answer; also set for rejections that happen after parsing
 */
public record ParseOutcome(PageResponse response, Failure failure, String reason) {

    /**
     * Why a completion was rejected.
     */
    public enum Failure {
        /** Generation stopped at the token budget */
        TRUNCATED,
        /** Prompt plus completion exceeded the model context */
        CONTEXT_OVERFLOW,
        /** Content is not parseable JSON */
        JSON_DECODE,
        /** JSON with missing, unknown or out-of-range fields */
        SCHEMA,
        /** Model reports the page is not upright */
        INVALID_ROTATION,
        INVALID_LANGUAGE,
        EMPTY_TEXT,
        /** Text ends in a long repetition loop */
        DEGENERATE
    }

    public ParseOutcome {
        if (failure == null) {
            Objects.requireNonNull(response, "Accepted outcome needs a response");
        }
    }

    public static ParseOutcome success(PageResponse response) {
        return new ParseOutcome(response, null, null);
    }

    public static ParseOutcome failure(Failure failure, String reason) {
        return new ParseOutcome(null, failure, reason);
    }

    public static ParseOutcome failure(Failure failure, String reason, PageResponse response) {
        return new ParseOutcome(response, failure, reason);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
