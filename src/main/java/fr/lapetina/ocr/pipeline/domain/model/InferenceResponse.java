package fr.lapetina.ocr.pipeline.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of one completion call: either generated text with usage counts,
 * or a typed error. Immutable and thread-safe.
 */
public record InferenceResponse(
        String requestId,
        String model,
        String text,
        String finishReason,
        int inputTokens,
        int outputTokens,
        int transportAttempts,
        Instant createdAt,
        Instant completedAt,
        Duration totalDuration,
        ErrorType errorType,
        String errorMessage
) {
    public InferenceResponse {
        Objects.requireNonNull(requestId, "Request ID is required");
        if (completedAt == null) {
            completedAt = Instant.now();
        }
        if (createdAt != null && totalDuration == null) {
            totalDuration = Duration.between(createdAt, completedAt);
        }
    }

    public boolean isSuccess() {
        return errorType == null;
    }

    public boolean isError() {
        return errorType != null;
    }

    public int totalTokens() {
        return inputTokens + outputTokens;
    }

    /**
     * Creates a successful response.
     */
    public static InferenceResponse success(
            String requestId,
            String model,
            String text,
            int inputTokens,
            int outputTokens,
            Instant createdAt
    ) {
        return new InferenceResponse(
                requestId, model, text, "stop", inputTokens, outputTokens, 1,
                createdAt, Instant.now(), null, null, null
        );
    }

    /**
     * Creates an error response.
     */
    public static InferenceResponse error(
            String requestId,
            String model,
            ErrorType errorType,
            String errorMessage,
            Instant createdAt
    ) {
        return new InferenceResponse(
                requestId, model, null, null, 0, 0, 1,
                createdAt, Instant.now(), null, errorType, errorMessage
        );
    }

    /**
     * Returns a copy carrying the number of transport attempts the client spent.
     */
    public InferenceResponse withTransportAttempts(int attempts) {
        return new InferenceResponse(
                requestId, model, text, finishReason, inputTokens, outputTokens, attempts,
                createdAt, completedAt, totalDuration, errorType, errorMessage
        );
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private String model;
        private String text;
        private String finishReason;
        private int inputTokens;
        private int outputTokens;
        private int transportAttempts = 1;
        private Instant createdAt;
        private Instant completedAt;
        private Duration totalDuration;
        private ErrorType errorType;
        private String errorMessage;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder finishReason(String finishReason) {
            this.finishReason = finishReason;
            return this;
        }

        public Builder inputTokens(int inputTokens) {
            this.inputTokens = inputTokens;
            return this;
        }

        public Builder outputTokens(int outputTokens) {
            this.outputTokens = outputTokens;
            return this;
        }

        public Builder transportAttempts(int transportAttempts) {
            this.transportAttempts = transportAttempts;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder totalDuration(Duration totalDuration) {
            this.totalDuration = totalDuration;
            return this;
        }

        public Builder errorType(ErrorType errorType) {
            this.errorType = errorType;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public InferenceResponse build() {
            return new InferenceResponse(
                    requestId, model, text, finishReason, inputTokens, outputTokens, transportAttempts,
                    createdAt, completedAt, totalDuration, errorType, errorMessage
            );
        }
    }
}
