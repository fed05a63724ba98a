package fr.lapetina.ocr.pipeline.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Represents a completion request for the vision model endpoint.
 * Immutable and thread-safe.
 */
public record InferenceRequest(
        String requestId,
        String model,
        String prompt,
        String imageBase64,
        double temperature,
        int maxTokens,
        Instant createdAt,
        String correlationId
) {
    public InferenceRequest {
        Objects.requireNonNull(model, "Model is required");
        Objects.requireNonNull(prompt, "Prompt is required");
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (correlationId == null) {
            correlationId = requestId;
        }
    }

    /**
     * Creates a vision request for one rendered page.
     *
     * @param model       served model name
     * @param prompt      text prompt
     * @param imageBase64 base64-encoded PNG
     * @param params      sampling parameters for this attempt
     */
    public static InferenceRequest ofPage(String model, String prompt, String imageBase64, SamplingParams params) {
        return new InferenceRequest(
                null, model, prompt, imageBase64, params.temperature(), params.maxTokens(), null, null
        );
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private String model;
        private String prompt;
        private String imageBase64;
        private double temperature;
        private int maxTokens = 4500;
        private Instant createdAt;
        private String correlationId;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder prompt(String prompt) {
            this.prompt = prompt;
            return this;
        }

        public Builder imageBase64(String imageBase64) {
            this.imageBase64 = imageBase64;
            return this;
        }

        public Builder temperature(double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder maxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public InferenceRequest build() {
            return new InferenceRequest(
                    requestId, model, prompt, imageBase64, temperature, maxTokens, createdAt, correlationId
            );
        }
    }
}
