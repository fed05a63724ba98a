package fr.lapetina.ocr.pipeline.domain.model;

import java.util.Objects;

/**
 * Everything needed for one inference attempt on one page.
 * Created per attempt and discarded after use.
 */
public record PageRequest(
        String documentRef,
        int pageNumber,
        RenderedPage renderedImage,
        SamplingParams samplingParams,
        String prompt,
        int attempt
) {
    public PageRequest {
        Objects.requireNonNull(documentRef, "Document reference is required");
        Objects.requireNonNull(renderedImage, "Rendered image is required");
        Objects.requireNonNull(samplingParams, "Sampling params are required");
        Objects.requireNonNull(prompt, "Prompt is required");
        if (pageNumber < 1) {
            throw new IllegalArgumentException("Page numbers are 1-based: " + pageNumber);
        }
    }

    /**
     * Builds the wire request for the given served model.
     */
    public InferenceRequest toInferenceRequest(String model) {
        return InferenceRequest.builder()
                .model(model)
                .prompt(prompt)
                .imageBase64(renderedImage.base64Png())
                .temperature(samplingParams.temperature())
                .maxTokens(samplingParams.maxTokens())
                .correlationId(documentRef + "-" + pageNumber)
                .build();
    }
}
