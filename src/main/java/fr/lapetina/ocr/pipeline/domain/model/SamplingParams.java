package fr.lapetina.ocr.pipeline.domain.model;

/**
 * Per-attempt prompt parameters for one page.
 *
 * @param temperature      sampling temperature sent to the model
 * @param maxTokens        completion token budget
 * @param anchorTextLength characters of extracted page text to include in the prompt, -1 for none
 * @param rotation         clockwise rotation applied to the rendered image (0, 90, 180, 270)
 */
public record SamplingParams(
        double temperature,
        int maxTokens,
        int anchorTextLength,
        int rotation
) {
    public SamplingParams {
        if (temperature < 0) {
            throw new IllegalArgumentException("Temperature must be >= 0");
        }
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive");
        }
        if (rotation != 0 && rotation != 90 && rotation != 180 && rotation != 270) {
            throw new IllegalArgumentException("Invalid rotation: " + rotation);
        }
    }

    public boolean usesAnchorText() {
        return anchorTextLength > 0;
    }
}
