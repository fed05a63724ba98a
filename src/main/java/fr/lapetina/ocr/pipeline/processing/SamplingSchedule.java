package fr.lapetina.ocr.pipeline.processing;

import fr.lapetina.ocr.pipeline.domain.model.SamplingParams;

/**
 * Escalation of sampling parameters across the attempts on one page.
 *
 * <ul>
 *   <li>Temperature follows a fixed ladder indexed by attempt; attempts past its end reuse the last rung.</li>
 *   <li>Anchor text is dropped on the last two rungs, so the image alone drives those attempts.</li>
 *   <li>Anchor length is halved after a context overflow or a JSON decode failure.</li>
 *   <li>After the model reports a wrong rotation, the image is rotated by its correction.</li>
 * </ul>
 */
public final class SamplingSchedule {

    static final double[] TEMPERATURES = {0.1, 0.1, 0.2, 0.3, 0.5, 0.8, 0.1, 0.8};

    private static final int IMAGE_ONLY_FROM = TEMPERATURES.length - 2;

    private final int maxTokens;
    private final int anchorTextLength;

    public SamplingSchedule(int maxTokens, int anchorTextLength) {
        this.maxTokens = maxTokens;
        this.anchorTextLength = anchorTextLength;
    }

    /**
     * Parameters for the first attempt.
     */
    public SamplingParams initial() {
        return new SamplingParams(TEMPERATURES[0], maxTokens, anchorTextLength, 0);
    }

    /**
     * Parameters for attempt {@code attempt} (1-based), given the previous attempt's parameters
     * and why it failed.
     *
     * @param failure validation failure of the previous attempt, or null for an inference error
     */
    public SamplingParams next(SamplingParams previous, int attempt, ParseOutcome failure) {
        int rung = Math.min(attempt, TEMPERATURES.length) - 1;
        double temperature = TEMPERATURES[rung];

        int anchor = previous.anchorTextLength();
        int rotation = previous.rotation();
        if (failure != null && failure.failure() != null) {
            switch (failure.failure()) {
                case CONTEXT_OVERFLOW:
                case JSON_DECODE:
                    anchor = anchor > 0 ? anchor / 2 : anchor;
                    break;
                case INVALID_ROTATION:
                    Integer correction = failure.response() != null ? failure.response().rotationCorrection() : null;
                    if (correction != null) {
                        rotation = Math.floorMod(rotation + correction, 360);
                    }
                    break;
                default:
                    break;
            }
        }
        if (rung >= IMAGE_ONLY_FROM) {
            anchor = -1;
        }
        return new SamplingParams(temperature, maxTokens, anchor, rotation);
    }
}
