package fr.lapetina.ocr.pipeline.processing;

/**
 * Detects completions that end in a repetition loop, a common failure mode
 * of generative models at low temperature.
 *
 * <p>A text is degenerate when its tail is some unit of at most {@code maxPeriod}
 * characters repeated at least {@code minRepeats} times, covering at least
 * {@code minSpanChars} characters.
 */
public final class RepetitionDetector {

    private final int maxPeriod;
    private final int minRepeats;
    private final int minSpanChars;

    public RepetitionDetector(int maxPeriod, int minRepeats, int minSpanChars) {
        this.maxPeriod = maxPeriod;
        this.minRepeats = minRepeats;
        this.minSpanChars = minSpanChars;
    }

    public RepetitionDetector() {
        this(100, 10, 500);
    }

    public boolean isDegenerate(String text) {
        if (text == null) {
            return false;
        }
        String trimmed = text.stripTrailing();
        int length = trimmed.length();
        if (length < minSpanChars) {
            return false;
        }
        for (int period = 1; period <= maxPeriod && period * minRepeats <= length; period++) {
            int repeats = tailRepeats(trimmed, period);
            if (repeats >= minRepeats && repeats * period >= minSpanChars) {
                return true;
            }
        }
        return false;
    }

    /**
     * Number of consecutive copies of the last {@code period} characters at the end of {@code text}.
     */
    static int tailRepeats(String text, int period) {
        int length = text.length();
        int repeats = 1;
        int unitStart = length - period;
        for (int start = unitStart - period; start >= 0; start -= period) {
            if (!text.regionMatches(start, text, unitStart, period)) {
                break;
            }
            repeats++;
        }
        return repeats;
    }
}
