package fr.lapetina.ocr.pipeline.processing;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.ocr.pipeline.domain.model.InferenceResponse;
import fr.lapetina.ocr.pipeline.domain.model.PageResponse;
import fr.lapetina.ocr.pipeline.processing.ParseOutcome.Failure;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Strict validation of a completion into a {@link PageResponse}.
 *
 * <p>Checks run in order and the first failure wins: truncation, context usage,
 * JSON shape (exactly the six known fields), rotation, language, text content,
 * repetition.
 */
public final class PageResponseParser {

    private static final Set<Integer> ROTATIONS = Set.of(0, 90, 180, 270);
    private static final Pattern LANGUAGE = Pattern.compile("[A-Za-z]{2,8}");

    private final ObjectMapper objectMapper;
    private final int modelMaxContext;
    private final RepetitionDetector repetitionDetector;

    /**
     * @param modelMaxContext total token limit of the model, 0 to skip the usage check
     */
    public PageResponseParser(int modelMaxContext, RepetitionDetector repetitionDetector) {
        this.modelMaxContext = modelMaxContext;
        this.repetitionDetector = repetitionDetector;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true)
                .configure(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES, true)
                .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true)
                .configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false);
    }

    public ParseOutcome parse(InferenceResponse completion) {
        if ("length".equals(completion.finishReason())) {
            return ParseOutcome.failure(Failure.TRUNCATED,
                    "Completion truncated at " + completion.outputTokens() + " tokens");
        }
        if (modelMaxContext > 0 && completion.totalTokens() > modelMaxContext) {
            return ParseOutcome.failure(Failure.CONTEXT_OVERFLOW,
                    "Usage " + completion.totalTokens() + " exceeds model context " + modelMaxContext);
        }

        String content = completion.text();
        if (content == null || content.isBlank()) {
            return ParseOutcome.failure(Failure.JSON_DECODE, "Empty completion");
        }

        PageResponse response;
        try {
            response = objectMapper.readValue(content, PageResponse.class);
        } catch (JsonParseException e) {
            return ParseOutcome.failure(Failure.JSON_DECODE, "Invalid JSON: " + e.getOriginalMessage());
        } catch (JsonProcessingException e) {
            return ParseOutcome.failure(Failure.SCHEMA, "Unexpected JSON shape: " + e.getOriginalMessage());
        }
        if (response == null) {
            return ParseOutcome.failure(Failure.SCHEMA, "Completion is JSON null");
        }

        return validate(response);
    }

    ParseOutcome validate(PageResponse response) {
        if (response.rotationValid() == null || response.rotationCorrection() == null
                || response.table() == null || response.diagram() == null) {
            return ParseOutcome.failure(Failure.SCHEMA, "Boolean and rotation fields must not be null", response);
        }
        if (!ROTATIONS.contains(response.rotationCorrection())) {
            return ParseOutcome.failure(Failure.SCHEMA,
                    "Invalid rotation_correction " + response.rotationCorrection(), response);
        }
        if (response.rotationValid() && response.rotationCorrection() != 0) {
            return ParseOutcome.failure(Failure.SCHEMA,
                    "Valid rotation with non-zero correction " + response.rotationCorrection(), response);
        }
        if (!response.rotationValid()) {
            return ParseOutcome.failure(Failure.INVALID_ROTATION,
                    "Page rotated, correction " + response.rotationCorrection(), response);
        }
        if (response.primaryLanguage() != null && !LANGUAGE.matcher(response.primaryLanguage()).matches()) {
            return ParseOutcome.failure(Failure.INVALID_LANGUAGE,
                    "Invalid primary_language '" + response.primaryLanguage() + "'", response);
        }
        if (response.naturalText() == null || response.naturalText().isBlank()) {
            return ParseOutcome.failure(Failure.EMPTY_TEXT, "natural_text is empty", response);
        }
        if (repetitionDetector.isDegenerate(response.naturalText())) {
            return ParseOutcome.failure(Failure.DEGENERATE, "natural_text ends in a repetition loop", response);
        }
        return ParseOutcome.success(response);
    }
}
