package fr.lapetina.ocr.pipeline.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Structured answer the model returns for one page.
 * Every field is required on the wire; {@code primary_language} and
 * {@code natural_text} may be null.
 */
public record PageResponse(
        @JsonProperty(value = "primary_language", required = true) String primaryLanguage,
        @JsonProperty(value = "is_rotation_valid", required = true) Boolean rotationValid,
        @JsonProperty(value = "rotation_correction", required = true) Integer rotationCorrection,
        @JsonProperty(value = "is_table", required = true) Boolean table,
        @JsonProperty(value = "is_diagram", required = true) Boolean diagram,
        @JsonProperty(value = "natural_text", required = true) String naturalText
) {
}
