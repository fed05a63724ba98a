package fr.lapetina.ocr.pipeline.domain.model;

/**
 * Text recorded for a page whose attempts were exhausted.
 */
public enum FallbackTextMode {
    /** Empty string. */
    EMPTY,
    /** Raw content of the last completion received, whatever its shape. */
    LAST_RESPONSE,
    /** Text layer extracted from the source document, empty for images. */
    EXTRACTED_TEXT
}
