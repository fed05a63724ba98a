package fr.lapetina.ocr.pipeline.domain.event;

/**
 * Lifecycle state of a batch result event in the writer pipeline.
 */
public enum EventState {
    /** Event published, awaiting serialization */
    CREATED,

    /** Documents rendered to JSONL (and Markdown) */
    SERIALIZED,

    /** Output objects stored */
    WRITTEN,

    /** Caller notified of success */
    COMPLETED,

    /** A stage failed; remaining stages only propagate the error */
    FAILED
}
