package fr.lapetina.ocr.pipeline.infrastructure.render;

/**
 * The source document is missing, unreadable or corrupt.
 * Retrying does not help; the document is reported and skipped.
 */
public class SourceDocumentException extends RuntimeException {

    private final String documentRef;

    public SourceDocumentException(String documentRef, String message) {
        super(message + ": " + documentRef);
        this.documentRef = documentRef;
    }

    public SourceDocumentException(String documentRef, String message, Throwable cause) {
        super(message + ": " + documentRef, cause);
        this.documentRef = documentRef;
    }

    public String getDocumentRef() {
        return documentRef;
    }
}
