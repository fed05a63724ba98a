package fr.lapetina.ocr.pipeline.infrastructure.storage;

/**
 * Raised when the backing store cannot complete an operation.
 */
public class ObjectStoreException extends RuntimeException {

    public ObjectStoreException(String message) {
        super(message);
    }

    public ObjectStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
