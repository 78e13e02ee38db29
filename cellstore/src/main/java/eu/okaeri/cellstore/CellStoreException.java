package eu.okaeri.cellstore;

/**
 * Root of all failures raised by a cell store.
 * <p>
 * Thrown as-is for unexpected failures during ingestion or querying
 * (storage errors, corrupted rows); the message stays generic while
 * the cause carries the detail.
 */
public class CellStoreException extends RuntimeException {

    public CellStoreException(String message) {
        super(message);
    }

    public CellStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
