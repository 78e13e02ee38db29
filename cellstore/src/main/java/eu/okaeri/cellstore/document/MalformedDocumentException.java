package eu.okaeri.cellstore.document;

import eu.okaeri.cellstore.CellStoreException;

/**
 * Input could not be read as a JSON object. Raised before validation.
 */
public class MalformedDocumentException extends CellStoreException {

    public MalformedDocumentException(String message) {
        super(message);
    }

    public MalformedDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
