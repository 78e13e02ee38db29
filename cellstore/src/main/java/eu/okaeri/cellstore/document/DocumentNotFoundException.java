package eu.okaeri.cellstore.document;

import eu.okaeri.cellstore.CellStoreException;
import lombok.Getter;

public class DocumentNotFoundException extends CellStoreException {

    @Getter
    private final String externalId;

    public DocumentNotFoundException(String externalId) {
        super("document not found: " + externalId);
        this.externalId = externalId;
    }
}
