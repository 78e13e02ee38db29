package eu.okaeri.cellstore.schema;

import eu.okaeri.cellstore.CellStoreException;
import lombok.Getter;
import lombok.NonNull;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Document does not satisfy the cell schema. Nothing was persisted.
 */
@Getter
public class DocumentValidationException extends CellStoreException {

    private final List<FieldError> errors;

    public DocumentValidationException(@NonNull List<FieldError> errors) {
        super("invalid document: " + errors);
        this.errors = Collections.unmodifiableList(errors);
    }

    public List<String> getDetails() {
        return this.errors.stream()
            .map(FieldError::toString)
            .collect(Collectors.toList());
    }
}
