package eu.okaeri.cellstore.schema;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ValidationResult {

    private final JsonNode document;
    private final List<FieldError> errors;

    public static ValidationResult valid(@NonNull JsonNode document) {
        return new ValidationResult(document, Collections.emptyList());
    }

    public static ValidationResult invalid(@NonNull List<FieldError> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("invalid result requires at least one error");
        }
        return new ValidationResult(null, Collections.unmodifiableList(errors));
    }

    public boolean isValid() {
        return this.errors.isEmpty();
    }

    public JsonNode orElseThrow() throws DocumentValidationException {
        if (!this.isValid()) {
            throw new DocumentValidationException(this.errors);
        }
        return this.document;
    }
}
