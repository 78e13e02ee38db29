package eu.okaeri.cellstore.schema;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.NonNull;

/**
 * Validation contract of a cell. The engine never interprets schemas itself,
 * it only asks the validator for a verdict.
 */
@FunctionalInterface
public interface DocumentValidator {

    ValidationResult validate(@NonNull JsonNode document);

    static DocumentValidator acceptAll() {
        return ValidationResult::valid;
    }
}
