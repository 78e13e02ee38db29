package eu.okaeri.cellstore.variant;

import com.fasterxml.jackson.databind.JsonNode;
import eu.okaeri.cellstore.document.JsonValues;
import eu.okaeri.cellstore.index.IndexPath;
import eu.okaeri.cellstore.schema.DocumentValidator;
import lombok.NonNull;

import java.util.List;

/**
 * Behavior of one cell kind: how documents are validated, which field repeats, which
 * fields are promoted to columns and where the external id comes from.
 */
public interface StoreVariant {

    String SCHEMA_VERSION = "v1";

    CellKind getKind();

    DocumentValidator getValidator();

    /**
     * @return repeating (array) field name, or {@code null} when the kind indexes no elements
     */
    String getRepeatingField();

    List<PromotedField> getPromotedFields();

    String getExternalIdPath();

    default String getSchemaVersion() {
        return SCHEMA_VERSION;
    }

    default String externalId(@NonNull JsonNode document) {
        List<JsonNode> values = JsonValues.walk(document, IndexPath.of(this.getExternalIdPath()).toParts());
        return values.isEmpty() ? null : JsonValues.stringify(values.get(0));
    }
}
