package eu.okaeri.cellstore.variant;

import com.fasterxml.jackson.databind.JsonNode;
import eu.okaeri.cellstore.document.JsonValues;
import eu.okaeri.cellstore.index.IndexPath;
import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

import java.math.BigDecimal;
import java.util.List;

/**
 * Document field lifted into its own typed column of the document table. Filterable by
 * exact match under {@code name}, and by inclusive range under {@code minKey}/{@code maxKey}
 * when those are set.
 */
@Data
@Builder
public class PromotedField {

    private final @NonNull String name;
    private final @NonNull String path;
    private final @NonNull PromotedType type;
    private final boolean required;
    private final String minKey;
    private final String maxKey;

    public boolean isRange() {
        return (this.minKey != null) || (this.maxKey != null);
    }

    /**
     * @return {@link String} for text fields, normalized {@link BigDecimal} for number fields, {@code null} when absent
     */
    public Object extract(@NonNull JsonNode document) {

        List<JsonNode> values = JsonValues.walk(document, IndexPath.of(this.path).toParts());
        if (values.isEmpty()) {
            return null;
        }

        JsonNode value = values.get(0);
        if (this.type == PromotedType.TEXT) {
            return JsonValues.stringify(value);
        }

        try {
            if (value.isNumber()) {
                return JsonValues.normalize(value.decimalValue());
            }
            if (value.isTextual()) {
                return JsonValues.normalize(new BigDecimal(value.textValue().trim()));
            }
        } catch (NumberFormatException ignored) {
            // NaN, infinity or non-numeric text
        }
        return null;
    }
}
