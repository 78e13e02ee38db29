package eu.okaeri.cellstore.schema.node;

import com.fasterxml.jackson.databind.JsonNode;
import eu.okaeri.cellstore.schema.FieldError;
import lombok.Getter;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Membership in a fixed set of JSON values ({@code enum}), or a single literal ({@code const}).
 */
@Getter
public class EnumSchema extends SchemaNode {

    private final List<JsonNode> values;
    private final boolean literal;

    public EnumSchema(@NonNull List<JsonNode> values, boolean literal) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("enum requires at least one value");
        }
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
        this.literal = literal;
    }

    @Override
    public void validate(@NonNull JsonNode value, @NonNull String path, @NonNull List<FieldError> errors) {
        for (JsonNode allowed : this.values) {
            if (allowed.equals(value) || (allowed.isNumber() && value.isNumber() && (allowed.decimalValue().compareTo(value.decimalValue()) == 0))) {
                return;
            }
        }
        if (this.literal) {
            errors.add(new FieldError(path, "Invalid literal value, expected " + this.values.get(0).toString()));
            return;
        }
        String expected = this.values.stream()
            .map(EnumSchema::quote)
            .collect(Collectors.joining(" | "));
        errors.add(new FieldError(path, "Invalid enum value. Expected " + expected + ", received " + quote(value)));
    }

    private static String quote(JsonNode node) {
        return node.isTextual() ? ("'" + node.textValue() + "'") : node.toString();
    }
}
