package eu.okaeri.cellstore.schema.node;

import com.fasterxml.jackson.databind.JsonNode;
import eu.okaeri.cellstore.schema.FieldError;
import lombok.NonNull;

import java.util.List;

public class BooleanSchema extends SchemaNode {

    @Override
    public void validate(@NonNull JsonNode value, @NonNull String path, @NonNull List<FieldError> errors) {
        if (!value.isBoolean()) {
            errors.add(typeError(path, "boolean", value));
        }
    }
}
