package eu.okaeri.cellstore.schema.node;

import com.fasterxml.jackson.databind.JsonNode;
import eu.okaeri.cellstore.schema.FieldError;
import lombok.NonNull;

import java.util.List;

public class NullSchema extends SchemaNode {

    @Override
    public void validate(@NonNull JsonNode value, @NonNull String path, @NonNull List<FieldError> errors) {
        if (!value.isNull()) {
            errors.add(typeError(path, "null", value));
        }
    }
}
