package eu.okaeri.cellstore.schema.node;

import com.fasterxml.jackson.databind.JsonNode;
import eu.okaeri.cellstore.schema.FieldError;
import lombok.NonNull;

import java.util.List;

public class AnySchema extends SchemaNode {

    public static final AnySchema INSTANCE = new AnySchema();

    @Override
    public void validate(@NonNull JsonNode value, @NonNull String path, @NonNull List<FieldError> errors) {
    }
}
