package eu.okaeri.cellstore.schema.node;

import com.fasterxml.jackson.databind.JsonNode;
import eu.okaeri.cellstore.schema.FieldError;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.List;

@RequiredArgsConstructor
public class ArraySchema extends SchemaNode {

    @Getter private final @NonNull SchemaNode items;

    @Override
    public void validate(@NonNull JsonNode value, @NonNull String path, @NonNull List<FieldError> errors) {
        if (!value.isArray()) {
            errors.add(typeError(path, "array", value));
            return;
        }
        for (int index = 0; index < value.size(); index++) {
            this.items.validate(value.get(index), child(path, String.valueOf(index)), errors);
        }
    }
}
