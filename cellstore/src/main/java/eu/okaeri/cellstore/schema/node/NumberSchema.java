package eu.okaeri.cellstore.schema.node;

import com.fasterxml.jackson.databind.JsonNode;
import eu.okaeri.cellstore.schema.FieldError;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * JSON number, optionally restricted to integral values ({@code 3} and {@code 3.0} both pass).
 */
@RequiredArgsConstructor
public class NumberSchema extends SchemaNode {

    @Getter private final boolean integer;

    @Override
    public void validate(@NonNull JsonNode value, @NonNull String path, @NonNull List<FieldError> errors) {
        if (!value.isNumber()) {
            errors.add(typeError(path, "number", value));
            return;
        }
        if (this.integer && !isIntegral(value)) {
            errors.add(new FieldError(path, "Expected integer, received float"));
        }
    }

    private static boolean isIntegral(JsonNode value) {
        if (value.isIntegralNumber()) {
            return true;
        }
        if (value.isDouble() || value.isFloat()) {
            double number = value.doubleValue();
            return !Double.isInfinite(number) && (number == Math.rint(number));
        }
        return value.decimalValue().stripTrailingZeros().scale() <= 0;
    }
}
