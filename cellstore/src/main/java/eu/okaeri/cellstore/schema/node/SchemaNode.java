package eu.okaeri.cellstore.schema.node;

import com.fasterxml.jackson.databind.JsonNode;
import eu.okaeri.cellstore.schema.FieldError;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiled schema element. Nodes are immutable and may be shared by many validations.
 */
public abstract class SchemaNode {

    /**
     * Validates {@code value} (never {@code null}, JSON null is {@code NullNode})
     * appending one error per offending path to {@code errors}.
     */
    public abstract void validate(@NonNull JsonNode value, @NonNull String path, @NonNull List<FieldError> errors);

    public boolean accepts(@NonNull JsonNode value) {
        List<FieldError> errors = new ArrayList<>();
        this.validate(value, "", errors);
        return errors.isEmpty();
    }

    public static String describe(@NonNull JsonNode value) {
        switch (value.getNodeType()) {
            case STRING:
                return "string";
            case NUMBER:
                return "number";
            case BOOLEAN:
                return "boolean";
            case OBJECT:
            case POJO:
                return "object";
            case ARRAY:
                return "array";
            case NULL:
                return "null";
            default:
                return "unknown";
        }
    }

    public static String child(@NonNull String path, @NonNull String key) {
        return path.isEmpty() ? key : (path + "." + key);
    }

    protected static FieldError typeError(String path, String expected, JsonNode received) {
        return new FieldError(path, "Expected " + expected + ", received " + describe(received));
    }
}
