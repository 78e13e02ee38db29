package eu.okaeri.cellstore.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.NonNull;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Utility methods for reading, walking and stringifying JSON documents.
 */
public final class JsonValues {

    /**
     * Shared mapper. Floating point numbers are read as exact decimals so a stored
     * body is written back structurally identical to the input.
     */
    public static final ObjectMapper MAPPER = createMapper();

    private JsonValues() {
    }

    public static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        mapper.setNodeFactory(JsonNodeFactory.withExactBigDecimals(true));
        return mapper;
    }

    /**
     * Parse raw input into a document object.
     *
     * @throws MalformedDocumentException when input is not JSON or not a JSON object
     */
    public static ObjectNode parseObject(String raw) {
        if ((raw == null) || raw.trim().isEmpty()) {
            throw new MalformedDocumentException("document is empty");
        }
        JsonNode node;
        try {
            node = MAPPER.readTree(raw);
        } catch (JsonProcessingException exception) {
            throw new MalformedDocumentException("document is not valid json", exception);
        }
        return requireObject(node);
    }

    public static ObjectNode requireObject(JsonNode node) {
        if ((node == null) || !node.isObject()) {
            String type = (node == null) ? "nothing" : node.getNodeType().name().toLowerCase();
            throw new MalformedDocumentException("document must be a json object, got " + type);
        }
        return (ObjectNode) node;
    }

    public static JsonNode readTree(@NonNull String raw) {
        try {
            return MAPPER.readTree(raw);
        } catch (JsonProcessingException exception) {
            throw new IllegalArgumentException("cannot read json", exception);
        }
    }

    public static String toJson(@NonNull JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException exception) {
            throw new IllegalArgumentException("cannot write json", exception);
        }
    }

    /**
     * Walk a document along path parts. Object nodes are entered by key, array nodes
     * by numeric index; a non-numeric part applied to an array continues on every element.
     *
     * @param root  the node to walk from
     * @param parts the path parts (e.g., ["usage", "total_tokens"])
     * @return all non-null values found, in document order
     */
    public static List<JsonNode> walk(JsonNode root, @NonNull List<String> parts) {
        List<JsonNode> values = new ArrayList<>();
        walk(root, parts, 0, values);
        return values;
    }

    private static void walk(JsonNode node, List<String> parts, int depth, List<JsonNode> values) {

        if ((node == null) || node.isNull() || node.isMissingNode()) {
            return;
        }

        if (depth == parts.size()) {
            values.add(node);
            return;
        }

        String part = parts.get(depth);
        if (node.isObject()) {
            walk(node.get(part), parts, depth + 1, values);
            return;
        }

        if (node.isArray()) {
            if (isIndex(part)) {
                walk(node.get(Integer.parseInt(part)), parts, depth + 1, values);
                return;
            }
            for (JsonNode element : node) {
                walk(element, parts, depth, values);
            }
        }
    }

    private static boolean isIndex(String part) {
        if (part.isEmpty() || (part.length() > 9)) {
            return false;
        }
        for (int i = 0; i < part.length(); i++) {
            if (!Character.isDigit(part.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Text form of a value as stored in index columns.
     * <ul>
     *   <li>strings verbatim</li>
     *   <li>integers in plain digits, decimals in plain notation without trailing zeros</li>
     *   <li>booleans as {@code true}/{@code false}</li>
     *   <li>objects and arrays as compact JSON</li>
     * </ul>
     */
    public static String stringify(@NonNull JsonNode value) {
        if (value.isTextual()) {
            return value.textValue();
        }
        if (value.isIntegralNumber()) {
            return value.bigIntegerValue().toString();
        }
        if (value.isNumber()) {
            if ((value.isDouble() || value.isFloat()) && !Double.isFinite(value.doubleValue())) {
                return String.valueOf(value.doubleValue());
            }
            return value.decimalValue().stripTrailingZeros().toPlainString();
        }
        if (value.isBoolean()) {
            return String.valueOf(value.booleanValue());
        }
        return toJson(value);
    }

    /**
     * Canonical form of a decimal: trailing zeros stripped, never a negative scale
     * ({@code 100.0} and {@code 1E+2} both become {@code 100}).
     */
    public static BigDecimal normalize(@NonNull BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        return (stripped.scale() < 0) ? stripped.setScale(0) : stripped;
    }

    /**
     * JavaScript-like truthiness, used when deriving element excerpts.
     */
    public static boolean isTruthy(JsonNode value) {
        if ((value == null) || value.isNull() || value.isMissingNode()) {
            return false;
        }
        if (value.isTextual()) {
            return !value.textValue().isEmpty();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            return value.decimalValue().signum() != 0;
        }
        return true;
    }
}
