package eu.okaeri.cellstore.schema;

import com.fasterxml.jackson.databind.JsonNode;
import eu.okaeri.cellstore.schema.node.AnySchema;
import eu.okaeri.cellstore.schema.node.ArraySchema;
import eu.okaeri.cellstore.schema.node.BooleanSchema;
import eu.okaeri.cellstore.schema.node.EnumSchema;
import eu.okaeri.cellstore.schema.node.NullSchema;
import eu.okaeri.cellstore.schema.node.NumberSchema;
import eu.okaeri.cellstore.schema.node.ObjectSchema;
import eu.okaeri.cellstore.schema.node.SchemaNode;
import eu.okaeri.cellstore.schema.node.StringSchema;
import eu.okaeri.cellstore.schema.node.UnionSchema;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Compiles a JSON-Schema subset into a {@link DocumentValidator}.
 * <p>
 * Supported keywords: {@code type} (single or array), {@code properties}, {@code required},
 * {@code additionalProperties}, {@code items}, {@code enum}, {@code const}, {@code anyOf}
 * and {@code oneOf} (both treated as "any member matches"). Everything else is ignored,
 * a schema without a recognized shape accepts any value.
 */
public final class SchemaCompiler {

    private static final Logger LOGGER = Logger.getLogger(SchemaCompiler.class.getSimpleName());

    private SchemaCompiler() {
    }

    public static DocumentValidator compile(@NonNull JsonNode schema) {
        SchemaNode root = compileNode(schema);
        return document -> {
            List<FieldError> errors = new ArrayList<>();
            root.validate(document, "", errors);
            return errors.isEmpty()
                ? ValidationResult.valid(document)
                : ValidationResult.invalid(errors);
        };
    }

    public static SchemaNode compileNode(JsonNode schema) {

        if ((schema == null) || !schema.isObject()) {
            return AnySchema.INSTANCE;
        }

        JsonNode union = schema.has("anyOf") ? schema.get("anyOf") : schema.get("oneOf");
        if ((union != null) && union.isArray()) {
            List<SchemaNode> members = new ArrayList<>();
            union.forEach(member -> members.add(compileNode(member)));
            return members.isEmpty() ? AnySchema.INSTANCE : new UnionSchema(members);
        }

        if (schema.has("const")) {
            return new EnumSchema(Collections.singletonList(schema.get("const")), true);
        }

        JsonNode values = schema.get("enum");
        if ((values != null) && values.isArray() && (values.size() > 0)) {
            List<JsonNode> allowed = new ArrayList<>();
            values.forEach(allowed::add);
            return new EnumSchema(allowed, false);
        }

        JsonNode type = schema.get("type");
        if (type == null) {
            // untyped but shaped like an object schema
            return schema.has("properties") ? compileTyped("object", schema) : AnySchema.INSTANCE;
        }

        if (type.isArray()) {
            List<SchemaNode> members = new ArrayList<>();
            type.forEach(member -> members.add(compileTyped(member.asText(), schema)));
            if (members.isEmpty()) {
                return AnySchema.INSTANCE;
            }
            return (members.size() == 1) ? members.get(0) : new UnionSchema(members);
        }

        return compileTyped(type.asText(), schema);
    }

    private static SchemaNode compileTyped(String type, JsonNode schema) {
        switch (type) {
            case "object":
                return compileObject(schema);
            case "array":
                return new ArraySchema(compileNode(schema.get("items")));
            case "string":
                return new StringSchema();
            case "number":
                return new NumberSchema(false);
            case "integer":
                return new NumberSchema(true);
            case "boolean":
                return new BooleanSchema();
            case "null":
                return new NullSchema();
            default:
                LOGGER.warning("Unknown schema type '" + type + "', accepting any value");
                return AnySchema.INSTANCE;
        }
    }

    private static SchemaNode compileObject(JsonNode schema) {

        Map<String, SchemaNode> properties = new LinkedHashMap<>();
        JsonNode propertiesNode = schema.get("properties");
        if ((propertiesNode != null) && propertiesNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = propertiesNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                properties.put(field.getKey(), compileNode(field.getValue()));
            }
        }

        Set<String> required = new LinkedHashSet<>();
        JsonNode requiredNode = schema.get("required");
        if ((requiredNode != null) && requiredNode.isArray()) {
            requiredNode.forEach(name -> required.add(name.asText()));
        }

        SchemaNode additional = null;
        JsonNode additionalNode = schema.get("additionalProperties");
        if (additionalNode != null) {
            if (additionalNode.isBoolean()) {
                additional = additionalNode.booleanValue() ? null : ObjectSchema.REJECT_ADDITIONAL;
            } else if (additionalNode.isObject()) {
                additional = compileNode(additionalNode);
            }
        }

        return new ObjectSchema(properties, required, additional);
    }
}
