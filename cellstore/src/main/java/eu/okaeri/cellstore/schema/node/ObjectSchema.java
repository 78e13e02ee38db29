package eu.okaeri.cellstore.schema.node;

import com.fasterxml.jackson.databind.JsonNode;
import eu.okaeri.cellstore.schema.FieldError;
import lombok.Getter;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Object with named properties. Keys not declared in {@code properties} are checked
 * against {@code additional}: {@code null} accepts them untouched, {@link #REJECT_ADDITIONAL}
 * reports them, any other node validates their values.
 */
@Getter
public class ObjectSchema extends SchemaNode {

    public static final SchemaNode REJECT_ADDITIONAL = new SchemaNode() {
        @Override
        public void validate(@NonNull JsonNode value, @NonNull String path, @NonNull List<FieldError> errors) {
            throw new UnsupportedOperationException("marker node");
        }
    };

    private final Map<String, SchemaNode> properties;
    private final Set<String> required;
    private final SchemaNode additional;

    public ObjectSchema(@NonNull Map<String, SchemaNode> properties, @NonNull Set<String> required, SchemaNode additional) {
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        this.required = Collections.unmodifiableSet(new LinkedHashSet<>(required));
        this.additional = additional;
    }

    @Override
    public void validate(@NonNull JsonNode value, @NonNull String path, @NonNull List<FieldError> errors) {

        if (!value.isObject()) {
            errors.add(typeError(path, "object", value));
            return;
        }

        for (Map.Entry<String, SchemaNode> entry : this.properties.entrySet()) {
            JsonNode property = value.get(entry.getKey());
            if (property == null) {
                if (this.required.contains(entry.getKey())) {
                    errors.add(new FieldError(child(path, entry.getKey()), "Required"));
                }
                continue;
            }
            entry.getValue().validate(property, child(path, entry.getKey()), errors);
        }

        // required without a property schema
        for (String key : this.required) {
            if (!this.properties.containsKey(key) && !value.has(key)) {
                errors.add(new FieldError(child(path, key), "Required"));
            }
        }

        if (this.additional == null) {
            return;
        }

        List<String> unknown = new ArrayList<>();
        Iterator<String> names = value.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (this.properties.containsKey(name)) {
                continue;
            }
            if (this.additional == REJECT_ADDITIONAL) {
                unknown.add(name);
            } else {
                this.additional.validate(value.get(name), child(path, name), errors);
            }
        }

        if (!unknown.isEmpty()) {
            errors.add(new FieldError(path, "Unrecognized key(s) in object: " + unknown.stream()
                .map(name -> "'" + name + "'")
                .collect(Collectors.joining(", "))));
        }
    }
}
