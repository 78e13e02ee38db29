package eu.okaeri.cellstore.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import eu.okaeri.cellstore.document.JsonValues;
import eu.okaeri.cellstore.variant.CellKind;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration of a single cell, as persisted in its meta table.
 * <pre>{@code
 * {
 *   "kind": "store",
 *   "version": "v1",
 *   "schema": {"type": "object"},
 *   "indexes": ["status", "output.role"],
 *   "params": {"repeating_field": "output"}
 * }
 * }</pre>
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CellConfig {

    @JsonProperty("kind")
    @JsonAlias("actorType")
    private String kind = "store";

    @JsonProperty("version")
    private String version = "v1";

    @JsonProperty("schema")
    private JsonNode schema = JsonValues.MAPPER.createObjectNode().put("type", "object");

    @JsonProperty("indexes")
    private List<String> indexes = new ArrayList<>();

    @JsonProperty("params")
    private CellParams params = new CellParams();

    public static CellConfig defaults() {
        return new CellConfig();
    }

    public static CellConfig of(@NonNull String kind, @NonNull List<String> indexes) {
        CellKind parsed = CellKind.parse(kind);
        CellConfig config = new CellConfig();
        config.setKind(parsed.getKind());
        config.setVersion(parsed.getVersion());
        config.setIndexes(new ArrayList<>(indexes));
        return config;
    }

    public static CellConfig read(@NonNull String json) {
        return read(JsonValues.readTree(json));
    }

    public static CellConfig read(@NonNull JsonNode json) {
        if (!json.isObject()) {
            throw new IllegalArgumentException("cell configuration must be a json object");
        }
        try {
            CellConfig config = JsonValues.MAPPER.treeToValue(json, CellConfig.class);
            return config.fillDefaults();
        } catch (JsonProcessingException exception) {
            throw new IllegalArgumentException("invalid cell configuration: " + exception.getOriginalMessage(), exception);
        }
    }

    @JsonIgnore
    public CellKind getCellKind() {
        return CellKind.of(this.kind, this.version);
    }

    public ObjectNode toJsonNode() {
        return JsonValues.MAPPER.valueToTree(this);
    }

    public String toJson() {
        return JsonValues.toJson(this.toJsonNode());
    }

    /**
     * Shallow merge: every top-level key of {@code partial} replaces the current one.
     */
    public CellConfig merge(@NonNull JsonNode partial) {
        if (!partial.isObject()) {
            throw new IllegalArgumentException("configuration patch must be a json object");
        }
        ObjectNode merged = this.toJsonNode();
        if (partial.has("actorType") && !partial.has("kind")) {
            merged.set("kind", partial.get("actorType"));
        }
        partial.fields().forEachRemaining(field -> {
            if (!"actorType".equals(field.getKey())) {
                merged.set(field.getKey(), field.getValue());
            }
        });
        return read(merged);
    }

    private CellConfig fillDefaults() {
        if (this.kind == null) this.kind = "store";
        if (this.version == null) this.version = "v1";
        if ((this.schema == null) || this.schema.isNull()) this.schema = JsonValues.MAPPER.createObjectNode().put("type", "object");
        if (this.indexes == null) this.indexes = new ArrayList<>();
        if (this.params == null) this.params = new CellParams();
        return this;
    }
}
