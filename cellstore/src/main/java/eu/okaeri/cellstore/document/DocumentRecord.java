package eu.okaeri.cellstore.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Data;
import lombok.NonNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
public class DocumentRecord {

    private final @NonNull String id;
    private final String externalId;
    private final long ingestedAt;
    private final @NonNull String schemaVersion;
    private final @NonNull Map<String, Object> promoted;
    private final @NonNull ObjectNode body;

    public DocumentRecord(@NonNull String id, String externalId, long ingestedAt, @NonNull String schemaVersion,
                          @NonNull Map<String, Object> promoted, @NonNull ObjectNode body) {
        this.id = id;
        this.externalId = externalId;
        this.ingestedAt = ingestedAt;
        this.schemaVersion = schemaVersion;
        this.promoted = Collections.unmodifiableMap(new LinkedHashMap<>(promoted));
        this.body = body;
    }

    /**
     * {@code {id, external_id, ingested_at, <promoted fields>, body}}
     */
    public ObjectNode toJson() {
        ObjectNode node = JsonValues.MAPPER.createObjectNode();
        node.put("id", this.id);
        node.put("external_id", this.externalId);
        node.put("ingested_at", this.ingestedAt);
        for (Map.Entry<String, Object> entry : this.promoted.entrySet()) {
            JsonNode value = JsonValues.MAPPER.valueToTree(entry.getValue());
            node.set(entry.getKey(), value);
        }
        node.set("body", this.body.deepCopy());
        return node;
    }
}
