package eu.okaeri.cellstore.document;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Data;

@Data
public class IngestResult {

    private final String id;
    private final String externalId;
    private final long ingestedAt;
    private final int elementCount;

    public ObjectNode toJson() {
        ObjectNode node = JsonValues.MAPPER.createObjectNode();
        node.put("id", this.id);
        node.put("external_id", this.externalId);
        node.put("ingested_at", this.ingestedAt);
        node.put("element_count", this.elementCount);
        return node;
    }
}
