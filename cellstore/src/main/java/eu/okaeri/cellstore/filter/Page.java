package eu.okaeri.cellstore.filter;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import eu.okaeri.cellstore.document.DocumentRecord;
import eu.okaeri.cellstore.document.JsonValues;
import lombok.Data;
import lombok.NonNull;

import java.util.Collections;
import java.util.List;

@Data
public class Page {

    private final @NonNull List<DocumentRecord> records;
    private final String nextAfter;

    public Page(@NonNull List<DocumentRecord> records, String nextAfter) {
        this.records = Collections.unmodifiableList(records);
        this.nextAfter = nextAfter;
    }

    public boolean hasNext() {
        return this.nextAfter != null;
    }

    /**
     * {@code {records: [...], next_after: id | null}}
     */
    public ObjectNode toJson() {
        ObjectNode node = JsonValues.MAPPER.createObjectNode();
        ArrayNode array = node.putArray("records");
        this.records.forEach(record -> array.add(record.toJson()));
        node.put("next_after", this.nextAfter);
        return node;
    }
}
