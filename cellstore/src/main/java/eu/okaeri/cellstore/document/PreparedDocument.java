package eu.okaeri.cellstore.document;

import lombok.Data;
import lombok.NonNull;

import java.util.List;
import java.util.Map;

/**
 * Everything ingestion writes for one document: the document row (with its index column
 * values, {@code null} for paths without a value) and its element rows.
 */
@Data
public class PreparedDocument {

    private final @NonNull DocumentRecord record;
    private final @NonNull Map<String, String> indexValues;
    private final @NonNull List<ElementRecord> elements;

    public IngestResult toResult() {
        return new IngestResult(this.record.getId(), this.record.getExternalId(), this.record.getIngestedAt(), this.elements.size());
    }
}
