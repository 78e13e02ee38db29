package eu.okaeri.cellstore.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import eu.okaeri.cellstore.index.IndexColumn;
import eu.okaeri.cellstore.index.PathExtractor;
import eu.okaeri.cellstore.index.TableShape;
import eu.okaeri.cellstore.schema.ValidationResult;
import eu.okaeri.cellstore.util.MonotonicIdGenerator;
import eu.okaeri.cellstore.variant.PromotedField;
import eu.okaeri.cellstore.variant.StoreVariant;
import lombok.Getter;
import lombok.NonNull;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw input into the rows of a document: parse, validate, assign identity,
 * derive index columns, promoted columns and element rows. Storage independent,
 * the caller writes the result in a single transaction.
 */
@Getter
public class DocumentIngestor {

    private final StoreVariant variant;
    private final TableShape shape;
    private final PathExtractor extractor;
    private final ElementIndexer elementIndexer;
    private final MonotonicIdGenerator idGenerator;
    private final Clock clock;

    public DocumentIngestor(@NonNull StoreVariant variant, @NonNull TableShape shape, int maxExcerptLength,
                            @NonNull MonotonicIdGenerator idGenerator, @NonNull Clock clock) {
        this.variant = variant;
        this.shape = shape;
        this.extractor = new PathExtractor(shape.getRepeatingField());
        this.elementIndexer = new ElementIndexer(shape, maxExcerptLength);
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    public PreparedDocument prepare(String raw) {
        return this.prepare(JsonValues.parseObject(raw));
    }

    /**
     * @throws MalformedDocumentException when the input is not a JSON object
     * @throws eu.okaeri.cellstore.schema.DocumentValidationException when the document fails validation
     */
    public PreparedDocument prepare(JsonNode input) {

        ObjectNode document = JsonValues.requireObject(input);
        ValidationResult result = this.variant.getValidator().validate(document);
        ObjectNode validated = JsonValues.requireObject(result.orElseThrow());

        String id = this.idGenerator.next();
        long ingestedAt = this.clock.millis() / 1000L;

        Map<String, Object> promoted = new LinkedHashMap<>();
        for (PromotedField field : this.variant.getPromotedFields()) {
            Object value = field.extract(validated);
            if (field.isRequired() && (value == null)) {
                throw new MalformedDocumentException("document has no value for " + field.getPath());
            }
            promoted.put(field.getName(), value);
        }

        Map<String, String> indexValues = new LinkedHashMap<>();
        for (IndexColumn column : this.shape.getDocumentColumns()) {
            indexValues.put(column.getName(), this.extractor.extractColumnValue(validated, column.getPath()));
        }

        List<ElementRecord> elements = this.elementIndexer.index(validated);
        DocumentRecord record = new DocumentRecord(id, this.variant.externalId(validated), ingestedAt,
            this.variant.getSchemaVersion(), promoted, validated.deepCopy());

        return new PreparedDocument(record, indexValues, elements);
    }
}
