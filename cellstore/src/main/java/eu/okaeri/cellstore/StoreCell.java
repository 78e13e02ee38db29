package eu.okaeri.cellstore;

import com.fasterxml.jackson.databind.JsonNode;
import eu.okaeri.cellstore.config.CellConfig;
import eu.okaeri.cellstore.document.DocumentRecord;
import eu.okaeri.cellstore.document.ElementDetails;
import eu.okaeri.cellstore.document.IngestResult;
import eu.okaeri.cellstore.filter.Page;
import eu.okaeri.cellstore.index.TableShape;
import lombok.NonNull;

import java.util.Map;
import java.util.Optional;

/**
 * Isolated document store with its own configuration and tables. Operations of one
 * cell never interleave, different cells run independently.
 */
public interface StoreCell {

    String getName();

    CellConfig getConfig();

    TableShape getShape();

    /**
     * Validate and persist a document given as JSON text.
     *
     * @throws eu.okaeri.cellstore.document.MalformedDocumentException when the text is not a JSON object
     * @throws eu.okaeri.cellstore.schema.DocumentValidationException when the document fails validation
     */
    IngestResult ingest(@NonNull String raw);

    IngestResult ingest(@NonNull JsonNode document);

    Optional<DocumentRecord> findById(@NonNull String id);

    /**
     * Most recently ingested document with the given external id.
     */
    Optional<DocumentRecord> findByExternalId(@NonNull String externalId);

    /**
     * Element rows of the most recent document with the given external id.
     *
     * @throws eu.okaeri.cellstore.document.DocumentNotFoundException when no element rows exist
     */
    ElementDetails elements(@NonNull String externalId);

    Page list(@NonNull Map<String, String> filters);

    long count();

    /**
     * Apply a new configuration. Changing the index set or table layout drops all documents.
     *
     * @return true if the tables were rebuilt
     */
    boolean reconfigure(@NonNull CellConfig config);

    /**
     * Shallow-merge {@code patch} into the current configuration and apply it.
     */
    boolean reconfigure(@NonNull JsonNode patch);
}
