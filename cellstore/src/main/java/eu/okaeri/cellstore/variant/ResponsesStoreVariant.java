package eu.okaeri.cellstore.variant;

import com.fasterxml.jackson.databind.JsonNode;
import eu.okaeri.cellstore.config.CellConfig;
import eu.okaeri.cellstore.document.JsonValues;
import eu.okaeri.cellstore.schema.DocumentValidator;
import eu.okaeri.cellstore.schema.SchemaCompiler;
import lombok.Getter;
import lombok.NonNull;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * {@code responsesStore.v1}: model response documents with a fixed schema. The {@code output}
 * array is indexed per element; status, model, creation time and total token usage are promoted.
 */
@Getter
public class ResponsesStoreVariant implements StoreVariant {

    public static final CellKind KIND = CellKind.of("responsesStore", "v1");
    public static final String SCHEMA_RESOURCE = "responses-schema.json";
    public static final String REPEATING_FIELD = "output";

    private static final JsonNode SCHEMA = loadSchema();
    private static final DocumentValidator VALIDATOR = SchemaCompiler.compile(SCHEMA);

    private static final List<PromotedField> PROMOTED_FIELDS = Collections.unmodifiableList(Arrays.asList(
        PromotedField.builder().name("status").path("status").type(PromotedType.TEXT).required(true).build(),
        PromotedField.builder().name("model").path("model").type(PromotedType.TEXT).required(true).build(),
        PromotedField.builder().name("created_at").path("created_at").type(PromotedType.NUMBER).required(true).build(),
        PromotedField.builder().name("total_tokens").path("usage.total_tokens").type(PromotedType.NUMBER)
            .minKey("min_tokens").maxKey("max_tokens").build()
    ));

    public ResponsesStoreVariant(@NonNull CellConfig config) {
        // fixed kind, configuration only affects indexes and params
    }

    public static JsonNode getSchema() {
        return SCHEMA.deepCopy();
    }

    private static JsonNode loadSchema() {
        try (InputStream stream = ResponsesStoreVariant.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (stream == null) {
                throw new IllegalStateException("missing resource " + SCHEMA_RESOURCE);
            }
            return JsonValues.MAPPER.readTree(stream);
        } catch (IOException exception) {
            throw new IllegalStateException("cannot read " + SCHEMA_RESOURCE, exception);
        }
    }

    @Override
    public CellKind getKind() {
        return KIND;
    }

    @Override
    public DocumentValidator getValidator() {
        return VALIDATOR;
    }

    @Override
    public String getRepeatingField() {
        return REPEATING_FIELD;
    }

    @Override
    public List<PromotedField> getPromotedFields() {
        return PROMOTED_FIELDS;
    }

    @Override
    public String getExternalIdPath() {
        return "id";
    }
}
