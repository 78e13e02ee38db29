package eu.okaeri.cellstore.variant;

import eu.okaeri.cellstore.config.CellConfig;
import eu.okaeri.cellstore.config.CellParams;
import eu.okaeri.cellstore.schema.DocumentValidator;
import eu.okaeri.cellstore.schema.SchemaCompiler;
import lombok.Getter;
import lombok.NonNull;

import java.util.Collections;
import java.util.List;

/**
 * {@code store.v1}: documents validated against the schema from the cell configuration.
 */
@Getter
public class GenericStoreVariant implements StoreVariant {

    public static final CellKind KIND = CellKind.of("store", "v1");

    private final DocumentValidator validator;
    private final String repeatingField;
    private final String externalIdPath;

    public GenericStoreVariant(@NonNull CellConfig config) {
        CellParams params = config.getParams();
        this.validator = SchemaCompiler.compile(config.getSchema());
        this.repeatingField = params.getRepeatingField();
        this.externalIdPath = params.getExternalIdPath();
    }

    @Override
    public CellKind getKind() {
        return KIND;
    }

    @Override
    public List<PromotedField> getPromotedFields() {
        return Collections.emptyList();
    }
}
