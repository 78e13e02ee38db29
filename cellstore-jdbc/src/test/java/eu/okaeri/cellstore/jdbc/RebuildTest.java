package eu.okaeri.cellstore.jdbc;

import eu.okaeri.cellstore.StoreCell;
import eu.okaeri.cellstore.config.CellConfig;
import eu.okaeri.cellstore.document.DocumentRecord;
import eu.okaeri.cellstore.document.IngestResult;
import eu.okaeri.cellstore.document.JsonValues;
import eu.okaeri.cellstore.index.ConfigurationRebuildException;
import eu.okaeri.cellstore.variant.UnknownCellKindException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RebuildTest extends AbstractH2Test {

    private static final String DOCUMENT = "{\"id\":\"a\",\"status\":\"completed\",\"model\":\"m1\"}";

    @Test
    void reconfigure_with_same_indexes_keeps_documents() {

        StoreCell cell = this.store.open("cell", CellConfig.of("store.v1", Arrays.asList("status", "model")));
        cell.ingest(DOCUMENT);

        // normalized: order and duplicates do not matter
        boolean rebuilt = cell.reconfigure(CellConfig.of("store.v1", Arrays.asList("model", " status", "model")));

        assertThat(rebuilt).isFalse();
        assertThat(cell.count()).isEqualTo(1);
    }

    @Test
    void reconfigure_with_new_indexes_drops_documents() {

        StoreCell cell = this.store.open("cell", CellConfig.of("store.v1", Collections.singletonList("status")));
        cell.ingest(DOCUMENT);

        boolean rebuilt = cell.reconfigure(CellConfig.of("store.v1", Arrays.asList("status", "model")));

        assertThat(rebuilt).isTrue();
        assertThat(cell.count()).isZero();
        cell.ingest(DOCUMENT);
        assertThat(cell.list(filters("model", "m1")).getRecords()).hasSize(1);
    }

    @Test
    void reconfigure_with_new_repeating_field_drops_documents() {

        StoreCell cell = this.store.open("cell", CellConfig.of("store.v1", Collections.singletonList("status")));
        cell.ingest(DOCUMENT);

        boolean rebuilt = cell.reconfigure(JsonValues.readTree("{\"params\": {\"repeating_field\": \"output\"}}"));

        assertThat(rebuilt).isTrue();
        assertThat(cell.count()).isZero();
        assertThat(cell.getConfig().getIndexes()).containsExactly("status");
        assertThat(cell.getShape().hasRepeatingField()).isTrue();
    }

    @Test
    void reconfigure_params_only_keeps_documents() {

        StoreCell cell = this.store.open("cell", CellConfig.of("store.v1", Collections.singletonList("status")));
        cell.ingest(DOCUMENT);

        boolean rebuilt = cell.reconfigure(JsonValues.readTree("{\"params\": {\"default_limit\": 1}}"));

        assertThat(rebuilt).isFalse();
        assertThat(cell.count()).isEqualTo(1);
        assertThat(cell.getConfig().getParams().getDefaultLimit()).isEqualTo(1);
    }

    @Test
    void reopen_with_same_configuration_keeps_documents() {

        CellConfig config = CellConfig.of("store.v1", Arrays.asList("status", "model"));
        IngestResult stored = this.store.open("cell", config).ingest(DOCUMENT);
        this.store.close();

        this.store = this.createStore();
        StoreCell reopened = this.store.open("cell", config);

        assertThat(reopened.count()).isEqualTo(1);
        assertThat(reopened.findById(stored.getId())).map(DocumentRecord::getExternalId).contains("a");
        assertThat(reopened.ingest(DOCUMENT).getId()).isGreaterThan(stored.getId());
    }

    @Test
    void open_without_configuration_uses_stored_one() {

        this.store.open("cell", CellConfig.of("responsesStore.v1", Collections.singletonList("metadata.user")));
        this.store.close();

        this.store = this.createStore();
        StoreCell reopened = this.store.open("cell");

        assertThat(reopened.getConfig().getCellKind().toString()).isEqualTo("responsesStore.v1");
        assertThat(reopened.getConfig().getIndexes()).containsExactly("metadata.user");
    }

    @Test
    void open_new_cell_without_configuration_uses_defaults() {
        StoreCell cell = this.store.open("fresh");
        assertThat(cell.getConfig()).isEqualTo(CellConfig.defaults());
        assertThat(cell.ingest("{\"anything\": [1, 2, 3]}").getExternalId()).isNull();
    }

    @Test
    void open_with_unknown_kind_fails() {
        assertThatThrownBy(() -> this.store.open("cell", CellConfig.of("chatStore.v1", Collections.emptyList())))
            .isInstanceOf(UnknownCellKindException.class);
        assertThat(this.store.getOpenCells()).isEmpty();
    }

    @Test
    void reconfigure_failure_is_reported() throws Exception {
        StoreCell cell = this.store.open("cell", CellConfig.of("store.v1", Collections.singletonList("status")));
        this.execute("drop table \"cell_meta\"");
        this.execute("create table \"cell_meta\" (\"x\" int)");
        assertThatThrownBy(() -> cell.reconfigure(CellConfig.of("store.v1", Collections.singletonList("model"))))
            .isInstanceOf(ConfigurationRebuildException.class);
    }
}
