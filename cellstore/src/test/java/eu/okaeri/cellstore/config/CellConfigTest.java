package eu.okaeri.cellstore.config;

import eu.okaeri.cellstore.document.JsonValues;
import eu.okaeri.cellstore.variant.CellKind;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CellConfigTest {

    @Test
    void defaults_describe_open_generic_store() {
        CellConfig config = CellConfig.defaults();
        assertThat(config.getCellKind()).isEqualTo(CellKind.of("store", "v1"));
        assertThat(config.getIndexes()).isEmpty();
        assertThat(JsonValues.toJson(config.getSchema())).isEqualTo("{\"type\":\"object\"}");
        assertThat(config.getParams().getMaxExcerptLength()).isEqualTo(1000);
        assertThat(config.getParams().isEnableContentSearch()).isTrue();
        assertThat(config.getParams().getRepeatingField()).isNull();
    }

    @Test
    void of_parses_kind_and_version() {
        CellConfig config = CellConfig.of("responsesStore.v1", Arrays.asList("metadata.user"));
        assertThat(config.getKind()).isEqualTo("responsesStore");
        assertThat(config.getVersion()).isEqualTo("v1");
        assertThat(config.getIndexes()).containsExactly("metadata.user");
    }

    @Test
    void read_accepts_aliases_and_fills_missing_sections() {

        CellConfig config = CellConfig.read("{\"actorType\": \"responsesStore\", \"schema\": null, " +
            "\"params\": {\"max_excerpt_length\": 10, \"unknown\": true}, \"extra\": 1}");

        assertThat(config.getKind()).isEqualTo("responsesStore");
        assertThat(config.getVersion()).isEqualTo("v1");
        assertThat(config.getSchema().path("type").asText()).isEqualTo("object");
        assertThat(config.getIndexes()).isEmpty();
        assertThat(config.getParams().getMaxExcerptLength()).isEqualTo(10);
    }

    @Test
    void read_rejects_non_objects() {
        assertThatThrownBy(() -> CellConfig.read("[1]")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CellConfig.read("{\"indexes\": 5}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("invalid cell configuration");
    }

    @Test
    void toJson_round_trips() {
        CellConfig config = CellConfig.of("store.v1", Arrays.asList("status", "output.role"));
        config.getParams().setRepeatingField("output");
        assertThat(CellConfig.read(config.toJson())).isEqualTo(config);
    }

    @Test
    void merge_replaces_top_level_keys_only() {

        CellConfig config = CellConfig.of("store.v1", Arrays.asList("status"));
        config.getParams().setRepeatingField("output");

        CellConfig merged = config.merge(JsonValues.readTree("{\"indexes\": [\"model\"], \"params\": {\"preview_length\": 20}}"));

        assertThat(merged.getIndexes()).containsExactly("model");
        assertThat(merged.getParams().getPreviewLength()).isEqualTo(20);
        assertThat(merged.getParams().getRepeatingField()).isNull();
        assertThat(config.getIndexes()).containsExactly("status");
    }

    @Test
    void merge_maps_actor_type_to_kind() {
        CellConfig merged = CellConfig.defaults().merge(JsonValues.readTree("{\"actorType\": \"responsesStore\"}"));
        assertThat(merged.getCellKind()).isEqualTo(CellKind.of("responsesStore", "v1"));
    }
}
