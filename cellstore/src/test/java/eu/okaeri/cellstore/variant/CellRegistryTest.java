package eu.okaeri.cellstore.variant;

import eu.okaeri.cellstore.config.CellConfig;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CellRegistryTest {

    @Test
    void defaults_register_both_kinds() {
        CellRegistry registry = CellRegistry.defaults();
        assertThat(registry.getKinds()).containsExactly(GenericStoreVariant.KIND, ResponsesStoreVariant.KIND);
        assertThat(registry.supports(CellKind.parse("responsesStore.v1"))).isTrue();
        assertThat(registry.supports(CellKind.parse("responsesStore.v2"))).isFalse();
    }

    @Test
    void create_picks_variant_by_kind() {
        CellRegistry registry = CellRegistry.defaults();
        assertThat(registry.create(CellConfig.defaults())).isInstanceOf(GenericStoreVariant.class);
        assertThat(registry.create(CellConfig.of("responsesStore.v1", Collections.emptyList())))
            .isInstanceOf(ResponsesStoreVariant.class);
    }

    @Test
    void create_throws_for_unknown_kind() {
        CellConfig config = CellConfig.of("chatStore.v1", Collections.emptyList());
        assertThatThrownBy(() -> CellRegistry.defaults().create(config))
            .isInstanceOf(UnknownCellKindException.class)
            .hasMessage("unknown cell kind: chatStore.v1");
    }

    @Test
    void register_rejects_duplicates() {
        assertThatThrownBy(() -> CellRegistry.builder()
            .register(GenericStoreVariant.KIND, GenericStoreVariant::new)
            .register(GenericStoreVariant.KIND, GenericStoreVariant::new))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("store.v1");
    }

    @Test
    void parse_rejects_missing_version() {
        assertThatThrownBy(() -> CellKind.parse("store")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CellKind.parse("store.")).isInstanceOf(IllegalArgumentException.class);
    }
}
