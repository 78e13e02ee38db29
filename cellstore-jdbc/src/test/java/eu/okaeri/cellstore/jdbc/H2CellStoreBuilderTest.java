package eu.okaeri.cellstore.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import eu.okaeri.cellstore.util.ConnectionRetry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class H2CellStoreBuilderTest {

    @Test
    void build_throws_when_hikariConfig_and_dataSource_missing() {
        assertThatThrownBy(() -> H2CellStore.builder().tablePrefix("app_").build())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("hikariConfig or dataSource is required");
    }

    @Test
    void build_throws_when_hikariConfig_and_dataSource_both_provided() {
        HikariConfig mockConfig = mock(HikariConfig.class);
        HikariDataSource mockDataSource = mock(HikariDataSource.class);

        assertThatThrownBy(() -> H2CellStore.builder()
            .hikariConfig(mockConfig)
            .dataSource(mockDataSource)
            .build())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("mutually exclusive");
    }

    @Test
    void build_throws_when_retry_given_with_dataSource() {
        HikariDataSource mockDataSource = mock(HikariDataSource.class);

        assertThatThrownBy(() -> H2CellStore.builder()
            .dataSource(mockDataSource)
            .connectionRetry(ConnectionRetry.defaults())
            .build())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("connectionRetry");
    }

    @Test
    void tablePrefix_rejects_unsafe_characters() {
        assertThatThrownBy(() -> H2CellStore.builder().tablePrefix("app\"; drop"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void build_wraps_existing_dataSource() {
        HikariDataSource mockDataSource = mock(HikariDataSource.class);

        H2CellStore store = H2CellStore.builder()
            .dataSource(mockDataSource)
            .tablePrefix("app_")
            .build();

        assertThat(store.getDataSource()).isSameAs(mockDataSource);
        assertThat(store.getTablePrefix()).isEqualTo("app_");
        assertThat(store.getOpenCells()).isEmpty();

        store.close();
        verify(mockDataSource).close();
    }

    @Test
    void open_rejects_unsafe_cell_name() {
        H2CellStore store = H2CellStore.builder().dataSource(mock(HikariDataSource.class)).build();
        assertThatThrownBy(() -> store.open("cell-1"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cell-1");
    }
}
