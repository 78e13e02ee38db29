package eu.okaeri.cellstore.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import eu.okaeri.cellstore.CellStore;
import eu.okaeri.cellstore.StoreCell;
import eu.okaeri.cellstore.config.CellConfig;
import eu.okaeri.cellstore.util.ConnectionRetry;
import eu.okaeri.cellstore.variant.CellRegistry;
import lombok.Getter;
import lombok.NonNull;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * H2 backed cell store. Cells share the connection pool, each cell owns its own tables
 * ({@code <prefix><cell>_meta}, {@code _documents}, {@code _elements}).
 */
public class H2CellStore implements CellStore {

    static final boolean DEBUG = Boolean.parseBoolean(System.getProperty("okaeri.cellstore.debug", "false"));
    private static final Logger LOGGER = Logger.getLogger(H2CellStore.class.getSimpleName());

    private final @Getter HikariDataSource dataSource;
    private final @Getter CellRegistry registry;
    private final @Getter String tablePrefix;
    private final @Getter Clock clock;

    private final Map<String, JdbcStoreCell> cells = new ConcurrentHashMap<>();

    public H2CellStore(@NonNull HikariConfig hikariConfig, @NonNull CellRegistry registry, @NonNull String tablePrefix,
                       @NonNull ConnectionRetry retry, @NonNull Clock clock) {
        this.registry = registry;
        this.tablePrefix = tablePrefix;
        this.clock = clock;
        this.dataSource = retry.connect(hikariConfig.getJdbcUrl(), () -> new HikariDataSource(hikariConfig));
    }

    public H2CellStore(@NonNull HikariDataSource dataSource, @NonNull CellRegistry registry, @NonNull String tablePrefix,
                       @NonNull Clock clock) {
        this.dataSource = dataSource;
        this.registry = registry;
        this.tablePrefix = tablePrefix;
        this.clock = clock;
    }

    public H2CellStore(@NonNull HikariConfig hikariConfig) {
        this(hikariConfig, CellRegistry.defaults(), "", ConnectionRetry.defaults(), Clock.systemUTC());
    }

    public H2CellStore(@NonNull HikariDataSource dataSource) {
        this(dataSource, CellRegistry.defaults(), "", Clock.systemUTC());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        private HikariConfig hikariConfig;
        private HikariDataSource dataSource;
        private CellRegistry registry = CellRegistry.defaults();
        private String tablePrefix = "";
        private ConnectionRetry connectionRetry;
        private Clock clock = Clock.systemUTC();

        public Builder hikariConfig(@NonNull HikariConfig hikariConfig) {
            this.hikariConfig = hikariConfig;
            return this;
        }

        public Builder dataSource(@NonNull HikariDataSource dataSource) {
            this.dataSource = dataSource;
            return this;
        }

        public Builder registry(@NonNull CellRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder tablePrefix(@NonNull String tablePrefix) {
            if (!tablePrefix.isEmpty() && !tablePrefix.matches("^[a-zA-Z0-9_]+$")) {
                throw new IllegalArgumentException("table prefix may only contain letters, digits and underscores");
            }
            this.tablePrefix = tablePrefix;
            return this;
        }

        public Builder connectionRetry(@NonNull ConnectionRetry connectionRetry) {
            this.connectionRetry = connectionRetry;
            return this;
        }

        public Builder clock(@NonNull Clock clock) {
            this.clock = clock;
            return this;
        }

        public H2CellStore build() {
            if ((this.hikariConfig == null) && (this.dataSource == null)) {
                throw new IllegalStateException("hikariConfig or dataSource is required");
            }
            if ((this.hikariConfig != null) && (this.dataSource != null)) {
                throw new IllegalStateException("hikariConfig and dataSource are mutually exclusive");
            }
            if ((this.dataSource != null) && (this.connectionRetry != null)) {
                throw new IllegalStateException("connectionRetry only applies to hikariConfig");
            }

            if (this.dataSource != null) {
                return new H2CellStore(this.dataSource, this.registry, this.tablePrefix, this.clock);
            }
            ConnectionRetry retry = (this.connectionRetry == null) ? ConnectionRetry.defaults() : this.connectionRetry;
            return new H2CellStore(this.hikariConfig, this.registry, this.tablePrefix, retry, this.clock);
        }
    }

    // ==================== CELLS ====================

    @Override
    public StoreCell open(@NonNull String name) {
        synchronized (this.cells) {
            JdbcStoreCell existing = this.cells.get(name);
            if (existing != null) {
                return existing;
            }
            CellConfig stored = JdbcStoreCell.readStoredConfig(this, name);
            return this.create(name, (stored == null) ? CellConfig.defaults() : stored);
        }
    }

    @Override
    public StoreCell open(@NonNull String name, @NonNull CellConfig config) {
        synchronized (this.cells) {
            JdbcStoreCell existing = this.cells.get(name);
            if (existing != null) {
                existing.reconfigure(config);
                return existing;
            }
            return this.create(name, config);
        }
    }

    private JdbcStoreCell create(String name, CellConfig config) {
        JdbcStoreCell cell = new JdbcStoreCell(this, name);
        cell.reconfigure(config);
        this.cells.put(name, cell);
        LOGGER.info("[" + name + "] Opened " + config.getCellKind() + " cell");
        return cell;
    }

    @Override
    public Set<String> getOpenCells() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(this.cells.keySet()));
    }

    @Override
    public void close() {
        synchronized (this.cells) {
            this.cells.clear();
            if (this.dataSource != null) {
                this.dataSource.close();
            }
        }
    }
}
