package eu.okaeri.cellstore.jdbc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import eu.okaeri.cellstore.CellStoreException;
import eu.okaeri.cellstore.StoreCell;
import eu.okaeri.cellstore.config.CellConfig;
import eu.okaeri.cellstore.config.CellParams;
import eu.okaeri.cellstore.document.DocumentIngestor;
import eu.okaeri.cellstore.document.DocumentNotFoundException;
import eu.okaeri.cellstore.document.DocumentRecord;
import eu.okaeri.cellstore.document.ElementDetails;
import eu.okaeri.cellstore.document.ElementRecord;
import eu.okaeri.cellstore.document.IngestResult;
import eu.okaeri.cellstore.document.JsonValues;
import eu.okaeri.cellstore.document.PreparedDocument;
import eu.okaeri.cellstore.filter.Page;
import eu.okaeri.cellstore.filter.Pager;
import eu.okaeri.cellstore.filter.Query;
import eu.okaeri.cellstore.filter.QueryTranslator;
import eu.okaeri.cellstore.index.ColumnMapper;
import eu.okaeri.cellstore.index.ConfigurationRebuildException;
import eu.okaeri.cellstore.index.IndexColumn;
import eu.okaeri.cellstore.index.IndexPlanner;
import eu.okaeri.cellstore.index.TableShape;
import eu.okaeri.cellstore.jdbc.commons.JdbcHelper;
import eu.okaeri.cellstore.jdbc.filter.RenderedQuery;
import eu.okaeri.cellstore.jdbc.filter.SqlQueryRenderer;
import eu.okaeri.cellstore.jdbc.schema.SqlSchemaRenderer;
import eu.okaeri.cellstore.util.MonotonicIdGenerator;
import eu.okaeri.cellstore.variant.PromotedField;
import eu.okaeri.cellstore.variant.PromotedType;
import eu.okaeri.cellstore.variant.StoreVariant;
import lombok.Getter;
import lombok.NonNull;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

import static eu.okaeri.cellstore.jdbc.commons.JdbcHelper.quote;

/**
 * Cell backed by three tables of a relational database. Every public operation holds the
 * cell lock, so reads never observe a document without its element rows and a rebuild
 * completes before the next operation starts.
 */
public class JdbcStoreCell implements StoreCell {

    private static final Logger LOGGER = Logger.getLogger(JdbcStoreCell.class.getSimpleName());

    static final String META_INDEXES = "indexes";
    static final String META_LAYOUT = "layout";
    static final String META_CONFIG = "config";

    private final @Getter String name;
    private final DataSource dataSource;
    private final H2CellStore store;
    private final SqlSchemaRenderer schemaRenderer;
    private final SqlQueryRenderer queryRenderer;
    private final MonotonicIdGenerator idGenerator = new MonotonicIdGenerator();
    private final ReentrantLock lock = new ReentrantLock(true);

    private CellConfig config;
    private StoreVariant variant;
    private TableShape shape;
    private DocumentIngestor ingestor;
    private QueryTranslator translator;
    private Pager pager;

    JdbcStoreCell(@NonNull H2CellStore store, @NonNull String name) {
        if (!JdbcHelper.isSafeName(name)) {
            throw new IllegalArgumentException("cell name '" + name + "' may only contain letters, digits and underscores");
        }
        this.name = name;
        this.store = store;
        this.dataSource = store.getDataSource();
        this.schemaRenderer = new SqlSchemaRenderer(store.getTablePrefix(), name);
        this.queryRenderer = new SqlQueryRenderer(this.schemaRenderer.getDocumentTable(), this.schemaRenderer.getElementTable());
    }

    // ==================== CONFIGURATION ====================

    @Override
    public CellConfig getConfig() {
        return this.locked(() -> CellConfig.read(this.config.toJsonNode()));
    }

    @Override
    public TableShape getShape() {
        return this.locked(() -> this.shape);
    }

    @Override
    public boolean reconfigure(@NonNull CellConfig config) {
        return this.locked(() -> this.apply(config));
    }

    @Override
    public boolean reconfigure(@NonNull JsonNode patch) {
        return this.locked(() -> this.apply(this.config.merge(patch)));
    }

    /**
     * Persisted configuration of a cell, {@code null} for a cell never opened before.
     */
    static CellConfig readStoredConfig(@NonNull H2CellStore store, @NonNull String name) {
        JdbcStoreCell bootstrap = new JdbcStoreCell(store, name);
        try (Connection connection = store.getDataSource().getConnection()) {
            bootstrap.execute(connection, bootstrap.schemaRenderer.createMetaTable());
            String stored = bootstrap.readMeta(connection, META_CONFIG);
            return (stored == null) ? null : CellConfig.read(stored);
        } catch (SQLException exception) {
            throw new ConfigurationRebuildException("cannot read configuration of cell " + name, exception);
        }
    }

    boolean apply(@NonNull CellConfig config) {

        StoreVariant variant = this.store.getRegistry().create(config);
        CellParams params = config.getParams();
        IndexPlanner planner = new IndexPlanner(variant.getRepeatingField(), ColumnMapper.of(params.isCollisionResistantColumns()));
        TableShape shape = planner.plan(config.getIndexes());
        String layout = variant.getKind() + ";" + shape.getLayout();

        boolean rebuilt;
        try (Connection connection = this.dataSource.getConnection()) {

            this.execute(connection, this.schemaRenderer.createMetaTable());
            String storedIndexes = this.readMeta(connection, META_INDEXES);
            String storedLayout = this.readMeta(connection, META_LAYOUT);
            List<String> baseline = (storedIndexes == null) ? null : readIndexes(storedIndexes);

            rebuilt = IndexPlanner.needsRebuild(baseline, shape.getIndexes()) || !layout.equals(storedLayout);
            if (rebuilt) {
                if (baseline == null) {
                    LOGGER.info("[" + this.name + "] Initializing " + variant.getKind() + " cell with indexes " + shape.getIndexes());
                } else {
                    LOGGER.warning("[" + this.name + "] Index configuration changed (" + baseline + " -> " + shape.getIndexes()
                        + ", layout " + storedLayout + " -> " + layout + "), dropping all stored documents and rebuilding tables");
                }
                for (String sql : this.schemaRenderer.dropTables()) {
                    this.execute(connection, sql);
                }
            }

            for (String sql : this.schemaRenderer.createTables(shape, variant.getPromotedFields(), params.isEnableContentSearch())) {
                this.execute(connection, sql);
            }

            this.writeMeta(connection, META_CONFIG, config.toJson());
            if (rebuilt) {
                // baseline last, an interrupted rebuild is repeated on next open
                this.writeMeta(connection, META_LAYOUT, layout);
                this.writeMeta(connection, META_INDEXES, JsonValues.toJson(JsonValues.MAPPER.valueToTree(shape.getIndexes())));
            }

            this.idGenerator.observe(this.selectMaxId(connection));
        } catch (SQLException exception) {
            throw new ConfigurationRebuildException("cannot prepare tables of cell " + this.name, exception);
        }

        this.config = config;
        this.variant = variant;
        this.shape = shape;
        this.pager = new Pager(params.getDefaultLimit(), params.getMaxLimit());
        this.ingestor = new DocumentIngestor(variant, shape, params.getMaxExcerptLength(), this.idGenerator, this.store.getClock());
        this.translator = new QueryTranslator(shape, variant.getPromotedFields(), this.pager);
        return rebuilt;
    }

    private static List<String> readIndexes(String json) {
        JsonNode node = JsonValues.readTree(json);
        List<String> indexes = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(element -> indexes.add(element.asText()));
        }
        return indexes;
    }

    // ==================== WRITES ====================

    @Override
    public IngestResult ingest(@NonNull String raw) {
        return this.locked(() -> this.write(this.ingestor.prepare(raw)));
    }

    @Override
    public IngestResult ingest(@NonNull JsonNode document) {
        return this.locked(() -> this.write(this.ingestor.prepare(document)));
    }

    private IngestResult write(PreparedDocument prepared) {

        DocumentRecord record = prepared.getRecord();
        try (Connection connection = this.dataSource.getConnection()) {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try {
                this.insertDocument(connection, prepared);
                this.insertElements(connection, record.getId(), prepared.getElements());
                connection.commit();
            } catch (SQLException | RuntimeException exception) {
                JdbcHelper.rollback(connection, exception);
                throw exception;
            } finally {
                connection.setAutoCommit(autoCommit);
            }
        } catch (SQLException exception) {
            LOGGER.log(Level.SEVERE, "[" + this.name + "] Cannot store document " + record.getExternalId(), exception);
            throw new CellStoreException("cannot store document", exception);
        }

        return prepared.toResult();
    }

    private void insertDocument(Connection connection, PreparedDocument prepared) throws SQLException {

        DocumentRecord record = prepared.getRecord();
        List<String> columns = new ArrayList<>();
        List<Object> values = new ArrayList<>();
        List<Integer> types = new ArrayList<>();

        add(columns, values, types, "id", record.getId(), Types.VARCHAR);
        add(columns, values, types, "external_id", record.getExternalId(), Types.VARCHAR);
        add(columns, values, types, "ingested_at", record.getIngestedAt(), Types.BIGINT);
        add(columns, values, types, "schema_version", record.getSchemaVersion(), Types.VARCHAR);
        for (PromotedField field : this.variant.getPromotedFields()) {
            int type = (field.getType() == PromotedType.NUMBER) ? Types.DECIMAL : Types.VARCHAR;
            add(columns, values, types, field.getName(), record.getPromoted().get(field.getName()), type);
        }
        add(columns, values, types, "body", JsonValues.toJson(record.getBody()), Types.CLOB);
        for (Map.Entry<String, String> entry : prepared.getIndexValues().entrySet()) {
            add(columns, values, types, entry.getKey(), entry.getValue(), Types.VARCHAR);
        }

        StringBuilder sql = new StringBuilder("insert into ").append(quote(this.schemaRenderer.getDocumentTable())).append(" (");
        StringBuilder marks = new StringBuilder();
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) {
                sql.append(", ");
                marks.append(", ");
            }
            sql.append(quote(columns.get(i)));
            marks.append('?');
        }
        sql.append(") values (").append(marks).append(')');

        try (PreparedStatement statement = connection.prepareStatement(this.debugQuery(sql.toString()))) {
            for (int i = 0; i < values.size(); i++) {
                bind(statement, i + 1, values.get(i), types.get(i));
            }
            statement.executeUpdate();
        }
    }

    private void insertElements(Connection connection, String parentId, List<ElementRecord> elements) throws SQLException {

        if (elements.isEmpty()) {
            return;
        }

        List<IndexColumn> extra = this.shape.getElementColumns();
        StringBuilder sql = new StringBuilder("insert into ").append(quote(this.schemaRenderer.getElementTable()))
            .append(" (\"parent_id\", \"position\", \"type\", \"role\", \"status\", \"content_excerpt\", \"content_size_estimate\"");
        for (IndexColumn column : extra) {
            sql.append(", ").append(quote(column.getName()));
        }
        sql.append(") values (?, ?, ?, ?, ?, ?, ?");
        for (int i = 0; i < extra.size(); i++) {
            sql.append(", ?");
        }
        sql.append(')');

        try (PreparedStatement statement = connection.prepareStatement(this.debugQuery(sql.toString()))) {
            for (ElementRecord element : elements) {
                statement.setString(1, parentId);
                statement.setInt(2, element.getPosition());
                statement.setString(3, element.getType());
                statement.setString(4, element.getRole());
                statement.setString(5, element.getStatus());
                statement.setString(6, element.getContentExcerpt());
                bind(statement, 7, element.getContentSizeEstimate(), Types.INTEGER);
                for (int i = 0; i < extra.size(); i++) {
                    statement.setString(8 + i, element.getColumns().get(extra.get(i).getName()));
                }
                statement.addBatch();
            }
            statement.executeBatch();
        }
    }

    private static void add(List<String> columns, List<Object> values, List<Integer> types, String column, Object value, int type) {
        columns.add(column);
        values.add(value);
        types.add(type);
    }

    private static void bind(PreparedStatement statement, int index, Object value, int type) throws SQLException {
        if (value == null) {
            statement.setNull(index, type);
        } else if (type == Types.CLOB) {
            statement.setString(index, (String) value);
        } else {
            statement.setObject(index, value);
        }
    }

    // ==================== READS ====================

    @Override
    public Optional<DocumentRecord> findById(@NonNull String id) {
        return this.locked(() -> this.selectOne("select * from " + quote(this.schemaRenderer.getDocumentTable()) + " where \"id\" = ?", id));
    }

    @Override
    public Optional<DocumentRecord> findByExternalId(@NonNull String externalId) {
        return this.locked(() -> this.selectOne("select * from " + quote(this.schemaRenderer.getDocumentTable())
            + " where \"external_id\" = ? order by \"id\" desc limit 1", externalId));
    }

    @Override
    public ElementDetails elements(@NonNull String externalId) {
        return this.locked(() -> {

            if (!this.shape.hasRepeatingField()) {
                throw new DocumentNotFoundException(externalId);
            }

            String sql = "select e.* from " + quote(this.schemaRenderer.getElementTable()) + " e where e.\"parent_id\" = ("
                + "select max(d.\"id\") from " + quote(this.schemaRenderer.getDocumentTable()) + " d where d.\"external_id\" = ?"
                + ") order by e.\"position\" asc";

            List<ElementRecord> elements = new ArrayList<>();
            try (Connection connection = this.dataSource.getConnection();
                 PreparedStatement statement = connection.prepareStatement(this.debugQuery(sql))) {
                statement.setString(1, externalId);
                try (ResultSet resultSet = statement.executeQuery()) {
                    while (resultSet.next()) {
                        elements.add(this.readElement(resultSet));
                    }
                }
            } catch (SQLException exception) {
                LOGGER.log(Level.SEVERE, "[" + this.name + "] Cannot read elements of " + externalId, exception);
                throw new CellStoreException("cannot read elements", exception);
            }

            if (elements.isEmpty()) {
                throw new DocumentNotFoundException(externalId);
            }
            return ElementDetails.of(externalId, elements, this.config.getParams().getPreviewLength());
        });
    }

    @Override
    public Page list(@NonNull Map<String, String> filters) {
        return this.locked(() -> {

            Query query = this.translator.translate(filters);
            RenderedQuery rendered = this.queryRenderer.renderList(query);

            List<DocumentRecord> records = new ArrayList<>();
            try (Connection connection = this.dataSource.getConnection();
                 PreparedStatement statement = connection.prepareStatement(this.debugQuery(rendered.getSql()))) {
                List<Object> params = rendered.getParams();
                for (int i = 0; i < params.size(); i++) {
                    statement.setObject(i + 1, params.get(i));
                }
                try (ResultSet resultSet = statement.executeQuery()) {
                    while (resultSet.next()) {
                        records.add(this.readDocument(resultSet));
                    }
                }
            } catch (SQLException exception) {
                LOGGER.log(Level.SEVERE, "[" + this.name + "] Cannot list documents with " + filters, exception);
                throw new CellStoreException("cannot list documents", exception);
            }

            return this.pager.page(records, query.getLimit());
        });
    }

    @Override
    public long count() {
        return this.locked(() -> {
            String sql = "select count(*) from " + quote(this.schemaRenderer.getDocumentTable());
            try (Connection connection = this.dataSource.getConnection();
                 Statement statement = connection.createStatement();
                 ResultSet resultSet = statement.executeQuery(this.debugQuery(sql))) {
                resultSet.next();
                return resultSet.getLong(1);
            } catch (SQLException exception) {
                LOGGER.log(Level.SEVERE, "[" + this.name + "] Cannot count documents", exception);
                throw new CellStoreException("cannot count documents", exception);
            }
        });
    }

    private Optional<DocumentRecord> selectOne(String sql, String param) {
        try (Connection connection = this.dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(this.debugQuery(sql))) {
            statement.setString(1, param);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(this.readDocument(resultSet)) : Optional.empty();
            }
        } catch (SQLException exception) {
            LOGGER.log(Level.SEVERE, "[" + this.name + "] Cannot read document " + param, exception);
            throw new CellStoreException("cannot read document", exception);
        }
    }

    private DocumentRecord readDocument(ResultSet resultSet) throws SQLException {

        Map<String, Object> promoted = new LinkedHashMap<>();
        for (PromotedField field : this.variant.getPromotedFields()) {
            if (field.getType() == PromotedType.NUMBER) {
                BigDecimal value = resultSet.getBigDecimal(field.getName());
                promoted.put(field.getName(), (value == null) ? null : JsonValues.normalize(value));
            } else {
                promoted.put(field.getName(), resultSet.getString(field.getName()));
            }
        }

        ObjectNode body = JsonValues.parseObject(resultSet.getString("body"));
        return new DocumentRecord(
            resultSet.getString("id"),
            resultSet.getString("external_id"),
            resultSet.getLong("ingested_at"),
            resultSet.getString("schema_version"),
            promoted,
            body
        );
    }

    private ElementRecord readElement(ResultSet resultSet) throws SQLException {

        int estimate = resultSet.getInt("content_size_estimate");
        ElementRecord.ElementRecordBuilder builder = ElementRecord.builder()
            .position(resultSet.getInt("position"))
            .type(resultSet.getString("type"))
            .role(resultSet.getString("role"))
            .status(resultSet.getString("status"))
            .contentExcerpt(resultSet.getString("content_excerpt"))
            .contentSizeEstimate(resultSet.wasNull() ? null : estimate);

        for (IndexColumn column : this.shape.getElementColumns()) {
            builder.column(column.getName(), resultSet.getString(column.getName()));
        }
        return builder.build();
    }

    // ==================== META ====================

    private String readMeta(Connection connection, String key) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(this.debugQuery(this.schemaRenderer.readMeta()))) {
            statement.setString(1, key);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? resultSet.getString(1) : null;
            }
        }
    }

    private void writeMeta(Connection connection, String key, String value) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(this.debugQuery(this.schemaRenderer.writeMeta()))) {
            statement.setString(1, key);
            statement.setString(2, value);
            statement.executeUpdate();
        }
    }

    private String selectMaxId(Connection connection) throws SQLException {
        String sql = "select max(\"id\") from " + quote(this.schemaRenderer.getDocumentTable());
        try (Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery(this.debugQuery(sql))) {
            return resultSet.next() ? resultSet.getString(1) : null;
        }
    }

    private void execute(Connection connection, String sql) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute(this.debugQuery(sql));
        }
    }

    // ==================== UTILITY ====================

    private <T> T locked(Supplier<T> operation) {
        this.lock.lock();
        try {
            return operation.get();
        } finally {
            this.lock.unlock();
        }
    }

    private String debugQuery(String sql) {
        if (H2CellStore.DEBUG) {
            LOGGER.info("[" + this.name + "] " + sql);
        }
        return sql;
    }
}
