package eu.okaeri.cellstore.index;

import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Table layout compiled from the configured index paths of a cell. Consumed by ingestion
 * (which columns to fill), DDL rendering (which columns to create) and query translation
 * (which filter keys resolve to which column).
 */
@Getter
@ToString
public class TableShape {

    private final String repeatingField;
    private final ColumnMapper columnMapper;
    private final List<String> indexes;
    private final List<IndexColumn> documentColumns;
    private final List<IndexColumn> elementColumns;
    private final Map<String, IndexColumn> aliases;

    TableShape(String repeatingField, @NonNull ColumnMapper columnMapper, @NonNull List<String> indexes,
               @NonNull List<IndexColumn> documentColumns, @NonNull List<IndexColumn> elementColumns,
               @NonNull Map<String, IndexColumn> aliases) {
        this.repeatingField = repeatingField;
        this.columnMapper = columnMapper;
        this.indexes = Collections.unmodifiableList(new ArrayList<>(indexes));
        this.documentColumns = Collections.unmodifiableList(new ArrayList<>(documentColumns));
        this.elementColumns = Collections.unmodifiableList(new ArrayList<>(elementColumns));
        this.aliases = Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
    }

    public boolean hasRepeatingField() {
        return this.repeatingField != null;
    }

    /**
     * Resolve a filter key (mapped column name or raw index path) to its column.
     */
    public Optional<IndexColumn> resolve(String key) {
        return Optional.ofNullable(this.aliases.get(key));
    }

    /**
     * Part of the shape not derived from index paths. A change means the tables
     * must be recreated even when the index set is unchanged.
     */
    public String getLayout() {
        return "repeating=" + ((this.repeatingField == null) ? "" : this.repeatingField)
            + ";columns=" + this.columnMapper.getMode();
    }
}
