package eu.okaeri.cellstore.index;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Plans the table shape of a cell from its index paths and decides when the stored
 * tables no longer match the configuration.
 */
@Getter
@RequiredArgsConstructor
public class IndexPlanner {

    private static final Logger LOGGER = Logger.getLogger(IndexPlanner.class.getSimpleName());

    private final String repeatingField;
    private final @NonNull ColumnMapper columnMapper;

    /**
     * Trimmed, non-empty, distinct and sorted copy of the configured paths.
     */
    public static List<String> normalize(Collection<String> indexes) {
        if (indexes == null) {
            return new ArrayList<>();
        }
        return indexes.stream()
            .filter(Objects::nonNull)
            .map(String::trim)
            .filter(path -> !path.isEmpty())
            .distinct()
            .sorted()
            .collect(Collectors.toList());
    }

    /**
     * @param stored normalized baseline, {@code null} when none was persisted yet
     * @param current configured index paths (normalized here)
     */
    public static boolean needsRebuild(List<String> stored, Collection<String> current) {
        if (stored == null) {
            return true;
        }
        return !normalize(stored).equals(normalize(current));
    }

    public TableShape plan(Collection<String> indexes) {

        List<String> normalized = normalize(indexes);
        List<IndexColumn> documentColumns = new ArrayList<>();
        List<IndexColumn> elementColumns = new ArrayList<>();
        Map<String, IndexColumn> aliases = new LinkedHashMap<>();

        for (String raw : normalized) {

            IndexPath path = IndexPath.of(raw);
            String name = this.columnMapper.mapPath(path);
            IndexColumn column;

            if (path.isRootedAt(this.repeatingField)) {
                IndexPath subPath = path.removeRoot();
                Optional<ElementTag> tag = ElementTag.byField(subPath.getValue());
                if (tag.isPresent()) {
                    column = IndexColumn.tag(tag.get(), path);
                } else {
                    column = this.register(elementColumns, IndexColumn.element(name, path, subPath));
                }
            } else {
                column = this.register(documentColumns, IndexColumn.document(name, path));
            }

            aliases.putIfAbsent(name, column);
            aliases.putIfAbsent(raw, column);
        }

        return new TableShape(this.repeatingField, this.columnMapper, normalized, documentColumns, elementColumns, aliases);
    }

    private IndexColumn register(List<IndexColumn> columns, IndexColumn column) {
        for (IndexColumn existing : columns) {
            if (existing.getName().equals(column.getName())) {
                LOGGER.warning("Index paths '" + existing.getPath().getValue() + "' and '" + column.getPath().getValue()
                    + "' both map to column " + column.getName() + ", only the first one is stored");
                return existing;
            }
        }
        columns.add(column);
        return column;
    }
}
