package eu.okaeri.cellstore.index;

import com.fasterxml.jackson.databind.JsonNode;
import eu.okaeri.cellstore.document.JsonValues;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Extracts index values from documents.
 * <p>
 * Paths rooted at the repeating field yield one value per array element (elements
 * without a value at the sub-path are skipped). Other paths yield the value found
 * at the path, or nothing when it is absent or null.
 */
@RequiredArgsConstructor
public class PathExtractor {

    public static final String MULTI_VALUE_DELIMITER = "|";

    /**
     * Repeating (array) field name, {@code null} when the cell has none.
     */
    @Getter private final String repeatingField;

    public List<String> extract(@NonNull JsonNode document, @NonNull IndexPath path) {

        if (path.isRootedAt(this.repeatingField)) {
            JsonNode elements = document.get(this.repeatingField);
            if ((elements == null) || !elements.isArray()) {
                return Collections.emptyList();
            }
            List<String> parts = path.removeRoot().toParts();
            List<String> values = new ArrayList<>();
            for (JsonNode element : elements) {
                this.extractInto(element, parts, values);
            }
            return values;
        }

        List<String> values = new ArrayList<>();
        this.extractInto(document, path.toParts(), values);
        return values;
    }

    public List<String> extract(@NonNull JsonNode document, @NonNull String path) {
        return this.extract(document, IndexPath.of(path));
    }

    /**
     * Single column value for a document-scoped path: multiple values joined
     * with {@value #MULTI_VALUE_DELIMITER}, {@code null} when nothing was found.
     */
    public String extractColumnValue(@NonNull JsonNode document, @NonNull IndexPath path) {
        List<String> values = this.extract(document, path);
        return values.isEmpty() ? null : String.join(MULTI_VALUE_DELIMITER, values);
    }

    /**
     * Column value for a sub-path within a single repeating field element.
     */
    public String extractElementValue(@NonNull JsonNode element, @NonNull IndexPath subPath) {
        List<String> values = new ArrayList<>();
        this.extractInto(element, subPath.toParts(), values);
        return values.isEmpty() ? null : String.join(MULTI_VALUE_DELIMITER, values);
    }

    private void extractInto(JsonNode node, List<String> parts, List<String> values) {
        values.addAll(JsonValues.walk(node, parts).stream()
            .map(JsonValues::stringify)
            .collect(Collectors.toList()));
    }
}
