package eu.okaeri.cellstore.filter;

import eu.okaeri.cellstore.filter.condition.Condition;
import lombok.Data;
import lombok.NonNull;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Translated listing request: conditions combined with AND, an optional cursor and a page size.
 */
@Data
public class Query {

    private final @NonNull List<Condition> conditions;
    private final String after;
    private final int limit;

    public Query(@NonNull List<Condition> conditions, String after, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
        this.conditions = Collections.unmodifiableList(conditions);
        this.after = after;
        this.limit = limit;
    }

    public boolean hasElementConditions() {
        return this.conditions.stream().anyMatch(Condition::isElementScoped);
    }

    public List<Condition> getDocumentConditions() {
        return this.conditions.stream()
            .filter(condition -> !condition.isElementScoped())
            .collect(Collectors.toList());
    }

    public List<Condition> getElementConditions() {
        return this.conditions.stream()
            .filter(Condition::isElementScoped)
            .collect(Collectors.toList());
    }
}
