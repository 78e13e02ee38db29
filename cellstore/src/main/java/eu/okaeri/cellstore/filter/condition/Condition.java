package eu.okaeri.cellstore.filter.condition;

import eu.okaeri.cellstore.filter.predicate.Predicate;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NonNull;

/**
 * Predicate bound to a column of the document or element table.
 */
@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Condition {

    private final ConditionScope scope;
    private final String column;
    private final Predicate predicate;

    public static Condition document(@NonNull String column, @NonNull Predicate predicate) {
        return new Condition(ConditionScope.DOCUMENT, column, predicate);
    }

    public static Condition element(@NonNull String column, @NonNull Predicate predicate) {
        return new Condition(ConditionScope.ELEMENT, column, predicate);
    }

    public boolean isElementScoped() {
        return this.scope == ConditionScope.ELEMENT;
    }
}
