package eu.okaeri.cellstore.filter.predicate;

import eu.okaeri.cellstore.filter.predicate.equality.EqPredicate;
import eu.okaeri.cellstore.filter.predicate.numeric.GtPredicate;
import eu.okaeri.cellstore.filter.predicate.numeric.GtePredicate;
import eu.okaeri.cellstore.filter.predicate.numeric.LtePredicate;
import eu.okaeri.cellstore.filter.predicate.string.ContainsPredicate;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NonNull;

import java.math.BigDecimal;

/**
 * Comparison applied to a single column. The right operand is always bound as a
 * statement parameter, never rendered into the query text.
 */
@Data
@AllArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class Predicate {

    private final @NonNull Object rightOperand;

    /**
     * {@code field == value}
     */
    public static EqPredicate eq(@NonNull Object value) {
        return new EqPredicate(value);
    }

    /**
     * {@code field > value}
     */
    public static GtPredicate gt(@NonNull Object value) {
        return new GtPredicate(value);
    }

    /**
     * {@code field >= value}
     */
    public static GtePredicate gte(@NonNull BigDecimal value) {
        return new GtePredicate(value);
    }

    /**
     * {@code field <= value}
     */
    public static LtePredicate lte(@NonNull BigDecimal value) {
        return new LtePredicate(value);
    }

    /**
     * {@code field LIKE '%substring%'}, case-sensitive
     */
    public static ContainsPredicate contains(@NonNull String substring) {
        return new ContainsPredicate(substring);
    }
}
