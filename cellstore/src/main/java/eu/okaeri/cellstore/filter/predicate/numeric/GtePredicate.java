package eu.okaeri.cellstore.filter.predicate.numeric;

import eu.okaeri.cellstore.filter.predicate.Predicate;
import lombok.NonNull;

import java.math.BigDecimal;

/**
 * VALUE greater than or equal to X
 * {@code val >= x}
 */
public class GtePredicate extends Predicate {

    public GtePredicate(@NonNull BigDecimal rightOperand) {
        super(rightOperand);
    }
}
