package eu.okaeri.cellstore.filter.predicate.numeric;

import eu.okaeri.cellstore.filter.predicate.Predicate;
import lombok.NonNull;

import java.math.BigDecimal;

/**
 * VALUE less than or equal to X
 * {@code val <= x}
 */
public class LtePredicate extends Predicate {

    public LtePredicate(@NonNull BigDecimal rightOperand) {
        super(rightOperand);
    }
}
