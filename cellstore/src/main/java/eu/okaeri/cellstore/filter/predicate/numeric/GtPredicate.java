package eu.okaeri.cellstore.filter.predicate.numeric;

import eu.okaeri.cellstore.filter.predicate.Predicate;
import lombok.NonNull;

/**
 * VALUE greater than X
 * {@code val > x}
 */
public class GtPredicate extends Predicate {

    public GtPredicate(@NonNull Object rightOperand) {
        super(rightOperand);
    }
}
