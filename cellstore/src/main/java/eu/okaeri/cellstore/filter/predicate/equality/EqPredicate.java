package eu.okaeri.cellstore.filter.predicate.equality;

import eu.okaeri.cellstore.filter.predicate.Predicate;
import lombok.NonNull;

/**
 * VALUE equals X
 * {@code val == x}
 */
public class EqPredicate extends Predicate {

    public EqPredicate(@NonNull Object rightOperand) {
        super(rightOperand);
    }
}
