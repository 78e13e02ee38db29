package eu.okaeri.cellstore.filter.predicate.string;

import eu.okaeri.cellstore.filter.predicate.Predicate;
import lombok.NonNull;

/**
 * String contains predicate.
 * {@code field contains "substring"}
 */
public class ContainsPredicate extends Predicate {

    public ContainsPredicate(@NonNull String substring) {
        super(substring);
    }

    public String getSubstring() {
        return (String) this.getRightOperand();
    }
}
