package eu.okaeri.cellstore.filter.condition;

/**
 * Table a condition is evaluated against.
 */
public enum ConditionScope {
    DOCUMENT,
    ELEMENT
}
