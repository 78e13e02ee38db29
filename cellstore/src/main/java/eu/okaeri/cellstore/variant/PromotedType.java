package eu.okaeri.cellstore.variant;

public enum PromotedType {
    TEXT,
    /**
     * Exact decimal, kept without narrowing (fractions and values past the long range included).
     */
    NUMBER
}
