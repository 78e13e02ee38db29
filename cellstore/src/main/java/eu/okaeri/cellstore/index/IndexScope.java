package eu.okaeri.cellstore.index;

/**
 * Table an index column lives in.
 */
public enum IndexScope {
    DOCUMENT,
    ELEMENT
}
