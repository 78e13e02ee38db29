package eu.okaeri.cellstore.index;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

/**
 * Built-in element table columns filled directly from an element's own fields.
 */
@Getter
@RequiredArgsConstructor
public enum ElementTag {

    TYPE("type"),
    ROLE("role"),
    STATUS("status");

    private final String field;

    public String getColumn() {
        return this.field;
    }

    public static Optional<ElementTag> byField(String field) {
        return Arrays.stream(values())
            .filter(tag -> tag.field.equals(field))
            .findFirst();
    }
}
