package eu.okaeri.cellstore.variant;

import lombok.Data;
import lombok.NonNull;

/**
 * Kind and version of a cell, written {@code kind.version} (e.g. {@code responsesStore.v1}).
 */
@Data
public class CellKind {

    private final @NonNull String kind;
    private final @NonNull String version;

    public static CellKind of(@NonNull String kind, @NonNull String version) {
        return new CellKind(kind, version);
    }

    public static CellKind parse(@NonNull String value) {
        int separator = value.lastIndexOf('.');
        if ((separator <= 0) || (separator == (value.length() - 1))) {
            throw new IllegalArgumentException("cell kind must be written as kind.version, got: " + value);
        }
        return new CellKind(value.substring(0, separator), value.substring(separator + 1));
    }

    @Override
    public String toString() {
        return this.kind + "." + this.version;
    }
}
