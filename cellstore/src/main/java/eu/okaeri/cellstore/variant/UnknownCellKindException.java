package eu.okaeri.cellstore.variant;

import eu.okaeri.cellstore.CellStoreException;
import lombok.Getter;

public class UnknownCellKindException extends CellStoreException {

    @Getter
    private final CellKind kind;

    public UnknownCellKindException(CellKind kind) {
        super("unknown cell kind: " + kind);
        this.kind = kind;
    }
}
