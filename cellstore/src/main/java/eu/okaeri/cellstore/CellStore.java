package eu.okaeri.cellstore;

import eu.okaeri.cellstore.config.CellConfig;
import eu.okaeri.cellstore.variant.CellRegistry;
import lombok.NonNull;

import java.util.Set;

/**
 * Entry point: opens cells by name over a shared storage backend.
 */
public interface CellStore extends AutoCloseable {

    CellRegistry getRegistry();

    /**
     * Open a cell with its persisted configuration, or the default one for a new cell.
     */
    StoreCell open(@NonNull String name);

    /**
     * Open a cell with the given configuration, rebuilding its tables when the index set changed.
     */
    StoreCell open(@NonNull String name, @NonNull CellConfig config);

    Set<String> getOpenCells();

    @Override
    void close();
}
