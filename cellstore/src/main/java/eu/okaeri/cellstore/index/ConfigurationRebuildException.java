package eu.okaeri.cellstore.index;

import eu.okaeri.cellstore.CellStoreException;

/**
 * Cell tables could not be created or rebuilt for the requested index configuration.
 * The previous baseline stays persisted, so the next open retries the rebuild.
 */
public class ConfigurationRebuildException extends CellStoreException {

    public ConfigurationRebuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
