package eu.okaeri.cellstore.schema;

import lombok.Data;
import lombok.NonNull;

/**
 * Single validation failure. Path segments are joined with dots,
 * array positions are rendered as numbers ({@code output.0.role}).
 */
@Data
public class FieldError {

    private final @NonNull String path;
    private final @NonNull String message;

    @Override
    public String toString() {
        return this.path.isEmpty() ? this.message : (this.path + ": " + this.message);
    }
}
