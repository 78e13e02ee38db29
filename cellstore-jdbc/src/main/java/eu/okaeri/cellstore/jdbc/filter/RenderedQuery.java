package eu.okaeri.cellstore.jdbc.filter;

import lombok.Data;
import lombok.NonNull;

import java.util.Collections;
import java.util.List;

/**
 * SQL text with its positional parameters, in binding order.
 */
@Data
public class RenderedQuery {

    private final @NonNull String sql;
    private final @NonNull List<Object> params;

    public RenderedQuery(@NonNull String sql, @NonNull List<Object> params) {
        this.sql = sql;
        this.params = Collections.unmodifiableList(params);
    }
}
