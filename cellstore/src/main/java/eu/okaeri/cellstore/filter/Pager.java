package eu.okaeri.cellstore.filter;

import eu.okaeri.cellstore.document.DocumentRecord;
import lombok.Getter;
import lombok.NonNull;

import java.util.List;
import java.util.logging.Logger;

/**
 * Keyset pagination ordered by internal id. A page holding exactly {@code limit} records
 * points at its last id, a shorter page ends the listing.
 */
@Getter
public class Pager {

    private static final Logger LOGGER = Logger.getLogger(Pager.class.getSimpleName());

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 200;

    private final int defaultLimit;
    private final int maxLimit;

    public Pager() {
        this(DEFAULT_LIMIT, MAX_LIMIT);
    }

    public Pager(int defaultLimit, int maxLimit) {
        if (maxLimit < 1) {
            throw new IllegalArgumentException("maxLimit must be positive, got " + maxLimit);
        }
        this.maxLimit = maxLimit;
        this.defaultLimit = Math.max(1, Math.min(defaultLimit, maxLimit));
    }

    public int resolveLimit(String raw) {
        if ((raw == null) || raw.trim().isEmpty()) {
            return this.defaultLimit;
        }
        int limit;
        try {
            limit = Integer.parseInt(raw.trim());
        } catch (NumberFormatException exception) {
            LOGGER.fine("Ignoring non-numeric limit '" + raw + "'");
            return this.defaultLimit;
        }
        return Math.max(1, Math.min(limit, this.maxLimit));
    }

    public Page page(@NonNull List<DocumentRecord> records, int limit) {
        String nextAfter = (!records.isEmpty() && (records.size() == limit))
            ? records.get(records.size() - 1).getId()
            : null;
        return new Page(records, nextAfter);
    }
}
