package eu.okaeri.cellstore.index;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.util.Arrays;
import java.util.List;

/**
 * Dotted document path selected for indexing, e.g. {@code usage.total_tokens} or {@code output.role}.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class IndexPath implements Comparable<IndexPath> {

    public static final String SEPARATOR = ".";
    private final String value;

    public static IndexPath of(@NonNull String path) {
        String trimmed = path.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("index path cannot be empty");
        }
        return new IndexPath(trimmed);
    }

    public IndexPath sub(@NonNull String sub) {
        return of(this.value + SEPARATOR + sub);
    }

    public List<String> toParts() {
        return Arrays.asList(this.value.split("\\.", -1));
    }

    public String getRoot() {
        int separator = this.value.indexOf(SEPARATOR);
        return (separator == -1) ? this.value : this.value.substring(0, separator);
    }

    public boolean isRootedAt(String field) {
        return (field != null) && this.value.startsWith(field + SEPARATOR) && (this.value.length() > (field.length() + 1));
    }

    public IndexPath removeRoot() {
        int separator = this.value.indexOf(SEPARATOR);
        if (separator == -1) {
            throw new IllegalStateException("path " + this.value + " has no sub-path");
        }
        return of(this.value.substring(separator + 1));
    }

    @Override
    public int compareTo(@NonNull IndexPath other) {
        return this.value.compareTo(other.value);
    }
}
