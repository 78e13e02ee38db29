package eu.okaeri.cellstore.index;

import lombok.Data;
import lombok.NonNull;

/**
 * Column fed by a configured index path. Element columns carry the path relative to
 * the element in {@code subPath}; tag columns reference a built-in {@link ElementTag}.
 */
@Data
public class IndexColumn {

    private final @NonNull String name;
    private final @NonNull IndexPath path;
    private final @NonNull IndexScope scope;
    private final IndexPath subPath;
    private final ElementTag tag;

    public static IndexColumn document(@NonNull String name, @NonNull IndexPath path) {
        return new IndexColumn(name, path, IndexScope.DOCUMENT, null, null);
    }

    public static IndexColumn element(@NonNull String name, @NonNull IndexPath path, @NonNull IndexPath subPath) {
        return new IndexColumn(name, path, IndexScope.ELEMENT, subPath, null);
    }

    public static IndexColumn tag(@NonNull ElementTag tag, @NonNull IndexPath path) {
        return new IndexColumn(tag.getColumn(), path, IndexScope.ELEMENT, path.removeRoot(), tag);
    }

    public boolean isTag() {
        return this.tag != null;
    }
}
