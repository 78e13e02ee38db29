package eu.okaeri.cellstore.variant;

import eu.okaeri.cellstore.config.CellConfig;
import lombok.NonNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Closed table of cell kinds. Built once and shared by every cell of a store.
 */
public final class CellRegistry {

    private final Map<CellKind, Function<CellConfig, StoreVariant>> factories;

    private CellRegistry(Map<CellKind, Function<CellConfig, StoreVariant>> factories) {
        this.factories = Collections.unmodifiableMap(new LinkedHashMap<>(factories));
    }

    public static CellRegistry defaults() {
        return builder()
            .register(GenericStoreVariant.KIND, GenericStoreVariant::new)
            .register(ResponsesStoreVariant.KIND, ResponsesStoreVariant::new)
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<CellKind> getKinds() {
        return this.factories.keySet();
    }

    public boolean supports(@NonNull CellKind kind) {
        return this.factories.containsKey(kind);
    }

    public StoreVariant create(@NonNull CellConfig config) {
        CellKind kind = config.getCellKind();
        Function<CellConfig, StoreVariant> factory = this.factories.get(kind);
        if (factory == null) {
            throw new UnknownCellKindException(kind);
        }
        return factory.apply(config);
    }

    public static final class Builder {

        private final Map<CellKind, Function<CellConfig, StoreVariant>> factories = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(@NonNull CellKind kind, @NonNull Function<CellConfig, StoreVariant> factory) {
            if (this.factories.putIfAbsent(kind, factory) != null) {
                throw new IllegalArgumentException("cell kind already registered: " + kind);
            }
            return this;
        }

        public CellRegistry build() {
            return new CellRegistry(this.factories);
        }
    }
}
