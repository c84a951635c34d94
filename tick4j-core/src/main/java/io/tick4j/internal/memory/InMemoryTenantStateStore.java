package io.tick4j.internal.memory;

import io.tick4j.spi.StateSection;
import io.tick4j.spi.TenantStateStore;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Process-local {@link TenantStateStore}. Section values are immutable records, so they are held as-is.
 */
public class InMemoryTenantStateStore implements TenantStateStore {

    private final Map<String, Map<String, Object>> tenants = new ConcurrentHashMap<>();

    @Override
    public <T> T read(String tenantId, StateSection<T> section) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(section, "section must not be null");

        Map<String, Object> sections = tenants.get(tenantId);
        Object value = sections == null ? null : sections.get(section.name());
        return value == null ? section.initial().get() : section.type().cast(value);
    }

    @Override
    public <T> T update(String tenantId, StateSection<T> section, UnaryOperator<T> mutator) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(section, "section must not be null");
        Objects.requireNonNull(mutator, "mutator must not be null");

        Map<String, Object> sections = tenants.computeIfAbsent(tenantId, id -> new ConcurrentHashMap<>());
        Object written = sections.compute(section.name(), (name, current) -> {
            T base = current == null ? section.initial().get() : section.type().cast(current);
            return Objects.requireNonNull(mutator.apply(base), "mutator must not return null");
        });
        return section.type().cast(written);
    }

    @Override
    public Set<String> tenantIds() {
        return Set.copyOf(tenants.keySet());
    }
}
