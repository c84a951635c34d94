package io.tick4j.spi;

import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Durable per-tenant record made of typed sections.
 *
 * <p>Updates are read-modify-write against a single section. Implementations keep the window
 * between read and write short but do not provide transactional isolation: the last writer wins.
 */
public interface TenantStateStore {

    /**
     * Read a section, falling back to {@link StateSection#initial()} when nothing is stored.
     */
    <T> T read(String tenantId, StateSection<T> section);

    /**
     * Apply {@code mutator} to the current section value and persist the result.
     *
     * @return the value that was written
     */
    <T> T update(String tenantId, StateSection<T> section, UnaryOperator<T> mutator);

    /**
     * Tenants that have any stored state.
     */
    Set<String> tenantIds();
}
