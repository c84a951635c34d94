package io.tick4j.spi;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Typed key of one section of the per-tenant state record.
 *
 * <p>Each section is read and written independently so that unrelated concerns
 * (breaker, markers, cache metadata) never overwrite each other.
 *
 * @param name    stable storage name; must not contain '.' or '$'
 * @param type    value type, an immutable record
 * @param initial value used when the tenant has no stored section yet
 */
public record StateSection<T>(String name, Class<T> type, Supplier<T> initial) {

    public StateSection {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(initial, "initial must not be null");
        if (name.isBlank() || name.contains(".") || name.contains("$")) {
            throw new IllegalArgumentException("invalid section name: " + name);
        }
    }

    public static <T> StateSection<T> of(String name, Class<T> type, Supplier<T> initial) {
        return new StateSection<>(name, type, initial);
    }
}
