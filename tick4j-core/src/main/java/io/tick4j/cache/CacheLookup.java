package io.tick4j.cache;

/**
 * Result of {@link BoundedCache#get}. A stale lookup still carries the cached value.
 */
public record CacheLookup<T>(T value, boolean found, boolean stale) {

    public static <T> CacheLookup<T> miss() {
        return new CacheLookup<>(null, false, false);
    }

    public static <T> CacheLookup<T> fresh(T value) {
        return new CacheLookup<>(value, true, false);
    }

    public static <T> CacheLookup<T> stale(T value) {
        return new CacheLookup<>(value, true, true);
    }
}
