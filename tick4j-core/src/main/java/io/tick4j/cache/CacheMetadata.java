package io.tick4j.cache;

import io.tick4j.spi.StateSection;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Per-tenant accounting of cached items. Invariant: {@code totalSize} is the sum of item sizes.
 *
 * <p>Items are kept as a list rather than a map so that arbitrary cache keys survive document stores
 * that restrict field names.
 */
public record CacheMetadata(List<CacheItemInfo> items, long totalSize) {

    public static final StateSection<CacheMetadata> SECTION =
            StateSection.of("cacheMetadata", CacheMetadata.class, CacheMetadata::empty);

    public CacheMetadata {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static CacheMetadata empty() {
        return new CacheMetadata(List.of(), 0);
    }

    public int count() {
        return items.size();
    }

    public Optional<CacheItemInfo> find(String key) {
        return items.stream().filter(i -> i.key().equals(key)).findFirst();
    }

    /**
     * Oldest item by {@code cachedAt}; the eviction candidate.
     */
    public Optional<CacheItemInfo> oldest() {
        return items.stream().min(Comparator.comparing(CacheItemInfo::cachedAt));
    }

    public CacheMetadata with(CacheItemInfo item) {
        List<CacheItemInfo> next = new ArrayList<>(items.size() + 1);
        for (CacheItemInfo i : items) {
            if (!i.key().equals(item.key())) {
                next.add(i);
            }
        }
        next.add(item);
        return new CacheMetadata(next, sum(next));
    }

    public CacheMetadata without(String key) {
        return withoutAll(List.of(key));
    }

    public CacheMetadata withoutAll(Collection<String> keys) {
        if (keys.isEmpty()) {
            return this;
        }
        List<CacheItemInfo> next = new ArrayList<>(items.size());
        for (CacheItemInfo i : items) {
            if (!keys.contains(i.key())) {
                next.add(i);
            }
        }
        return new CacheMetadata(next, sum(next));
    }

    /**
     * Same items with {@code totalSize} recomputed.
     */
    public CacheMetadata reconciled() {
        return new CacheMetadata(items, sum(items));
    }

    private static long sum(List<CacheItemInfo> items) {
        long total = 0;
        for (CacheItemInfo i : items) {
            total += i.sizeBytes();
        }
        return total;
    }
}
