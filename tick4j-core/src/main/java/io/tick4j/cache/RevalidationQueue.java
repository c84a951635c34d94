package io.tick4j.cache;

import io.tick4j.spi.StateSection;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * De-duplicated backlog of keys awaiting background recomputation, oldest first.
 */
public record RevalidationQueue(List<RevalidationQueueItem> items) {

    public static final StateSection<RevalidationQueue> SECTION =
            StateSection.of("revalidation", RevalidationQueue.class, RevalidationQueue::empty);

    public RevalidationQueue {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static RevalidationQueue empty() {
        return new RevalidationQueue(List.of());
    }

    public boolean contains(String key) {
        return items.stream().anyMatch(i -> i.key().equals(key));
    }

    public int size() {
        return items.size();
    }

    /**
     * Append {@code item} unless its key is already queued.
     */
    public RevalidationQueue enqueue(RevalidationQueueItem item) {
        if (contains(item.key())) {
            return this;
        }
        List<RevalidationQueueItem> next = new ArrayList<>(items);
        next.add(item);
        return new RevalidationQueue(next);
    }

    public List<RevalidationQueueItem> head(int n) {
        return items.subList(0, Math.min(Math.max(n, 0), items.size()));
    }

    public RevalidationQueue withoutKeys(Collection<String> keys) {
        List<RevalidationQueueItem> next = new ArrayList<>(items.size());
        for (RevalidationQueueItem i : items) {
            if (!keys.contains(i.key())) {
                next.add(i);
            }
        }
        return new RevalidationQueue(next);
    }
}
