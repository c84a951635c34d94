package io.tick4j.internal.memory;

import io.tick4j.spi.TriggerManager;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link TriggerManager} that only records which tenants own a trigger.
 *
 * <p>Nothing fires on its own; {@link #fire(String)} invokes the registered tick, which is how
 * embedding code without a platform timer (and tests) drive the scheduler.
 */
public class InMemoryTriggerManager implements TriggerManager {

    private final Map<String, Runnable> triggers = new ConcurrentHashMap<>();

    @Override
    public void ensureTrigger(String tenantId, Runnable onTick) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(onTick, "onTick must not be null");
        triggers.putIfAbsent(tenantId, onTick);
    }

    @Override
    public void retireTrigger(String tenantId) {
        triggers.remove(tenantId);
    }

    @Override
    public boolean hasTrigger(String tenantId) {
        return triggers.containsKey(tenantId);
    }

    /**
     * Run the tenant's tick once, if a trigger exists.
     *
     * @return false when the tenant has no trigger
     */
    public boolean fire(String tenantId) {
        Runnable onTick = triggers.get(tenantId);
        if (onTick == null) {
            return false;
        }
        onTick.run();
        return true;
    }
}
