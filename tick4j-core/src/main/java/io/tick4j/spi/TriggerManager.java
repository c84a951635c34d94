package io.tick4j.spi;

/**
 * Owns the single external periodic trigger of each tenant.
 *
 * <p>Both operations are idempotent: ensuring an existing trigger or retiring a missing one is a no-op.
 */
public interface TriggerManager {

    void ensureTrigger(String tenantId, Runnable onTick);

    void retireTrigger(String tenantId);

    boolean hasTrigger(String tenantId);
}
