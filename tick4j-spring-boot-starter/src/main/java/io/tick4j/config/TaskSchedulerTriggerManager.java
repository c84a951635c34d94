package io.tick4j.config;

import io.tick4j.spi.TriggerManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * {@link TriggerManager} backed by a Spring {@link TaskScheduler}: one fixed-rate task per tenant.
 */
public class TaskSchedulerTriggerManager implements TriggerManager {
    private static final Logger log = LoggerFactory.getLogger(TaskSchedulerTriggerManager.class);

    private final TaskScheduler taskScheduler;
    private final Duration tickInterval;
    private final Duration initialDelay;
    private final Clock clock;

    private final Map<String, ScheduledFuture<?>> triggers = new ConcurrentHashMap<>();

    public TaskSchedulerTriggerManager(TaskScheduler taskScheduler, Duration tickInterval, Duration initialDelay, Clock clock) {
        this.taskScheduler = Objects.requireNonNull(taskScheduler, "taskScheduler must not be null");
        this.tickInterval = Objects.requireNonNull(tickInterval, "tickInterval must not be null");
        this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (tickInterval.isZero() || tickInterval.isNegative()) {
            throw new IllegalArgumentException("tickInterval must be a positive duration");
        }
    }

    @Override
    public void ensureTrigger(String tenantId, Runnable onTick) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(onTick, "onTick must not be null");
        triggers.computeIfAbsent(tenantId, id -> {
            log.info("tenant trigger scheduled tenant={} every={}", id, tickInterval);
            return taskScheduler.scheduleAtFixedRate(() -> runTick(id, onTick),
                    clock.instant().plus(initialDelay), tickInterval);
        });
    }

    @Override
    public void retireTrigger(String tenantId) {
        ScheduledFuture<?> future = triggers.remove(tenantId);
        if (future != null) {
            future.cancel(false);
            log.info("tenant trigger retired tenant={}", tenantId);
        }
    }

    @Override
    public boolean hasTrigger(String tenantId) {
        return triggers.containsKey(tenantId);
    }

    // An exception escaping a fixed-rate task would cancel all its later runs.
    private void runTick(String tenantId, Runnable onTick) {
        try {
            onTick.run();
        } catch (RuntimeException e) {
            log.error("tenant tick failed tenant={} msg={}", tenantId, e.getMessage(), e);
        }
    }
}
