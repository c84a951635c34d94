package io.tick4j.config;

import io.tick4j.runtime.TenantRuntimes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Restores tenant triggers when the container starts and retires them when it stops.
 *
 * <p>Reports running only once the restore succeeded. A failed restore is rethrown so the
 * context does not come up half-scheduled.
 */
public class Tick4jLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(Tick4jLifecycle.class);

    private final TenantRuntimes runtimes;
    private volatile boolean running = false;

    public Tick4jLifecycle(TenantRuntimes runtimes) {
        this.runtimes = runtimes;
    }

    @Override
    public void start() {
        try {
            int restored = runtimes.restoreTriggers();
            running = true;
            log.info("tick4j started restoredTriggers={}", restored);
        } catch (RuntimeException e) {
            log.error("tick4j trigger restore failed msg={}", e.getMessage(), e);
            throw e;
        }
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        runtimes.shutdown();
        running = false;
        log.info("tick4j stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // last to start, first to stop
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
