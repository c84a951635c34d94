package io.tick4j.config;

import io.tick4j.breaker.BreakerSettings;
import io.tick4j.cache.CacheSettings;
import io.tick4j.resilience.RetryOptions;
import io.tick4j.runtime.RuntimeSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runtime configuration for tenant scheduling, retries, the circuit breaker and the cache.
 */
@ConfigurationProperties(prefix = "tick4j")
public class Tick4jProperties {
    private Duration tickInterval = Duration.ofHours(1);
    private Duration initialTickDelay = Duration.ofSeconds(30);
    private ZoneId zone = ZoneId.of("UTC"); // zone of cadence overrides
    private int schedulerPoolSize = 2;
    private boolean ensureIndexesOnStartup = false;
    private Map<String, String> cadences = new LinkedHashMap<>(); // job name -> cadence

    private final Retry retry = new Retry();
    private final Breaker breaker = new Breaker();
    private final Cache cache = new Cache();

    public RuntimeSettings toRuntimeSettings() {
        return new RuntimeSettings(retry.toOptions(), breaker.toSettings(), cache.toSettings());
    }

    public Duration getTickInterval() {
        return tickInterval;
    }

    public void setTickInterval(Duration tickInterval) {
        this.tickInterval = tickInterval;
    }

    public Duration getInitialTickDelay() {
        return initialTickDelay;
    }

    public void setInitialTickDelay(Duration initialTickDelay) {
        this.initialTickDelay = initialTickDelay;
    }

    public ZoneId getZone() {
        return zone;
    }

    public void setZone(ZoneId zone) {
        this.zone = zone;
    }

    public int getSchedulerPoolSize() {
        return schedulerPoolSize;
    }

    public void setSchedulerPoolSize(int schedulerPoolSize) {
        this.schedulerPoolSize = schedulerPoolSize;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public Map<String, String> getCadences() {
        return cadences;
    }

    public void setCadences(Map<String, String> cadences) {
        this.cadences = cadences;
    }

    public Retry getRetry() {
        return retry;
    }

    public Breaker getBreaker() {
        return breaker;
    }

    public Cache getCache() {
        return cache;
    }

    public static class Retry {
        private int maxRetries = 3;
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(10);
        private double backoffMultiplier = 2.0;

        RetryOptions toOptions() {
            return new RetryOptions(maxRetries, initialDelay, maxDelay, backoffMultiplier);
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }
    }

    public static class Breaker {
        private int failureThreshold = 5;
        private Duration cooldown = Duration.ofMinutes(5);

        BreakerSettings toSettings() {
            return new BreakerSettings(failureThreshold, cooldown);
        }

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getCooldown() {
            return cooldown;
        }

        public void setCooldown(Duration cooldown) {
            this.cooldown = cooldown;
        }
    }

    public static class Cache {
        private int maxItems = 100;
        private long maxItemSize = 100 * 1024;
        private long maxTotalSize = 1024 * 1024;
        private Duration staleRetention = Duration.ofHours(1);
        private int revalidationBatchSize = 3;
        private double utilizationThreshold = 0.8;
        private Duration maintenanceCeiling = Duration.ofHours(6);

        CacheSettings toSettings() {
            return new CacheSettings(maxItems, maxItemSize, maxTotalSize, staleRetention,
                    revalidationBatchSize, utilizationThreshold, maintenanceCeiling);
        }

        public int getMaxItems() {
            return maxItems;
        }

        public void setMaxItems(int maxItems) {
            this.maxItems = maxItems;
        }

        public long getMaxItemSize() {
            return maxItemSize;
        }

        public void setMaxItemSize(long maxItemSize) {
            this.maxItemSize = maxItemSize;
        }

        public long getMaxTotalSize() {
            return maxTotalSize;
        }

        public void setMaxTotalSize(long maxTotalSize) {
            this.maxTotalSize = maxTotalSize;
        }

        public Duration getStaleRetention() {
            return staleRetention;
        }

        public void setStaleRetention(Duration staleRetention) {
            this.staleRetention = staleRetention;
        }

        public int getRevalidationBatchSize() {
            return revalidationBatchSize;
        }

        public void setRevalidationBatchSize(int revalidationBatchSize) {
            this.revalidationBatchSize = revalidationBatchSize;
        }

        public double getUtilizationThreshold() {
            return utilizationThreshold;
        }

        public void setUtilizationThreshold(double utilizationThreshold) {
            this.utilizationThreshold = utilizationThreshold;
        }

        public Duration getMaintenanceCeiling() {
            return maintenanceCeiling;
        }

        public void setMaintenanceCeiling(Duration maintenanceCeiling) {
            this.maintenanceCeiling = maintenanceCeiling;
        }
    }
}
