package io.tick4j.runtime;

import io.tick4j.breaker.BreakerSettings;
import io.tick4j.cache.CacheSettings;
import io.tick4j.resilience.RetryOptions;

import java.util.Objects;

public record RuntimeSettings(RetryOptions retry, BreakerSettings breaker, CacheSettings cache) {

    public RuntimeSettings {
        Objects.requireNonNull(retry, "retry must not be null");
        Objects.requireNonNull(breaker, "breaker must not be null");
        Objects.requireNonNull(cache, "cache must not be null");
    }

    public static RuntimeSettings defaults() {
        return new RuntimeSettings(RetryOptions.defaults(), BreakerSettings.defaults(), CacheSettings.defaults());
    }
}
