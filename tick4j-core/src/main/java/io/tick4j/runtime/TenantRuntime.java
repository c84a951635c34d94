package io.tick4j.runtime;

import io.tick4j.TickScheduler;
import io.tick4j.breaker.CircuitBreaker;
import io.tick4j.cache.BoundedCache;
import io.tick4j.resilience.ResilientCall;

/**
 * Everything a feature job needs for one tenant. All members share the tenant's breaker.
 */
public record TenantRuntime(
        String tenantId,
        TickScheduler scheduler,
        ResilientCall resilientCall,
        CircuitBreaker breaker,
        BoundedCache cache
) {
}
