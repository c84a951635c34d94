package io.tick4j.breaker;

import io.tick4j.spi.TenantStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Tenant-scoped circuit breaker over the upstream service.
 *
 * <p>State machine:
 * <ul>
 *   <li>CLOSED: calls pass; failures are counted</li>
 *   <li>OPEN: {@link #isOpenNow()} is true until {@code cooldown} has passed since the last failure</li>
 *   <li>HALF_OPEN: evaluated lazily, never stored; the next call passes and its outcome decides.
 *       A success closes the breaker, a failure re-opens it with a fresh timer</li>
 * </ul>
 *
 * <p>Callers check {@link #isOpenNow()} before issuing a call; best-effort work (prefetch,
 * revalidation) must skip entirely while it is true.
 */
public class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String tenantId;
    private final TenantStateStore stateStore;
    private final BreakerSettings settings;
    private final Clock clock;

    public CircuitBreaker(String tenantId, TenantStateStore stateStore, BreakerSettings settings, Clock clock) {
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId must not be null");
        this.stateStore = Objects.requireNonNull(stateStore, "stateStore must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public void recordFailure() {
        Instant now = clock.instant();
        CircuitBreakerState before = stateStore.read(tenantId, CircuitBreakerState.SECTION);
        CircuitBreakerState after = stateStore.update(tenantId, CircuitBreakerState.SECTION,
                s -> s.failedAt(now, settings.failureThreshold()));

        if (after.open() && !before.open()) {
            log.warn("circuit breaker opened tenant={} failures={} cooldown={}",
                    tenantId, after.failureCount(), settings.cooldown());
        } else if (after.open()) {
            log.warn("circuit breaker trial failed, re-opened tenant={} failures={}", tenantId, after.failureCount());
        } else {
            log.debug("circuit breaker failure recorded tenant={} failures={}", tenantId, after.failureCount());
        }
    }

    public void recordSuccess() {
        CircuitBreakerState before = stateStore.read(tenantId, CircuitBreakerState.SECTION);
        if (before.failureCount() == 0 && !before.open()) {
            return;
        }
        stateStore.update(tenantId, CircuitBreakerState.SECTION, s -> CircuitBreakerState.closed());
        if (before.open()) {
            log.info("circuit breaker closed tenant={}", tenantId);
        }
    }

    /**
     * True while the breaker is open and the cooldown has not elapsed. Past the cooldown the
     * breaker is half-open and this returns false without changing the stored state.
     */
    public boolean isOpenNow() {
        return status() == BreakerStatus.OPEN;
    }

    public BreakerStatus status() {
        CircuitBreakerState state = snapshot();
        if (!state.open()) {
            return BreakerStatus.CLOSED;
        }
        if (state.lastFailureAt() == null) {
            return BreakerStatus.HALF_OPEN;
        }
        Duration sinceFailure = Duration.between(state.lastFailureAt(), clock.instant());
        return sinceFailure.compareTo(settings.cooldown()) > 0 ? BreakerStatus.HALF_OPEN : BreakerStatus.OPEN;
    }

    public CircuitBreakerState snapshot() {
        return stateStore.read(tenantId, CircuitBreakerState.SECTION);
    }

    /**
     * Force the breaker closed, e.g. after an operator fixed the upstream credentials.
     */
    public void reset() {
        stateStore.update(tenantId, CircuitBreakerState.SECTION, s -> CircuitBreakerState.closed());
        log.info("circuit breaker reset tenant={}", tenantId);
    }

    public BreakerSettings settings() {
        return settings;
    }
}
