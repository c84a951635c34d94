package io.tick4j.resilience;

import io.tick4j.MutableClock;
import io.tick4j.breaker.BreakerSettings;
import io.tick4j.breaker.CircuitBreaker;
import io.tick4j.internal.memory.InMemoryTenantStateStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResilientCallTest {

    private final MutableClock clock = MutableClock.at("2026-03-02T08:00:00Z");
    private final List<Duration> sleeps = new ArrayList<>();

    private CircuitBreaker breaker;
    private ResilientCall call;

    @BeforeEach
    void setUp() {
        breaker = new CircuitBreaker("tenant-a", new InMemoryTenantStateStore(), new BreakerSettings(2, Duration.ofMinutes(5)), clock);
        call = new ResilientCall(breaker, new ErrorClassifier(), sleeps::add, RetryOptions.defaults());
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void networkErrorsShouldBeRetriedUntilSuccess() {
        AtomicInteger invocations = new AtomicInteger();

        String result = call.execute(() -> {
            if (invocations.incrementAndGet() < 3) {
                throw new ConnectException("Connection refused");
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, invocations.get());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeps);
        assertEquals(0, breaker.snapshot().failureCount());
    }

    @Test
    void unauthorizedShouldFailOnFirstAttempt() {
        AtomicInteger invocations = new AtomicInteger();

        ClassifiedCallException ex = assertThrows(ClassifiedCallException.class, () -> call.execute(() -> {
            invocations.incrementAndGet();
            throw new UpstreamStatusException(401, "token expired");
        }));

        assertEquals(1, invocations.get());
        assertEquals(ErrorKind.UNAUTHORIZED, ex.getKind());
        assertEquals(1, ex.getAttempts());
        assertEquals(MessageCategory.REAUTHORIZE, ex.getMessageCategory());
        assertTrue(sleeps.isEmpty());
        assertEquals(1, breaker.snapshot().failureCount());
    }

    @Test
    void rateLimitedShouldWaitAtLeastTheFloorAndSurfaceLastError() {
        AtomicInteger invocations = new AtomicInteger();
        List<RuntimeException> raised = new ArrayList<>();

        ClassifiedCallException ex = assertThrows(ClassifiedCallException.class, () -> call.execute(() -> {
            RuntimeException e = new UpstreamStatusException(429, "attempt " + invocations.incrementAndGet());
            raised.add(e);
            throw e;
        }));

        assertEquals(4, invocations.get());
        assertEquals(4, ex.getAttempts());
        assertEquals(ErrorKind.RATE_LIMITED, ex.getKind());
        assertSame(raised.get(3), ex.getCause());
        assertThat(sleeps).hasSize(3).allMatch(d -> d.equals(Duration.ofSeconds(30)));
    }

    @Test
    void exhaustedRetriesShouldCountOnceTowardsTheBreaker() {
        assertThrows(ClassifiedCallException.class, () -> call.execute(() -> {
            throw new UpstreamStatusException(500, "internal");
        }));

        assertEquals(1, breaker.snapshot().failureCount());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4)), sleeps);
    }

    @Test
    void unknownErrorsShouldUseFlatDelay() {
        assertThrows(ClassifiedCallException.class, () -> call.execute(() -> {
            throw new IllegalStateException("boom");
        }, RetryOptions.defaults().withMaxRetries(2)));

        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(1)), sleeps);
    }

    @Test
    void backoffShouldBeCappedAtMaxDelay() {
        RetryOptions options = new RetryOptions(5, Duration.ofSeconds(1), Duration.ofSeconds(10), 3.0);

        assertEquals(Duration.ofSeconds(1), call.delayFor(ErrorKind.GENERIC_UPSTREAM, 0, options));
        assertEquals(Duration.ofSeconds(9), call.delayFor(ErrorKind.GENERIC_UPSTREAM, 2, options));
        assertEquals(Duration.ofSeconds(10), call.delayFor(ErrorKind.GENERIC_UPSTREAM, 3, options));
        assertEquals(Duration.ofSeconds(30), call.delayFor(ErrorKind.RATE_LIMITED, 3, options));
    }

    @Test
    void guardedShouldRejectWithoutInvokingWhileOpen() {
        breaker.recordFailure();
        breaker.recordFailure();
        AtomicInteger invocations = new AtomicInteger();

        ServiceTemporarilyUnavailableException ex = assertThrows(ServiceTemporarilyUnavailableException.class,
                () -> call.guarded(invocations::incrementAndGet));

        assertEquals(0, invocations.get());
        assertEquals(MessageCategory.TRY_AGAIN_SHORTLY, ex.getMessageCategory());
    }

    @Test
    void guardedShouldLetTrialThroughAfterCooldown() {
        breaker.recordFailure();
        breaker.recordFailure();
        clock.advance(Duration.ofMinutes(5).plusSeconds(1));

        assertEquals("trial", call.guarded(() -> "trial"));
        assertEquals(0, breaker.snapshot().failureCount());
        assertFalse(breaker.isOpenNow());
    }

    @Test
    void breakerRejectionFromNestedCallShouldPassThroughUnretried() {
        AtomicInteger invocations = new AtomicInteger();
        ServiceTemporarilyUnavailableException rejection =
                new ServiceTemporarilyUnavailableException("Upstream service temporarily unavailable");

        ServiceTemporarilyUnavailableException thrown = assertThrows(ServiceTemporarilyUnavailableException.class,
                () -> call.execute(() -> {
                    invocations.incrementAndGet();
                    throw rejection;
                }));

        assertSame(rejection, thrown);
        assertEquals(1, invocations.get());
        assertTrue(sleeps.isEmpty());
        assertEquals(0, breaker.snapshot().failureCount());
    }

    @Test
    void interruptedSleepShouldStopRetrying() {
        ResilientCall interrupted = new ResilientCall(breaker, new ErrorClassifier(), d -> {
            throw new InterruptedException("shutdown");
        }, RetryOptions.defaults());
        AtomicInteger invocations = new AtomicInteger();

        ClassifiedCallException ex = assertThrows(ClassifiedCallException.class, () -> interrupted.execute(() -> {
            invocations.incrementAndGet();
            throw new ConnectException("Connection refused");
        }));

        assertEquals(1, invocations.get());
        assertEquals(ErrorKind.NETWORK_UNAVAILABLE, ex.getKind());
        assertTrue(Thread.currentThread().isInterrupted());
    }

    @Test
    void withTimeoutShouldReturnResult() throws Exception {
        assertEquals(42, call.withTimeout("answer", Duration.ofSeconds(1), () -> 42));
    }
}
