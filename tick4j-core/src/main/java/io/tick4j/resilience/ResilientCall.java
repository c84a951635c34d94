package io.tick4j.resilience;

import io.tick4j.breaker.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Executes calls to the upstream service with classified, bounded retries.
 *
 * <p>Retries are blocking: the calling thread sleeps between attempts. Intermediate failures are
 * logged and suppressed; only the last attempt's error is raised, wrapped in a
 * {@link ClassifiedCallException}. Each {@code execute} reports exactly one outcome to the
 * tenant's {@link CircuitBreaker}, except when {@code fn} itself raises a
 * {@link ServiceTemporarilyUnavailableException}, which is rethrown as is.
 *
 * <p>Typical usage:
 * <pre>{@code
 * List<Thread> threads = resilientCall.guarded(() -> mail.search(query), RetryOptions.defaults());
 * }</pre>
 */
public class ResilientCall {
    private static final Logger log = LoggerFactory.getLogger(ResilientCall.class);

    private final CircuitBreaker breaker;
    private final ErrorClassifier classifier;
    private final Sleeper sleeper;
    private final RetryOptions defaults;

    public ResilientCall(CircuitBreaker breaker, ErrorClassifier classifier, Sleeper sleeper, RetryOptions defaults) {
        this.breaker = Objects.requireNonNull(breaker, "breaker must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.defaults = Objects.requireNonNull(defaults, "defaults must not be null");
    }

    public <T> T execute(Callable<T> fn) {
        return execute(fn, defaults);
    }

    /**
     * Invoke {@code fn} until it succeeds, fails with a non-retryable error, or
     * {@code options.maxRetries()} retries are exhausted.
     *
     * @throws ClassifiedCallException carrying the last attempt's error as cause
     * @throws ServiceTemporarilyUnavailableException raised by {@code fn}, unchanged and not retried
     */
    public <T> T execute(Callable<T> fn, RetryOptions options) {
        Objects.requireNonNull(fn, "fn must not be null");
        Objects.requireNonNull(options, "options must not be null");

        int attempt = 0;
        while (true) {
            try {
                T result = fn.call();
                breaker.recordSuccess();
                if (attempt > 0) {
                    log.info("upstream call succeeded after retries attempts={}", attempt + 1);
                }
                return result;
            } catch (ServiceTemporarilyUnavailableException e) {
                // a nested guarded call was rejected: no upstream call was made
                throw e;
            } catch (Exception e) {
                ErrorKind kind = classifier.classify(e);
                int attempts = attempt + 1;

                if (!kind.retryable() || attempt >= options.maxRetries()) {
                    breaker.recordFailure();
                    log.error("upstream call failed kind={} attempts={} retryable={} msg={}",
                            kind, attempts, kind.retryable(), e.getMessage());
                    throw new ClassifiedCallException(kind, attempts, e);
                }

                Duration delay = delayFor(kind, attempt, options);
                log.warn("upstream call failed, retrying kind={} attempt={} retryIn={} msg={}",
                        kind, attempts, delay, e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    breaker.recordFailure();
                    throw new ClassifiedCallException(kind, attempts, e);
                }
                attempt++;
            }
        }
    }

    public <T> T guarded(Callable<T> fn) {
        return guarded(fn, defaults);
    }

    /**
     * Like {@link #execute(Callable, RetryOptions)}, but rejects immediately while the breaker is open.
     *
     * @throws ServiceTemporarilyUnavailableException when the breaker is open; {@code fn} is not invoked
     */
    public <T> T guarded(Callable<T> fn, RetryOptions options) {
        if (breaker.isOpenNow()) {
            log.debug("upstream call rejected, circuit breaker open");
            throw new ServiceTemporarilyUnavailableException("Upstream service temporarily unavailable, try again shortly");
        }
        return execute(fn, options);
    }

    /**
     * Run {@code fn} on the calling thread and log when it overruns {@code budget}.
     * The call is never aborted.
     */
    public <T> T withTimeout(String name, Duration budget, Callable<T> fn) throws Exception {
        Objects.requireNonNull(budget, "budget must not be null");
        long startedAt = System.nanoTime();
        try {
            return fn.call();
        } finally {
            Duration took = Duration.ofNanos(System.nanoTime() - startedAt);
            if (took.compareTo(budget) > 0) {
                log.warn("call overran its time budget name={} budget={} took={}", name, budget, took);
            }
        }
    }

    /**
     * Backoff for a zero-based retry attempt, raised to the kind's floor. {@link ErrorKind#UNKNOWN}
     * waits a flat {@code initialDelay}.
     */
    Duration delayFor(ErrorKind kind, int attempt, RetryOptions options) {
        Duration delay = kind == ErrorKind.UNKNOWN
                ? min(options.initialDelay(), options.maxDelay())
                : options.backoff(attempt);
        return delay.compareTo(kind.delayFloor()) < 0 ? kind.delayFloor() : delay;
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public RetryOptions defaults() {
        return defaults;
    }
}
