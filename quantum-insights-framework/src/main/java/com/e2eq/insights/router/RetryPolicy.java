package com.e2eq.insights.router;

import com.e2eq.insights.exceptions.UpstreamException;
import io.quarkus.logging.Log;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Bounded exponential-backoff retry for collaborator calls. Only failures accepted by the
 * predicate are retried; anything else, and the last attempt's failure, propagates unchanged.
 */
public class RetryPolicy {

    /** Retries 5xx and timeouts reported as {@link UpstreamException}; never 4xx. */
    public static final Predicate<Throwable> UPSTREAM_RETRYABLE =
        e -> e instanceof UpstreamException && ((UpstreamException) e).isRetryable();

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final Predicate<Throwable> retryable;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, Predicate<Throwable> retryable, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.retryable = retryable;
        this.sleeper = sleeper;
    }

    public static RetryPolicy forUpstream(int maxAttempts, Duration baseDelay, Duration maxDelay) {
        return new RetryPolicy(maxAttempts, baseDelay, maxDelay, UPSTREAM_RETRYABLE, d -> Thread.sleep(d.toMillis()));
    }

    public <T> T execute(String operation, Supplier<T> call) {
        int attempt = 1;
        while (true) {
            try {
                return call.get();
            } catch (RuntimeException e) {
                if (attempt >= maxAttempts || !retryable.test(e)) {
                    throw e;
                }
                Duration delay = backoff(attempt);
                Log.warnf("%s failed on attempt %d/%d (%s); retrying in %d ms",
                    operation, attempt, maxAttempts, e.getMessage(), delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
                attempt++;
            }
        }
    }

    /**
     * Delay before the retry that follows the given failed attempt: base * 2^(attempt-1), capped.
     */
    Duration backoff(int attempt) {
        Duration delay = baseDelay.multipliedBy(1L << Math.min(attempt - 1, 20));
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
