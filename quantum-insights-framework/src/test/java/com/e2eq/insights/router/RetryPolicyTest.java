package com.e2eq.insights.router;

import com.e2eq.insights.exceptions.UpstreamException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RetryPolicy unit tests")
class RetryPolicyTest {

    private final List<Duration> sleeps = new ArrayList<>();
    private final RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(100), Duration.ofMillis(250),
        RetryPolicy.UPSTREAM_RETRYABLE, sleeps::add);

    @Test
    @DisplayName("client errors are never retried")
    void clientError_notRetried() {
        AtomicInteger calls = new AtomicInteger();

        UpstreamException e = assertThrows(UpstreamException.class, () -> policy.execute("op", () -> {
            calls.incrementAndGet();
            throw UpstreamException.clientError("engine", 400);
        }));

        assertEquals(1, calls.get());
        assertEquals(400, e.getStatusCode());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("server errors are attempted three times with exponential backoff")
    void serverError_threeAttempts() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(UpstreamException.class, () -> policy.execute("op", () -> {
            calls.incrementAndGet();
            throw UpstreamException.serverError("engine", 503);
        }));

        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeps);
    }

    @Test
    @DisplayName("timeout followed by success returns the result")
    void timeoutThenSuccess() {
        AtomicInteger calls = new AtomicInteger();

        String result = policy.execute("op", () -> {
            if (calls.incrementAndGet() == 1) {
                throw UpstreamException.timeout("llm", null);
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(2, calls.get());
    }

    @Test
    @DisplayName("failures outside the predicate propagate immediately")
    void otherFailure_notRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(IllegalStateException.class, () -> policy.execute("op", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("bug");
        }));
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("backoff doubles and is capped")
    void backoff_capped() {
        assertEquals(Duration.ofMillis(100), policy.backoff(1));
        assertEquals(Duration.ofMillis(200), policy.backoff(2));
        assertEquals(Duration.ofMillis(250), policy.backoff(3));
    }
}
