package org.mozilla.automation.etp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.mozilla.automation.etp.config.ExceptionsManagerConfig.RetryConfig;

public class RetryingCallerTest {

    static RetryConfig retryConfig(int attempts, Duration initial, Duration max) {
        return new RetryConfig() {
            @Override
            public int maxAttempts() {
                return attempts;
            }

            @Override
            public Duration initialBackoff() {
                return initial;
            }

            @Override
            public Duration maxBackoff() {
                return max;
            }
        };
    }

    final RetryingCaller retry = new RetryingCaller(retryConfig(3, Duration.ofMillis(1), Duration.ofMillis(2)));

    @Test
    void testRetriesTransientFailures() {
        AtomicInteger calls = new AtomicInteger();

        String result = retry.call("flaky", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new TransientException("Service unavailable", 503, null);
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void testGivesUpAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();
        TransientException failure = new TransientException("Too many requests", 429, null);

        assertThatThrownBy(() -> retry.run("throttled", () -> {
            calls.incrementAndGet();
            throw failure;
        })).isSameAs(failure);
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void testOtherFailuresAreNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retry.run("conflict", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("412 Precondition Failed");
        })).isInstanceOf(IllegalStateException.class);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void testBackoffDoublesUpToMax() {
        RetryingCaller caller = new RetryingCaller(retryConfig(10, Duration.ofMillis(500), Duration.ofSeconds(10)));

        assertThat(caller.backoff(1)).isEqualTo(Duration.ofMillis(500));
        assertThat(caller.backoff(2)).isEqualTo(Duration.ofSeconds(1));
        assertThat(caller.backoff(3)).isEqualTo(Duration.ofSeconds(2));
        assertThat(caller.backoff(6)).isEqualTo(Duration.ofSeconds(10));
        assertThat(caller.backoff(40)).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void testTransientStatus() {
        assertThat(TransientException.isTransientStatus(503)).isTrue();
        assertThat(TransientException.isTransientStatus(429)).isTrue();
        assertThat(TransientException.isTransientStatus(408)).isTrue();
        assertThat(TransientException.isTransientStatus(409)).isFalse();
        assertThat(TransientException.isTransientStatus(412)).isFalse();
        assertThat(TransientException.isTransientStatus(500)).isFalse();
    }
}
