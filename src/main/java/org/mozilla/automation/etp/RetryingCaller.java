package org.mozilla.automation.etp;

import java.time.Duration;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.mozilla.automation.etp.config.ExceptionsManagerConfig;
import org.mozilla.automation.etp.config.ExceptionsManagerConfig.RetryConfig;

import io.quarkus.logging.Log;

/**
 * Wraps a single call to Bugzilla or Remote Settings.
 * <p>
 * {@link TransientException}s are retried with exponential backoff up to the
 * configured number of attempts; every other exception is rethrown immediately.
 * When attempts are exhausted, the last transient failure is rethrown.
 */
@ApplicationScoped
public class RetryingCaller {
    static final String ME = "🔁-retry";

    private final RetryConfig retryConfig;

    @Inject
    public RetryingCaller(ExceptionsManagerConfig config) {
        this(config.retry());
    }

    RetryingCaller(RetryConfig retryConfig) {
        this.retryConfig = retryConfig;
    }

    public void run(String description, Runnable action) {
        call(description, () -> {
            action.run();
            return null;
        });
    }

    public <T> T call(String description, Supplier<T> action) {
        int maxAttempts = Math.max(1, retryConfig.maxAttempts());
        int attempt = 1;
        while (true) {
            try {
                return action.get();
            } catch (TransientException e) {
                if (attempt >= maxAttempts) {
                    Log.warnf("[%s] %s failed after %d attempt(s): %s", ME, description, attempt, e.getMessage());
                    throw e;
                }
                Duration delay = backoff(attempt);
                Log.infof("[%s] %s failed (attempt %d of %d), retrying in %s: %s",
                        ME, description, attempt, maxAttempts, delay, e.getMessage());
                sleep(delay, e);
                attempt++;
            }
        }
    }

    Duration backoff(int attempt) {
        Duration initial = retryConfig.initialBackoff();
        Duration max = retryConfig.maxBackoff();
        Duration delay = initial.multipliedBy(1L << Math.min(attempt - 1, 16));
        return delay.compareTo(max) > 0 ? max : delay;
    }

    private void sleep(Duration delay, TransientException cause) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw cause;
        }
    }
}
