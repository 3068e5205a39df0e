package front.migrator.app.support;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff and random jitter.
 * The delay before attempt {@code n + 1} is {@code baseDelay * 2^(n-1) + random(0, maxJitter)}.
 * Only {@link RemoteCallResult.Kind#RETRYABLE} outcomes are attempted again; fatal outcomes
 * and the last retryable failure are rethrown unchanged.
 */
@Slf4j
public class RetryPolicy {
    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxJitter;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxJitter, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.maxJitter = maxJitter;
        this.sleeper = sleeper;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public <T> T execute(String description, Supplier<RemoteCallResult<T>> call) {
        for (int attempt = 1; ; attempt++) {
            RemoteCallResult<T> result = call.get();
            switch (result.getKind()) {
                case SUCCESS:
                    return result.getValue();
                case FATAL:
                    throw result.getError();
                default:
                    break;
            }

            RuntimeException error = result.getError();
            if (attempt >= maxAttempts) {
                log.warn("{} failed after {} attempts: {}", description, attempt, error.getMessage());
                throw error;
            }

            Duration delay = backoffDelay(attempt);
            log.debug("{} attempt {}/{} failed ({}), retrying in {}ms",
                    description, attempt, maxAttempts, error.getMessage(), delay.toMillis());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while backing off from " + description, e);
            }
        }
    }

    Duration backoffDelay(int failedAttempt) {
        long exponential = baseDelay.toMillis() * (1L << (failedAttempt - 1));
        long jitterBound = maxJitter.toMillis();
        long jitter = jitterBound > 0 ? ThreadLocalRandom.current().nextLong(jitterBound) : 0;
        return Duration.ofMillis(exponential + jitter);
    }
}
