package front.migrator.app.support;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private final List<Duration> sleeps = new ArrayList<>();
    private RetryPolicy retryPolicy;

    @BeforeEach
    void setUp() {
        retryPolicy = new RetryPolicy(3, Duration.ofMillis(500), Duration.ofMillis(100), sleeps::add);
    }

    @Test
    void execute_WithImmediateSuccess_ShouldNotSleep() {
        // When
        String value = retryPolicy.execute("call", () -> RemoteCallResult.success("ok"));

        // Then
        assertEquals("ok", value);
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void execute_WithTwoRetryableFailures_ShouldSucceedOnThirdAttempt() {
        // Given
        AtomicInteger attempts = new AtomicInteger();

        // When
        String value = retryPolicy.execute("call", () -> attempts.incrementAndGet() < 3
            ? RemoteCallResult.retryable(new IllegalStateException("503"))
            : RemoteCallResult.success("ok"));

        // Then
        assertEquals("ok", value);
        assertEquals(3, attempts.get());
        assertEquals(2, sleeps.size());
    }

    @Test
    void execute_ShouldBackOffExponentiallyWithBoundedJitter() {
        // When
        assertThrows(IllegalStateException.class, () -> retryPolicy.execute("call",
            () -> RemoteCallResult.retryable(new IllegalStateException("429"))));

        // Then
        assertEquals(2, sleeps.size());
        long first = sleeps.get(0).toMillis();
        long second = sleeps.get(1).toMillis();
        assertTrue(first >= 500 && first < 600, "first delay was " + first);
        assertTrue(second >= 1000 && second < 1100, "second delay was " + second);
    }

    @Test
    void execute_WhenRetriesExhausted_ShouldRethrowLastError() {
        // Given
        AtomicInteger attempts = new AtomicInteger();
        IllegalStateException last = new IllegalStateException("still failing");

        // When
        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> retryPolicy.execute("call", () -> {
            attempts.incrementAndGet();
            return RemoteCallResult.retryable(last);
        }));

        // Then
        assertSame(last, thrown);
        assertEquals(3, attempts.get());
    }

    @Test
    void execute_WithFatalFailure_ShouldNotRetry() {
        // Given
        AtomicInteger attempts = new AtomicInteger();

        // When
        assertThrows(UnsupportedOperationException.class, () -> retryPolicy.execute("call", () -> {
            attempts.incrementAndGet();
            return RemoteCallResult.fatal(new UnsupportedOperationException("401"));
        }));

        // Then
        assertEquals(1, attempts.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void execute_WhenInterruptedDuringBackoff_ShouldRestoreInterruptFlag() {
        // Given
        RetryPolicy interrupted = new RetryPolicy(3, Duration.ofMillis(1), Duration.ZERO, duration -> {
            throw new InterruptedException();
        });

        // When
        assertThrows(IllegalStateException.class, () -> interrupted.execute("call",
            () -> RemoteCallResult.retryable(new RuntimeException("503"))));

        // Then
        assertTrue(Thread.interrupted());
    }

    @Test
    void constructor_WithZeroAttempts_ShouldBeRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO, sleeps::add));
    }
}
