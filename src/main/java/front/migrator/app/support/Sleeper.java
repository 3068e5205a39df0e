package front.migrator.app.support;

import java.time.Duration;

/**
 * Abstraction over waiting so that backoff and inter-batch pauses can be skipped in tests.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleeper() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
