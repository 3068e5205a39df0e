package front.migrator.app.support;

import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

/**
 * Caps the number of in-flight outbound calls of one client.
 * Callers past the cap block until a permit frees up; ordering of results is unaffected.
 */
public class AdmissionLimiter {
    private final Semaphore permits;

    public AdmissionLimiter(int maxConcurrent) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1, got " + maxConcurrent);
        }
        this.permits = new Semaphore(maxConcurrent, true);
    }

    public <T> T call(Supplier<T> task) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for an outbound call slot", e);
        }
        try {
            return task.get();
        } finally {
            permits.release();
        }
    }

    public int availablePermits() {
        return permits.availablePermits();
    }
}
