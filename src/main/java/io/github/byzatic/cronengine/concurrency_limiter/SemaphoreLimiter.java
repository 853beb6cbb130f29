package io.github.byzatic.cronengine.concurrency_limiter;

import com.google.errorprone.annotations.ThreadSafe;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * FIFO-fair counting limiter.
 * <p>
 * Waiters are admitted in arrival order, so a burst of scheduled jobs cannot starve an interactive
 * invocation that queued earlier.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * Limiter limiter = new SemaphoreLimiter(2);
 * limiter.acquire();
 * try {
 *     // invoke the runtime
 * } finally {
 *     limiter.release();
 * }
 * }</pre>
 */
@ThreadSafe
public final class SemaphoreLimiter implements Limiter {
    private final int maxConcurrent;
    private final Semaphore semaphore;

    /**
     * @param maxConcurrent permits, must be &gt; 0
     */
    public SemaphoreLimiter(int maxConcurrent) {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be > 0");
        }
        this.maxConcurrent = maxConcurrent;
        this.semaphore = new Semaphore(maxConcurrent, true);
    }

    @Override
    public boolean tryAcquire() {
        return semaphore.tryAcquire();
    }

    @Override
    public void acquire() throws InterruptedException {
        semaphore.acquire();
    }

    @Override
    public boolean acquire(Duration timeout) throws InterruptedException {
        return semaphore.tryAcquire(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    @Override
    public void release() {
        semaphore.release();
    }

    @Override
    public int limit() {
        return maxConcurrent;
    }

    @Override
    public int activeCount() {
        return maxConcurrent - semaphore.availablePermits();
    }

    @Override
    public int waitingCount() {
        return semaphore.getQueueLength();
    }
}
