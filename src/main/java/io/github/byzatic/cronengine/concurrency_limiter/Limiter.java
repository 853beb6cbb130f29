package io.github.byzatic.cronengine.concurrency_limiter;

import java.time.Duration;

/**
 * Cap on simultaneously outstanding operations.
 * <p>
 * A permit taken with {@link #tryAcquire()}, {@link #acquire()} or {@link #acquire(Duration)} must be given
 * back with exactly one {@link #release()}. Implementations are thread-safe.
 */
public interface Limiter {

    /**
     * Takes a permit if one is free right now; never waits.
     */
    boolean tryAcquire();

    /**
     * Takes a permit, waiting as long as needed.
     */
    void acquire() throws InterruptedException;

    /**
     * Takes a permit, waiting at most {@code timeout}.
     *
     * @return {@code false} if no permit became free in time
     */
    boolean acquire(Duration timeout) throws InterruptedException;

    void release();

    /**
     * @return maximum number of permits, 0 when unlimited
     */
    int limit();

    int activeCount();

    int waitingCount();
}
