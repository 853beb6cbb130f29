package io.github.byzatic.cronengine.executor;

import com.google.errorprone.annotations.ThreadSafe;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local outcome counters of one {@link CronJobExecutor}.
 */
@ThreadSafe
public final class ExecutionStats {
    private final AtomicLong skippedOverlap = new AtomicLong();
    private final AtomicLong skippedLock = new AtomicLong();
    private final AtomicLong success = new AtomicLong();
    private final AtomicLong error = new AtomicLong();
    private final AtomicLong empty = new AtomicLong();

    void recordSkippedOverlap() {
        skippedOverlap.incrementAndGet();
    }

    void recordSkippedLock() {
        skippedLock.incrementAndGet();
    }

    void recordSuccess() {
        success.incrementAndGet();
    }

    void recordError() {
        error.incrementAndGet();
    }

    void recordEmpty() {
        empty.incrementAndGet();
    }

    /**
     * Ticks dropped because the previous run of the same job was still active in this process.
     */
    public long getSkippedOverlap() {
        return skippedOverlap.get();
    }

    /**
     * Ticks dropped because the job lock could not be acquired.
     */
    public long getSkippedLock() {
        return skippedLock.get();
    }

    public long getSuccess() {
        return success.get();
    }

    public long getError() {
        return error.get();
    }

    public long getEmpty() {
        return empty.get();
    }

    @Override
    public String toString() {
        return "ExecutionStats{skippedOverlap=" + skippedOverlap + ", skippedLock=" + skippedLock +
                ", success=" + success + ", error=" + error + ", empty=" + empty + '}';
    }
}
