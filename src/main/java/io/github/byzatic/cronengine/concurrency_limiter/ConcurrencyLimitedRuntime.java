package io.github.byzatic.cronengine.concurrency_limiter;

import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.cronengine.base_exceptions.ExternalProcessException;
import io.github.byzatic.cronengine.runtime.InvocationEvent;
import io.github.byzatic.cronengine.runtime.InvocationRequest;
import io.github.byzatic.cronengine.runtime.InvocationStream;
import io.github.byzatic.cronengine.runtime.RuntimeAdapter;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runtime adapter that admits at most {@code limit} invocations at once, process-wide.
 * <p>
 * One instance is shared by scheduled and interactive callers so the cap reflects total load.
 * The permit is held for the whole lifetime of the returned stream and given back exactly once,
 * when the stream is closed or has been drained.
 */
@ThreadSafe
public final class ConcurrencyLimitedRuntime implements RuntimeAdapter {
    private final static Logger logger = LoggerFactory.getLogger(ConcurrencyLimitedRuntime.class);

    private final RuntimeAdapter delegate;
    private final Limiter limiter;

    public ConcurrencyLimitedRuntime(@NotNull RuntimeAdapter delegate, @NotNull Limiter limiter) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.limiter = Objects.requireNonNull(limiter, "limiter");
    }

    /**
     * Wraps {@code runtime} with a fair limiter of {@code maxConcurrent} permits.
     * {@code maxConcurrent <= 0} means unlimited and returns {@code runtime} itself.
     */
    public static @NotNull RuntimeAdapter wrap(@NotNull RuntimeAdapter runtime, int maxConcurrent) {
        if (maxConcurrent <= 0) return runtime;
        return new ConcurrencyLimitedRuntime(runtime, new SemaphoreLimiter(maxConcurrent));
    }

    public Limiter getLimiter() {
        return limiter;
    }

    @Override
    public @NotNull String id() {
        return delegate.id();
    }

    @Override
    public @NotNull InvocationStream invoke(@NotNull InvocationRequest request)
            throws ExternalProcessException, InterruptedException {
        limiter.acquire();
        logger.debug("runtime:concurrency slot acquired active={} max={}", limiter.activeCount(), limiter.limit());
        InvocationStream inner;
        try {
            inner = delegate.invoke(request);
        } catch (ExternalProcessException | InterruptedException | RuntimeException e) {
            releaseSlot();
            throw e;
        }
        return new PermitStream(inner);
    }

    @Override
    public void killActive() {
        delegate.killActive();
    }

    @Override
    public void close() {
        delegate.close();
    }

    private void releaseSlot() {
        limiter.release();
        logger.debug("runtime:concurrency slot released active={} max={}", limiter.activeCount(), limiter.limit());
    }

    private final class PermitStream implements InvocationStream {
        private final InvocationStream inner;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private PermitStream(InvocationStream inner) {
            this.inner = inner;
        }

        @Override
        public boolean hasNext() {
            boolean more = inner.hasNext();
            if (!more) giveBack();
            return more;
        }

        @Override
        public InvocationEvent next() {
            return inner.next();
        }

        @Override
        public void close() {
            try {
                inner.close();
            } finally {
                giveBack();
            }
        }

        private void giveBack() {
            if (released.compareAndSet(false, true)) releaseSlot();
        }
    }
}
