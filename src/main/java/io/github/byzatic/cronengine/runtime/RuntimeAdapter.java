package io.github.byzatic.cronengine.runtime;

import io.github.byzatic.cronengine.base_exceptions.ExternalProcessException;
import org.jetbrains.annotations.NotNull;

/**
 * Entry point into the external agent runtime.
 */
public interface RuntimeAdapter extends AutoCloseable {

    @NotNull String id();

    /**
     * Starts an invocation. Failures after the start are reported in-band as {@link InvocationEvent.Type#ERROR}.
     *
     * @throws ExternalProcessException the runtime could not be started
     * @throws InterruptedException     interrupted while waiting to start (for example for a concurrency slot)
     */
    @NotNull InvocationStream invoke(@NotNull InvocationRequest request) throws ExternalProcessException, InterruptedException;

    /**
     * Best-effort termination of every invocation still running. Used on shutdown.
     */
    default void killActive() {
    }

    /**
     * Releases threads or other resources held by the adapter. Further invocations are rejected.
     */
    @Override
    default void close() {
    }
}
