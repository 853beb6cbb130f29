package io.github.byzatic.cronengine.base_exceptions;

import java.time.Duration;

/**
 * A bounded wait expired before the awaited condition held.
 */
public class OperationTimedOutException extends Exception {
    private final Duration waited;

    public OperationTimedOutException(String operation, Duration waited) {
        super(operation + " did not finish within " + waited.toMillis() + "ms");
        this.waited = waited;
    }

    public Duration getWaited() {
        return waited;
    }
}
