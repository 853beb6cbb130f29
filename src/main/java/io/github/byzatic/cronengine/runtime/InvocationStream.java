package io.github.byzatic.cronengine.runtime;

import java.util.Iterator;

/**
 * Blocking, single-consumer stream of invocation events.
 * <p>
 * {@link #hasNext()} may block until the runtime produces the next event. Consumers must close the stream,
 * whether or not they drained it: resources such as concurrency slots and subprocesses are held until then.
 */
public interface InvocationStream extends Iterator<InvocationEvent>, AutoCloseable {

    /**
     * Idempotent; never throws.
     */
    @Override
    void close();
}
