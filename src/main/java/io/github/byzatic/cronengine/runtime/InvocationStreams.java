package io.github.byzatic.cronengine.runtime;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stream factories.
 */
public final class InvocationStreams {

    private InvocationStreams() {
    }

    /**
     * Stream over a fixed list of events.
     */
    public static InvocationStream of(List<InvocationEvent> events) {
        Iterator<InvocationEvent> it = new ArrayList<>(events).iterator();
        return new InvocationStream() {
            @Override
            public boolean hasNext() {
                return it.hasNext();
            }

            @Override
            public InvocationEvent next() {
                return it.next();
            }

            @Override
            public void close() {
            }
        };
    }

    /**
     * Producer-fed stream that ends after a {@link InvocationEvent.Type#DONE} event has been consumed.
     */
    static QueueStream queue(Runnable onClose) {
        return new QueueStream(onClose);
    }

    static final class QueueStream implements InvocationStream {
        private final BlockingQueue<InvocationEvent> queue = new LinkedBlockingQueue<>();
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private final Runnable onClose;
        private InvocationEvent lookahead;
        private boolean finished;

        private QueueStream(Runnable onClose) {
            this.onClose = onClose;
        }

        void push(InvocationEvent event) {
            queue.offer(event);
        }

        @Override
        public boolean hasNext() {
            if (finished) return false;
            if (lookahead != null) return true;
            try {
                lookahead = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                lookahead = InvocationEvent.error("invocation interrupted");
                queue.clear();
                queue.offer(InvocationEvent.done());
            }
            return true;
        }

        @Override
        public InvocationEvent next() {
            if (!hasNext()) throw new NoSuchElementException();
            InvocationEvent e = lookahead;
            lookahead = null;
            if (e.getType() == InvocationEvent.Type.DONE) finished = true;
            return e;
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                onClose.run();
            }
        }
    }
}
