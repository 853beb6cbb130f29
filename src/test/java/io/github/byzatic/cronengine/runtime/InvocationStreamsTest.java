package io.github.byzatic.cronengine.runtime;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class InvocationStreamsTest {

    @Test
    void queueStream_endsAfterDone_andClosesOnce() {
        AtomicInteger closes = new AtomicInteger();
        InvocationStreams.QueueStream stream = InvocationStreams.queue(closes::incrementAndGet);
        stream.push(InvocationEvent.textDelta("a"));
        stream.push(InvocationEvent.done());

        assertEquals(InvocationEvent.Type.TEXT_DELTA, stream.next().getType());
        assertEquals(InvocationEvent.Type.DONE, stream.next().getType());
        assertFalse(stream.hasNext());
        assertThrows(NoSuchElementException.class, stream::next);

        stream.close();
        stream.close();
        assertEquals(1, closes.get());
    }

    @Test
    void interruptedConsumer_getsErrorThenDone() {
        InvocationStreams.QueueStream stream = InvocationStreams.queue(() -> { });
        Thread.currentThread().interrupt();
        try {
            assertEquals(InvocationEvent.Type.ERROR, stream.next().getType());
            assertTrue(Thread.interrupted());
            assertEquals(InvocationEvent.Type.DONE, stream.next().getType());
            assertFalse(stream.hasNext());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void listStream_replaysEvents() {
        InvocationStream stream = InvocationStreams.of(List.of(InvocationEvent.textFinal("x"), InvocationEvent.done()));
        assertEquals("x", stream.next().getText());
        assertEquals(InvocationEvent.Type.DONE, stream.next().getType());
        assertFalse(stream.hasNext());
    }
}
