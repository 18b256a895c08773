package com.arth.workq.broker.queue;

import com.arth.workq.common.exception.CapacityExceededException;
import com.arth.workq.common.message.Message;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DequeMessageQueueTest {

    @Test
    void shouldKeepFifoOrder() {
        DequeMessageQueue queue = new DequeMessageQueue("jobs", 0);
        for (long id = 1; id <= 3; id++) {
            queue.enqueue(queued(id));
        }

        assertEquals(1, queue.pollOldest().getMessageId());
        assertEquals(2, queue.pollOldest().getMessageId());
        assertEquals(3, queue.pollOldest().getMessageId());
        assertNull(queue.pollOldest());
        assertTrue(queue.isEmpty());
    }

    @Test
    void shouldRejectEnqueueWhenFullButAcceptRequeue() {
        DequeMessageQueue queue = new DequeMessageQueue("jobs", 2);
        queue.enqueue(queued(1));
        queue.enqueue(queued(2));

        assertTrue(queue.isFull());
        assertThrows(CapacityExceededException.class, () -> queue.enqueue(queued(3)));

        queue.requeueFront(queued(0));
        queue.requeueTail(queued(4));
        assertEquals(4, queue.size());
        assertEquals(List.of(0L, 1L, 2L, 4L), ids(queue.clear()));
        assertFalse(queue.isFull());
    }

    @Test
    void shouldPeekWithoutRemoving() {
        DequeMessageQueue queue = new DequeMessageQueue("jobs", 0);
        QueuedMessage first = queued(1);
        QueuedMessage second = queued(2);
        queue.enqueue(first);
        queue.enqueue(second);

        assertSame(second, queue.peekNext(m -> m.getMessageId() > 1));
        assertEquals(2, queue.size());
        assertNull(queue.peekNext(m -> false));

        assertTrue(queue.remove(second));
        assertFalse(queue.remove(second));
        assertSame(first, queue.pollNext(m -> true));
        assertNull(queue.pollNext(m -> true));
    }

    @Test
    void shouldRejectNegativeLength() {
        assertThrows(IllegalArgumentException.class, () -> new DequeMessageQueue("jobs", -1));
    }

    @Test
    void shouldCountAttempts() {
        QueuedMessage fresh = queued(1);
        assertFalse(fresh.isRedelivered());
        assertEquals(1, fresh.beginAttempt());
        assertTrue(fresh.isRedelivered());
        assertEquals(2, fresh.beginAttempt());

        QueuedMessage recovered = QueuedMessage.recovered(new Message(2, "jobs", new byte[0], true));
        assertTrue(recovered.isRedelivered());
        assertEquals(1, recovered.beginAttempt());
    }

    private static QueuedMessage queued(long id) {
        return QueuedMessage.of(new Message(id, "jobs", new byte[]{(byte) id}, false));
    }

    private static List<Long> ids(List<QueuedMessage> messages) {
        return messages.stream().map(QueuedMessage::getMessageId).collect(Collectors.toList());
    }
}
