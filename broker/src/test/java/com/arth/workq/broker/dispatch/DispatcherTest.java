package com.arth.workq.broker.dispatch;

import com.arth.workq.broker.delivery.ConsumerRegistration;
import com.arth.workq.broker.queue.DequeMessageQueue;
import com.arth.workq.broker.queue.QueuedMessage;
import com.arth.workq.common.message.Message;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class DispatcherTest {

    @Test
    void shouldRotateAndRememberCursor() {
        RoundRobinSelector<String> selector = new RoundRobinSelector<>();
        List<String> candidates = List.of("a", "b", "c");

        assertEquals("a", selector.next(candidates, c -> true));
        assertEquals("b", selector.next(candidates, c -> true));
        assertEquals("c", selector.next(candidates, c -> true));
        assertEquals("a", selector.next(candidates, c -> true));
        assertEquals(1, selector.getCursor());

        assertEquals("c", selector.next(candidates, c -> !c.equals("b")));
        assertNull(selector.next(candidates, c -> false));
        assertNull(selector.next(List.of(), c -> true));
    }

    @Test
    void shouldSurviveShrinkingCandidateList() {
        RoundRobinSelector<String> selector = new RoundRobinSelector<>();
        selector.next(List.of("a", "b", "c"), c -> true);
        selector.next(List.of("a", "b", "c"), c -> true);

        assertEquals("a", selector.next(List.of("a"), c -> true));
    }

    @Test
    void shouldStopWhenNoConsumerHasCapacity() {
        DequeMessageQueue pending = new DequeMessageQueue("jobs", 0);
        for (long id = 1; id <= 10; id++) {
            pending.enqueue(QueuedMessage.of(new Message(id, "jobs", new byte[0], false)));
        }
        List<ConsumerRegistration> consumers = new ArrayList<>();
        consumers.add(new ConsumerRegistration("c1", "jobs", 2, false, null));
        consumers.add(new ConsumerRegistration("c2", "jobs", 3, false, null));
        Map<String, List<Long>> received = new HashMap<>();

        int delivered = new Dispatcher("jobs").dispatch(
                pending,
                consumers,
                m -> true,
                c -> received.getOrDefault(c.getConsumerId(), List.of()).size() < c.getPrefetch(),
                (c, m) -> received.computeIfAbsent(c.getConsumerId(), k -> new ArrayList<>()).add(m.getMessageId()));

        assertEquals(5, delivered);
        assertEquals(5, pending.size());
        assertEquals(List.of(1L, 3L), received.get("c1"));
        assertEquals(List.of(2L, 4L, 5L), received.get("c2"));
    }

    @Test
    void shouldSkipUndeliverableMessages() {
        DequeMessageQueue pending = new DequeMessageQueue("jobs", 0);
        for (long id = 1; id <= 3; id++) {
            pending.enqueue(QueuedMessage.of(new Message(id, "jobs", new byte[0], false)));
        }
        List<ConsumerRegistration> consumers = List.of(new ConsumerRegistration("c1", "jobs", 10, false, null));
        List<Long> received = new ArrayList<>();

        new Dispatcher("jobs").dispatch(pending, consumers, m -> m.getMessageId() != 2, c -> true,
                (c, m) -> received.add(m.getMessageId()));

        assertEquals(List.of(1L, 3L), received);
        assertEquals(1, pending.size());
        assertEquals(2, pending.peekNext(m -> true).getMessageId());
    }
}
