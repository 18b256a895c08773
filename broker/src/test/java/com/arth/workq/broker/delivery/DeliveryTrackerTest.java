package com.arth.workq.broker.delivery;

import com.arth.workq.broker.queue.QueuedMessage;
import com.arth.workq.common.exception.UnknownDeliveryException;
import com.arth.workq.common.message.Message;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeliveryTrackerTest {

    private final DeliveryTracker tracker = new DeliveryTracker("jobs");

    @Test
    void shouldTrackPerConsumer() {
        tracker.track("c1", queued(1), 1, 0, 1);
        tracker.track("c1", queued(2), 2, 0, 1);
        tracker.track("c2", queued(3), 3, 0, 1);

        assertEquals(2, tracker.inFlightCount("c1"));
        assertEquals(1, tracker.inFlightCount("c2"));
        assertEquals(0, tracker.inFlightCount("c3"));
        assertEquals(3, tracker.totalInFlight());
        assertTrue(tracker.isInFlight(3));
    }

    @Test
    void shouldRefuseSecondHolder() {
        QueuedMessage message = queued(1);
        tracker.track("c1", message, 1, 0, 1);

        assertThrows(IllegalStateException.class, () -> tracker.track("c2", message, 2, 0, 2));
        assertEquals(1, tracker.totalInFlight());
    }

    @Test
    void shouldOnlyCompleteForTheHolder() {
        tracker.track("c1", queued(1), 1, 0, 1);

        assertThrows(UnknownDeliveryException.class, () -> tracker.complete("c2", 1));
        assertThrows(UnknownDeliveryException.class, () -> tracker.complete("c1", 2));

        InFlightEntry entry = tracker.complete("c1", 1);
        assertEquals(1, entry.getMessageId());
        assertFalse(tracker.isInFlight(1));
        assertThrows(UnknownDeliveryException.class, () -> tracker.complete("c1", 1));
    }

    @Test
    void shouldReleaseAllInIdOrder() {
        tracker.track("c1", queued(5), 1, 0, 1);
        tracker.track("c1", queued(2), 2, 0, 1);
        tracker.track("c1", queued(9), 3, 0, 1);
        tracker.track("c2", queued(4), 4, 0, 1);

        List<InFlightEntry> released = tracker.releaseAll("c1");

        assertEquals(3, released.size());
        assertEquals(2, released.get(0).getMessageId());
        assertEquals(5, released.get(1).getMessageId());
        assertEquals(9, released.get(2).getMessageId());
        assertEquals(1, tracker.totalInFlight());
        assertNull(tracker.get("c1", 5));
        assertTrue(tracker.releaseAll("c1").isEmpty());
    }

    @Test
    void shouldRejectInvalidPrefetch() {
        assertThrows(IllegalArgumentException.class, () -> new ConsumerRegistration("c1", "jobs", 0, false, null));
    }

    private static QueuedMessage queued(long id) {
        return QueuedMessage.of(new Message(id, "jobs", new byte[0], false));
    }
}
