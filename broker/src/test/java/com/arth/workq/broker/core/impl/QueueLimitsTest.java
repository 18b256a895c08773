package com.arth.workq.broker.core.impl;

import com.arth.workq.broker.config.OverflowPolicy;
import com.arth.workq.broker.config.QueueConfig;
import com.arth.workq.broker.consumer.Delivery;
import com.arth.workq.broker.consumer.Subscription;
import com.arth.workq.common.exception.CapacityExceededException;
import com.arth.workq.common.exception.ErrorCode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.arth.workq.broker.core.impl.TestBrokers.bytes;
import static com.arth.workq.broker.core.impl.TestBrokers.next;
import static com.arth.workq.broker.core.impl.TestBrokers.text;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueueLimitsTest {

    @TempDir
    Path dir;

    private DefaultBroker broker;

    @AfterEach
    void tearDown() throws IOException {
        if (broker != null) {
            broker.shutdown();
        }
    }

    @Test
    void shouldRejectPublishWhenFull() throws IOException {
        broker = TestBrokers.started(dir);
        broker.declareQueue("jobs", true, bounded(2, OverflowPolicy.REJECT_PUBLISH));
        broker.publish("jobs", bytes("m0"), true);
        broker.publish("jobs", bytes("m1"), true);

        CapacityExceededException e = assertThrows(CapacityExceededException.class,
                () -> broker.publish("jobs", bytes("m2"), true));

        assertEquals(ErrorCode.CAPACITY_EXCEEDED, e.getErrorCode());
        assertEquals(2, broker.queueInfo("jobs").getPending());
    }

    @Test
    void shouldCountOnlyPendingMessagesAgainstTheBound() throws Exception {
        broker = TestBrokers.started(dir);
        broker.declareQueue("jobs", false, bounded(2, OverflowPolicy.REJECT_PUBLISH));
        Subscription subscription = broker.consume("jobs", 2, false);

        for (int i = 0; i < 4; i++) {
            broker.publish("jobs", bytes("m" + i), false);
        }

        assertEquals(2, broker.queueInfo("jobs").getInFlight());
        assertEquals(2, broker.queueInfo("jobs").getPending());
        assertThrows(CapacityExceededException.class, () -> broker.publish("jobs", bytes("m4"), false));
        assertTrue(subscription.isActive());
    }

    @Test
    void shouldAcceptRequeueBeyondTheBound() throws Exception {
        broker = TestBrokers.started(dir);
        broker.declareQueue("jobs", false, bounded(1, OverflowPolicy.REJECT_PUBLISH));
        Subscription subscription = broker.consume("jobs", 1, false);
        broker.publish("jobs", bytes("m0"), false);
        broker.publish("jobs", bytes("m1"), false);
        next(subscription);

        subscription.cancel();

        assertEquals(2, broker.queueInfo("jobs").getPending());
    }

    @Test
    void shouldEvictOldestWhenDroppingHead() throws Exception {
        broker = TestBrokers.started(dir);
        broker.declareQueue("jobs", true, bounded(2, OverflowPolicy.DROP_HEAD));
        for (int i = 0; i < 4; i++) {
            broker.publish("jobs", bytes("m" + i), true);
        }

        assertEquals(2, broker.queueInfo("jobs").getPending());
        Subscription subscription = broker.consume("jobs", 2, false);
        assertEquals("m2", text(next(subscription)));
        assertEquals("m3", text(next(subscription)));

        broker.shutdown();
        broker = TestBrokers.started(dir);
        // Evicted messages were tombstoned; the unacked ones come back
        assertEquals(2, broker.queueInfo("jobs").getPending());
    }

    @Test
    void shouldFailBlockedPublishAfterTimeout() throws IOException {
        broker = TestBrokers.started(dir, "queue.publishBlockTimeoutMs", "100");
        broker.declareQueue("jobs", false, bounded(1, OverflowPolicy.BLOCK_PUBLISH));
        broker.publish("jobs", bytes("m0"), false);

        long begin = System.nanoTime();
        assertThrows(CapacityExceededException.class, () -> broker.publish("jobs", bytes("m1"), false));

        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin) >= 90);
        assertEquals(1, broker.queueInfo("jobs").getPending());
    }

    @Test
    void shouldReleaseBlockedPublishWhenRoomAppears() throws Exception {
        broker = TestBrokers.started(dir, "queue.publishBlockTimeoutMs", "5000");
        broker.declareQueue("jobs", false, bounded(1, OverflowPolicy.BLOCK_PUBLISH));
        broker.publish("jobs", bytes("m0"), false);

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<Long> blocked = pool.submit(() -> broker.publish("jobs", bytes("m1"), false));
            Thread.sleep(100);
            assertFalse(blocked.isDone());

            Subscription subscription = broker.consume("jobs", 1, false);

            assertEquals(2L, blocked.get(5, TimeUnit.SECONDS));
            Delivery first = next(subscription);
            assertEquals("m0", text(first));
            subscription.ack(first);
            assertEquals("m1", text(next(subscription)));
        } finally {
            pool.shutdownNow();
        }
    }

    private static QueueConfig bounded(int maxLength, OverflowPolicy policy) {
        return QueueConfig.builder().maxLength(maxLength).overflowPolicy(policy).build();
    }
}
