package com.arth.workq.broker.core.impl;

import com.arth.workq.broker.config.QueueConfig;
import com.arth.workq.broker.config.RequeuePosition;
import com.arth.workq.broker.consumer.Delivery;
import com.arth.workq.broker.consumer.Subscription;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.arth.workq.broker.core.impl.TestBrokers.assertNoDelivery;
import static com.arth.workq.broker.core.impl.TestBrokers.bytes;
import static com.arth.workq.broker.core.impl.TestBrokers.next;
import static com.arth.workq.broker.core.impl.TestBrokers.text;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Restarts over the same store directory. A broker that is abandoned without shutdown
 * stands in for a crashed process: every write it made was already flushed.
 */
class DurabilityTest {

    @TempDir
    Path dir;

    private final List<DefaultBroker> brokers = new ArrayList<>();

    @AfterEach
    void tearDown() throws IOException {
        for (DefaultBroker broker : brokers) {
            broker.shutdown();
        }
    }

    @Test
    void shouldRedeliverEveryUnackedMessageAfterCrash() throws Exception {
        DefaultBroker crashed = start("store.syncOnWrite", "true");
        crashed.declareQueue("jobs", true);
        for (int i = 0; i < 100; i++) {
            crashed.publish("jobs", bytes("m" + i), true);
        }
        Subscription subscription = crashed.consume("jobs", 10, false);
        for (int i = 0; i < 40; i++) {
            subscription.ack(next(subscription));
        }
        // 10 more are in flight and never acked
        for (int i = 0; i < 10; i++) {
            next(subscription);
        }

        DefaultBroker restarted = start("store.syncOnWrite", "true");
        assertEquals(Set.of("jobs"), restarted.queueNames());
        assertEquals(60, restarted.queueInfo("jobs").getPending());

        Subscription recovered = restarted.consume("jobs", 10, false);
        Set<String> payloads = new HashSet<>();
        for (int i = 0; i < 60; i++) {
            Delivery delivery = next(recovered);
            assertTrue(delivery.isRedelivered());
            assertTrue(delivery.getAttempt() >= 1);
            assertTrue(payloads.add(text(delivery)), "duplicate " + text(delivery));
            recovered.ack(delivery);
        }
        assertNoDelivery(recovered);
        for (int i = 40; i < 100; i++) {
            assertTrue(payloads.contains("m" + i));
        }
        assertEquals(101, restarted.publish("jobs", bytes("after"), true));
    }

    @Test
    void shouldLoseAutoAckedMessagesOnCrash() throws Exception {
        DefaultBroker crashed = start();
        crashed.declareQueue("jobs", true);
        Subscription subscription = crashed.consume("jobs", 5, true);
        for (int i = 0; i < 10; i++) {
            crashed.publish("jobs", bytes("m" + i), true);
        }
        // Five deliveries sit in the mailbox and are never processed
        assertEquals(5, subscription.backlog());

        DefaultBroker restarted = start();

        assertEquals(5, restarted.queueInfo("jobs").getPending());
        Subscription recovered = restarted.consume("jobs", 5, false);
        assertEquals("m5", text(next(recovered)));
    }

    @Test
    void shouldNotKeepTransientMessagesOrQueues() throws Exception {
        DefaultBroker first = start();
        first.declareQueue("durable", true);
        first.declareQueue("transient", false);
        first.publish("durable", bytes("kept"), true);
        first.publish("durable", bytes("dropped"), false);
        first.publish("transient", bytes("dropped"), true);
        first.shutdown();

        DefaultBroker second = start();

        assertEquals(Set.of("durable"), second.queueNames());
        assertEquals(1, second.queueInfo("durable").getPending());
        assertEquals("kept", text(next(second.consume("durable", 1, false))));
    }

    @Test
    void shouldRecoverQueueOptionsAndAcceptMatchingRedeclare() throws Exception {
        QueueConfig config = QueueConfig.builder().maxLength(5).requeuePosition(RequeuePosition.TAIL).build();
        DefaultBroker first = start();
        first.declareQueue("jobs", true, config);
        first.shutdown();

        DefaultBroker second = start();

        assertEquals(config, second.queueInfo("jobs").getConfig());
        assertTrue(second.queueInfo("jobs").isDurable());
        second.declareQueue("jobs", true, config);
    }

    @Test
    void shouldKeepPurgedAndRejectedMessagesGoneAfterRestart() throws Exception {
        DefaultBroker first = start();
        first.declareQueue("jobs", true);
        Subscription subscription = first.consume("jobs", 1, false);
        for (int i = 0; i < 5; i++) {
            first.publish("jobs", bytes("m" + i), true);
        }
        subscription.nack(next(subscription), false);
        next(subscription);
        first.purgeQueue("jobs");

        DefaultBroker second = start();

        // Only the message that was in flight during the purge survives
        assertEquals(1, second.queueInfo("jobs").getPending());
        assertEquals("m1", text(next(second.consume("jobs", 1, false))));
    }

    @Test
    void shouldSurviveCompactionAcrossRestarts() throws Exception {
        DefaultBroker first = start("store.compactionThreshold", "5");
        first.declareQueue("jobs", true);
        for (int i = 0; i < 30; i++) {
            first.publish("jobs", bytes("m" + i), true);
        }
        Subscription subscription = first.consume("jobs", 1, false);
        for (int i = 0; i < 23; i++) {
            subscription.ack(next(subscription));
        }
        first.shutdown();

        DefaultBroker second = start("store.compactionThreshold", "5");

        assertEquals(7, second.queueInfo("jobs").getPending());
        assertEquals("m23", text(next(second.consume("jobs", 1, false))));
        assertEquals(31, second.publish("jobs", bytes("m30"), true));
    }

    @Test
    void shouldForgetDeletedDurableQueue() throws Exception {
        DefaultBroker first = start();
        first.declareQueue("jobs", true);
        first.publish("jobs", bytes("x"), true);
        first.deleteQueue("jobs", true);
        first.shutdown();

        DefaultBroker second = start();

        assertFalse(second.queueNames().contains("jobs"));
    }

    private DefaultBroker start(String... overrides) throws IOException {
        DefaultBroker broker = TestBrokers.started(dir, overrides);
        brokers.add(broker);
        return broker;
    }
}
