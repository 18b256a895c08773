package com.arth.workq.broker.consumer;

import com.arth.workq.broker.core.Broker;
import com.arth.workq.common.constant.LoggerName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Cancellable stream of deliveries for one consumer registration.
 * <p>
 * The broker places deliveries into the mailbox while holding the queue's lock; the
 * consumer drains it with {@link #take()}, {@link #poll(long, TimeUnit)} or the blocking
 * iterator. Once cancelled, undrained deliveries are discarded by the broker (in-flight
 * ones are requeued) and every waiting call returns null.
 */
public class Subscription implements Iterable<Delivery>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LoggerName.CONSUMER);

    // Wakes up blocked takers on termination
    private static final Delivery END = new Delivery(null, null, -1, new byte[0], 0, false, false, 0, 0);

    private final Broker broker;
    private final String consumerId;
    private final String queueName;
    private final Runnable drainListener;
    private final BlockingQueue<Delivery> mailbox = new LinkedBlockingQueue<>();
    private volatile boolean terminated = false;

    public Subscription(Broker broker, String consumerId, String queueName) {
        this(broker, consumerId, queueName, null);
    }

    /**
     * @param drainListener run after each delivery taken from the mailbox, may be null
     */
    public Subscription(Broker broker, String consumerId, String queueName, Runnable drainListener) {
        this.broker = broker;
        this.consumerId = consumerId;
        this.queueName = queueName;
        this.drainListener = drainListener;
    }

    public String getConsumerId() {
        return consumerId;
    }

    public String getQueueName() {
        return queueName;
    }

    /**
     * Wait for the next delivery.
     *
     * @return the delivery, or null once the subscription has ended
     */
    public Delivery take() throws InterruptedException {
        if (terminated) {
            return null;
        }
        Delivery delivery = mailbox.take();
        return unwrap(delivery);
    }

    /**
     * @return the next delivery, or null on timeout or once the subscription has ended
     */
    public Delivery poll(long timeout, TimeUnit unit) throws InterruptedException {
        if (terminated) {
            return null;
        }
        Delivery delivery = mailbox.poll(timeout, unit);
        return delivery == null ? null : unwrap(delivery);
    }

    public void ack(Delivery delivery) {
        broker.ack(consumerId, delivery.getMessageId());
    }

    public void nack(Delivery delivery, boolean requeue) {
        broker.nack(consumerId, delivery.getMessageId(), requeue);
    }

    /**
     * Stop deliveries to this consumer and requeue everything it holds.
     */
    public void cancel() {
        broker.cancelConsumer(consumerId);
    }

    public boolean isActive() {
        return !terminated;
    }

    /**
     * @return deliveries placed in the mailbox and not yet taken
     */
    public int backlog() {
        return terminated ? 0 : mailbox.size();
    }

    /**
     * Called by the broker, under the queue's lock.
     */
    public void offer(Delivery delivery) {
        if (terminated) {
            throw new IllegalStateException("Subscription " + consumerId + " already ended");
        }
        mailbox.add(delivery);
    }

    /**
     * Called by the broker, under the queue's lock, when a delivery expired before it was taken.
     *
     * @return true if an undrained delivery of the message was removed
     */
    public boolean withdraw(long messageId) {
        return mailbox.removeIf(delivery -> delivery != END && delivery.getMessageId() == messageId);
    }

    /**
     * Called by the broker, under the queue's lock. Ends the stream and wakes up any waiting taker.
     *
     * @return the deliveries that were never taken
     */
    public List<Delivery> terminate() {
        if (terminated) {
            return new ArrayList<>();
        }
        terminated = true;
        List<Delivery> undrained = new ArrayList<>();
        mailbox.drainTo(undrained);
        mailbox.add(END);
        if (!undrained.isEmpty()) {
            log.debug("Subscription {} ended with {} undrained deliveries", consumerId, undrained.size());
        }
        return undrained;
    }

    @Override
    public void close() {
        cancel();
    }

    /**
     * Blocking iterator that ends when the subscription ends. An interrupt also ends the
     * iteration, with the thread's interrupt flag restored.
     */
    @Override
    public Iterator<Delivery> iterator() {
        return new Iterator<>() {
            private Delivery next;

            @Override
            public boolean hasNext() {
                if (next == null) {
                    try {
                        next = take();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return false;
                    }
                }
                return next != null;
            }

            @Override
            public Delivery next() {
                if (!hasNext()) {
                    throw new NoSuchElementException("Subscription " + consumerId + " has ended");
                }
                Delivery delivery = next;
                next = null;
                return delivery;
            }
        };
    }

    private Delivery unwrap(Delivery delivery) {
        if (delivery == END) {
            // Leave the marker for other waiting takers
            mailbox.add(END);
            return null;
        }
        if (drainListener != null && !terminated) {
            drainListener.run();
        }
        return delivery;
    }

    @Override
    public String toString() {
        return "Subscription{consumer='" + consumerId + "', queue='" + queueName + "', active=" + !terminated + "}";
    }
}
