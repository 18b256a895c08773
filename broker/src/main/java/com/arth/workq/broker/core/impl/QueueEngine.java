package com.arth.workq.broker.core.impl;

import com.arth.workq.broker.config.BrokerConfig;
import com.arth.workq.broker.config.OverflowPolicy;
import com.arth.workq.broker.config.QueueConfig;
import com.arth.workq.broker.config.RequeuePosition;
import com.arth.workq.broker.consumer.Delivery;
import com.arth.workq.broker.consumer.Subscription;
import com.arth.workq.broker.core.QueueInfo;
import com.arth.workq.broker.delivery.ConsumerRegistration;
import com.arth.workq.broker.delivery.ConsumerState;
import com.arth.workq.broker.delivery.DeliveryTracker;
import com.arth.workq.broker.delivery.InFlightEntry;
import com.arth.workq.broker.dispatch.Dispatcher;
import com.arth.workq.broker.queue.DequeMessageQueue;
import com.arth.workq.broker.queue.MessageQueue;
import com.arth.workq.broker.queue.QueuedMessage;
import com.arth.workq.broker.store.MessageStore;
import com.arth.workq.common.constant.LoggerName;
import com.arth.workq.common.exception.CapacityExceededException;
import com.arth.workq.common.exception.QueueInUseException;
import com.arth.workq.common.exception.QueueNotFoundException;
import com.arth.workq.common.exception.StoreFailureException;
import com.arth.workq.common.exception.UnknownConsumerException;
import com.arth.workq.common.message.Message;
import io.netty.util.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One queue with its pending messages, consumers and in-flight entries.
 * <p>
 * Every state transition happens while holding {@link #lock}: enqueue, store writes,
 * dispatch, ack, nack, cancel and timeouts. Different queues never share a lock.
 */
public class QueueEngine {

    private static final Logger log = LoggerFactory.getLogger(LoggerName.BROKER);

    private final String name;
    private final boolean durable;
    private final QueueConfig config;
    private final MessageStore store;
    private final BrokerConfig brokerConfig;
    private final Timer timer;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notFull = lock.newCondition();
    private final MessageQueue pending;
    private final DeliveryTracker tracker;
    private final Dispatcher dispatcher;
    private final List<ConsumerRegistration> consumers = new ArrayList<>();

    private long nextMessageId = 1;
    private long nextDeliveryTag = 1;
    private boolean halted = false;
    private boolean deleted = false;

    /**
     * @param store the store of durable queues, ignored for transient ones
     * @param timer schedules delivery timeouts
     */
    public QueueEngine(String name, boolean durable, QueueConfig config, MessageStore store,
                       BrokerConfig brokerConfig, Timer timer) {
        this.name = name;
        this.durable = durable;
        this.config = config;
        this.store = durable ? store : null;
        this.brokerConfig = brokerConfig;
        this.timer = timer;
        this.pending = new DequeMessageQueue(name, config.getMaxLength());
        this.tracker = new DeliveryTracker(name);
        this.dispatcher = new Dispatcher(name);
    }

    public String getName() {
        return name;
    }

    public boolean isDurable() {
        return durable;
    }

    public QueueConfig getConfig() {
        return config;
    }

    /**
     * Load unacknowledged messages after a restart. Recovered messages bypass the length bound.
     */
    public void recover(List<Message> messages, long lastMessageId) {
        lock.lock();
        try {
            nextMessageId = Math.max(nextMessageId, lastMessageId + 1);
            for (Message message : messages) {
                pending.requeueTail(QueuedMessage.recovered(message));
                nextMessageId = Math.max(nextMessageId, message.getMessageId() + 1);
            }
            log.info("Queue {} recovered {} messages, next message id: {}", name, messages.size(), nextMessageId);
        } finally {
            lock.unlock();
        }
    }

    public long publish(byte[] payload, boolean persistent) {
        lock.lock();
        try {
            ensureUsable();
            QueuedMessage evicted = pending.isFull() ? makeRoom() : null;

            Message message = new Message(nextMessageId++, name, payload, persistent);
            if (isStored(message)) {
                try {
                    store.append(name, message);
                } catch (IOException e) {
                    if (evicted != null) {
                        pending.requeueFront(evicted);
                    }
                    log.error("Queue {}: failed to store message {}", name, message.getMessageId(), e);
                    throw new StoreFailureException("Failed to store message on queue " + name, e);
                }
            }
            pending.enqueue(QueuedMessage.of(message));
            log.debug("Queue {}: published message {} ({} bytes, persistent={})",
                    name, message.getMessageId(), payload.length, persistent);

            if (evicted != null) {
                log.warn("Queue {} full at {} messages, evicted oldest message {}",
                        name, config.getMaxLength(), evicted.getMessageId());
                if (isStored(evicted.getMessage()) && !removeFromStore(evicted.getMessage())) {
                    // The new message is stored and stays queued; the evicted one returns after a restart
                    throw new StoreFailureException("Queue " + name + " halted: could not record eviction of message "
                            + evicted.getMessageId());
                }
            }

            dispatch();
            return message.getMessageId();
        } finally {
            lock.unlock();
        }
    }

    public void register(ConsumerRegistration consumer) {
        lock.lock();
        try {
            ensureUsable();
            consumers.add(consumer);
            log.info("Queue {}: consumer {} registered (prefetch={}, autoAck={})",
                    name, consumer.getConsumerId(), consumer.getPrefetch(), consumer.isAutoAck());
            dispatch();
        } finally {
            lock.unlock();
        }
    }

    public Subscription subscription(String consumerId) {
        lock.lock();
        try {
            return requireConsumer(consumerId).getSubscription();
        } finally {
            lock.unlock();
        }
    }

    public void ack(String consumerId, long messageId) {
        lock.lock();
        try {
            ensureUsable();
            InFlightEntry entry = tracker.complete(consumerId, messageId);
            entry.cancelTimeout();
            log.debug("Queue {}: consumer {} acked message {}", name, consumerId, messageId);

            Message message = entry.getMessage().getMessage();
            boolean removed = !isStored(message) || removeFromStore(message);
            dispatch();
            if (!removed) {
                throw new StoreFailureException("Queue " + name + " halted: could not record ack of message " + messageId);
            }
        } finally {
            lock.unlock();
        }
    }

    public void nack(String consumerId, long messageId, boolean requeue) {
        lock.lock();
        try {
            ensureUsable();
            InFlightEntry entry = tracker.complete(consumerId, messageId);
            entry.cancelTimeout();
            if (requeue) {
                requeue(entry.getMessage());
                log.debug("Queue {}: consumer {} nacked message {}, requeued at {}",
                        name, consumerId, messageId, config.getRequeuePosition());
            } else {
                Message message = entry.getMessage().getMessage();
                log.debug("Queue {}: consumer {} rejected message {}, discarded", name, consumerId, messageId);
                if (isStored(message) && !removeFromStore(message)) {
                    throw new StoreFailureException("Queue " + name + " halted: could not record rejection of message "
                            + messageId);
                }
            }
            dispatch();
        } finally {
            lock.unlock();
        }
    }

    /**
     * End a registration: stop deliveries, drop undrained deliveries and requeue everything
     * the consumer held. Does nothing for an unknown consumer.
     */
    public void release(String consumerId, ConsumerState finalState) {
        lock.lock();
        try {
            ConsumerRegistration consumer = findConsumer(consumerId);
            if (consumer == null) {
                return;
            }
            consumer.setState(finalState);
            consumers.remove(consumer);

            List<Delivery> undrained = consumer.getSubscription().terminate();
            List<InFlightEntry> held = tracker.releaseAll(consumerId);
            held.forEach(InFlightEntry::cancelTimeout);
            requeueAll(held);

            if (consumer.isAutoAck() && !undrained.isEmpty()) {
                log.warn("Queue {}: auto-ack consumer {} ended with {} undrained deliveries, messages lost",
                        name, consumerId, undrained.size());
            }
            log.info("Queue {}: consumer {} {}, {} in-flight messages requeued",
                    name, consumerId, finalState.name().toLowerCase(), held.size());

            if (!halted && !deleted) {
                dispatch();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Refill mailbox-bounded consumers after one of them took a delivery.
     */
    public void drained() {
        lock.lock();
        try {
            dispatch();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop every pending message. In-flight messages are untouched.
     *
     * @return the number of messages dropped
     * @throws StoreFailureException if a tombstone could not be written; the messages not yet
     *                               tombstoned stay queued and the queue halts
     */
    public int purge() {
        lock.lock();
        try {
            ensureUsable();
            List<QueuedMessage> dropped = pending.clear();
            for (int i = 0; i < dropped.size(); i++) {
                Message message = dropped.get(i).getMessage();
                if (isStored(message) && !removeFromStore(message)) {
                    List<QueuedMessage> kept = dropped.subList(i, dropped.size());
                    kept.forEach(pending::requeueTail);
                    log.error("Queue {} purge stopped after {} messages, {} kept", name, i, kept.size());
                    throw new StoreFailureException("Queue " + name + " halted: could not record purge of message "
                            + message.getMessageId());
                }
            }
            notFull.signalAll();
            log.info("Queue {} purged, {} messages dropped", name, dropped.size());
            return dropped.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Tear the queue down, store files first. The caller removes the registry entry.
     *
     * @return ids of the consumers that were cancelled
     * @throws StoreFailureException if the store files could not be deleted; the queue is left as it was
     */
    public List<String> delete(boolean force) {
        lock.lock();
        try {
            if (deleted) {
                throw new QueueNotFoundException("Queue " + name + " does not exist");
            }
            if (!force && tracker.totalInFlight() > 0) {
                throw new QueueInUseException("Queue " + name + " has " + tracker.totalInFlight()
                        + " messages in flight");
            }
            if (durable) {
                try {
                    store.deleteQueue(name);
                } catch (IOException e) {
                    log.error("Queue {}: failed to delete stored files", name, e);
                    throw new StoreFailureException("Failed to delete stored files of queue " + name, e);
                }
            }
            List<String> cancelled = new ArrayList<>();
            for (ConsumerRegistration consumer : consumers) {
                consumer.setState(ConsumerState.CANCELLED);
                consumer.getSubscription().terminate();
                cancelled.add(consumer.getConsumerId());
            }
            consumers.clear();
            tracker.clear().forEach(InFlightEntry::cancelTimeout);
            int dropped = pending.clear().size();
            pending.close();
            deleted = true;
            notFull.signalAll();
            log.info("Queue {} deleted (force={}), {} pending messages dropped, {} consumers cancelled",
                    name, force, dropped, cancelled.size());
            return cancelled;
        } finally {
            lock.unlock();
        }
    }

    public QueueInfo info() {
        lock.lock();
        try {
            return new QueueInfo(name, durable, config, pending.size(), tracker.totalInFlight(),
                    consumers.size(), halted);
        } finally {
            lock.unlock();
        }
    }

    /**
     * End every subscription at broker shutdown. Stored messages stay in the store.
     */
    public void shutdown() {
        lock.lock();
        try {
            for (ConsumerRegistration consumer : consumers) {
                consumer.setState(ConsumerState.CANCELLED);
                consumer.getSubscription().terminate();
            }
            consumers.clear();
            tracker.clear().forEach(InFlightEntry::cancelTimeout);
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private void dispatch() {
        if (halted || deleted) {
            return;
        }
        int delivered = dispatcher.dispatch(
                pending,
                consumers,
                message -> !tracker.isInFlight(message.getMessageId()),
                this::isEligible,
                this::deliver);
        if (delivered > 0) {
            notFull.signalAll();
        }
    }

    private boolean isEligible(ConsumerRegistration consumer) {
        if (halted || !consumer.isActive()) {
            return false;
        }
        if (consumer.isAutoAck()) {
            // No in-flight phase: prefetch bounds the undrained mailbox instead
            return consumer.getSubscription().backlog() < consumer.getPrefetch();
        }
        return tracker.inFlightCount(consumer.getConsumerId()) < consumer.getPrefetch();
    }

    private void deliver(ConsumerRegistration consumer, QueuedMessage queued) {
        boolean redelivered = queued.isRedelivered();
        int attempt = queued.beginAttempt();
        Message message = queued.getMessage();
        long now = System.currentTimeMillis();

        if (consumer.isAutoAck()) {
            // PENDING -> ACKED: gone from the store before the consumer has seen it
            if (isStored(message) && !removeFromStore(message)) {
                log.error("Queue {}: auto-ack of message {} by {} not recorded, it returns after a restart",
                        name, message.getMessageId(), consumer.getConsumerId());
            }
        } else {
            InFlightEntry entry = tracker.track(consumer.getConsumerId(), queued, nextDeliveryTag++, now, attempt);
            scheduleTimeout(entry);
        }

        consumer.getSubscription().offer(new Delivery(
                consumer.getConsumerId(),
                name,
                message.getMessageId(),
                message.getPayload(),
                attempt,
                redelivered,
                message.isPersistent(),
                message.getEnqueueTimestamp(),
                now));
        consumer.recordDelivery();
    }

    private void scheduleTimeout(InFlightEntry entry) {
        long timeoutMs = config.getDeliveryTimeoutMs();
        if (timeoutMs <= 0 || timer == null) {
            return;
        }
        String consumerId = entry.getConsumerId();
        long messageId = entry.getMessageId();
        long tag = entry.getDeliveryTag();
        entry.setTimeout(timer.newTimeout(t -> onDeliveryTimeout(consumerId, messageId, tag),
                timeoutMs, TimeUnit.MILLISECONDS));
    }

    void onDeliveryTimeout(String consumerId, long messageId, long deliveryTag) {
        lock.lock();
        try {
            if (halted || deleted) {
                return;
            }
            InFlightEntry entry = tracker.get(consumerId, messageId);
            if (entry == null || entry.getDeliveryTag() != deliveryTag) {
                return;
            }
            tracker.complete(consumerId, messageId);
            ConsumerRegistration consumer = findConsumer(consumerId);
            if (consumer != null) {
                consumer.getSubscription().withdraw(messageId);
            }
            log.warn("Queue {}: message {} not acknowledged by {} within {}ms, requeued",
                    name, messageId, consumerId, config.getDeliveryTimeoutMs());
            requeue(entry.getMessage());
            dispatch();
        } finally {
            lock.unlock();
        }
    }

    private void requeue(QueuedMessage queued) {
        if (config.getRequeuePosition() == RequeuePosition.TAIL) {
            pending.requeueTail(queued);
        } else {
            pending.requeueFront(queued);
        }
    }

    /**
     * Requeue entries so that they keep their relative message id order.
     */
    private void requeueAll(List<InFlightEntry> entries) {
        if (config.getRequeuePosition() == RequeuePosition.TAIL) {
            for (InFlightEntry entry : entries) {
                pending.requeueTail(entry.getMessage());
            }
        } else {
            for (int i = entries.size() - 1; i >= 0; i--) {
                pending.requeueFront(entries.get(i).getMessage());
            }
        }
    }

    /**
     * Apply the overflow policy of a full queue.
     *
     * @return the message taken off the head under DROP_HEAD, not yet tombstoned; null otherwise
     */
    private QueuedMessage makeRoom() {
        OverflowPolicy policy = config.getOverflowPolicy();
        switch (policy) {
            case DROP_HEAD -> {
                return pending.pollOldest();
            }
            case BLOCK_PUBLISH -> {
                awaitNotFull();
                return null;
            }
            default -> throw new CapacityExceededException("Queue " + name + " is at its maximum length of "
                    + config.getMaxLength());
        }
    }

    private void awaitNotFull() {
        long remaining = TimeUnit.MILLISECONDS.toNanos(brokerConfig.getPublishBlockTimeoutMs());
        try {
            while (pending.isFull()) {
                if (remaining <= 0) {
                    throw new CapacityExceededException("Queue " + name + " stayed full for "
                            + brokerConfig.getPublishBlockTimeoutMs() + "ms");
                }
                remaining = notFull.awaitNanos(remaining);
                ensureUsable();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CapacityExceededException("Interrupted while waiting for room on queue " + name, e);
        }
    }

    /**
     * Write the tombstone of a message, retrying with a growing delay. Halts the queue
     * when every attempt fails.
     *
     * @return false if the queue was halted
     */
    private boolean removeFromStore(Message message) {
        int maxRetries = brokerConfig.getAckMaxRetries();
        for (int attempt = 0; ; attempt++) {
            try {
                store.remove(name, message.getMessageId());
                return true;
            } catch (IOException e) {
                if (attempt >= maxRetries) {
                    halted = true;
                    log.error("Queue {} halted: removal of message {} failed after {} attempts",
                            name, message.getMessageId(), attempt + 1, e);
                    return false;
                }
                long delay = brokerConfig.getAckRetryDelayMs() * (attempt + 1);
                log.warn("Queue {}: removal of message {} failed (attempt {}), retrying in {}ms",
                        name, message.getMessageId(), attempt + 1, delay);
                if (!sleep(delay)) {
                    halted = true;
                    log.error("Queue {} halted: interrupted while retrying removal of message {}",
                            name, message.getMessageId());
                    return false;
                }
            }
        }
    }

    private static boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private boolean isStored(Message message) {
        return durable && message.isPersistent();
    }

    private void ensureUsable() {
        if (deleted) {
            throw new QueueNotFoundException("Queue " + name + " does not exist");
        }
        if (halted) {
            throw new StoreFailureException("Queue " + name + " is halted after a store failure");
        }
    }

    private ConsumerRegistration findConsumer(String consumerId) {
        for (ConsumerRegistration consumer : consumers) {
            if (consumer.getConsumerId().equals(consumerId)) {
                return consumer;
            }
        }
        return null;
    }

    private ConsumerRegistration requireConsumer(String consumerId) {
        ConsumerRegistration consumer = findConsumer(consumerId);
        if (consumer == null) {
            throw new UnknownConsumerException("Consumer " + consumerId + " is not registered on queue " + name);
        }
        return consumer;
    }
}
