package com.arth.workq.broker.delivery;

import com.arth.workq.broker.queue.QueuedMessage;
import com.arth.workq.common.constant.LoggerName;
import com.arth.workq.common.exception.UnknownDeliveryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-flight entries of one queue, indexed by consumer and by message id.
 * Not thread safe; the owning queue's lock guards every call.
 */
public class DeliveryTracker {

    private static final Logger log = LoggerFactory.getLogger(LoggerName.DELIVERY);

    private final String queueName;
    private final Map<String, Map<Long, InFlightEntry>> byConsumer = new HashMap<>();
    private final Map<Long, InFlightEntry> byMessageId = new HashMap<>();

    public DeliveryTracker(String queueName) {
        this.queueName = queueName;
    }

    /**
     * Register a delivery.
     *
     * @throws IllegalStateException if the message is already in flight with some consumer
     */
    public InFlightEntry track(String consumerId, QueuedMessage message, long deliveryTag, long deliveredAt, int attempt) {
        long messageId = message.getMessageId();
        InFlightEntry holder = byMessageId.get(messageId);
        if (holder != null) {
            throw new IllegalStateException("Message " + messageId + " of queue " + queueName
                    + " is already in flight with consumer " + holder.getConsumerId());
        }
        InFlightEntry entry = new InFlightEntry(message, consumerId, deliveryTag, deliveredAt, attempt);
        byConsumer.computeIfAbsent(consumerId, k -> new LinkedHashMap<>()).put(messageId, entry);
        byMessageId.put(messageId, entry);
        log.debug("Queue {}: message {} in flight with {} (attempt {})", queueName, messageId, consumerId, attempt);
        return entry;
    }

    /**
     * Remove the in-flight entry for an ack or nack.
     *
     * @throws UnknownDeliveryException if the consumer does not hold the message
     */
    public InFlightEntry complete(String consumerId, long messageId) {
        Map<Long, InFlightEntry> entries = byConsumer.get(consumerId);
        InFlightEntry entry = entries == null ? null : entries.remove(messageId);
        if (entry == null) {
            throw new UnknownDeliveryException("Consumer " + consumerId + " holds no in-flight message "
                    + messageId + " on queue " + queueName);
        }
        if (entries.isEmpty()) {
            byConsumer.remove(consumerId);
        }
        byMessageId.remove(messageId);
        return entry;
    }

    /**
     * @return the entry or null
     */
    public InFlightEntry get(String consumerId, long messageId) {
        Map<Long, InFlightEntry> entries = byConsumer.get(consumerId);
        return entries == null ? null : entries.get(messageId);
    }

    /**
     * Remove every entry held by the consumer.
     *
     * @return the removed entries in ascending message id order
     */
    public List<InFlightEntry> releaseAll(String consumerId) {
        Map<Long, InFlightEntry> entries = byConsumer.remove(consumerId);
        if (entries == null) {
            return new ArrayList<>();
        }
        List<InFlightEntry> released = new ArrayList<>(entries.values());
        released.sort(Comparator.comparingLong(InFlightEntry::getMessageId));
        for (InFlightEntry entry : released) {
            byMessageId.remove(entry.getMessageId());
        }
        return released;
    }

    public int inFlightCount(String consumerId) {
        Map<Long, InFlightEntry> entries = byConsumer.get(consumerId);
        return entries == null ? 0 : entries.size();
    }

    public int totalInFlight() {
        return byMessageId.size();
    }

    public boolean isInFlight(long messageId) {
        return byMessageId.containsKey(messageId);
    }

    /**
     * Drop all entries, used when the queue is torn down.
     */
    public List<InFlightEntry> clear() {
        List<InFlightEntry> all = new ArrayList<>(byMessageId.values());
        byConsumer.clear();
        byMessageId.clear();
        return all;
    }
}
