package com.arth.workq.broker.queue;

import java.util.List;
import java.util.function.Predicate;

/**
 * Ordered pending sequence of one queue. Implementations are not thread safe; callers
 * hold the queue's lock.
 */
public interface MessageQueue {

    /**
     * Append to the tail.
     *
     * @throws com.arth.workq.common.exception.CapacityExceededException when the queue is full
     */
    void enqueue(QueuedMessage message);

    /**
     * @return the first pending message accepted by the predicate, or null; nothing is removed
     */
    QueuedMessage peekNext(Predicate<QueuedMessage> eligible);

    /**
     * Remove and return the first pending message accepted by the predicate, or null.
     */
    QueuedMessage pollNext(Predicate<QueuedMessage> eligible);

    boolean remove(QueuedMessage message);

    /**
     * Reinsert at the head; never subject to the capacity bound.
     */
    void requeueFront(QueuedMessage message);

    /**
     * Reinsert at the tail; never subject to the capacity bound.
     */
    void requeueTail(QueuedMessage message);

    /**
     * Remove and return the head, or null when empty.
     */
    QueuedMessage pollOldest();

    boolean isFull();

    int size();

    boolean isEmpty();

    /**
     * Remove every pending message.
     *
     * @return the removed messages in queue order
     */
    List<QueuedMessage> clear();

    void close();
}
