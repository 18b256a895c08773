package com.arth.workq.broker.queue;

import com.arth.workq.common.constant.LoggerName;
import com.arth.workq.common.exception.CapacityExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;

/**
 * {@link ArrayDeque}-backed pending sequence with an optional bound on its length.
 */
public class DequeMessageQueue implements MessageQueue {

    private static final Logger log = LoggerFactory.getLogger(LoggerName.MESSAGE);

    private final String name;
    private final int maxLength;
    private final ArrayDeque<QueuedMessage> pending = new ArrayDeque<>();

    /**
     * @param maxLength maximum number of pending messages accepted by {@link #enqueue}, 0 for unbounded
     */
    public DequeMessageQueue(String name, int maxLength) {
        if (maxLength < 0) {
            throw new IllegalArgumentException("maxLength must be >= 0, got " + maxLength);
        }
        this.name = name;
        this.maxLength = maxLength;
    }

    @Override
    public void enqueue(QueuedMessage message) {
        if (isFull()) {
            log.debug("Queue {} full at {} messages", name, pending.size());
            throw new CapacityExceededException("Queue " + name + " is at its maximum length of " + maxLength);
        }
        pending.addLast(message);
    }

    @Override
    public QueuedMessage peekNext(Predicate<QueuedMessage> eligible) {
        for (QueuedMessage message : pending) {
            if (eligible.test(message)) {
                return message;
            }
        }
        return null;
    }

    @Override
    public QueuedMessage pollNext(Predicate<QueuedMessage> eligible) {
        Iterator<QueuedMessage> it = pending.iterator();
        while (it.hasNext()) {
            QueuedMessage message = it.next();
            if (eligible.test(message)) {
                it.remove();
                return message;
            }
        }
        return null;
    }

    @Override
    public boolean remove(QueuedMessage message) {
        return pending.remove(message);
    }

    @Override
    public void requeueFront(QueuedMessage message) {
        pending.addFirst(message);
    }

    @Override
    public void requeueTail(QueuedMessage message) {
        pending.addLast(message);
    }

    @Override
    public QueuedMessage pollOldest() {
        return pending.pollFirst();
    }

    @Override
    public boolean isFull() {
        return maxLength > 0 && pending.size() >= maxLength;
    }

    @Override
    public int size() {
        return pending.size();
    }

    @Override
    public boolean isEmpty() {
        return pending.isEmpty();
    }

    @Override
    public List<QueuedMessage> clear() {
        List<QueuedMessage> drained = new ArrayList<>(pending);
        pending.clear();
        return drained;
    }

    @Override
    public void close() {
        pending.clear();
    }
}
