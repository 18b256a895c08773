package com.arth.workq.broker.core.impl;

import com.arth.workq.common.exception.QueueNotFoundException;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

public class QueueManager {

    private final ConcurrentHashMap<String, QueueEngine> queues = new ConcurrentHashMap<>();

    /**
     * @return the queue already registered under the same name, or null if this one was added
     */
    public QueueEngine register(QueueEngine queue) {
        return queues.putIfAbsent(queue.getName(), queue);
    }

    /**
     * @return the queue or null
     */
    public QueueEngine get(String name) {
        return queues.get(name);
    }

    public QueueEngine require(String name) {
        QueueEngine queue = queues.get(name);
        if (queue == null) {
            throw new QueueNotFoundException("Queue " + name + " does not exist");
        }
        return queue;
    }

    public void unregister(String name) {
        queues.remove(name);
    }

    public Collection<QueueEngine> allQueues() {
        return queues.values();
    }

    public Set<String> names() {
        return new TreeSet<>(queues.keySet());
    }

    public void clear() {
        queues.clear();
    }
}
