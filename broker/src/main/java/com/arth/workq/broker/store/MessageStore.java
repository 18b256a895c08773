package com.arth.workq.broker.store;

import com.arth.workq.broker.config.QueueConfig;
import com.arth.workq.common.message.Message;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Durable record of the messages of durable queues.
 * <p>
 * Writes for one queue are serialized by the store. A message passed to {@link #remove}
 * must never come back from {@link #loadAll} after a restart; a message not yet removed
 * always does.
 */
public interface MessageStore {

    void start() throws IOException;

    /**
     * Persist the declaration of a durable queue so it is recovered on restart.
     */
    void declare(String queueName, QueueConfig config) throws IOException;

    /**
     * @return every durable queue found in the store, by name
     */
    Map<String, QueueConfig> recoverDeclarations() throws IOException;

    StoreReceipt append(String queueName, Message message) throws IOException;

    /**
     * @return the unacknowledged messages of the queue, in message id order
     */
    List<Message> loadAll(String queueName) throws IOException;

    /**
     * @return the highest message id ever written for the queue, or 0 if none
     */
    long lastMessageId(String queueName) throws IOException;

    void remove(String queueName, long messageId) throws IOException;

    void deleteQueue(String queueName) throws IOException;

    void shutdown() throws IOException;
}
