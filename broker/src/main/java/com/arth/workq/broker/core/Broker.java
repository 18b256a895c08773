package com.arth.workq.broker.core;

import com.arth.workq.broker.config.QueueConfig;
import com.arth.workq.broker.consumer.Subscription;

import java.io.IOException;
import java.util.Set;

/**
 * Publish/consume/ack surface of the broker. A transport maps its wire operations onto
 * these calls.
 */
public interface Broker {

    /**
     * Start the store and recover every durable queue. No other call is accepted before.
     */
    void start() throws IOException;

    void shutdown() throws IOException;

    /**
     * Declare a queue with the broker's default options. Idempotent.
     *
     * @throws com.arth.workq.common.exception.QueueConflictException if the queue exists with different attributes
     */
    void declareQueue(String name, boolean durable);

    void declareQueue(String name, boolean durable, QueueConfig config);

    /**
     * @param force when false, fails with {@link com.arth.workq.common.exception.QueueInUseException}
     *              while messages are in flight; when true, cancels all consumers first
     */
    void deleteQueue(String name, boolean force);

    /**
     * Drop every pending message. In-flight messages are not affected.
     *
     * @return number of messages dropped
     */
    int purgeQueue(String name);

    /**
     * @return the id assigned to the message
     */
    long publish(String queueName, byte[] payload, boolean persistent);

    /**
     * @return the consumer id
     */
    String registerConsumer(String queueName, int prefetch, boolean autoAck);

    Subscription subscription(String consumerId);

    /**
     * Register a consumer and return its delivery stream.
     */
    Subscription consume(String queueName, int prefetch, boolean autoAck);

    void ack(String consumerId, long messageId);

    void nack(String consumerId, long messageId, boolean requeue);

    /**
     * Stop deliveries and requeue every in-flight message of the consumer. Unknown ids are ignored.
     */
    void cancelConsumer(String consumerId);

    /**
     * Same effect as {@link #cancelConsumer} for a consumer whose connection went away.
     */
    void disconnectConsumer(String consumerId);

    QueueInfo queueInfo(String name);

    Set<String> queueNames();
}
