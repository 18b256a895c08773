package com.arth.workq.broker.core.impl;

import com.arth.workq.broker.config.BrokerConfig;
import com.arth.workq.broker.config.QueueConfig;
import com.arth.workq.broker.consumer.Subscription;
import com.arth.workq.broker.core.Broker;
import com.arth.workq.broker.core.QueueInfo;
import com.arth.workq.broker.delivery.ConsumerRegistration;
import com.arth.workq.broker.delivery.ConsumerState;
import com.arth.workq.broker.store.FileMessageStore;
import com.arth.workq.broker.store.MessageStore;
import com.arth.workq.common.constant.LoggerName;
import com.arth.workq.common.exception.QueueConflictException;
import com.arth.workq.common.exception.StoreFailureException;
import com.arth.workq.common.exception.UnknownConsumerException;
import com.arth.workq.common.message.Message;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timer;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

public class DefaultBroker implements Broker {

    private static final Logger log = LoggerFactory.getLogger(LoggerName.BROKER);

    private static final Pattern QUEUE_NAME = Pattern.compile("[A-Za-z0-9._-]{1,200}");

    private final BrokerConfig config;
    private final MessageStore store;
    private final QueueManager queueManager = new QueueManager();
    private final ConcurrentHashMap<String, QueueEngine> consumerIndex = new ConcurrentHashMap<>();
    private final AtomicLong consumerIdGenerator = new AtomicLong(0);

    // Serializes declare, delete, start and shutdown; per-queue work never takes it
    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private volatile boolean started = false;
    private Timer timer;

    // Default constructor that uses the default config
    public DefaultBroker() {
        this(BrokerConfig.getConfig());
    }

    public DefaultBroker(BrokerConfig config) {
        this(config, new FileMessageStore(config));
    }

    public DefaultBroker(BrokerConfig config, MessageStore store) {
        this.config = config;
        this.store = store;
    }

    @Override
    public void start() throws IOException {
        lifecycleLock.lock();
        try {
            if (started) {
                return;
            }
            store.start();
            timer = new HashedWheelTimer(new DefaultThreadFactory("workq-delivery-timeout", true),
                    10, TimeUnit.MILLISECONDS);

            Map<String, QueueConfig> declarations = store.recoverDeclarations();
            int recovered = 0;
            for (Map.Entry<String, QueueConfig> declaration : declarations.entrySet()) {
                String name = declaration.getKey();
                QueueEngine queue = new QueueEngine(name, true, declaration.getValue(), store, config, timer);
                List<Message> messages = store.loadAll(name);
                queue.recover(messages, store.lastMessageId(name));
                queueManager.register(queue);
                recovered += messages.size();
            }
            started = true;
            log.info("Broker started: {} durable queues recovered with {} unacknowledged messages",
                    declarations.size(), recovered);
        } finally {
            lifecycleLock.unlock();
        }
    }

    @Override
    public void shutdown() throws IOException {
        lifecycleLock.lock();
        try {
            if (!started) {
                return;
            }
            started = false;
            for (QueueEngine queue : queueManager.allQueues()) {
                queue.shutdown();
            }
            queueManager.clear();
            consumerIndex.clear();
            timer.stop();
            store.shutdown();
            log.info("Broker shut down");
        } finally {
            lifecycleLock.unlock();
        }
    }

    @Override
    public void declareQueue(String name, boolean durable) {
        declareQueue(name, durable, config.getDefaultQueueConfig());
    }

    @Override
    public void declareQueue(String name, boolean durable, QueueConfig queueConfig) {
        ensureStarted();
        validateName(name);
        if (queueConfig == null) {
            throw new IllegalArgumentException("Queue config must not be null");
        }
        lifecycleLock.lock();
        try {
            QueueEngine existing = queueManager.get(name);
            if (existing != null) {
                if (existing.isDurable() != durable || !existing.getConfig().equals(queueConfig)) {
                    throw new QueueConflictException("Queue " + name + " already declared as durable="
                            + existing.isDurable() + " with " + existing.getConfig());
                }
                return;
            }
            if (durable) {
                try {
                    store.declare(name, queueConfig);
                } catch (IOException e) {
                    throw new StoreFailureException("Failed to persist declaration of queue " + name, e);
                }
            }
            queueManager.register(new QueueEngine(name, durable, queueConfig, store, config, timer));
            log.info("Queue {} declared, durable: {}, {}", name, durable, queueConfig);
        } finally {
            lifecycleLock.unlock();
        }
    }

    @Override
    public void deleteQueue(String name, boolean force) {
        ensureStarted();
        lifecycleLock.lock();
        try {
            QueueEngine queue = queueManager.require(name);
            List<String> cancelled = queue.delete(force);
            cancelled.forEach(consumerIndex::remove);
            queueManager.unregister(name);
        } finally {
            lifecycleLock.unlock();
        }
    }

    @Override
    public int purgeQueue(String name) {
        ensureStarted();
        return queueManager.require(name).purge();
    }

    @Override
    public long publish(String queueName, byte[] payload, boolean persistent) {
        ensureStarted();
        if (payload == null) {
            throw new IllegalArgumentException("Payload must not be null");
        }
        return queueManager.require(queueName).publish(payload, persistent);
    }

    @Override
    public String registerConsumer(String queueName, int prefetch, boolean autoAck) {
        ensureStarted();
        if (prefetch < 1) {
            throw new IllegalArgumentException("prefetch must be >= 1, got " + prefetch);
        }
        QueueEngine queue = queueManager.require(queueName);
        String consumerId = "ctag-" + consumerIdGenerator.incrementAndGet();
        // Auto-ack consumers are bounded by their mailbox, so taking a delivery makes room
        Subscription subscription = autoAck
                ? new Subscription(this, consumerId, queueName, queue::drained)
                : new Subscription(this, consumerId, queueName);
        consumerIndex.put(consumerId, queue);
        try {
            queue.register(new ConsumerRegistration(consumerId, queueName, prefetch, autoAck, subscription));
        } catch (RuntimeException e) {
            consumerIndex.remove(consumerId);
            throw e;
        }
        return consumerId;
    }

    @Override
    public Subscription subscription(String consumerId) {
        ensureStarted();
        return consumerQueue(consumerId).subscription(consumerId);
    }

    @Override
    public Subscription consume(String queueName, int prefetch, boolean autoAck) {
        return subscription(registerConsumer(queueName, prefetch, autoAck));
    }

    /**
     * Register a consumer with {@code consumer.defaultPrefetch} and manual acks.
     */
    public Subscription consume(String queueName) {
        return consume(queueName, config.getDefaultPrefetch(), false);
    }

    @Override
    public void ack(String consumerId, long messageId) {
        ensureStarted();
        consumerQueue(consumerId).ack(consumerId, messageId);
    }

    @Override
    public void nack(String consumerId, long messageId, boolean requeue) {
        ensureStarted();
        consumerQueue(consumerId).nack(consumerId, messageId, requeue);
    }

    @Override
    public void cancelConsumer(String consumerId) {
        release(consumerId, ConsumerState.CANCELLED);
    }

    @Override
    public void disconnectConsumer(String consumerId) {
        release(consumerId, ConsumerState.DISCONNECTED);
    }

    @Override
    public QueueInfo queueInfo(String name) {
        ensureStarted();
        return queueManager.require(name).info();
    }

    @Override
    public Set<String> queueNames() {
        ensureStarted();
        return queueManager.names();
    }

    public BrokerConfig getConfig() {
        return config;
    }

    public boolean isStarted() {
        return started;
    }

    private void release(String consumerId, ConsumerState state) {
        QueueEngine queue = consumerIndex.remove(consumerId);
        if (queue == null) {
            log.debug("Ignoring release of unknown consumer {}", consumerId);
            return;
        }
        queue.release(consumerId, state);
    }

    private QueueEngine consumerQueue(String consumerId) {
        QueueEngine queue = consumerIndex.get(consumerId);
        if (queue == null) {
            throw new UnknownConsumerException("Consumer " + consumerId + " is not registered");
        }
        return queue;
    }

    private void ensureStarted() {
        if (!started) {
            throw new IllegalStateException("Broker is not started");
        }
    }

    private static void validateName(String name) {
        if (name == null || !QUEUE_NAME.matcher(name).matches() || name.equals(".") || name.equals("..")) {
            throw new IllegalArgumentException("Invalid queue name: " + name);
        }
    }
}
