package com.arth.workq.broker.delivery;

import com.arth.workq.broker.consumer.Subscription;

/**
 * One logical worker bound to one queue. State changes happen under the queue's lock.
 */
public class ConsumerRegistration {

    private final String consumerId;
    private final String queueName;
    private final int prefetch;
    private final boolean autoAck;
    private final Subscription subscription;
    private final long registeredAt;
    private volatile ConsumerState state = ConsumerState.ACTIVE;
    private volatile long deliveredCount = 0;

    public ConsumerRegistration(String consumerId, String queueName, int prefetch, boolean autoAck,
                                Subscription subscription) {
        if (prefetch < 1) {
            throw new IllegalArgumentException("prefetch must be >= 1, got " + prefetch);
        }
        this.consumerId = consumerId;
        this.queueName = queueName;
        this.prefetch = prefetch;
        this.autoAck = autoAck;
        this.subscription = subscription;
        this.registeredAt = System.currentTimeMillis();
    }

    public String getConsumerId() {
        return consumerId;
    }

    public String getQueueName() {
        return queueName;
    }

    public int getPrefetch() {
        return prefetch;
    }

    public boolean isAutoAck() {
        return autoAck;
    }

    public Subscription getSubscription() {
        return subscription;
    }

    public long getRegisteredAt() {
        return registeredAt;
    }

    public ConsumerState getState() {
        return state;
    }

    public boolean isActive() {
        return state == ConsumerState.ACTIVE;
    }

    public void setState(ConsumerState state) {
        this.state = state;
    }

    public long getDeliveredCount() {
        return deliveredCount;
    }

    public void recordDelivery() {
        deliveredCount++;
    }

    @Override
    public String toString() {
        return "ConsumerRegistration{id='" + consumerId + "', queue='" + queueName + "', prefetch=" + prefetch
                + ", autoAck=" + autoAck + ", state=" + state + "}";
    }
}
