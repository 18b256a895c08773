package com.arth.workq.broker.queue;

import com.arth.workq.common.message.Message;

/**
 * A message together with its delivery history. Mutated only under the owning queue's lock.
 */
public final class QueuedMessage {

    private final Message message;
    private final boolean recovered;
    private int deliveryCount;

    private QueuedMessage(Message message, boolean recovered) {
        this.message = message;
        this.recovered = recovered;
    }

    public static QueuedMessage of(Message message) {
        return new QueuedMessage(message, false);
    }

    /**
     * A message reloaded from the store after a restart. It may have been delivered
     * before the restart, so it is reported as redelivered.
     */
    public static QueuedMessage recovered(Message message) {
        return new QueuedMessage(message, true);
    }

    public Message getMessage() {
        return message;
    }

    public long getMessageId() {
        return message.getMessageId();
    }

    /**
     * Record a delivery.
     *
     * @return the attempt number of this delivery, starting at 1
     */
    public int beginAttempt() {
        return ++deliveryCount;
    }

    public int getDeliveryCount() {
        return deliveryCount;
    }

    public boolean isRedelivered() {
        return recovered || deliveryCount > 0;
    }

    @Override
    public String toString() {
        return "QueuedMessage{id=" + message.getMessageId() + ", deliveries=" + deliveryCount
                + ", recovered=" + recovered + "}";
    }
}
