package com.arth.workq.broker.delivery;

import com.arth.workq.broker.queue.QueuedMessage;
import io.netty.util.Timeout;

/**
 * A delivered but not yet acknowledged message and the consumer holding it.
 */
public class InFlightEntry {

    private final QueuedMessage message;
    private final String consumerId;
    private final long deliveryTag;
    private final long deliveredAt;
    private final int attempt;
    private Timeout timeout;

    public InFlightEntry(QueuedMessage message, String consumerId, long deliveryTag, long deliveredAt, int attempt) {
        this.message = message;
        this.consumerId = consumerId;
        this.deliveryTag = deliveryTag;
        this.deliveredAt = deliveredAt;
        this.attempt = attempt;
    }

    public QueuedMessage getMessage() {
        return message;
    }

    public long getMessageId() {
        return message.getMessageId();
    }

    public String getConsumerId() {
        return consumerId;
    }

    /**
     * Unique per delivery, so a stale timeout cannot requeue a later delivery of the same message.
     */
    public long getDeliveryTag() {
        return deliveryTag;
    }

    public long getDeliveredAt() {
        return deliveredAt;
    }

    public int getAttempt() {
        return attempt;
    }

    public void setTimeout(Timeout timeout) {
        this.timeout = timeout;
    }

    public void cancelTimeout() {
        if (timeout != null) {
            timeout.cancel();
            timeout = null;
        }
    }

    @Override
    public String toString() {
        return "InFlightEntry{messageId=" + message.getMessageId() + ", consumer='" + consumerId
                + "', tag=" + deliveryTag + ", attempt=" + attempt + "}";
    }
}
