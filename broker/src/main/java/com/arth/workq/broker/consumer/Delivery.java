package com.arth.workq.broker.consumer;

import java.util.Arrays;

/**
 * One message handed to one consumer.
 */
public final class Delivery {

    private final String consumerId;
    private final String queue;
    private final long messageId;
    private final byte[] payload;
    private final int attempt;
    private final boolean redelivered;
    private final boolean persistent;
    private final long enqueueTimestamp;
    private final long deliveredAt;

    public Delivery(String consumerId, String queue, long messageId, byte[] payload, int attempt,
                    boolean redelivered, boolean persistent, long enqueueTimestamp, long deliveredAt) {
        this.consumerId = consumerId;
        this.queue = queue;
        this.messageId = messageId;
        this.payload = payload;
        this.attempt = attempt;
        this.redelivered = redelivered;
        this.persistent = persistent;
        this.enqueueTimestamp = enqueueTimestamp;
        this.deliveredAt = deliveredAt;
    }

    public String getConsumerId() {
        return consumerId;
    }

    public String getQueue() {
        return queue;
    }

    public long getMessageId() {
        return messageId;
    }

    public byte[] getPayload() {
        return Arrays.copyOf(payload, payload.length);
    }

    /**
     * @return 1 for the first delivery of the message, incremented on every redelivery
     */
    public int getAttempt() {
        return attempt;
    }

    /**
     * @return true if the message may have been seen by a consumer before, including
     * deliveries of messages recovered after a restart
     */
    public boolean isRedelivered() {
        return redelivered;
    }

    public boolean isPersistent() {
        return persistent;
    }

    public long getEnqueueTimestamp() {
        return enqueueTimestamp;
    }

    public long getDeliveredAt() {
        return deliveredAt;
    }

    @Override
    public String toString() {
        return "Delivery{consumer='" + consumerId + "', queue='" + queue + "', messageId=" + messageId
                + ", attempt=" + attempt + ", redelivered=" + redelivered + "}";
    }
}
