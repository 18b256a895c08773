package com.arth.workq.broker.store;

/**
 * Proof that a message reached the durable log.
 */
public final class StoreReceipt {

    private final String queueName;
    private final long messageId;
    private final long offset;

    public StoreReceipt(String queueName, long messageId, long offset) {
        this.queueName = queueName;
        this.messageId = messageId;
        this.offset = offset;
    }

    public String getQueueName() {
        return queueName;
    }

    public long getMessageId() {
        return messageId;
    }

    /**
     * @return byte offset of the record in the queue's log at the time of the write
     */
    public long getOffset() {
        return offset;
    }

    @Override
    public String toString() {
        return "StoreReceipt{queue='" + queueName + "', id=" + messageId + ", offset=" + offset + "}";
    }
}
