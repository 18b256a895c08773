package com.arth.workq.common.message;

import java.util.Arrays;
import java.util.Objects;

/**
 * Logic immutable message
 */
public final class Message {

    private final long messageId;
    private final String queue;
    private final byte[] payload;
    private final boolean persistent;
    private final long enqueueTimestamp;

    public Message(long messageId, String queue, byte[] payload, boolean persistent, long enqueueTimestamp) {
        this.messageId = messageId;
        this.queue = Objects.requireNonNull(queue, "queue");
        this.payload = Arrays.copyOf(Objects.requireNonNull(payload, "payload"), payload.length);
        this.persistent = persistent;
        this.enqueueTimestamp = enqueueTimestamp;
    }

    public Message(long messageId, String queue, byte[] payload, boolean persistent) {
        this(messageId, queue, payload, persistent, System.currentTimeMillis());
    }

    public long getMessageId() {
        return messageId;
    }

    public String getQueue() {
        return queue;
    }

    /**
     * @return a copy of the payload
     */
    public byte[] getPayload() {
        return Arrays.copyOf(payload, payload.length);
    }

    public int getPayloadSize() {
        return payload.length;
    }

    public boolean isPersistent() {
        return persistent;
    }

    public long getEnqueueTimestamp() {
        return enqueueTimestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Message)) return false;
        Message other = (Message) o;
        return messageId == other.messageId
                && persistent == other.persistent
                && enqueueTimestamp == other.enqueueTimestamp
                && queue.equals(other.queue)
                && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(queue, messageId);
    }

    @Override
    public String toString() {
        return "Message{queue='" + queue + "', id=" + messageId + ", persistent=" + persistent
                + ", size=" + payload.length + "}";
    }
}
