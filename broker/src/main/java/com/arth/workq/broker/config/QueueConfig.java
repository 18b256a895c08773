package com.arth.workq.broker.config;

import java.util.Objects;

/**
 * Per-queue options. Two declarations of the same queue must carry equal options.
 */
public final class QueueConfig {

    private final int maxLength;
    private final OverflowPolicy overflowPolicy;
    private final RequeuePosition requeuePosition;
    private final long deliveryTimeoutMs;

    private QueueConfig(Builder builder) {
        this.maxLength = builder.maxLength;
        this.overflowPolicy = builder.overflowPolicy;
        this.requeuePosition = builder.requeuePosition;
        this.deliveryTimeoutMs = builder.deliveryTimeoutMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxLength(maxLength)
                .overflowPolicy(overflowPolicy)
                .requeuePosition(requeuePosition)
                .deliveryTimeoutMs(deliveryTimeoutMs);
    }

    /**
     * @return maximum pending messages, 0 when unbounded
     */
    public int getMaxLength() {
        return maxLength;
    }

    public boolean isBounded() {
        return maxLength > 0;
    }

    public OverflowPolicy getOverflowPolicy() {
        return overflowPolicy;
    }

    public RequeuePosition getRequeuePosition() {
        return requeuePosition;
    }

    /**
     * @return how long a delivery may stay unacknowledged before it is requeued, 0 when disabled
     */
    public long getDeliveryTimeoutMs() {
        return deliveryTimeoutMs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueueConfig)) return false;
        QueueConfig that = (QueueConfig) o;
        return maxLength == that.maxLength
                && deliveryTimeoutMs == that.deliveryTimeoutMs
                && overflowPolicy == that.overflowPolicy
                && requeuePosition == that.requeuePosition;
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxLength, overflowPolicy, requeuePosition, deliveryTimeoutMs);
    }

    @Override
    public String toString() {
        return "QueueConfig{maxLength=" + maxLength + ", overflow=" + overflowPolicy
                + ", requeue=" + requeuePosition + ", deliveryTimeoutMs=" + deliveryTimeoutMs + "}";
    }

    public static final class Builder {
        private int maxLength = 0;
        private OverflowPolicy overflowPolicy = OverflowPolicy.REJECT_PUBLISH;
        private RequeuePosition requeuePosition = RequeuePosition.HEAD;
        private long deliveryTimeoutMs = 0;

        private Builder() {
        }

        public Builder maxLength(int maxLength) {
            if (maxLength < 0) {
                throw new IllegalArgumentException("maxLength must be >= 0, got " + maxLength);
            }
            this.maxLength = maxLength;
            return this;
        }

        public Builder overflowPolicy(OverflowPolicy overflowPolicy) {
            this.overflowPolicy = Objects.requireNonNull(overflowPolicy, "overflowPolicy");
            return this;
        }

        public Builder requeuePosition(RequeuePosition requeuePosition) {
            this.requeuePosition = Objects.requireNonNull(requeuePosition, "requeuePosition");
            return this;
        }

        public Builder deliveryTimeoutMs(long deliveryTimeoutMs) {
            if (deliveryTimeoutMs < 0) {
                throw new IllegalArgumentException("deliveryTimeoutMs must be >= 0, got " + deliveryTimeoutMs);
            }
            this.deliveryTimeoutMs = deliveryTimeoutMs;
            return this;
        }

        public QueueConfig build() {
            return new QueueConfig(this);
        }
    }
}
