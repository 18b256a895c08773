package com.arth.workq.broker.core;

import com.arth.workq.broker.config.QueueConfig;

/**
 * Point-in-time view of a queue for monitoring.
 */
public final class QueueInfo {

    private final String name;
    private final boolean durable;
    private final QueueConfig config;
    private final int pending;
    private final int inFlight;
    private final int consumers;
    private final boolean halted;

    public QueueInfo(String name, boolean durable, QueueConfig config, int pending, int inFlight, int consumers,
                     boolean halted) {
        this.name = name;
        this.durable = durable;
        this.config = config;
        this.pending = pending;
        this.inFlight = inFlight;
        this.consumers = consumers;
        this.halted = halted;
    }

    public String getName() {
        return name;
    }

    public boolean isDurable() {
        return durable;
    }

    public QueueConfig getConfig() {
        return config;
    }

    public int getPending() {
        return pending;
    }

    public int getInFlight() {
        return inFlight;
    }

    public int getConsumers() {
        return consumers;
    }

    /**
     * @return true if the queue stopped after the store failed to record a removal
     */
    public boolean isHalted() {
        return halted;
    }

    @Override
    public String toString() {
        return String.format("QueueInfo{name=%s, durable=%s, pending=%d, inFlight=%d, consumers=%d, halted=%s}",
                name, durable, pending, inFlight, consumers, halted);
    }
}
